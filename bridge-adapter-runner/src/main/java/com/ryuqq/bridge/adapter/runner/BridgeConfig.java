package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.core.cache.CacheConfig;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import com.ryuqq.bridge.core.protection.RateLimiterConfig;
import com.ryuqq.bridge.core.telemetry.TelemetryConfig;

/**
 * ResilientBridge 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>rateLimiter: Token Bucket 설정 (기본 100 tokens/s, 용량 1000)</li>
 *   <li>circuitBreaker: 연속 실패 임계값/차단 시간 (기본 5회, 60초)</li>
 *   <li>cache: 결과 캐시 TTL/용량 (기본 5분, 10000개)</li>
 *   <li>telemetry: 텔레메트리 버퍼 크기 (기본 10)</li>
 *   <li>backendTimeoutMs: 백엔드 호출 타임아웃 (기본 30000ms, 0이면 타임아웃 없음)</li>
 *   <li>cacheScope: 캐시 키 범위 (기본 GLOBAL)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param rateLimiter Rate Limiter 설정
 * @param circuitBreaker Circuit Breaker 설정
 * @param cache 캐시 설정
 * @param telemetry 텔레메트리 설정
 * @param backendTimeoutMs 백엔드 호출 타임아웃 (밀리초, 0 이상)
 * @param cacheScope 캐시 키 범위
 */
public record BridgeConfig(
    RateLimiterConfig rateLimiter,
    CircuitBreakerConfig circuitBreaker,
    CacheConfig cache,
    TelemetryConfig telemetry,
    long backendTimeoutMs,
    CacheScope cacheScope
) {

    /** 기본 백엔드 타임아웃 (30초). */
    public static final long DEFAULT_BACKEND_TIMEOUT_MS = 30_000;

    /**
     * 기본 설정 생성자.
     */
    public BridgeConfig() {
        this(
            new RateLimiterConfig(),
            new CircuitBreakerConfig(),
            new CacheConfig(),
            new TelemetryConfig(),
            DEFAULT_BACKEND_TIMEOUT_MS,
            CacheScope.GLOBAL
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BridgeConfig {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (backendTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "backendTimeoutMs must be non-negative (current: " + backendTimeoutMs + ")"
            );
        }
        if (cacheScope == null) {
            throw new IllegalArgumentException("cacheScope cannot be null");
        }
    }

    /**
     * rateLimiter만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }

    /**
     * circuitBreaker만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }

    /**
     * cache만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withCache(CacheConfig cache) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }

    /**
     * telemetry만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withTelemetry(TelemetryConfig telemetry) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }

    /**
     * backendTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withBackendTimeoutMs(long backendTimeoutMs) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }

    /**
     * cacheScope만 변경한 새 인스턴스 생성.
     */
    public BridgeConfig withCacheScope(CacheScope cacheScope) {
        return new BridgeConfig(rateLimiter, circuitBreaker, cache, telemetry, backendTimeoutMs, cacheScope);
    }
}
