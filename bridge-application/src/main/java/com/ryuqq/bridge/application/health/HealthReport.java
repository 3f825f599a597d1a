package com.ryuqq.bridge.application.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridge Health 보고서.
 *
 * <p>components는 구성 요소 이름에서 상태 문자열로의 매핑입니다
 * ({@value #BACKEND}, {@value #CIRCUIT_BREAKER}, {@value #CACHE}, {@value #RATE_LIMITER}).</p>
 *
 * @param status 전체 상태
 * @param timestamp 보고 시각
 * @param components 구성 요소별 상태 (불변, 삽입 순서 유지)
 * @param metrics 집계 지표
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HealthReport(
    HealthStatus status,
    Instant timestamp,
    Map<String, String> components,
    BridgeMetrics metrics
) {

    public static final String BACKEND = "backend";
    public static final String CIRCUIT_BREAKER = "circuit_breaker";
    public static final String CACHE = "cache";
    public static final String RATE_LIMITER = "rate_limiter";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status, timestamp 또는 metrics가 null인 경우
     */
    public HealthReport {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        components = components == null || components.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    /**
     * HEALTHY 여부.
     *
     * @return status가 HEALTHY이면 true
     */
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
