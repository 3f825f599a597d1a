package com.ryuqq.bridge.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>Token Bucket 기준으로 permitsPerSecond는 초당 리필 토큰 수,
 * maxBurstSize는 버킷 크기(capacity)입니다. permitsPerSecond가 0이면
 * 리필 없이 초기 토큰만 사용합니다.</p>
 *
 * <p>기본값: permitsPerSecond=100.0, maxBurstSize=1000</p>
 *
 * @param permitsPerSecond 초당 리필 토큰 수 (0 이상)
 * @param maxBurstSize 버킷 크기 (양수여야 함)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double permitsPerSecond, int maxBurstSize) {

    /**
     * 기본 설정 생성자.
     */
    public RateLimiterConfig() {
        this(100.0, 1000);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if permitsPerSecond is negative or not finite
     * @throws IllegalArgumentException if maxBurstSize is not positive
     */
    public RateLimiterConfig {
        if (Double.isNaN(permitsPerSecond) || Double.isInfinite(permitsPerSecond) || permitsPerSecond < 0) {
            throw new IllegalArgumentException(
                "permitsPerSecond must be non-negative (current: " + permitsPerSecond + ")"
            );
        }
        if (maxBurstSize <= 0) {
            throw new IllegalArgumentException(
                "maxBurstSize must be positive (current: " + maxBurstSize + ")"
            );
        }
    }

    /**
     * permitsPerSecond만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withPermitsPerSecond(double permitsPerSecond) {
        return new RateLimiterConfig(permitsPerSecond, maxBurstSize);
    }

    /**
     * maxBurstSize만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withMaxBurstSize(int maxBurstSize) {
        return new RateLimiterConfig(permitsPerSecond, maxBurstSize);
    }
}
