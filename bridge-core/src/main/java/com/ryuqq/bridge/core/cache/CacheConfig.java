package com.ryuqq.bridge.core.cache;

/**
 * Result Cache 설정.
 *
 * <p>기본값: ttlMs=300000ms (5분), maxEntries=10000</p>
 *
 * @param ttlMs 항목 유효 시간 (밀리초, 양수여야 함)
 * @param maxEntries 최대 항목 수 (0이면 무제한, 초과 시 가장 오래된 항목 제거)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheConfig(long ttlMs, int maxEntries) {

    /** 무제한을 의미하는 maxEntries 값. */
    public static final int UNBOUNDED = 0;

    /**
     * 기본 설정 생성자.
     */
    public CacheConfig() {
        this(300_000, 10_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheConfig {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException(
                "ttlMs must be positive (current: " + ttlMs + ")"
            );
        }
        if (maxEntries < 0) {
            throw new IllegalArgumentException(
                "maxEntries must be non-negative (current: " + maxEntries + ")"
            );
        }
    }

    /**
     * 용량 제한 여부.
     *
     * @return maxEntries가 0보다 크면 true
     */
    public boolean isBounded() {
        return maxEntries > UNBOUNDED;
    }

    /**
     * ttlMs만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withTtlMs(long ttlMs) {
        return new CacheConfig(ttlMs, maxEntries);
    }

    /**
     * maxEntries만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(ttlMs, maxEntries);
    }
}
