package com.ryuqq.bridge.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * <p>기본값: failureThreshold=5, openTimeoutMs=60000ms (60초)</p>
 *
 * @param failureThreshold OPEN 전이까지의 연속 실패 횟수 (양수여야 함)
 * @param openTimeoutMs 마지막 실패 이후 시험 호출을 허용하기까지의 대기 시간 (밀리초, 양수여야 함)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, long openTimeoutMs) {

    /**
     * 기본 설정 생성자.
     */
    public CircuitBreakerConfig() {
        this(5, 60_000);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if failureThreshold or openTimeoutMs is not positive
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (openTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "openTimeoutMs must be positive (current: " + openTimeoutMs + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openTimeoutMs);
    }

    /**
     * openTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withOpenTimeoutMs(long openTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, openTimeoutMs);
    }
}
