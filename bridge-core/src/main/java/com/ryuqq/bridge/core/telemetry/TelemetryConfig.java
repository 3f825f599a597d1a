package com.ryuqq.bridge.core.telemetry;

/**
 * Telemetry Recorder 설정.
 *
 * <p>기본값: flushThreshold=10</p>
 *
 * @param flushThreshold 버퍼를 비우는 샘플 수 (양수여야 함)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TelemetryConfig(int flushThreshold) {

    /**
     * 기본 설정 생성자.
     */
    public TelemetryConfig() {
        this(10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException flushThreshold가 양수가 아닌 경우
     */
    public TelemetryConfig {
        if (flushThreshold <= 0) {
            throw new IllegalArgumentException(
                "flushThreshold must be positive (current: " + flushThreshold + ")"
            );
        }
    }
}
