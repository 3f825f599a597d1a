package com.ryuqq.bridge.core.telemetry;

import java.util.List;

/**
 * 텔레메트리 외부 전달 SPI.
 *
 * <p>{@link TelemetryRecorder}가 버퍼를 비울 때 샘플 묶음을 전달받습니다.
 * 전달은 Recorder의 락 밖에서 호출되며, 예외를 던져도 Recorder가 로그만 남기고
 * 해당 묶음을 버립니다 (텔레메트리 유실 허용).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TelemetrySink {

    /**
     * 샘플 묶음 전달.
     *
     * @param samples 불변 샘플 목록 (기록 순서 유지)
     */
    void publish(List<TelemetrySample> samples);
}
