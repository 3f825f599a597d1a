package com.ryuqq.bridge.core.telemetry;

/**
 * 집계 카운터의 읽기 전용 스냅샷.
 *
 * @param requestCount 전체 요청 수 (성공, 실패, 캐시 적중 포함)
 * @param errorCount 실패 요청 수
 * @param totalLatencyMs 누적 지연 시간 (밀리초)
 * @param averageLatencyMs 누적 이동 평균 지연 시간 (밀리초)
 * @param bufferedSamples 아직 전달되지 않은 샘플 수
 * @param flushedSamples Sink로 전달된 샘플 수
 * @param droppedSamples Sink 오류로 유실된 샘플 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TelemetrySnapshot(
    long requestCount,
    long errorCount,
    double totalLatencyMs,
    double averageLatencyMs,
    int bufferedSamples,
    long flushedSamples,
    long droppedSamples
) {

    /**
     * 오류율 계산.
     *
     * @return errorCount / max(requestCount, 1)
     */
    public double errorRate() {
        return (double) errorCount / Math.max(requestCount, 1);
    }
}
