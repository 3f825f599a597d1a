package com.ryuqq.bridge.core.trace;

import com.ryuqq.bridge.core.model.Result;

import java.time.Duration;
import java.util.List;

/**
 * 추적 종료 시 함께 전달되는 결과 메타데이터.
 *
 * @param success 성공 여부
 * @param latency 요청 시작부터 종료까지 걸린 시간
 * @param stages 거쳐 간 처리 단계
 * @param errorCode 실패 코드 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TraceOutcome(
    boolean success,
    Duration latency,
    List<String> stages,
    String errorCode
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException latency가 null이거나 음수인 경우
     */
    public TraceOutcome {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency must be non-negative (current: " + latency + ")");
        }
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Result로부터 생성.
     *
     * @param result 요청 결과
     * @param latency 요청 처리 시간
     * @return TraceOutcome
     */
    public static TraceOutcome of(Result result, Duration latency) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new TraceOutcome(result.success(), latency, result.stages(), result.errorCode());
    }
}
