package com.ryuqq.bridge.core.trace;

/**
 * 요청 추적 외부 전달 SPI.
 *
 * <p>Bridge는 요청마다 {@link #onStart(Trace)}를 한 번, 결과가 정해지면 {@link #onEnd(Trace, TraceOutcome)}를
 * 한 번 호출합니다. 성공, 캐시 적중, 거부, 실패 모든 경로에서 종료가 호출됩니다.
 * 구현체가 던진 예외는 Bridge가 로그만 남기고 무시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TraceSink {

    /**
     * 추적 시작.
     *
     * @param trace 시작된 추적
     */
    default void onStart(Trace trace) {
    }

    /**
     * 추적 종료.
     *
     * @param trace 종료된 추적
     * @param outcome 결과 메타데이터
     */
    void onEnd(Trace trace, TraceOutcome outcome);
}
