package com.ryuqq.bridge.core.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 추적 시작/종료를 DEBUG 로그로 남기는 기본 Sink.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingTraceSink implements TraceSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTraceSink.class);

    @Override
    public void onStart(Trace trace) {
        log.debug("Trace {} started for requester {}", trace.traceId(), trace.requesterId());
    }

    @Override
    public void onEnd(Trace trace, TraceOutcome outcome) {
        if (outcome.success()) {
            log.debug("Trace {} completed: success=true, latency={}ms, stages={}",
                trace.traceId(), outcome.latency().toMillis(), outcome.stages());
        } else {
            log.debug("Trace {} completed: success=false, error={}, latency={}ms",
                trace.traceId(), outcome.errorCode(), outcome.latency().toMillis());
        }
    }
}
