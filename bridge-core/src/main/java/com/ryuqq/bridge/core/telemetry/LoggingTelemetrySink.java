package com.ryuqq.bridge.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 샘플 묶음을 DEBUG 로그로 남기는 기본 Sink.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    @Override
    public void publish(List<TelemetrySample> samples) {
        log.debug("Flushing {} metrics", samples.size());
        if (log.isTraceEnabled()) {
            for (TelemetrySample sample : samples) {
                log.trace("metric {}={} labels={} at {}", sample.name(), sample.value(), sample.labels(), sample.timestamp());
            }
        }
    }
}
