package com.ryuqq.bridge.adapter.micrometer;

import com.ryuqq.bridge.application.health.BridgeMetrics;
import com.ryuqq.bridge.application.health.HealthReporter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.function.ToDoubleFunction;

/**
 * Bridge 집계 지표를 Micrometer Meter로 노출하는 Binder.
 *
 * <p>등록되는 Meter:</p>
 * <ul>
 *   <li>{@code bridge.requests} / {@code bridge.errors}: 누적 요청 수 / 실패 수 (FunctionCounter)</li>
 *   <li>{@code bridge.latency.avg}: 평균 처리 시간 (ms)</li>
 *   <li>{@code bridge.cache.size}: 캐시 항목 수</li>
 *   <li>{@code bridge.admission.tokens}: 남은 Admission 토큰</li>
 *   <li>{@code bridge.breaker.state}: Breaker 상태 코드 (0=CLOSED, 1=OPEN, 2=HALF_OPEN)</li>
 * </ul>
 *
 * <p>값은 Registry가 읽을 때마다 {@link HealthReporter#metrics()}에서 가져옵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BridgeMeterBinder implements MeterBinder {

    private final HealthReporter reporter;
    private final Tags tags;

    public BridgeMeterBinder(HealthReporter reporter) {
        this(reporter, Tags.empty());
    }

    /**
     * 생성자.
     *
     * @param reporter 지표 조회 대상
     * @param tags 모든 Meter에 붙일 공통 태그
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BridgeMeterBinder(HealthReporter reporter, Tags tags) {
        if (reporter == null) {
            throw new IllegalArgumentException("reporter cannot be null");
        }
        if (tags == null) {
            throw new IllegalArgumentException("tags cannot be null");
        }
        this.reporter = reporter;
        this.tags = tags;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("bridge.requests", reporter, r -> r.metrics().requestsTotal())
            .description("Total requests handled by the bridge")
            .tags(tags)
            .register(registry);
        FunctionCounter.builder("bridge.errors", reporter, r -> r.metrics().errorsTotal())
            .description("Total failed requests")
            .tags(tags)
            .register(registry);

        gauge(registry, "bridge.latency.avg", "Average request latency in milliseconds",
            BridgeMetrics::avgLatencyMs);
        gauge(registry, "bridge.cache.size", "Number of cached results",
            BridgeMetrics::cacheSize);
        gauge(registry, "bridge.admission.tokens", "Tokens left in the admission bucket",
            BridgeMetrics::admissionTokens);
        gauge(registry, "bridge.breaker.state", "Circuit breaker state code (0=closed,1=open,2=half_open)",
            metrics -> metrics.breakerState().ordinal());
    }

    private void gauge(MeterRegistry registry, String name, String description, ToDoubleFunction<BridgeMetrics> value) {
        Gauge.builder(name, reporter, r -> value.applyAsDouble(r.metrics()))
            .description(description)
            .tags(tags)
            .register(registry);
    }
}
