package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.health.BridgeMetrics;
import com.ryuqq.bridge.application.health.HealthReport;
import com.ryuqq.bridge.application.health.HealthReporter;
import com.ryuqq.bridge.application.health.HealthStatus;
import com.ryuqq.bridge.core.cache.ResultCache;
import com.ryuqq.bridge.core.protection.CircuitBreaker;
import com.ryuqq.bridge.core.protection.CircuitBreakerState;
import com.ryuqq.bridge.core.protection.RateLimiter;
import com.ryuqq.bridge.core.spi.BackendHandler;
import com.ryuqq.bridge.core.telemetry.TelemetryRecorder;
import com.ryuqq.bridge.core.telemetry.TelemetrySnapshot;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridge 구성 요소를 읽기 전용으로 조회하는 {@link HealthReporter} 구현체.
 *
 * <p>각 구성 요소의 조회 메서드만 호출하므로 요청 처리와 동시에 호출해도 안전합니다.
 * 여러 구성 요소의 값을 하나의 원자적 시점으로 묶어 주지는 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BridgeHealthReporter implements HealthReporter {

    static final String COMPONENT_HEALTHY = "healthy";

    private final BackendHandler backend;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ResultCache cache;
    private final TelemetryRecorder telemetry;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BridgeHealthReporter(
        BackendHandler backend,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        ResultCache cache,
        TelemetryRecorder telemetry,
        Clock clock
    ) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.backend = backend;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.cache = cache;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    @Override
    public BridgeMetrics metrics() {
        TelemetrySnapshot snapshot = telemetry.snapshot();
        return new BridgeMetrics(
            snapshot.requestCount(),
            snapshot.errorCount(),
            snapshot.errorRate(),
            snapshot.averageLatencyMs(),
            cache.size(),
            circuitBreaker.getState(),
            rateLimiter.getAvailableTokens(),
            backend.getMetrics()
        );
    }

    @Override
    public HealthReport health() {
        BridgeMetrics metrics = metrics();
        CircuitBreakerState state = metrics.breakerState();

        Map<String, String> components = new LinkedHashMap<>();
        components.put(HealthReport.BACKEND, backend.getStatus());
        components.put(HealthReport.CIRCUIT_BREAKER, state.name());
        components.put(HealthReport.CACHE, COMPONENT_HEALTHY);
        components.put(HealthReport.RATE_LIMITER, COMPONENT_HEALTHY);

        HealthStatus status = state == CircuitBreakerState.OPEN ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
        return new HealthReport(status, clock.instant(), components, metrics);
    }
}
