package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.BridgeConfig;
import com.ryuqq.bridge.application.health.BridgeMetrics;
import com.ryuqq.bridge.application.health.HealthReport;
import com.ryuqq.bridge.application.health.HealthStatus;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import com.ryuqq.bridge.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for health and metrics reporting.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Status is degraded exactly while the breaker is open</li>
 *   <li>Counters include rejected and cached requests</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HealthContractTest extends AbstractBridgeContractTest {

    @Override
    protected BridgeConfig config() {
        return super.config().withCircuitBreaker(new CircuitBreakerConfig(1, 1000));
    }

    @Test
    void testDegradedOnlyWhileBreakerOpen() {
        // Given
        HealthReport initial = bridge.reporter().health();
        assertEquals(HealthStatus.HEALTHY, initial.status());

        // When
        backend.failNext(1);
        execute("boom");
        HealthReport open = bridge.reporter().health();
        clock.advanceMillis(1000);
        execute("recover");
        HealthReport recovered = bridge.reporter().health();

        // Then
        assertEquals(HealthStatus.DEGRADED, open.status());
        assertFalse(open.isHealthy());
        assertEquals(HealthStatus.HEALTHY, recovered.status());
        assertEquals("CLOSED", recovered.components().get(HealthReport.CIRCUIT_BREAKER));
    }

    @Test
    void testMetricsCountEveryRequest() {
        // Given
        execute("hello");
        execute("hello");
        backend.failNext(1);
        execute("boom");

        // When
        BridgeMetrics metrics = bridge.reporter().metrics();

        // Then
        assertEquals(3, metrics.requestsTotal());
        assertEquals(1, metrics.errorsTotal());
        assertEquals(1.0 / 3.0, metrics.errorRate(), 1e-9);
        assertEquals(1, metrics.cacheSize());
        assertEquals(CircuitBreakerState.OPEN, metrics.breakerState());
        assertEquals(2, metrics.backendMetrics().get("invocations"));
    }
}
