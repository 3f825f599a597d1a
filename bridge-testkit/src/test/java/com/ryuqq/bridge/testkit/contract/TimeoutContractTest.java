package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.BridgeConfig;
import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for backend timeouts.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A backend that never answers yields BACKEND-TIMEOUT</li>
 *   <li>Timeouts count as breaker failures</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TimeoutContractTest extends AbstractBridgeContractTest {

    @Override
    protected BridgeConfig config() {
        return super.config()
            .withBackendTimeoutMs(50)
            .withCircuitBreaker(new CircuitBreakerConfig(2, 60_000));
    }

    @Test
    void testHangingBackend_TimesOut() {
        // Given
        backend.hangNext(1);

        // When / Then
        assertFailure(execute("slow"), FailureType.BACKEND_TIMEOUT);
        assertEquals(1, bridge.reporter().metrics().errorsTotal());
    }

    @Test
    void testRepeatedTimeouts_OpenBreaker() {
        // Given
        backend.hangNext(2);

        // When
        execute("slow 1");
        execute("slow 2");

        // Then
        assertFailure(execute("slow 3"), FailureType.BREAKER_OPEN);
        assertEquals(2, backend.invocationCount());
    }
}
