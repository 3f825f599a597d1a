package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.BridgeConfig;
import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the circuit breaker lifecycle.
 *
 * <p>Threshold 3, open timeout 1.0s.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Three consecutive failures open the breaker</li>
 *   <li>0.5s later requests are rejected without reaching the backend</li>
 *   <li>1.1s later one trial passes; its outcome closes or reopens the breaker</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerContractTest extends AbstractBridgeContractTest {

    @Override
    protected BridgeConfig config() {
        return super.config().withCircuitBreaker(new CircuitBreakerConfig(3, 1000));
    }

    @Test
    void testThreeFailures_OpenThenRejectThenTrialCloses() {
        // Given
        openBreaker();

        // When: 0.5s after the last failure
        clock.advanceMillis(500);
        Result rejected = execute("still down?");

        // Then
        assertFailure(rejected, FailureType.BREAKER_OPEN);
        assertEquals(List.of("admission", "cache", "circuit-breaker"), rejected.stages());
        assertEquals(3, backend.invocationCount(), "Open breaker must not invoke the backend");

        // When: 1.1s after the last failure
        clock.advanceMillis(600);
        Result trial = execute("back up?");

        // Then
        assertSuccess(trial);
        assertEquals(4, backend.invocationCount());
        assertEquals("CLOSED", breakerState());
    }

    @Test
    void testFailedTrial_ReopensBreaker() {
        // Given
        openBreaker();
        clock.advanceMillis(1100);
        backend.failNext(1);

        // When
        Result trial = execute("trial");
        Result afterTrial = execute("after trial");

        // Then
        assertFailure(trial, FailureType.BACKEND_FAILURE);
        assertFailure(afterTrial, FailureType.BREAKER_OPEN);
        assertEquals("OPEN", breakerState());
    }

    @Test
    void testSingleTrial_ConcurrentRequestsRejectedWhileTrialInFlight() {
        // Given
        openBreaker();
        clock.advanceMillis(1100);
        backend.hangNext(1);

        // When
        CompletableFuture<Result> trial = bridge.execute(Request.of("trial"));
        Result second = execute("second");

        // Then
        assertFailure(second, FailureType.BREAKER_OPEN);
        assertEquals("HALF_OPEN", breakerState());
        assertEquals(1, backend.releaseHung());
        assertTrue(trial.join().success());
        assertEquals("CLOSED", breakerState());
    }

    @Test
    void testSuccessResetsConsecutiveCount() {
        // Given
        backend.failNext(2);
        execute("f1");
        execute("f2");

        // When
        execute("ok");
        backend.failNext(2);
        execute("f3");
        execute("f4");

        // Then
        assertEquals("CLOSED", breakerState());
    }

    private void openBreaker() {
        backend.failNext(3);
        for (int i = 0; i < 3; i++) {
            assertFailure(execute("failing " + i), FailureType.BACKEND_FAILURE);
        }
        assertEquals("OPEN", breakerState());
    }

    private String breakerState() {
        return bridge.reporter().health().components().get("circuit_breaker");
    }
}
