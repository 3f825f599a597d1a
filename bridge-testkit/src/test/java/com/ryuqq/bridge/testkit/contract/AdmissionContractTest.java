package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.BridgeConfig;
import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import com.ryuqq.bridge.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for admission control.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A bucket of 10 with no refill admits exactly 10 requests</li>
 *   <li>Rejected requests never reach the backend or the breaker</li>
 *   <li>Refill admits new requests once time passes</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AdmissionContractTest extends AbstractBridgeContractTest {

    @Override
    protected BridgeConfig config() {
        return super.config().withRateLimiter(new RateLimiterConfig(0, 10));
    }

    @Test
    void testBurstOfTwelve_FirstTenAdmitted_RestRejected() {
        // When
        int admitted = 0;
        int rejected = 0;
        for (int i = 0; i < 12; i++) {
            Result result = execute("burst " + i);
            if (result.success()) {
                admitted++;
            } else {
                assertFailure(result, FailureType.ADMISSION_REJECTED);
                assertEquals(List.of("admission"), result.stages());
                rejected++;
            }
        }

        // Then
        assertEquals(10, admitted);
        assertEquals(2, rejected);
        assertEquals(10, backend.invocationCount(), "Rejected requests must not reach the backend");
        assertEquals(12, bridge.reporter().metrics().requestsTotal());
        assertEquals(2, bridge.reporter().metrics().errorsTotal());
    }

    @Test
    void testRejectedRequests_DoNotCountTowardBreaker() {
        // Given: a bucket of four, drained by backend failures one below the threshold of five
        bridge = newBridge(config()
            .withRateLimiter(new RateLimiterConfig(0, 4))
            .withCircuitBreaker(new CircuitBreakerConfig(5, 1000)));
        backend.failNext(4);
        for (int i = 0; i < 4; i++) {
            assertFailure(execute("fail " + i), FailureType.BACKEND_FAILURE);
        }

        // When
        for (int i = 0; i < 3; i++) {
            assertFailure(execute("rejected " + i), FailureType.ADMISSION_REJECTED);
        }

        // Then
        assertEquals("CLOSED", bridge.reporter().health().components().get("circuit_breaker"));
        assertEquals(4, backend.invocationCount());
    }

    @Test
    void testRefill_AdmitsAgainAfterTimePasses() {
        // Given
        BridgeConfig refilling = config().withRateLimiter(new RateLimiterConfig(2, 2));
        bridge = newBridge(refilling);
        assertTrue(execute("a").success());
        assertTrue(execute("b").success());
        assertFailure(execute("c"), FailureType.ADMISSION_REJECTED);

        // When
        clock.advanceMillis(500);

        // Then
        assertSuccess(execute("d"));
        assertFailure(execute("e"), FailureType.ADMISSION_REJECTED);
    }
}
