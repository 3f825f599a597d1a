package com.ryuqq.bridge.core.trace;

import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Result;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Trace / TraceOutcome 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TraceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void start_AssignsDistinctPrefixedIds() {
        // Given
        Fingerprint fingerprint = Fingerprint.of("same content");

        // When
        Trace first = Trace.start(fingerprint, "user-1", START);
        Trace second = Trace.start(fingerprint, "user-1", START);

        // Then
        assertTrue(first.traceId().startsWith(Trace.PREFIX));
        assertNotEquals(first.traceId(), second.traceId());
        assertEquals(START, first.startedAt());
    }

    @Test
    void constructor_BlankTraceId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new Trace(" ", Fingerprint.of("x"), "user-1", START));
        assertEquals("traceId cannot be null or blank", exception.getMessage());
    }

    @Test
    void outcome_OfFailure_CarriesErrorCodeAndStages() {
        // Given
        Result result = Result.failure(FailureType.BACKEND_TIMEOUT, Duration.ofMillis(30),
            List.of("admission", "cache", "circuit_breaker", "backend"));

        // When
        TraceOutcome outcome = TraceOutcome.of(result, Duration.ofMillis(31));

        // Then
        assertFalse(outcome.success());
        assertEquals("BACKEND-TIMEOUT", outcome.errorCode());
        assertEquals(Duration.ofMillis(31), outcome.latency());
        assertEquals(4, outcome.stages().size());
    }

    @Test
    void outcome_OfSuccess_HasNoErrorCode() {
        // When
        TraceOutcome outcome = TraceOutcome.of(
            Result.success("ok", 0.9, Duration.ZERO, List.of("backend")), Duration.ZERO);

        // Then
        assertTrue(outcome.success());
        assertNull(outcome.errorCode());
        assertEquals(List.of("backend"), outcome.stages());
    }

    @Test
    void outcome_NegativeLatency_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new TraceOutcome(true, Duration.ofMillis(-1), List.of(), null));
    }
}
