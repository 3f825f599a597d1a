package com.ryuqq.bridge.core.model;

import com.ryuqq.bridge.core.failure.FailureType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Result 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void success_CreatesSuccessfulResult() {
        // When
        Result result = Result.success("Your refund has been initiated", 0.9, Duration.ofMillis(300),
            List.of("parser", "processor", "responder"));

        // Then
        assertTrue(result.success());
        assertNull(result.failureType());
        assertNull(result.errorCode());
        assertEquals(List.of("parser", "processor", "responder"), result.stages());
    }

    @Test
    void failure_HasZeroConfidenceAndErrorCode() {
        // When
        Result result = Result.failure(FailureType.BREAKER_OPEN, Duration.ofMillis(2), List.of("admission"));

        // Then
        assertFalse(result.success());
        assertEquals(0.0, result.confidence());
        assertEquals("CB-OPEN", result.errorCode());
        assertEquals(FailureType.BREAKER_OPEN.getDefaultMessage(), result.content());
    }

    @Test
    void stages_AreDefensivelyCopied() {
        // Given
        List<String> stages = new ArrayList<>(List.of("parser"));

        // When
        Result result = Result.success("ok", 1.0, Duration.ZERO, stages);
        stages.add("processor");

        // Then
        assertEquals(List.of("parser"), result.stages());
    }

    @Test
    void confidence_OutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Result.success("ok", 1.5, Duration.ZERO, List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> Result.success("ok", -0.1, Duration.ZERO, List.of()));
    }

    @Test
    void processingTime_Negative_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Result.success("ok", 0.5, Duration.ofMillis(-1), List.of()));
    }

    @Test
    void successWithFailureType_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Result("ok", 0.5, Duration.ZERO, List.of(), true, FailureType.BACKEND_FAILURE));
    }
}
