package com.ryuqq.bridge.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RequestTest {

    @Test
    void of_ComputesFingerprintFromContent() {
        // When
        Request request = Request.of("Track my shipment #67890", "user-002");

        // Then
        assertEquals(Fingerprint.of("Track my shipment #67890"), request.fingerprint());
        assertEquals("user-002", request.requesterId());
        assertNotNull(request.receivedAt());
    }

    @Test
    void of_BlankRequester_DefaultsToAnonymous() {
        // When
        Request blank = Request.of("hi", "  ");
        Request missing = Request.of("hi");

        // Then
        assertEquals(Request.ANONYMOUS, blank.requesterId());
        assertEquals(Request.ANONYMOUS, missing.requesterId());
    }

    @Test
    void of_MetadataIsDefensivelyCopied() {
        // Given
        Map<String, String> metadata = new HashMap<>();
        metadata.put("channel", "chat");

        // When
        Request request = Request.of("hi", "user-001", metadata);
        metadata.put("channel", "email");

        // Then
        assertEquals("chat", request.metadata().get("channel"));
        assertThrows(UnsupportedOperationException.class, () -> request.metadata().put("x", "y"));
    }

    @Test
    void of_NullMetadata_BecomesEmptyMap() {
        // When
        Request request = Request.of("hi", "user-001", null);

        // Then
        assertTrue(request.metadata().isEmpty());
    }

    @Test
    void of_NullContent_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Request.of(null));
    }
}
