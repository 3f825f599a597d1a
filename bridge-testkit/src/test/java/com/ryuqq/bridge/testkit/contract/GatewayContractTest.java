package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.application.gateway.GatewayHealth;
import com.ryuqq.bridge.application.gateway.MessageGateway;
import com.ryuqq.bridge.application.gateway.MessageRequest;
import com.ryuqq.bridge.application.gateway.MessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the message gateway in front of a real bridge.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GatewayContractTest extends AbstractBridgeContractTest {

    private MessageGateway gateway;

    @BeforeEach
    void setUpGateway() {
        gateway = new MessageGateway(bridge, bridge.reporter(), clock);
    }

    @Test
    void testMessage_RoundTripsThroughBridge() {
        // When
        MessageResponse response = gateway.handleMessage(
            new MessageRequest("Track my parcel", "user-7", Map.of("channel", "chat"))
        ).join();

        // Then
        assertTrue(response.success());
        assertEquals(ScriptedBackendHandler.ECHO_PREFIX + "Track my parcel", response.response());
        assertEquals(ScriptedBackendHandler.DEFAULT_CONFIDENCE, response.confidence());
        assertNull(response.errorCode());
        assertEquals(EPOCH, response.timestamp());
        assertEquals("user-7", backend.invocations().get(0).requesterId());
    }

    @Test
    void testBackendFailure_SurfacesErrorCode() {
        // Given
        backend.failNext(1);

        // When
        MessageResponse response = gateway.handleMessage(new MessageRequest("boom", null, null)).join();

        // Then
        assertFalse(response.success());
        assertEquals("BACKEND-FAIL", response.errorCode());
        assertEquals(0.0, response.confidence());
    }

    @Test
    void testHealth_ReportsUptime() {
        // When
        clock.advance(Duration.ofMinutes(5));
        GatewayHealth health = gateway.health();

        // Then
        assertEquals(Duration.ofMinutes(5), health.uptime());
        assertTrue(health.report().isHealthy());
        assertEquals(0, gateway.metrics().requestsTotal());
    }
}
