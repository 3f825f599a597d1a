package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.BridgeConfig;
import com.ryuqq.bridge.adapter.runner.CacheScope;
import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.cache.CacheConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for result caching.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Identical content within the TTL is answered once by the backend</li>
 *   <li>Failures are never cached</li>
 *   <li>Entries expire after the TTL</li>
 *   <li>Per-requester scope isolates requesters</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CacheContractTest extends AbstractBridgeContractTest {

    @Override
    protected BridgeConfig config() {
        return super.config().withCache(new CacheConfig(1000, 100));
    }

    @Test
    void testIdenticalContent_BackendCalledOnce() {
        // When
        Result first = execute("Where is my order?");
        Result second = execute("Where is my order?");

        // Then
        assertSuccess(first);
        assertSuccess(second);
        assertEquals(first.content(), second.content());
        assertEquals(1, backend.invocationCount());
        assertTrue(sampleNames().contains("cache_hit"));
        assertEquals(1, bridge.reporter().metrics().cacheSize());
    }

    @Test
    void testFailure_NotCached() {
        // Given
        backend.reportFailureNext(1);

        // When
        Result failed = execute("flaky");
        Result retried = execute("flaky");

        // Then
        assertFailure(failed, FailureType.BACKEND_FAILURE);
        assertSuccess(retried);
        assertEquals(2, backend.invocationCount());
    }

    @Test
    void testEntryExpiresAfterTtl() {
        // Given
        execute("ttl");

        // When
        clock.advanceMillis(999);
        execute("ttl");
        clock.advanceMillis(1);
        execute("ttl");

        // Then
        assertEquals(2, backend.invocationCount());
    }

    @Test
    void testEvictExpired_RemovesStaleEntries() {
        // Given
        execute("a");
        execute("b");
        clock.advanceMillis(1000);

        // When
        int evicted = bridge.evictExpiredCache();

        // Then
        assertEquals(2, evicted);
        assertEquals(0, bridge.reporter().metrics().cacheSize());
    }

    @Test
    void testPerRequesterScope_IsolatesRequesters() {
        // Given
        bridge = newBridge(config().withCacheScope(CacheScope.PER_REQUESTER));

        // When
        execute("same question", "alice");
        execute("same question", "bob");
        execute("same question", "alice");

        // Then
        assertEquals(2, backend.invocationCount());
    }
}
