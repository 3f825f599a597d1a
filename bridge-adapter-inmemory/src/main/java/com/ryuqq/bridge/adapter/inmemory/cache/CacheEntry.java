package com.ryuqq.bridge.adapter.inmemory.cache;

import com.ryuqq.bridge.core.model.Result;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached {@link Result} together with the instant it was stored.
 *
 * @param result cached result
 * @param insertedAt instant the entry was stored
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
record CacheEntry(Result result, Instant insertedAt) {

    /**
     * Checks whether the entry is still valid at the given instant.
     *
     * <p>An entry is valid while {@code now - insertedAt < ttl}. A clock that moved
     * backwards keeps the entry valid.</p>
     *
     * @param now current instant
     * @param ttlMs time-to-live in milliseconds
     * @return true if the entry has not expired
     */
    boolean isValidAt(Instant now, long ttlMs) {
        return Duration.between(insertedAt, now).toMillis() < ttlMs;
    }
}
