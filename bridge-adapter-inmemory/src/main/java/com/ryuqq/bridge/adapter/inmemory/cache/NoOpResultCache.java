package com.ryuqq.bridge.adapter.inmemory.cache;

import com.ryuqq.bridge.core.cache.ResultCache;
import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Result;

import java.util.Optional;

/**
 * {@link ResultCache} that never stores anything, used when caching is disabled.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpResultCache implements ResultCache {

    @Override
    public Optional<Result> get(Fingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(Fingerprint fingerprint, Result result) {
        // caching disabled
    }

    @Override
    public int evictExpired() {
        return 0;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public void clear() {
        // nothing stored
    }
}
