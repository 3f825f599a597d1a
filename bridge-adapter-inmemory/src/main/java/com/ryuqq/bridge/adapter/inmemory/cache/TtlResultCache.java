package com.ryuqq.bridge.adapter.inmemory.cache;

import com.ryuqq.bridge.core.cache.CacheConfig;
import com.ryuqq.bridge.core.cache.ResultCache;
import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link ResultCache} with a time-to-live and an optional capacity bound.
 *
 * <p><strong>Expiry:</strong></p>
 * <ul>
 *   <li>Entries are valid while {@code now - insertedAt < ttlMs}</li>
 *   <li>Expired entries are treated as absent by {@link #get(Fingerprint)} and removed on access</li>
 *   <li>{@link #evictExpired()} sweeps all expired entries at once</li>
 * </ul>
 *
 * <p><strong>Capacity:</strong> when {@link CacheConfig#isBounded()} and a {@link #put(Fingerprint, Result)}
 * grows the cache past {@code maxEntries}, the oldest inserted entry is evicted. Overwriting a key
 * makes it the newest entry.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Insertion-ordered {@link LinkedHashMap} guarded by a single {@link ReentrantLock}</li>
 *   <li>Entries are immutable, so a reader never observes a partially written {@link Result}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ResultCache cache = new TtlResultCache(new CacheConfig(300_000, 10_000));
 *
 * cache.put(request.fingerprint(), result);
 * Optional&lt;Result&gt; cached = cache.get(request.fingerprint());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TtlResultCache implements ResultCache {

    private final CacheConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Fingerprint → entry storage, oldest insertion first.
     */
    private final LinkedHashMap<Fingerprint, CacheEntry> entries = new LinkedHashMap<>();

    /**
     * Creates a cache using the system UTC clock.
     *
     * @param config cache configuration
     */
    public TtlResultCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a cache.
     *
     * @param config cache configuration
     * @param clock clock used for insertion timestamps and expiry checks
     * @throws IllegalArgumentException if config or clock is null
     */
    public TtlResultCache(CacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Optional<Result> get(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        Instant now = clock.instant();

        lock.lock();
        try {
            CacheEntry entry = entries.get(fingerprint);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isValidAt(now, config.ttlMs())) {
                entries.remove(fingerprint);
                return Optional.empty();
            }
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(Fingerprint fingerprint, Result result) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        CacheEntry entry = new CacheEntry(result, clock.instant());

        lock.lock();
        try {
            // remove first so the overwritten key moves to the newest position
            entries.remove(fingerprint);
            entries.put(fingerprint, entry);
            if (config.isBounded()) {
                Iterator<Fingerprint> oldest = entries.keySet().iterator();
                while (entries.size() > config.maxEntries() && oldest.hasNext()) {
                    oldest.next();
                    oldest.remove();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;

        lock.lock();
        try {
            Iterator<Map.Entry<Fingerprint, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (!it.next().getValue().isValidAt(now, config.ttlMs())) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cache configuration.
     *
     * @return configuration
     */
    public CacheConfig getConfig() {
        return config;
    }
}
