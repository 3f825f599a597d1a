/**
 * In-memory {@link com.ryuqq.bridge.core.cache.ResultCache} implementations.
 *
 * <p>Entries live only for the lifetime of the JVM; nothing is persisted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.inmemory.cache;
