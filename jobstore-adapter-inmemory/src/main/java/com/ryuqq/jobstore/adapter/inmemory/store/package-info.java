/**
 * In-memory document store adapter.
 *
 * <p>{@link com.ryuqq.jobstore.adapter.inmemory.store.InMemoryDocumentStore} implements the
 * {@link com.ryuqq.jobstore.core.spi.DocumentStore} SPI with the same conflict, etag,
 * expiry and ordering semantics the engine expects from a remote document database.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Per-document operations are atomic through {@code ConcurrentHashMap.compute}.
 * Queries read a weakly consistent snapshot, like cross-partition queries of a real store.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.adapter.inmemory.store;
