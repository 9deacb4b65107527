/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage boundary of the job store. The engine in
 * {@code jobstore-application} only talks to {@link com.ryuqq.jobstore.core.spi.DocumentStore};
 * adapters provide the implementation.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobstore.core.spi.DocumentStore} - partitioned document CRUD and paged queries</li>
 * </ul>
 *
 * <h2>Error Model</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobstore.core.spi.DocumentConflictException} - create of an existing id (lock exclusivity relies on it)</li>
 *   <li>{@link com.ryuqq.jobstore.core.spi.DocumentNotFoundException} - replace of a vanished document</li>
 *   <li>{@link com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException} - etag mismatch, retryable after re-read</li>
 *   <li>{@link com.ryuqq.jobstore.core.spi.DocumentStoreException} - everything else, possibly transient</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., jobstore-adapter-inmemory) implement the store. Decorators in
 * jobstore-adapter-protection add retries, timeouts and circuit breaking without changing
 * the contract.</p>
 *
 * @since 1.0.0
 * @author JobStore Team
 */
package com.ryuqq.jobstore.core.spi;
