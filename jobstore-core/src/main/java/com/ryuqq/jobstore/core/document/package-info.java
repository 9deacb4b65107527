/**
 * Persisted document model.
 *
 * <p>Every document extends {@link com.ryuqq.jobstore.core.document.BaseDocument} and is
 * discriminated by {@link com.ryuqq.jobstore.core.document.DocumentKind}. The JSON shape
 * produced by {@link com.ryuqq.jobstore.core.document.DocumentMapper} is the persisted-state
 * contract: any store placed under the engine must round-trip it unchanged.</p>
 *
 * <h2>Document ids</h2>
 * <ul>
 *   <li>{@code job:{jobId}}, {@code jobIndex:{jobId}}</li>
 *   <li>{@code server:{serverId}}, {@code lock:{resource}}, {@code queue:{name}}, {@code counter:{key}}</li>
 *   <li>{@code set:{key}:{value}}, {@code hash:{key}:{field}}, {@code list:{key}:{index}}</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.core.document;
