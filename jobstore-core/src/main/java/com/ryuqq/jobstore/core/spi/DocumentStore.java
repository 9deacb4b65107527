package com.ryuqq.jobstore.core.spi;

import com.ryuqq.jobstore.core.document.BaseDocument;

import java.util.Optional;

/**
 * Document Store Gateway SPI.
 *
 * <p>Uniform access to named, partitioned document collections. Every document is
 * addressed by (collection, id, partition key). Implementations must provide:</p>
 * <ul>
 *   <li>Per-document atomic create/read/replace/delete</li>
 *   <li>Rejection of a create whose id and partition key already exist</li>
 *   <li>Ordered range queries within one partition</li>
 *   <li>Document-level expiry driven by {@code expireAt}</li>
 *   <li>A new {@code etag} on every write</li>
 * </ul>
 *
 * <p>Cross-partition queries ({@code partitionKey == null}) are allowed but may be
 * eventually consistent and carry no ordering guarantee across partitions beyond the
 * requested sort.</p>
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public interface DocumentStore {

    /**
     * Point read.
     *
     * @param collection   physical collection name
     * @param id           document id
     * @param partitionKey partition key
     * @param type         document class
     * @param <T>          document type
     * @return the document, or empty when absent or expired
     * @throws DocumentStoreException on store failure
     */
    <T extends BaseDocument> Optional<T> get(String collection, String id, String partitionKey, Class<T> type);

    /**
     * Creates a document that must not already exist.
     *
     * @param collection physical collection name
     * @param document   document with id and partition key set
     * @param <T>        document type
     * @return the stored document with store-assigned timestamp and etag
     * @throws DocumentConflictException when a document with the same id and partition exists
     * @throws DocumentStoreException    on store failure
     */
    <T extends BaseDocument> T create(String collection, T document);

    /**
     * Creates or unconditionally overwrites a document.
     *
     * @param collection physical collection name
     * @param document   document with id and partition key set
     * @param <T>        document type
     * @return the stored document
     * @throws DocumentStoreException on store failure
     */
    <T extends BaseDocument> T upsert(String collection, T document);

    /**
     * Overwrites an existing document.
     *
     * <p>When the document carries a non-null etag, the write only succeeds if it still
     * matches the stored version.</p>
     *
     * @param collection physical collection name
     * @param document   document with id and partition key set
     * @param <T>        document type
     * @return the stored document
     * @throws DocumentNotFoundException           when the document no longer exists
     * @throws DocumentPreconditionFailedException when the etag does not match
     * @throws DocumentStoreException              on store failure
     */
    <T extends BaseDocument> T replace(String collection, T document);

    /**
     * Deletes a document, optionally only if its etag matches. Deleting an absent
     * document succeeds.
     *
     * @param collection   physical collection name
     * @param id           document id
     * @param partitionKey partition key
     * @param ifMatchEtag  expected etag, or null for an unconditional delete
     * @throws DocumentPreconditionFailedException when {@code ifMatchEtag} does not match
     * @throws DocumentStoreException              on store failure
     */
    void delete(String collection, String id, String partitionKey, String ifMatchEtag);

    /**
     * Unconditional delete.
     *
     * @param collection   physical collection name
     * @param id           document id
     * @param partitionKey partition key
     */
    default void delete(String collection, String id, String partitionKey) {
        delete(collection, id, partitionKey, null);
    }

    /**
     * Reads one page of query results.
     *
     * @param collection        physical collection name
     * @param query             filter, ordering and window
     * @param partitionKey      partition to query, or null for a cross-partition query
     * @param type              document class
     * @param continuationToken token from the previous page, or null for the first page
     * @param pageSize          maximum number of documents in the page
     * @param <T>               document type
     * @return the page and the token for the next one
     * @throws DocumentStoreException on store failure
     */
    <T extends BaseDocument> DocumentPage<T> query(String collection, DocumentQuery query, String partitionKey,
                                                   Class<T> type, String continuationToken, int pageSize);
}
