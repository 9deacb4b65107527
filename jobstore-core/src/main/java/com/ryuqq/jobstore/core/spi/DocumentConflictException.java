package com.ryuqq.jobstore.core.spi;

/**
 * Create of a document whose id and partition key already exist.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class DocumentConflictException extends DocumentStoreException {

    private final String collection;
    private final String id;
    private final String partitionKey;

    public DocumentConflictException(String collection, String id, String partitionKey) {
        super(String.format("Document %s (collection: %s, partitionKey: %s): already exists", id, collection, partitionKey), false);
        this.collection = collection;
        this.id = id;
        this.partitionKey = partitionKey;
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    @Override
    public boolean indicatesStoreFailure() {
        return false;
    }
}
