package com.ryuqq.jobstore.core.spi;

/**
 * Conditional write whose expected etag no longer matches the stored version. Re-read and reapply.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class DocumentPreconditionFailedException extends DocumentStoreException {

    private final String collection;
    private final String id;
    private final String partitionKey;

    public DocumentPreconditionFailedException(String collection, String id, String partitionKey) {
        super(String.format("Document %s (collection: %s, partitionKey: %s): etag mismatch", id, collection, partitionKey), false);
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
