package com.ryuqq.jobstore.core.spi;

/**
 * Write against a document that does not exist.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class DocumentNotFoundException extends DocumentStoreException {

    private final String collection;
    private final String id;
    private final String partitionKey;

    public DocumentNotFoundException(String collection, String id, String partitionKey) {
        super(String.format("Document %s (collection: %s, partitionKey: %s): not found", id, collection, partitionKey), false);
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
