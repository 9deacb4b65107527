package com.ryuqq.jobstore.core.layout;

/**
 * Where a document lives: physical collection and partition key.
 *
 * @param collection   physical collection name
 * @param partitionKey partition key
 * @author JobStore Team
 * @since 1.0.0
 */
public record DocumentLocation(String collection, String partitionKey) {

    public DocumentLocation {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (partitionKey == null || partitionKey.isBlank()) {
            throw new IllegalArgumentException("partitionKey cannot be null or blank");
        }
    }
}
