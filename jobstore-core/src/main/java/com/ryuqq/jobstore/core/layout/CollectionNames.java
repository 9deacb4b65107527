package com.ryuqq.jobstore.core.layout;

/**
 * Physical collection names for both layouts.
 *
 * <p>Only the names used by the active {@link CollectionLayout} need to be set;
 * {@link #validateFor(CollectionLayout)} checks them.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public record CollectionNames(
    String jobs,
    String servers,
    String locks,
    String queues,
    String sets,
    String hashes,
    String lists,
    String counters,
    String metadata,
    String collections
) {

    /**
     * Default names.
     */
    public CollectionNames() {
        this("jobs", "servers", "locks", "queues", "sets", "hashes", "lists", "counters", "metadata", "collections");
    }

    /**
     * Checks that every name the layout needs is present.
     *
     * @param layout active layout
     * @throws IllegalArgumentException naming the first missing collection
     */
    public void validateFor(CollectionLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        require("jobs", jobs, layout);
        if (layout == CollectionLayout.CONSOLIDATED) {
            require("metadata", metadata, layout);
            require("collections", collections, layout);
            return;
        }
        require("servers", servers, layout);
        require("locks", locks, layout);
        require("queues", queues, layout);
        require("sets", sets, layout);
        require("hashes", hashes, layout);
        require("lists", lists, layout);
        require("counters", counters, layout);
    }

    private static void require(String field, String value, CollectionLayout layout) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                String.format("Collection name '%s' cannot be null or blank for %s layout", field, layout));
        }
    }

    public CollectionNames withJobs(String jobs) {
        return new CollectionNames(jobs, servers, locks, queues, sets, hashes, lists, counters, metadata, collections);
    }

    public CollectionNames withMetadata(String metadata) {
        return new CollectionNames(jobs, servers, locks, queues, sets, hashes, lists, counters, metadata, collections);
    }

    public CollectionNames withCollections(String collections) {
        return new CollectionNames(jobs, servers, locks, queues, sets, hashes, lists, counters, metadata, collections);
    }

    public CollectionNames withServers(String servers) {
        return new CollectionNames(jobs, servers, locks, queues, sets, hashes, lists, counters, metadata, collections);
    }

    public CollectionNames withLocks(String locks) {
        return new CollectionNames(jobs, servers, locks, queues, sets, hashes, lists, counters, metadata, collections);
    }
}
