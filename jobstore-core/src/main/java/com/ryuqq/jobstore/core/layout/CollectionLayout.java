package com.ryuqq.jobstore.core.layout;

/**
 * Physical collection layout.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public enum CollectionLayout {

    /**
     * One collection per document kind: jobs, servers, locks, queues, sets, hashes, lists, counters.
     */
    DEDICATED,

    /**
     * Jobs in their own collection; servers, locks, queues and counters share a metadata
     * collection; sets, hashes and lists share a collections collection.
     */
    CONSOLIDATED
}
