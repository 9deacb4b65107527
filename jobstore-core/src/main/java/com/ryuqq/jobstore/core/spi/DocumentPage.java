package com.ryuqq.jobstore.core.spi;

import java.util.List;

/**
 * One page of query results.
 *
 * @param documents         documents of this page, in query order
 * @param continuationToken opaque token for the next page, null when this is the last page
 * @param <T>               document type
 * @author JobStore Team
 * @since 1.0.0
 */
public record DocumentPage<T>(List<T> documents, String continuationToken) {

    public DocumentPage {
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        documents = List.copyOf(documents);
    }

    public boolean hasMore() {
        return continuationToken != null;
    }

    public static <T> DocumentPage<T> last(List<T> documents) {
        return new DocumentPage<>(documents, null);
    }
}
