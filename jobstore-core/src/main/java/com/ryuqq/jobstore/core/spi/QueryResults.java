package com.ryuqq.jobstore.core.spi;

import com.ryuqq.jobstore.core.document.BaseDocument;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy sequence over a paged query.
 *
 * <p>No store call is issued until iteration starts; each further page is fetched only
 * when the previous one is exhausted. Every iteration restarts from the first page.</p>
 *
 * @param <T> document type
 * @author JobStore Team
 * @since 1.0.0
 */
public final class QueryResults<T extends BaseDocument> implements Iterable<T> {

    private final DocumentStore store;
    private final String collection;
    private final DocumentQuery query;
    private final String partitionKey;
    private final Class<T> type;
    private final int pageSize;

    private QueryResults(DocumentStore store, String collection, DocumentQuery query,
                         String partitionKey, Class<T> type, int pageSize) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.store = store;
        this.collection = collection;
        this.query = query;
        this.partitionKey = partitionKey;
        this.type = type;
        this.pageSize = pageSize;
    }

    public static <T extends BaseDocument> QueryResults<T> of(DocumentStore store, String collection,
                                                              DocumentQuery query, String partitionKey,
                                                              Class<T> type, int pageSize) {
        return new QueryResults<>(store, collection, query, partitionKey, type, pageSize);
    }

    @Override
    public Iterator<T> iterator() {
        return new PageIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public List<T> toList() {
        List<T> result = new ArrayList<>();
        for (T document : this) {
            result.add(document);
        }
        return result;
    }

    public T first() {
        Iterator<T> iterator = iterator();
        return iterator.hasNext() ? iterator.next() : null;
    }

    private final class PageIterator implements Iterator<T> {

        private Iterator<T> current = null;
        private String continuationToken = null;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (exhausted) {
                    return false;
                }
                DocumentPage<T> page = store.query(collection, query, partitionKey, type, continuationToken, pageSize);
                current = page.documents().iterator();
                continuationToken = page.continuationToken();
                exhausted = !page.hasMore();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
