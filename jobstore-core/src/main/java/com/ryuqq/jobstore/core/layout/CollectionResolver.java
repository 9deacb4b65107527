package com.ryuqq.jobstore.core.layout;

import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.document.DocumentKind;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps document kinds to physical collections and partition keys.
 *
 * <p>Partition keys do not depend on the layout, so a document keeps its partition key
 * when the data is moved between layouts:</p>
 * <ul>
 *   <li>job: {@code job:{queueName}}, job index: {@code job-index}</li>
 *   <li>server: {@code servers}, lock: {@code locks}, queue: {@code queues}, counter: {@code counters}</li>
 *   <li>set: {@code set:{key}}, hash: {@code hash:{key}}, list: {@code list:{key}}</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class CollectionResolver {

    private final CollectionLayout layout;
    private final CollectionNames names;

    public CollectionResolver(CollectionLayout layout, CollectionNames names) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (names == null) {
            throw new IllegalArgumentException("names cannot be null");
        }
        names.validateFor(layout);
        this.layout = layout;
        this.names = names;
    }

    public CollectionLayout getLayout() {
        return layout;
    }

    /**
     * Collection holding documents of the given kind.
     *
     * @param kind document kind
     * @return physical collection name
     */
    public String collectionFor(DocumentKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (layout == CollectionLayout.CONSOLIDATED) {
            return switch (kind) {
                case JOB, JOB_INDEX -> names.jobs();
                case SERVER, LOCK, QUEUE, COUNTER -> names.metadata();
                case SET, HASH, LIST -> names.collections();
            };
        }
        return switch (kind) {
            case JOB, JOB_INDEX -> names.jobs();
            case SERVER -> names.servers();
            case LOCK -> names.locks();
            case QUEUE -> names.queues();
            case SET -> names.sets();
            case HASH -> names.hashes();
            case LIST -> names.lists();
            case COUNTER -> names.counters();
        };
    }

    /**
     * Collection for a persisted {@code documentType} value.
     *
     * @param documentType discriminator value
     * @return physical collection name
     * @throws IllegalArgumentException for unknown document types
     */
    public String collectionFor(String documentType) {
        return collectionFor(DocumentKind.fromValue(documentType));
    }

    /**
     * Partition key for a document kind and its natural key.
     *
     * @param kind  document kind
     * @param scope queue name for jobs, key for sets, hashes and lists; ignored otherwise
     * @return partition key
     * @throws IllegalArgumentException if the kind needs a scope and none is given
     */
    public String partitionKeyFor(DocumentKind kind, String scope) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case JOB -> "job:" + requireScope(kind, scope);
            case JOB_INDEX -> "job-index";
            case SERVER -> "servers";
            case LOCK -> "locks";
            case QUEUE -> "queues";
            case COUNTER -> "counters";
            case SET -> "set:" + requireScope(kind, scope);
            case HASH -> "hash:" + requireScope(kind, scope);
            case LIST -> "list:" + requireScope(kind, scope);
        };
    }

    /**
     * Resolves where a document lives.
     *
     * @param document document
     * @return collection and partition key
     */
    public DocumentLocation locate(BaseDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        DocumentKind kind = document.kind();
        return new DocumentLocation(collectionFor(kind), partitionKeyFor(kind, document.partitionScope()));
    }

    /**
     * Resolves a document's location and stamps its partition key.
     *
     * @param document document to prepare for writing
     * @param <T>      document type
     * @return collection name to write to
     */
    public <T extends BaseDocument> String assignPartitionKey(T document) {
        DocumentLocation location = locate(document);
        document.setPartitionKey(location.partitionKey());
        return location.collection();
    }

    /**
     * Distinct physical collections of the active layout, in a stable order.
     *
     * @return collection names
     */
    public Set<String> requiredCollections() {
        Set<String> result = new LinkedHashSet<>();
        for (DocumentKind kind : EnumSet.allOf(DocumentKind.class)) {
            result.add(collectionFor(kind));
        }
        return result;
    }

    private static String requireScope(DocumentKind kind, String scope) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Partition scope is required for document type '" + kind.getValue() + "'");
        }
        return scope;
    }
}
