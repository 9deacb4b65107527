package com.ryuqq.jobstore.adapter.inmemory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.DocumentMapper;
import com.ryuqq.jobstore.core.spi.DocumentConflictException;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentPage;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link DocumentStore} SPI for testing and single-node use.
 *
 * <p>Documents are held as Jackson {@link ObjectNode} trees, so every read returns a fresh
 * copy and every write goes through the same JSON shape a remote document database would
 * persist.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>collections:</strong> ConcurrentHashMap&lt;String, InMemoryCollection&gt; - created lazily, one per physical name</li>
 *   <li><strong>InMemoryCollection.entries:</strong> ConcurrentHashMap keyed by (partitionKey, id) - per-document atomic compute</li>
 * </ul>
 *
 * <p><strong>Store Semantics:</strong></p>
 * <ul>
 *   <li><strong>create:</strong> fails with {@link DocumentConflictException} when a live document exists</li>
 *   <li><strong>replace:</strong> honors the document etag as If-Match</li>
 *   <li><strong>expiry:</strong> {@code expireAt}, or a per-kind default TTL counted from the last write;
 *       expired documents are invisible and removed lazily or by {@link #purgeExpired()}</li>
 *   <li><strong>query:</strong> filter, stable sort (ties by partition key and id), offset/limit, paging
 *       with a numeric continuation token</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Queries scan the partition (or the whole collection) linearly</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * JobStoreOptions options = new JobStoreOptions();
 * InMemoryDocumentStore store = InMemoryDocumentStore.forOptions(options, Clock.systemUTC());
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentHashMap<String, InMemoryCollection> collections = new ConcurrentHashMap<>();
    private final Map<String, Duration> defaultTtlByType;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong versionSequence = new AtomicLong();

    public InMemoryDocumentStore() {
        this(Clock.systemUTC(), DocumentMapper.create(), Map.of());
    }

    public InMemoryDocumentStore(Clock clock) {
        this(clock, DocumentMapper.create(), Map.of());
    }

    /**
     * @param clock            time source for timestamps and expiry
     * @param objectMapper     mapper defining the persisted JSON shape
     * @param defaultTtlByKind default TTL for documents without {@code expireAt}, per kind
     */
    public InMemoryDocumentStore(Clock clock, ObjectMapper objectMapper, Map<DocumentKind, Duration> defaultTtlByKind) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (defaultTtlByKind == null) {
            throw new IllegalArgumentException("defaultTtlByKind cannot be null");
        }
        this.clock = clock;
        this.objectMapper = objectMapper;
        Map<String, Duration> byType = new ConcurrentHashMap<>();
        defaultTtlByKind.forEach((kind, ttl) -> byType.put(kind.getValue(), ttl));
        this.defaultTtlByType = byType;
    }

    /**
     * Creates a store with the default TTLs of the options and the active layout's
     * collections pre-registered.
     *
     * @param options job store options
     * @param clock   time source
     * @return new store
     */
    public static InMemoryDocumentStore forOptions(JobStoreOptions options, Clock clock) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Map<DocumentKind, Duration> ttls = new EnumMap<>(DocumentKind.class);
        for (DocumentKind kind : DocumentKind.values()) {
            options.documentTtl().forKind(kind).ifPresent(ttl -> ttls.put(kind, ttl));
        }
        InMemoryDocumentStore store = new InMemoryDocumentStore(clock, DocumentMapper.create(), ttls);
        options.createResolver().requiredCollections().forEach(store::collection);
        return store;
    }

    @Override
    public <T extends BaseDocument> Optional<T> get(String collection, String id, String partitionKey, Class<T> type) {
        requireKey(id, partitionKey);
        Instant now = clock.instant();
        StoredKey key = new StoredKey(partitionKey, id);
        StoredEntry entry = collection(collection).entries.computeIfPresent(key,
            (k, existing) -> isExpired(existing, now) ? null : existing);
        return Optional.ofNullable(entry).map(e -> toDocument(e, type));
    }

    @Override
    public <T extends BaseDocument> T create(String collection, T document) {
        requireDocument(document);
        Instant now = clock.instant();
        ObjectNode json = toJson(document);
        StoredKey key = StoredKey.of(document);
        StoredEntry stored = collection(collection).entries.compute(key, (k, existing) -> {
            if (existing != null && !isExpired(existing, now)) {
                throw new DocumentConflictException(collection, key.id(), key.partitionKey());
            }
            return newEntry(json, now);
        });
        return toDocument(stored, classOf(document));
    }

    @Override
    public <T extends BaseDocument> T upsert(String collection, T document) {
        requireDocument(document);
        Instant now = clock.instant();
        ObjectNode json = toJson(document);
        StoredEntry stored = collection(collection).entries.compute(StoredKey.of(document),
            (k, existing) -> newEntry(json, now));
        return toDocument(stored, classOf(document));
    }

    @Override
    public <T extends BaseDocument> T replace(String collection, T document) {
        requireDocument(document);
        Instant now = clock.instant();
        ObjectNode json = toJson(document);
        StoredKey key = StoredKey.of(document);
        String ifMatch = document.getEtag();
        StoredEntry stored = collection(collection).entries.compute(key, (k, existing) -> {
            if (existing == null || isExpired(existing, now)) {
                throw new DocumentNotFoundException(collection, key.id(), key.partitionKey());
            }
            if (ifMatch != null && !ifMatch.equals(existing.etag())) {
                throw new DocumentPreconditionFailedException(collection, key.id(), key.partitionKey());
            }
            return newEntry(json, now);
        });
        return toDocument(stored, classOf(document));
    }

    @Override
    public void delete(String collection, String id, String partitionKey, String ifMatchEtag) {
        requireKey(id, partitionKey);
        Instant now = clock.instant();
        collection(collection).entries.computeIfPresent(new StoredKey(partitionKey, id), (k, existing) -> {
            if (ifMatchEtag != null && !isExpired(existing, now) && !ifMatchEtag.equals(existing.etag())) {
                throw new DocumentPreconditionFailedException(collection, id, partitionKey);
            }
            return null;
        });
    }

    @Override
    public <T extends BaseDocument> DocumentPage<T> query(String collection, DocumentQuery query, String partitionKey,
                                                          Class<T> type, String continuationToken, int pageSize) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        Instant now = clock.instant();
        List<Map.Entry<StoredKey, StoredEntry>> matches = new ArrayList<>();
        for (Map.Entry<StoredKey, StoredEntry> entry : collection(collection).entries.entrySet()) {
            if (partitionKey != null && !partitionKey.equals(entry.getKey().partitionKey())) {
                continue;
            }
            if (isExpired(entry.getValue(), now) || !QueryMatcher.matches(entry.getValue().json(), query, objectMapper)) {
                continue;
            }
            matches.add(entry);
        }
        matches.sort(ordering(query));

        int from = Math.min(query.getOffset(), matches.size());
        int to = query.getLimit() == null ? matches.size() : Math.min(matches.size(), from + query.getLimit());
        List<Map.Entry<StoredKey, StoredEntry>> window = matches.subList(from, to);

        int start = parseContinuation(continuationToken);
        int end = Math.min(window.size(), start + pageSize);
        List<T> documents = new ArrayList<>(Math.max(0, end - start));
        for (int i = start; i < end; i++) {
            documents.add(toDocument(window.get(i).getValue(), type));
        }
        String next = end < window.size() ? Integer.toString(end) : null;
        return new DocumentPage<>(documents, next);
    }

    /**
     * Removes every expired document, as a store's TTL sweeper would.
     *
     * @return number of removed documents
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (InMemoryCollection collection : collections.values()) {
            for (Map.Entry<StoredKey, StoredEntry> entry : collection.entries.entrySet()) {
                if (isExpired(entry.getValue(), now) && collection.entries.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired documents", removed);
        }
        return removed;
    }

    /**
     * Number of live documents in a collection.
     *
     * @param collection collection name
     * @return live document count
     */
    public int documentCount(String collection) {
        Instant now = clock.instant();
        InMemoryCollection handle = collections.get(collection);
        if (handle == null) {
            return 0;
        }
        return (int) handle.entries.values().stream().filter(e -> !isExpired(e, now)).count();
    }

    /**
     * Names of the collections created so far.
     *
     * @return collection names
     */
    public List<String> collectionNames() {
        return List.copyOf(collections.keySet());
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        collections.values().forEach(c -> c.entries.clear());
    }

    InMemoryCollection collection(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        return collections.computeIfAbsent(name, n -> {
            log.debug("Creating in-memory collection '{}'", n);
            return new InMemoryCollection();
        });
    }

    private StoredEntry newEntry(ObjectNode json, Instant now) {
        String etag = "\"" + Long.toHexString(versionSequence.incrementAndGet()) + "\"";
        ObjectNode copy = json.deepCopy();
        copy.put("_ts", now.getEpochSecond());
        copy.put("_etag", etag);
        return new StoredEntry(copy, etag, expiryOf(copy, now));
    }

    private Instant expiryOf(ObjectNode json, Instant writtenAt) {
        JsonNode expireAt = json.get("expireAt");
        if (!JsonValues.isAbsent(expireAt)) {
            return Instant.parse(expireAt.asText());
        }
        JsonNode type = json.get("documentType");
        Duration ttl = type == null ? null : defaultTtlByType.get(type.asText());
        return ttl == null ? null : writtenAt.plus(ttl);
    }

    private static boolean isExpired(StoredEntry entry, Instant now) {
        return entry.expiresAt() != null && !entry.expiresAt().isAfter(now);
    }

    private Comparator<Map.Entry<StoredKey, StoredEntry>> ordering(DocumentQuery query) {
        Comparator<Map.Entry<StoredKey, StoredEntry>> tieBreak = Comparator
            .comparing((Map.Entry<StoredKey, StoredEntry> e) -> e.getKey().partitionKey())
            .thenComparing(e -> e.getKey().id());
        if (query.getOrderBy() == null) {
            return tieBreak;
        }
        String field = query.getOrderBy();
        Comparator<Map.Entry<StoredKey, StoredEntry>> byField =
            (a, b) -> JsonValues.SORT_ORDER.compare(a.getValue().json().get(field), b.getValue().json().get(field));
        if (query.isDescending()) {
            byField = byField.reversed();
        }
        return byField.thenComparing(tieBreak);
    }

    private ObjectNode toJson(BaseDocument document) {
        return objectMapper.valueToTree(document);
    }

    private <T extends BaseDocument> T toDocument(StoredEntry entry, Class<T> type) {
        try {
            return objectMapper.treeToValue(entry.json(), type);
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException("Failed to read document as " + type.getSimpleName(), e, false);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends BaseDocument> Class<T> classOf(T document) {
        return (Class<T>) document.getClass();
    }

    private static int parseContinuation(String token) {
        if (token == null) {
            return 0;
        }
        try {
            int value = Integer.parseInt(token);
            if (value < 0) {
                throw new IllegalArgumentException("Invalid continuation token: " + token);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid continuation token: " + token, e);
        }
    }

    private static void requireDocument(BaseDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        requireKey(document.getId(), document.getPartitionKey());
    }

    private static void requireKey(String id, String partitionKey) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (partitionKey == null || partitionKey.isBlank()) {
            throw new IllegalArgumentException("partitionKey cannot be null or blank");
        }
    }

    static final class InMemoryCollection {

        private final ConcurrentHashMap<StoredKey, StoredEntry> entries = new ConcurrentHashMap<>();
    }

    record StoredKey(String partitionKey, String id) {

        static StoredKey of(BaseDocument document) {
            return new StoredKey(document.getPartitionKey(), document.getId());
        }
    }

    record StoredEntry(ObjectNode json, String etag, Instant expiresAt) {
    }
}
