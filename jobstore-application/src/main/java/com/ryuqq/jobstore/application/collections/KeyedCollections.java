package com.ryuqq.jobstore.application.collections;

import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.document.CounterDocument;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.HashDocument;
import com.ryuqq.jobstore.core.document.ListDocument;
import com.ryuqq.jobstore.core.document.SetDocument;
import com.ryuqq.jobstore.core.protection.BackoffCalculator;
import com.ryuqq.jobstore.core.spi.DocumentConflictException;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentQuery.Operator;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Counters, sorted sets, lists and hashes kept as one document per element.
 *
 * <p>Each set, hash and list lives in its own partition ({@code set:{key}}, ...), so every
 * read here is a single-partition query. Counters and list positions are assigned with
 * compare-and-swap loops. Those loops contend on a single document, so they get their own
 * bound ({@link #CONTENTION_RETRY_ATTEMPTS}, or {@code concurrencyRetryAttempts} when that is
 * higher) and sleep a fully jittered backoff between attempts.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class KeyedCollections {

    private static final Logger log = LoggerFactory.getLogger(KeyedCollections.class);

    /** Attempts for a counter or list-index swap before the last conflict is rethrown. */
    public static final int CONTENTION_RETRY_ATTEMPTS = 100;

    private static final BackoffCalculator DEFAULT_CONTENTION_BACKOFF = new BackoffCalculator(1, 64, 1.0);

    private final StorageContext context;
    private final BackoffCalculator contentionBackoff;

    public KeyedCollections(StorageContext context) {
        this(context, DEFAULT_CONTENTION_BACKOFF);
    }

    public KeyedCollections(StorageContext context, BackoffCalculator contentionBackoff) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (contentionBackoff == null) {
            throw new IllegalArgumentException("contentionBackoff cannot be null");
        }
        this.context = context;
        this.contentionBackoff = contentionBackoff;
    }

    // ===== Counters =====

    /**
     * Adds {@code delta} to a counter, creating it when absent.
     *
     * @param key      counter key
     * @param delta    amount to add (may be negative)
     * @param expireIn expiry from now, or null to leave the expiry unchanged
     * @return the new value
     */
    public long adjustCounter(String key, long delta, Duration expireIn) {
        requireKey(key);
        int maxAttempts = contentionAttempts();
        DocumentStoreException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant now = context.now();
            Optional<CounterDocument> current = context.read(DocumentKind.COUNTER, CounterDocument.class,
                CounterDocument.idFor(key), null);
            try {
                if (current.isEmpty()) {
                    CounterDocument counter = new CounterDocument(key, delta);
                    if (expireIn != null) {
                        counter.setExpireAt(now.plus(expireIn));
                    }
                    return context.create(counter).getValue();
                }
                CounterDocument counter = current.get();
                counter.setValue(counter.getValue() + delta);
                if (expireIn != null) {
                    counter.setExpireAt(now.plus(expireIn));
                }
                return context.replace(counter).getValue();
            } catch (DocumentConflictException | DocumentPreconditionFailedException | DocumentNotFoundException e) {
                lastConflict = e;
                log.debug("Counter {} changed concurrently (attempt {}/{})", key, attempt, maxAttempts);
                pauseAfterConflict(attempt, maxAttempts);
            }
        }
        log.warn("Counter {} still contended after {} attempts", key, maxAttempts);
        throw lastConflict;
    }

    /**
     * @param key counter key
     * @return current value, 0 when the counter does not exist
     */
    public long getCounter(String key) {
        requireKey(key);
        return context.read(DocumentKind.COUNTER, CounterDocument.class, CounterDocument.idFor(key), null)
            .map(CounterDocument::getValue)
            .orElse(0L);
    }

    // ===== Sets =====

    public void addToSet(String key, String value, double score) {
        requireKey(key);
        requireValue(value);
        context.upsert(new SetDocument(key, value, score));
    }

    public void removeFromSet(String key, String value) {
        requireKey(key);
        requireValue(value);
        SetDocument element = new SetDocument(key, value, 0);
        context.resolver().assignPartitionKey(element);
        context.delete(element);
    }

    /**
     * Deletes every element of a set.
     *
     * @param key set key
     * @return number of deleted elements
     */
    public int removeSet(String key) {
        return deleteAll(DocumentKind.SET, SetDocument.class, key);
    }

    /**
     * @param key set key
     * @return values ordered by score, empty when the set does not exist
     */
    public Set<String> getAllItemsFromSet(String key) {
        Set<String> values = new LinkedHashSet<>();
        for (SetDocument element : context.queryPartition(DocumentKind.SET, SetDocument.class, key,
                byScore().build())) {
            values.add(element.getValue());
        }
        return values;
    }

    /**
     * @param key       set key
     * @param fromScore lowest score, inclusive
     * @param toScore   highest score, inclusive
     * @param count     maximum number of values
     * @return values in ascending score order
     */
    public List<String> getFirstByLowestScoreFromSet(String key, double fromScore, double toScore, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        if (toScore < fromScore) {
            throw new IllegalArgumentException("toScore must be >= fromScore (from: " + fromScore
                + ", to: " + toScore + ")");
        }
        DocumentQuery query = byScore()
            .where("score", Operator.GE, fromScore)
            .where("score", Operator.LE, toScore)
            .limit(count)
            .build();
        List<String> values = new ArrayList<>();
        for (SetDocument element : context.queryPartition(DocumentKind.SET, SetDocument.class, key, query)) {
            values.add(element.getValue());
        }
        return values;
    }

    /**
     * @return lowest-scored value within the range, or null
     */
    public String getFirstByLowestScoreFromSet(String key, double fromScore, double toScore) {
        List<String> values = getFirstByLowestScoreFromSet(key, fromScore, toScore, 1);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * @param key          set key
     * @param startingFrom first position, inclusive (0-based)
     * @param endingAt     last position, inclusive
     * @return values at those positions in score order
     */
    public List<String> getRangeFromSet(String key, int startingFrom, int endingAt) {
        requireRange(startingFrom, endingAt);
        DocumentQuery query = byScore()
            .offset(startingFrom)
            .limit(endingAt - startingFrom + 1)
            .build();
        List<String> values = new ArrayList<>();
        for (SetDocument element : context.queryPartition(DocumentKind.SET, SetDocument.class, key, query)) {
            values.add(element.getValue());
        }
        return values;
    }

    public long getSetCount(String key) {
        return count(DocumentKind.SET, SetDocument.class, key);
    }

    public Duration getSetTtl(String key) {
        return ttl(DocumentKind.SET, SetDocument.class, key);
    }

    // ===== Lists =====

    /**
     * Appends a value after the highest existing index.
     *
     * @param key   list key
     * @param value value
     */
    public void insertToList(String key, String value) {
        requireKey(key);
        requireValue(value);
        int maxAttempts = contentionAttempts();
        DocumentConflictException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            DocumentQuery query = DocumentQuery.forKind(DocumentKind.LIST)
                .orderByDescending("index")
                .limit(1)
                .build();
            ListDocument last = context.queryPartition(DocumentKind.LIST, ListDocument.class, key, query).first();
            long nextIndex = last == null ? 0 : last.getIndex() + 1;
            try {
                context.create(new ListDocument(key, nextIndex, value));
                return;
            } catch (DocumentConflictException e) {
                lastConflict = e;
                log.debug("List {} index {} taken concurrently (attempt {}/{})", key, nextIndex, attempt, maxAttempts);
                pauseAfterConflict(attempt, maxAttempts);
            }
        }
        log.warn("List {} still contended after {} attempts", key, maxAttempts);
        throw lastConflict;
    }

    /**
     * Removes every element equal to {@code value}.
     *
     * @return number of removed elements
     */
    public int removeFromList(String key, String value) {
        requireKey(key);
        requireValue(value);
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.LIST).whereEquals("value", value).build();
        int removed = 0;
        for (ListDocument element : context.queryPartition(DocumentKind.LIST, ListDocument.class, key, query)
                .toList()) {
            context.delete(element);
            removed++;
        }
        return removed;
    }

    /**
     * Keeps only the elements at positions {@code keepStartingFrom..keepEndingAt}.
     *
     * @return number of removed elements
     */
    public int trimList(String key, int keepStartingFrom, int keepEndingAt) {
        requireKey(key);
        if (keepStartingFrom < 0) {
            throw new IllegalArgumentException("keepStartingFrom must be >= 0 (current: " + keepStartingFrom + ")");
        }
        List<ListDocument> elements = context.queryPartition(DocumentKind.LIST, ListDocument.class, key,
            byIndex().build()).toList();
        int removed = 0;
        for (int position = 0; position < elements.size(); position++) {
            if (position < keepStartingFrom || position > keepEndingAt) {
                context.delete(elements.get(position));
                removed++;
            }
        }
        return removed;
    }

    public int removeList(String key) {
        return deleteAll(DocumentKind.LIST, ListDocument.class, key);
    }

    /**
     * @return values in insertion order, empty when the list does not exist
     */
    public List<String> getAllItemsFromList(String key) {
        List<String> values = new ArrayList<>();
        for (ListDocument element : context.queryPartition(DocumentKind.LIST, ListDocument.class, key,
                byIndex().build())) {
            values.add(element.getValue());
        }
        return values;
    }

    /**
     * @param key          list key
     * @param startingFrom first position, inclusive (0-based)
     * @param endingAt     last position, inclusive
     * @return values at those positions in insertion order
     */
    public List<String> getRangeFromList(String key, int startingFrom, int endingAt) {
        requireRange(startingFrom, endingAt);
        DocumentQuery query = byIndex()
            .offset(startingFrom)
            .limit(endingAt - startingFrom + 1)
            .build();
        List<String> values = new ArrayList<>();
        for (ListDocument element : context.queryPartition(DocumentKind.LIST, ListDocument.class, key, query)) {
            values.add(element.getValue());
        }
        return values;
    }

    public long getListCount(String key) {
        return count(DocumentKind.LIST, ListDocument.class, key);
    }

    public Duration getListTtl(String key) {
        return ttl(DocumentKind.LIST, ListDocument.class, key);
    }

    // ===== Hashes =====

    public void setRangeInHash(String key, Map<String, String> entries) {
        requireKey(key);
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            requireValue(entry.getKey());
            context.upsert(new HashDocument(key, entry.getKey(), entry.getValue()));
        }
    }

    public int removeHash(String key) {
        return deleteAll(DocumentKind.HASH, HashDocument.class, key);
    }

    /**
     * @return all fields, or null when the hash does not exist
     */
    public Map<String, String> getAllEntriesFromHash(String key) {
        Map<String, String> entries = new LinkedHashMap<>();
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.HASH).orderBy("field").build();
        for (HashDocument field : context.queryPartition(DocumentKind.HASH, HashDocument.class, key, query)) {
            entries.put(field.getField(), field.getValue());
        }
        return entries.isEmpty() ? null : entries;
    }

    public String getValueFromHash(String key, String field) {
        requireKey(key);
        requireValue(field);
        return context.read(DocumentKind.HASH, HashDocument.class, HashDocument.idFor(key, field), key)
            .map(HashDocument::getValue)
            .orElse(null);
    }

    public long getHashCount(String key) {
        return count(DocumentKind.HASH, HashDocument.class, key);
    }

    public Duration getHashTtl(String key) {
        return ttl(DocumentKind.HASH, HashDocument.class, key);
    }

    // ===== Expiration =====

    /**
     * Sets the expiry of every element of a set, list or hash.
     *
     * @param kind     SET, LIST or HASH
     * @param key      collection key
     * @param expireAt expiry, or null to persist
     * @return number of updated elements
     */
    public int setExpiration(DocumentKind kind, String key, Instant expireAt) {
        Class<? extends BaseDocument> type = elementType(kind);
        int updated = 0;
        for (BaseDocument element : context.queryPartition(kind, type, key, DocumentQuery.forKind(kind).build())
                .toList()) {
            if (!Objects.equals(element.getExpireAt(), expireAt)) {
                element.setExpireAt(expireAt);
                element.setEtag(null);
                context.upsert(element);
                updated++;
            }
        }
        return updated;
    }

    private static Class<? extends BaseDocument> elementType(DocumentKind kind) {
        return switch (kind) {
            case SET -> SetDocument.class;
            case LIST -> ListDocument.class;
            case HASH -> HashDocument.class;
            default -> throw new IllegalArgumentException("Not a keyed collection: " + kind);
        };
    }

    private <T extends BaseDocument> int deleteAll(DocumentKind kind, Class<T> type, String key) {
        requireKey(key);
        int removed = 0;
        for (T element : context.queryPartition(kind, type, key, DocumentQuery.forKind(kind).build()).toList()) {
            context.delete(element);
            removed++;
        }
        return removed;
    }

    private <T extends BaseDocument> long count(DocumentKind kind, Class<T> type, String key) {
        requireKey(key);
        return context.queryPartition(kind, type, key, DocumentQuery.forKind(kind).build()).stream().count();
    }

    // Shortest remaining lifetime among the elements; null when none expires.
    private <T extends BaseDocument> Duration ttl(DocumentKind kind, Class<T> type, String key) {
        requireKey(key);
        Optional<Instant> earliest = context.queryPartition(kind, type, key, DocumentQuery.forKind(kind).build())
            .stream()
            .map(BaseDocument::getExpireAt)
            .filter(Objects::nonNull)
            .min(Instant::compareTo);
        if (earliest.isEmpty()) {
            return null;
        }
        Duration remaining = Duration.between(context.now(), earliest.get());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static DocumentQuery.Builder byScore() {
        return DocumentQuery.forKind(DocumentKind.SET).orderBy("score");
    }

    private static DocumentQuery.Builder byIndex() {
        return DocumentQuery.forKind(DocumentKind.LIST).orderBy("index");
    }

    private int contentionAttempts() {
        return Math.max(CONTENTION_RETRY_ATTEMPTS, context.options().concurrencyRetryAttempts());
    }

    private void pauseAfterConflict(int attempt, int maxAttempts) {
        if (attempt >= maxAttempts) {
            return;
        }
        try {
            Thread.sleep(contentionBackoff.calculate(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry a contended write");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requireRange(int startingFrom, int endingAt) {
        if (startingFrom < 0) {
            throw new IllegalArgumentException("startingFrom must be >= 0 (current: " + startingFrom + ")");
        }
        if (endingAt < startingFrom) {
            throw new IllegalArgumentException("endingAt must be >= startingFrom (from: " + startingFrom
                + ", to: " + endingAt + ")");
        }
    }
}
