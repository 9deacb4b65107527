package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.application.transaction.WriteTransaction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: sets, lists and hashes behave like their in-process counterparts.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class KeyedCollectionsContractTest extends AbstractContractTest {

    private void write(Consumer<WriteTransaction> operations) {
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            operations.accept(transaction);
            transaction.commit();
        }
    }

    // ===== Sets =====

    @Test
    void set_orderedByScore_andDeduplicated() {
        // Given
        write(tx -> {
            tx.addToSet("schedule", "job-c", 30);
            tx.addToSet("schedule", "job-a", 10);
            tx.addToSet("schedule", "job-b", 20);
            tx.addToSet("schedule", "job-a", 5);
        });

        // Then
        assertEquals(List.of("job-a", "job-b", "job-c"), List.copyOf(connection.getAllItemsFromSet("schedule")));
        assertEquals(3, connection.getSetCount("schedule"));
        assertEquals("job-a", connection.getFirstByLowestScoreFromSet("schedule", 0, 100));
        assertEquals(List.of("job-b", "job-c"), connection.getFirstByLowestScoreFromSet("schedule", 15, 30, 5));
        assertEquals(List.of("job-b"), connection.getRangeFromSet("schedule", 1, 1));
        assertNull(connection.getFirstByLowestScoreFromSet("schedule", 31, 40));
    }

    @Test
    void set_removeAndDelete() {
        // Given
        write(tx -> tx.addRangeToSet("recurring-jobs", List.of("daily", "hourly", "weekly")));

        // When
        write(tx -> tx.removeFromSet("recurring-jobs", "hourly"));

        // Then
        assertEquals(2, connection.getSetCount("recurring-jobs"));
        write(tx -> tx.removeSet("recurring-jobs"));
        assertTrue(connection.getAllItemsFromSet("recurring-jobs").isEmpty());
    }

    @Test
    void set_expireAndPersist() {
        // Given
        write(tx -> {
            tx.addToSet("temp", "value");
            tx.expireSet("temp", Duration.ofMinutes(10));
        });
        assertEquals(Duration.ofMinutes(10), connection.getSetTtl("temp"));

        // When
        write(tx -> tx.persistSet("temp"));
        advance(Duration.ofHours(1));

        // Then
        assertNull(connection.getSetTtl("temp"));
        assertEquals(1, connection.getSetCount("temp"));
    }

    @Test
    void set_expiredElementsDisappear() {
        write(tx -> {
            tx.addToSet("temp", "value");
            tx.expireSet("temp", Duration.ofMinutes(10));
        });

        advance(Duration.ofMinutes(11));

        assertEquals(0, connection.getSetCount("temp"));
    }

    // ===== Lists =====

    @Test
    void list_keepsInsertionOrder() {
        // Given
        write(tx -> {
            tx.insertToList("log", "first");
            tx.insertToList("log", "second");
            tx.insertToList("log", "third");
        });

        // Then
        assertEquals(List.of("first", "second", "third"), connection.getAllItemsFromList("log"));
        assertEquals(List.of("second", "third"), connection.getRangeFromList("log", 1, 5));
        assertEquals(3, connection.getListCount("log"));
    }

    @Test
    void list_removeAllOccurrences() {
        write(tx -> {
            tx.insertToList("log", "a");
            tx.insertToList("log", "b");
            tx.insertToList("log", "a");
        });

        write(tx -> tx.removeFromList("log", "a"));

        assertEquals(List.of("b"), connection.getAllItemsFromList("log"));
    }

    @Test
    void list_trimKeepsRange() {
        // Given
        write(tx -> {
            for (int i = 0; i < 5; i++) {
                tx.insertToList("log", "item-" + i);
            }
        });

        // When
        write(tx -> tx.trimList("log", 1, 2));

        // Then
        assertEquals(List.of("item-1", "item-2"), connection.getAllItemsFromList("log"));
    }

    @Test
    void list_insertAfterTrim_appendsAtEnd() {
        write(tx -> {
            tx.insertToList("log", "a");
            tx.insertToList("log", "b");
            tx.trimList("log", 1, 1);
            tx.insertToList("log", "c");
        });

        assertEquals(List.of("b", "c"), connection.getAllItemsFromList("log"));
    }

    @Test
    void list_ttl() {
        write(tx -> {
            tx.insertToList("log", "a");
            tx.expireList("log", Duration.ofMinutes(5));
        });
        advance(Duration.ofMinutes(2));

        assertEquals(Duration.ofMinutes(3), connection.getListTtl("log"));
    }

    // ===== Hashes =====

    @Test
    void hash_setRangeAndRead() {
        // Given
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("Queue", "default");
        entries.put("Cron", "0 * * * *");
        write(tx -> tx.setRangeInHash("recurring-job:daily", entries));

        // When
        write(tx -> tx.setRangeInHash("recurring-job:daily", Map.of("Cron", "0 0 * * *")));

        // Then
        Map<String, String> stored = connection.getAllEntriesFromHash("recurring-job:daily");
        assertEquals(List.of("Cron", "Queue"), List.copyOf(stored.keySet()));
        assertEquals("0 0 * * *", connection.getValueFromHash("recurring-job:daily", "Cron"));
        assertEquals(2, connection.getHashCount("recurring-job:daily"));
        assertNull(connection.getValueFromHash("recurring-job:daily", "Missing"));
    }

    @Test
    void hash_missing_returnsNull() {
        assertNull(connection.getAllEntriesFromHash("missing"));
        assertNull(connection.getHashTtl("missing"));
    }

    @Test
    void hash_removeAndExpire() {
        write(tx -> {
            tx.setRangeInHash("h", Map.of("a", "1"));
            tx.expireHash("h", Duration.ofSeconds(30));
        });
        assertEquals(Duration.ofSeconds(30), connection.getHashTtl("h"));

        write(tx -> tx.removeHash("h"));

        assertNull(connection.getAllEntriesFromHash("h"));
    }
}
