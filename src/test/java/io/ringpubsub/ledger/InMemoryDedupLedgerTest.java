package io.ringpubsub.ledger;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDedupLedgerTest {

    @Test
    void firstSuccessWinsWithinRetention() {
        final AtomicLong clock = new AtomicLong();
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(1_000L, 10, clock::get)) {
            assertTrue(ledger.markSucceeded("m1"));
            assertFalse(ledger.markSucceeded("m1"));
            assertTrue(ledger.isSucceeded("m1"));
            assertFalse(ledger.isSucceeded("m2"));
            assertEquals(1, ledger.size());
        }
    }

    @Test
    void expiredEntriesAreForgotten() {
        final AtomicLong clock = new AtomicLong();
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(1_000L, 10, clock::get)) {
            ledger.markSucceeded("m1");
            clock.set(500L);
            ledger.markSucceeded("m2");

            clock.set(1_000L);
            assertFalse(ledger.isSucceeded("m1"));
            assertTrue(ledger.isSucceeded("m2"));

            assertEquals(1, ledger.evictExpired());
            assertEquals(1, ledger.size());
        }
    }

    @Test
    void expiredButUnsweptIdCanSucceedAgain() {
        final AtomicLong clock = new AtomicLong();
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(1_000L, 10, clock::get)) {
            ledger.markSucceeded("m1");
            clock.set(2_000L);

            assertTrue(ledger.markSucceeded("m1"));
            assertTrue(ledger.isSucceeded("m1"));
        }
    }

    @Test
    void oldestEntryIsEvictedAtCapacity() {
        final AtomicLong clock = new AtomicLong();
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(60_000L, 2, clock::get)) {
            ledger.markSucceeded("m1");
            ledger.markSucceeded("m2");
            ledger.markSucceeded("m3");

            assertEquals(2, ledger.size());
            assertFalse(ledger.isSucceeded("m1"));
            assertTrue(ledger.isSucceeded("m3"));
        }
    }

    @Test
    void retentionOnlyGrows() {
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(10_000L, 10)) {
            ledger.ensureRetention(1_000L);
            assertEquals(10_000L, ledger.getRetentionMillis());

            ledger.ensureRetention(30_000L);
            assertEquals(30_000L + InMemoryDedupLedger.RETENTION_SLACK_MILLIS, ledger.getRetentionMillis());
        }
    }

    @Test
    void sweeperEvictsInBackground() throws Exception {
        try (final InMemoryDedupLedger ledger = new InMemoryDedupLedger(20L, 10).startSweeper(5L)) {
            ledger.markSucceeded("m1");

            final long deadline = System.currentTimeMillis() + 2_000L;
            while (ledger.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(0, ledger.size());
        }
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryDedupLedger(0L, 10));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryDedupLedger(10L, 0));
    }
}
