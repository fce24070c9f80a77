package io.ringpubsub.ledger;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Bounded in-memory {@link DedupLedger}.
 * <p>
 * Entries are kept in success order, so expiry and capacity eviction both pop from the head. Evicting an
 * id means a later duplicate of it is treated as new: exactly-once holds only within the retention window.
 * </p>
 */
@Slf4j
public final class InMemoryDedupLedger implements DedupLedger {

    /* Extra retention on top of the longest redelivery span of a subscription. */
    static final long RETENTION_SLACK_MILLIS = 1_000L;

    private final LinkedHashMap<String, Long> succeeded = new LinkedHashMap<>();
    private final int maxEntries;
    private final LongSupplier clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Getter private volatile long retentionMillis;

    private ScheduledExecutorService sweeper;

    public InMemoryDedupLedger(final long retentionMillis, final int maxEntries) {
        this(retentionMillis, maxEntries, System::currentTimeMillis);
    }

    InMemoryDedupLedger(final long retentionMillis, final int maxEntries, final LongSupplier clock) {
        if (retentionMillis <= 0) throw new IllegalArgumentException("retentionMillis must be > 0");
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");

        this.retentionMillis = retentionMillis;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Starts a background eviction sweep at the given period.
     */
    public InMemoryDedupLedger startSweeper(final long periodMillis) {
        synchronized (this) {
            if (sweeper != null || closed.get()) return this;

            sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "dedup-ledger-sweeper");
                t.setDaemon(true);
                return t;
            });
        }
        sweeper.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        return this;
    }

    @Override
    public synchronized boolean markSucceeded(final String messageId) {
        final long now = clock.getAsLong();
        final Long at = succeeded.get(messageId);
        if (at != null) {
            if (now - at < retentionMillis) return false;
            // expired but not swept yet; re-insert at the tail
            succeeded.remove(messageId);
        }

        succeeded.put(messageId, now);

        if (succeeded.size() > maxEntries) {
            final Iterator<Map.Entry<String, Long>> it = succeeded.entrySet().iterator();
            final String evicted = it.next().getKey();
            it.remove();
            log.debug("Dedup ledger at capacity {}, evicted {}", maxEntries, evicted);
        }
        return true;
    }

    @Override
    public synchronized boolean isSucceeded(final String messageId) {
        final Long at = succeeded.get(messageId);
        return at != null && clock.getAsLong() - at < retentionMillis;
    }

    @Override
    public synchronized void ensureRetention(final long minRetentionMillis) {
        final long required = minRetentionMillis + RETENTION_SLACK_MILLIS;
        if (required > retentionMillis) {
            log.info("Raising dedup retention from {}ms to {}ms", retentionMillis, required);
            retentionMillis = required;
        }
    }

    @Override
    public synchronized int evictExpired() {
        final long cutoff = clock.getAsLong() - retentionMillis;
        int evicted = 0;

        final Iterator<Map.Entry<String, Long>> it = succeeded.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() > cutoff) break;
            it.remove();
            evicted++;
        }
        return evicted;
    }

    @Override
    public synchronized int size() {
        return succeeded.size();
    }

    private void sweep() {
        try {
            final int evicted = evictExpired();
            if (evicted > 0) log.debug("Dedup ledger evicted {} expired ids", evicted);
        } catch (final Throwable t) {
            log.error("Dedup ledger sweep failed", t);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final ScheduledExecutorService s;
        synchronized (this) {
            s = sweeper;
            succeeded.clear();
        }
        if (s != null) s.shutdownNow();
    }
}
