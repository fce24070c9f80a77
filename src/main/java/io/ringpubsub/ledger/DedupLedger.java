package io.ringpubsub.ledger;

/**
 * Records which message ids have been processed successfully, for exactly-once subscriptions.
 * <p>
 * Implementations must be thread-safe: acks of independently redelivered attempts may race. Once an id
 * is marked successful it stays successful until evicted.
 * </p>
 */
public interface DedupLedger extends AutoCloseable {

    /**
     * Marks {@code messageId} as successfully processed.
     *
     * @return {@code true} if this call recorded the success, {@code false} if it was already recorded
     */
    boolean markSucceeded(String messageId);

    boolean isSucceeded(String messageId);

    /**
     * Makes sure entries are kept for at least {@code minRetentionMillis}.
     */
    void ensureRetention(long minRetentionMillis);

    /**
     * Drops entries older than the retention window.
     *
     * @return number of evicted entries
     */
    int evictExpired();

    int size();

    @Override
    void close();
}
