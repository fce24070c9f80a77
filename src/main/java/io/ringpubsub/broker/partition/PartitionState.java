package io.ringpubsub.broker.partition;

/**
 * Lifecycle of a partition: {@code OPEN -> DRAINING -> CLOSED}. An unsubscribe drain returns to
 * {@code OPEN}; a close drain ends in {@code CLOSED}.
 */
public enum PartitionState {
    /** Accepts publishes and subscriptions. */
    OPEN,
    /** Rejects publishes while in-flight deliveries finish or time out. */
    DRAINING,
    /** Terminal. */
    CLOSED
}
