package io.ringpubsub.broker.delivery;

/**
 * Terminal outcome of one tracked message.
 */
public enum DeliveryOutcome {
    ACKNOWLEDGED,
    /** Already processed successfully according to the dedup ledger; not counted again. */
    DEDUPLICATED,
    /** Retry budget spent; carries a {@code DELIVERY_FAILED} error. */
    FAILED,
    /** Partition or subscription closed before the message was resolved. */
    CLOSED
}
