package io.ringpubsub.core.model;

/**
 * Delivery contract of a subscription, fixed for its lifetime.
 */
public enum DeliveryGuarantee {
    /**
     * Every message is delivered until acknowledged or the retry budget runs out. Duplicates are
     * tolerated, and messages of one ordering key complete in order.
     */
    AT_LEAST_ONCE(true),

    /**
     * Like {@link #AT_LEAST_ONCE}, but a message id is acknowledged successfully at most once within
     * the dedup ledger's retention window.
     */
    EXACTLY_ONCE(true),

    /**
     * Failed deliveries are retried up to the budget, but a pending redelivery is dropped as soon as
     * any attempt succeeds. Batches of one ordering key are handed off in FIFO order without waiting
     * for the previous batch to complete.
     */
    AT_MOST_ONCE_WITH_RETRY(false);

    private final boolean orderedCompletion;

    DeliveryGuarantee(final boolean orderedCompletion) {
        this.orderedCompletion = orderedCompletion;
    }

    /**
     * Whether a batch of an ordering key must be resolved before the next batch of that key is dispatched.
     */
    public boolean requiresOrderedCompletion() {
        return orderedCompletion;
    }
}
