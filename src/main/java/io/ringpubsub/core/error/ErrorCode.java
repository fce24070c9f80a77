package io.ringpubsub.core.error;

/**
 * Failure codes surfaced at the publish, subscribe and lifecycle boundaries.
 */
public enum ErrorCode {
    INVALID_TOPIC(Category.VALIDATION),
    MESSAGE_TOO_LARGE(Category.VALIDATION),
    BACKLOG_FULL(Category.CAPACITY),
    PARTITION_LIMIT_EXCEEDED(Category.CAPACITY),
    PARTITION_CLOSED(Category.LIFECYCLE),
    SUBSCRIPTION_CLOSED(Category.LIFECYCLE),
    ALREADY_SUBSCRIBED(Category.LIFECYCLE),
    DELIVERY_FAILED(Category.DELIVERY);

    public enum Category {
        /** Rejected synchronously, never retried. */
        VALIDATION,
        /** Caller may back off and try again. */
        CAPACITY,
        /** Terminal for the call. */
        LIFECYCLE,
        /** Reported after the retry budget of a message is spent. */
        DELIVERY
    }

    private final Category category;

    ErrorCode(final Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /**
     * True when the caller may retry the same call later.
     */
    public boolean isRetriable() {
        return category == Category.CAPACITY;
    }
}
