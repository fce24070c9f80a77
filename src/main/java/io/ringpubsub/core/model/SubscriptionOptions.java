package io.ringpubsub.core.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-subscription delivery settings.
 */
@Getter
@ToString
public final class SubscriptionOptions {

    /**
     * Largest payload accepted by publishes while this subscription is active; 0 falls back to the
     * partition's configured {@code defaultMaxMessageSize}.
     */
    private final int maxMessageSize;

    /** Milliseconds after dispatch before an unacknowledged delivery is considered lost. */
    private final long ackTimeoutMillis;

    private final DeliveryGuarantee deliveryGuarantee;

    /** Upper bound on redelivery attempts after the first delivery. */
    private final int maxRetries;

    @Builder
    private SubscriptionOptions(final int maxMessageSize,
                                final Long ackTimeoutMillis,
                                final DeliveryGuarantee deliveryGuarantee,
                                final Integer maxRetries) {
        this.maxMessageSize = maxMessageSize;
        this.ackTimeoutMillis = ackTimeoutMillis != null ? ackTimeoutMillis : 30_000L;
        this.deliveryGuarantee = deliveryGuarantee != null ? deliveryGuarantee : DeliveryGuarantee.AT_LEAST_ONCE;
        this.maxRetries = maxRetries != null ? maxRetries : 3;

        if (maxMessageSize < 0) throw new IllegalArgumentException("maxMessageSize must be >= 0");
        if (this.ackTimeoutMillis <= 0) throw new IllegalArgumentException("ackTimeoutMillis must be > 0");
        if (this.maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    }

    public static SubscriptionOptions defaults() {
        return builder().build();
    }

    /**
     * Longest span over which one message can still be redelivered.
     */
    public long maxRedeliverySpanMillis() {
        return ackTimeoutMillis * (maxRetries + 1L);
    }
}
