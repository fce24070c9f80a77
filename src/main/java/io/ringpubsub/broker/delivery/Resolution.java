package io.ringpubsub.broker.delivery;

/**
 * What the {@link AckTracker} decided for one ack or expiry.
 */
public record Resolution(Kind kind, PendingDelivery delivery, Throwable cause) {

    public enum Kind {
        ACKNOWLEDGED,
        DEDUPLICATED,
        REDELIVER,
        FAILED,
        /** Unknown, late or duplicate ack: nothing changes. */
        IGNORED
    }

    static final Resolution IGNORED = new Resolution(Kind.IGNORED, null, null);

    /** True when the delivery left tracking and its ordering key slot is free again. */
    public boolean isTerminal() {
        return kind == Kind.ACKNOWLEDGED || kind == Kind.DEDUPLICATED || kind == Kind.FAILED;
    }
}
