package io.ringpubsub.broker.delivery;

import io.ringpubsub.broker.ordering.OrderingKey;
import io.ringpubsub.broker.ordering.SequencedMessage;
import io.ringpubsub.core.model.Message;
import lombok.Getter;

/**
 * One message handed to a subscriber and not yet resolved.
 */
@Getter
public final class PendingDelivery {

    public enum Status {
        /** Handed to the handler, waiting for an ack or the deadline. */
        IN_FLIGHT,
        /** Attempt failed, queued for another hand-off. */
        AWAITING_REDELIVERY
    }

    private final SequencedMessage entry;
    private final String partition;
    private final String subscriber;

    private int attempts;
    private int failures;
    private long deadline;
    private Status status;
    private Throwable lastError;

    PendingDelivery(final SequencedMessage entry, final String partition, final String subscriber) {
        this.entry = entry;
        this.partition = partition;
        this.subscriber = subscriber;
    }

    public String messageId() {
        return entry.messageId();
    }

    public Message message() {
        return entry.message();
    }

    public OrderingKey key() {
        return entry.key();
    }

    void handedOff(final long deadline) {
        this.attempts++;
        this.deadline = deadline;
        this.status = Status.IN_FLIGHT;
    }

    int failed(final Throwable error) {
        this.lastError = error;
        this.status = Status.AWAITING_REDELIVERY;
        return ++failures;
    }

    @Override
    public String toString() {
        return "PendingDelivery{" + messageId() + " on " + partition + ", attempts=" + attempts + ", status=" + status + '}';
    }
}
