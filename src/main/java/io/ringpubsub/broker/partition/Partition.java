package io.ringpubsub.broker.partition;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.MessageMetadata;
import io.ringpubsub.core.model.SubscriptionOptions;

import java.util.Map;

/**
 * One ordered, independently scheduled shard of a topic.
 * <p>
 * Failures are reported as {@link io.ringpubsub.core.error.PubSubException}s. Every operation on a closed
 * partition fails with {@code PARTITION_CLOSED}.
 * </p>
 */
public interface Partition extends AutoCloseable {

    String topic();

    int id();

    /**
     * Registers the single active handler of this partition and starts resolving acks from
     * {@code ackChannel}.
     *
     * @param metadata free-form subscriber attributes (address, connection id); may be empty
     * @throws io.ringpubsub.core.error.PubSubException {@code ALREADY_SUBSCRIBED} if a handler is active
     */
    void subscribe(BatchConsumer handler,
                   Map<String, String> metadata,
                   SubscriptionOptions options,
                   AckChannel ackChannel);

    /**
     * Detaches the current handler once its in-flight deliveries are acknowledged or timed out.
     * Deliveries still unresolved go back to the front of the backlog. No-op without a subscriber.
     */
    void unsubscribe();

    /**
     * Publishes a payload.
     *
     * @param orderingKey {@code null} to use the key set by {@link #setOrderingKey(byte[])}, empty for unordered
     * @throws io.ringpubsub.core.error.PubSubException {@code MESSAGE_TOO_LARGE}, {@code BACKLOG_FULL}
     *                                                  or {@code PARTITION_CLOSED}
     */
    void publish(byte[] value, MessageMetadata metadata, byte[] orderingKey);

    /**
     * Publishes an already built message, keeping its id.
     */
    void publish(Message message, byte[] orderingKey);

    /**
     * Sets the ordering key for later publishes that pass no key. Already buffered messages keep theirs.
     */
    void setOrderingKey(byte[] orderingKey);

    PartitionState state();

    /** Messages waiting for their first hand-off. */
    int backlog();

    /** Deliveries handed to the handler and not yet resolved. */
    int inFlight();

    /**
     * Drains in-flight deliveries for up to the configured grace period, then releases everything still
     * pending. Idempotent.
     */
    @Override
    void close();
}
