package io.ringpubsub;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.model.SubscriptionOptions;

import java.util.Map;

/**
 * Subscribe boundary of the pub/sub core.
 */
public interface Subscriber extends AutoCloseable {

    /**
     * Registers {@code handler} for every partition of {@code topic}, including partitions created later.
     * The caller pushes one {@link io.ringpubsub.core.model.AckMessage} per delivered message on
     * {@code ackChannel}.
     *
     * @throws io.ringpubsub.core.error.PubSubException {@code INVALID_TOPIC} or {@code ALREADY_SUBSCRIBED}
     */
    void subscribe(String topic,
                   BatchConsumer handler,
                   Map<String, String> metadata,
                   SubscriptionOptions options,
                   AckChannel ackChannel);

    /**
     * Stops delivery for {@code topic} once in-flight deliveries have drained.
     */
    void unsubscribe(String topic);

    @Override
    void close();
}
