package io.ringpubsub;

import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.MessageMetadata;

import java.util.List;

/**
 * Publish boundary of the pub/sub core.
 */
public interface Publisher extends AutoCloseable {

    /**
     * Routes {@code messages} to the partition selected by {@code key} and appends them in list order.
     * The partition is created if it does not exist yet.
     *
     * @param metadata optional; its ordering key, if any, applies to every message of the call
     * @throws io.ringpubsub.core.error.PubSubException {@code INVALID_TOPIC}, {@code MESSAGE_TOO_LARGE},
     *                                                  {@code BACKLOG_FULL} or {@code PARTITION_CLOSED}. Messages
     *                                                  before the failing one stay published.
     */
    void publish(String topic, byte[] key, List<Message> messages, MessageMetadata metadata);

    @Override
    void close();
}
