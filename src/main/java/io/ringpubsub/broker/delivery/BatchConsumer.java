package io.ringpubsub.broker.delivery;

import io.ringpubsub.core.model.Message;

import java.util.List;

/**
 * Subscriber callback receiving one ordered batch per call.
 * <p>
 * Runs on the partition's dispatcher thread. Acknowledgments go back through the subscription's
 * {@link io.ringpubsub.core.channel.AckChannel}, not through the return value. A thrown exception counts
 * as a failed attempt for every message in the batch.
 * </p>
 */
@FunctionalInterface
public interface BatchConsumer {
    void deliver(List<Message> batch);
}
