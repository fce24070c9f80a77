package io.ringpubsub;

import io.ringpubsub.cluster.partitioner.Partitioner;

/**
 * A partitioned pub/sub system: publish and subscribe by topic, or work on single partitions through the
 * {@link #partitioner()}.
 */
public interface PubSub extends Publisher, Subscriber {

    Partitioner partitioner();

    /**
     * Closes every partition, waiting up to the configured grace period for in-flight deliveries.
     * Idempotent.
     */
    @Override
    void close();
}
