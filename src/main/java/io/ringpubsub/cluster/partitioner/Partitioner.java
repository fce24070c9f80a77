package io.ringpubsub.cluster.partitioner;

import io.ringpubsub.broker.partition.Partition;

/**
 * Maps {@code (topic, key)} to the partition that owns it, creating the partition on first use.
 */
public interface Partitioner extends AutoCloseable {

    /**
     * Idempotent lookup-or-create. Concurrent callers for the same key always get the same instance.
     *
     * @throws io.ringpubsub.core.error.PubSubException {@code INVALID_TOPIC} for a null or blank topic,
     *                                                  {@code PARTITION_LIMIT_EXCEEDED} when a new partition
     *                                                  would exceed the configured maximum,
     *                                                  {@code PARTITION_CLOSED} once closed
     */
    Partition partition(String topic, byte[] key);

    /**
     * Closes every partition created through this partitioner.
     */
    @Override
    void close();
}
