package io.ringpubsub.cluster.partitioner.impl;

import io.ringpubsub.broker.partition.LocalPartition;
import io.ringpubsub.cluster.partitioner.PartitionSelector;
import io.ringpubsub.cluster.partitioner.Partitioner;
import io.ringpubsub.registry.TopicRegistry;
import lombok.Getter;

import java.util.Objects;

/**
 * {@link Partitioner} backed by a {@link TopicRegistry}: the selector picks the partition id and the
 * registry resolves it to the single live instance.
 */
public final class RegistryPartitioner implements Partitioner {

    @Getter private final TopicRegistry registry;
    private final PartitionSelector selector;
    private final int partitionsPerTopic;

    public RegistryPartitioner(final TopicRegistry registry,
                               final PartitionSelector selector,
                               final int partitionsPerTopic) {
        if (partitionsPerTopic <= 0) throw new IllegalArgumentException("partitionsPerTopic must be > 0");

        this.registry = Objects.requireNonNull(registry, "registry");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.partitionsPerTopic = partitionsPerTopic;
    }

    @Override
    public LocalPartition partition(final String topic, final byte[] key) {
        TopicRegistry.validateTopic(topic);

        final int partitionId = selector.selectPartition(key, partitionsPerTopic);
        return registry.getOrCreate(topic, partitionId);
    }

    public int partitionId(final byte[] key) {
        return selector.selectPartition(key, partitionsPerTopic);
    }

    @Override
    public void close() {
        registry.close();
    }
}
