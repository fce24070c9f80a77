package io.ringpubsub.registry;

import io.ringpubsub.broker.partition.LocalPartition;
import io.ringpubsub.broker.subscription.TopicSubscription;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A named stream and its partitions. The partition set only grows; writes happen under the registry's
 * create lock, reads are lock-free.
 */
public final class Topic {

    @Getter private final String name;
    private final ConcurrentNavigableMap<Integer, LocalPartition> partitions = new ConcurrentSkipListMap<>();

    // guarded by the registry's create lock
    private TopicSubscription subscription;

    Topic(final String name) {
        this.name = name;
    }

    public LocalPartition partition(final int partitionId) {
        return partitions.get(partitionId);
    }

    public Collection<LocalPartition> partitions() {
        return Collections.unmodifiableCollection(partitions.values());
    }

    public int size() {
        return partitions.size();
    }

    void add(final LocalPartition partition) {
        partitions.put(partition.id(), partition);
    }

    TopicSubscription subscription() {
        return subscription;
    }

    void subscription(final TopicSubscription subscription) {
        this.subscription = subscription;
    }
}
