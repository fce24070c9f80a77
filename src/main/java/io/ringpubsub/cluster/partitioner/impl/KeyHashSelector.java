package io.ringpubsub.cluster.partitioner.impl;

import io.ringpubsub.cluster.partitioner.PartitionSelector;

import java.util.Arrays;

/**
 * {@code KeyHashSelector} routes a key to {@code floorMod(Arrays.hashCode(key), totalPartitions)}, so all
 * messages published under one key land on the same partition. A {@code null} or empty key always
 * selects partition 0.
 */
public final class KeyHashSelector implements PartitionSelector {

    @Override
    public int selectPartition(final byte[] key, final int totalPartitions) {
        if (totalPartitions <= 0) throw new IllegalArgumentException("totalPartitions must be > 0");

        final int hash = (key != null && key.length > 0)
                ? Arrays.hashCode(key)
                : 0;

        return Math.floorMod(hash, totalPartitions);
    }
}
