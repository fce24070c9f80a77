package io.ringpubsub.cluster.partitioner;

/**
 * Deterministic mapping from a publish key to a partition id within a topic.
 * <p>
 * Implementations must be pure: the same key and partition count always yield the same id, otherwise
 * messages of one key would be spread over several partitions and lose their ordering.
 * </p>
 */
public interface PartitionSelector {
    /**
     * @param key             the publish key (may be empty or null)
     * @param totalPartitions partitions per topic
     * @return the partition id in the range [0..totalPartitions)
     */
    int selectPartition(byte[] key, int totalPartitions);
}
