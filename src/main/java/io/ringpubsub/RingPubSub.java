package io.ringpubsub;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.broker.delivery.DeliveryListener;
import io.ringpubsub.broker.partition.Partition;
import io.ringpubsub.cluster.partitioner.impl.KeyHashSelector;
import io.ringpubsub.cluster.partitioner.impl.RegistryPartitioner;
import io.ringpubsub.config.impl.PubSubConfig;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.MessageMetadata;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.ledger.InMemoryDedupLedger;
import io.ringpubsub.registry.TopicRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link PubSub}: one topic registry, one key-hash partitioner and one dedup ledger shared by
 * all exactly-once subscriptions.
 */
@Slf4j
public final class RingPubSub implements PubSub {

    private static final long MIN_LEDGER_SWEEP_MILLIS = 1_000L;

    @Getter private final PubSubConfig config;
    @Getter private final TopicRegistry registry;
    private final RegistryPartitioner partitioner;
    private final InMemoryDedupLedger ledger;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private RingPubSub(final PubSubConfig config, final DeliveryListener listener) {
        this.config = config.validate();
        this.ledger = new InMemoryDedupLedger(config.getDedupRetentionMillis(), config.getDedupMaxEntries())
                .startSweeper(Math.max(MIN_LEDGER_SWEEP_MILLIS, config.getDedupRetentionMillis() / 10));
        this.registry = new TopicRegistry(config, ledger, listener);
        this.partitioner = new RegistryPartitioner(registry, new KeyHashSelector(), config.getPartitionsPerTopic());
    }

    public static RingPubSub create(final PubSubConfig config) {
        return create(config, DeliveryListener.logging());
    }

    public static RingPubSub create(final PubSubConfig config, final DeliveryListener listener) {
        Objects.requireNonNull(config, "config");
        final RingPubSub pubSub = new RingPubSub(config, listener);
        log.info("RingPubSub started: {}", config);
        return pubSub;
    }

    @Override
    public void publish(final String topic,
                        final byte[] key,
                        final List<Message> messages,
                        final MessageMetadata metadata) {
        Objects.requireNonNull(messages, "messages");
        ensureOpen();

        final Partition partition = partitioner.partition(topic, key);
        final byte[] orderingKey = metadata == null ? null : metadata.getOrderingKey();

        for (final Message m : messages) {
            partition.publish(m, orderingKey);
        }
    }

    @Override
    public void subscribe(final String topic,
                          final BatchConsumer handler,
                          final Map<String, String> metadata,
                          final SubscriptionOptions options,
                          final AckChannel ackChannel) {
        ensureOpen();
        registry.subscribe(topic, handler, metadata, options, ackChannel);
    }

    @Override
    public void unsubscribe(final String topic) {
        ensureOpen();
        registry.unsubscribe(topic);
    }

    @Override
    public RegistryPartitioner partitioner() {
        return partitioner;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        log.info("Shutting down RingPubSub...");
        try {
            registry.close(config.getCloseGracePeriodMillis());
        } finally {
            ledger.close();
        }
        log.info("Shutdown complete.");
    }

    private void ensureOpen() {
        if (closed.get()) throw PubSubException.partitionClosed("pub/sub");
    }
}
