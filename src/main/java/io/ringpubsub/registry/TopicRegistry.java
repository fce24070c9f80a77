package io.ringpubsub.registry;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.broker.delivery.DeliveryListener;
import io.ringpubsub.broker.partition.LocalPartition;
import io.ringpubsub.broker.subscription.TopicSubscription;
import io.ringpubsub.config.impl.PubSubConfig;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.ledger.DedupLedger;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Arena of every live partition, keyed by topic and partition id.
 * <p>
 * Lookups are lock-free. Creation goes through a single create-or-fetch lock, so concurrent callers for the
 * same {@code (topic, partitionId)} always end up with the same instance and the partition limit is
 * enforced exactly.
 * </p>
 */
@Slf4j
public final class TopicRegistry implements AutoCloseable {

    private static final int MAX_CLOSE_THREADS = 8;

    private final ConcurrentMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final Object createLock = new Object();

    private final PubSubConfig config;
    private final DedupLedger ledger;
    private final DeliveryListener listener;

    // guarded by createLock
    private int partitionCount;
    private volatile boolean closed;

    public TopicRegistry(final PubSubConfig config, final DedupLedger ledger, final DeliveryListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.ledger = ledger;
        this.listener = listener;
    }

    /**
     * @throws PubSubException {@code INVALID_TOPIC} if the name is null or blank
     */
    public static void validateTopic(final String topic) {
        if (topic == null || topic.isBlank()) throw PubSubException.invalidTopic(topic);
    }

    public LocalPartition getOrCreate(final String topic, final int partitionId) {
        validateTopic(topic);
        if (partitionId < 0) throw new IllegalArgumentException("partitionId must be >= 0");
        if (closed) throw PubSubException.partitionClosed("registry");

        final Topic existing = topics.get(topic);
        if (existing != null) {
            final LocalPartition p = existing.partition(partitionId);
            if (p != null) return p;
        }

        synchronized (createLock) {
            if (closed) throw PubSubException.partitionClosed("registry");

            final Topic t = topics.computeIfAbsent(topic, Topic::new);
            final LocalPartition raced = t.partition(partitionId);
            if (raced != null) return raced;

            if (partitionCount >= config.getMaxPartitions()) {
                throw PubSubException.partitionLimitExceeded(config.getMaxPartitions());
            }

            final LocalPartition created = new LocalPartition(topic, partitionId, config, ledger, listener);
            t.add(created);
            partitionCount++;

            final TopicSubscription sub = t.subscription();
            if (sub != null) sub.attach(created);

            log.info("Created partition {}#{} ({} of {})", topic, partitionId, partitionCount, config.getMaxPartitions());
            return created;
        }
    }

    /**
     * Subscribes one handler to every current and future partition of {@code topic}.
     *
     * @throws PubSubException {@code ALREADY_SUBSCRIBED} if the topic or one of its partitions already has a
     *                         subscriber; nothing stays attached in that case
     */
    public void subscribe(final String topic,
                          final BatchConsumer handler,
                          final Map<String, String> metadata,
                          final SubscriptionOptions options,
                          final AckChannel ackChannel) {
        validateTopic(topic);

        synchronized (createLock) {
            if (closed) throw PubSubException.partitionClosed("registry");

            final Topic t = topics.computeIfAbsent(topic, Topic::new);
            if (t.subscription() != null) throw PubSubException.alreadySubscribed("topic " + topic);

            for (final LocalPartition p : t.partitions()) {
                if (p.isSubscribed()) throw PubSubException.alreadySubscribed(p.toString());
            }

            final TopicSubscription sub = new TopicSubscription(topic, handler, metadata, options, ackChannel, t::partitions);
            final List<LocalPartition> attached = new ArrayList<>();
            try {
                for (final LocalPartition p : t.partitions()) {
                    sub.attachPaused(p);
                    attached.add(p);
                }
            } catch (final RuntimeException e) {
                // a direct subscriber raced in; nothing was dispatched yet
                attached.forEach(LocalPartition::detachPaused);
                sub.close();
                throw e;
            }

            t.subscription(sub);
            sub.start();
            attached.forEach(LocalPartition::resume);
        }
        log.info("Subscribed to topic {}", topic);
    }

    /**
     * Detaches the topic-wide subscriber from every partition. No-op if the topic has none.
     */
    public void unsubscribe(final String topic) {
        validateTopic(topic);

        final Topic t = topics.get(topic);
        if (t == null) return;

        final TopicSubscription sub;
        final List<LocalPartition> partitions;
        synchronized (createLock) {
            sub = t.subscription();
            if (sub == null) return;
            t.subscription(null);
            partitions = new ArrayList<>(t.partitions());
        }

        // the router keeps resolving acks while partitions drain
        for (final LocalPartition p : partitions) {
            p.unsubscribe();
        }
        sub.close();
        log.info("Unsubscribed from topic {}", topic);
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    public Set<String> listTopics() {
        return Collections.unmodifiableSet(topics.keySet());
    }

    public List<LocalPartition> partitions(final String topic) {
        final Topic t = topics.get(topic);
        return t == null ? List.of() : List.copyOf(t.partitions());
    }

    public int partitionCount() {
        synchronized (createLock) {
            return partitionCount;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        close(config.getCloseGracePeriodMillis());
    }

    /**
     * Closes all partitions in parallel, each with the same grace period, then stops topic ack routers.
     */
    public void close(final long graceMillis) {
        final List<LocalPartition> all = new ArrayList<>();
        final List<TopicSubscription> subs = new ArrayList<>();

        synchronized (createLock) {
            if (closed) return;
            closed = true;

            for (final Topic t : topics.values()) {
                all.addAll(t.partitions());
                if (t.subscription() != null) subs.add(t.subscription());
            }
        }

        if (!all.isEmpty()) {
            final ExecutorService closer = Executors.newFixedThreadPool(Math.min(all.size(), MAX_CLOSE_THREADS), r -> {
                final Thread t = new Thread(r, "registry-close");
                t.setDaemon(true);
                return t;
            });
            try {
                CompletableFuture.allOf(all.stream()
                                .map(p -> CompletableFuture.runAsync(() -> p.close(graceMillis), closer))
                                .toArray(CompletableFuture[]::new))
                        .join();
            } finally {
                closer.shutdown();
            }
        }

        subs.forEach(TopicSubscription::close);
        log.info("Topic registry closed ({} partitions across {} topics)", all.size(), topics.size());
    }
}
