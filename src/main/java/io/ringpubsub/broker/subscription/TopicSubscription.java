package io.ringpubsub.broker.subscription;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.broker.partition.LocalPartition;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.model.AckMessage;
import io.ringpubsub.core.model.SubscriptionOptions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * One handler subscribed to every partition of a topic.
 * <p>
 * Each partition keeps its own in-flight table; the subscriber's single ack channel is drained by a
 * router task that hands every ack to the partition tracking that message id.
 * </p>
 */
@Slf4j
public final class TopicSubscription implements AutoCloseable {

    private static final long ROUTER_POLL_MILLIS = 50L;

    @Getter private final String topic;
    private final BatchConsumer handler;
    private final Map<String, String> metadata;
    @Getter private final SubscriptionOptions options;
    private final AckChannel ackChannel;
    private final Supplier<Collection<LocalPartition>> partitions;

    private final ExecutorService router;
    private volatile boolean active = true;

    public TopicSubscription(final String topic,
                             final BatchConsumer handler,
                             final Map<String, String> metadata,
                             final SubscriptionOptions options,
                             final AckChannel ackChannel,
                             final Supplier<Collection<LocalPartition>> partitions) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metadata = metadata == null ? Map.of() : metadata;
        this.options = Objects.requireNonNull(options, "options");
        this.ackChannel = Objects.requireNonNull(ackChannel, "ackChannel");
        this.partitions = Objects.requireNonNull(partitions, "partitions");

        this.router = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "topic-acks-" + topic);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        router.submit(this::routeLoop);
    }

    /**
     * Attaches to a partition and starts dispatching right away.
     */
    public void attach(final LocalPartition partition) {
        partition.attach(handler, metadata, options);
        partition.resume();
    }

    /**
     * Attaches without dispatching; the caller resumes the partition once the whole topic is attached.
     */
    public void attachPaused(final LocalPartition partition) {
        partition.attach(handler, metadata, options);
    }

    private void routeLoop() {
        while (active && !Thread.currentThread().isInterrupted()) {
            try {
                final AckMessage ack = ackChannel.poll(ROUTER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (ack != null && !route(ack)) {
                    log.debug("No partition of {} tracks {}; ack ignored", topic, ack.messageId());
                }
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (final Throwable t) {
                log.error("Ack routing for topic {} failed", topic, t);
            }
        }
    }

    private boolean route(final AckMessage ack) {
        for (final LocalPartition p : partitions.get()) {
            if (p.acknowledge(ack)) return true;
        }
        return false;
    }

    @Override
    public void close() {
        active = false;
        router.shutdownNow();
    }
}
