package io.ringpubsub.broker.partition;

import io.ringpubsub.broker.delivery.AckTracker;
import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.broker.delivery.DeliveryListener;
import io.ringpubsub.broker.delivery.DeliveryOutcome;
import io.ringpubsub.broker.delivery.DeliveryReport;
import io.ringpubsub.broker.delivery.PendingDelivery;
import io.ringpubsub.broker.delivery.Resolution;
import io.ringpubsub.broker.ordering.OrderingKey;
import io.ringpubsub.broker.ordering.OrderingSequencer;
import io.ringpubsub.broker.ordering.SequencedMessage;
import io.ringpubsub.config.impl.BackpressurePolicy;
import io.ringpubsub.config.impl.PubSubConfig;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.error.ErrorCode;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.AckMessage;
import io.ringpubsub.core.model.DeliveryGuarantee;
import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.MessageMetadata;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.ledger.DedupLedger;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link Partition}.
 * <p>
 * The backlog, the in-flight table and the state are guarded by one lock and mutated only by the publish
 * path, the dispatcher thread and ack resolution. The handler runs on the dispatcher thread outside the
 * lock, so a slow handler delays delivery but never publishes. Acks are resolved by a dedicated task per
 * subscription, and a scheduled sweep expires deliveries that were never acknowledged.
 * </p>
 */
@Slf4j
public final class LocalPartition implements Partition {

    private static final long RESOLVER_POLL_MILLIS = 50L;

    private final String topic;
    private final int id;
    private final String label;
    private final PubSubConfig config;
    private final DedupLedger ledger;
    private final DeliveryListener listener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition work = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition settled = lock.newCondition();

    private final OrderingSequencer sequencer = new OrderingSequencer();

    private final ExecutorService dispatcher;
    private final ExecutorService resolver;
    private final ScheduledExecutorService sweeper;

    private volatile PartitionState state = PartitionState.OPEN;
    private boolean closing;
    private OrderingKey defaultKey = OrderingKey.UNORDERED;
    private Subscription subscription;

    /**
     * The handler and its tracker. Replaced as a whole on resubscribe.
     */
    private static final class Subscription {
        final String subscriberId;
        final BatchConsumer handler;
        final Map<String, String> metadata;
        final SubscriptionOptions options;
        final AckTracker tracker;

        volatile boolean active = true;
        // guarded by the partition lock; a paused subscription receives nothing
        boolean paused;
        Future<?> resolverTask;
        ScheduledFuture<?> sweepTask;

        Subscription(final String subscriberId,
                     final BatchConsumer handler,
                     final Map<String, String> metadata,
                     final SubscriptionOptions options,
                     final AckTracker tracker) {
            this.subscriberId = subscriberId;
            this.handler = handler;
            this.metadata = metadata;
            this.options = options;
            this.tracker = tracker;
        }

        void stop() {
            active = false;
            if (resolverTask != null) resolverTask.cancel(true);
            if (sweepTask != null) sweepTask.cancel(false);
        }
    }

    private record Handoff(Subscription subscription, List<Message> batch, List<DeliveryReport> reports) {
    }

    public LocalPartition(final String topic,
                          final int id,
                          final PubSubConfig config,
                          final DedupLedger ledger,
                          final DeliveryListener listener) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.id = id;
        this.label = topic + "#" + id;
        this.config = Objects.requireNonNull(config, "config");
        this.ledger = ledger;
        this.listener = listener != null ? listener : DeliveryListener.logging();

        this.dispatcher = Executors.newSingleThreadExecutor(daemon("partition-dispatch-" + label));
        this.resolver = Executors.newSingleThreadExecutor(daemon("partition-acks-" + label));
        this.sweeper = Executors.newSingleThreadScheduledExecutor(daemon("partition-sweep-" + label));

        dispatcher.submit(this::dispatchLoop);
    }

    private static ThreadFactory daemon(final String name) {
        return r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public PartitionState state() {
        return state;
    }

    // ---------- Subscribe path ----------

    @Override
    public void subscribe(final BatchConsumer handler,
                          final Map<String, String> metadata,
                          final SubscriptionOptions options,
                          final AckChannel ackChannel) {
        Objects.requireNonNull(ackChannel, "ackChannel");

        lock.lock();
        try {
            final Subscription sub = attachLocked(handler, metadata, options);
            sub.resolverTask = resolver.submit(() -> resolverLoop(sub, ackChannel));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a handler whose acks are fed through {@link #acknowledge(AckMessage)} by the caller
     * instead of a dedicated channel. Used for topic-wide subscriptions sharing one ack channel.
     * <p>
     * The handler starts paused: nothing is dispatched until {@link #resume()}, and
     * {@link #detachPaused()} can still take it back without a drain.
     * </p>
     */
    public void attach(final BatchConsumer handler,
                       final Map<String, String> metadata,
                       final SubscriptionOptions options) {
        lock.lock();
        try {
            attachLocked(handler, metadata, options).paused = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts dispatching to a handler registered with {@link #attach}.
     */
    public void resume() {
        lock.lock();
        try {
            final Subscription sub = subscription;
            if (sub == null || !sub.paused) return;

            sub.paused = false;
            work.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a handler that is still paused. Nothing was handed to it, so there is nothing to drain.
     *
     * @return {@code false} if there was no paused handler to remove
     */
    public boolean detachPaused() {
        final Subscription sub;

        lock.lock();
        try {
            sub = subscription;
            if (sub == null || !sub.paused) return false;

            subscription = null;
        } finally {
            lock.unlock();
        }

        sub.stop();
        log.info("Subscriber {} detached from {} before dispatch started", sub.subscriberId, label);
        return true;
    }

    private Subscription attachLocked(final BatchConsumer handler,
                                      final Map<String, String> metadata,
                                      final SubscriptionOptions options) {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(options, "options");

        ensureOpen();
        if (subscription != null) throw PubSubException.alreadySubscribed(label);

        if (options.getDeliveryGuarantee() == DeliveryGuarantee.EXACTLY_ONCE) {
            if (ledger == null) throw new IllegalStateException("no dedup ledger configured for " + label);
            ledger.ensureRetention(options.maxRedeliverySpanMillis());
        }

        final Map<String, String> meta = metadata == null ? Map.of() : Map.copyOf(metadata);
        final String subscriberId = meta.getOrDefault("subscriberId", UUID.randomUUID().toString());

        final Subscription sub = new Subscription(subscriberId, handler, meta, options,
                new AckTracker(options, ledger, label, subscriberId));

        final long period = Math.min(config.getAckSweepIntervalMillis(), Math.max(1L, options.getAckTimeoutMillis() / 4));
        sub.sweepTask = sweeper.scheduleAtFixedRate(() -> sweep(sub), period, period, TimeUnit.MILLISECONDS);

        sequencer.setOrderedCompletion(options.getDeliveryGuarantee().requiresOrderedCompletion());
        subscription = sub;
        work.signalAll();

        log.info("Subscriber {} attached to {} ({}, ackTimeout={}ms, maxRetries={})",
                subscriberId, label, options.getDeliveryGuarantee(), options.getAckTimeoutMillis(), options.getMaxRetries());
        return sub;
    }

    @Override
    public void unsubscribe() {
        final Subscription sub;

        lock.lock();
        try {
            if (state == PartitionState.CLOSED) throw PubSubException.partitionClosed(label);

            sub = subscription;
            if (sub == null || state == PartitionState.DRAINING) return;

            state = PartitionState.DRAINING;
            wakeAll();
            log.info("Draining {} before detaching subscriber {}", label, sub.subscriberId);

            awaitSettled(sub, config.getDrainTimeoutMillis());

            // a concurrent close() took over the partition
            if (closing || subscription != sub) return;

            final List<SequencedMessage> unresolved = new ArrayList<>();
            for (final PendingDelivery d : sub.tracker.drain()) {
                unresolved.add(d.getEntry());
            }
            sequencer.resetInFlight();
            sequencer.requeueFront(unresolved);

            subscription = null;
            sub.stop();
            state = PartitionState.OPEN;
            wakeAll();

            log.info("Subscriber {} detached from {}; {} unresolved deliveries requeued",
                    sub.subscriberId, label, unresolved.size());
        } finally {
            lock.unlock();
        }
    }

    // ---------- Publish path ----------

    @Override
    public void publish(final byte[] value, final MessageMetadata metadata, final byte[] orderingKey) {
        Objects.requireNonNull(value, "value");
        final MessageMetadata meta = metadata != null ? metadata : MessageMetadata.empty();

        publish(meta.toMessage(value), orderingKey);
    }

    @Override
    public void publish(final Message message, final byte[] orderingKey) {
        Objects.requireNonNull(message, "message");

        lock.lock();
        try {
            ensureOpen();

            final int limit = maxMessageSize();
            if (limit > 0 && message.size() > limit) throw PubSubException.messageTooLarge(message.size(), limit);

            awaitBacklogRoom();

            final OrderingKey key = orderingKey == null ? defaultKey : OrderingKey.of(orderingKey);
            sequencer.append(message, key);
            work.signal();
        } finally {
            lock.unlock();
        }
    }

    private int maxMessageSize() {
        final Subscription sub = subscription;
        if (sub != null && sub.options.getMaxMessageSize() > 0) return sub.options.getMaxMessageSize();
        return config.getDefaultMaxMessageSize();
    }

    private void awaitBacklogRoom() {
        final int capacity = config.getBacklogCapacity();
        if (sequencer.getSize() < capacity) return;

        if (config.getBackpressure() == BackpressurePolicy.FAIL_FAST) throw PubSubException.backlogFull(label, capacity);

        long remaining = TimeUnit.MILLISECONDS.toNanos(config.getPublishTimeoutMillis());
        try {
            while (sequencer.getSize() >= capacity) {
                if (remaining <= 0L) throw PubSubException.backlogFull(label, capacity);
                remaining = notFull.awaitNanos(remaining);
                ensureOpen();
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PubSubException(ErrorCode.BACKLOG_FULL, "interrupted while waiting for backlog room on " + label, ie);
        }
    }

    @Override
    public void setOrderingKey(final byte[] orderingKey) {
        lock.lock();
        try {
            if (state == PartitionState.CLOSED) throw PubSubException.partitionClosed(label);
            defaultKey = OrderingKey.of(orderingKey);
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (state != PartitionState.OPEN) throw PubSubException.partitionClosed(label);
    }

    // ---------- Dispatch ----------

    private void dispatchLoop() {
        for (; ; ) {
            final Handoff handoff;

            lock.lock();
            try {
                while (state != PartitionState.CLOSED && !canDispatch()) {
                    work.await();
                }
                if (state == PartitionState.CLOSED) return;

                handoff = nextHandoff();
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (final Throwable t) {
                log.error("Dispatcher of {} failed to prepare a batch", label, t);
                continue;
            } finally {
                lock.unlock();
            }

            emit(handoff.reports());
            if (!handoff.batch().isEmpty()) deliver(handoff);
        }
    }

    private boolean canDispatch() {
        return state == PartitionState.OPEN
                && subscription != null
                && !subscription.paused
                && sequencer.hasReady();
    }

    private Handoff nextHandoff() {
        final Subscription sub = subscription;
        final AckTracker tracker = sub.tracker;
        final long now = System.currentTimeMillis();
        final int max = config.getMaxBatchSize();

        final List<Message> batch = new ArrayList<>();
        final List<DeliveryReport> reports = new ArrayList<>(0);

        final List<SequencedMessage> retries = sequencer.nextRedelivery(max);
        if (!retries.isEmpty()) {
            for (final SequencedMessage e : retries) {
                final PendingDelivery d = tracker.awaitingRedelivery(e.messageId());
                if (d == null) {
                    sequencer.release(e);
                    continue;
                }
                tracker.redispatch(d, now);
                batch.add(e.message());
            }
            return new Handoff(sub, batch, reports);
        }

        for (final SequencedMessage e : sequencer.nextBatch(max)) {
            // same id already out with the handler, or already succeeded under exactly-once
            if (tracker.isDuplicate(e.messageId()) || tracker.isTracked(e.messageId())) {
                sequencer.release(e);
                reports.add(report(e.messageId(), DeliveryOutcome.DEDUPLICATED, 0, null));
                continue;
            }
            tracker.dispatch(e, now);
            batch.add(e.message());
        }
        notFull.signalAll();

        return new Handoff(sub, batch, reports);
    }

    private void deliver(final Handoff handoff) {
        final Subscription sub = handoff.subscription();
        final List<Message> batch = Collections.unmodifiableList(handoff.batch());

        try {
            sub.handler.deliver(batch);
        } catch (final RuntimeException e) {
            log.warn("Handler of {} threw on a batch of {}; counting it as a failed attempt", label, batch.size(), e);
            for (final Message m : batch) {
                resolve(sub, AckMessage.failure(m.getMessageId(), e));
            }
        }
    }

    // ---------- Ack resolution ----------

    /**
     * Resolves an ack against the current subscription.
     *
     * @return {@code true} if the ack matched a tracked delivery of this partition
     */
    public boolean acknowledge(final AckMessage ack) {
        Objects.requireNonNull(ack, "ack");

        final Subscription sub;
        lock.lock();
        try {
            sub = subscription;
        } finally {
            lock.unlock();
        }
        return sub != null && resolve(sub, ack);
    }

    private boolean resolve(final Subscription sub, final AckMessage ack) {
        final List<DeliveryReport> reports = new ArrayList<>(1);
        final boolean matched;

        lock.lock();
        try {
            if (subscription != sub) return false;

            final Resolution r = sub.tracker.onAck(ack);
            matched = r.kind() != Resolution.Kind.IGNORED;
            apply(r, reports);
        } finally {
            lock.unlock();
        }

        emit(reports);
        return matched;
    }

    private void resolverLoop(final Subscription sub, final AckChannel channel) {
        while (sub.active && !Thread.currentThread().isInterrupted()) {
            try {
                final AckMessage ack = channel.poll(RESOLVER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (ack != null && !resolve(sub, ack)) {
                    log.debug("Ignored ack for {} on {}", ack.messageId(), label);
                }
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (final Throwable t) {
                log.error("Ack resolution on {} failed", label, t);
            }
        }
    }

    private void sweep(final Subscription sub) {
        final List<DeliveryReport> reports = new ArrayList<>(0);

        lock.lock();
        try {
            if (subscription != sub) return;

            for (final Resolution r : sub.tracker.expire(System.currentTimeMillis())) {
                apply(r, reports);
            }
        } catch (final Throwable t) {
            log.error("Ack timeout sweep on {} failed", label, t);
        } finally {
            lock.unlock();
        }

        emit(reports);
    }

    /* Caller holds the lock. */
    private void apply(final Resolution r, final List<DeliveryReport> reports) {
        final PendingDelivery d = r.delivery();

        switch (r.kind()) {
            case ACKNOWLEDGED -> reports.add(report(d.messageId(), DeliveryOutcome.ACKNOWLEDGED, d.getAttempts(), null));
            case DEDUPLICATED -> reports.add(report(d.messageId(), DeliveryOutcome.DEDUPLICATED, d.getAttempts(), null));
            case FAILED -> reports.add(report(d.messageId(), DeliveryOutcome.FAILED, d.getAttempts(), r.cause()));
            case REDELIVER -> sequencer.retry(d.getEntry());
            case IGNORED -> {
                return;
            }
        }

        if (r.isTerminal()) sequencer.release(d.getEntry());
        work.signalAll();
        settled.signalAll();
    }

    // ---------- Lifecycle ----------

    @Override
    public void close() {
        close(config.getCloseGracePeriodMillis());
    }

    /**
     * Closes with an explicit grace period for in-flight deliveries.
     */
    public void close(final long graceMillis) {
        final Subscription sub;
        final List<DeliveryReport> reports = new ArrayList<>();

        lock.lock();
        try {
            if (state == PartitionState.CLOSED || closing) return;

            closing = true;
            state = PartitionState.DRAINING;
            wakeAll();

            sub = subscription;
            if (sub != null) {
                awaitSettled(sub, graceMillis);

                for (final PendingDelivery d : sub.tracker.drain()) {
                    reports.add(report(d.messageId(), DeliveryOutcome.CLOSED, d.getAttempts(),
                            PubSubException.subscriptionClosed(label)));
                }
            }

            for (final SequencedMessage e : sequencer.drainAll()) {
                reports.add(report(e.messageId(), DeliveryOutcome.CLOSED, 0, PubSubException.partitionClosed(label)));
            }

            subscription = null;
            state = PartitionState.CLOSED;
            wakeAll();
        } finally {
            lock.unlock();
        }

        if (sub != null) sub.stop();
        dispatcher.shutdownNow();
        resolver.shutdownNow();
        sweeper.shutdownNow();

        emit(reports);
        log.info("Closed {} ({} messages released)", label, reports.size());
    }

    /* Caller holds the lock. */
    private void awaitSettled(final Subscription sub, final long timeoutMillis) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try {
            while (subscription == sub && sub.tracker.inFlight() > 0 && remaining > 0L) {
                remaining = settled.awaitNanos(remaining);
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }

        if (sub.tracker.inFlight() > 0) {
            log.warn("{} still has {} in-flight deliveries after {}ms", label, sub.tracker.inFlight(), timeoutMillis);
        }
    }

    private void wakeAll() {
        work.signalAll();
        notFull.signalAll();
        settled.signalAll();
    }

    // ---------- Introspection ----------

    @Override
    public int backlog() {
        lock.lock();
        try {
            return sequencer.getSize();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int inFlight() {
        lock.lock();
        try {
            return subscription == null ? 0 : subscription.tracker.inFlight();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSubscribed() {
        lock.lock();
        try {
            return subscription != null;
        } finally {
            lock.unlock();
        }
    }

    // ---------- Reporting ----------

    private DeliveryReport report(final String messageId,
                                  final DeliveryOutcome outcome,
                                  final int attempts,
                                  final Throwable cause) {
        return new DeliveryReport(topic, id, messageId, outcome, attempts, cause);
    }

    private void emit(final List<DeliveryReport> reports) {
        for (final DeliveryReport r : reports) {
            try {
                listener.onReport(r);
            } catch (final RuntimeException e) {
                log.warn("Delivery listener threw on {} for {}", r.outcome(), r.messageId(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "LocalPartition{" + label + ", state=" + state + '}';
    }
}
