package io.ringpubsub.broker.ordering;

import io.ringpubsub.core.model.Message;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns the publish stream of one partition into delivery batches.
 * <p>
 * Every ordering key has its own lane: a FIFO of queued messages, the sequences currently out with the
 * handler, and the failed messages waiting to go out again. When ordered completion is on, a keyed lane
 * only yields new messages after everything it handed out before has been {@link #release released}, and
 * a failed message is only handed out again once no earlier message of its key is still out. Redeliveries
 * of one key always leave in publish order. Unordered messages never wait.
 * Among ready lanes the one whose head was published first goes next, so hand-off stays in publish
 * order whenever nothing is gated.
 * </p>
 * <p>
 * Not thread-safe: the owning partition serializes all calls under its lock.
 * </p>
 */
public final class OrderingSequencer {

    private static final class Lane {
        final OrderingKey key;
        final ArrayDeque<SequencedMessage> queue = new ArrayDeque<>();
        /* handed out and waiting on the handler */
        final TreeSet<Long> active = new TreeSet<>();
        /* failed, waiting for another hand-off */
        final TreeMap<Long, SequencedMessage> retry = new TreeMap<>();
        int inFlight;

        Lane(final OrderingKey key) {
            this.key = key;
        }

        long headSequence() {
            return queue.peekFirst().sequence();
        }

        long retryHead() {
            return retry.firstKey();
        }

        /* sequences below this bound may be redelivered now */
        long retryBound(final boolean gated) {
            return gated && !active.isEmpty() ? active.first() : Long.MAX_VALUE;
        }
    }

    private final Map<OrderingKey, Lane> lanes = new HashMap<>();
    private long nextSequence;
    @Getter private int size;
    @Getter private boolean orderedCompletion = true;

    public void setOrderedCompletion(final boolean orderedCompletion) {
        this.orderedCompletion = orderedCompletion;
    }

    public SequencedMessage append(final Message message, final OrderingKey key) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(key, "key");

        final SequencedMessage entry = new SequencedMessage(nextSequence++, message, key);
        lanes.computeIfAbsent(key, Lane::new).queue.addLast(entry);
        size++;
        return entry;
    }

    public boolean hasReady() {
        for (final Lane lane : lanes.values()) {
            if (isReady(lane) || isRetryReady(lane)) return true;
        }
        return false;
    }

    /**
     * Takes the next batch of new messages and marks them in flight.
     *
     * @return consecutive same-key messages in publish order, or an empty list if no lane is ready
     */
    public List<SequencedMessage> nextBatch(final int maxBatchSize) {
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");

        Lane best = null;
        long bound = Long.MAX_VALUE;

        for (final Lane lane : lanes.values()) {
            if (!isReady(lane)) continue;

            final long head = lane.headSequence();
            if (best == null || head < best.headSequence()) {
                if (best != null) bound = Math.min(bound, best.headSequence());
                best = lane;
            } else {
                bound = Math.min(bound, head);
            }
        }

        if (best == null) return List.of();

        // stop where another ready lane's message was published in between
        final List<SequencedMessage> batch = new ArrayList<>(Math.min(maxBatchSize, best.queue.size()));
        while (batch.size() < maxBatchSize && !best.queue.isEmpty() && best.headSequence() < bound) {
            final SequencedMessage e = best.queue.pollFirst();
            best.active.add(e.sequence());
            batch.add(e);
        }

        best.inFlight += batch.size();
        size -= batch.size();
        return batch;
    }

    /**
     * Parks a failed in-flight message until its lane allows another hand-off.
     */
    public void retry(final SequencedMessage entry) {
        final Lane lane = lanes.get(entry.key());
        if (lane == null || !lane.active.remove(entry.sequence())) return;

        lane.retry.put(entry.sequence(), entry);
    }

    /**
     * Takes the next batch of redeliveries and marks them in flight again.
     *
     * @return failed messages of one key in publish order, or an empty list if none may go out yet
     */
    public List<SequencedMessage> nextRedelivery(final int maxBatchSize) {
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");

        Lane best = null;
        for (final Lane lane : lanes.values()) {
            if (!isRetryReady(lane)) continue;
            if (best == null || lane.retryHead() < best.retryHead()) best = lane;
        }

        if (best == null) return List.of();

        final long bound = best.retryBound(isGated(best));
        final List<SequencedMessage> batch = new ArrayList<>();
        while (batch.size() < maxBatchSize && !best.retry.isEmpty() && best.retryHead() < bound) {
            final SequencedMessage e = best.retry.pollFirstEntry().getValue();
            best.active.add(e.sequence());
            batch.add(e);
        }
        return batch;
    }

    /**
     * Marks one handed-out message as resolved, whether it was waiting on the handler or on redelivery.
     */
    public void release(final SequencedMessage entry) {
        final Lane lane = lanes.get(entry.key());
        if (lane == null) return;

        final boolean wasOut = lane.active.remove(entry.sequence()) | lane.retry.remove(entry.sequence()) != null;
        if (wasOut && lane.inFlight > 0) lane.inFlight--;
        prune(lane);
    }

    /**
     * Puts unresolved messages back at the front of their lanes, oldest first.
     */
    public void requeueFront(final Collection<SequencedMessage> entries) {
        final List<SequencedMessage> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingLong(SequencedMessage::sequence).reversed());

        for (final SequencedMessage e : sorted) {
            lanes.computeIfAbsent(e.key(), Lane::new).queue.addFirst(e);
            size++;
        }
    }

    /**
     * Forgets every handed-out message, used when the subscriber that held them is gone.
     */
    public void resetInFlight() {
        final Iterator<Lane> it = lanes.values().iterator();
        while (it.hasNext()) {
            final Lane lane = it.next();
            lane.inFlight = 0;
            lane.active.clear();
            lane.retry.clear();
            if (lane.queue.isEmpty()) it.remove();
        }
    }

    /**
     * Removes and returns every queued message in publish order. Handed-out messages are dropped.
     */
    public List<SequencedMessage> drainAll() {
        final List<SequencedMessage> all = new ArrayList<>(size);
        for (final Lane lane : lanes.values()) {
            all.addAll(lane.queue);
        }
        all.sort(Comparator.comparingLong(SequencedMessage::sequence));

        lanes.clear();
        size = 0;
        return all;
    }

    public int queued(final OrderingKey key) {
        final Lane lane = lanes.get(key);
        return lane == null ? 0 : lane.queue.size();
    }

    public int inFlight(final OrderingKey key) {
        final Lane lane = lanes.get(key);
        return lane == null ? 0 : lane.inFlight;
    }

    public int awaitingRedelivery(final OrderingKey key) {
        final Lane lane = lanes.get(key);
        return lane == null ? 0 : lane.retry.size();
    }

    private boolean isGated(final Lane lane) {
        return orderedCompletion && !lane.key.isUnordered();
    }

    private boolean isReady(final Lane lane) {
        if (lane.queue.isEmpty()) return false;
        return !isGated(lane) || lane.inFlight == 0;
    }

    private boolean isRetryReady(final Lane lane) {
        if (lane.retry.isEmpty()) return false;
        return lane.retryHead() < lane.retryBound(isGated(lane));
    }

    private void prune(final Lane lane) {
        if (lane.inFlight == 0 && lane.queue.isEmpty()) lanes.remove(lane.key);
    }
}
