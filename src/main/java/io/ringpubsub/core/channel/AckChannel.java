package io.ringpubsub.core.channel;

import io.ringpubsub.core.model.AckMessage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue carrying {@link AckMessage}s from a subscriber back to the partition that
 * dispatched the messages.
 * <p>
 * Subscribers call {@link #send(AckMessage)} from any thread; exactly one resolution task polls it.
 * </p>
 */
@Slf4j
public final class AckChannel {

    private final BlockingQueue<AckMessage> queue;
    @Getter private final int capacity;
    @Getter private final OverflowPolicy overflowPolicy;
    private final AtomicLong dropped = new AtomicLong();

    public AckChannel(final int capacity, final OverflowPolicy overflowPolicy) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");

        this.capacity = capacity;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public static AckChannel blocking(final int capacity) {
        return new AckChannel(capacity, OverflowPolicy.BLOCK);
    }

    public static AckChannel dropping(final int capacity) {
        return new AckChannel(capacity, OverflowPolicy.DROP);
    }

    /**
     * Pushes an ack.
     *
     * @return {@code false} if the ack was dropped because the channel was full
     * @throws InterruptedException if interrupted while waiting under {@link OverflowPolicy#BLOCK}
     */
    public boolean send(final AckMessage ack) throws InterruptedException {
        Objects.requireNonNull(ack, "ack");

        if (overflowPolicy == OverflowPolicy.BLOCK) {
            queue.put(ack);
            return true;
        }

        if (queue.offer(ack)) return true;

        dropped.incrementAndGet();
        log.warn("Ack channel full ({}), dropping ack for {}", capacity, ack.messageId());
        return false;
    }

    /**
     * Convenience for subscribers that cannot propagate {@link InterruptedException}.
     */
    public boolean trySend(final AckMessage ack) {
        try {
            return send(ack);
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public AckMessage poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
