package io.ringpubsub.core.channel;

/**
 * What {@link AckChannel#send} does when the channel is full.
 */
public enum OverflowPolicy {
    /** Wait for space; the sender is interruptible. */
    BLOCK,
    /** Reject the ack immediately; the delivery then resolves through its ack timeout. */
    DROP
}
