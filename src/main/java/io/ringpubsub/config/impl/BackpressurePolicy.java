package io.ringpubsub.config.impl;

/**
 * What a publish does when the partition backlog is full.
 */
public enum BackpressurePolicy {
    /** Fail with {@code BACKLOG_FULL} right away. */
    FAIL_FAST,
    /** Wait up to {@code publishTimeoutMillis} for room, then fail with {@code BACKLOG_FULL}. */
    BLOCK
}
