package io.ringpubsub.core.model;

import java.util.Objects;

/**
 * Subscriber-reported outcome of processing one message. A {@code null} error means success.
 */
public record AckMessage(String messageId, Throwable error) {

    public AckMessage {
        Objects.requireNonNull(messageId, "messageId");
    }

    public static AckMessage success(final String messageId) {
        return new AckMessage(messageId, null);
    }

    public static AckMessage failure(final String messageId, final Throwable error) {
        return new AckMessage(messageId, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
