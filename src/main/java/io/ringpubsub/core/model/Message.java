package io.ringpubsub.core.model;

import lombok.Getter;

import java.util.Objects;
import java.util.UUID;

/**
 * An immutable pub/sub message.
 * <p>
 * Identity is the {@link #getMessageId() message id}: two instances carrying the same id are the
 * same logical message, no matter how many times it has been redelivered.
 * </p>
 */
@Getter
public final class Message {

    private final String messageId;
    private final long timestamp;
    private final String contentType;
    private final String correlationId;

    private final byte[] value;

    private Message(final String messageId,
                    final byte[] value,
                    final long timestamp,
                    final String contentType,
                    final String correlationId) {
        if (messageId == null || messageId.isEmpty()) throw new IllegalArgumentException("messageId must not be empty");

        this.messageId = messageId;
        this.value = Objects.requireNonNull(value, "value").clone();
        this.timestamp = timestamp;
        this.contentType = contentType;
        this.correlationId = correlationId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a message with a random id and the current time as timestamp.
     */
    public static Message of(final byte[] value) {
        return builder().value(value).build();
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] getValue() {
        return value.clone();
    }

    public int size() {
        return value.length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        return messageId.equals(((Message) o).messageId);
    }

    @Override
    public int hashCode() {
        return messageId.hashCode();
    }

    @Override
    public String toString() {
        return "Message{id=" + messageId + ", bytes=" + value.length + ", contentType=" + contentType + '}';
    }

    public static final class Builder {
        private String messageId;
        private byte[] value = new byte[0];
        private long timestamp = -1L;
        private String contentType;
        private String correlationId;

        public Builder messageId(final String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder value(final byte[] value) {
            this.value = value;
            return this;
        }

        public Builder timestamp(final long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder contentType(final String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder correlationId(final String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Message build() {
            final String id = messageId != null ? messageId : UUID.randomUUID().toString();
            final long ts = timestamp >= 0 ? timestamp : System.currentTimeMillis();
            return new Message(id, value, ts, contentType, correlationId);
        }
    }
}
