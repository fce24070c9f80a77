package io.ringpubsub.core.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Optional publish-side attributes. Absent fields fall back to generated or partition defaults.
 */
@Getter
@Builder
public final class MessageMetadata {

    private static final MessageMetadata EMPTY = MessageMetadata.builder().build();

    /** Explicit id, used for idempotent republishing; a random id is generated when absent. */
    private final String messageId;
    private final String contentType;
    private final String correlationId;

    /**
     * Ordering key applied by the facade publish path; {@code null} means the partition's current
     * ordering key, an empty array means unordered.
     */
    private final byte[] orderingKey;

    public static MessageMetadata empty() {
        return EMPTY;
    }

    public Message toMessage(final byte[] value) {
        return Message.builder()
                .messageId(messageId)
                .contentType(contentType)
                .correlationId(correlationId)
                .value(value)
                .build();
    }
}
