package io.ringpubsub.broker.ordering;

import io.ringpubsub.core.model.Message;

/**
 * A published message stamped with its partition-local publish sequence.
 */
public record SequencedMessage(long sequence, Message message, OrderingKey key) {

    public String messageId() {
        return message.getMessageId();
    }
}
