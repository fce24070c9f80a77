package io.ringpubsub.broker.delivery;

/**
 * Terminal outcome of a message, attributable to its id.
 *
 * @param attempts number of hand-offs to a handler, 0 if it was never delivered
 * @param cause    {@code null} for {@link DeliveryOutcome#ACKNOWLEDGED} and {@link DeliveryOutcome#DEDUPLICATED}
 */
public record DeliveryReport(String topic,
                             int partitionId,
                             String messageId,
                             DeliveryOutcome outcome,
                             int attempts,
                             Throwable cause) {
}
