package io.ringpubsub.core.error;

import lombok.Getter;

/**
 * Unchecked failure of a pub/sub boundary call or delivery, tagged with an {@link ErrorCode}.
 */
@Getter
public final class PubSubException extends RuntimeException {

    private final ErrorCode code;

    public PubSubException(final ErrorCode code, final String message) {
        super(message);
        this.code = code;
    }

    public PubSubException(final ErrorCode code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static PubSubException invalidTopic(final String topic) {
        return new PubSubException(ErrorCode.INVALID_TOPIC, "invalid topic: '" + topic + "'");
    }

    public static PubSubException messageTooLarge(final int size, final int limit) {
        return new PubSubException(ErrorCode.MESSAGE_TOO_LARGE, "message of " + size + " bytes exceeds limit " + limit);
    }

    public static PubSubException backlogFull(final String partition, final int capacity) {
        return new PubSubException(ErrorCode.BACKLOG_FULL, "backlog of " + partition + " is full (" + capacity + ")");
    }

    public static PubSubException partitionLimitExceeded(final int limit) {
        return new PubSubException(ErrorCode.PARTITION_LIMIT_EXCEEDED, "partition limit " + limit + " reached");
    }

    public static PubSubException partitionClosed(final String partition) {
        return new PubSubException(ErrorCode.PARTITION_CLOSED, partition + " is closed");
    }

    public static PubSubException subscriptionClosed(final String partition) {
        return new PubSubException(ErrorCode.SUBSCRIPTION_CLOSED, "subscription on " + partition + " closed before acknowledgment");
    }

    public static PubSubException alreadySubscribed(final String target) {
        return new PubSubException(ErrorCode.ALREADY_SUBSCRIBED, target + " already has an active subscriber");
    }

    public static PubSubException deliveryFailed(final String messageId, final int attempts, final Throwable lastError) {
        return new PubSubException(ErrorCode.DELIVERY_FAILED,
                "message " + messageId + " failed after " + attempts + " attempts", lastError);
    }
}
