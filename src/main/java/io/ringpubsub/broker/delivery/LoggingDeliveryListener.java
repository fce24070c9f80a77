package io.ringpubsub.broker.delivery;

import lombok.extern.slf4j.Slf4j;

/** Default {@link DeliveryListener}: writes outcomes to the log. */
@Slf4j
final class LoggingDeliveryListener implements DeliveryListener {

    static final LoggingDeliveryListener INSTANCE = new LoggingDeliveryListener();

    private LoggingDeliveryListener() {
    }

    @Override
    public void onReport(final DeliveryReport r) {
        switch (r.outcome()) {
            case FAILED -> log.warn("Delivery of {} on {}#{} failed after {} attempts",
                    r.messageId(), r.topic(), r.partitionId(), r.attempts(), r.cause());
            case CLOSED -> log.info("Message {} on {}#{} released by close: {}",
                    r.messageId(), r.topic(), r.partitionId(), r.cause() == null ? "-" : r.cause().getMessage());
            default -> log.debug("Message {} on {}#{} {} after {} attempts",
                    r.messageId(), r.topic(), r.partitionId(), r.outcome(), r.attempts());
        }
    }
}
