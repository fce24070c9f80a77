package io.ringpubsub.broker.delivery;

/**
 * Operator-facing sink for terminal delivery outcomes. Called outside partition locks; implementations
 * should be quick and must be thread-safe.
 */
@FunctionalInterface
public interface DeliveryListener {

    void onReport(DeliveryReport report);

    static DeliveryListener logging() {
        return LoggingDeliveryListener.INSTANCE;
    }
}
