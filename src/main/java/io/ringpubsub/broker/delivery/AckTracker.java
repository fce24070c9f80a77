package io.ringpubsub.broker.delivery;

import io.ringpubsub.broker.ordering.SequencedMessage;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.AckMessage;
import io.ringpubsub.core.model.DeliveryGuarantee;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.ledger.DedupLedger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * In-flight table of one subscription: binds every handed-off message to a deadline and a retry budget
 * and decides what each ack or expiry means under the subscription's {@link DeliveryGuarantee}.
 * <p>
 * A message is delivered at most {@code maxRetries + 1} times. Under {@link DeliveryGuarantee#EXACTLY_ONCE}
 * the {@link DedupLedger} is consulted before counting a success or scheduling a redelivery.
 * </p>
 * <p>
 * Not thread-safe: guarded by the owning partition's lock. Callers pass the current time so expiry is
 * deterministic under test.
 * </p>
 */
@Slf4j
public final class AckTracker {

    @Getter private final SubscriptionOptions options;
    private final DedupLedger ledger;
    private final String partition;
    private final String subscriber;

    private final Map<String, PendingDelivery> pending = new LinkedHashMap<>();

    public AckTracker(final SubscriptionOptions options,
                      final DedupLedger ledger,
                      final String partition,
                      final String subscriber) {
        this.options = Objects.requireNonNull(options, "options");
        this.partition = partition;
        this.subscriber = subscriber;

        if (options.getDeliveryGuarantee() == DeliveryGuarantee.EXACTLY_ONCE) {
            this.ledger = Objects.requireNonNull(ledger, "exactly-once delivery needs a dedup ledger");
        } else {
            this.ledger = ledger;
        }
    }

    public DeliveryGuarantee guarantee() {
        return options.getDeliveryGuarantee();
    }

    /**
     * True if the message was already processed successfully and must not be handed out again.
     */
    public boolean isDuplicate(final String messageId) {
        return guarantee() == DeliveryGuarantee.EXACTLY_ONCE && ledger.isSucceeded(messageId);
    }

    /**
     * Records the first hand-off of {@code entry}.
     */
    public PendingDelivery dispatch(final SequencedMessage entry, final long now) {
        if (pending.containsKey(entry.messageId())) {
            throw new IllegalStateException("message " + entry.messageId() + " is already tracked on " + partition);
        }

        final PendingDelivery d = new PendingDelivery(entry, partition, subscriber);
        d.handedOff(now + options.getAckTimeoutMillis());
        pending.put(entry.messageId(), d);
        return d;
    }

    /**
     * Records a repeated hand-off of a delivery that was queued for redelivery.
     */
    public void redispatch(final PendingDelivery d, final long now) {
        d.handedOff(now + options.getAckTimeoutMillis());
    }

    /**
     * @return the tracked delivery of {@code messageId} if it is queued for another hand-off, else {@code null}
     */
    public PendingDelivery awaitingRedelivery(final String messageId) {
        final PendingDelivery d = pending.get(messageId);
        return d != null && d.getStatus() == PendingDelivery.Status.AWAITING_REDELIVERY ? d : null;
    }

    public Resolution onAck(final AckMessage ack) {
        final PendingDelivery d = pending.get(ack.messageId());
        if (d == null) {
            log.debug("Ack for untracked message {} on {}", ack.messageId(), partition);
            return Resolution.IGNORED;
        }

        if (ack.isSuccess()) {
            pending.remove(d.messageId());

            if (ledger != null && guarantee() == DeliveryGuarantee.EXACTLY_ONCE && !ledger.markSucceeded(d.messageId())) {
                return new Resolution(Resolution.Kind.DEDUPLICATED, d, null);
            }
            return new Resolution(Resolution.Kind.ACKNOWLEDGED, d, null);
        }

        // A late failure for an attempt that already timed out must not burn another retry.
        if (d.getStatus() != PendingDelivery.Status.IN_FLIGHT) return Resolution.IGNORED;

        return fail(d, ack.error());
    }

    /**
     * Fails every in-flight delivery whose deadline has passed.
     */
    public List<Resolution> expire(final long now) {
        List<Resolution> out = null;

        for (final PendingDelivery d : new ArrayList<>(pending.values())) {
            if (d.getStatus() != PendingDelivery.Status.IN_FLIGHT || d.getDeadline() > now) continue;

            if (out == null) out = new ArrayList<>();
            out.add(fail(d, new TimeoutException("no ack within " + options.getAckTimeoutMillis() + "ms")));
        }
        return out == null ? List.of() : out;
    }

    private Resolution fail(final PendingDelivery d, final Throwable error) {
        final int failures = d.failed(error);

        if (failures > options.getMaxRetries()) {
            pending.remove(d.messageId());
            return new Resolution(Resolution.Kind.FAILED, d,
                    PubSubException.deliveryFailed(d.messageId(), d.getAttempts(), error));
        }

        if (isDuplicate(d.messageId())) {
            pending.remove(d.messageId());
            return new Resolution(Resolution.Kind.DEDUPLICATED, d, null);
        }

        log.debug("Scheduling redelivery of {} on {} ({} of {} retries)",
                d.messageId(), partition, failures, options.getMaxRetries());
        return new Resolution(Resolution.Kind.REDELIVER, d, error);
    }

    /**
     * Number of deliveries currently waiting on the handler.
     */
    public int inFlight() {
        int n = 0;
        for (final PendingDelivery d : pending.values()) {
            if (d.getStatus() == PendingDelivery.Status.IN_FLIGHT) n++;
        }
        return n;
    }

    public int tracked() {
        return pending.size();
    }

    public boolean isTracked(final String messageId) {
        return pending.containsKey(messageId);
    }

    /**
     * Stops tracking everything and returns what was still unresolved.
     */
    public List<PendingDelivery> drain() {
        final List<PendingDelivery> out = new ArrayList<>(pending.values());
        pending.clear();
        return out;
    }
}
