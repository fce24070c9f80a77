package io.ringpubsub.broker.delivery;

import io.ringpubsub.broker.ordering.OrderingKey;
import io.ringpubsub.broker.ordering.SequencedMessage;
import io.ringpubsub.core.error.ErrorCode;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.AckMessage;
import io.ringpubsub.core.model.DeliveryGuarantee;
import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.ledger.InMemoryDedupLedger;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

final class AckTrackerTest {

    private static SequencedMessage entry(final long seq, final String id) {
        return new SequencedMessage(seq, Message.builder().messageId(id).value(new byte[]{1}).build(), OrderingKey.of("k"));
    }

    private static SubscriptionOptions options(final DeliveryGuarantee guarantee, final long timeout, final int retries) {
        return SubscriptionOptions.builder()
                .deliveryGuarantee(guarantee)
                .ackTimeoutMillis(timeout)
                .maxRetries(retries)
                .build();
    }

    private static AckTracker tracker(final DeliveryGuarantee guarantee, final int retries) {
        return new AckTracker(options(guarantee, 100L, retries), new InMemoryDedupLedger(60_000L, 100), "t#0", "s1");
    }

    @Test
    void successRemovesTracking() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 3);
        tracker.dispatch(entry(0, "m1"), 0L);
        assertEquals(1, tracker.inFlight());

        final Resolution r = tracker.onAck(AckMessage.success("m1"));

        assertEquals(Resolution.Kind.ACKNOWLEDGED, r.kind());
        assertTrue(r.isTerminal());
        assertEquals(0, tracker.tracked());
    }

    @Test
    void unknownAckIsIgnored() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 3);
        assertEquals(Resolution.Kind.IGNORED, tracker.onAck(AckMessage.success("nope")).kind());
    }

    @Test
    void failuresExhaustRetryBudgetThenFail() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 2);
        final PendingDelivery d = tracker.dispatch(entry(0, "m1"), 0L);
        final RuntimeException boom = new RuntimeException("boom");

        assertEquals(Resolution.Kind.REDELIVER, tracker.onAck(AckMessage.failure("m1", boom)).kind());
        assertSame(d, tracker.awaitingRedelivery("m1"));
        tracker.redispatch(d, 10L);

        assertEquals(Resolution.Kind.REDELIVER, tracker.onAck(AckMessage.failure("m1", boom)).kind());
        tracker.redispatch(d, 20L);

        final Resolution last = tracker.onAck(AckMessage.failure("m1", boom));
        assertEquals(Resolution.Kind.FAILED, last.kind());
        assertEquals(3, d.getAttempts());
        assertFalse(tracker.isTracked("m1"));

        final PubSubException cause = assertInstanceOf(PubSubException.class, last.cause());
        assertEquals(ErrorCode.DELIVERY_FAILED, cause.getCode());
        assertSame(boom, cause.getCause());
    }

    @Test
    void expiryCountsAsFailure() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 0);
        tracker.dispatch(entry(0, "m1"), 0L);

        assertTrue(tracker.expire(99L).isEmpty());

        final List<Resolution> expired = tracker.expire(100L);
        assertEquals(1, expired.size());
        assertEquals(Resolution.Kind.FAILED, expired.get(0).kind());
        assertInstanceOf(TimeoutException.class, expired.get(0).cause().getCause());
    }

    @Test
    void lateErrorAfterTimeoutDoesNotBurnAnotherRetry() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 1);
        final PendingDelivery d = tracker.dispatch(entry(0, "m1"), 0L);

        assertEquals(Resolution.Kind.REDELIVER, tracker.expire(100L).get(0).kind());
        assertEquals(Resolution.Kind.IGNORED, tracker.onAck(AckMessage.failure("m1", new RuntimeException())).kind());
        assertEquals(1, d.getFailures());
    }

    @Test
    void lateSuccessWhileQueuedResolvesDelivery() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_MOST_ONCE_WITH_RETRY, 3);
        tracker.dispatch(entry(0, "m1"), 0L);
        tracker.expire(100L);
        assertNotNull(tracker.awaitingRedelivery("m1"));

        assertEquals(Resolution.Kind.ACKNOWLEDGED, tracker.onAck(AckMessage.success("m1")).kind());
        assertNull(tracker.awaitingRedelivery("m1"));
    }

    @Test
    void exactlyOnceDeduplicatesSecondSuccess() {
        final InMemoryDedupLedger ledger = new InMemoryDedupLedger(60_000L, 100);
        final SubscriptionOptions opts = options(DeliveryGuarantee.EXACTLY_ONCE, 100L, 3);
        final AckTracker first = new AckTracker(opts, ledger, "t#0", "s1");
        final AckTracker second = new AckTracker(opts, ledger, "t#0", "s2");

        first.dispatch(entry(0, "m1"), 0L);
        assertEquals(Resolution.Kind.ACKNOWLEDGED, first.onAck(AckMessage.success("m1")).kind());

        assertTrue(second.isDuplicate("m1"));
        second.dispatch(entry(0, "m1"), 0L);
        assertEquals(Resolution.Kind.DEDUPLICATED, second.onAck(AckMessage.success("m1")).kind());
        assertEquals(1, ledger.size());
    }

    @Test
    void exactlyOnceRequiresLedger() {
        assertThrows(NullPointerException.class,
                () -> new AckTracker(options(DeliveryGuarantee.EXACTLY_ONCE, 100L, 1), null, "t#0", "s1"));
    }

    @Test
    void doubleDispatchIsRejected() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 1);
        tracker.dispatch(entry(0, "m1"), 0L);
        assertThrows(IllegalStateException.class, () -> tracker.dispatch(entry(1, "m1"), 0L));
    }

    @Test
    void drainReturnsUnresolved() {
        final AckTracker tracker = tracker(DeliveryGuarantee.AT_LEAST_ONCE, 1);
        tracker.dispatch(entry(0, "m1"), 0L);
        tracker.dispatch(entry(1, "m2"), 0L);

        assertEquals(2, tracker.drain().size());
        assertEquals(0, tracker.tracked());
    }
}
