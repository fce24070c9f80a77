package io.ringpubsub;

import io.ringpubsub.broker.delivery.BatchConsumer;
import io.ringpubsub.broker.delivery.DeliveryOutcome;
import io.ringpubsub.broker.delivery.DeliveryReport;
import io.ringpubsub.broker.partition.LocalPartition;
import io.ringpubsub.broker.partition.Partition;
import io.ringpubsub.broker.partition.PartitionState;
import io.ringpubsub.config.impl.PubSubConfig;
import io.ringpubsub.core.channel.AckChannel;
import io.ringpubsub.core.error.ErrorCode;
import io.ringpubsub.core.error.PubSubException;
import io.ringpubsub.core.model.AckMessage;
import io.ringpubsub.core.model.DeliveryGuarantee;
import io.ringpubsub.core.model.Message;
import io.ringpubsub.core.model.MessageMetadata;
import io.ringpubsub.core.model.SubscriptionOptions;
import io.ringpubsub.registry.TopicRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

final class RingPubSubTest {

    private final List<DeliveryReport> reports = new CopyOnWriteArrayList<>();
    private final RingPubSub pubSub = RingPubSub.create(PubSubConfig.builder()
            .partitionsPerTopic(4)
            .closeGracePeriodMillis(200L)
            .drainTimeoutMillis(200L)
            .build(), reports::add);

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static Message msg(final String id) {
        return Message.builder().messageId(id).value(bytes(id)).build();
    }

    private static void await(final BooleanSupplier condition, final String what) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 5_000L;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(5);
        }
    }

    private static BatchConsumer acking(final List<String> seen, final AckChannel channel) {
        return batch -> {
            for (final Message m : batch) {
                seen.add(m.getMessageId());
                channel.trySend(AckMessage.success(m.getMessageId()));
            }
        };
    }

    @AfterEach
    void tearDown() {
        pubSub.close();
    }

    @Test
    void topicSubscriberReceivesFromEveryPartition() throws Exception {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final AckChannel channel = AckChannel.blocking(256);
        pubSub.subscribe("orders", acking(seen, channel), Map.of("subscriberId", "billing"),
                SubscriptionOptions.defaults(), channel);

        final List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            final String id = "m" + i;
            pubSub.publish("orders", bytes("customer-" + i), List.of(msg(id)), null);
            expected.add(id);
        }

        await(() -> seen.size() == 20, "20 deliveries");
        assertEquals(new java.util.HashSet<>(expected), new java.util.HashSet<>(seen));
        await(() -> reports.stream().filter(r -> r.outcome() == DeliveryOutcome.ACKNOWLEDGED).count() == 20, "20 acks");
        assertTrue(pubSub.getRegistry().partitionCount() > 1, "keys should spread over partitions");
    }

    @Test
    void sameKeyPreservesPublishOrder() throws Exception {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final AckChannel channel = AckChannel.blocking(256);
        pubSub.subscribe("orders", acking(seen, channel), null, SubscriptionOptions.defaults(), channel);

        final MessageMetadata ordered = MessageMetadata.builder().orderingKey(bytes("customer-1")).build();
        final List<Message> batch = new ArrayList<>();
        for (int i = 0; i < 50; i++) batch.add(msg("m" + i));

        pubSub.publish("orders", bytes("customer-1"), batch, ordered);

        await(() -> seen.size() == 50, "50 deliveries");
        for (int i = 0; i < 50; i++) assertEquals("m" + i, seen.get(i));
    }

    @Test
    void partitionerReturnsStableInstances() {
        final Partition first = pubSub.partitioner().partition("orders", bytes("k"));
        final Partition again = pubSub.partitioner().partition("orders", bytes("k"));

        assertSame(first, again);
        assertEquals(pubSub.partitioner().partitionId(bytes("k")), first.id());
        assertEquals("orders", first.topic());
    }

    @Test
    void subscriptionCoversPartitionsCreatedLater() throws Exception {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final AckChannel channel = AckChannel.blocking(16);
        pubSub.subscribe("late", acking(seen, channel), null, SubscriptionOptions.defaults(), channel);

        assertTrue(pubSub.getRegistry().partitions("late").isEmpty());
        pubSub.publish("late", bytes("x"), List.of(msg("m1")), null);

        await(() -> seen.size() == 1, "delivery on a new partition");
    }

    @Test
    void duplicateTopicSubscriptionIsRejected() {
        final AckChannel channel = AckChannel.blocking(16);
        pubSub.subscribe("orders", batch -> { }, null, SubscriptionOptions.defaults(), channel);

        final PubSubException e = assertThrows(PubSubException.class,
                () -> pubSub.subscribe("orders", batch -> { }, null, SubscriptionOptions.defaults(), channel));
        assertEquals(ErrorCode.ALREADY_SUBSCRIBED, e.getCode());
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final AckChannel channel = AckChannel.blocking(16);
        pubSub.subscribe("orders", acking(seen, channel), null, SubscriptionOptions.defaults(), channel);

        pubSub.publish("orders", bytes("k"), List.of(msg("m1")), null);
        await(() -> seen.size() == 1, "first delivery");

        pubSub.unsubscribe("orders");
        pubSub.publish("orders", bytes("k"), List.of(msg("m2")), null);

        Thread.sleep(50);
        assertEquals(List.of("m1"), seen);

        final LocalPartition p = pubSub.partitioner().partition("orders", bytes("k"));
        assertEquals(1, p.backlog());
        assertFalse(p.isSubscribed());
    }

    @Test
    void exactlyOnceAcrossResubscribe() throws Exception {
        final List<String> seen = new CopyOnWriteArrayList<>();
        final AckChannel channel = AckChannel.blocking(16);
        final SubscriptionOptions once = SubscriptionOptions.builder()
                .deliveryGuarantee(DeliveryGuarantee.EXACTLY_ONCE)
                .build();

        pubSub.subscribe("payments", acking(seen, channel), null, once, channel);
        pubSub.publish("payments", bytes("p"), List.of(msg("pay-1")), null);
        await(() -> reports.stream().anyMatch(r -> r.outcome() == DeliveryOutcome.ACKNOWLEDGED), "ack");

        pubSub.unsubscribe("payments");
        final AckChannel next = AckChannel.blocking(16);
        pubSub.subscribe("payments", acking(seen, next), null, once, next);
        pubSub.publish("payments", bytes("p"), List.of(msg("pay-1")), null);

        await(() -> reports.stream().anyMatch(r -> r.outcome() == DeliveryOutcome.DEDUPLICATED), "dedup");
        assertEquals(List.of("pay-1"), seen);
    }

    @Test
    void invalidTopicAndOversizedMessagesAreRejected() {
        assertEquals(ErrorCode.INVALID_TOPIC, assertThrows(PubSubException.class,
                () -> pubSub.publish(" ", null, List.of(msg("m1")), null)).getCode());

        final byte[] big = new byte[PubSubConfig.defaults().getDefaultMaxMessageSize() + 1];
        assertEquals(ErrorCode.MESSAGE_TOO_LARGE, assertThrows(PubSubException.class,
                () -> pubSub.publish("orders", null, List.of(Message.of(big)), null)).getCode());
    }

    @Test
    void closeCascadesAndIsIdempotent() {
        final LocalPartition p = pubSub.partitioner().partition("orders", bytes("k"));
        pubSub.publish("orders", bytes("k"), List.of(msg("m1")), null);

        pubSub.close();
        pubSub.close();

        assertEquals(PartitionState.CLOSED, p.state());
        assertTrue(reports.stream().anyMatch(r -> r.outcome() == DeliveryOutcome.CLOSED && r.messageId().equals("m1")));
        assertEquals(ErrorCode.PARTITION_CLOSED, assertThrows(PubSubException.class,
                () -> pubSub.publish("orders", bytes("k"), List.of(msg("m2")), null)).getCode());
    }

    @Test
    void rejectedTopicSubscribeDeliversNothing() throws Exception {
        try (final RingPubSub local = RingPubSub.create(PubSubConfig.builder()
                .partitionsPerTopic(2)
                .drainTimeoutMillis(2_000L)
                .closeGracePeriodMillis(200L)
                .build(), reports::add)) {
            final TopicRegistry reg = local.getRegistry();
            final LocalPartition p0 = reg.getOrCreate("t", 0);
            final LocalPartition p1 = reg.getOrCreate("t", 1);

            p0.publish(msg("buffered"), null);
            p1.subscribe(batch -> { }, Map.of(), SubscriptionOptions.defaults(), AckChannel.blocking(16));

            final List<String> rejected = new CopyOnWriteArrayList<>();
            final AckChannel channel = AckChannel.blocking(16);
            final long start = System.currentTimeMillis();

            final PubSubException e = assertThrows(PubSubException.class,
                    () -> local.subscribe("t", acking(rejected, channel), null, SubscriptionOptions.defaults(), channel));
            assertEquals(ErrorCode.ALREADY_SUBSCRIBED, e.getCode());
            assertTrue(System.currentTimeMillis() - start < 1_000L, "a rejected subscribe must not wait for a drain");

            Thread.sleep(100);
            assertTrue(rejected.isEmpty());
            assertFalse(p0.isSubscribed());
            assertEquals(1, p0.backlog());

            // the registry stays usable and the buffered message goes to the next accepted subscriber
            reg.getOrCreate("other", 0);
            p1.unsubscribe();

            final List<String> seen = new CopyOnWriteArrayList<>();
            final AckChannel next = AckChannel.blocking(16);
            local.subscribe("t", acking(seen, next), null, SubscriptionOptions.defaults(), next);

            await(() -> seen.size() == 1, "buffered message");
            assertEquals(List.of("buffered"), seen);
        }
    }
}
