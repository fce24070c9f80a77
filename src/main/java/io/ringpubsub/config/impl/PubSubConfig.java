package io.ringpubsub.config.impl;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Immutable settings of a pub/sub instance, loaded from pubsub.yaml or built in code.
 * Missing YAML keys keep their defaults.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class PubSubConfig {

    @Builder.Default private final int partitionsPerTopic = 16;
    @Builder.Default private final int maxPartitions = 1024;

    @Builder.Default private final int backlogCapacity = 10_000;
    @Builder.Default private final BackpressurePolicy backpressure = BackpressurePolicy.FAIL_FAST;
    @Builder.Default private final long publishTimeoutMillis = 1_000L;

    @Builder.Default private final int maxBatchSize = 64;
    @Builder.Default private final int defaultMaxMessageSize = 1024 * 1024;

    @Builder.Default private final long ackSweepIntervalMillis = 10L;
    @Builder.Default private final long drainTimeoutMillis = 5_000L;
    @Builder.Default private final long closeGracePeriodMillis = 5_000L;

    @Builder.Default private final long dedupRetentionMillis = 600_000L;
    @Builder.Default private final int dedupMaxEntries = 100_000;

    public static PubSubConfig defaults() {
        return builder().build();
    }

    public static PubSubConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static PubSubConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        final PubSubConfig d = defaults();
        if (m == null) return d;

        final PubSubConfig cfg = PubSubConfig.builder()
                .partitionsPerTopic(intValue(m, "partitionsPerTopic", d.partitionsPerTopic))
                .maxPartitions(intValue(m, "maxPartitions", d.maxPartitions))
                .backlogCapacity(intValue(m, "backlogCapacity", d.backlogCapacity))
                .backpressure(BackpressurePolicy.valueOf(
                        ((String) m.getOrDefault("backpressure", d.backpressure.name())).toUpperCase()))
                .publishTimeoutMillis(longValue(m, "publishTimeoutMillis", d.publishTimeoutMillis))
                .maxBatchSize(intValue(m, "maxBatchSize", d.maxBatchSize))
                .defaultMaxMessageSize(intValue(m, "defaultMaxMessageSize", d.defaultMaxMessageSize))
                .ackSweepIntervalMillis(longValue(m, "ackSweepIntervalMillis", d.ackSweepIntervalMillis))
                .drainTimeoutMillis(longValue(m, "drainTimeoutMillis", d.drainTimeoutMillis))
                .closeGracePeriodMillis(longValue(m, "closeGracePeriodMillis", d.closeGracePeriodMillis))
                .dedupRetentionMillis(longValue(m, "dedupRetentionMillis", d.dedupRetentionMillis))
                .dedupMaxEntries(intValue(m, "dedupMaxEntries", d.dedupMaxEntries))
                .build();

        cfg.validate();
        return cfg;
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     */
    public PubSubConfig validate() {
        if (partitionsPerTopic <= 0) throw new IllegalArgumentException("partitionsPerTopic must be > 0");
        if (maxPartitions <= 0) throw new IllegalArgumentException("maxPartitions must be > 0");
        if (backlogCapacity <= 0) throw new IllegalArgumentException("backlogCapacity must be > 0");
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        if (defaultMaxMessageSize < 0) throw new IllegalArgumentException("defaultMaxMessageSize must be >= 0");
        if (ackSweepIntervalMillis <= 0) throw new IllegalArgumentException("ackSweepIntervalMillis must be > 0");
        if (dedupRetentionMillis <= 0) throw new IllegalArgumentException("dedupRetentionMillis must be > 0");
        if (dedupMaxEntries <= 0) throw new IllegalArgumentException("dedupMaxEntries must be > 0");
        return this;
    }

    private static int intValue(final Map<String, Object> m, final String key, final int def) {
        final Object v = m.get(key);
        return v == null ? def : ((Number) v).intValue();
    }

    private static long longValue(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.get(key);
        return v == null ? def : ((Number) v).longValue();
    }
}
