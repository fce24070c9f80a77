package io.ringpubsub.config.type;

import io.ringpubsub.config.impl.BackpressurePolicy;
import io.ringpubsub.config.impl.PubSubConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsResourceAndKeepsDefaultsForMissingKeys() throws Exception {
        final PubSubConfig cfg = ConfigLoader.loadResource("pubsub-test.yaml");

        assertEquals(8, cfg.getPartitionsPerTopic());
        assertEquals(64, cfg.getMaxPartitions());
        assertEquals(500, cfg.getBacklogCapacity());
        assertEquals(BackpressurePolicy.BLOCK, cfg.getBackpressure());
        assertEquals(250L, cfg.getPublishTimeoutMillis());
        assertEquals(120_000L, cfg.getDedupRetentionMillis());

        final PubSubConfig defaults = PubSubConfig.defaults();
        assertEquals(defaults.getMaxBatchSize(), cfg.getMaxBatchSize());
        assertEquals(defaults.getDefaultMaxMessageSize(), cfg.getDefaultMaxMessageSize());
        assertEquals(defaults.getCloseGracePeriodMillis(), cfg.getCloseGracePeriodMillis());
    }

    @Test
    void loadsFromFile() throws Exception {
        final Path file = dir.resolve("pubsub.yaml");
        Files.writeString(file, "maxBatchSize: 5\nackSweepIntervalMillis: 20\n", StandardCharsets.UTF_8);

        final PubSubConfig cfg = ConfigLoader.load(file.toString());

        assertEquals(5, cfg.getMaxBatchSize());
        assertEquals(20L, cfg.getAckSweepIntervalMillis());
        assertEquals(16, cfg.getPartitionsPerTopic());
    }

    @Test
    void emptyFileYieldsDefaults() throws Exception {
        final Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "", StandardCharsets.UTF_8);

        final PubSubConfig cfg = ConfigLoader.load(file.toString());
        assertEquals(PubSubConfig.defaults().getBacklogCapacity(), cfg.getBacklogCapacity());
    }

    @Test
    void rejectsOutOfRangeValues() throws Exception {
        final Path file = dir.resolve("bad.yaml");
        Files.writeString(file, "backlogCapacity: 0\n", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IOException.class, () -> ConfigLoader.loadResource("does-not-exist.yaml"));
    }
}
