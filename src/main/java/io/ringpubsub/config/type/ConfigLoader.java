package io.ringpubsub.config.type;

import io.ringpubsub.config.impl.PubSubConfig;

import java.io.IOException;
import java.io.InputStream;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads pub/sub configuration from a YAML file by delegating to {@link PubSubConfig#load(String)}.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link PubSubConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static PubSubConfig load(final String path) throws IOException {
        return PubSubConfig.load(path);
    }

    /**
     * Loads configuration from a classpath resource, for example:
     * <pre>
     * partitionsPerTopic: 8
     * backlogCapacity: 500
     * backpressure: block
     * publishTimeoutMillis: 250
     * </pre>
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public static PubSubConfig loadResource(final String resource) throws IOException {
        try (final InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("config resource not found: " + resource);
            return PubSubConfig.load(in);
        }
    }
}
