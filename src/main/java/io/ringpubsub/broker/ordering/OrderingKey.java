package io.ringpubsub.broker.ordering;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Value wrapper over an ordering key's bytes. The empty key groups unordered messages.
 */
public final class OrderingKey {

    public static final OrderingKey UNORDERED = new OrderingKey(new byte[0]);

    private final byte[] bytes;
    private final int hash;

    private OrderingKey(final byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * @param key raw key; {@code null} or empty yields {@link #UNORDERED}
     */
    public static OrderingKey of(final byte[] key) {
        if (key == null || key.length == 0) return UNORDERED;
        return new OrderingKey(key.clone());
    }

    public static OrderingKey of(final String key) {
        return key == null ? UNORDERED : of(key.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isUnordered() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderingKey)) return false;
        return Arrays.equals(bytes, ((OrderingKey) o).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return isUnordered() ? "<unordered>" : new String(bytes, StandardCharsets.UTF_8);
    }
}
