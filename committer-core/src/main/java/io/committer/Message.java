package io.committer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable record read from a partitioned log and handed to a {@link Committer}.
 *
 * <p>The host treats messages as opaque: it only orders them by position within a batch
 * and counts them. The {@code offset} is the message's position in its partition. Key and
 * payload arrays are copied on the way in and on the way out.
 *
 * @see Committer#commit(java.util.List, String)
 */
public final class Message {
    private final long offset;
    private final byte[] key;
    private final byte[] payload;

    private Message(long offset, byte[] key, byte[] payload) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        Objects.requireNonNull(payload, "payload");
        this.offset = offset;
        this.key = key == null ? null : Arrays.copyOf(key, key.length);
        this.payload = Arrays.copyOf(payload, payload.length);
    }

    /**
     * Creates a keyless message.
     *
     * @param offset  position in the partition
     * @param payload message body
     * @return a new message
     */
    public static Message of(long offset, byte[] payload) {
        return new Message(offset, null, payload);
    }

    /**
     * Creates a keyed message.
     *
     * @param offset  position in the partition
     * @param key     message key, may be {@code null}
     * @param payload message body
     * @return a new message
     */
    public static Message of(long offset, byte[] key, byte[] payload) {
        return new Message(offset, key, payload);
    }

    /**
     * Creates a keyless message with a UTF-8 payload.
     *
     * @param offset  position in the partition
     * @param payload message body
     * @return a new message
     */
    public static Message ofString(long offset, String payload) {
        Objects.requireNonNull(payload, "payload");
        return new Message(offset, null, payload.getBytes(StandardCharsets.UTF_8));
    }

    public long offset() {
        return offset;
    }

    /**
     * Returns a copy of the key, or {@code null} for keyless messages.
     *
     * @return the key bytes, or {@code null}
     */
    public byte[] key() {
        return key == null ? null : Arrays.copyOf(key, key.length);
    }

    public boolean hasKey() {
        return key != null;
    }

    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public int payloadSize() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return offset == other.offset
                && Arrays.equals(key, other.key)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(offset);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "Message{offset=" + offset + ", keyed=" + hasKey() + ", payloadSize=" + payload.length + '}';
    }
}
