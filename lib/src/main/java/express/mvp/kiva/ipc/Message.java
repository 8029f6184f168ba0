package express.mvp.kiva.ipc;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable unit of inbound data handed to the message handler.
 *
 * <p>What a message contains depends on the framing mode that produced it: all bytes a client
 * sent before ending its output ({@link ConnectionMode#TEXT_DATA}), or the bytes of a single read
 * ({@link ConnectionMode#STREAM_DATA}, {@link ConnectionMode#PERSISTENT}).
 *
 * <p>The sender reference lets a handler reply and inspect session state. It does not own the
 * connection: the session task closes it regardless of what the handler keeps.
 */
public final class Message {

    private final byte[] payload;
    private final Connection sender;
    private final ConnectionMode mode;
    private final Instant receivedAt;

    /**
     * Creates a message from bytes read on a connection.
     *
     * @param payload the bytes; copied
     * @param sender the connection the bytes arrived on
     * @param mode the framing mode that produced this message
     */
    public Message(byte[] payload, Connection sender, ConnectionMode mode) {
        this.payload = Objects.requireNonNull(payload, "payload must not be null").clone();
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.receivedAt = Instant.now();
    }

    /**
     * Creates a message from the readable bytes of a buffer, leaving the buffer untouched.
     *
     * @param buffer the buffer, flipped for reading
     * @param sender the connection the bytes arrived on
     * @param mode the framing mode that produced this message
     * @return a new message holding a copy of the readable bytes
     */
    public static Message of(ByteBuffer buffer, Connection sender, ConnectionMode mode) {
        ByteBuffer view = buffer.duplicate();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return new Message(bytes, sender, mode);
    }

    /**
     * Returns a copy of the payload.
     *
     * @return the payload bytes
     */
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Returns a read-only view of the payload.
     *
     * @return a read-only buffer over the payload
     */
    public ByteBuffer asReadOnlyBuffer() {
        return ByteBuffer.wrap(payload).asReadOnlyBuffer();
    }

    /**
     * Returns the payload length.
     *
     * @return the number of payload bytes
     */
    public int size() {
        return payload.length;
    }

    /**
     * Checks whether the payload is empty.
     *
     * @return true if the message carries no bytes
     */
    public boolean isEmpty() {
        return payload.length == 0;
    }

    /**
     * Decodes the payload as UTF-8 text.
     *
     * @return the payload as a string
     */
    public String text() {
        return text(StandardCharsets.UTF_8);
    }

    /**
     * Decodes the payload with the given charset.
     *
     * @param charset the charset to decode with
     * @return the payload as a string
     */
    public String text(Charset charset) {
        return new String(payload, charset);
    }

    /**
     * Returns the connection the message arrived on.
     *
     * @return the sending connection
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Handlers reply through the live sender connection.")
    public Connection sender() {
        return sender;
    }

    /**
     * Returns the framing mode that produced this message.
     *
     * @return the framing mode
     */
    public ConnectionMode mode() {
        return mode;
    }

    /**
     * Returns when the message was assembled.
     *
     * @return the receive timestamp
     */
    public Instant receivedAt() {
        return receivedAt;
    }

    /**
     * Checks whether another message carries the same bytes, ignoring sender and timing.
     *
     * @param other the message to compare with
     * @return true if both payloads are equal
     */
    public boolean hasSamePayload(Message other) {
        return other != null && Arrays.equals(payload, other.payload);
    }

    @Override
    public String toString() {
        return "Message[" + payload.length + " bytes, " + mode + ", from #" + sender.id() + "]";
    }
}
