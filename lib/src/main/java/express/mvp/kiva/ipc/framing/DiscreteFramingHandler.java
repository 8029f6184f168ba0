package express.mvp.kiva.ipc.framing;

import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.Message;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Frames everything a peer sends before ending its output as a single message.
 *
 * <p>Bytes are accumulated until end-of-stream. If a read limit is configured and more than that
 * many bytes arrive, framing fails with {@link MessageLimitExceededException} without waiting for
 * end-of-stream and without delivering anything. On end-of-stream the accumulated bytes become one
 * {@link ConnectionMode#TEXT_DATA} message, after which the inbound side of the connection is shut
 * down.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FramingHandler framing = new DiscreteFramingHandler(64 * 1024, 8192);
 * framing.frame(connection, ByteBuffer.allocate(0), handler::onMessage);
 * }</pre>
 */
public final class DiscreteFramingHandler implements FramingHandler {

    /** Read limit value meaning "no limit". */
    public static final long NO_LIMIT = 0;

    private final long readLimit;
    private final int readBufferSize;

    /**
     * Creates a discrete framing handler.
     *
     * @param readLimit maximum message size in bytes, or {@link #NO_LIMIT}
     * @param readBufferSize bytes requested per read
     * @throws IllegalArgumentException if readLimit is negative or readBufferSize is not positive
     */
    public DiscreteFramingHandler(long readLimit, int readBufferSize) {
        if (readLimit < 0) {
            throw new IllegalArgumentException("readLimit must not be negative: " + readLimit);
        }
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException(
                    "readBufferSize must be positive: " + readBufferSize);
        }
        this.readLimit = readLimit;
        this.readBufferSize = readBufferSize;
    }

    @Override
    public long frame(Connection connection, ByteBuffer prefetched, MessageSink sink)
            throws IOException {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        ByteArrayOutputStream accumulated = new ByteArrayOutputStream();
        if (prefetched != null) {
            append(accumulated, prefetched);
        }

        ByteBuffer buffer = ByteBuffer.allocate(readBufferSize);
        while (true) {
            buffer.clear();
            int n = connection.read(buffer);
            if (n < 0) {
                break;
            }
            buffer.flip();
            append(accumulated, buffer);
        }

        sink.deliver(new Message(accumulated.toByteArray(), connection, ConnectionMode.TEXT_DATA));
        connection.shutdownInput();
        return 1;
    }

    private void append(ByteArrayOutputStream accumulated, ByteBuffer bytes) {
        int length = bytes.remaining();
        long total = (long) accumulated.size() + length;
        if (readLimit != NO_LIMIT && total > readLimit) {
            throw new MessageLimitExceededException(readLimit, total);
        }
        if (bytes.hasArray()) {
            accumulated.write(bytes.array(), bytes.arrayOffset() + bytes.position(), length);
            bytes.position(bytes.limit());
        } else {
            byte[] copy = new byte[length];
            bytes.get(copy);
            accumulated.write(copy, 0, length);
        }
    }

    /**
     * Returns the configured read limit.
     *
     * @return the limit in bytes, or {@link #NO_LIMIT}
     */
    public long readLimit() {
        return readLimit;
    }

    @Override
    public String toString() {
        return "DiscreteFramingHandler[readLimit="
                + (readLimit == NO_LIMIT ? "none" : readLimit) + "]";
    }
}
