package express.mvp.kiva.ipc.framing;

import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.Message;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Frames every non-empty read as its own message.
 *
 * <p>Each read asks for at most {@code chunkSize} bytes, and whatever it returns is delivered at
 * once. Nothing is buffered across reads, so a message never holds more than one read's worth of
 * bytes. Prefetched bytes handed to {@link #frame} are delivered first, split into slices of at
 * most {@code chunkSize} bytes. Messages carry the mode the connection is in when they are framed: {@link
 * ConnectionMode#STREAM_DATA} or {@link ConnectionMode#PERSISTENT}.
 */
public final class ChunkedFramingHandler implements FramingHandler {

    /** Default bytes per read. */
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    private final int chunkSize;

    /** Creates a handler with {@link #DEFAULT_CHUNK_SIZE}. */
    public ChunkedFramingHandler() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates a handler with the given chunk size.
     *
     * @param chunkSize maximum bytes per read, and per message
     * @throws IllegalArgumentException if chunkSize is not positive
     */
    public ChunkedFramingHandler(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    @Override
    public long frame(Connection connection, ByteBuffer prefetched, MessageSink sink)
            throws IOException {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        long delivered = 0;
        if (prefetched != null) {
            while (prefetched.hasRemaining()) {
                ByteBuffer slice = prefetched.duplicate();
                slice.limit(slice.position() + Math.min(chunkSize, slice.remaining()));
                sink.deliver(Message.of(slice, connection, chunkMode(connection)));
                prefetched.position(slice.limit());
                delivered++;
            }
        }

        ByteBuffer buffer = ByteBuffer.allocate(chunkSize);
        while (true) {
            buffer.clear();
            int n = connection.read(buffer);
            if (n < 0) {
                return delivered;
            }
            if (n == 0) {
                continue;
            }
            buffer.flip();
            sink.deliver(Message.of(buffer, connection, chunkMode(connection)));
            delivered++;
        }
    }

    private static ConnectionMode chunkMode(Connection connection) {
        ConnectionMode mode = connection.mode();
        return mode.isChunked() ? mode : ConnectionMode.STREAM_DATA;
    }

    /**
     * Returns the configured chunk size.
     *
     * @return bytes per read
     */
    public int chunkSize() {
        return chunkSize;
    }

    @Override
    public String toString() {
        return "ChunkedFramingHandler[chunkSize=" + chunkSize + "]";
    }
}
