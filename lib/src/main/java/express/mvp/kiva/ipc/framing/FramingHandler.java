package express.mvp.kiva.ipc.framing;

import express.mvp.kiva.ipc.Connection;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Strategy for turning the inbound byte stream of a connection into messages.
 *
 * <p>A framing handler owns the read loop of a session once command negotiation is over. It reads
 * until the peer ends its output and hands every message it produces to a {@link MessageSink}, in
 * arrival order.
 *
 * <h2>Framing Disciplines</h2>
 *
 * <pre>
 * Discrete (TEXT_DATA):
 *   read ─▶ read ─▶ read ─▶ EOF
 *   └──────── one message ────┘
 *
 * Chunked (STREAM_DATA, PERSISTENT):
 *   read ─▶ read ─▶ read ─▶ EOF
 *    msg     msg     msg
 * </pre>
 *
 * <h2>Prefetched Bytes</h2>
 *
 * <p>Command negotiation reads ahead to recognise command headers. Whatever it read that was not a
 * command is passed in as {@code prefetched} and is framed exactly as if it had just been read
 * from the connection.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations are immutable; all per-session state lives on the stack of {@link #frame}.
 * The same instance may serve many sessions concurrently.
 *
 * @see DiscreteFramingHandler
 * @see ChunkedFramingHandler
 */
public interface FramingHandler {

    /**
     * Reads the connection until end-of-stream, delivering messages as they are framed.
     *
     * @param connection the connection to read from
     * @param prefetched bytes already read from the connection, flipped for reading; consumed
     * @param sink receives each framed message
     * @return the number of messages delivered
     * @throws FramingException if the inbound bytes violate the framing rules
     * @throws IOException if reading fails, including {@link
     *     java.nio.channels.ClosedByInterruptException} when the session is cancelled
     */
    long frame(Connection connection, ByteBuffer prefetched, MessageSink sink) throws IOException;
}
