package express.mvp.kiva.ipc;

import express.mvp.kiva.ipc.lifecycle.SessionState;
import express.mvp.kiva.ipc.lifecycle.SessionStateMachine;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One accepted client and the state of its session.
 *
 * <p>A connection carries the peer's {@link PeerIdentity}, the blocking {@link SocketChannel} it
 * was accepted on, and a small fixed set of session fields: the framing {@link ConnectionMode},
 * creation and last-update timestamps, and the {@link SessionStateMachine}.
 *
 * <h2>Ownership</h2>
 *
 * <p>The channel is owned by the session task that serves this connection: only that task reads
 * from it, and only that task closes it. Writes may come from other threads (a handler replying
 * from elsewhere, a broadcast); they are serialized by a per-connection write lock and refused with
 * {@link StaleConnectionException} once the session is closing or the outbound side has been shut
 * down.
 *
 * <h2>Timestamps</h2>
 *
 * <p>{@link #updatedAt()} moves forward on every state-affecting event: a mode switch, a message
 * produced from this connection, a reply, a lifecycle transition.
 */
public final class Connection implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Connection.class.getName());

    private static final AtomicLong ID_GEN = new AtomicLong(0);

    private final long id;
    private final PeerIdentity identity;
    private final SocketChannel channel;
    private final SessionStateMachine state;
    private final Instant createdAt;
    private final Object writeLock = new Object();

    private volatile ConnectionMode mode;
    private volatile Instant updatedAt;
    private volatile boolean inputShutdown;
    private volatile boolean outputShutdown;

    /**
     * Creates a connection for a freshly accepted channel.
     *
     * @param identity the peer identity extracted by the transport
     * @param channel the accepted channel, in blocking mode
     * @param initialMode the framing mode to start with
     */
    public Connection(PeerIdentity identity, SocketChannel channel, ConnectionMode initialMode) {
        this.id = ID_GEN.incrementAndGet();
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.mode = Objects.requireNonNull(initialMode, "initialMode must not be null");
        this.state = new SessionStateMachine("conn-" + id);
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.state.addListener((previous, current, cause) -> touch());
    }

    /**
     * Returns the process-unique id of this connection.
     *
     * @return the connection id
     */
    public long id() {
        return id;
    }

    /**
     * Returns the peer identity.
     *
     * @return identity assigned at acceptance
     */
    public PeerIdentity identity() {
        return identity;
    }

    /**
     * Returns the current framing mode.
     *
     * @return the framing mode
     */
    public ConnectionMode mode() {
        return mode;
    }

    /**
     * Switches the framing mode for subsequent reads.
     *
     * @param newMode the mode to switch to
     * @return the previous mode
     */
    public ConnectionMode setMode(ConnectionMode newMode) {
        Objects.requireNonNull(newMode, "newMode must not be null");
        ConnectionMode previous = mode;
        mode = newMode;
        touch();
        return previous;
    }

    /**
     * Returns when this connection was accepted.
     *
     * @return the creation timestamp
     */
    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns when the session state last changed.
     *
     * @return the last-update timestamp
     */
    public Instant updatedAt() {
        return updatedAt;
    }

    /** Records a state-affecting event. */
    public void touch() {
        updatedAt = Instant.now();
    }

    /**
     * Returns the session state machine.
     *
     * @return the state machine of this connection's session
     */
    public SessionStateMachine state() {
        return state;
    }

    /**
     * Returns the current session state.
     *
     * @return the session state
     */
    public SessionState sessionState() {
        return state.getState();
    }

    /**
     * Reads inbound bytes. Blocks until at least one byte is available or the peer ends its
     * output.
     *
     * @param destination buffer to fill
     * @return the number of bytes read, or -1 on end-of-stream
     * @throws IOException if the read fails; {@link java.nio.channels.ClosedByInterruptException}
     *     when the session is cancelled while blocked
     */
    public int read(ByteBuffer destination) throws IOException {
        if (inputShutdown) {
            return -1;
        }
        return channel.read(destination);
    }

    /**
     * Writes all remaining bytes of the buffer, without ending the outbound side.
     *
     * @param source bytes to write
     * @throws StaleConnectionException if the connection is closing, closed or its output is shut
     * @throws IOException if the write fails for another reason
     */
    public void write(ByteBuffer source) throws IOException {
        synchronized (writeLock) {
            ensureWritable();
            writeFully(source);
        }
        touch();
    }

    /**
     * Sends a reply: writes all bytes, waits until they are handed to the transport, then signals
     * end-of-output unless the connection is in {@link ConnectionMode#PERSISTENT} mode.
     *
     * @param payload reply bytes
     * @throws StaleConnectionException if the connection is closing, closed or its output is shut
     * @throws IOException if the write fails for another reason
     */
    public void send(ByteBuffer payload) throws IOException {
        synchronized (writeLock) {
            ensureWritable();
            writeFully(payload);
            if (mode.closesOutputAfterReply()) {
                shutdownOutputLocked();
            }
        }
        touch();
    }

    /**
     * Checks whether a reply could still be written.
     *
     * @return true while the session is not closing and the outbound side is open
     */
    public boolean isWritable() {
        return !outputShutdown && channel.isOpen() && !state.isClosingOrClosed();
    }

    /**
     * Checks whether the channel has been closed.
     *
     * @return true while the channel is open
     */
    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * Marks the inbound side fully consumed and shuts it down. Subsequent reads return -1.
     *
     * @throws IOException if the transport refuses the shutdown
     */
    public void shutdownInput() throws IOException {
        if (inputShutdown) {
            return;
        }
        inputShutdown = true;
        if (channel.isOpen()) {
            channel.shutdownInput();
        }
    }

    /**
     * Signals end-of-output to the peer. Does nothing if already signalled or closed.
     *
     * @throws IOException if the transport refuses the shutdown
     */
    public void shutdownOutput() throws IOException {
        synchronized (writeLock) {
            shutdownOutputLocked();
        }
    }

    /**
     * Releases the channel. Idempotent; failures are logged, not thrown.
     */
    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to close " + this, e);
        }
    }

    private void ensureWritable() {
        if (!isWritable()) {
            throw new StaleConnectionException(this);
        }
    }

    private void writeFully(ByteBuffer source) throws IOException {
        try {
            while (source.hasRemaining()) {
                channel.write(source);
            }
        } catch (AsynchronousCloseException e) {
            // interrupted or closed underneath us: the session is being torn down
            throw e;
        } catch (ClosedChannelException e) {
            throw new StaleConnectionException(this, e);
        }
    }

    private void shutdownOutputLocked() throws IOException {
        if (outputShutdown || !channel.isOpen()) {
            return;
        }
        outputShutdown = true;
        channel.shutdownOutput();
    }

    @Override
    public String toString() {
        return "Connection#" + id + "[" + identity.transport() + " " + identity.describe()
                + ", mode=" + mode + ", state=" + state.getState() + "]";
    }
}
