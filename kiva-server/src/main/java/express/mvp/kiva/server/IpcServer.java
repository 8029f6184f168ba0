package express.mvp.kiva.server;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionPool;
import express.mvp.kiva.ipc.ConnectionPoolImpl;
import express.mvp.kiva.ipc.IpcException;
import express.mvp.kiva.ipc.ListenerSetupException;
import express.mvp.kiva.ipc.PeerIdentity;
import express.mvp.kiva.ipc.SessionHandle;
import express.mvp.kiva.ipc.SessionWorkerPool;
import express.mvp.kiva.ipc.StaleConnectionException;
import express.mvp.kiva.ipc.error.SessionOutcome;
import express.mvp.kiva.ipc.lifecycle.ShutdownCoordinator;
import express.mvp.kiva.ipc.lifecycle.ShutdownListener;
import express.mvp.kiva.ipc.lifecycle.ShutdownPhase;
import express.mvp.kiva.ipc.transport.TcpTransportAdapter;
import express.mvp.kiva.ipc.transport.TransportAdapter;
import express.mvp.kiva.ipc.transport.UnixDomainTransportAdapter;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IPC server: accepts connections and runs one session per admitted connection.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                         IpcServer                           │
 * ├─────────────────────────────────────────────────────────────┤
 * │   ┌──────────────────┐       ┌──────────────────────────┐   │
 * │   │ TransportAdapter │       │      ConnectionPool      │   │
 * │   │ (unix / tcp)     │       │  handle ─▶ session task  │   │
 * │   └────────┬─────────┘       └─────────────▲────────────┘   │
 * │            │ accept()                      │ admit/register │
 * │            ▼                               │                │
 * │   ┌─────────────────────────────────────────────────────┐   │
 * │   │                  Accept thread                      │   │
 * │   │  • extracts peer identity, builds the Connection    │   │
 * │   │  • full pool: closes the connection, no handshake   │   │
 * │   │  • otherwise: hands it to a session thread          │   │
 * │   └─────────────────────────────────────────────────────┘   │
 * │            │                                                │
 * │            ▼                                                │
 * │   ┌──────────┐ ┌──────────┐ ┌──────────┐                    │
 * │   │ session  │ │ session  │ │ session  │  SessionEngine     │
 * │   └──────────┘ └──────────┘ └──────────┘  per connection    │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * IpcServerHandler handler = new IpcServerHandler() {
 *     @Override
 *     public void onMessage(Message message) throws IOException {
 *         server.sendMessage("ok", message.sender());
 *     }
 * };
 *
 * try (IpcServer server = IpcServer.unixDomain(Path.of("/run/app.sock"),
 *         IpcServerConfig.defaults(), handler)) {
 *     server.start();
 *     ...
 * }
 * }</pre>
 *
 * <h2>Failure Containment</h2>
 *
 * <ul>
 *   <li>Bind failures fail {@link #start()} with {@link ListenerSetupException}
 *   <li>Accept failures are logged and the accept loop continues
 *   <li>Session failures end only their session and are reported to {@link
 *       IpcServerHandler#onSessionClosed}
 * </ul>
 *
 * @see IpcServerConfig
 * @see IpcServerHandler
 * @see SessionEngine
 */
public class IpcServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(IpcServer.class.getName());

    /** Pause after a failed accept, so a persistent failure does not spin. */
    private static final long ACCEPT_RETRY_PAUSE_MS = 50;

    private final IpcServerConfig config;
    private final TransportAdapter adapter;
    private final ConnectionPool pool;
    private final SessionWorkerPool workers;
    private final ShutdownCoordinator coordinator = new ShutdownCoordinator();
    private final SessionEngine engine;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong rejectedConnections = new AtomicLong(0);
    private final AtomicReference<RuntimeException> teardownFailure = new AtomicReference<>();

    /** The thread that runs the accept loop. */
    private volatile Thread acceptThread;

    private volatile SocketAddress localAddress;

    /**
     * Creates a server over any transport.
     *
     * @param config server configuration
     * @param adapter the transport to listen on
     * @param handler session callbacks
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The server owns the adapter for its whole lifetime.")
    public IpcServer(IpcServerConfig config, TransportAdapter adapter, IpcServerHandler handler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        this.engine = new SessionEngine(config, handler);
        this.pool = new ConnectionPoolImpl(config.getMaxConnections());
        this.workers = SessionWorkerPool.create(config.getThreadNamePrefix());
        coordinator.addListener(new ShutdownLog());
    }

    /**
     * Creates a server listening on a Unix domain socket.
     *
     * @param socketPath the socket node path
     * @param config server configuration
     * @param handler session callbacks
     * @return a new, unstarted server
     */
    public static IpcServer unixDomain(
            Path socketPath, IpcServerConfig config, IpcServerHandler handler) {
        return new IpcServer(config, new UnixDomainTransportAdapter(socketPath), handler);
    }

    /**
     * Creates a server listening on TCP.
     *
     * @param bindAddress the address to bind; port 0 for an ephemeral port
     * @param config server configuration
     * @param handler session callbacks
     * @return a new, unstarted server
     */
    public static IpcServer tcp(
            InetSocketAddress bindAddress, IpcServerConfig config, IpcServerHandler handler) {
        return new IpcServer(config, new TcpTransportAdapter(bindAddress), handler);
    }

    /**
     * Binds the listener and starts accepting connections.
     *
     * <p>Binding happens on the calling thread, so the server is reachable when this returns.
     *
     * @return the bound address
     * @throws ListenerSetupException if the listener cannot be bound
     * @throws IllegalStateException if the server was already started
     */
    public SocketAddress start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        SocketAddress bound;
        try {
            bound = adapter.listen();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        localAddress = bound;
        running.set(true);

        Thread thread = new Thread(this::acceptLoop, config.getThreadNamePrefix() + "-accept");
        thread.setDaemon(true);
        acceptThread = thread;
        thread.start();

        LOGGER.info(() -> "Listening on " + bound + " with " + config);
        return bound;
    }

    private void acceptLoop() {
        while (running.get()) {
            SocketChannel channel;
            try {
                channel = adapter.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (!running.get()) {
                    break;
                }
                LOGGER.log(Level.WARNING, "Accept failed on " + localAddress, e);
                if (!pauseAfterAcceptFailure()) {
                    break;
                }
                continue;
            }
            onAccept(channel);
        }
        LOGGER.fine(() -> "Accept loop stopped on " + localAddress);
    }

    private static boolean pauseAfterAcceptFailure() {
        try {
            Thread.sleep(ACCEPT_RETRY_PAUSE_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Turns an accepted channel into a session, or refuses it.
     *
     * <p>A connection is refused, closed at once without any byte exchanged, when the pool is
     * full or the server is shutting down.
     *
     * @param channel the accepted channel
     */
    void onAccept(SocketChannel channel) {
        Connection connection;
        try {
            PeerIdentity identity = adapter.extractIdentity(channel);
            connection = new Connection(identity, channel, config.getDefaultMode());
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cannot identify accepted peer, closing", e);
            closeUnidentified(channel);
            return;
        }

        SessionHandle handle = coordinator.isAcceptingSessions() ? pool.admit(connection) : null;
        if (handle == null) {
            refuse(connection);
            return;
        }
        if (!coordinator.sessionStarted()) {
            pool.deregister(handle);
            refuse(connection);
            return;
        }

        SessionTask task = new SessionTask(connection, handle);
        pool.register(handle, task);
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Worker pool refused " + connection, e);
            task.cancel(false);
        }
    }

    private void refuse(Connection connection) {
        rejectedConnections.incrementAndGet();
        LOGGER.fine(() -> "Refused " + connection
                + (coordinator.isAcceptingSessions() ? ": pool full" : ": shutting down"));
        connection.close();
        connection.state().closeFully(null);
    }

    private static void closeUnidentified(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to close unidentified channel", e);
        }
    }

    /**
     * Sends a reply to one connection.
     *
     * <p>Writes the payload, waits for it to be written, then signals end-of-output unless the
     * connection is in {@link express.mvp.kiva.ipc.ConnectionMode#PERSISTENT} mode.
     *
     * @param payload the bytes to send
     * @param connection the target
     * @throws StaleConnectionException if the connection is closing, closed or already replied to
     * @throws IOException if the write fails
     */
    public void sendMessage(byte[] payload, Connection connection) throws IOException {
        Objects.requireNonNull(payload, "payload must not be null");
        connection.send(ByteBuffer.wrap(payload));
    }

    /**
     * Sends UTF-8 text to one connection.
     *
     * @param text the text to send
     * @param connection the target
     * @throws StaleConnectionException if the connection is closing, closed or already replied to
     * @throws IOException if the write fails
     */
    public void sendMessage(String text, Connection connection) throws IOException {
        sendMessage(text.getBytes(StandardCharsets.UTF_8), connection);
    }

    /**
     * Sends the same payload to several connections, skipping those that cannot take it.
     *
     * @param payload the bytes to send
     * @param connections the targets
     * @return the number of connections the payload was written to
     */
    public int sendMessage(byte[] payload, Collection<Connection> connections) {
        Objects.requireNonNull(payload, "payload must not be null");
        int written = 0;
        for (Connection connection : connections) {
            try {
                connection.send(ByteBuffer.wrap(payload));
                written++;
            } catch (StaleConnectionException e) {
                LOGGER.fine(() -> "Skipped stale " + connection);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Send failed on " + connection, e);
            }
        }
        return written;
    }

    /**
     * Sends the same UTF-8 text to several connections, skipping those that cannot take it.
     *
     * @param text the text to send
     * @param connections the targets
     * @return the number of connections the text was written to
     */
    public int sendMessage(String text, Collection<Connection> connections) {
        return sendMessage(text.getBytes(StandardCharsets.UTF_8), connections);
    }

    /**
     * Cancels every running session without stopping the listener.
     *
     * @return the number of sessions asked to cancel
     */
    public int cancelAllSessions() {
        return pool.cancelAll();
    }

    /**
     * Stops immediately: cancels every session, then closes the listener.
     *
     * <p>Idempotent.
     *
     * @throws ListenerSetupException if the transport could not be torn down cleanly
     */
    @Override
    public void close() {
        coordinator.shutdownNow(pool::close, this::releaseTransport);
        rethrowTeardownFailure();
    }

    /**
     * Shuts down gracefully with the configured shutdown timeout.
     *
     * @return true if every session finished on its own
     * @throws InterruptedException if interrupted while waiting
     * @see #shutdown(Duration)
     */
    public boolean shutdown() throws InterruptedException {
        return shutdown(config.getShutdownTimeout());
    }

    /**
     * Shuts down gracefully: refuses new connections, waits for running sessions to finish, then
     * cancels whatever is left and closes the listener.
     *
     * @param drainTimeout how long to wait for sessions to finish on their own
     * @return true if every session finished on its own
     * @throws InterruptedException if interrupted while waiting; the server is still torn down
     * @throws ListenerSetupException if the transport could not be torn down cleanly
     */
    public boolean shutdown(Duration drainTimeout) throws InterruptedException {
        boolean graceful = coordinator.shutdown(drainTimeout, pool::close, this::releaseTransport);
        rethrowTeardownFailure();
        return graceful;
    }

    private void releaseTransport() {
        running.set(false);
        try {
            adapter.close();
        } catch (IpcException e) {
            teardownFailure.compareAndSet(null, e);
        }
        workers.shutdownNow();

        Thread thread = acceptThread;
        try {
            if (thread != null && thread != Thread.currentThread()) {
                thread.interrupt();
                thread.join(config.getShutdownTimeout().toMillis());
            }
            if (!workers.awaitTermination(config.getShutdownTimeout())) {
                LOGGER.fine(() -> "Not waiting for session threads: " + workers);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (localAddress != null) {
            LOGGER.info(() -> "Stopped listening on " + localAddress);
        }
    }

    private void rethrowTeardownFailure() {
        RuntimeException failure = teardownFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Registers a listener for shutdown phases, drain progress and completion.
     *
     * @param listener the listener to add
     */
    public void addShutdownListener(ShutdownListener listener) {
        coordinator.addListener(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Removes a shutdown listener.
     *
     * @param listener the listener to remove
     * @return true if it was registered
     */
    public boolean removeShutdownListener(ShutdownListener listener) {
        return coordinator.removeListener(listener);
    }

    /**
     * Returns where the server is in its shutdown sequence.
     *
     * @return {@link ShutdownPhase#RUNNING} until shutdown begins
     */
    public ShutdownPhase shutdownPhase() {
        return coordinator.getPhase();
    }

    /**
     * Returns the number of sessions currently in the pool.
     *
     * @return active sessions
     */
    public int activeSessions() {
        return pool.size();
    }

    /**
     * Returns how many connections were closed without a session.
     *
     * @return refused connections since start
     */
    public long rejectedConnections() {
        return rejectedConnections.get();
    }

    /**
     * Checks whether the server is accepting connections.
     *
     * @return true between {@link #start()} and shutdown
     */
    public boolean isRunning() {
        return running.get() && coordinator.isAcceptingSessions();
    }

    /**
     * Returns the bound listener address.
     *
     * @return the address, or null before {@link #start()}
     */
    public SocketAddress localAddress() {
        return localAddress;
    }

    /**
     * Returns the server configuration.
     *
     * @return the configuration
     */
    public IpcServerConfig config() {
        return config;
    }

    /**
     * Waits until the server has been shut down.
     *
     * @param timeout how long to wait
     * @return true if the server terminated in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return coordinator.awaitTermination(timeout);
    }

    /**
     * Session task that frees its pool slot when it finishes, however it finishes.
     *
     * <p>Exactly one of the run path and the cancelled-before-run path claims the session; the
     * claimant closes the connection and frees the slot.
     */
    private final class SessionTask extends FutureTask<SessionOutcome> {
        private final Connection connection;
        private final SessionHandle handle;
        private final AtomicBoolean claimed;

        SessionTask(Connection connection, SessionHandle handle) {
            this(connection, handle, new AtomicBoolean(false));
        }

        private SessionTask(Connection connection, SessionHandle handle, AtomicBoolean claimed) {
            super(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return SessionOutcome.CANCELLED;
                }
                try {
                    return engine.run(connection);
                } finally {
                    release(handle);
                }
            });
            this.connection = connection;
            this.handle = handle;
            this.claimed = claimed;
        }

        /** Also closes the connection, so I/O blocked on it ends even without an interrupt. */
        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            if (cancelled && mayInterruptIfRunning) {
                connection.close();
            }
            return cancelled;
        }

        @Override
        protected void done() {
            if (claimed.compareAndSet(false, true)) {
                try {
                    engine.abandon(connection);
                } finally {
                    release(handle);
                }
            }
        }
    }

    private void release(SessionHandle handle) {
        if (pool.deregister(handle)) {
            coordinator.sessionCompleted();
        }
    }

    /** Logs the shutdown sequence. */
    private final class ShutdownLog implements ShutdownListener {

        @Override
        public void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase) {
            if (currentPhase == ShutdownPhase.DRAINING) {
                LOGGER.info(() -> "Draining " + coordinator.getRunningCount() + " sessions on "
                        + localAddress);
            } else {
                LOGGER.fine(() -> "Shutdown phase " + previousPhase + " -> " + currentPhase);
            }
        }

        @Override
        public void onDrainProgress(int remainingSessions, int totalSessions) {
            LOGGER.fine(() -> "Drained " + (totalSessions - remainingSessions) + "/"
                    + totalSessions + " sessions");
        }

        @Override
        public void onShutdownComplete(boolean graceful, long durationMs) {
            LOGGER.info(() -> "Shut down in " + durationMs + " ms (graceful=" + graceful + ")");
        }
    }
}
