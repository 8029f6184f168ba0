package express.mvp.kiva.server;

import express.mvp.kiva.ipc.AuthenticationRejectedException;
import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.command.Command;
import express.mvp.kiva.ipc.command.CommandHeader;
import express.mvp.kiva.ipc.error.OutcomeClassifier;
import express.mvp.kiva.ipc.error.SessionOutcome;
import express.mvp.kiva.ipc.framing.ChunkedFramingHandler;
import express.mvp.kiva.ipc.framing.DiscreteFramingHandler;
import express.mvp.kiva.ipc.framing.FramingHandler;
import express.mvp.kiva.ipc.lifecycle.SessionState;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the session of one connection, from authentication to close.
 *
 * <h2>Session States</h2>
 *
 * <pre>
 *  ┌────────────────┐  accepted   ┌─────────┐  end-of-stream  ┌─────────┐        ┌────────┐
 *  │ AUTHENTICATING │ ──────────▶ │ FRAMING │ ──────────────▶ │ CLOSING │ ─────▶ │ CLOSED │
 *  └────────────────┘             └─────────┘  or failure     └─────────┘        └────────┘
 *          │          rejected or failure                          ▲
 *          └───────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Framing</h2>
 *
 * <ol>
 *   <li><b>Command negotiation:</b> before any payload, 8-byte command headers are executed as
 *       they arrive. The first bytes that are not a header end negotiation and become payload.
 *   <li><b>Payload:</b> framed by the connection's mode as it stands after negotiation, discretely
 *       for {@link ConnectionMode#TEXT_DATA} and in chunks otherwise.
 * </ol>
 *
 * <p>Negotiation reads only the bytes still needed to decide the next header, so it never holds
 * more than {@link CommandHeader#WIDTH} bytes. While those bytes are a prefix of some header the
 * engine keeps reading: a streaming peer that sends a lone {@code "@"} and then waits sees it
 * delivered only once more bytes or end-of-stream arrive, together with the bytes read after it.
 * Bytes left over from negotiation are framed like any other read, so chunks still hold at most
 * {@code chunkSize} bytes.
 *
 * <p>A discrete session that carried only commands ends without delivering an empty message.
 *
 * <h2>Cancellation</h2>
 *
 * <p>The session thread is interrupted on cancellation. A blocked read or write then fails with
 * {@link java.nio.channels.ClosedByInterruptException}, and the interrupt status is checked before
 * every handler call, so no message is handled after cancellation is observed.
 *
 * <p>Instances are stateless apart from configuration and may run many sessions concurrently.
 */
public final class SessionEngine {

    private static final Logger LOGGER = Logger.getLogger(SessionEngine.class.getName());

    private static final byte[] PONG = CommandHeader.encode(Command.PONG);

    private final IpcServerHandler handler;
    private final FramingHandler discrete;
    private final FramingHandler chunked;
    private final Duration closeLinger;

    /**
     * Creates an engine.
     *
     * @param config framing and teardown settings
     * @param handler the session callbacks
     */
    public SessionEngine(IpcServerConfig config, IpcServerHandler handler) {
        Objects.requireNonNull(config, "config must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.discrete = new DiscreteFramingHandler(config.getReadLimit(), config.getChunkSize());
        this.chunked = new ChunkedFramingHandler(config.getChunkSize());
        this.closeLinger = config.getCloseLinger();
    }

    /**
     * Runs a session to completion. Exceptions become the session outcome.
     *
     * <p>An {@link Error} also ends the session as {@link SessionOutcome#FAILED}, with the
     * connection closed and the handler notified, and is then rethrown.
     *
     * @param connection the connection to serve; closed when this returns
     * @return how the session ended
     */
    public SessionOutcome run(Connection connection) {
        LOGGER.fine(() -> "Session started: " + connection);
        Throwable failure = null;
        try {
            authenticate(connection);
            connection.state().transitionTo(SessionState.FRAMING);
            frame(connection);
        } catch (Throwable t) {
            failure = t;
        }
        SessionOutcome outcome = finish(connection, failure);
        if (failure instanceof Error error) {
            throw error;
        }
        return outcome;
    }

    /**
     * Ends a session that was cancelled before it ever ran.
     *
     * @param connection the connection that was never served
     * @return {@link SessionOutcome#CANCELLED}
     */
    public SessionOutcome abandon(Connection connection) {
        CancellationException cancelled = new CancellationException("Cancelled before start");
        connection.close();
        connection.state().closeFully(cancelled);
        notifyClosed(connection, SessionOutcome.CANCELLED, cancelled);
        return SessionOutcome.CANCELLED;
    }

    private void authenticate(Connection connection) throws Exception {
        checkCancelled();
        if (!handler.authenticate(connection)) {
            throw new AuthenticationRejectedException(connection);
        }
    }

    private void frame(Connection connection) throws Exception {
        Negotiation negotiation = negotiate(connection);
        ConnectionMode mode = connection.mode();
        FramingHandler framing = mode.isChunked() ? chunked : discrete;

        framing.frame(connection, negotiation.remainder, message -> {
            if (message.isEmpty() && negotiation.commands > 0) {
                return;
            }
            deliver(message);
        });
    }

    /**
     * Executes leading command headers.
     *
     * @return the bytes read past the last header, flipped for reading
     */
    private Negotiation negotiate(Connection connection) throws IOException {
        // reads never go past the header being decided
        ByteBuffer buffer = ByteBuffer.allocate(CommandHeader.WIDTH);
        int commands = 0;
        while (true) {
            buffer.flip();
            switch (CommandHeader.scan(buffer)) {
                case MATCH -> {
                    execute(connection, CommandHeader.decode(buffer));
                    commands++;
                    buffer.compact();
                }
                case NO_MATCH -> {
                    return new Negotiation(buffer, commands);
                }
                case PARTIAL -> {
                    buffer.compact();
                    if (connection.read(buffer) < 0) {
                        buffer.flip();
                        return new Negotiation(buffer, commands);
                    }
                }
            }
        }
    }

    private void execute(Connection connection, Command command) throws IOException {
        LOGGER.fine(() -> "Command " + command + " on " + connection);
        switch (command) {
            case PING -> connection.write(ByteBuffer.wrap(PONG));
            case PONG -> connection.touch();
            case SET_STREAM -> connection.setMode(ConnectionMode.STREAM_DATA);
            case SET_DATA -> connection.setMode(ConnectionMode.TEXT_DATA);
        }
    }

    private void deliver(Message message) throws IOException {
        checkCancelled();
        message.sender().touch();
        try {
            handler.onMessage(message);
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageHandlerException(message, e);
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Session cancelled");
        }
    }

    private SessionOutcome finish(Connection connection, Throwable failure) {
        SessionOutcome outcome = OutcomeClassifier.classify(failure);
        boolean cancelled =
                outcome == SessionOutcome.CANCELLED || Thread.currentThread().isInterrupted();
        if (cancelled) {
            outcome = SessionOutcome.CANCELLED;
        }

        connection.state().transitionTo(SessionState.CLOSING, failure);
        if (!cancelled) {
            drainOutput(connection);
        }
        connection.close();
        connection.state().transitionTo(SessionState.CLOSED, failure);

        log(connection, outcome, failure);
        notifyClosed(connection, outcome, failure);
        return outcome;
    }

    /** Signals end-of-output, then gives the peer the close linger to read it. */
    private void drainOutput(Connection connection) {
        try {
            connection.shutdownOutput();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "End-of-output failed on " + connection, e);
            return;
        }
        if (closeLinger.isZero()) {
            return;
        }
        try {
            Thread.sleep(closeLinger.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void log(Connection connection, SessionOutcome outcome, Throwable failure) {
        if (outcome == SessionOutcome.FAILED) {
            LOGGER.log(Level.WARNING, "Session failed: " + connection, failure);
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Session closed: " + connection + " (" + outcome.getDescription() + ")");
        }
    }

    private void notifyClosed(Connection connection, SessionOutcome outcome, Throwable failure) {
        try {
            handler.onSessionClosed(connection, outcome, failure);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Session-closed callback failed for " + connection, e);
        }
    }

    /** Result of command negotiation. */
    private static final class Negotiation {
        final ByteBuffer remainder;
        final int commands;

        Negotiation(ByteBuffer remainder, int commands) {
            this.remainder = remainder;
            this.commands = commands;
        }
    }
}
