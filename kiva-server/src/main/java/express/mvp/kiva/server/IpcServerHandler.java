package express.mvp.kiva.server;

import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.error.SessionOutcome;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callback handler for IpcServer sessions.
 *
 * <p>Every method has a default, so an implementation overrides only what it needs. With no
 * overrides, every peer is accepted and every message is logged.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>For each admitted connection, callbacks are invoked in this order:
 *
 * <ol>
 *   <li>{@link #authenticate(Connection)}: once, before any byte is read
 *   <li>{@link #onMessage(Message)}: once per framed message, in arrival order; never after
 *       authentication was refused or the session was cancelled
 *   <li>{@link #onSessionClosed(Connection, SessionOutcome, Throwable)}: once, after the connection
 *       is closed
 * </ol>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All callbacks for one connection run on that connection's session thread. Callbacks for
 * different connections run concurrently, so shared state in a handler must be thread-safe.
 *
 * <h2>Example Implementation</h2>
 *
 * <pre>{@code
 * IpcServerHandler echo = new IpcServerHandler() {
 *     @Override
 *     public boolean authenticate(Connection connection) {
 *         return connection.identity() instanceof LocalPeerCredentials creds
 *                 && creds.uid() == ALLOWED_UID;
 *     }
 *
 *     @Override
 *     public void onMessage(Message message) throws IOException {
 *         server.sendMessage(message.payload(), message.sender());
 *     }
 * };
 * }</pre>
 *
 * @see IpcServer
 */
public interface IpcServerHandler {

    /**
     * Decides whether a peer may start a session. May block, for example on an external check.
     *
     * @param connection the new connection, with its peer identity already extracted
     * @return true to continue the session, false to close it without reading anything
     * @throws Exception if the check fails; the session ends as failed
     */
    default boolean authenticate(Connection connection) throws Exception {
        return true;
    }

    /**
     * Handles one framed message. May block; the session reads nothing more until it returns.
     *
     * <p>The default logs the payload as text at INFO level.
     *
     * @param message the message
     * @throws Exception if handling fails; the session ends as failed
     */
    default void onMessage(Message message) throws Exception {
        Logger logger = Logger.getLogger(IpcServerHandler.class.getName());
        if (logger.isLoggable(Level.INFO)) {
            logger.info("Received " + message + ": " + message.text());
        }
    }

    /**
     * Called once after a session's connection has been closed.
     *
     * @param connection the closed connection
     * @param outcome how the session ended
     * @param cause what ended the session early, or null for {@link SessionOutcome#COMPLETED}
     */
    default void onSessionClosed(Connection connection, SessionOutcome outcome, Throwable cause) {}
}
