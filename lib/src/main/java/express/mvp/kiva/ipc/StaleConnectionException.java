package express.mvp.kiva.ipc;

/**
 * Thrown when a write targets a connection that is closing, closed, or whose outbound side has
 * already been shut down.
 *
 * <p>The write is rejected before any byte reaches the channel. Senders that broadcast to several
 * connections skip stale targets instead of failing.
 */
public class StaleConnectionException extends IpcException {

    /**
     * Creates the exception for a stale connection.
     *
     * @param connection the connection the write was aimed at
     */
    public StaleConnectionException(Connection connection) {
        super("Connection is no longer writable: " + connection);
    }

    /**
     * Creates the exception with an underlying cause, typically a closed channel.
     *
     * @param connection the connection the write was aimed at
     * @param cause the I/O failure that revealed the connection as stale
     */
    public StaleConnectionException(Connection connection, Throwable cause) {
        super("Connection is no longer writable: " + connection, cause);
    }
}
