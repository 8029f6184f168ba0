package express.mvp.kiva.ipc;

/**
 * Records that the authentication hook refused a connection.
 *
 * <p>The session is closed silently: no reply is written and no message handler is invoked. The
 * exception never propagates out of the session; it is handed to the session-closed callback as
 * the cause of an {@code AUTHENTICATION_REJECTED} outcome.
 */
public class AuthenticationRejectedException extends IpcException {

    private final transient Connection connection;

    /**
     * Creates the rejection record for a connection.
     *
     * @param connection the rejected connection
     */
    public AuthenticationRejectedException(Connection connection) {
        super("Authentication rejected for " + connection);
        this.connection = connection;
    }

    /**
     * Returns the rejected connection.
     *
     * @return the connection the hook refused
     */
    public Connection connection() {
        return connection;
    }
}
