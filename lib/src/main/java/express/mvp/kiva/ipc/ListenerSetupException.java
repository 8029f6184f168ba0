package express.mvp.kiva.ipc;

/**
 * Thrown when a listening endpoint cannot be created, bound or released.
 *
 * <p>This is the only IPC failure that is fatal to a server: it surfaces from server startup and
 * is not retried automatically. It is also raised when a Unix domain socket node cannot be removed
 * after the listener has been closed.
 */
public class ListenerSetupException extends IpcException {

    /**
     * Constructs a new listener setup exception.
     *
     * @param message the detail message
     */
    public ListenerSetupException(String message) {
        super(message);
    }

    /**
     * Constructs a new listener setup exception with a cause.
     *
     * @param message the detail message
     * @param cause the underlying I/O failure
     */
    public ListenerSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
