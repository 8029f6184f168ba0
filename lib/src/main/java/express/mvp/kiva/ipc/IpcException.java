package express.mvp.kiva.ipc;

/**
 * Unchecked exception thrown when IPC operations fail.
 *
 * <p>This is the root of the IPC error taxonomy. It wraps I/O errors, listener failures and
 * protocol violations that occur while serving sessions. It extends {@link RuntimeException} to
 * avoid cluttering handler signatures with checked exceptions.
 *
 * <h2>Subtypes</h2>
 *
 * <ul>
 *   <li>{@link ListenerSetupException} - the listening endpoint cannot be bound or released
 *   <li>{@link AuthenticationRejectedException} - the authentication hook refused a connection
 *   <li>{@link StaleConnectionException} - a write targeted a closing or closed connection
 *   <li>{@link express.mvp.kiva.ipc.framing.FramingException} - payload framing failed
 * </ul>
 *
 * <p>Only {@link ListenerSetupException} ever reaches the caller of server startup or shutdown.
 * The others terminate a single session and are reported as its outcome.
 *
 * @see express.mvp.kiva.ipc.error.OutcomeClassifier
 */
public class IpcException extends RuntimeException {

    /**
     * Constructs a new IPC exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public IpcException(String message) {
        super(message);
    }

    /**
     * Constructs a new IPC exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public IpcException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new IPC exception with the specified cause.
     *
     * @param cause the underlying cause of the failure
     */
    public IpcException(Throwable cause) {
        super(cause);
    }
}
