package express.mvp.kiva.ipc.lifecycle;

/**
 * Callback interface for session state change events.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * connection.state().addListener((previous, current, cause) -> {
 *     if (current == SessionState.CLOSED) {
 *         LOGGER.fine("Session closed: " + connection);
 *     }
 * });
 * }</pre>
 *
 * <p>Callbacks run synchronously on the thread that performed the transition, usually the
 * session's own worker thread. Implementations should be quick and non-blocking.
 *
 * @see SessionStateMachine
 */
@FunctionalInterface
public interface SessionStateListener {

    /**
     * Called when the session state changes.
     *
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     * @param cause the reason for the transition (may be null for normal transitions)
     */
    void onStateChanged(SessionState previousState, SessionState currentState, Throwable cause);
}
