package express.mvp.kiva.ipc.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for a session's lifecycle.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * AUTHENTICATING → FRAMING, CLOSING
 * FRAMING        → CLOSING
 * CLOSING        → CLOSED
 * CLOSED         → (terminal, no transitions)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The session's worker thread drives the transitions, but senders on other threads consult the
 * state before writing. Transitions use compare-and-set so a concurrent reader never sees a state
 * the machine did not pass through.
 *
 * @see SessionState
 * @see SessionStateListener
 */
public final class SessionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(SessionStateMachine.class.getName());

    private static final Set<SessionState> FROM_AUTHENTICATING =
            EnumSet.of(SessionState.FRAMING, SessionState.CLOSING);

    private static final Set<SessionState> FROM_FRAMING = EnumSet.of(SessionState.CLOSING);

    private static final Set<SessionState> FROM_CLOSING = EnumSet.of(SessionState.CLOSED);

    /** Current session state. */
    private final AtomicReference<SessionState> state =
            new AtomicReference<>(SessionState.AUTHENTICATING);

    /** Registered state change listeners. */
    private final List<SessionStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Identifier used in log lines. */
    private final String sessionId;

    /**
     * Creates a new state machine in {@link SessionState#AUTHENTICATING} state.
     *
     * @param sessionId identifier for log lines
     */
    public SessionStateMachine(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * Returns the current state.
     *
     * @return the current session state
     */
    public SessionState getState() {
        return state.get();
    }

    /**
     * Checks if the session is closing or closed.
     *
     * @return true if in CLOSING or CLOSED state
     */
    public boolean isClosingOrClosed() {
        return state.get().isClosingOrClosed();
    }

    /**
     * Checks if the session is fully closed.
     *
     * @return true if in CLOSED state
     */
    public boolean isClosed() {
        return state.get().isClosed();
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(SessionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(SessionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired new state
     * @return true if the transition was successful
     */
    public boolean transitionTo(SessionState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * <p>The cause is passed to listeners and is set when a session ends abnormally.
     *
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was successful
     */
    public boolean transitionTo(SessionState newState, Throwable cause) {
        while (true) {
            SessionState current = state.get();

            if (!isValidTransition(current, newState)) {
                return false;
            }

            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Walks the machine to {@link SessionState#CLOSED} through CLOSING, from whatever state it is
     * in. Does nothing if already closed.
     *
     * @param cause the reason the session ended (may be null)
     */
    public void closeFully(Throwable cause) {
        transitionTo(SessionState.CLOSING, cause);
        transitionTo(SessionState.CLOSED, cause);
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(SessionState from, SessionState to) {
        if (from == to) {
            return false;
        }

        return switch (from) {
            case AUTHENTICATING -> FROM_AUTHENTICATING.contains(to);
            case FRAMING -> FROM_FRAMING.contains(to);
            case CLOSING -> FROM_CLOSING.contains(to);
            case CLOSED -> false;
        };
    }

    private void notifyListeners(SessionState previous, SessionState current, Throwable cause) {
        for (SessionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Session state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "SessionStateMachine[" + sessionId + ":" + state.get() + "]";
    }
}
