package express.mvp.kiva.ipc.lifecycle;

/**
 * Represents the states of a server-side session.
 *
 * <p>A session starts when a connection has been admitted to the pool and ends when its channel
 * has been released. State transitions follow a fixed pattern.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌────────────────┐  accepted   ┌───────────┐
 * │ AUTHENTICATING │────────────▶│  FRAMING  │
 * └────────────────┘             └───────────┘
 *         │                            │
 *         │ rejected / cancelled       │ end-of-stream / error / cancelled
 *         ▼                            ▼
 *     ┌──────────────────────────────────┐  released  ┌──────────┐
 *     │             CLOSING              │───────────▶│  CLOSED  │
 *     └──────────────────────────────────┘            └──────────┘
 * </pre>
 *
 * @see SessionStateMachine
 */
public enum SessionState {

    /**
     * The authentication hook is deciding whether to serve the connection.
     *
     * <p>Allowed transitions:
     *
     * <ul>
     *   <li>{@link #FRAMING} - when the hook accepts the connection
     *   <li>{@link #CLOSING} - when the hook rejects it or the session is cancelled
     * </ul>
     */
    AUTHENTICATING(0, "Authenticating", false, false),

    /**
     * Reading commands and payload and delivering messages.
     *
     * <p>Allowed transitions:
     *
     * <ul>
     *   <li>{@link #CLOSING} - on end-of-stream, limit overrun, I/O error or cancellation
     * </ul>
     */
    FRAMING(1, "Framing", true, false),

    /**
     * Pending writes are flushed and end-of-output is signalled.
     *
     * <p>No new writes are accepted. Allowed transitions:
     *
     * <ul>
     *   <li>{@link #CLOSED} - once the channel is released
     * </ul>
     */
    CLOSING(2, "Closing", false, true),

    /** Terminal state. Neither direction of the channel may be used. */
    CLOSED(3, "Closed", false, true);

    private final int order;
    private final String displayName;
    private final boolean readable;
    private final boolean terminal;

    SessionState(int order, String displayName, boolean readable, boolean terminal) {
        this.order = order;
        this.displayName = displayName;
        this.readable = readable;
        this.terminal = terminal;
    }

    /**
     * Returns the numeric order of this state.
     *
     * @return the state order
     */
    public int order() {
        return order;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if inbound bytes are being framed into messages.
     *
     * @return true only in {@link #FRAMING} state
     */
    public boolean isFraming() {
        return readable;
    }

    /**
     * Checks if this is CLOSING or CLOSED.
     *
     * @return true if no more writes should be attempted
     */
    public boolean isClosingOrClosed() {
        return terminal;
    }

    /**
     * Checks if this is the final state.
     *
     * @return true only in {@link #CLOSED} state
     */
    public boolean isClosed() {
        return this == CLOSED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
