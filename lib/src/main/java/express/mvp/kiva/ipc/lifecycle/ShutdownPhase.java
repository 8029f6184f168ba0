package express.mvp.kiva.ipc.lifecycle;

/**
 * Represents the phases of server shutdown.
 *
 * <h2>Phase Transitions</h2>
 *
 * <pre>
 * RUNNING ──▶ DRAINING ──▶ CLOSING ──▶ TERMINATED
 *    │                        ▲
 *    └────── shutdownNow ─────┘
 * </pre>
 *
 * <ul>
 *   <li>{@link #RUNNING}: admitting new sessions
 *   <li>{@link #DRAINING}: no new sessions, running ones may finish on their own
 *   <li>{@link #CLOSING}: remaining sessions are cancelled, the listener is torn down
 *   <li>{@link #TERMINATED}: all resources released
 * </ul>
 *
 * @see ShutdownCoordinator
 */
public enum ShutdownPhase {

    /** Normal operation: connections are accepted and admitted. */
    RUNNING("Running"),

    /** Graceful shutdown initiated: running sessions are given time to complete. */
    DRAINING("Draining"),

    /** Remaining sessions are cancelled and transport resources released. */
    CLOSING("Closing"),

    /** Terminal phase. The server instance cannot be restarted. */
    TERMINATED("Terminated");

    private final String displayName;

    ShutdownPhase(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Checks if new sessions may be admitted.
     *
     * @return true only in {@link #RUNNING} phase
     */
    public boolean isAcceptingSessions() {
        return this == RUNNING;
    }

    /**
     * Checks if shutdown is complete.
     *
     * @return true only in {@link #TERMINATED} phase
     */
    public boolean isTerminated() {
        return this == TERMINATED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
