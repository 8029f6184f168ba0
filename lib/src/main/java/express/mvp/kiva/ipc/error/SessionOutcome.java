package express.mvp.kiva.ipc.error;

/**
 * How a session ended.
 *
 * <p>Every session ends with exactly one outcome, reported to the server's session-closed hook.
 * Only {@link #COMPLETED} is a normal end; the others name the per-session failure that closed the
 * connection early.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * public void onSessionClosed(Connection connection, SessionOutcome outcome, Throwable cause) {
 *     if (outcome.isFailure()) {
 *         metrics.increment(outcome.name());
 *     }
 * }
 * }</pre>
 *
 * @see OutcomeClassifier
 */
public enum SessionOutcome {

    /** The peer ended its output and every message was handled. */
    COMPLETED(false, "Session completed"),

    /** The authentication hook refused the peer; no message was handled. */
    AUTHENTICATION_REJECTED(true, "Authentication rejected"),

    /** A discrete message grew past the read limit; no message was handled. */
    MESSAGE_LIMIT_EXCEEDED(true, "Message limit exceeded"),

    /**
     * The session was cancelled by pool-wide cancellation or server shutdown.
     *
     * <p>No message is handled after cancellation is observed.
     */
    CANCELLED(true, "Session cancelled"),

    /** Any other failure: I/O errors, framing errors, a throwing handler. */
    FAILED(true, "Session failed");

    private final boolean failure;
    private final String description;

    SessionOutcome(boolean failure, String description) {
        this.failure = failure;
        this.description = description;
    }

    /**
     * Checks whether the session ended abnormally.
     *
     * @return true for every outcome except {@link #COMPLETED}
     */
    public boolean isFailure() {
        return failure;
    }

    /**
     * Returns a human-readable description.
     *
     * @return the description
     */
    public String getDescription() {
        return description;
    }
}
