package express.mvp.kiva.ipc.error;

import express.mvp.kiva.ipc.AuthenticationRejectedException;
import express.mvp.kiva.ipc.framing.MessageLimitExceededException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.CancellationException;

/**
 * Maps the throwable that ended a session to its {@link SessionOutcome}.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>No throwable: {@link SessionOutcome#COMPLETED}
 *   <li>Cancellation or interruption anywhere in the cause chain: {@link SessionOutcome#CANCELLED}
 *   <li>Authentication refusal and read-limit overrun by type, walking causes
 *   <li>Anything else: {@link SessionOutcome#FAILED}
 * </ol>
 *
 * <p>Cancellation is checked first: once a session is cancelled, the exception that surfaces is
 * whatever the interrupted operation happened to throw, and the cancellation is the real reason.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     engine.run();
 * } catch (Throwable t) {
 *     SessionOutcome outcome = OutcomeClassifier.classify(t);
 * }
 * }</pre>
 */
public final class OutcomeClassifier {

    /** Guards against cyclic cause chains. */
    private static final int MAX_CAUSE_DEPTH = 16;

    private OutcomeClassifier() {
        // Utility class
    }

    /**
     * Classifies a session's terminating throwable.
     *
     * @param throwable what ended the session, or null if it ended normally
     * @return the session outcome
     */
    public static SessionOutcome classify(Throwable throwable) {
        if (throwable == null) {
            return SessionOutcome.COMPLETED;
        }
        if (isCancellation(throwable)) {
            return SessionOutcome.CANCELLED;
        }

        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof AuthenticationRejectedException) {
                return SessionOutcome.AUTHENTICATION_REJECTED;
            }
            if (current instanceof MessageLimitExceededException) {
                return SessionOutcome.MESSAGE_LIMIT_EXCEEDED;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return SessionOutcome.FAILED;
    }

    /**
     * Checks whether a throwable, or any of its causes, signals cancellation.
     *
     * @param throwable the throwable to inspect
     * @return true for cancellation, thread interruption and interrupted channel I/O
     */
    public static boolean isCancellation(Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CancellationException
                    || current instanceof InterruptedException
                    || current instanceof ClosedByInterruptException
                    || current instanceof InterruptedIOException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
