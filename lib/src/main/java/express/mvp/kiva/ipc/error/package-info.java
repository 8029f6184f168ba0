/**
 * Session outcome reporting.
 *
 * <p>Per-session failures never leave the session task. Instead the throwable that ended a
 * session is classified by {@link express.mvp.kiva.ipc.error.OutcomeClassifier} into a {@link
 * express.mvp.kiva.ipc.error.SessionOutcome} and handed to whoever observes session ends.
 */
package express.mvp.kiva.ipc.error;
