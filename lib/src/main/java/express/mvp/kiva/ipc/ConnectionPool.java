package express.mvp.kiva.ipc;

import java.util.concurrent.Future;

/**
 * Bounds and tracks the sessions a server runs concurrently.
 *
 * <p>A pool maps each admitted session's {@link SessionHandle} to the task serving it, and refuses
 * admission once its capacity is reached.
 *
 * <h2>Session Slot Lifecycle</h2>
 *
 * <ol>
 *   <li><b>Admit:</b> {@link #admit(Connection)} atomically reserves a slot, before any session
 *       task exists
 *   <li><b>Register:</b> {@link #register(SessionHandle, Future)} attaches the task serving it
 *   <li><b>Deregister:</b> {@link #deregister(SessionHandle)} frees the slot when the task
 *       finishes, however it finishes
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SessionHandle handle = pool.admit(connection);
 * if (handle == null) {
 *     connection.close();           // full: refuse without a handshake
 *     return;
 * }
 * FutureTask<Void> task = new FutureTask<>(session, null) {
 *     protected void done() {
 *         pool.deregister(handle);
 *     }
 * };
 * pool.register(handle, task);
 * workers.execute(task);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Admission, registration and deregistration are called from the accept thread and from every
 * session's worker thread. Implementations must make them race-free: when one slot remains, at
 * most one of several concurrent admissions succeeds.
 *
 * @see ConnectionPoolImpl
 */
public interface ConnectionPool extends AutoCloseable {

    /** Capacity value meaning "no limit". */
    int UNBOUNDED = 0;

    /**
     * Reserves a session slot for a connection.
     *
     * <p>Has no side effects when the pool is full or closed.
     *
     * @param candidate the connection asking for a session
     * @return the handle of the reserved slot, or null if the pool is full or closed
     */
    SessionHandle admit(Connection candidate);

    /**
     * Attaches the task serving an admitted session.
     *
     * <p>If {@link #cancelAll()} ran after the slot was admitted, the task is cancelled right away.
     *
     * @param handle a handle returned by {@link #admit(Connection)}
     * @param task the task serving the session
     * @throws IllegalStateException if the handle is unknown (never admitted or already freed)
     */
    void register(SessionHandle handle, Future<?> task);

    /**
     * Frees a session slot. Idempotent: only the first call for a handle has an effect.
     *
     * @param handle the slot to free (null is ignored)
     * @return true if this call freed the slot
     */
    boolean deregister(SessionHandle handle);

    /**
     * Requests cancellation of every tracked session.
     *
     * <p>Returns as soon as cancellation has been requested; completion shows up as
     * deregistration.
     *
     * @return the number of sessions asked to cancel
     */
    int cancelAll();

    /**
     * Checks whether an admission would currently be refused for capacity.
     *
     * @return true if every slot is taken
     */
    boolean isFull();

    /**
     * Returns the number of tracked sessions.
     *
     * @return admitted slots not yet freed
     */
    int size();

    /**
     * Returns the configured capacity.
     *
     * @return the maximum number of sessions, or {@link #UNBOUNDED}
     */
    int capacity();

    /** Cancels all sessions and refuses further admissions. */
    @Override
    void close();
}
