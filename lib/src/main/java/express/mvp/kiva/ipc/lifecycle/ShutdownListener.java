package express.mvp.kiva.ipc.lifecycle;

/**
 * Callback interface for shutdown lifecycle events.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * coordinator.addListener(new ShutdownListener() {
 *     @Override
 *     public void onPhaseChange(ShutdownPhase previous, ShutdownPhase current) {
 *         LOGGER.info("Shutdown phase: " + previous + " -> " + current);
 *     }
 *
 *     @Override
 *     public void onShutdownComplete(boolean graceful, long durationMs) {
 *         LOGGER.info("Stopped in " + durationMs + "ms, graceful=" + graceful);
 *     }
 * });
 * }</pre>
 *
 * <p>Callbacks may arrive on the thread calling shutdown or on a session worker thread that
 * finishes while the server drains. Implementations must be thread-safe.
 *
 * @see ShutdownCoordinator
 */
public interface ShutdownListener {

    /**
     * Called for every phase transition.
     *
     * @param previousPhase the phase being exited
     * @param currentPhase the phase being entered
     */
    void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase);

    /**
     * Called whenever a session finishes while the server drains.
     *
     * @param remainingSessions number of sessions still running
     * @param totalSessions number of sessions running when draining started
     */
    default void onDrainProgress(int remainingSessions, int totalSessions) {}

    /**
     * Called once the coordinator reaches {@link ShutdownPhase#TERMINATED}.
     *
     * @param graceful true if every session finished before the drain timeout
     * @param durationMs total shutdown duration in milliseconds
     */
    void onShutdownComplete(boolean graceful, long durationMs);

    /**
     * Called if a shutdown step throws. Shutdown continues regardless.
     *
     * @param phase the phase where the error occurred
     * @param error the exception that was thrown
     */
    default void onShutdownError(ShutdownPhase phase, Throwable error) {}
}
