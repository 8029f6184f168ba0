/**
 * Session and server lifecycle management.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.kiva.ipc.lifecycle.SessionStateMachine} - per-session state machine
 *       (AUTHENTICATING, FRAMING, CLOSING, CLOSED)
 *   <li>{@link express.mvp.kiva.ipc.lifecycle.ShutdownCoordinator} - orderly server shutdown with
 *       a drain timeout
 *   <li>{@link express.mvp.kiva.ipc.lifecycle.ShutdownPhase} - shutdown phases
 * </ul>
 */
package express.mvp.kiva.ipc.lifecycle;
