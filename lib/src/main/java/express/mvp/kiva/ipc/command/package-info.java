/**
 * The in-band command sub-protocol.
 *
 * <p>Before any payload, a client may send fixed-width command headers ({@link
 * express.mvp.kiva.ipc.command.CommandHeader}) carrying one of the {@link
 * express.mvp.kiva.ipc.command.Command}s. Parsing is advisory: bytes that are not a valid header are
 * framed as payload.
 */
package express.mvp.kiva.ipc.command;
