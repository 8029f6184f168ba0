/**
 * Server runtime for Kiva IPC.
 *
 * <p>{@link express.mvp.kiva.server.IpcServer} accepts connections through a {@link
 * express.mvp.kiva.ipc.transport.TransportAdapter}, admits them into a bounded {@link
 * express.mvp.kiva.ipc.ConnectionPool} and runs each admitted connection as an independent session
 * on its own thread. {@link express.mvp.kiva.server.SessionEngine} drives a session through
 * authentication, command negotiation, payload framing and close, calling back into an {@link
 * express.mvp.kiva.server.IpcServerHandler}.
 */
package express.mvp.kiva.server;
