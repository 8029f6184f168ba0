/**
 * Core types of Kiva IPC: connections, messages and the bounded session pool.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.kiva.ipc.Connection} - One accepted peer and its session state
 *   <li>{@link express.mvp.kiva.ipc.Message} - Immutable unit of inbound data
 *   <li>{@link express.mvp.kiva.ipc.ConnectionPool} - Bounds and tracks running sessions
 *   <li>{@link express.mvp.kiva.ipc.SessionWorkerPool} - Threads that run sessions
 *   <li>{@link express.mvp.kiva.ipc.IpcException} - Root of the error hierarchy
 * </ul>
 *
 * @see express.mvp.kiva.ipc.transport.TransportAdapter
 * @see express.mvp.kiva.ipc.framing.FramingHandler
 */
package express.mvp.kiva.ipc;
