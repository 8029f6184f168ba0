/**
 * Transport adapters: listener bootstrap and peer identification.
 *
 * <ul>
 *   <li>{@link express.mvp.kiva.ipc.transport.UnixDomainTransportAdapter}: filesystem-addressed
 *       sockets, peers identified by kernel credentials
 *   <li>{@link express.mvp.kiva.ipc.transport.TcpTransportAdapter}: TCP sockets, peers identified
 *       by address
 * </ul>
 */
package express.mvp.kiva.ipc.transport;
