package express.mvp.kiva.ipc.transport;

import express.mvp.kiva.ipc.ListenerSetupException;
import express.mvp.kiva.ipc.PeerIdentity;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.SocketChannel;

/**
 * Transport-specific listener and peer-identity capability.
 *
 * <p>The server core only ever talks to this interface: it binds through {@link #listen()}, runs
 * its accept loop over {@link #accept()}, identifies each peer with {@link
 * #extractIdentity(SocketChannel)}, and tears the listener down with {@link #close()}.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * ┌─────────┐  listen()  ┌───────────┐  close()  ┌────────┐
 * │ CREATED │ ─────────▶ │ LISTENING │ ────────▶ │ CLOSED │
 * └─────────┘            └───────────┘           └────────┘
 *                          accept() *
 * </pre>
 *
 * <p>{@link #close()} may be called from any thread, including while another thread is blocked in
 * {@link #accept()}; the blocked call then fails with {@link
 * java.nio.channels.AsynchronousCloseException}. Closing is idempotent.
 *
 * @see UnixDomainTransportAdapter
 * @see TcpTransportAdapter
 */
public interface TransportAdapter extends AutoCloseable {

    /**
     * Binds the listener.
     *
     * @return the bound address
     * @throws ListenerSetupException if the endpoint cannot be bound
     * @throws IllegalStateException if already listening or closed
     */
    SocketAddress listen();

    /**
     * Waits for the next client.
     *
     * @return the accepted channel, in blocking mode
     * @throws java.nio.channels.ClosedChannelException once the listener is closed
     * @throws IOException if accepting fails
     */
    SocketChannel accept() throws IOException;

    /**
     * Extracts the peer identity of an accepted channel.
     *
     * @param channel a channel returned by {@link #accept()}
     * @return the peer identity
     * @throws IOException if the channel can no longer be queried
     */
    PeerIdentity extractIdentity(SocketChannel channel) throws IOException;

    /**
     * Returns the bound address.
     *
     * @return the address passed to bind, resolved, or null before {@link #listen()}
     */
    SocketAddress localAddress();

    /**
     * Stops listening and releases transport resources.
     *
     * @throws ListenerSetupException if a transport resource could not be released
     */
    @Override
    void close();
}
