package express.mvp.kiva.ipc.transport;

import express.mvp.kiva.ipc.ListenerSetupException;
import express.mvp.kiva.ipc.NetworkPeerAddress;
import express.mvp.kiva.ipc.PeerIdentity;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport adapter for TCP sockets.
 *
 * <p>Peers are identified by their remote and local addresses. Binding to port 0 picks an
 * ephemeral port; {@link #localAddress()} reports the one chosen.
 */
public final class TcpTransportAdapter implements TransportAdapter {

    private static final Logger LOGGER = Logger.getLogger(TcpTransportAdapter.class.getName());

    private final InetSocketAddress bindAddress;
    private final Object lock = new Object();

    private ServerSocketChannel listener;
    private volatile SocketAddress boundAddress;
    private volatile boolean closed;

    /**
     * Creates an adapter that will listen on the given address.
     *
     * @param bindAddress address and port to bind; port 0 for an ephemeral port
     */
    public TcpTransportAdapter(InetSocketAddress bindAddress) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress must not be null");
    }

    @Override
    public SocketAddress listen() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Adapter is closed: " + bindAddress);
            }
            if (listener != null) {
                throw new IllegalStateException("Already listening on " + boundAddress);
            }

            ServerSocketChannel channel = null;
            try {
                channel = ServerSocketChannel.open();
                channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
                channel.bind(bindAddress);
                listener = channel;
                boundAddress = channel.getLocalAddress();
                return boundAddress;
            } catch (IOException e) {
                if (channel != null) {
                    try {
                        channel.close();
                    } catch (IOException suppressed) {
                        e.addSuppressed(suppressed);
                    }
                }
                throw new ListenerSetupException("Cannot listen on " + bindAddress, e);
            }
        }
    }

    @Override
    public SocketChannel accept() throws IOException {
        ServerSocketChannel current;
        synchronized (lock) {
            current = listener;
        }
        if (current == null) {
            throw new ClosedChannelException();
        }
        SocketChannel channel = current.accept();
        try {
            channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Cannot set TCP_NODELAY on accepted channel", e);
        }
        return channel;
    }

    @Override
    public PeerIdentity extractIdentity(SocketChannel channel) throws IOException {
        return new NetworkPeerAddress(channel.getRemoteAddress(), channel.getLocalAddress());
    }

    @Override
    public SocketAddress localAddress() {
        return boundAddress;
    }

    @Override
    public void close() {
        ServerSocketChannel current;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            current = listener;
            listener = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            throw new ListenerSetupException("Cannot close listener on " + boundAddress, e);
        }
    }

    @Override
    public String toString() {
        return "TcpTransportAdapter[" + (boundAddress != null ? boundAddress : bindAddress) + "]";
    }
}
