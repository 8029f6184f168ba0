package express.mvp.kiva.ipc.transport;

import express.mvp.kiva.ipc.ListenerSetupException;
import express.mvp.kiva.ipc.LocalPeerCredentials;
import express.mvp.kiva.ipc.PeerIdentity;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.newsclub.net.unix.AFUNIXServerSocketChannel;
import org.newsclub.net.unix.AFUNIXSocketAddress;
import org.newsclub.net.unix.AFUNIXSocketChannel;
import org.newsclub.net.unix.AFUNIXSocketCredentials;

/**
 * Transport adapter for Unix domain sockets addressed by a filesystem path.
 *
 * <h2>Socket Node Lifecycle</h2>
 *
 * <ul>
 *   <li>A file left at the bind path by an earlier process is deleted before binding
 *   <li>A directory at the bind path fails {@link #listen()}
 *   <li>The node is deleted after the listener closes
 * </ul>
 *
 * <h2>Peer Identity</h2>
 *
 * <p>The listener is a junixsocket channel, which reads the peer's process, user and group ids
 * from the kernel. Accepted channels are ordinary {@link SocketChannel}s and are reported to
 * clients as a {@link UnixDomainSocketAddress}. A channel from any other source, or a platform
 * without peer credentials, yields {@link LocalPeerCredentials#UNAVAILABLE}.
 */
public final class UnixDomainTransportAdapter implements TransportAdapter {

    private static final Logger LOGGER =
            Logger.getLogger(UnixDomainTransportAdapter.class.getName());

    private final Path socketPath;
    private final Object lock = new Object();

    private AFUNIXServerSocketChannel listener;
    private volatile SocketAddress boundAddress;
    private volatile boolean closed;

    /**
     * Creates an adapter that will listen on the given path.
     *
     * @param socketPath the filesystem path of the socket node
     */
    public UnixDomainTransportAdapter(Path socketPath) {
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath must not be null");
    }

    /**
     * Returns the socket node path.
     *
     * @return the bind path
     */
    public Path socketPath() {
        return socketPath;
    }

    @Override
    public SocketAddress listen() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Adapter is closed: " + socketPath);
            }
            if (listener != null) {
                throw new IllegalStateException("Already listening on " + socketPath);
            }

            if (Files.isDirectory(socketPath)) {
                throw new ListenerSetupException(
                        "Socket path is a directory: " + socketPath);
            }
            try {
                if (Files.deleteIfExists(socketPath)) {
                    LOGGER.fine(() -> "Removed stale socket node " + socketPath);
                }
            } catch (IOException e) {
                throw new ListenerSetupException("Cannot remove stale socket node " + socketPath, e);
            }

            AFUNIXServerSocketChannel channel = null;
            try {
                channel = AFUNIXServerSocketChannel.open();
                channel.bind(AFUNIXSocketAddress.of(socketPath));
                listener = channel;
                boundAddress = UnixDomainSocketAddress.of(socketPath);
                return boundAddress;
            } catch (IOException | UnsupportedOperationException e) {
                closeQuietly(channel);
                throw new ListenerSetupException("Cannot listen on " + socketPath, e);
            }
        }
    }

    @Override
    public SocketChannel accept() throws IOException {
        AFUNIXServerSocketChannel current;
        synchronized (lock) {
            current = listener;
        }
        if (current == null) {
            throw new ClosedChannelException();
        }
        return current.accept();
    }

    @Override
    public PeerIdentity extractIdentity(SocketChannel channel) throws IOException {
        if (!(channel instanceof AFUNIXSocketChannel unixChannel)) {
            LOGGER.fine(() -> "No peer credentials for " + channel.getClass().getName());
            return LocalPeerCredentials.UNAVAILABLE;
        }
        AFUNIXSocketCredentials credentials;
        try {
            credentials = unixChannel.getPeerCredentials();
        } catch (UnsupportedOperationException e) {
            LOGGER.log(Level.FINE, "Peer credentials not supported on this platform", e);
            return LocalPeerCredentials.UNAVAILABLE;
        }
        if (credentials == null) {
            return LocalPeerCredentials.UNAVAILABLE;
        }
        return new LocalPeerCredentials(
                credentials.getPid(), credentials.getUid(), credentials.getGid());
    }

    @Override
    public SocketAddress localAddress() {
        return boundAddress;
    }

    @Override
    public void close() {
        AFUNIXServerSocketChannel current;
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

        IOException closeFailure = null;
        try {
            current.close();
        } catch (IOException e) {
            closeFailure = e;
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            ListenerSetupException failure =
                    new ListenerSetupException("Cannot remove socket node " + socketPath, e);
            if (closeFailure != null) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        if (closeFailure != null) {
            throw new ListenerSetupException("Cannot close listener on " + socketPath, closeFailure);
        }
    }

    private static void closeQuietly(AFUNIXServerSocketChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close unbound listener", e);
        }
    }

    @Override
    public String toString() {
        return "UnixDomainTransportAdapter[" + socketPath + "]";
    }
}
