package express.mvp.kiva.ipc;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;

/** A connected loopback TCP pair for tests that need a real channel under a {@link Connection}. */
public final class SocketPair implements AutoCloseable {

    private final SocketChannel serverSide;
    private final SocketChannel peer;

    private SocketPair(SocketChannel serverSide, SocketChannel peer) {
        this.serverSide = serverSide;
        this.peer = peer;
    }

    public static SocketPair open() throws IOException {
        try (ServerSocketChannel listener = ServerSocketChannel.open()) {
            listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            SocketChannel peer = SocketChannel.open(listener.getLocalAddress());
            SocketChannel serverSide = listener.accept();
            return new SocketPair(serverSide, peer);
        }
    }

    /** Wraps the accepting end in a connection. */
    public Connection connection(ConnectionMode mode) throws IOException {
        return new Connection(
                new NetworkPeerAddress(serverSide.getRemoteAddress(), serverSide.getLocalAddress()),
                serverSide,
                mode);
    }

    public SocketChannel serverSide() {
        return serverSide;
    }

    public SocketChannel peer() {
        return peer;
    }

    public void peerSends(String text) throws IOException {
        peerSends(text.getBytes(StandardCharsets.UTF_8));
    }

    public void peerSends(byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            peer.write(buffer);
        }
    }

    public void peerFinishes() throws IOException {
        peer.shutdownOutput();
    }

    /** Reads from the peer end until the accepting end ends its output. */
    public String peerReadsToEnd() throws IOException {
        StringBuilder text = new StringBuilder();
        ByteBuffer buffer = ByteBuffer.allocate(1024);
        while (peer.read(buffer.clear()) >= 0) {
            buffer.flip();
            text.append(StandardCharsets.UTF_8.decode(buffer));
        }
        return text.toString();
    }

    @Override
    public void close() throws IOException {
        try {
            peer.close();
        } finally {
            serverSide.close();
        }
    }
}
