package express.mvp.kiva.ipc.client;

import express.mvp.kiva.ipc.command.Command;
import express.mvp.kiva.ipc.command.CommandHeader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Blocking client for Kiva IPC servers.
 *
 * <p>Speaks the server's wire rules over either transport: raw payload bytes, the end of output as
 * the message boundary in discrete mode, and 8-byte command headers before any payload.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (IpcClient client = IpcClient.connect(Path.of("/run/app.sock"))) {
 *     byte[] reply = client.request("status".getBytes(StandardCharsets.UTF_8));
 * }
 *
 * try (IpcClient client = IpcClient.connect(Path.of("/run/app.sock"))) {
 *     client.sendCommand(Command.SET_STREAM);
 *     client.send(chunk1);
 *     client.send(chunk2);
 *     client.finishSending();
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe; use one client per thread.
 */
public final class IpcClient implements AutoCloseable {

    private static final int READ_BUFFER_SIZE = 8192;

    private final SocketChannel channel;

    private IpcClient(SocketChannel channel) {
        this.channel = channel;
    }

    /**
     * Connects to a server listening on a Unix domain socket.
     *
     * @param socketPath the server's socket node
     * @return a connected client
     * @throws IOException if the connection fails
     */
    public static IpcClient connect(Path socketPath) throws IOException {
        Objects.requireNonNull(socketPath, "socketPath must not be null");
        return open(SocketChannel.open(StandardProtocolFamily.UNIX),
                UnixDomainSocketAddress.of(socketPath));
    }

    /**
     * Connects to a server listening on TCP.
     *
     * @param address the server's address
     * @return a connected client
     * @throws IOException if the connection fails
     */
    public static IpcClient connect(InetSocketAddress address) throws IOException {
        Objects.requireNonNull(address, "address must not be null");
        return open(SocketChannel.open(), address);
    }

    /**
     * Connects to a server at a bound address as reported by the server.
     *
     * @param address a {@link UnixDomainSocketAddress} or {@link InetSocketAddress}
     * @return a connected client
     * @throws IOException if the connection fails
     * @throws IllegalArgumentException for other address types
     */
    public static IpcClient connect(SocketAddress address) throws IOException {
        if (address instanceof UnixDomainSocketAddress unix) {
            return connect(unix.getPath());
        }
        if (address instanceof InetSocketAddress inet) {
            return connect(inet);
        }
        throw new IllegalArgumentException("Unsupported address type: " + address);
    }

    private static IpcClient open(SocketChannel channel, SocketAddress address)
            throws IOException {
        try {
            channel.connect(address);
            return new IpcClient(channel);
        } catch (IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    /**
     * Writes payload bytes.
     *
     * @param payload the bytes to send
     * @throws IOException if writing fails
     */
    public void send(byte[] payload) throws IOException {
        writeFully(ByteBuffer.wrap(payload));
    }

    /**
     * Writes UTF-8 text.
     *
     * @param text the text to send
     * @throws IOException if writing fails
     */
    public void send(String text) throws IOException {
        send(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a command header. Only meaningful before any payload has been sent.
     *
     * @param command the command to send
     * @throws IOException if writing fails
     */
    public void sendCommand(Command command) throws IOException {
        send(CommandHeader.encode(command));
    }

    /**
     * Ends the outbound side; the server sees end-of-stream.
     *
     * @throws IOException if the shutdown fails
     */
    public void finishSending() throws IOException {
        channel.shutdownOutput();
    }

    /**
     * Reads until the server ends its output.
     *
     * @return every byte received
     * @throws IOException if reading fails
     */
    public byte[] readReply() throws IOException {
        ByteArrayOutputStream reply = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
        while (channel.read(buffer.clear()) >= 0) {
            reply.write(buffer.array(), 0, buffer.position());
        }
        return reply.toByteArray();
    }

    /**
     * Reads whatever one read returns, waiting for at least one byte.
     *
     * @param maxBytes the most bytes to return
     * @return the bytes read; empty once the server has ended its output
     * @throws IOException if reading fails
     */
    public byte[] readAvailable(int maxBytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(maxBytes);
        int n;
        do {
            n = channel.read(buffer);
        } while (n == 0);
        return n < 0 ? new byte[0] : Arrays.copyOf(buffer.array(), n);
    }

    /**
     * Reads exactly {@code length} bytes, or fewer if the server ends its output first.
     *
     * @param length the number of bytes wanted
     * @return the bytes read
     * @throws IOException if reading fails
     */
    public byte[] readFully(int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    /**
     * Sends {@link Command#PING} and waits for the {@link Command#PONG} reply.
     *
     * <p>Only valid before any payload has been sent on this connection.
     *
     * @param timeout how long to wait for the reply
     * @return true if the server answered with PONG in time
     * @throws IOException if the exchange fails
     */
    public boolean ping(Duration timeout) throws IOException {
        sendCommand(Command.PING);
        byte[] reply = readFully(CommandHeader.WIDTH, timeout);
        return Arrays.equals(reply, CommandHeader.encode(Command.PONG));
    }

    /**
     * Sends a discrete request and reads the whole reply.
     *
     * @param payload the request
     * @return the reply bytes
     * @throws IOException if the exchange fails
     */
    public byte[] request(byte[] payload) throws IOException {
        send(payload);
        finishSending();
        return readReply();
    }

    /**
     * Checks whether the channel is still open.
     *
     * @return true until {@link #close()}
     */
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private void writeFully(ByteBuffer source) throws IOException {
        while (source.hasRemaining()) {
            channel.write(source);
        }
    }

    private byte[] readFully(int length, Duration timeout) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        long deadline = System.nanoTime() + timeout.toNanos();
        channel.configureBlocking(false);
        try (Selector selector = Selector.open()) {
            channel.register(selector, SelectionKey.OP_READ);
            while (buffer.hasRemaining()) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    break;
                }
                selector.select(remainingMillis);
                selector.selectedKeys().clear();
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
        } finally {
            // closing the selector deregistered the channel
            channel.configureBlocking(true);
        }
        return Arrays.copyOf(buffer.array(), buffer.position());
    }
}
