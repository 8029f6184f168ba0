package express.mvp.kiva.ipc.client;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.kiva.ipc.command.Command;
import express.mvp.kiva.ipc.command.CommandHeader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link IpcClient} against a scripted loopback peer.
 */
@DisplayName("IpcClient")
class IpcClientTest {

    private ServerSocketChannel listener;
    private ExecutorService peer;

    @BeforeEach
    void setUp() throws IOException {
        listener = ServerSocketChannel.open();
        listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        peer = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws IOException {
        peer.shutdownNow();
        listener.close();
    }

    private InetSocketAddress address() throws IOException {
        return (InetSocketAddress) listener.getLocalAddress();
    }

    private static byte[] readToEnd(SocketChannel channel) throws IOException {
        ByteArrayOutputStream all = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(256);
        while (channel.read(buffer.clear()) >= 0) {
            all.write(buffer.array(), 0, buffer.position());
        }
        return all.toByteArray();
    }

    private static void writeAll(SocketChannel channel, byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    @Test
    @DisplayName("request sends, ends output and reads the whole reply")
    void requestReadsWholeReply() throws Exception {
        Future<String> received = peer.submit(() -> {
            try (SocketChannel channel = listener.accept()) {
                byte[] request = readToEnd(channel);
                writeAll(channel, "reply".getBytes(StandardCharsets.UTF_8));
                return new String(request, StandardCharsets.UTF_8);
            }
        });

        try (IpcClient client = IpcClient.connect(address())) {
            byte[] reply = client.request("question".getBytes(StandardCharsets.UTF_8));

            assertEquals("reply", new String(reply, StandardCharsets.UTF_8));
        }
        assertEquals("question", received.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("ping succeeds on a PONG reply")
    void pingSucceeds() throws Exception {
        Future<byte[]> received = peer.submit(() -> {
            try (SocketChannel channel = listener.accept()) {
                ByteBuffer header = ByteBuffer.allocate(CommandHeader.WIDTH);
                while (header.hasRemaining() && channel.read(header) >= 0) {
                    Thread.onSpinWait();
                }
                writeAll(channel, CommandHeader.encode(Command.PONG));
                readToEnd(channel);
                return header.array();
            }
        });

        try (IpcClient client = IpcClient.connect(address())) {
            assertTrue(client.ping(Duration.ofSeconds(5)));
            client.finishSending();
        }
        assertArrayEquals(CommandHeader.encode(Command.PING), received.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("ping fails when no reply arrives in time")
    void pingTimesOut() throws Exception {
        CompletableFuture<Void> done = new CompletableFuture<>();
        peer.submit(() -> {
            try (SocketChannel channel = listener.accept()) {
                done.get(5, TimeUnit.SECONDS);
            }
            return null;
        });

        try (IpcClient client = IpcClient.connect(address())) {
            assertFalse(client.ping(Duration.ofMillis(100)));
            assertTrue(client.isOpen());
        } finally {
            done.complete(null);
        }
    }

    @Test
    @DisplayName("readAvailable returns empty at end-of-stream")
    void readAvailableAtEnd() throws Exception {
        peer.submit(() -> {
            listener.accept().close();
            return null;
        });

        try (IpcClient client = IpcClient.connect(address())) {
            assertEquals(0, client.readAvailable(16).length);
        }
    }

    @Test
    @DisplayName("Rejects unsupported address types")
    void rejectsUnsupportedAddress() {
        SocketAddress unsupported = new SocketAddress() {};

        assertThrows(IllegalArgumentException.class, () -> IpcClient.connect(unsupported));
    }
}
