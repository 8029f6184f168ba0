package express.mvp.kiva.ipc.framing;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.SocketPair;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChunkedFramingHandler} over a loopback connection.
 */
@DisplayName("ChunkedFramingHandler")
class ChunkedFramingHandlerTest {

    private SocketPair sockets;
    private final List<Message> delivered = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        sockets = SocketPair.open();
    }

    @AfterEach
    void tearDown() throws IOException {
        sockets.close();
    }

    private String joined() {
        ByteArrayOutputStream all = new ByteArrayOutputStream();
        for (Message message : delivered) {
            all.writeBytes(message.payload());
        }
        return all.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Rejects a non-positive chunk size")
    void rejectsZeroChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedFramingHandler(0));
    }

    @Test
    @DisplayName("Delivers chunks no larger than the chunk size, in order")
    void deliversBoundedChunksInOrder() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.STREAM_DATA);
        ChunkedFramingHandler handler = new ChunkedFramingHandler(4);
        sockets.peerSends("abcdefghij");
        sockets.peerFinishes();

        long count = handler.frame(connection, null, delivered::add);

        assertEquals(delivered.size(), count);
        assertTrue(count >= 3);
        delivered.forEach(message -> {
            assertTrue(message.size() <= 4);
            assertFalse(message.isEmpty());
            assertEquals(ConnectionMode.STREAM_DATA, message.mode());
        });
        assertEquals("abcdefghij", joined());
    }

    @Test
    @DisplayName("Delivers prefetched bytes as the first chunk")
    void prefetchedFirst() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.STREAM_DATA);
        ChunkedFramingHandler handler = new ChunkedFramingHandler(64);
        sockets.peerFinishes();
        ByteBuffer prefetched = ByteBuffer.wrap("early".getBytes(StandardCharsets.UTF_8));

        handler.frame(connection, prefetched, delivered::add);

        assertEquals(1, delivered.size());
        assertEquals("early", delivered.get(0).text());
        assertFalse(prefetched.hasRemaining());
    }

    @Test
    @DisplayName("Splits prefetched bytes longer than the chunk size")
    void prefetchedSplit() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.STREAM_DATA);
        ChunkedFramingHandler handler = new ChunkedFramingHandler(3);
        sockets.peerFinishes();
        ByteBuffer prefetched = ByteBuffer.wrap("abcdefgh".getBytes(StandardCharsets.UTF_8));

        assertEquals(3, handler.frame(connection, prefetched, delivered::add));

        assertEquals(List.of("abc", "def", "gh"),
                delivered.stream().map(Message::text).collect(Collectors.toList()));
        assertFalse(prefetched.hasRemaining());
    }

    @Test
    @DisplayName("Delivers nothing for an empty stream")
    void emptyStream() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.STREAM_DATA);
        sockets.peerFinishes();

        assertEquals(0, new ChunkedFramingHandler().frame(connection, null, delivered::add));
        assertTrue(delivered.isEmpty());
    }

    @Test
    @DisplayName("Tags chunks with the persistent mode")
    void persistentMode() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.PERSISTENT);
        sockets.peerSends("x");
        sockets.peerFinishes();

        new ChunkedFramingHandler().frame(connection, null, delivered::add);

        assertEquals(ConnectionMode.PERSISTENT, delivered.get(0).mode());
    }

    @Test
    @DisplayName("Propagates sink failures")
    void propagatesSinkFailure() throws IOException {
        Connection connection = sockets.connection(ConnectionMode.STREAM_DATA);
        sockets.peerSends("boom");

        IOException e = assertThrows(IOException.class,
                () -> new ChunkedFramingHandler().frame(connection, null, message -> {
                    throw new IOException("sink failed");
                }));
        assertEquals("sink failed", e.getMessage());
    }
}
