package express.mvp.kiva.server;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.kiva.ipc.Connection;
import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.ListenerSetupException;
import express.mvp.kiva.ipc.LocalPeerCredentials;
import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.StaleConnectionException;
import express.mvp.kiva.ipc.client.IpcClient;
import express.mvp.kiva.ipc.command.Command;
import express.mvp.kiva.ipc.error.SessionOutcome;
import express.mvp.kiva.ipc.lifecycle.SessionState;
import express.mvp.kiva.ipc.lifecycle.ShutdownListener;
import express.mvp.kiva.ipc.lifecycle.ShutdownPhase;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end tests for {@link IpcServer} with real clients over Unix domain sockets and TCP.
 */
@DisplayName("IpcServer")
class IpcServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private Path socketPath;
    private RecordingHandler handler;
    private IpcServer server;
    private final List<IpcClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() {
        socketPath = tempDir.resolve("kiva.sock");
        handler = new RecordingHandler();
    }

    @AfterEach
    void tearDown() throws IOException {
        for (IpcClient client : clients) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }

    private static IpcServerConfig.Builder config() {
        return IpcServerConfig.builder()
                .closeLinger(Duration.ofMillis(10))
                .shutdownTimeout(Duration.ofSeconds(2));
    }

    private void startUnix(IpcServerConfig.Builder config) {
        server = IpcServer.unixDomain(socketPath, config.build(), handler);
        server.start();
    }

    private IpcClient connect() throws IOException {
        IpcClient client = IpcClient.connect(server.localAddress());
        clients.add(client);
        return client;
    }

    private static void await(BooleanSupplier condition, String description)
            throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start binds the socket node and close removes it")
        void startAndClose() {
            startUnix(config());

            assertTrue(server.isRunning());
            assertTrue(Files.exists(socketPath));

            server.close();

            assertFalse(server.isRunning());
            assertFalse(Files.exists(socketPath));
        }

        @Test
        @DisplayName("start twice is an error")
        void startTwice() {
            startUnix(config());

            assertThrows(IllegalStateException.class, server::start);
        }

        @Test
        @DisplayName("Bind failures surface from start")
        void bindFailure() throws IOException {
            Files.createDirectory(socketPath);
            server = IpcServer.unixDomain(socketPath, config().build(), handler);

            assertThrows(ListenerSetupException.class, server::start);
            assertNull(server.localAddress());
            assertFalse(server.isRunning());
            assertDoesNotThrow(server::close);
        }

        @Test
        @DisplayName("start can be retried after a bind failure")
        void startRetriedAfterBindFailure() throws Exception {
            Files.createDirectory(socketPath);
            handler.action = message -> server.sendMessage("up", message.sender());
            server = IpcServer.unixDomain(socketPath, config().build(), handler);
            assertThrows(ListenerSetupException.class, server::start);

            Files.delete(socketPath);
            server.start();

            assertTrue(server.isRunning());
            assertEquals("up", utf8(connect().request(new byte[] {1})));
        }

        @Test
        @DisplayName("A stale socket node is replaced")
        void staleNodeReplaced() throws Exception {
            Files.writeString(socketPath, "stale");
            handler.action = message -> server.sendMessage("fresh", message.sender());
            startUnix(config());

            assertEquals("fresh", utf8(connect().request(new byte[] {1})));
        }

        @Test
        @DisplayName("Peers are identified by their credentials")
        void peerCredentials() throws Exception {
            startUnix(config());
            Path owned = Files.createFile(tempDir.resolve("owned"));
            long uid = ((Number) Files.getAttribute(owned, "unix:uid")).longValue();

            connect().request("who".getBytes(StandardCharsets.UTF_8));

            Message message = handler.nextMessage();
            LocalPeerCredentials credentials =
                    assertInstanceOf(LocalPeerCredentials.class, message.sender().identity());
            assertEquals(ProcessHandle.current().pid(), credentials.pid());
            assertEquals(uid, credentials.uid());
        }

        @Test
        @DisplayName("Serves TCP clients")
        void servesTcp() throws Exception {
            handler.action = message ->
                    server.sendMessage("tcp:" + message.text(), message.sender());
            server = IpcServer.tcp(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                    config().build(), handler);
            InetSocketAddress bound = (InetSocketAddress) server.start();

            assertTrue(bound.getPort() > 0);
            assertEquals("tcp:hi", utf8(connect().request("hi".getBytes(StandardCharsets.UTF_8))));
            assertEquals("tcp", handler.nextMessage().sender().identity().transport());
        }
    }

    @Nested
    @DisplayName("Discrete messages")
    class DiscreteTests {

        @Test
        @DisplayName("One message per connection, delivered at end-of-stream")
        void oneMessagePerConnection() throws Exception {
            handler.action = message -> server.sendMessage("ok", message.sender());
            startUnix(config());

            IpcClient client = connect();
            client.send("hello ");
            client.send("world");
            client.finishSending();

            assertEquals("ok", utf8(client.readReply()));
            Message message = handler.nextMessage();
            assertEquals("hello world", message.text());
            assertEquals(ConnectionMode.TEXT_DATA, message.mode());
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
        }

        @Test
        @DisplayName("A second reply to the same connection is stale")
        void secondReplyIsStale() throws Exception {
            AtomicReference<Throwable> secondReply = new AtomicReference<>();
            handler.action = message -> {
                server.sendMessage("first", message.sender());
                try {
                    server.sendMessage("second", message.sender());
                } catch (StaleConnectionException e) {
                    secondReply.set(e);
                }
            };
            startUnix(config());

            assertEquals("first", utf8(connect().request(new byte[] {1})));
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            assertInstanceOf(StaleConnectionException.class, secondReply.get());
        }

        @Test
        @DisplayName("A message over the read limit is never delivered")
        void readLimitExceeded() throws Exception {
            startUnix(config().readLimit(10));

            IpcClient client = connect();
            client.send("0123456789A");
            client.finishSending();

            assertEquals(SessionOutcome.MESSAGE_LIMIT_EXCEEDED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
        }

        @Test
        @DisplayName("The read limit ends a session whose peer keeps its output open")
        void readLimitExceededWithoutEndOfStream() throws Exception {
            startUnix(config().readLimit(10));

            connect().send("0123456789A");

            assertEquals(SessionOutcome.MESSAGE_LIMIT_EXCEEDED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
            assertEquals(SessionState.CLOSED, handler.connections.get(0).sessionState());
        }

        @Test
        @DisplayName("A message at the read limit is delivered")
        void readLimitExact() throws Exception {
            startUnix(config().readLimit(10));

            connect().request("0123456789".getBytes(StandardCharsets.UTF_8));

            assertEquals("0123456789", handler.nextMessage().text());
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
        }

        @Test
        @DisplayName("A connection with no bytes yields one empty message")
        void emptyMessage() throws Exception {
            startUnix(config());

            connect().request(new byte[0]);

            assertTrue(handler.nextMessage().isEmpty());
        }

        @Test
        @DisplayName("Handler failures end only their session")
        void handlerFailure() throws Exception {
            handler.action = message -> {
                if (message.text().equals("bad")) {
                    throw new IllegalStateException("handler failure");
                }
                server.sendMessage("good", message.sender());
            };
            startUnix(config());

            connect().request("bad".getBytes(StandardCharsets.UTF_8));
            assertEquals(SessionOutcome.FAILED, handler.nextOutcome());

            assertEquals("good", utf8(connect().request("fine".getBytes(StandardCharsets.UTF_8))));
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
        }

        @Test
        @DisplayName("A handler Error still closes the session and reports it")
        void handlerError() throws Exception {
            handler.action = message -> {
                throw new AssertionError("handler broke");
            };
            startUnix(config());

            IpcClient client = connect();
            client.send("x");
            client.finishSending();

            assertEquals(SessionOutcome.FAILED, handler.nextOutcome());
            assertEquals(SessionState.CLOSED, handler.connections.get(0).sessionState());
            assertEquals(0, client.readReply().length);
            await(() -> server.activeSessions() == 0, "the slot to be freed");
        }
    }

    @Nested
    @DisplayName("Authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("Rejected peers deliver nothing")
        void rejectedPeer() throws Exception {
            handler.authenticator = connection -> false;
            startUnix(config());

            IpcClient client = connect();
            client.send("secret");
            client.finishSending();

            assertEquals(SessionOutcome.AUTHENTICATION_REJECTED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
            assertEquals(SessionState.CLOSED, handler.connections.get(0).sessionState());
        }

        @Test
        @DisplayName("Authentication failures are treated as failures")
        void authenticatorThrows() throws Exception {
            handler.authenticator = connection -> {
                throw new IllegalStateException("directory unavailable");
            };
            startUnix(config());

            connect().finishSending();

            assertEquals(SessionOutcome.FAILED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
        }
    }

    @Nested
    @DisplayName("Streamed messages")
    class StreamTests {

        @Test
        @DisplayName("Each chunk is delivered in order as it arrives")
        void chunksInOrder() throws Exception {
            startUnix(config().defaultMode(ConnectionMode.STREAM_DATA));

            IpcClient client = connect();
            for (String chunk : List.of("alpha", "beta", "gamma")) {
                client.send(chunk);
                Message message = handler.nextMessage();
                assertEquals(chunk, message.text());
                assertEquals(ConnectionMode.STREAM_DATA, message.mode());
            }
            client.finishSending();

            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
        }

        @Test
        @DisplayName("Chunks never exceed the chunk size")
        void chunkSizeBound() throws Exception {
            startUnix(config().defaultMode(ConnectionMode.STREAM_DATA).chunkSize(16));

            connect().request(new byte[100]);

            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            int total = 0;
            for (Message message : handler.drainMessages()) {
                assertTrue(message.size() <= 16);
                total += message.size();
            }
            assertEquals(100, total);
        }

        @Test
        @DisplayName("Chunks smaller than a command header keep their bound")
        void chunkSizeBelowHeaderWidth() throws Exception {
            startUnix(config().defaultMode(ConnectionMode.STREAM_DATA).chunkSize(4));

            connect().request("abcdefgh".getBytes(StandardCharsets.US_ASCII));

            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            StringBuilder joined = new StringBuilder();
            for (Message message : handler.drainMessages()) {
                assertTrue(message.size() <= 4, "chunk of " + message.size() + " bytes");
                joined.append(message.text());
            }
            assertEquals("abcdefgh", joined.toString());
        }

        @Test
        @DisplayName("Bytes after a command respect a small chunk size")
        void chunkSizeAfterCommand() throws Exception {
            startUnix(config().chunkSize(3));

            IpcClient client = connect();
            client.sendCommand(Command.SET_STREAM);
            client.send("abcdefgh");
            client.finishSending();

            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            StringBuilder joined = new StringBuilder();
            for (Message message : handler.drainMessages()) {
                assertTrue(message.size() <= 3, "chunk of " + message.size() + " bytes");
                assertEquals(ConnectionMode.STREAM_DATA, message.mode());
                joined.append(message.text());
            }
            assertEquals("abcdefgh", joined.toString());
        }
    }

    @Nested
    @DisplayName("Commands")
    class CommandTests {

        @Test
        @DisplayName("SET_STREAM switches a discrete connection to chunks")
        void setStream() throws Exception {
            startUnix(config());

            IpcClient client = connect();
            client.sendCommand(Command.SET_STREAM);
            client.send("live");

            Message message = handler.nextMessage();
            assertEquals("live", message.text());
            assertEquals(ConnectionMode.STREAM_DATA, message.mode());
            client.finishSending();
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
        }

        @Test
        @DisplayName("SET_DATA switches a streaming connection to one message")
        void setData() throws Exception {
            startUnix(config().defaultMode(ConnectionMode.STREAM_DATA));

            IpcClient client = connect();
            client.sendCommand(Command.SET_DATA);
            client.send("one ");
            client.send("message");
            client.finishSending();

            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            List<Message> messages = handler.drainMessages();
            assertEquals(1, messages.size());
            assertEquals("one message", messages.get(0).text());
            assertEquals(ConnectionMode.TEXT_DATA, messages.get(0).mode());
        }

        @Test
        @DisplayName("PING is answered with PONG and delivers no message")
        void pingOnly() throws Exception {
            startUnix(config());

            IpcClient client = connect();
            assertTrue(client.ping(TIMEOUT));
            client.finishSending();

            assertEquals(0, client.readReply().length);
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            assertTrue(handler.messages.isEmpty());
        }

        @Test
        @DisplayName("Payload after PING is delivered normally")
        void pingThenPayload() throws Exception {
            handler.action = message -> server.sendMessage("ack", message.sender());
            startUnix(config());

            IpcClient client = connect();
            assertTrue(client.ping(TIMEOUT));

            assertEquals("ack", utf8(client.request("data".getBytes(StandardCharsets.UTF_8))));
            assertEquals("data", handler.nextMessage().text());
        }

        @Test
        @DisplayName("Unknown command codes are payload")
        void unknownCodeIsPayload() throws Exception {
            startUnix(config());

            connect().request("@IPC9999".getBytes(StandardCharsets.US_ASCII));

            assertEquals("@IPC9999", handler.nextMessage().text());
        }
    }

    @Nested
    @DisplayName("Persistent sessions")
    class PersistentTests {

        @Test
        @DisplayName("Replies keep the connection open for further rounds")
        void multipleRounds() throws Exception {
            handler.action = message -> server.sendMessage(message.payload(), message.sender());
            startUnix(config().defaultMode(ConnectionMode.PERSISTENT));

            IpcClient client = connect();
            for (String round : List.of("one", "two", "three")) {
                client.send(round);
                assertEquals(round, utf8(client.readFully(round.length())));
            }
            client.finishSending();

            assertEquals(0, client.readReply().length);
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
        }

        @Test
        @DisplayName("Broadcast skips stale connections")
        void broadcastSkipsStale() throws Exception {
            startUnix(config().defaultMode(ConnectionMode.PERSISTENT));

            IpcClient first = connect();
            IpcClient second = connect();
            IpcClient finished = connect();
            handler.awaitAuthenticated(3);

            finished.finishSending();
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());

            int written = server.sendMessage("news", handler.connections);

            assertEquals(2, written);
            assertEquals("news", utf8(first.readFully(4)));
            assertEquals("news", utf8(second.readFully(4)));
        }
    }

    @Nested
    @DisplayName("Capacity")
    class CapacityTests {

        @Test
        @DisplayName("Connections over capacity are closed without a session")
        void overCapacityRefused() throws Exception {
            startUnix(config().maxConnections(2));

            connect();
            connect();
            handler.awaitAuthenticated(2);

            IpcClient refused = connect();

            assertEquals(0, refused.readAvailable(16).length);
            await(() -> server.rejectedConnections() == 1, "the refusal to be counted");
            assertEquals(2, server.activeSessions());
            assertEquals(2, handler.connections.size());
        }

        @Test
        @DisplayName("Concurrent connects admit exactly the capacity")
        void concurrentConnects() throws Exception {
            int capacity = 3;
            startUnix(config().maxConnections(capacity));

            ExecutorService executor = Executors.newFixedThreadPool(capacity + 1);
            try {
                CountDownLatch go = new CountDownLatch(1);
                List<Future<IpcClient>> futures = new ArrayList<>();
                for (int i = 0; i <= capacity; i++) {
                    futures.add(executor.submit(() -> {
                        go.await();
                        return IpcClient.connect(server.localAddress());
                    }));
                }
                go.countDown();
                for (Future<IpcClient> future : futures) {
                    clients.add(future.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            await(() -> server.activeSessions() + server.rejectedConnections() == capacity + 1,
                    "every connection to be admitted or refused");
            assertEquals(capacity, server.activeSessions());
            assertEquals(1, server.rejectedConnections());
        }

        @Test
        @DisplayName("A freed slot admits the next connection")
        void freedSlotReused() throws Exception {
            handler.action = message -> server.sendMessage("ok", message.sender());
            startUnix(config().maxConnections(1));

            assertEquals("ok", utf8(connect().request(new byte[] {1})));
            await(() -> server.activeSessions() == 0, "the first session to end");

            assertEquals("ok", utf8(connect().request(new byte[] {2})));
            assertEquals(0, server.rejectedConnections());
        }
    }

    @Nested
    @DisplayName("Cancellation and shutdown")
    class ShutdownTests {

        @Test
        @DisplayName("cancelAllSessions closes blocked sessions without delivering")
        void cancelAll() throws Exception {
            int sessions = 3;
            startUnix(config());
            for (int i = 0; i < sessions; i++) {
                connect().send("partial");
            }
            handler.awaitAuthenticated(sessions);

            assertEquals(sessions, server.cancelAllSessions());

            await(() -> server.activeSessions() == 0, "the pool to empty");
            for (int i = 0; i < sessions; i++) {
                assertEquals(SessionOutcome.CANCELLED, handler.nextOutcome());
            }
            for (Connection connection : handler.connections) {
                assertEquals(SessionState.CLOSED, connection.sessionState());
            }
            assertTrue(handler.messages.isEmpty());
            assertTrue(server.isRunning());
        }

        @Test
        @DisplayName("Cancelling a session blocked in a write ends it")
        void cancelDuringWrite() throws Exception {
            CountDownLatch writing = new CountDownLatch(1);
            byte[] large = new byte[32 * 1024 * 1024];
            handler.action = message -> {
                writing.countDown();
                server.sendMessage(large, message.sender());
            };
            server = IpcServer.tcp(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                    config().defaultMode(ConnectionMode.PERSISTENT).build(), handler);
            server.start();

            connect().send("go");
            assertTrue(writing.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
            // the client never reads, so the reply fills the socket buffers and blocks
            Thread.sleep(100);

            assertEquals(1, server.cancelAllSessions());

            assertEquals(SessionOutcome.CANCELLED, handler.nextOutcome());
            await(() -> server.activeSessions() == 0, "the pool to empty");
            assertEquals(SessionState.CLOSED, handler.connections.get(0).sessionState());
        }

        @Test
        @DisplayName("close returns after every session has reported its outcome")
        void closeWaitsForSessions() throws Exception {
            startUnix(config());
            connect();
            connect();
            handler.awaitAuthenticated(2);

            server.close();

            assertEquals(SessionOutcome.CANCELLED, handler.outcomes.poll());
            assertEquals(SessionOutcome.CANCELLED, handler.outcomes.poll());
            assertEquals(0, server.activeSessions());
        }

        @Test
        @DisplayName("Shutdown listeners observe every phase")
        void shutdownListener() throws Exception {
            startUnix(config());
            List<ShutdownPhase> phases = new CopyOnWriteArrayList<>();
            AtomicReference<Boolean> graceful = new AtomicReference<>();
            server.addShutdownListener(new ShutdownListener() {
                @Override
                public void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase) {
                    phases.add(currentPhase);
                }

                @Override
                public void onShutdownComplete(boolean completedGracefully, long durationMs) {
                    graceful.set(completedGracefully);
                }
            });
            List<ShutdownPhase> removedSaw = new CopyOnWriteArrayList<>();
            ShutdownListener removed = new ShutdownListener() {
                @Override
                public void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase) {
                    removedSaw.add(currentPhase);
                }

                @Override
                public void onShutdownComplete(boolean completedGracefully, long durationMs) {
                    removedSaw.add(ShutdownPhase.TERMINATED);
                }
            };
            server.addShutdownListener(removed);
            assertTrue(server.removeShutdownListener(removed));

            assertTrue(server.shutdown(TIMEOUT));

            assertEquals(List.of(ShutdownPhase.DRAINING, ShutdownPhase.CLOSING,
                    ShutdownPhase.TERMINATED), phases);
            assertTrue(removedSaw.isEmpty());
            assertEquals(Boolean.TRUE, graceful.get());
            assertEquals(ShutdownPhase.TERMINATED, server.shutdownPhase());
        }

        @Test
        @DisplayName("Graceful shutdown waits for running sessions")
        void gracefulShutdown() throws Exception {
            handler.action = message -> server.sendMessage("bye", message.sender());
            startUnix(config());
            IpcClient client = connect();
            handler.awaitAuthenticated(1);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Boolean> graceful = executor.submit(() -> server.shutdown(TIMEOUT));
                await(() -> !server.isRunning(), "shutdown to begin");

                assertEquals("bye", utf8(client.request(new byte[] {1})));

                assertTrue(graceful.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertTrue(server.awaitTermination(TIMEOUT));
            assertEquals(SessionOutcome.COMPLETED, handler.nextOutcome());
            assertFalse(Files.exists(socketPath));
        }

        @Test
        @DisplayName("Shutdown cancels sessions that outlive the timeout")
        void shutdownTimeout() throws Exception {
            startUnix(config());
            connect();
            handler.awaitAuthenticated(1);

            assertFalse(server.shutdown(Duration.ofMillis(100)));

            assertEquals(SessionOutcome.CANCELLED, handler.nextOutcome());
            await(() -> server.activeSessions() == 0, "the pool to empty");
        }

        @Test
        @DisplayName("Connections during shutdown are refused")
        void refusedAfterClose() throws Exception {
            startUnix(config());
            server.close();

            assertThrows(IOException.class, () -> IpcClient.connect(socketPath).close());
        }
    }

    /** Records every callback; behaviour is set per test. */
    private static final class RecordingHandler implements IpcServerHandler {

        final BlockingQueue<Message> messages = new LinkedBlockingQueue<>();
        final BlockingQueue<SessionOutcome> outcomes = new LinkedBlockingQueue<>();
        final List<Connection> connections = new CopyOnWriteArrayList<>();
        final Semaphore authenticated = new Semaphore(0);

        volatile Predicate<Connection> authenticator = connection -> true;
        volatile MessageAction action = message -> {};

        @Override
        public boolean authenticate(Connection connection) {
            connections.add(connection);
            try {
                return authenticator.test(connection);
            } finally {
                authenticated.release();
            }
        }

        @Override
        public void onMessage(Message message) throws Exception {
            messages.add(message);
            action.accept(message);
        }

        @Override
        public void onSessionClosed(Connection connection, SessionOutcome outcome, Throwable cause) {
            outcomes.add(outcome);
        }

        Message nextMessage() throws InterruptedException {
            Message message = messages.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            assertNotNull(message, "no message delivered");
            return message;
        }

        SessionOutcome nextOutcome() throws InterruptedException {
            SessionOutcome outcome = outcomes.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            assertNotNull(outcome, "no session closed");
            return outcome;
        }

        List<Message> drainMessages() {
            List<Message> drained = new ArrayList<>();
            messages.drainTo(drained);
            return drained;
        }

        void awaitAuthenticated(int sessions) throws InterruptedException {
            assertTrue(authenticated.tryAcquire(sessions, TIMEOUT.toMillis(), TimeUnit.MILLISECONDS),
                    "sessions did not start");
        }
    }

    @FunctionalInterface
    private interface MessageAction {
        void accept(Message message) throws Exception;
    }
}
