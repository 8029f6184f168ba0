package express.mvp.kiva.benchmark;

import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.client.IpcClient;
import express.mvp.kiva.server.IpcServer;
import express.mvp.kiva.server.IpcServerConfig;
import express.mvp.kiva.server.IpcServerHandler;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Round-trip latency of a small payload echoed over one long-lived connection.
 *
 * <p>Kiva sessions run in {@link ConnectionMode#PERSISTENT} mode so that every chunk is answered
 * without ending the connection. The raw NIO and Netty drivers are plain echo servers and give the
 * floor for each transport.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 1, time = 10)
@Measurement(iterations = 1, time = 30)
public class PingPongBenchmark {

    private static final byte[] PAYLOAD = {0, 0, 0, 123};

    @Param({"NIO_UNIX", "NETTY_TCP", "KIVA_UNIX", "KIVA_TCP"})
    private String implementation;

    private BenchmarkDriver driver;

    @Setup
    public void setup() throws Exception {
        switch (implementation) {
            case "NIO_UNIX" -> driver = new NioUnixDriver();
            case "NETTY_TCP" -> driver = new NettyDriver();
            case "KIVA_UNIX" -> driver = new KivaDriver(true);
            case "KIVA_TCP" -> driver = new KivaDriver(false);
            default -> throw new IllegalArgumentException("Unknown implementation: " + implementation);
        }
        driver.setup();
    }

    @TearDown
    public void tearDown() {
        if (driver != null) {
            driver.tearDown();
        }
    }

    @Benchmark
    public void pingPong() throws Exception {
        driver.pingPong();
    }

    interface BenchmarkDriver {
        void setup() throws Exception;

        void pingPong() throws Exception;

        void tearDown();
    }

    // ==========================================
    // Raw NIO over a Unix domain socket
    // ==========================================
    static class NioUnixDriver implements BenchmarkDriver {
        private Path directory;
        private ServerSocketChannel serverSocket;
        private java.nio.channels.SocketChannel clientChannel;
        private Thread serverThread;
        private final ByteBuffer clientBuffer = ByteBuffer.allocateDirect(PAYLOAD.length);

        @Override
        public void setup() throws Exception {
            directory = Files.createTempDirectory("kiva-bench");
            UnixDomainSocketAddress address =
                    UnixDomainSocketAddress.of(directory.resolve("nio.sock"));
            serverSocket = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            serverSocket.bind(address);

            serverThread = new Thread(() -> {
                ByteBuffer buffer = ByteBuffer.allocateDirect(1024);
                try (java.nio.channels.SocketChannel peer = serverSocket.accept()) {
                    while (peer.read(buffer.clear()) >= 0) {
                        buffer.flip();
                        while (buffer.hasRemaining()) {
                            peer.write(buffer);
                        }
                    }
                } catch (IOException e) {
                    if (serverSocket.isOpen()) {
                        throw new UncheckedIOException("Echo server failed", e);
                    }
                }
            }, "nio-echo");
            serverThread.setDaemon(true);
            serverThread.start();

            clientChannel = java.nio.channels.SocketChannel.open(address);
        }

        @Override
        public void pingPong() throws Exception {
            clientBuffer.clear();
            clientBuffer.put(PAYLOAD).flip();
            while (clientBuffer.hasRemaining()) {
                clientChannel.write(clientBuffer);
            }
            clientBuffer.clear();
            while (clientBuffer.hasRemaining()) {
                if (clientChannel.read(clientBuffer) < 0) {
                    throw new IOException("Echo server closed the connection");
                }
            }
        }

        @Override
        public void tearDown() {
            try {
                clientChannel.close();
                serverSocket.close();
                serverThread.join(1000);
                Files.deleteIfExists(directory.resolve("nio.sock"));
                Files.deleteIfExists(directory);
            } catch (IOException e) {
                throw new IllegalStateException("NIO teardown failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ==========================================
    // Netty over TCP
    // ==========================================
    static class NettyDriver implements BenchmarkDriver {
        private EventLoopGroup bossGroup;
        private EventLoopGroup workerGroup;
        private EventLoopGroup clientGroup;
        private Channel clientChannel;
        private volatile CountDownLatch latch;
        private final ByteBuf msg = Unpooled.directBuffer(PAYLOAD.length).writeBytes(PAYLOAD);

        @Override
        public void setup() throws Exception {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup(1);
            clientGroup = new NioEventLoopGroup(1);

            ServerBootstrap sb = new ServerBootstrap();
            sb.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
                                @Override
                                public void channelRead(ChannelHandlerContext ctx, Object msg) {
                                    ctx.writeAndFlush(msg);
                                }
                            });
                        }
                    });

            Channel serverChannel = sb.bind("127.0.0.1", 0).sync().channel();
            InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();

            Bootstrap cb = new Bootstrap();
            cb.group(clientGroup)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
                                @Override
                                public void channelRead(ChannelHandlerContext ctx, Object msg) {
                                    if (msg instanceof ByteBuf) {
                                        ((ByteBuf) msg).release();
                                    }
                                    CountDownLatch current = latch;
                                    if (current != null) {
                                        current.countDown();
                                    }
                                }
                            });
                        }
                    });

            clientChannel = cb.connect(bound).sync().channel();
        }

        @Override
        public void pingPong() throws Exception {
            latch = new CountDownLatch(1);
            msg.retain(); // write releases
            clientChannel.writeAndFlush(msg.duplicate());
            latch.await();
        }

        @Override
        public void tearDown() {
            try {
                if (clientGroup != null) {
                    clientGroup.shutdownGracefully().sync();
                }
                if (workerGroup != null) {
                    workerGroup.shutdownGracefully().sync();
                }
                if (bossGroup != null) {
                    bossGroup.shutdownGracefully().sync();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ==========================================
    // Kiva IpcServer, persistent echo session
    // ==========================================
    static class KivaDriver implements BenchmarkDriver {
        private final boolean unixDomain;
        private Path directory;
        private IpcServer server;
        private IpcClient client;

        KivaDriver(boolean unixDomain) {
            this.unixDomain = unixDomain;
        }

        @Override
        public void setup() throws Exception {
            IpcServerConfig config = IpcServerConfig.builder()
                    .defaultMode(ConnectionMode.PERSISTENT)
                    .closeLinger(java.time.Duration.ZERO)
                    .build();
            IpcServerHandler echo = new IpcServerHandler() {
                @Override
                public void onMessage(Message message) throws IOException {
                    server.sendMessage(message.payload(), message.sender());
                }
            };

            if (unixDomain) {
                directory = Files.createTempDirectory("kiva-bench");
                server = IpcServer.unixDomain(directory.resolve("kiva.sock"), config, echo);
            } else {
                server = IpcServer.tcp(new InetSocketAddress("127.0.0.1", 0), config, echo);
            }
            client = IpcClient.connect(server.start());
        }

        @Override
        public void pingPong() throws Exception {
            client.send(PAYLOAD);
            if (client.readFully(PAYLOAD.length).length != PAYLOAD.length) {
                throw new IOException("Server closed the session");
            }
        }

        @Override
        public void tearDown() {
            try {
                client.close();
                server.close();
                if (directory != null) {
                    Files.deleteIfExists(directory);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Kiva teardown failed", e);
            }
        }
    }
}
