package express.mvp.kiva.benchmark;

import express.mvp.kiva.ipc.Message;
import express.mvp.kiva.ipc.client.IpcClient;
import express.mvp.kiva.server.IpcServer;
import express.mvp.kiva.server.IpcServerConfig;
import express.mvp.kiva.server.IpcServerHandler;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
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
 * Cost of a complete discrete exchange: connect, send, end output, read the reply to end-of-stream.
 *
 * <p>Each invocation is a full session, so this measures accept, admission, session thread
 * hand-off and teardown along with the transfer itself.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 1, time = 10)
@Measurement(iterations = 1, time = 30)
public class RequestReplyBenchmark {

    private static final byte[] REQUEST = "status".getBytes(StandardCharsets.UTF_8);

    @Param({"UNIX", "TCP"})
    private String transport;

    @Param({"64", "65536"})
    private int replySize;

    private Path directory;
    private IpcServer server;
    private SocketAddress address;

    @Setup
    public void setup() throws IOException {
        byte[] reply = new byte[replySize];
        IpcServerConfig config = IpcServerConfig.builder().closeLinger(Duration.ZERO).build();
        IpcServerHandler handler = new IpcServerHandler() {
            @Override
            public void onMessage(Message message) throws IOException {
                server.sendMessage(reply, message.sender());
            }
        };

        switch (transport) {
            case "UNIX" -> {
                directory = Files.createTempDirectory("kiva-bench");
                server = IpcServer.unixDomain(directory.resolve("kiva.sock"), config, handler);
            }
            case "TCP" -> server =
                    IpcServer.tcp(new InetSocketAddress("127.0.0.1", 0), config, handler);
            default -> throw new IllegalArgumentException("Unknown transport: " + transport);
        }
        address = server.start();
    }

    @TearDown
    public void tearDown() throws IOException {
        server.close();
        if (directory != null) {
            Files.deleteIfExists(directory);
        }
    }

    @Benchmark
    public byte[] requestReply() throws IOException {
        try (IpcClient client = IpcClient.connect(address)) {
            return client.request(REQUEST);
        }
    }
}
