package express.mvp.kiva.server;

import express.mvp.kiva.ipc.ConnectionMode;
import express.mvp.kiva.ipc.ConnectionPool;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for an {@link IpcServer} instance.
 *
 * <p>Immutable; built with {@link #builder()} and validated when built.
 *
 * <h2>Configuration Categories</h2>
 *
 * <table border="1">
 *   <caption>Configuration options by category</caption>
 *   <tr><th>Category</th><th>Options</th><th>Default</th></tr>
 *   <tr><td>Framing</td><td>defaultMode</td><td>TEXT_DATA</td></tr>
 *   <tr><td>Framing</td><td>readLimit</td><td>none</td></tr>
 *   <tr><td>Framing</td><td>chunkSize</td><td>8192 bytes</td></tr>
 *   <tr><td>Capacity</td><td>maxConnections</td><td>unbounded</td></tr>
 *   <tr><td>Teardown</td><td>closeLinger</td><td>100 ms</td></tr>
 *   <tr><td>Teardown</td><td>shutdownTimeout</td><td>5 s</td></tr>
 *   <tr><td>Threads</td><td>threadNamePrefix</td><td>kiva-session</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * IpcServerConfig config = IpcServerConfig.builder()
 *     .defaultMode(ConnectionMode.STREAM_DATA)
 *     .chunkSize(4096)
 *     .maxConnections(64)
 *     .build();
 * }</pre>
 *
 * @see IpcServer
 */
public final class IpcServerConfig {

    /** Read limit value meaning "no limit". */
    public static final long NO_READ_LIMIT = 0;

    /** Default bytes per chunked read. */
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    /** Default pause between signalling end-of-output and closing. */
    public static final Duration DEFAULT_CLOSE_LINGER = Duration.ofMillis(100);

    /** Default drain period of a graceful shutdown. */
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /** Default session thread name prefix. */
    public static final String DEFAULT_THREAD_NAME_PREFIX = "kiva-session";

    private static final IpcServerConfig DEFAULTS = builder().build();

    /** Maximum discrete message size in bytes, or {@link #NO_READ_LIMIT}. */
    private final long readLimit;

    /** Bytes per read in chunked framing. */
    private final int chunkSize;

    /** Pool capacity, or {@link ConnectionPool#UNBOUNDED}. */
    private final int maxConnections;

    /** Framing mode every connection starts in. */
    private final ConnectionMode defaultMode;

    /** Pause between end-of-output and close. */
    private final Duration closeLinger;

    /** Drain period of {@link IpcServer#shutdown()}. */
    private final Duration shutdownTimeout;

    /** Prefix of session thread names. */
    private final String threadNamePrefix;

    private IpcServerConfig(Builder builder) {
        this.readLimit = builder.readLimit;
        this.chunkSize = builder.chunkSize;
        this.maxConnections = builder.maxConnections;
        this.defaultMode = builder.defaultMode;
        this.closeLinger = builder.closeLinger;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.threadNamePrefix = builder.threadNamePrefix;
    }

    /**
     * Returns the default configuration.
     *
     * @return a configuration with every option at its default
     */
    public static IpcServerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder.
     *
     * @return a builder with every option at its default
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the read limit of discrete framing.
     *
     * @return the maximum message size in bytes, or {@link #NO_READ_LIMIT}
     */
    public long getReadLimit() {
        return readLimit;
    }

    /**
     * Checks whether discrete messages are size-limited.
     *
     * @return true if a read limit is set
     */
    public boolean hasReadLimit() {
        return readLimit != NO_READ_LIMIT;
    }

    /**
     * Gets the chunk size of chunked framing.
     *
     * @return bytes per read
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Gets the connection pool capacity.
     *
     * @return the maximum concurrent sessions, or {@link ConnectionPool#UNBOUNDED}
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * Gets the framing mode new connections start in.
     *
     * @return the default mode
     */
    public ConnectionMode getDefaultMode() {
        return defaultMode;
    }

    /**
     * Gets the pause between signalling end-of-output and closing a connection.
     *
     * @return the close linger
     */
    public Duration getCloseLinger() {
        return closeLinger;
    }

    /**
     * Gets how long a graceful shutdown waits for sessions to finish.
     *
     * @return the shutdown timeout
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Gets the session thread name prefix.
     *
     * @return the prefix
     */
    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    @Override
    public String toString() {
        return "IpcServerConfig["
                + "defaultMode=" + defaultMode
                + ", readLimit=" + (hasReadLimit() ? readLimit : "none")
                + ", chunkSize=" + chunkSize
                + ", maxConnections="
                + (maxConnections == ConnectionPool.UNBOUNDED ? "unbounded" : maxConnections)
                + ", closeLinger=" + closeLinger
                + ", shutdownTimeout=" + shutdownTimeout
                + "]";
    }

    /** Builder for {@link IpcServerConfig}. */
    public static final class Builder {
        private long readLimit = NO_READ_LIMIT;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxConnections = ConnectionPool.UNBOUNDED;
        private ConnectionMode defaultMode = ConnectionMode.TEXT_DATA;
        private Duration closeLinger = DEFAULT_CLOSE_LINGER;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;

        private Builder() {}

        /**
         * Limits the size of discrete messages.
         *
         * @param readLimit maximum message size in bytes, or {@link #NO_READ_LIMIT}
         * @return this builder
         */
        public Builder readLimit(long readLimit) {
            this.readLimit = readLimit;
            return this;
        }

        /**
         * Sets the bytes per read in chunked framing.
         *
         * @param chunkSize bytes per read
         * @return this builder
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Bounds the number of concurrent sessions.
         *
         * @param maxConnections pool capacity, or {@link ConnectionPool#UNBOUNDED}
         * @return this builder
         */
        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Sets the framing mode new connections start in.
         *
         * @param defaultMode the mode
         * @return this builder
         */
        public Builder defaultMode(ConnectionMode defaultMode) {
            this.defaultMode = Objects.requireNonNull(defaultMode, "defaultMode must not be null");
            return this;
        }

        /**
         * Sets the pause between end-of-output and close.
         *
         * @param closeLinger the pause; zero for none
         * @return this builder
         */
        public Builder closeLinger(Duration closeLinger) {
            this.closeLinger = Objects.requireNonNull(closeLinger, "closeLinger must not be null");
            return this;
        }

        /**
         * Sets how long a graceful shutdown waits for sessions.
         *
         * @param shutdownTimeout the drain period
         * @return this builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout =
                    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
            return this;
        }

        /**
         * Sets the session thread name prefix.
         *
         * @param threadNamePrefix the prefix
         * @return this builder
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix =
                    Objects.requireNonNull(threadNamePrefix, "threadNamePrefix must not be null");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         * @throws IllegalArgumentException if an option is out of range
         */
        public IpcServerConfig build() {
            if (readLimit < 0) {
                throw new IllegalArgumentException("readLimit must not be negative: " + readLimit);
            }
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
            }
            if (maxConnections < 0) {
                throw new IllegalArgumentException(
                        "maxConnections must not be negative: " + maxConnections);
            }
            if (closeLinger.isNegative()) {
                throw new IllegalArgumentException(
                        "closeLinger must not be negative: " + closeLinger);
            }
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException(
                        "shutdownTimeout must not be negative: " + shutdownTimeout);
            }
            if (threadNamePrefix.isBlank()) {
                throw new IllegalArgumentException("threadNamePrefix must not be blank");
            }
            return new IpcServerConfig(this);
        }
    }
}
