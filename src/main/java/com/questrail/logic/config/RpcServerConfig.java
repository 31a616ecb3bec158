package com.questrail.logic.config;

import com.questrail.logic.protocol.rpc.codec.RpcFraming;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the RPC server.
 *
 * <p>{@link #fromProperties(Properties)} reads the {@code logic.rpc.*} keys;
 * unset keys keep their defaults.</p>
 */
public record RpcServerConfig(
    Path socketPath,
    Duration restartBackoff,
    int ioThreads,
    int workerThreads,
    int maxPayloadLength,
    Duration drainTimeout,
    boolean rerunStartHooksOnRestart
) {
    public static final Path DEFAULT_SOCKET_PATH = Path.of("/run/logic/logic.sock");
    public static final Duration DEFAULT_RESTART_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    static final String PREFIX = "logic.rpc.";
    static final String SOCKET_PATH = PREFIX + "socket-path";
    static final String RESTART_BACKOFF_MS = PREFIX + "restart-backoff-ms";
    static final String IO_THREADS = PREFIX + "io-threads";
    static final String WORKER_THREADS = PREFIX + "worker-threads";
    static final String MAX_PAYLOAD_BYTES = PREFIX + "max-payload-bytes";
    static final String DRAIN_TIMEOUT_MS = PREFIX + "drain-timeout-ms";
    static final String RERUN_START_HOOKS = PREFIX + "rerun-start-hooks";

    public RpcServerConfig {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(restartBackoff, "restartBackoff");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        if (restartBackoff.isNegative()) {
            throw new IllegalArgumentException("restartBackoff must not be negative");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must not be negative");
        }
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be >= 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        if (maxPayloadLength < 1 || maxPayloadLength > Integer.MAX_VALUE - RpcFraming.HEADER_LENGTH) {
            throw new IllegalArgumentException("maxPayloadLength out of range: " + maxPayloadLength);
        }
    }

    public static RpcServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RpcServerConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();

        String socket = props.getProperty(SOCKET_PATH);
        if (socket != null && !socket.isBlank()) {
            b.withSocketPath(Path.of(socket.trim()));
        }
        String backoff = props.getProperty(RESTART_BACKOFF_MS);
        if (backoff != null) {
            b.withRestartBackoff(Duration.ofMillis(parseLong(RESTART_BACKOFF_MS, backoff)));
        }
        String io = props.getProperty(IO_THREADS);
        if (io != null) {
            b.withIoThreads(parseInt(IO_THREADS, io));
        }
        String workers = props.getProperty(WORKER_THREADS);
        if (workers != null) {
            b.withWorkerThreads(parseInt(WORKER_THREADS, workers));
        }
        String maxPayload = props.getProperty(MAX_PAYLOAD_BYTES);
        if (maxPayload != null) {
            b.withMaxPayloadLength(parseInt(MAX_PAYLOAD_BYTES, maxPayload));
        }
        String drain = props.getProperty(DRAIN_TIMEOUT_MS);
        if (drain != null) {
            b.withDrainTimeout(Duration.ofMillis(parseLong(DRAIN_TIMEOUT_MS, drain)));
        }
        String rerun = props.getProperty(RERUN_START_HOOKS);
        if (rerun != null) {
            b.withRerunStartHooksOnRestart(parseBoolean(RERUN_START_HOOKS, rerun));
        }
        return b.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(key + " is not a boolean: '" + value + "'");
    }

    public static final class Builder {
        private Path socketPath = DEFAULT_SOCKET_PATH;
        private Duration restartBackoff = DEFAULT_RESTART_BACKOFF;
        private int ioThreads = 1;
        private int workerThreads = Math.max(4, Runtime.getRuntime().availableProcessors());
        private int maxPayloadLength = RpcFraming.DEFAULT_MAX_PAYLOAD_LENGTH;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
        private boolean rerunStartHooksOnRestart = true;

        public Builder withSocketPath(Path socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder withRestartBackoff(Duration restartBackoff) {
            this.restartBackoff = restartBackoff;
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withMaxPayloadLength(int maxPayloadLength) {
            this.maxPayloadLength = maxPayloadLength;
            return this;
        }

        public Builder withDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder withRerunStartHooksOnRestart(boolean rerun) {
            this.rerunStartHooksOnRestart = rerun;
            return this;
        }

        public RpcServerConfig build() {
            return new RpcServerConfig(socketPath, restartBackoff, ioThreads, workerThreads,
                maxPayloadLength, drainTimeout, rerunStartHooksOnRestart);
        }
    }
}
