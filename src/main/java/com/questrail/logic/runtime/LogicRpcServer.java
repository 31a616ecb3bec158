package com.questrail.logic.runtime;

import com.questrail.logic.config.RpcServerConfig;
import com.questrail.logic.observability.ConnectionEvent;
import com.questrail.logic.observability.NullObservabilitySink;
import com.questrail.logic.observability.RpcErrorEvent;
import com.questrail.logic.observability.RpcObservabilitySink;
import com.questrail.logic.observability.ServerStateTransitionEvent;
import com.questrail.logic.protocol.rpc.codec.RpcEnvelopeCodec;
import com.questrail.logic.protocol.rpc.codec.impl.MessagePackEnvelopeCodec;
import com.questrail.logic.protocol.rpc.internal.dispatch.Dispatcher;
import com.questrail.logic.registry.ModuleRegistry;
import com.questrail.logic.transport.ConnectionListener;
import com.questrail.logic.transport.FrameChannel;
import com.questrail.logic.transport.ListenerBinding;
import com.questrail.logic.transport.ServerEndpoint;
import com.questrail.logic.transport.TransportException;
import com.questrail.logic.transport.netty.NettyUnixServerEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * LogicRpcServer
 * =============================================================================
 * Composition root and lifecycle owner for the RPC server.
 *
 * <h2>Server loop</h2>
 * A dedicated supervisor thread drives the state machine:
 *
 * <pre>
 *   STOPPED → STARTING → SERVING → (CRASHED → STARTING)* → STOPPING → STOPPED
 * </pre>
 *
 * <ul>
 *   <li><strong>STARTING</strong>: run start hooks (every attempt, or only the
 *       first when {@link RpcServerConfig#rerunStartHooksOnRestart()} is off),
 *       delete any stale file at the socket path, bind.</li>
 *   <li><strong>SERVING</strong>: the transport accepts connections and hands
 *       each to a new {@link RpcConnectionHandler}. The supervisor only waits
 *       for the listener to close.</li>
 *   <li><strong>CRASHED</strong>: a bind failure, or the listener closing
 *       without being asked to. The supervisor waits the fixed
 *       {@link RpcServerConfig#restartBackoff()} and goes back to STARTING.
 *       Retries are unbounded and the backoff never grows.</li>
 *   <li><strong>STOPPING</strong>: entered only through {@link #stop()}. Closes
 *       the listener, waits up to {@link RpcServerConfig#drainTimeout()} for
 *       outstanding calls, runs shutdown hooks, and releases the transport and
 *       worker pool. Never restarts.</li>
 * </ul>
 *
 * <h2>Registry</h2>
 * {@link #start()} seals the {@link ModuleRegistry}. All modules must be
 * registered beforehand.
 *
 * <h2>Lifecycle</h2>
 * The server is single-use: once stopped it cannot be started again.
 */
public final class LogicRpcServer
{
    private static final Logger log = LoggerFactory.getLogger(LogicRpcServer.class);

    private static final long WORKER_SHUTDOWN_TIMEOUT_MS = 5_000;

    private final RpcServerConfig config;
    private final ModuleRegistry registry;
    private final RpcObservabilitySink sink;
    private final RpcEnvelopeCodec codec;
    private final Function<RpcServerConfig, ServerEndpoint> endpointFactory;
    private final HookRunner hookRunner;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Object stateLock = new Object();

    private ServerState state = ServerState.STOPPED;
    private boolean startHooksRan;

    private volatile ServerEndpoint endpoint;
    private volatile ExecutorService workers;
    private volatile Dispatcher dispatcher;
    private volatile ListenerBinding binding;
    private volatile Thread supervisorThread;

    private LogicRpcServer(RpcServerConfig config,
                           ModuleRegistry registry,
                           RpcObservabilitySink sink,
                           RpcEnvelopeCodec codec,
                           Function<RpcServerConfig, ServerEndpoint> endpointFactory)
    {
        this.config = config;
        this.registry = registry;
        this.sink = sink;
        this.codec = codec;
        this.endpointFactory = endpointFactory;
        this.hookRunner = new HookRunner(sink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Seal the registry and start the supervisor thread. Returns immediately;
     * use {@link #awaitServing(Duration)} to wait for the first successful bind.
     * Calling it again while running has no effect.
     *
     * @throws IllegalStateException if the server has already been stopped
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            if (terminated.getCount() == 0) {
                throw new IllegalStateException("server has been stopped and cannot be restarted");
            }
            return;
        }

        registry.seal();

        try {
            endpoint = endpointFactory.apply(config);
        } catch (RuntimeException e) {
            terminated.countDown();
            throw e;
        }
        workers = newWorkerPool(config.workerThreads());
        dispatcher = new Dispatcher(registry, workers, sink);

        Thread t = new Thread(this::supervise, "logic-rpc-supervisor");
        supervisorThread = t;
        t.start();
    }

    /**
     * Signal shutdown and block until the server reaches {@code STOPPED}.
     * Safe to call from any thread, more than once, or before {@link #start()}.
     */
    public void stop()
    {
        stopLatch.countDown();

        ListenerBinding b = binding;
        if (b != null) {
            b.close();
        }

        if (!started.get()) {
            return;
        }
        if (Thread.currentThread() == supervisorThread) {
            return;
        }
        awaitTermination();
    }

    /**
     * @return {@code true} once the server is serving, {@code false} on timeout
     */
    public boolean awaitServing(Duration timeout) throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            while (state != ServerState.SERVING) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                stateLock.wait(remainingMs);
            }
            return true;
        }
    }

    /**
     * Block until the server has stopped. Returns at once if it was never
     * started.
     */
    public void awaitTermination()
    {
        if (!started.get()) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                terminated.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return {@code true} if the server stopped within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException
    {
        return !started.get() || terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public ServerState state()
    {
        synchronized (stateLock) {
            return state;
        }
    }

    // -------------------------------------------------------------------------
    // Supervisor
    // -------------------------------------------------------------------------

    private void supervise()
    {
        try {
            boolean firstAttempt = true;

            while (!stopRequested()) {
                transition(ServerState.STARTING, null);

                if (firstAttempt || config.rerunStartHooksOnRestart()) {
                    hookRunner.runStartHooks(registry.modules());
                    startHooksRan = true;
                }
                firstAttempt = false;

                if (stopRequested()) {
                    break;
                }

                Throwable crash = serveOnce();
                if (crash == null) {
                    break;
                }

                transition(ServerState.CRASHED, crash);
                log.info("Restarting in {} ms", config.restartBackoff().toMillis());
                if (awaitStopSignal(config.restartBackoff())) {
                    break;
                }
            }
        } catch (RuntimeException | Error e) {
            sink.onError(new RpcErrorEvent(Instant.now(), "Supervisor failed", e));
        } finally {
            shutdown();
        }
    }

    /**
     * One bind-and-serve attempt.
     *
     * @return {@code null} if the attempt ended because stop was requested,
     *         otherwise the failure that ended it
     */
    private Throwable serveOnce()
    {
        final ListenerBinding b;
        try {
            Files.deleteIfExists(config.socketPath());
            b = endpoint.bind(config.socketPath(), this::accept);
        } catch (IOException | RuntimeException e) {
            return e;
        }

        binding = b;
        if (stopRequested()) {
            b.close();
        }
        else {
            transition(ServerState.SERVING, null);
        }

        Throwable cause = b.closeFuture().handle((ignored, error) -> error).join();
        binding = null;

        if (stopRequested()) {
            return null;
        }
        return cause != null ? cause : new TransportException("listener closed unexpectedly");
    }

    private ConnectionListener accept(FrameChannel channel)
    {
        sink.onConnectionEvent(new ConnectionEvent(Instant.now(), channel.id(), ConnectionEvent.Kind.OPENED, null));
        return new RpcConnectionHandler(channel, codec, dispatcher, sink, config.maxPayloadLength());
    }

    private void shutdown()
    {
        transition(ServerState.STOPPING, null);

        ListenerBinding b = binding;
        if (b != null) {
            b.close();
        }

        try {
            if (!dispatcher.inFlight().awaitIdle(config.drainTimeout())) {
                log.warn("{} calls still outstanding after {} ms drain",
                        dispatcher.inFlight().count(), config.drainTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (startHooksRan) {
            hookRunner.runShutdownHooks(registry.modules());
        }

        endpoint.close();
        shutdownWorkers();
        deleteSocketFile();

        transition(ServerState.STOPPED, null);
        terminated.countDown();
    }

    private void shutdownWorkers()
    {
        ExecutorService w = workers;
        w.shutdown();
        try {
            if (!w.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                w.shutdownNow();
            }
        } catch (InterruptedException e) {
            w.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void deleteSocketFile()
    {
        try {
            Files.deleteIfExists(config.socketPath());
        } catch (IOException e) {
            sink.onError(new RpcErrorEvent(Instant.now(), "Could not remove socket " + config.socketPath(), e));
        }
    }

    private boolean stopRequested()
    {
        return stopLatch.getCount() == 0;
    }

    /**
     * @return {@code true} if stop was requested before the timeout elapsed
     */
    private boolean awaitStopSignal(Duration timeout)
    {
        try {
            return stopLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopLatch.countDown();
            return true;
        }
    }

    private void transition(ServerState next, Throwable cause)
    {
        ServerState previous;
        synchronized (stateLock) {
            previous = state;
            state = next;
            stateLock.notifyAll();
        }
        sink.onStateTransition(new ServerStateTransitionEvent(Instant.now(), previous, next, cause));
    }

    private static ExecutorService newWorkerPool(int threads)
    {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "logic-rpc-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static final class Builder
    {
        private RpcServerConfig config = RpcServerConfig.defaults();
        private ModuleRegistry registry;
        private RpcObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private RpcEnvelopeCodec codec = new MessagePackEnvelopeCodec();
        private Function<RpcServerConfig, ServerEndpoint> endpointFactory =
                c -> new NettyUnixServerEndpoint(c.ioThreads(), c.maxPayloadLength());

        public Builder withConfig(RpcServerConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withRegistry(ModuleRegistry registry)
        {
            this.registry = registry;
            return this;
        }

        public Builder withObservabilitySink(RpcObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withCodec(RpcEnvelopeCodec codec)
        {
            this.codec = codec;
            return this;
        }

        /**
         * Replace the transport. The factory is called once, from {@link #start()}.
         */
        public Builder withEndpointFactory(Function<RpcServerConfig, ServerEndpoint> factory)
        {
            this.endpointFactory = factory;
            return this;
        }

        public LogicRpcServer build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(registry, "registry");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            return new LogicRpcServer(config, registry, observabilitySink, codec, endpointFactory);
        }
    }
}
