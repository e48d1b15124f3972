package com.questrail.datagram;

import com.questrail.datagram.api.AlreadyStartedException;
import com.questrail.datagram.api.BindAddress;
import com.questrail.datagram.api.InvalidConfigException;
import com.questrail.datagram.api.NetworkFamily;
import com.questrail.datagram.api.NotRunningException;
import com.questrail.datagram.api.Response;
import com.questrail.datagram.api.ServerBindException;
import com.questrail.datagram.api.ServerState;
import com.questrail.datagram.config.DatagramServerConfig;
import com.questrail.datagram.config.WorkerPoolPolicy;
import com.questrail.datagram.internal.exec.BoundedWorkerPool;
import com.questrail.datagram.internal.exec.CancellationSignal;
import com.questrail.datagram.internal.exec.DatagramReader;
import com.questrail.datagram.internal.exec.ObservabilityReporter;
import com.questrail.datagram.internal.exec.ReceivedDatagram;
import com.questrail.datagram.internal.exec.RequestDispatcher;
import com.questrail.datagram.internal.exec.ResponseWriter;
import com.questrail.datagram.internal.exec.ServerCounters;
import com.questrail.datagram.observability.DatagramServerObservabilitySink;
import com.questrail.datagram.observability.DatagramServerStats;
import com.questrail.datagram.observability.ErrorKind;
import com.questrail.datagram.observability.ServerLifecycleEvent;
import com.questrail.datagram.observability.Slf4jDatagramServerObservabilitySink;
import com.questrail.datagram.transport.DatagramSocketHandle;

import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * DatagramServer
 * =============================================================================
 * Lifecycle owner for one concurrent datagram server.
 *
 * <h2>Architectural Role</h2>
 * This class owns the bound socket, the reader thread and both worker pools,
 * and coordinates their start and shutdown. <strong>No protocol semantics live
 * here.</strong> What a datagram means and what to reply is decided entirely
 * by the configured {@link com.questrail.datagram.api.RequestHandler}; how the
 * socket is bound and how replies are written by the
 * {@link com.questrail.datagram.api.Binder} and
 * {@link com.questrail.datagram.api.ResponseHandler}.
 *
 * <h2>Data Flow</h2>
 * <pre>
 *   socket
 *     → DatagramReader (one thread)
 *         → request queue (bounded)
 *             → RequestDispatcher × requestWorkers
 *                 → response queue (bounded)
 *                     → ResponseWriter × responseWorkers
 *                         → socket
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   create(...)  → CREATED   (validation only; no socket, no threads)
 *   start()      → RUNNING   (bind, publish address, launch threads)
 *   stop()       → STOPPED   (cancel, drain within grace period, join, close)
 * </pre>
 * Transitions only move forward. A failed bind leaves the server
 * {@code CREATED} so that {@link #start()} may be retried.
 *
 * <h2>Shutdown</h2>
 * {@link #stop()} fires one shared {@link CancellationSignal}, shuts down socket
 * input and joins the reader. The request pool and then the response pool are
 * drained against a single deadline of {@code shutdownGracePeriod}. Work still
 * running at the deadline is interrupted and abandoned. {@code stop()} returns
 * only after every thread it started has exited, or, for a thread that ignores
 * interruption, after a bounded wait that is reported.
 *
 * <h2>Thread Safety</h2>
 * {@link #start()} and {@link #stop()} may be called from any thread.
 * {@link #state()}, {@link #localAddress()} and {@link #stats()} never block.
 */
public final class DatagramServer {

    private static final Logger log = LoggerFactory.getLogger(DatagramServer.class);

    private static final long ABANDON_JOIN_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final String name;
    private final DatagramServerConfig config;
    private final NetworkFamily family;
    private final WorkerPoolPolicy policy;
    private final ObservabilityReporter reporter;
    private final ServerCounters counters = new ServerCounters();

    private final Object lifecycleLock = new Object();

    private volatile ServerState state = ServerState.CREATED;
    private volatile InetSocketAddress localAddress;
    private volatile boolean reading;

    // Running resources; assigned once under lifecycleLock by start().
    private DatagramSocketHandle socket;
    private CancellationSignal cancellation;
    private Thread readerThread;
    private BoundedWorkerPool<ReceivedDatagram> requestPool;
    private BoundedWorkerPool<Response> responsePool;

    private DatagramServer(String name,
                           DatagramServerConfig config,
                           NetworkFamily family,
                           WorkerPoolPolicy policy,
                           DatagramServerObservabilitySink sink) {
        this.name = name;
        this.config = config;
        this.family = family;
        this.policy = policy;
        this.reporter = new ObservabilityReporter(name, sink);
    }

    /**
     * Validate {@code config} and create an inert server.
     *
     * <p>No socket is opened and no thread is started. A {@code null} pool policy
     * means {@link WorkerPoolPolicy#defaults()}; a {@code null} observability sink
     * means SLF4J logging.</p>
     *
     * @param name   diagnostic name, used in thread names and events
     * @param config server configuration
     * @return a server in {@link ServerState#CREATED}
     * @throws InvalidConfigException naming the first invalid field
     */
    public static DatagramServer create(String name, DatagramServerConfig config) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigException("name", "must not be empty");
        }
        if (config == null) {
            throw new InvalidConfigException("config", "must not be null");
        }

        NetworkFamily family = NetworkFamily.fromName(config.network())
                .orElseThrow(() -> new InvalidConfigException("network",
                        "unknown network '" + config.network() + "', expected udp, udp4 or udp6"));

        if (config.bindAddress() == null) {
            throw new InvalidConfigException("bindAddress", "must not be null");
        }
        try {
            BindAddress.parse(config.bindAddress());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("bindAddress", e.getMessage(), e);
        }

        if (config.binder() == null) {
            throw new InvalidConfigException("binder", "must not be null");
        }
        if (config.requestHandler() == null) {
            throw new InvalidConfigException("requestHandler", "must not be null");
        }
        if (config.responseHandler() == null) {
            throw new InvalidConfigException("responseHandler", "must not be null");
        }

        WorkerPoolPolicy policy = Objects.requireNonNullElse(config.poolPolicy(), WorkerPoolPolicy.defaults());
        DatagramServerObservabilitySink sink = Objects.requireNonNullElse(
                config.observabilitySink(), Slf4jDatagramServerObservabilitySink.INSTANCE);

        return new DatagramServer(name, config, family, policy, sink);
    }

    /**
     * Bind the socket and start serving.
     *
     * @throws AlreadyStartedException if the server is not {@link ServerState#CREATED}
     * @throws ServerBindException if the binder fails; the server stays {@code CREATED}
     */
    public void start() {
        InetSocketAddress bound;

        synchronized (lifecycleLock) {
            if (state != ServerState.CREATED) {
                throw new AlreadyStartedException(name, state);
            }

            final DatagramSocketHandle handle;
            try {
                handle = config.binder().bind(family, config.bindAddress());
            } catch (IOException | RuntimeException e) {
                log.warn("Datagram server {} failed to bind {} '{}'", name, family, config.bindAddress(), e);
                throw new ServerBindException(
                        "server " + name + " failed to bind " + family + " '" + config.bindAddress() + "'", e);
            }
            if (handle == null) {
                throw new ServerBindException("server " + name + ": binder returned no socket", null);
            }

            bound = handle.localAddress();
            CancellationSignal signal = new CancellationSignal();

            ResponseWriter writer = new ResponseWriter(config.responseHandler(), handle, reporter, counters);
            BoundedWorkerPool<Response> responses = new BoundedWorkerPool<>(
                    name + "-response",
                    policy.responseWorkers(),
                    policy.responseQueueCapacity(),
                    writer,
                    new DefaultThreadFactory(name + "-response", true),
                    writer::onFailure);

            RequestDispatcher dispatcher =
                    new RequestDispatcher(config.requestHandler(), responses, reporter, counters);
            BoundedWorkerPool<ReceivedDatagram> requests = new BoundedWorkerPool<>(
                    name + "-request",
                    policy.requestWorkers(),
                    policy.requestQueueCapacity(),
                    dispatcher,
                    new DefaultThreadFactory(name + "-request", true),
                    dispatcher::onFailure);

            DatagramReader reader = new DatagramReader(
                    handle,
                    requests,
                    signal,
                    policy.maxConsecutiveReadErrors(),
                    reporter,
                    counters,
                    this::onReaderStopped);

            Thread readerLoop = new DefaultThreadFactory(name + "-reader", true).newThread(reader);

            try {
                responses.start();
                requests.start();
                reading = true;
                readerLoop.start();
            } catch (RuntimeException | Error e) {
                reading = false;
                signal.cancel();
                handle.shutdownInput();
                requests.abandon(ABANDON_JOIN_NANOS);
                responses.abandon(ABANDON_JOIN_NANOS);
                handle.close();
                throw e;
            }

            this.socket = handle;
            this.cancellation = signal;
            this.requestPool = requests;
            this.responsePool = responses;
            this.readerThread = readerLoop;
            this.localAddress = bound;
            this.state = ServerState.RUNNING;
        }

        log.info("Datagram server {} listening on {} {}", name, family, bound);
        reporter.lifecycle(ServerLifecycleEvent.Kind.STARTED, ServerState.RUNNING, bound);
    }

    /**
     * Stop serving and release every resource.
     *
     * <p>Blocks until the reader and all workers have exited. Queued work gets up
     * to {@code shutdownGracePeriod} to finish; anything left after that is
     * abandoned and counted in {@link DatagramServerStats#abandoned()}.</p>
     *
     * @throws NotRunningException if the server is not {@link ServerState#RUNNING}
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state != ServerState.RUNNING) {
                throw new NotRunningException(name, state);
            }
            state = ServerState.STOPPING;
        }

        log.info("Datagram server {} stopping", name);
        reporter.lifecycle(ServerLifecycleEvent.Kind.STOPPING, ServerState.STOPPING, localAddress);

        long deadline = System.nanoTime() + policy.shutdownGracePeriod().toNanos();
        boolean interrupted = false;
        boolean drained = false;

        cancellation.cancel();
        socket.shutdownInput();

        try {
            TimeUnit.NANOSECONDS.timedJoin(readerThread, Math.max(1, deadline - System.nanoTime()));
            // The response pool may only stop accepting once no request worker can produce a reply.
            drained = requestPool.awaitDrained(deadline) && responsePool.awaitDrained(deadline);
        } catch (InterruptedException e) {
            interrupted = true;
        }

        List<String> survivors = new ArrayList<>();
        if (!drained) {
            log.warn("Datagram server {} did not drain within {} ms, abandoning in-flight work",
                    name, policy.shutdownGracePeriod().toMillis());
            survivors.addAll(requestPool.abandon(ABANDON_JOIN_NANOS));
            survivors.addAll(responsePool.abandon(ABANDON_JOIN_NANOS));
        }
        if (readerThread.isAlive()) {
            readerThread.interrupt();
            try {
                TimeUnit.NANOSECONDS.timedJoin(readerThread, ABANDON_JOIN_NANOS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (readerThread.isAlive()) {
                survivors.add(readerThread.getName());
            }
        }

        int leftovers = requestPool.drainQueue().size() + responsePool.drainQueue().size();
        if (leftovers > 0) {
            counters.addAbandoned(leftovers);
            reporter.error(ErrorKind.ABANDONED, null,
                    leftovers + " queued item(s) abandoned at shutdown", null);
        }
        if (!survivors.isEmpty()) {
            log.warn("Datagram server {}: threads still running after shutdown: {}", name, survivors);
        }

        reading = false;
        socket.close();
        state = ServerState.STOPPED;

        log.info("Datagram server {} stopped", name);
        reporter.lifecycle(ServerLifecycleEvent.Kind.STOPPED, ServerState.STOPPED, localAddress);

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * The bound local address.
     *
     * @return empty before a successful {@link #start()}; afterwards the bound
     *         address, which stays available after {@link #stop()}
     */
    public Optional<InetSocketAddress> localAddress() {
        return Optional.ofNullable(localAddress);
    }

    public ServerState state() {
        return state;
    }

    public String name() {
        return name;
    }

    /**
     * @return {@code true} while the reader is taking datagrams off the socket
     */
    public boolean isReading() {
        return reading;
    }

    public DatagramServerStats stats() {
        return counters.snapshot();
    }

    private void onReaderStopped() {
        reading = false;
        log.debug("Datagram server {} reader stopped", name);
        reporter.lifecycle(ServerLifecycleEvent.Kind.READER_STOPPED, state, localAddress);
    }

    @Override
    public String toString() {
        return "DatagramServer[" + name + ", " + state + ", " + localAddress + "]";
    }
}
