package com.questrail.datagram;

import com.questrail.datagram.api.AlreadyStartedException;
import com.questrail.datagram.api.Binder;
import com.questrail.datagram.api.InvalidConfigException;
import com.questrail.datagram.api.NetworkFamily;
import com.questrail.datagram.api.NotRunningException;
import com.questrail.datagram.api.Response;
import com.questrail.datagram.api.ServerBindException;
import com.questrail.datagram.api.ServerState;
import com.questrail.datagram.config.DatagramServerConfig;
import com.questrail.datagram.config.WorkerPoolPolicy;
import com.questrail.datagram.observability.ErrorKind;
import com.questrail.datagram.observability.NullObservabilitySink;
import com.questrail.datagram.observability.RecordingObservabilitySink;
import com.questrail.datagram.observability.ServerErrorEvent;
import com.questrail.datagram.observability.ServerLifecycleEvent;
import com.questrail.datagram.transport.FakeDatagramSocketHandle;
import com.questrail.datagram.transport.udp.VerbatimResponseHandler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DatagramServerTest
 * -----------------------------------------------------------------------------
 * Lifecycle and pipeline behavior against {@link FakeDatagramSocketHandle}.
 * Real-socket behavior is covered by {@link DatagramServerIntegrationTest}.
 */
class DatagramServerTest {

    private static final InetSocketAddress PEER = new InetSocketAddress("127.0.0.1", 9400);

    private FakeDatagramSocketHandle socket;
    private AtomicInteger bindCalls;
    private AtomicReference<String> boundFamily;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        socket = new FakeDatagramSocketHandle();
        bindCalls = new AtomicInteger();
        boundFamily = new AtomicReference<>();
        sink = new RecordingObservabilitySink();
    }

    private Binder fakeBinder() {
        return (family, address) -> {
            bindCalls.incrementAndGet();
            boundFamily.set(family.networkName());
            return socket;
        };
    }

    private DatagramServerConfig.Builder config() {
        return DatagramServerConfig.builder()
                .withNetwork("udp4")
                .withBindAddress(":0")
                .withBinder(fakeBinder())
                .withRequestHandler(request -> Optional.of(Response.replyTo(request, "GOT IT")))
                .withResponseHandler(new VerbatimResponseHandler())
                .withObservabilitySink(sink)
                .withPoolPolicy(WorkerPoolPolicy.builder()
                        .withShutdownGracePeriod(Duration.ofMillis(500))
                        .build());
    }

    // -------------------------------------------------------------------------
    // Construction
    // -------------------------------------------------------------------------

    @Test
    void createIsInert() {
        DatagramServer server = DatagramServer.create("TEST", config().build());

        assertEquals(ServerState.CREATED, server.state());
        assertTrue(server.localAddress().isEmpty());
        assertEquals(0, bindCalls.get());
        assertEquals("TEST", server.name());
    }

    @Test
    void invalidConfigurationNamesTheField() {
        assertInvalid("name", () -> DatagramServer.create(" ", config().build()));
        assertInvalid("name", () -> DatagramServer.create(null, config().build()));
        assertInvalid("config", () -> DatagramServer.create("TEST", null));
        assertInvalid("network", () -> DatagramServer.create("TEST", config().withNetwork("tcp").build()));
        assertInvalid("network", () -> DatagramServer.create("TEST", config().withNetwork((String) null).build()));
        assertInvalid("network", () -> DatagramServer.create("TEST", config().withNetwork("UDP4").build()));
        assertInvalid("poolPolicy", () -> DatagramServer.create("TEST", config()
                .withPoolPolicy(WorkerPoolPolicy.builder().withRequestWorkers(0).build())
                .build()));
        assertInvalid("bindAddress", () -> DatagramServer.create("TEST", config().withBindAddress(null).build()));
        assertInvalid("bindAddress", () -> DatagramServer.create("TEST", config().withBindAddress("host:port").build()));
        assertInvalid("binder", () -> DatagramServer.create("TEST", config().withBinder(null).build()));
        assertInvalid("requestHandler", () -> DatagramServer.create("TEST", config().withRequestHandler(null).build()));
        assertInvalid("responseHandler", () -> DatagramServer.create("TEST", config().withResponseHandler(null).build()));
        assertEquals(0, bindCalls.get());
    }

    @Test
    void missingPolicyAndSinkFallBackToDefaults() {
        DatagramServer server = DatagramServer.create("TEST",
                config().withPoolPolicy(null).withObservabilitySink(null).build());
        server.start();
        try {
            assertEquals(ServerState.RUNNING, server.state());
        } finally {
            server.stop();
        }
    }

    @Test
    void nullSinkSilencesEventsWithoutAffectingTheServer() throws InterruptedException {
        DatagramServer server = DatagramServer.create("QUIET", config()
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .withRequestHandler(request -> {
                    if (request.payload().length == 0) {
                        throw new IllegalArgumentException("empty");
                    }
                    return Optional.of(Response.replyTo(request, "GOT IT"));
                })
                .build());
        server.start();
        try {
            socket.injectDatagram(PEER, new byte[0]);
            socket.injectDatagram(PEER, new byte[] {7});

            awaitCondition(() -> socket.sent().size() == 1);
            assertEquals(1, server.stats().requestFailures());
        } finally {
            server.stop();
        }
        assertTrue(sink.getAllEvents().isEmpty());
    }

    private static void assertInvalid(String field, org.junit.jupiter.api.function.Executable call) {
        InvalidConfigException e = assertThrows(InvalidConfigException.class, call);
        assertEquals(field, e.field());
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Test
    void startBindsOncePublishesAddressAndRuns() {
        DatagramServer server = DatagramServer.create("TEST", config().build());
        server.start();
        try {
            assertEquals(1, bindCalls.get());
            assertEquals("udp4", boundFamily.get());
            assertEquals(ServerState.RUNNING, server.state());
            assertEquals(Optional.of(socket.localAddress()), server.localAddress());
            assertTrue(server.isReading());
        } finally {
            server.stop();
        }
        assertEquals(List.of(ServerLifecycleEvent.Kind.STARTED,
                        ServerLifecycleEvent.Kind.STOPPING,
                        ServerLifecycleEvent.Kind.STOPPED),
                sink.getLifecycleKinds());
    }

    @Test
    void secondStartFailsWithoutSideEffects() {
        DatagramServer server = DatagramServer.create("TEST", config().build());
        server.start();
        try {
            Optional<InetSocketAddress> before = server.localAddress();

            AlreadyStartedException e = assertThrows(AlreadyStartedException.class, server::start);
            assertEquals(ServerState.RUNNING, e.state());
            assertEquals(1, bindCalls.get());
            assertEquals(before, server.localAddress());
        } finally {
            server.stop();
        }

        assertThrows(AlreadyStartedException.class, server::start);
        assertEquals(1, bindCalls.get());
    }

    @Test
    void stopBeforeStartFails() {
        DatagramServer server = DatagramServer.create("TEST", config().build());

        NotRunningException e = assertThrows(NotRunningException.class, server::stop);
        assertEquals(ServerState.CREATED, e.state());
        assertEquals(ServerState.CREATED, server.state());
    }

    @Test
    void secondStopFailsAndDoesNotReleaseTwice() {
        DatagramServer server = DatagramServer.create("TEST", config().build());
        server.start();
        server.stop();

        assertEquals(ServerState.STOPPED, server.state());
        assertEquals(1, socket.closeCount());

        NotRunningException e = assertThrows(NotRunningException.class, server::stop);
        assertEquals(ServerState.STOPPED, e.state());
        assertEquals(1, socket.closeCount());
    }

    @Test
    void addressRemainsAvailableAfterStop() {
        DatagramServer server = DatagramServer.create("TEST", config().build());
        server.start();
        server.stop();

        assertEquals(Optional.of(socket.localAddress()), server.localAddress());
        assertFalse(socket.isOpen());
    }

    @Test
    void failedBindLeavesServerCreatedAndStartCanBeRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Binder flaky = (family, address) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new BindException("Address already in use");
            }
            return socket;
        };

        DatagramServer server = DatagramServer.create("TEST", config().withBinder(flaky).build());

        ServerBindException e = assertThrows(ServerBindException.class, server::start);
        assertInstanceOf(BindException.class, e.getCause());
        assertEquals(ServerState.CREATED, server.state());
        assertTrue(server.localAddress().isEmpty());

        server.start();
        try {
            assertEquals(ServerState.RUNNING, server.state());
            assertEquals(2, attempts.get());
        } finally {
            server.stop();
        }
    }

    @Test
    void binderReturningNothingIsABindFailure() {
        DatagramServer server = DatagramServer.create("TEST", config().withBinder((f, a) -> null).build());

        assertThrows(ServerBindException.class, server::start);
        assertEquals(ServerState.CREATED, server.state());
    }

    // -------------------------------------------------------------------------
    // Pipeline
    // -------------------------------------------------------------------------

    @Test
    void datagramIsAnsweredThroughBothPools() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config().build());
        server.start();
        try {
            socket.injectDatagram(PEER, new byte[20]);

            awaitCondition(() -> socket.sent().size() == 1);
            assertEquals(PEER, socket.sent().get(0).remote());
            assertArrayEquals("GOT IT".getBytes(StandardCharsets.US_ASCII), socket.sent().get(0).payload());
            assertEquals(1, server.stats().datagramsReceived());
            assertEquals(1, server.stats().responsesWritten());
        } finally {
            server.stop();
        }
    }

    @Test
    void failingDatagramDoesNotAffectOthers() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config()
                .withRequestHandler(request -> {
                    if (request.payload().length == 0) {
                        throw new IllegalArgumentException("empty datagram");
                    }
                    return Optional.of(Response.replyTo(request, request.payload()));
                })
                .build());
        server.start();
        try {
            InetSocketAddress other = new InetSocketAddress("127.0.0.1", 9401);
            socket.injectDatagram(PEER, new byte[0]);
            socket.injectDatagram(other, new byte[] {42});

            awaitCondition(() -> socket.sent().size() == 1);
            assertEquals(other, socket.sent().get(0).remote());
            assertEquals(1, sink.getErrors(ErrorKind.REQUEST).size());
            assertEquals(ServerState.RUNNING, server.state());
        } finally {
            server.stop();
        }
    }

    @Test
    void errorFromRequestHandlerIsReportedAndWorkerKeepsServing() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config()
                .withPoolPolicy(WorkerPoolPolicy.builder()
                        .withRequestWorkers(1)
                        .withShutdownGracePeriod(Duration.ofMillis(500))
                        .build())
                .withRequestHandler(request -> {
                    if (request.payload().length == 0) {
                        throw new AssertionError("bad datagram");
                    }
                    return Optional.of(Response.replyTo(request, "GOT IT"));
                })
                .build());
        server.start();
        try {
            socket.injectDatagram(PEER, new byte[0]);
            socket.injectDatagram(PEER, new byte[] {1});

            awaitCondition(() -> socket.sent().size() == 1);
            List<ServerErrorEvent> internal = sink.getErrors(ErrorKind.INTERNAL);
            assertEquals(1, internal.size());
            assertInstanceOf(AssertionError.class, internal.get(0).cause());
            assertEquals(PEER, internal.get(0).peer());
            assertEquals(1, server.stats().requestFailures());
            assertEquals(ServerState.RUNNING, server.state());
        } finally {
            server.stop();
        }
    }

    @Test
    void errorFromResponseHandlerIsReportedAndWorkerKeepsWriting() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config()
                .withPoolPolicy(WorkerPoolPolicy.builder()
                        .withResponseWorkers(1)
                        .withShutdownGracePeriod(Duration.ofMillis(500))
                        .build())
                .withRequestHandler(request -> Optional.of(Response.replyTo(request, request.payload())))
                .withResponseHandler((handle, response) -> {
                    if (response.payload().length == 0) {
                        throw new StackOverflowError("writer blew up");
                    }
                    handle.send(response.destination(), response.payload());
                })
                .build());
        server.start();
        try {
            socket.injectDatagram(PEER, new byte[0]);
            awaitCondition(() -> sink.getErrors(ErrorKind.INTERNAL).size() == 1);

            socket.injectDatagram(PEER, new byte[] {2});
            awaitCondition(() -> socket.sent().size() == 1);
            assertInstanceOf(StackOverflowError.class, sink.getErrors(ErrorKind.INTERNAL).get(0).cause());
            assertEquals(1, server.stats().writeFailures());
            assertEquals(1, server.stats().responsesWritten());
        } finally {
            server.stop();
        }
    }

    @Test
    void fullResponseQueueHoldsRepliesUntilTheyAreWritten() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);

        DatagramServer server = DatagramServer.create("TEST", config()
                .withPoolPolicy(WorkerPoolPolicy.builder()
                        .withRequestWorkers(1)
                        .withResponseWorkers(1)
                        .withResponseQueueCapacity(1)
                        .withShutdownGracePeriod(Duration.ofSeconds(2))
                        .build())
                .withRequestHandler(request -> Optional.of(Response.replyTo(request, request.payload())))
                .withResponseHandler((handle, response) -> {
                    try {
                        gate.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("gate interrupted");
                    }
                    handle.send(response.destination(), response.payload());
                })
                .build());
        server.start();
        try {
            for (int i = 0; i < 5; i++) {
                socket.injectDatagram(PEER, new byte[] {(byte) i});
            }

            // One reply held by the writer, one in the queue; the request worker blocks on the third.
            awaitCondition(() -> server.stats().responsesQueued() == 2);
            Thread.sleep(200);
            assertEquals(2, server.stats().responsesQueued());
            assertTrue(socket.sent().isEmpty());

            gate.countDown();

            awaitCondition(() -> socket.sent().size() == 5);
            for (int i = 0; i < 5; i++) {
                assertArrayEquals(new byte[] {(byte) i}, socket.sent().get(i).payload());
            }
            assertEquals(5, server.stats().responsesQueued());
            assertEquals(5, server.stats().responsesWritten());
            assertEquals(0, server.stats().abandoned());
            assertTrue(sink.getErrors().isEmpty());
        } finally {
            gate.countDown();
            server.stop();
        }
        assertEquals(0, server.stats().abandoned());
    }

    @Test
    void readerGivingUpIsReportedAndServerCanStillBeStopped() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config()
                .withPoolPolicy(WorkerPoolPolicy.builder().withMaxConsecutiveReadErrors(2).build())
                .build());
        server.start();

        socket.injectReadFailure(new IOException("first"));
        socket.injectReadFailure(new IOException("second"));

        awaitCondition(() -> !server.isReading());
        assertTrue(sink.getLifecycleKinds().contains(ServerLifecycleEvent.Kind.READER_STOPPED));
        assertEquals(ServerState.RUNNING, server.state());

        server.stop();
        assertEquals(ServerState.STOPPED, server.state());
    }

    @Test
    void sinkFailureDoesNotDisturbThePipeline() throws InterruptedException {
        DatagramServer server = DatagramServer.create("TEST", config()
                .withObservabilitySink(new com.questrail.datagram.observability.DatagramServerObservabilitySink() {
                    @Override
                    public void onLifecycleEvent(ServerLifecycleEvent event) {
                        throw new IllegalStateException("sink down");
                    }

                    @Override
                    public void onError(ServerErrorEvent event) {
                        throw new IllegalStateException("sink down");
                    }
                })
                .withRequestHandler(request -> {
                    if (request.payload().length == 0) {
                        throw new IllegalArgumentException("empty");
                    }
                    return Optional.of(Response.replyTo(request, "ok"));
                })
                .build());
        server.start();
        try {
            socket.injectDatagram(PEER, new byte[0]);
            socket.injectDatagram(PEER, new byte[] {1});
            awaitCondition(() -> socket.sent().size() == 1);
        } finally {
            server.stop();
        }
    }

    static void awaitCondition(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 2 seconds");
            }
            Thread.sleep(10);
        }
    }
}
