package com.questrail.datagram.transport.udp.netty;

import com.questrail.datagram.api.NetworkFamily;
import com.questrail.datagram.api.RawDatagram;
import com.questrail.datagram.transport.DatagramSocketHandle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NettyDatagramBinderTest {

    private DatagramSocketHandle handle;

    @AfterEach
    void tearDown() {
        if (handle != null) {
            handle.close();
        }
    }

    @Test
    void bindsToOsAssignedPort() throws IOException {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");

        InetSocketAddress local = handle.localAddress();
        assertNotNull(local);
        assertNotEquals(0, local.getPort());
        assertEquals(InetAddress.getByName("127.0.0.1"), local.getAddress());
        assertTrue(handle.isOpen());
    }

    @Test
    void receivesWholeDatagramWithSender() throws IOException {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");

        byte[] payload = new byte[3000];
        Arrays.fill(payload, (byte) 0x5A);

        try (DatagramSocket client = new DatagramSocket(0, InetAddress.getByName("127.0.0.1"))) {
            client.send(new DatagramPacket(payload, payload.length, handle.localAddress()));

            RawDatagram datagram = handle.receive();
            assertArrayEquals(payload, datagram.payload());
            assertEquals(client.getLocalPort(), datagram.sender().getPort());
        }
    }

    @Test
    void sendDeliversToPeer() throws IOException {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");

        try (DatagramSocket client = new DatagramSocket(0, InetAddress.getByName("127.0.0.1"))) {
            client.setSoTimeout(2000);

            handle.send(client.getLocalSocketAddress(), "ping".getBytes(StandardCharsets.US_ASCII));

            byte[] buf = new byte[16];
            DatagramPacket packet = new DatagramPacket(buf, buf.length);
            client.receive(packet);
            assertEquals("ping", new String(buf, 0, packet.getLength(), StandardCharsets.US_ASCII));
        }
    }

    @Test
    void expiredWriteDeadlineFailsWithTimeout() throws IOException {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");

        byte[] payload = "String to send via UDP socket for testing purposes.".getBytes(StandardCharsets.US_ASCII);
        InetSocketAddress remote = new InetSocketAddress("127.0.0.1", 1234);

        assertThrows(SocketTimeoutException.class, () -> handle.send(remote, payload, Duration.ZERO));
        assertThrows(SocketTimeoutException.class, () -> handle.send(remote, payload, Duration.ofMillis(-1)));

        // The socket stays usable after a timeout.
        handle.send(remote, payload, Duration.ofSeconds(1));
    }

    @Test
    void shutdownInputUnblocksPendingReceive() throws Exception {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                handle.receive();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        reader.start();
        Thread.sleep(100);

        handle.shutdownInput();
        reader.join(2000);

        assertFalse(reader.isAlive());
        assertInstanceOf(ClosedChannelException.class, failure.get());
        assertThrows(ClosedChannelException.class, handle::receive);
    }

    @Test
    void closeStopsTheEventLoopThread() throws Exception {
        handle = NettyDatagramBinder.builder()
                .withThreadNamePrefix("binder-close-test")
                .build()
                .bind(NetworkFamily.UDP4, "127.0.0.1:0");

        // Force the event loop thread into existence.
        handle.send(new InetSocketAddress("127.0.0.1", 1234), new byte[] {1});
        assertTrue(liveThreadsNamed("binder-close-test") > 0);

        handle.close();
        assertFalse(handle.isOpen());
        assertThrows(ClosedChannelException.class,
                () -> handle.send(new InetSocketAddress("127.0.0.1", 1234), new byte[] {1}));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (liveThreadsNamed("binder-close-test") > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, liveThreadsNamed("binder-close-test"));

        handle.close(); // idempotent
    }

    @Test
    void bindingAPortInUseFails() throws IOException {
        handle = new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:0");
        int port = handle.localAddress().getPort();

        assertThrows(IOException.class,
                () -> new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:" + port));
    }

    @Test
    void malformedAddressFailsToBind() {
        assertThrows(IOException.class, () -> new NettyDatagramBinder().bind(NetworkFamily.UDP4, "127.0.0.1:x"));
    }

    @Test
    void builderRejectsNonPositiveWriteTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> NettyDatagramBinder.builder().withWriteTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> NettyDatagramBinder.builder().withMaxDatagramSize(0));
    }

    static long liveThreadsNamed(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(t -> t.getName().startsWith(prefix))
                .count();
    }
}
