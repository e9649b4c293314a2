package io.fixorder.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TcpOrderTransportTest {
    private static final byte[] ORDER = "8=FIX.4.2\u00019=5\u000135=D\u000110=000\u0001".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ACK = "8=FIX.4.2\u000135=8\u000139=0\u000110=111\u0001".getBytes(StandardCharsets.US_ASCII);
    private static final TransportTimeouts SHORT = new TransportTimeouts(Duration.ofSeconds(2), Duration.ofMillis(300), 4096);

    private final TcpOrderTransport transport = new TcpOrderTransport();

    @Test
    void returnsPeerResponse() throws Exception {
        try (LoopbackServer server = new LoopbackServer(LoopbackServer.Behavior.REPLY, ACK, ORDER.length)) {
            TransportOutcome outcome = transport.send(server.endpoint(), ORDER, TransportTimeouts.defaults());

            TransportOutcome.Received received = assertInstanceOf(TransportOutcome.Received.class, outcome);
            assertArrayEquals(ACK, received.response());
            assertArrayEquals(ORDER, server.received().get(2, TimeUnit.SECONDS));
            assertTrue(outcome.delivered());
            assertTrue(received.describe().contains("35=8"));
            assertTrue(server.clientClosed().get(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void truncatesResponseToReceiveBuffer() throws Exception {
        try (LoopbackServer server = new LoopbackServer(LoopbackServer.Behavior.REPLY, ACK, ORDER.length)) {
            TransportTimeouts tinyBuffer = new TransportTimeouts(Duration.ofSeconds(2), Duration.ofSeconds(2), 4);

            TransportOutcome outcome = transport.send(server.endpoint(), ORDER, tinyBuffer);

            TransportOutcome.Received received = assertInstanceOf(TransportOutcome.Received.class, outcome);
            assertTrue(received.length() <= 4);
        }
    }

    @Test
    void reportsPeerCloseWithoutData() throws Exception {
        try (LoopbackServer server = new LoopbackServer(LoopbackServer.Behavior.CLOSE, null, ORDER.length)) {
            TransportOutcome outcome = transport.send(server.endpoint(), ORDER, SHORT);

            assertInstanceOf(TransportOutcome.ClosedByPeer.class, outcome);
            assertTrue(outcome.delivered());
            assertFalse(outcome.failed());
        }
    }

    @Test
    void treatsSilentPeerAsDeliveredAfterReadTimeout() throws Exception {
        try (LoopbackServer server = new LoopbackServer(LoopbackServer.Behavior.SILENT, null, ORDER.length)) {
            long started = System.nanoTime();
            TransportOutcome outcome = transport.send(server.endpoint(), ORDER, SHORT);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            TransportOutcome.TimedOut timedOut = assertInstanceOf(TransportOutcome.TimedOut.class, outcome);
            assertEquals(300L, timedOut.waitedMillis());
            assertTrue(elapsedMillis >= 250L, "returned after " + elapsedMillis + " ms");
            assertTrue(outcome.delivered());
            assertArrayEquals(ORDER, server.received().get(2, TimeUnit.SECONDS));
            assertTrue(server.clientClosed().get(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void reportsRefusedWhenNothingListens() throws IOException {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }
        TransportEndpoint endpoint = new TransportEndpoint(InetAddress.getLoopbackAddress().getHostAddress(), port);

        TransportOutcome outcome = transport.send(endpoint, ORDER, SHORT);

        TransportOutcome.Refused refused = assertInstanceOf(TransportOutcome.Refused.class, outcome);
        assertEquals(endpoint, refused.endpoint());
        assertTrue(outcome.failed());
        assertEquals("Connection refused at " + endpoint, outcome.describe());
    }

    @Test
    void reportsUnknownHostAsTransportError() {
        String host = "no-such-host.invalid";
        assumeTrue(new InetSocketAddress(host, 9876).isUnresolved(), "resolver answered for " + host);
        TransportEndpoint endpoint = new TransportEndpoint(host, 9876);

        TransportOutcome outcome = transport.send(endpoint, ORDER, SHORT);

        TransportOutcome.TransportError error = assertInstanceOf(TransportOutcome.TransportError.class, outcome);
        assertEquals("Unknown host: " + host, error.detail());
        assertEquals(endpoint, error.endpoint());
        assertTrue(outcome.failed());
        assertFalse(outcome.delivered());
    }

    @Test
    void reportsConnectTimeoutAsTransportError() {
        TransportEndpoint endpoint = new TransportEndpoint("10.255.255.1", 9876);
        TransportTimeouts timeouts = new TransportTimeouts(Duration.ofMillis(200), Duration.ofMillis(200), 4096);

        long started = System.nanoTime();
        TransportOutcome outcome = transport.send(endpoint, ORDER, timeouts);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(outcome.failed(), outcome.toString());
        assumeTrue(
            outcome instanceof TransportOutcome.TransportError error && error.detail().contains("timed out"),
            "network answered immediately: " + outcome.describe()
        );
        assertEquals("Connect to 10.255.255.1:9876 timed out after 200 ms", outcome.describe());
        assertTrue(elapsedMillis >= 150L, "returned after " + elapsedMillis + " ms");
    }
}
