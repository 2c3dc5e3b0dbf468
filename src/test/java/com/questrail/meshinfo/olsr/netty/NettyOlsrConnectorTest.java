package com.questrail.meshinfo.olsr.netty;

import com.questrail.meshinfo.olsr.OlsrConnectException;
import com.questrail.meshinfo.olsr.OlsrData;
import com.questrail.meshinfo.olsr.OlsrLineSource;
import com.questrail.meshinfo.olsr.OlsrLink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyOlsrConnectorTest
 * -----------------------------------------------------------------------------
 * Runs the Netty line source against a local TCP server playing the daemon.
 */
class NettyOlsrConnectorTest {

    private ServerSocket server;
    private Thread serverThread;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws IOException {
        server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws Exception {
        release.countDown();
        server.close();
        if (serverThread != null) {
            serverThread.join(2000);
        }
    }

    /** Accept one connection, write the payload, then hold or close the connection. */
    private void serve(String payload, boolean holdOpen) {
        serverThread = new Thread(() -> {
            try (Socket socket = server.accept()) {
                OutputStream out = socket.getOutputStream();
                out.write(payload.getBytes(StandardCharsets.UTF_8));
                out.flush();
                if (holdOpen) {
                    release.await(5, TimeUnit.SECONDS);
                }
            } catch (IOException | InterruptedException ignored) {
                // test server shuts down with the test
            }
        }, "fake-olsr-daemon");
        serverThread.start();
    }

    @Test
    void streamsLinesUntilTheDaemonClosesTheConnection() throws Exception {
        serve("digraph topology\n"
                + "\"10.1.1.1\" -> \"10.1.1.2\"[label=\"2.500\"];\n"
                + "\"10.1.1.2\" -> \"10.1.1.1\"[label=\"INFINITE\"];\r\n"
                + "}\n", false);

        NettyOlsrConnector connector = new NettyOlsrConnector(Duration.ofSeconds(5));
        OlsrData olsr = OlsrData.connect(connector, "127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2));

        List<OlsrLink> links = new ArrayList<>();
        olsr.links().forEachRemaining(links::add);
        List<String> nodes = new ArrayList<>();
        olsr.nodes().forEachRemaining(nodes::add);

        assertEquals(List.of(
                new OlsrLink("10.1.1.1", "10.1.1.2", 2.5),
                new OlsrLink("10.1.1.2", "10.1.1.1", 99.99)), links);
        assertEquals(List.of("10.1.1.1", "10.1.1.2"), nodes);
        assertTrue(olsr.isFinished());
    }

    @Test
    void endOfStreamIsReportedRepeatedly() throws Exception {
        serve("only line\n", false);

        OlsrLineSource source = new NettyOlsrConnector(Duration.ofSeconds(5))
                .connect("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2));
        try {
            assertEquals("only line", source.readLine());
            assertNull(source.readLine());
            assertNull(source.readLine());
        } finally {
            source.close();
            source.close();
        }
    }

    @Test
    void silentDaemonTimesOutTheRead() throws Exception {
        serve("", true);

        OlsrLineSource source = new NettyOlsrConnector(Duration.ofMillis(200))
                .connect("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2));
        try {
            assertThrows(SocketTimeoutException.class, source::readLine);
        } finally {
            source.close();
        }
    }

    @Test
    void refusedConnectionFailsWithConnectException() throws Exception {
        int port = server.getLocalPort();
        server.close();

        NettyOlsrConnector connector = new NettyOlsrConnector(Duration.ofSeconds(1));
        OlsrConnectException e = assertThrows(OlsrConnectException.class,
                () -> connector.connect("127.0.0.1", port, Duration.ofSeconds(2)));
        assertEquals("127.0.0.1", e.host());
        assertEquals(port, e.port());
    }
}
