package com.questrail.meshinfo.poller.netty;

import com.questrail.meshinfo.poller.StatusClient;
import com.questrail.meshinfo.poller.StatusResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyStatusClientTest
 * -----------------------------------------------------------------------------
 * Runs the Netty HTTP client against a local HTTP server playing a node.
 */
class NettyStatusClientTest {

    private HttpServer server;
    private final AtomicReference<String> requestedUri = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/cgi-bin/sysinfo.json", exchange -> {
            requestedUri.set(exchange.getRequestURI().toString());
            respond(exchange, 200, "{\"node\":\"N0CALL-HAP\"}");
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private NettyStatusClient client(Duration readTimeout) {
        return new NettyStatusClient(Duration.ofSeconds(2), readTimeout, server.getAddress().getPort());
    }

    @Test
    void fetchesStatusDocumentWithServiceAndLinkQuery() throws Exception {
        try (NettyStatusClient client = client(Duration.ofSeconds(2))) {
            StatusResponse response = client.fetch("127.0.0.1");

            assertEquals(200, response.status());
            assertEquals("{\"node\":\"N0CALL-HAP\"}", response.text());
            assertEquals(StatusClient.STATUS_PATH + "?" + StatusClient.STATUS_QUERY, requestedUri.get());
        }
    }

    @Test
    void nonSuccessStatusIsReturnedNotThrown() throws Exception {
        server.removeContext("/cgi-bin/sysinfo.json");
        server.createContext("/cgi-bin/sysinfo.json", exchange -> respond(exchange, 500, "Internal Server Error"));

        try (NettyStatusClient client = client(Duration.ofSeconds(2))) {
            StatusResponse response = client.fetch("127.0.0.1");

            assertEquals(500, response.status());
            assertEquals("Internal Server Error", response.text());
        }
    }

    @Test
    void invalidUtf8IsReplacedNotFatal() throws Exception {
        server.removeContext("/cgi-bin/sysinfo.json");
        server.createContext("/cgi-bin/sysinfo.json", exchange -> {
            byte[] bytes = {'4', '5', (byte) 0xB0};
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });

        try (NettyStatusClient client = client(Duration.ofSeconds(2))) {
            assertEquals("45\uFFFD", client.fetch("127.0.0.1").text());
        }
    }

    @Test
    void slowNodeTimesOut() throws Exception {
        server.removeContext("/cgi-bin/sysinfo.json");
        server.createContext("/cgi-bin/sysinfo.json", exchange -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{}");
        });

        try (NettyStatusClient client = client(Duration.ofMillis(200))) {
            assertThrows(SocketTimeoutException.class, () -> client.fetch("127.0.0.1"));
        }
    }

    @Test
    void refusedConnectionIsAnIoErrorButNotATimeout() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }

        try (NettyStatusClient client = new NettyStatusClient(Duration.ofSeconds(2), Duration.ofSeconds(2), port)) {
            IOException e = assertThrows(IOException.class, () -> client.fetch("127.0.0.1"));
            assertFalse(e instanceof SocketTimeoutException);
        }
    }

    @Test
    void closedClientRefusesFetches() {
        NettyStatusClient client = client(Duration.ofSeconds(1));
        client.close();
        client.close();

        assertThrows(IOException.class, () -> client.fetch("127.0.0.1"));
    }

    @Test
    void factoryOpensIndependentSessions() throws Exception {
        NettyStatusClientFactory factory = new NettyStatusClientFactory(
                Duration.ofSeconds(2), Duration.ofSeconds(2), server.getAddress().getPort());

        try (StatusClient first = factory.open(); StatusClient second = factory.open()) {
            assertNotSame(first, second);
            assertEquals(200, first.fetch("127.0.0.1").status());
            assertEquals(200, second.fetch("127.0.0.1").status());
        }
    }
}
