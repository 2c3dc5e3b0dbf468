package com.questrail.meshinfo.poller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshinfo.poller.sysinfo.SystemInfo;
import com.questrail.meshinfo.poller.sysinfo.SystemInfoParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NodePoller
 * =============================================================================
 * Fetches and decodes the status document of every node address it is given.
 *
 * <h2>Concurrency</h2>
 * One fetch task is submitted per address as soon as the address is drawn
 * from the input, even while the input is still being produced. At most
 * {@code maxConnections} fetches run at once; further tasks wait in the
 * queue and are never rejected.
 *
 * <h2>Fault isolation</h2>
 * Every expected failure becomes a {@link NodeResult} carrying a
 * {@link NodeError}. A task that fails unexpectedly is logged and its result
 * is omitted; it never affects sibling tasks or the pass as a whole.
 *
 * <h2>Classification order</h2>
 * <ol>
 *   <li>timeout while connecting or reading: {@link PollingError#TIMEOUT_ERROR}</li>
 *   <li>any other transport fault: {@link PollingError#CONNECTION_ERROR}</li>
 *   <li>status other than 200: {@link PollingError#HTTP_ERROR}</li>
 *   <li>body is not JSON: {@link PollingError#INVALID_RESPONSE}</li>
 *   <li>JSON does not describe a node: {@link PollingError#PARSE_ERROR}</li>
 * </ol>
 *
 * <h2>Resources</h2>
 * The {@link StatusClient} session and the worker pool live for exactly one
 * {@link #poll(Iterator)} call and are released on every exit path.
 */
public final class NodePoller
{
    private static final Logger log = LoggerFactory.getLogger(NodePoller.class);

    private final StatusClientFactory clientFactory;
    private final NameResolver nameResolver;
    private final SystemInfoParser parser;
    private final int maxConnections;

    public NodePoller(StatusClientFactory clientFactory,
                      NameResolver nameResolver,
                      SystemInfoParser parser,
                      int maxConnections)
    {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.nameResolver = Objects.requireNonNull(nameResolver, "nameResolver");
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1");
        }
        this.maxConnections = maxConnections;
    }

    /**
     * Poll every address produced by {@code addresses}.
     *
     * @return one result per address, minus tasks that failed unexpectedly;
     *         order follows submission order
     * @throws InterruptedException if interrupted while waiting for results
     * @throws RuntimeException whatever the input iterator throws; outstanding
     *         fetches are cancelled and the session is closed first
     */
    public List<NodeResult> poll(Iterator<String> addresses) throws InterruptedException {
        long start = System.nanoTime();

        ExecutorService workers = Executors.newFixedThreadPool(maxConnections, new WorkerThreadFactory());
        try (StatusClient client = clientFactory.open()) {
            List<Future<NodeResult>> tasks = new ArrayList<>();
            while (addresses.hasNext()) {
                String address = addresses.next();
                log.debug("Creating task to poll {}", address);
                tasks.add(workers.submit(() -> pollNode(client, address)));
            }

            List<NodeResult> results = new ArrayList<>(tasks.size());
            for (Future<NodeResult> task : tasks) {
                try {
                    results.add(task.get());
                } catch (ExecutionException e) {
                    log.error("Unexpected exception polling nodes: {}", e.getCause().toString(), e.getCause());
                }
            }

            log.info("Querying nodes took {} seconds",
                    String.format("%.2f", (System.nanoTime() - start) / 1e9));
            return results;
        } finally {
            workers.shutdownNow();
        }
    }

    /**
     * Poll a single node. Package-private for tests.
     */
    NodeResult pollNode(StatusClient client, String address) {
        log.debug("{} begin polling...", address);

        final StatusResponse response;
        try {
            response = client.fetch(address);
        } catch (IOException e) {
            return connectionFailure(address, e);
        }

        String text = response.text();
        if (response.status() != 200) {
            return responseFailure(address, PollingError.HTTP_ERROR, response.status() + ": " + text, null);
        }

        final JsonNode json;
        try {
            json = parser.readTree(text);
        } catch (JsonProcessingException e) {
            return responseFailure(address, PollingError.INVALID_RESPONSE, text, e);
        }

        final SystemInfo info;
        try {
            info = parser.parse(json, address);
        } catch (RuntimeException e) {
            return responseFailure(address, PollingError.PARSE_ERROR, text, e);
        }

        log.info("Finished polling {}", info);
        return NodeResult.success(address, info);
    }

    private NodeResult connectionFailure(String address, IOException e) {
        String name = nameResolver.lookup(address);
        // SocketTimeoutException is also an IOException; check it first
        final NodeError error;
        if (e instanceof SocketTimeoutException) {
            error = new NodeError(PollingError.TIMEOUT_ERROR, "Timeout error");
        } else {
            error = new NodeError(PollingError.CONNECTION_ERROR, String.valueOf(e.getMessage()));
        }
        NodeResult result = NodeResult.failure(address, name, error);
        log.error("{}: {}", result.label(), e.toString());
        return result;
    }

    private NodeResult responseFailure(String address, PollingError kind, String response, Exception cause) {
        NodeResult result = NodeResult.failure(address, nameResolver.lookup(address), new NodeError(kind, response));
        switch (kind) {
            case HTTP_ERROR -> log.error("{}: HTTP error {}", result.label(), response);
            case INVALID_RESPONSE -> log.error("{}: Invalid JSON response: {}", result.label(), String.valueOf(cause));
            default -> log.error("{}: Parsing node information failed: {}", result.label(), String.valueOf(cause));
        }
        return result;
    }

    private static final class WorkerThreadFactory implements ThreadFactory
    {
        private static final AtomicInteger SEQUENCE = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "node-poller-" + SEQUENCE.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
