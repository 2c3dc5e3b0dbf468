package com.questrail.meshinfo.topology;

import com.questrail.meshinfo.olsr.OlsrData;
import com.questrail.meshinfo.olsr.OlsrLink;
import com.questrail.meshinfo.poller.NodePoller;
import com.questrail.meshinfo.poller.NodeResult;
import com.questrail.meshinfo.poller.sysinfo.LinkInfo;
import com.questrail.meshinfo.poller.sysinfo.SystemInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * TopologyAssembler
 * =============================================================================
 * Combines one OLSR session with the poll results of the nodes it names into
 * a single {@link NetworkInfo}.
 *
 * <h2>Sequencing</h2>
 * Polling of {@link OlsrData#nodes()} starts on a background thread while the
 * calling thread drains {@link OlsrData#links()}. Merging starts only after
 * both are complete, so the result does not depend on the order in which
 * individual polls finish.
 *
 * <h2>Merge rules</h2>
 * <ul>
 *   <li>A failed poll goes to the error list.</li>
 *   <li>A node that reports its own links keeps them. Firmware with an API
 *       version below {@value #COST_API_MAJOR}.{@value #COST_API_MINOR} does
 *       not report link cost, so cost is taken from OLSR by destination IP.</li>
 *   <li>A node that reports no links gets its OLSR links instead. Destinations
 *       that no successful poll names are dropped.</li>
 * </ul>
 */
public final class TopologyAssembler
{
    private static final Logger log = LoggerFactory.getLogger(TopologyAssembler.class);

    static final int COST_API_MAJOR = 1;
    static final int COST_API_MINOR = 9;

    private final NodePoller poller;

    public TopologyAssembler(NodePoller poller) {
        this.poller = Objects.requireNonNull(poller, "poller");
    }

    /**
     * Poll every node in the session and merge the results.
     *
     * @throws InterruptedException if interrupted while waiting for polling
     * @throws com.questrail.meshinfo.olsr.OlsrStreamException if the OLSR
     *         stream fails before it ends
     */
    public NetworkInfo assemble(OlsrData olsr) throws InterruptedException {
        ExecutorService background = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "topology-poll");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<List<NodeResult>> polling = background.submit(() -> poller.poll(olsr.nodes()));

            List<OlsrLink> olsrLinks = new ArrayList<>();
            try {
                olsr.links().forEachRemaining(olsrLinks::add);
            } catch (RuntimeException e) {
                // unblock the poller, which may be waiting on the same session
                olsr.close();
                polling.cancel(true);
                throw e;
            }
            log.info("OLSR link count: {}", olsrLinks.size());

            return merge(awaitResults(polling), olsrLinks);
        } finally {
            background.shutdownNow();
        }
    }

    private static List<NodeResult> awaitResults(Future<List<NodeResult>> polling) throws InterruptedException {
        try {
            return polling.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            if (cause instanceof InterruptedException ie) {
                throw ie;
            }
            throw new IllegalStateException("Polling failed", cause);
        }
    }

    /**
     * Merge poll results with OLSR links. Package-private for tests.
     */
    static NetworkInfo merge(List<NodeResult> results, List<OlsrLink> olsrLinks) {
        Map<String, String> namesByIp = new HashMap<>();
        // failed nodes are never link endpoints
        for (NodeResult result : results) {
            if (result.isSuccess() && !result.name().isEmpty() && !result.ipAddress().isEmpty()) {
                namesByIp.put(result.ipAddress(), result.name());
            }
        }

        Map<String, List<OlsrLink>> olsrBySource = new HashMap<>();
        for (OlsrLink link : olsrLinks) {
            olsrBySource.computeIfAbsent(link.source(), k -> new ArrayList<>()).add(link);
        }

        Map<String, Integer> counters = new LinkedHashMap<>();
        List<SystemInfo> nodes = new ArrayList<>();
        List<LinkInfo> links = new ArrayList<>();
        List<NodeResult> errors = new ArrayList<>();

        for (NodeResult result : results) {
            count(counters, "node results");
            if (result.error().isPresent()) {
                count(counters, "errors (totals)");
                count(counters, "errors (" + result.error().get().error() + ")");
                errors.add(result);
                continue;
            }

            SystemInfo info = result.systemInfo().orElseThrow();
            List<OlsrLink> nodeOlsrLinks = olsrBySource.getOrDefault(result.ipAddress(), List.of());

            if (!info.links().isEmpty()) {
                count(counters, "using link_info json");
                List<LinkInfo> reported = info.links();
                if (info.apiVersion().isBefore(COST_API_MAJOR, COST_API_MINOR)) {
                    count(counters, "using olsr for link cost");
                    reported = costFromOlsr(info, reported, nodeOlsrLinks);
                }
                links.addAll(reported);
                nodes.add(info.withLinkCount(reported.size()));
                continue;
            }

            count(counters, "using olsr for link data");
            if (nodeOlsrLinks.isEmpty()) {
                log.warn("Failed to find OLSR links for {}", info);
                nodes.add(info.withLinkCount(0));
                continue;
            }
            for (OlsrLink link : nodeOlsrLinks) {
                String destination = namesByIp.get(link.destination());
                if (destination == null) {
                    log.warn("OLSR IP not found in node information, skipping: {}", link);
                    continue;
                }
                links.add(LinkInfo.fromOlsr(info.nodeName(), result.ipAddress(),
                        destination, link.destination(), link.cost()));
            }
            nodes.add(info.withLinkCount(nodeOlsrLinks.size()));
        }

        log.info("Network Info Summary: {}", counters);
        return new NetworkInfo(nodes, links, errors, counters);
    }

    private static List<LinkInfo> costFromOlsr(SystemInfo info, List<LinkInfo> reported, List<OlsrLink> olsrLinks) {
        if (olsrLinks.isEmpty()) {
            log.warn("No OLSR link data found for {}", info);
            return reported;
        }
        Map<String, Double> costByDestination = new HashMap<>();
        for (OlsrLink link : olsrLinks) {
            costByDestination.put(link.destination(), link.cost());
        }

        List<LinkInfo> updated = new ArrayList<>(reported.size());
        for (LinkInfo link : reported) {
            Double cost = costByDestination.get(link.destinationIp());
            if (cost == null) {
                log.warn("No OLSR link found for {}", link);
                updated.add(link);
            } else {
                updated.add(link.withOlsrCost(cost));
            }
        }
        return updated;
    }

    private static void count(Map<String, Integer> counters, String key) {
        counters.merge(key, 1, Integer::sum);
    }
}
