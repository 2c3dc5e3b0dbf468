package com.questrail.meshinfo.collector;

import com.questrail.meshinfo.geo.Geodesy;
import com.questrail.meshinfo.persistence.LinkRecord;
import com.questrail.meshinfo.persistence.LinkStatus;
import com.questrail.meshinfo.persistence.NodeRecord;
import com.questrail.meshinfo.persistence.NodeStatus;
import com.questrail.meshinfo.persistence.RepositorySession;
import com.questrail.meshinfo.poller.sysinfo.LinkInfo;
import com.questrail.meshinfo.poller.sysinfo.SystemInfo;
import com.questrail.meshinfo.topology.NetworkInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TopologyReconciler
 * =============================================================================
 * Applies one cycle's {@link NetworkInfo} to stored state.
 *
 * <h2>Node identity</h2>
 * A polled node is matched against stored nodes in three tiers, the first
 * tier with any match winning:
 * <ol>
 *   <li>same MAC address and same name, any status</li>
 *   <li>same MAC address, {@link NodeStatus#ACTIVE} (skipped when the MAC is unknown)</li>
 *   <li>same name, {@link NodeStatus#ACTIVE}</li>
 * </ol>
 * The most recently seen match is updated. Other matches that are still
 * active are stale duplicates and become {@link NodeStatus#INACTIVE}.
 *
 * <h2>Links</h2>
 * All {@link LinkStatus#CURRENT} links drop to {@link LinkStatus#RECENT}
 * first, so only links seen in this cycle end up current. A link is stored
 * only when both endpoint addresses belong to an active node.
 *
 * <h2>Expiry</h2>
 * Runs after the updates, so data refreshed in this cycle is never expired
 * by it.
 *
 * <p>Every method works inside the caller's unit of work.</p>
 */
public final class TopologyReconciler
{
    private static final Logger log = LoggerFactory.getLogger(TopologyReconciler.class);

    private static final Comparator<NodeRecord> MOST_RECENT_FIRST = Comparator
            .comparing(NodeRecord::getLastSeen, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(NodeRecord::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Duration nodeInactive;
    private final Duration linkInactive;

    public TopologyReconciler(Duration nodeInactive, Duration linkInactive) {
        this.nodeInactive = Objects.requireNonNull(nodeInactive, "nodeInactive");
        this.linkInactive = Objects.requireNonNull(linkInactive, "linkInactive");
    }

    /**
     * Save nodes, then links, then expire stale data.
     *
     * @return counters of everything done, prefixed by {@code nodes} or {@code links}
     */
    public Map<String, Integer> reconcile(RepositorySession session, NetworkInfo network, Instant now) {
        Map<String, Integer> counters = new LinkedHashMap<>();
        saveNodes(session, network.nodes(), now)
                .forEach((k, v) -> counters.put("nodes " + k, v));
        saveLinks(session, network.links(), now)
                .forEach((k, v) -> counters.put("links " + k, v));
        counters.putAll(expireData(session, now));
        return counters;
    }

    public Map<String, Integer> saveNodes(RepositorySession session, List<SystemInfo> nodes, Instant now) {
        Map<String, Integer> count = new LinkedHashMap<>();
        for (SystemInfo node : nodes) {
            increment(count, "total");

            Optional<NodeRecord> existing = findBestMatch(session, node);
            NodeRecord record;
            if (existing.isEmpty()) {
                log.debug("Saving {} to database", node);
                increment(count, "added");
                record = new NodeRecord();
            } else {
                record = existing.get();
                log.debug("Updating {} in database with {}", record, node);
                increment(count, "updated");
            }

            record.overwriteFrom(node);
            record.setLastSeen(now);
            record.setStatus(NodeStatus.ACTIVE);
            session.saveNode(record);
        }
        log.info("Nodes written to database: {}", count);
        return count;
    }

    /**
     * The stored node a snapshot belongs to, if any. Demotes stale duplicates
     * among the winning tier's matches.
     */
    Optional<NodeRecord> findBestMatch(RepositorySession session, SystemInfo node) {
        String mac = node.wlanMacAddress();
        String name = node.nodeName();

        List<NodeRecord> matches = session.findNodes(mac, name, null);
        if (matches.isEmpty() && !mac.isEmpty()) {
            matches = session.findNodes(mac, null, NodeStatus.ACTIVE);
        }
        if (matches.isEmpty()) {
            matches = session.findNodes(null, name, NodeStatus.ACTIVE);
        }
        return mostRecent(session, matches);
    }

    private static Optional<NodeRecord> mostRecent(RepositorySession session, List<NodeRecord> matches) {
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        List<NodeRecord> sorted = new ArrayList<>(matches);
        sorted.sort(MOST_RECENT_FIRST);
        for (NodeRecord older : sorted.subList(1, sorted.size())) {
            if (older.getStatus() == NodeStatus.ACTIVE) {
                log.debug("Marking older match inactive: {}", older);
                older.setStatus(NodeStatus.INACTIVE);
                session.saveNode(older);
            }
        }
        return Optional.of(sorted.get(0));
    }

    public Map<String, Integer> saveLinks(RepositorySession session, List<LinkInfo> links, Instant now) {
        Map<String, Integer> count = new LinkedHashMap<>();

        int demoted = session.updateLinkStatus(LinkStatus.CURRENT, LinkStatus.RECENT, null);
        log.debug("Marked {} current links as recent", demoted);

        for (LinkInfo link : links) {
            increment(count, "total");

            Optional<NodeRecord> source = session.findActiveNodeByIp(link.sourceIp());
            Optional<NodeRecord> destination = session.findActiveNodeByIp(link.destinationIp());
            if (source.isEmpty() || destination.isEmpty()) {
                log.warn("Failed to save link {} -> {}, node missing from database",
                        link.sourceIp(), link.destinationIp());
                increment(count, "errors");
                continue;
            }
            NodeRecord from = source.get();
            NodeRecord to = destination.get();

            Optional<LinkRecord> existing = session.findLink(from.getId(), to.getId());
            LinkRecord record;
            if (existing.isEmpty()) {
                increment(count, "new");
                record = new LinkRecord(from.getId(), to.getId());
            } else {
                increment(count, "updated");
                record = existing.get();
            }

            record.setType(link.type());
            record.setInterfaceName(link.interfaceName());
            record.setSignal(link.signal());
            record.setNoise(link.noise());
            record.setQuality(link.quality());
            record.setNeighborQuality(link.neighborQuality());
            record.setTxRate(link.txRate());
            record.setRxRate(link.rxRate());
            record.setOlsrCost(link.olsrCost());
            record.setStatus(LinkStatus.CURRENT);
            record.setLastSeen(now);

            if (from.hasLocation() && to.hasLocation()) {
                increment(count, "location calculated");
                record.setDistance(Geodesy.distance(
                        from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude()));
                record.setBearing(Geodesy.bearing(
                        from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude()));
            } else {
                increment(count, "missing location info");
                record.setDistance(null);
                record.setBearing(null);
            }
            session.saveLink(record);
        }
        log.info("Links written to database: {}", count);
        return count;
    }

    /**
     * Mark links and nodes inactive when not seen within their expiry windows.
     *
     * @return the number of links and nodes expired
     */
    public Map<String, Integer> expireData(RepositorySession session, Instant now) {
        Map<String, Integer> count = new LinkedHashMap<>();

        Instant linkCutoff = now.minus(linkInactive);
        int links = session.updateLinkStatus(LinkStatus.RECENT, LinkStatus.INACTIVE, linkCutoff);
        log.info("Marked {} links inactive that have not been seen since {}", links, linkCutoff);
        count.put("links expired", links);

        Instant nodeCutoff = now.minus(nodeInactive);
        int nodes = session.updateNodeStatus(NodeStatus.ACTIVE, NodeStatus.INACTIVE, nodeCutoff);
        log.info("Marked {} nodes inactive that have not been seen since {}", nodes, nodeCutoff);
        count.put("nodes expired", nodes);

        return count;
    }

    private static void increment(Map<String, Integer> count, String key) {
        count.merge(key, 1, Integer::sum);
    }
}
