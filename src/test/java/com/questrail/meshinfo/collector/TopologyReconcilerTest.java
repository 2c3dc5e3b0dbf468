package com.questrail.meshinfo.collector;

import com.questrail.meshinfo.geo.Geodesy;
import com.questrail.meshinfo.persistence.InMemoryMeshRepository;
import com.questrail.meshinfo.persistence.LinkRecord;
import com.questrail.meshinfo.persistence.LinkStatus;
import com.questrail.meshinfo.persistence.NodeRecord;
import com.questrail.meshinfo.persistence.NodeStatus;
import com.questrail.meshinfo.poller.sysinfo.ApiVersion;
import com.questrail.meshinfo.poller.sysinfo.LinkInfo;
import com.questrail.meshinfo.poller.sysinfo.LinkType;
import com.questrail.meshinfo.poller.sysinfo.RadioInfo;
import com.questrail.meshinfo.poller.sysinfo.SystemInfo;
import com.questrail.meshinfo.topology.NetworkInfo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TopologyReconcilerTest
 * -----------------------------------------------------------------------------
 * Node identity matching, link lifecycle and expiry against the in-memory store.
 */
class TopologyReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryMeshRepository repository;
    private TopologyReconciler reconciler;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMeshRepository();
        reconciler = new TopologyReconciler(Duration.ofDays(7), Duration.ofDays(1));
    }

    private static SystemInfo snapshot(String name, String ip, String mac, Double lat, Double lon) {
        return new SystemInfo(name, ip, mac, "desc", "model", null, "AREDN", "3.23.4.0",
                new ApiVersion(1, 11), lat, lon, null, null, List.of(), RadioInfo.NONE,
                false, 0, "[]", List.of(), 0, "{}");
    }

    private static LinkInfo link(String sourceIp, String destinationIp, double cost) {
        return LinkInfo.fromOlsr("src", sourceIp, "dst", destinationIp, cost);
    }

    private long store(String name, String ip, String mac, NodeStatus status, Instant lastSeen) {
        return repository.inTransaction(session -> {
            NodeRecord record = new NodeRecord();
            record.setName(name);
            record.setWlanIp(ip);
            record.setWlanMacAddress(mac);
            record.setStatus(status);
            record.setLastSeen(lastSeen);
            return session.saveNode(record).getId();
        });
    }

    private NodeRecord node(long id) {
        return repository.nodes().stream().filter(n -> n.getId() == id).findFirst().orElseThrow();
    }

    private Map<String, Integer> saveNodes(SystemInfo... nodes) {
        return repository.inTransaction(session -> reconciler.saveNodes(session, List.of(nodes), NOW));
    }

    private Map<String, Integer> saveLinks(LinkInfo... links) {
        return repository.inTransaction(session -> reconciler.saveLinks(session, List.of(links), NOW));
    }

    // -------------------------------------------------------------------------
    // Nodes
    // -------------------------------------------------------------------------

    @Test
    void unknownNodeIsAdded() {
        Map<String, Integer> count = saveNodes(snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null));

        assertEquals(1, count.get("added"));
        NodeRecord stored = repository.nodes().get(0);
        assertEquals("NODE-A", stored.getName());
        assertEquals("10.1.1.1", stored.getWlanIp());
        assertEquals("3.23.4.0", stored.getFirmwareVersion());
        assertEquals("1.11", stored.getApiVersion());
        assertEquals(NodeStatus.ACTIVE, stored.getStatus());
        assertEquals(NOW, stored.getLastSeen());
    }

    @Test
    void macAndNameMatchReactivatesInactiveRecord() {
        long id = store("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.INACTIVE, NOW.minus(Duration.ofDays(30)));

        Map<String, Integer> count = saveNodes(snapshot("NODE-A", "10.1.1.5", "02:00:00:00:00:0a", null, null));

        assertEquals(1, count.get("updated"));
        assertEquals(1, repository.nodes().size());
        assertEquals(NodeStatus.ACTIVE, node(id).getStatus());
        assertEquals("10.1.1.5", node(id).getWlanIp());
    }

    @Test
    void activeNodeWithSameMacIsRenamed() {
        long id = store("OLD-NAME", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.ACTIVE, NOW.minusSeconds(300));

        saveNodes(snapshot("NEW-NAME", "10.1.1.1", "02:00:00:00:00:0a", null, null));

        assertEquals(1, repository.nodes().size());
        assertEquals("NEW-NAME", node(id).getName());
    }

    @Test
    void inactiveNodeWithSameMacButOtherNameIsNotReused() {
        store("OLD-NAME", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.INACTIVE, NOW.minusSeconds(300));

        Map<String, Integer> count = saveNodes(snapshot("NEW-NAME", "10.1.1.1", "02:00:00:00:00:0a", null, null));

        assertEquals(1, count.get("added"));
        assertEquals(2, repository.nodes().size());
    }

    @Test
    void activeNodeWithSameNameGetsNewHardware() {
        long id = store("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.ACTIVE, NOW.minusSeconds(300));

        saveNodes(snapshot("NODE-A", "10.2.2.2", "02:00:00:00:00:ff", null, null));

        assertEquals(1, repository.nodes().size());
        assertEquals("02:00:00:00:00:ff", node(id).getWlanMacAddress());
    }

    @Test
    void unknownMacSkipsHardwareMatch() {
        store("OTHER", "10.1.1.1", "", NodeStatus.ACTIVE, NOW.minusSeconds(300));

        Map<String, Integer> count = saveNodes(snapshot("NODE-A", "10.1.1.2", "", null, null));

        assertEquals(1, count.get("added"));
        assertEquals(2, repository.nodes().size());
    }

    @Test
    void newestMatchWinsAndOlderActiveDuplicateIsDemoted() {
        long older = store("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.ACTIVE, NOW.minus(Duration.ofDays(2)));
        long newer = store("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", NodeStatus.ACTIVE, NOW.minus(Duration.ofDays(1)));

        saveNodes(snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null));

        assertEquals(NodeStatus.INACTIVE, node(older).getStatus());
        assertEquals(NodeStatus.ACTIVE, node(newer).getStatus());
        assertEquals(NOW, node(newer).getLastSeen());
        assertEquals(NOW.minus(Duration.ofDays(2)), node(older).getLastSeen());
    }

    // -------------------------------------------------------------------------
    // Links
    // -------------------------------------------------------------------------

    @Test
    void linkBetweenLocatedNodesGetsDistanceAndBearing() {
        saveNodes(
                snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", 32.7157, -117.1611),
                snapshot("NODE-B", "10.1.1.2", "02:00:00:00:00:0b", 34.0522, -118.2437));

        Map<String, Integer> count = saveLinks(link("10.1.1.1", "10.1.1.2", 2.5));

        assertEquals(1, count.get("new"));
        assertEquals(1, count.get("location calculated"));
        LinkRecord stored = repository.links().get(0);
        assertEquals(LinkStatus.CURRENT, stored.getStatus());
        assertEquals(2.5, stored.getOlsrCost());
        assertEquals(LinkType.UNKNOWN, stored.getType());
        assertEquals(NOW, stored.getLastSeen());
        assertEquals(Geodesy.distance(32.7157, -117.1611, 34.0522, -118.2437), stored.getDistance());
        assertEquals(Geodesy.bearing(32.7157, -117.1611, 34.0522, -118.2437), stored.getBearing());
    }

    @Test
    void linkWithUnlocatedEndpointHasNoGeometry() {
        saveNodes(
                snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", 32.7157, -117.1611),
                snapshot("NODE-B", "10.1.1.2", "02:00:00:00:00:0b", null, null));

        Map<String, Integer> count = saveLinks(link("10.1.1.1", "10.1.1.2", 2.5));

        assertEquals(1, count.get("missing location info"));
        assertNull(repository.links().get(0).getDistance());
        assertNull(repository.links().get(0).getBearing());
    }

    @Test
    void linkToUnknownOrInactiveNodeIsDroppedAndCounted() {
        saveNodes(snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null));
        store("NODE-B", "10.1.1.2", "02:00:00:00:00:0b", NodeStatus.INACTIVE, NOW.minus(Duration.ofDays(9)));

        Map<String, Integer> count = saveLinks(
                link("10.1.1.1", "10.1.1.2", 1.0),
                link("10.1.1.1", "10.1.1.3", 1.0));

        assertEquals(2, count.get("errors"));
        assertTrue(repository.links().isEmpty());
    }

    @Test
    void existingLinkIsUpdatedAndUnseenLinksDropToRecent() {
        saveNodes(
                snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null),
                snapshot("NODE-B", "10.1.1.2", "02:00:00:00:00:0b", null, null));
        saveLinks(link("10.1.1.1", "10.1.1.2", 1.0), link("10.1.1.2", "10.1.1.1", 1.0));

        Map<String, Integer> count = saveLinks(link("10.1.1.1", "10.1.1.2", 7.5));

        assertEquals(1, count.get("updated"));
        assertEquals(2, repository.links().size());
        LinkRecord seen = repository.links().get(0);
        LinkRecord unseen = repository.links().get(1);
        assertEquals(LinkStatus.CURRENT, seen.getStatus());
        assertEquals(7.5, seen.getOlsrCost());
        assertEquals(LinkStatus.RECENT, unseen.getStatus());
    }

    // -------------------------------------------------------------------------
    // Expiry
    // -------------------------------------------------------------------------

    @Test
    void staleDataExpiresButFreshDataDoesNot() {
        long stale = store("STALE", "10.1.1.9", "02:00:00:00:00:09", NodeStatus.ACTIVE, NOW.minus(Duration.ofDays(8)));
        long recent = store("RECENT", "10.1.1.8", "02:00:00:00:00:08", NodeStatus.ACTIVE, NOW.minus(Duration.ofDays(6)));

        Map<String, Integer> counters = repository.inTransaction(session -> reconciler.reconcile(session,
                new NetworkInfo(List.of(snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null)),
                        List.of(), List.of(), Map.of()),
                NOW));

        assertEquals(NodeStatus.INACTIVE, node(stale).getStatus());
        assertEquals(NodeStatus.ACTIVE, node(recent).getStatus());
        assertEquals(1, counters.get("nodes expired"));
        assertEquals(1, counters.get("nodes added"));
        assertEquals(NodeStatus.ACTIVE, repository.nodes().get(2).getStatus());
    }

    @Test
    void recentLinksExpireAfterTheLinkWindow() {
        saveNodes(
                snapshot("NODE-A", "10.1.1.1", "02:00:00:00:00:0a", null, null),
                snapshot("NODE-B", "10.1.1.2", "02:00:00:00:00:0b", null, null));
        saveLinks(link("10.1.1.1", "10.1.1.2", 1.0));

        // two days later the link is not seen again
        Instant later = NOW.plus(Duration.ofDays(2));
        Map<String, Integer> counters = repository.inTransaction(session -> {
            reconciler.saveLinks(session, List.of(), later);
            return reconciler.expireData(session, later);
        });

        assertEquals(1, counters.get("links expired"));
        assertEquals(LinkStatus.INACTIVE, repository.links().get(0).getStatus());
    }
}
