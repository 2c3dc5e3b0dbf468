package com.questrail.meshinfo.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryMeshRepositoryTest
 * -----------------------------------------------------------------------------
 * Commit and rollback of units of work, id assignment and status sweeps.
 */
class InMemoryMeshRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryMeshRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMeshRepository();
    }

    private static NodeRecord node(String name, String ip, Instant lastSeen) {
        NodeRecord record = new NodeRecord();
        record.setName(name);
        record.setWlanIp(ip);
        record.setWlanMacAddress("");
        record.setLastSeen(lastSeen);
        return record;
    }

    @Test
    void idsAreAssignedOnFirstSaveOnly() {
        NodeRecord saved = repository.inTransaction(session -> {
            NodeRecord first = session.saveNode(node("NODE-A", "10.1.1.1", NOW));
            session.saveNode(node("NODE-B", "10.1.1.2", NOW));
            first.setName("NODE-A2");
            return session.saveNode(first);
        });

        assertEquals(1L, saved.getId());
        assertEquals(2, repository.nodes().size());
        assertEquals("NODE-A2", repository.nodes().get(0).getName());
        assertEquals(2L, repository.nodes().get(1).getId());
    }

    @Test
    void failedUnitOfWorkLeavesCommittedStateUntouched() {
        repository.inTransaction(session -> session.saveNode(node("NODE-A", "10.1.1.1", NOW)));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
                repository.inTransaction(session -> {
                    NodeRecord existing = session.findNodes(null, "NODE-A", null).get(0);
                    existing.setStatus(NodeStatus.INACTIVE);
                    session.saveNode(existing);
                    session.saveNode(node("NODE-B", "10.1.1.2", NOW));
                    session.appendStatistics(new CycleStatistics(NOW, 2, 0, 0,
                            Duration.ZERO, Duration.ZERO, Map.of()));
                    throw new IllegalStateException("boom");
                }));

        assertEquals("boom", thrown.getMessage());
        assertEquals(1, repository.nodes().size());
        assertEquals(NodeStatus.ACTIVE, repository.nodes().get(0).getStatus());
        assertTrue(repository.statistics().isEmpty());
    }

    @Test
    void readersSeeCopiesNotLiveRecords() {
        repository.inTransaction(session -> session.saveNode(node("NODE-A", "10.1.1.1", NOW)));

        repository.nodes().get(0).setName("changed");

        assertEquals("NODE-A", repository.nodes().get(0).getName());
    }

    @Test
    void linkToUnknownNodeIsRejected() {
        long id = repository.inTransaction(session -> session.saveNode(node("NODE-A", "10.1.1.1", NOW)).getId());

        assertThrows(RepositoryException.class, () ->
                repository.inTransaction(session -> session.saveLink(new LinkRecord(id, 99))));
        assertTrue(repository.links().isEmpty());
    }

    @Test
    void activeNodeLookupByIpPrefersMostRecent() {
        repository.inTransaction(session -> {
            session.saveNode(node("OLD", "10.1.1.1", NOW.minusSeconds(600)));
            session.saveNode(node("NEW", "10.1.1.1", NOW));
            NodeRecord inactive = node("GONE", "10.1.1.1", NOW.plusSeconds(60));
            inactive.setStatus(NodeStatus.INACTIVE);
            return session.saveNode(inactive);
        });

        String name = repository.inTransaction(session ->
                session.findActiveNodeByIp("10.1.1.1").map(NodeRecord::getName).orElse(null));

        assertEquals("NEW", name);
    }

    @Test
    void statusSweepHonorsCutoff() {
        repository.inTransaction(session -> {
            long a = session.saveNode(node("NODE-A", "10.1.1.1", NOW)).getId();
            long b = session.saveNode(node("NODE-B", "10.1.1.2", NOW)).getId();
            LinkRecord old = new LinkRecord(a, b);
            old.setStatus(LinkStatus.RECENT);
            old.setLastSeen(NOW.minus(Duration.ofDays(3)));
            session.saveLink(old);
            LinkRecord fresh = new LinkRecord(b, a);
            fresh.setStatus(LinkStatus.RECENT);
            fresh.setLastSeen(NOW);
            return session.saveLink(fresh);
        });

        int expired = repository.inTransaction(session ->
                session.updateLinkStatus(LinkStatus.RECENT, LinkStatus.INACTIVE, NOW.minus(Duration.ofDays(1))));

        assertEquals(1, expired);
        assertEquals(LinkStatus.INACTIVE, repository.links().get(0).getStatus());
        assertEquals(LinkStatus.RECENT, repository.links().get(1).getStatus());
    }
}
