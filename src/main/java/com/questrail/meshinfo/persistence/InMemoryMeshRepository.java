package com.questrail.meshinfo.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InMemoryMeshRepository
 * =============================================================================
 * {@link MeshRepository} held entirely in memory.
 *
 * <p>Units of work are serialized. Each one runs against a private copy of
 * the committed state; the copy replaces the committed state only when the
 * unit of work returns normally. Readers outside a unit of work always see
 * committed state.</p>
 */
public final class InMemoryMeshRepository implements MeshRepository
{
    private static final Logger log = LoggerFactory.getLogger(InMemoryMeshRepository.class);

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private State committed = new State();

    @Override
    public <T> T inTransaction(UnitOfWork<T> work) {
        Objects.requireNonNull(work, "work");
        lock.lock();
        try {
            State working = committed.copy();
            T result;
            try {
                result = work.run(new Session(working));
            } catch (RuntimeException | Error e) {
                log.warn("Rolling back unit of work: {}", e.toString());
                throw e;
            }
            committed = working;
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Committed nodes, as copies, in insertion order. */
    public List<NodeRecord> nodes() {
        lock.lock();
        try {
            List<NodeRecord> copy = new ArrayList<>();
            committed.nodes.values().forEach(n -> copy.add(new NodeRecord(n)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /** Committed links, as copies, in insertion order. */
    public List<LinkRecord> links() {
        lock.lock();
        try {
            List<LinkRecord> copy = new ArrayList<>();
            committed.links.values().forEach(l -> copy.add(new LinkRecord(l)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public List<CycleStatistics> statistics() {
        lock.lock();
        try {
            return List.copyOf(committed.statistics);
        } finally {
            lock.unlock();
        }
    }

    private static final class State
    {
        final Map<Long, NodeRecord> nodes = new LinkedHashMap<>();
        final Map<Long, LinkRecord> links = new LinkedHashMap<>();
        final List<CycleStatistics> statistics = new ArrayList<>();
        long nextNodeId = 1;
        long nextLinkId = 1;

        State copy() {
            State copy = new State();
            nodes.forEach((id, n) -> copy.nodes.put(id, new NodeRecord(n)));
            links.forEach((id, l) -> copy.links.put(id, new LinkRecord(l)));
            copy.statistics.addAll(statistics);
            copy.nextNodeId = nextNodeId;
            copy.nextLinkId = nextLinkId;
            return copy;
        }
    }

    private static final class Session implements RepositorySession
    {
        private static final Comparator<NodeRecord> MOST_RECENT_FIRST = Comparator
                .comparing(NodeRecord::getLastSeen, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(NodeRecord::getId, Comparator.reverseOrder());

        private final State state;

        Session(State state) {
            this.state = state;
        }

        @Override
        public List<NodeRecord> findNodes(String macAddress, String name, NodeStatus status) {
            List<NodeRecord> found = new ArrayList<>();
            for (NodeRecord node : state.nodes.values()) {
                if ((macAddress == null || macAddress.equals(node.getWlanMacAddress()))
                        && (name == null || name.equals(node.getName()))
                        && (status == null || status == node.getStatus())) {
                    found.add(node);
                }
            }
            return found;
        }

        @Override
        public Optional<NodeRecord> findActiveNodeByIp(String ipAddress) {
            return state.nodes.values().stream()
                    .filter(n -> n.getStatus() == NodeStatus.ACTIVE && ipAddress.equals(n.getWlanIp()))
                    .min(MOST_RECENT_FIRST);
        }

        @Override
        public NodeRecord saveNode(NodeRecord node) {
            if (node.getId() == null) {
                node.setId(state.nextNodeId++);
            }
            state.nodes.put(node.getId(), node);
            return node;
        }

        @Override
        public Optional<LinkRecord> findLink(long sourceId, long destinationId) {
            return state.links.values().stream()
                    .filter(l -> l.getSourceId() == sourceId && l.getDestinationId() == destinationId)
                    .findFirst();
        }

        @Override
        public LinkRecord saveLink(LinkRecord link) {
            if (!state.nodes.containsKey(link.getSourceId()) || !state.nodes.containsKey(link.getDestinationId())) {
                throw new RepositoryException("Link references unknown node: " + link);
            }
            if (link.getId() == null) {
                link.setId(state.nextLinkId++);
            }
            state.links.put(link.getId(), link);
            return link;
        }

        @Override
        public int updateLinkStatus(LinkStatus from, LinkStatus to, Instant seenBefore) {
            int count = 0;
            for (LinkRecord link : state.links.values()) {
                if (link.getStatus() == from && isBefore(link.getLastSeen(), seenBefore)) {
                    link.setStatus(to);
                    count++;
                }
            }
            return count;
        }

        @Override
        public int updateNodeStatus(NodeStatus from, NodeStatus to, Instant seenBefore) {
            int count = 0;
            for (NodeRecord node : state.nodes.values()) {
                if (node.getStatus() == from && isBefore(node.getLastSeen(), seenBefore)) {
                    node.setStatus(to);
                    count++;
                }
            }
            return count;
        }

        @Override
        public void appendStatistics(CycleStatistics statistics) {
            state.statistics.add(Objects.requireNonNull(statistics, "statistics"));
        }

        private static boolean isBefore(Instant lastSeen, Instant cutoff) {
            return cutoff == null || (lastSeen != null && lastSeen.isBefore(cutoff));
        }
    }
}
