package com.questrail.meshinfo.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operations available inside one unit of work of a {@link MeshRepository}.
 *
 * <p>Changes become visible to other units of work only when the enclosing
 * unit of work completes normally.</p>
 */
public interface RepositorySession
{
    /**
     * Nodes matching every non-null criterion.
     *
     * @param macAddress hardware address, or {@code null} for any
     * @param name       declared node name, or {@code null} for any
     * @param status     lifecycle status, or {@code null} for any
     */
    List<NodeRecord> findNodes(String macAddress, String name, NodeStatus status);

    /** The {@link NodeStatus#ACTIVE} node with this mesh address, most recently seen first. */
    Optional<NodeRecord> findActiveNodeByIp(String ipAddress);

    /** Insert or update; assigns an id to a new record. */
    NodeRecord saveNode(NodeRecord node);

    Optional<LinkRecord> findLink(long sourceId, long destinationId);

    /** Insert or update; assigns an id to a new record. */
    LinkRecord saveLink(LinkRecord link);

    /**
     * Move links from one status to another.
     *
     * @param seenBefore only links last seen strictly before this instant, or
     *                   {@code null} for all links in {@code from}
     * @return the number of links changed
     */
    int updateLinkStatus(LinkStatus from, LinkStatus to, Instant seenBefore);

    /**
     * Move nodes from one status to another.
     *
     * @param seenBefore only nodes last seen strictly before this instant, or
     *                   {@code null} for all nodes in {@code from}
     * @return the number of nodes changed
     */
    int updateNodeStatus(NodeStatus from, NodeStatus to, Instant seenBefore);

    void appendStatistics(CycleStatistics statistics);
}
