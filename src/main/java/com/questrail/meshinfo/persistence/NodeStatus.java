package com.questrail.meshinfo.persistence;

/**
 * Lifecycle of a stored node.
 */
public enum NodeStatus {
    ACTIVE,
    INACTIVE
}
