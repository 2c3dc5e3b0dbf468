package com.questrail.meshinfo.poller;

/**
 * Resolves a display name for a node address that could not be polled.
 *
 * <p>Implementations MUST be total: return an empty string instead of
 * throwing when no name is known.</p>
 */
@FunctionalInterface
public interface NameResolver
{
    String lookup(String address);
}
