package com.questrail.meshinfo.poller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * {@link NameResolver} backed by reverse DNS on the mesh.
 *
 * <p>Mesh host names look like {@code N0CALL-HAP.local.mesh}; the suffix is
 * dropped so the result matches the name a node declares about itself.</p>
 */
public final class ReverseDnsNameResolver implements NameResolver
{
    private static final Logger log = LoggerFactory.getLogger(ReverseDnsNameResolver.class);

    static final String MESH_SUFFIX = ".local.mesh";

    @Override
    public String lookup(String address) {
        try {
            String host = InetAddress.getByName(address).getCanonicalHostName();
            if (host == null || host.equals(address)) {
                return "";
            }
            return stripMeshSuffix(host);
        } catch (UnknownHostException | SecurityException e) {
            log.debug("Reverse lookup failed for {}: {}", address, e.toString());
            return "";
        }
    }

    static String stripMeshSuffix(String host) {
        if (host.regionMatches(true, host.length() - MESH_SUFFIX.length(), MESH_SUFFIX, 0, MESH_SUFFIX.length())) {
            return host.substring(0, host.length() - MESH_SUFFIX.length());
        }
        return host;
    }
}
