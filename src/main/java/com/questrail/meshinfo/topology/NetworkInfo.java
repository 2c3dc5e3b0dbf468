package com.questrail.meshinfo.topology;

import com.questrail.meshinfo.poller.NodeResult;
import com.questrail.meshinfo.poller.sysinfo.LinkInfo;
import com.questrail.meshinfo.poller.sysinfo.SystemInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Topology of one cycle: the nodes that answered, the merged links, and the
 * failed poll results.
 *
 * @param counters diagnostic counters collected while assembling, in
 *                 insertion order
 */
public record NetworkInfo(
        List<SystemInfo> nodes,
        List<LinkInfo> links,
        List<NodeResult> errors,
        Map<String, Integer> counters
) {
    public NetworkInfo {
        nodes = List.copyOf(nodes);
        links = List.copyOf(links);
        errors = List.copyOf(errors);
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }
}
