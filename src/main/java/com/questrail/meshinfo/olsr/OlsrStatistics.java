package com.questrail.meshinfo.olsr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic counters for one OLSR stream session.
 */
public record OlsrStatistics(
        int linesProcessed,
        int nodesReturned,
        int duplicateNodes,
        int linksReturned,
        int duplicateLinks,
        int invalidLinks
) {
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("lines processed", linesProcessed);
        map.put("nodes returned", nodesReturned);
        map.put("duplicate node", duplicateNodes);
        map.put("links returned", linksReturned);
        map.put("duplicate link", duplicateLinks);
        map.put("invalid link", invalidLinks);
        return map;
    }
}
