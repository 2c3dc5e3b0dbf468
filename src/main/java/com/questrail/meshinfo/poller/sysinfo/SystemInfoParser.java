package com.questrail.meshinfo.poller.sysinfo;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SystemInfoParser
 * =============================================================================
 * Decodes the JSON status document of a node into {@link SystemInfo}.
 *
 * <p>Decoding happens in two steps so callers can tell a body that is not
 * JSON at all ({@link #readTree(String)}) from a JSON document that does not
 * describe a node ({@link #parse(JsonNode, String)}).</p>
 *
 * <h2>Firmware generations</h2>
 * <ul>
 *   <li>Hardware and firmware details live in {@code node_details} on newer
 *       firmware and at the top level on older firmware.</li>
 *   <li>Radio settings live in {@code meshrf} from API 1.5 on, at the top
 *       level before that.</li>
 *   <li>{@code link_info} (an object keyed by neighbor IP) is only present
 *       on firmware that reports its own links.</li>
 * </ul>
 */
public final class SystemInfoParser
{
    /** Interfaces carrying the mesh address, most specific first. */
    static final List<String> WIRELESS_INTERFACES = List.of("wlan0", "wlan1", "eth1.3975", "eth0.3975");

    private static final String MESH_SUFFIX = ".local.mesh";
    private static final List<String> HOST_PREFIXES = List.of("dtdlink.", "mid1.", "mid2.", "mid3.");

    private final ObjectMapper mapper;

    /**
     * Parser whose mapper rejects anything after the top-level JSON value.
     */
    public SystemInfoParser() {
        this(JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build());
    }

    public SystemInfoParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Parse text as JSON.
     *
     * @throws JsonProcessingException if the text is not a JSON document, or has
     *         content after it
     */
    public JsonNode readTree(String text) throws JsonProcessingException {
        JsonNode tree = mapper.readTree(text);
        if (tree == null || tree.isMissingNode()) {
            throw new JsonParseException((JsonParser) null, "Empty response body");
        }
        return tree;
    }

    /**
     * Interpret a JSON document as a node status.
     *
     * @param json          the document
     * @param polledAddress address the document was fetched from, used when the
     *                      interface list does not identify the mesh interface
     * @throws SystemInfoParseException if required information is missing or malformed
     */
    public SystemInfo parse(JsonNode json, String polledAddress) {
        if (!json.isObject()) {
            throw new SystemInfoParseException("Expected a JSON object but got " + json.getNodeType());
        }

        String nodeName = text(json, "node");
        if (nodeName == null || nodeName.isEmpty()) {
            throw new SystemInfoParseException("Status document has no node name");
        }

        ApiVersion apiVersion = ApiVersion.parse(text(json, "api_version"));
        JsonNode details = json.path("node_details");
        JsonNode sysinfo = json.path("sysinfo");
        JsonNode tunnels = json.path("tunnels");

        String[] wlan = wirelessInterface(json.path("interfaces"), polledAddress);
        List<LinkInfo> links = links(json.path("link_info"), nodeName, wlan[0]);

        return new SystemInfo(
                nodeName,
                wlan[0],
                wlan[1],
                firstText(details, json, "description"),
                firstText(details, json, "model"),
                firstText(details, json, "board_id"),
                firstText(details, json, "firmware_mfg"),
                firstText(details, json, "firmware_version"),
                apiVersion,
                coordinate(json, "lat"),
                coordinate(json, "lon"),
                text(json, "grid_square"),
                text(sysinfo, "uptime"),
                loads(sysinfo.path("loads")),
                radio(json, apiVersion),
                bool(tunnels.path("tunnel_installed")),
                integer(tunnels.path("active_tunnel_count")),
                json.path("services_local").isMissingNode() ? "[]" : json.path("services_local").toString(),
                links,
                links.size(),
                json.toString());
    }

    // -------------------------------------------------------------------------
    // Sections
    // -------------------------------------------------------------------------

    private static String[] wirelessInterface(JsonNode interfaces, String polledAddress) {
        if (interfaces.isArray()) {
            for (String wanted : WIRELESS_INTERFACES) {
                for (JsonNode iface : interfaces) {
                    String ip = text(iface, "ip");
                    if (wanted.equals(text(iface, "name")) && ip != null && !ip.isEmpty()) {
                        return new String[] {ip, normalizeMac(text(iface, "mac"))};
                    }
                }
            }
            for (JsonNode iface : interfaces) {
                if (polledAddress.equals(text(iface, "ip"))) {
                    return new String[] {polledAddress, normalizeMac(text(iface, "mac"))};
                }
            }
        }
        return new String[] {polledAddress, ""};
    }

    private static RadioInfo radio(JsonNode json, ApiVersion apiVersion) {
        JsonNode source = apiVersion.isBefore(1, 5) ? json : json.path("meshrf");
        if (source.isMissingNode() || "off".equals(text(source, "status"))) {
            return RadioInfo.NONE;
        }
        return new RadioInfo(
                text(source, "ssid"),
                text(source, "channel"),
                text(source, "chanbw"),
                band(text(source, "freq")));
    }

    static String band(String frequency) {
        if (frequency == null || frequency.isEmpty()) {
            return null;
        }
        if (frequency.startsWith("0.9")) {
            return "900MHz";
        }
        if (frequency.startsWith("2.")) {
            return "2GHz";
        }
        if (frequency.startsWith("3.")) {
            return "3GHz";
        }
        if (frequency.startsWith("5.")) {
            return "5GHz";
        }
        return "Unknown";
    }

    private static List<LinkInfo> links(JsonNode linkInfo, String source, String sourceIp) {
        List<LinkInfo> links = new ArrayList<>();
        if (!linkInfo.isObject()) {
            return links;
        }
        Iterator<Map.Entry<String, JsonNode>> it = linkInfo.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode link = entry.getValue();
            if (!link.isObject()) {
                throw new SystemInfoParseException("Malformed link_info entry for " + entry.getKey());
            }
            String hostname = text(link, "hostname");
            links.add(new LinkInfo(
                    source,
                    sourceIp,
                    hostname == null ? entry.getKey() : hostToNodeName(hostname),
                    entry.getKey(),
                    LinkType.fromLabel(text(link, "linkType")),
                    Objects.requireNonNullElse(text(link, "olsrInterface"), LinkInfo.UNKNOWN_INTERFACE),
                    number(link, "signal"),
                    number(link, "noise"),
                    number(link, "linkQuality"),
                    number(link, "neighborLinkQuality"),
                    number(link, "tx_rate"),
                    number(link, "rx_rate"),
                    number(link, "linkCost")));
        }
        return links;
    }

    private static List<Double> loads(JsonNode loads) {
        List<Double> values = new ArrayList<>();
        if (loads.isArray()) {
            for (JsonNode load : loads) {
                values.add(load.asDouble());
            }
        }
        return values;
    }

    // -------------------------------------------------------------------------
    // Field helpers
    // -------------------------------------------------------------------------

    static String hostToNodeName(String hostname) {
        String name = hostname;
        for (String prefix : HOST_PREFIXES) {
            if (name.startsWith(prefix)) {
                name = name.substring(prefix.length());
                break;
            }
        }
        if (name.endsWith(MESH_SUFFIX)) {
            name = name.substring(0, name.length() - MESH_SUFFIX.length());
        }
        return name;
    }

    private static String normalizeMac(String mac) {
        return mac == null ? "" : mac.trim().toLowerCase();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw new SystemInfoParseException("Expected a scalar for '" + field + "'");
        }
        return value.asText().trim();
    }

    private static String firstText(JsonNode preferred, JsonNode fallback, String field) {
        String value = text(preferred, field);
        return value != null ? value : text(fallback, field);
    }

    private static Double coordinate(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new SystemInfoParseException("Invalid coordinate '" + field + "': " + value, e);
        }
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = text(node, field);
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean bool(JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.isTextual() && Boolean.parseBoolean(value.asText().trim());
    }

    private static int integer(JsonNode value) {
        if (value.isNumber()) {
            return value.asInt();
        }
        return value.isTextual() ? value.asInt(0) : 0;
    }
}
