package com.questrail.meshinfo.poller.sysinfo;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one node as reported by its status endpoint.
 *
 * <p>Immutable. {@code linkCount} starts as the number of self-reported
 * links and is set by topology assembly once the links to keep for the node
 * are known.</p>
 *
 * @param nodeName             declared node name
 * @param wlanIpAddress        address of the mesh interface
 * @param wlanMacAddress       hardware address of the mesh interface; may be empty
 * @param apiVersion           status API version, decides which fields the firmware fills in
 * @param latitude             decimal degrees, {@code null} when not configured
 * @param longitude            decimal degrees, {@code null} when not configured
 * @param servicesJson         advertised local services as raw JSON
 * @param links                self-reported links, empty on older firmware
 * @param sourceJson           the status document as received
 */
public record SystemInfo(
        String nodeName,
        String wlanIpAddress,
        String wlanMacAddress,
        String description,
        String model,
        String boardId,
        String firmwareManufacturer,
        String firmwareVersion,
        ApiVersion apiVersion,
        Double latitude,
        Double longitude,
        String gridSquare,
        String upTime,
        List<Double> loadAverages,
        RadioInfo radio,
        boolean tunnelInstalled,
        int activeTunnelCount,
        String servicesJson,
        List<LinkInfo> links,
        int linkCount,
        String sourceJson
) {
    public SystemInfo {
        Objects.requireNonNull(nodeName, "nodeName");
        Objects.requireNonNull(wlanIpAddress, "wlanIpAddress");
        Objects.requireNonNull(apiVersion, "apiVersion");
        Objects.requireNonNull(radio, "radio");
        wlanMacAddress = wlanMacAddress == null ? "" : wlanMacAddress;
        loadAverages = List.copyOf(loadAverages);
        links = List.copyOf(links);
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public SystemInfo withLinkCount(int count) {
        return new SystemInfo(nodeName, wlanIpAddress, wlanMacAddress, description, model, boardId,
                firmwareManufacturer, firmwareVersion, apiVersion, latitude, longitude, gridSquare,
                upTime, loadAverages, radio, tunnelInstalled, activeTunnelCount, servicesJson,
                links, count, sourceJson);
    }

    @Override
    public String toString() {
        return nodeName + " (" + wlanIpAddress + ")";
    }
}
