package com.questrail.meshinfo.persistence;

import com.questrail.meshinfo.poller.sysinfo.SystemInfo;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Stored state of one mesh node.
 *
 * <p>Mutable; a record obtained from a {@link RepositorySession} is only
 * persisted once passed back to {@link RepositorySession#saveNode}.</p>
 */
public final class NodeRecord
{
    private Long id;
    private String name;
    private String wlanIp;
    private String wlanMacAddress;
    private String description;
    private String model;
    private String boardId;
    private String firmwareVersion;
    private String firmwareManufacturer;
    private String apiVersion;
    private Double latitude;
    private Double longitude;
    private String gridSquare;
    private String upTime;
    private List<Double> loadAverages = List.of();
    private String ssid;
    private String channel;
    private String channelBandwidth;
    private String band;
    private String services;
    private boolean tunnelInstalled;
    private int activeTunnelCount;
    private int linkCount;
    private String systemInfo;
    private NodeStatus status = NodeStatus.ACTIVE;
    private Instant lastSeen;

    public NodeRecord() {
    }

    public NodeRecord(NodeRecord other) {
        this.id = other.id;
        this.name = other.name;
        this.wlanIp = other.wlanIp;
        this.wlanMacAddress = other.wlanMacAddress;
        this.description = other.description;
        this.model = other.model;
        this.boardId = other.boardId;
        this.firmwareVersion = other.firmwareVersion;
        this.firmwareManufacturer = other.firmwareManufacturer;
        this.apiVersion = other.apiVersion;
        this.latitude = other.latitude;
        this.longitude = other.longitude;
        this.gridSquare = other.gridSquare;
        this.upTime = other.upTime;
        this.loadAverages = other.loadAverages;
        this.ssid = other.ssid;
        this.channel = other.channel;
        this.channelBandwidth = other.channelBandwidth;
        this.band = other.band;
        this.services = other.services;
        this.tunnelInstalled = other.tunnelInstalled;
        this.activeTunnelCount = other.activeTunnelCount;
        this.linkCount = other.linkCount;
        this.systemInfo = other.systemInfo;
        this.status = other.status;
        this.lastSeen = other.lastSeen;
    }

    /**
     * Overwrite every descriptive field from a fresh snapshot. Status and
     * last-seen time are left to the caller.
     */
    public void overwriteFrom(SystemInfo info) {
        this.name = info.nodeName();
        this.wlanIp = info.wlanIpAddress();
        this.wlanMacAddress = info.wlanMacAddress();
        this.description = info.description();
        this.model = info.model();
        this.boardId = info.boardId();
        this.firmwareVersion = info.firmwareVersion();
        this.firmwareManufacturer = info.firmwareManufacturer();
        this.apiVersion = info.apiVersion().toString();
        this.latitude = info.latitude();
        this.longitude = info.longitude();
        this.gridSquare = info.gridSquare();
        this.upTime = info.upTime();
        this.loadAverages = info.loadAverages();
        this.ssid = info.radio().ssid();
        this.channel = info.radio().channel();
        this.channelBandwidth = info.radio().channelBandwidth();
        this.band = info.radio().band();
        this.services = info.servicesJson();
        this.tunnelInstalled = info.tunnelInstalled();
        this.activeTunnelCount = info.activeTunnelCount();
        this.linkCount = info.linkCount();
        this.systemInfo = info.sourceJson();
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public Long getId() { return id; }
    void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getWlanIp() { return wlanIp; }
    public void setWlanIp(String wlanIp) { this.wlanIp = wlanIp; }

    public String getWlanMacAddress() { return wlanMacAddress; }
    public void setWlanMacAddress(String wlanMacAddress) { this.wlanMacAddress = wlanMacAddress; }

    public String getDescription() { return description; }
    public String getModel() { return model; }
    public String getBoardId() { return boardId; }
    public String getFirmwareVersion() { return firmwareVersion; }
    public String getFirmwareManufacturer() { return firmwareManufacturer; }
    public String getApiVersion() { return apiVersion; }

    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }

    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }

    public String getGridSquare() { return gridSquare; }
    public String getUpTime() { return upTime; }
    public List<Double> getLoadAverages() { return loadAverages; }
    public String getSsid() { return ssid; }
    public String getChannel() { return channel; }
    public String getChannelBandwidth() { return channelBandwidth; }
    public String getBand() { return band; }
    public String getServices() { return services; }
    public boolean isTunnelInstalled() { return tunnelInstalled; }
    public int getActiveTunnelCount() { return activeTunnelCount; }
    public int getLinkCount() { return linkCount; }
    public String getSystemInfo() { return systemInfo; }

    public NodeStatus getStatus() { return status; }
    public void setStatus(NodeStatus status) { this.status = Objects.requireNonNull(status); }

    public Instant getLastSeen() { return lastSeen; }
    public void setLastSeen(Instant lastSeen) { this.lastSeen = lastSeen; }

    @Override
    public String toString() {
        return "Node(id=" + id + ", " + name + " (" + wlanIp + "), " + status + ")";
    }
}
