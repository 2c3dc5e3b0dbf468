package com.questrail.meshinfo.persistence;

import com.questrail.meshinfo.poller.sysinfo.LinkType;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored state of one directed link, keyed by its two node ids.
 */
public final class LinkRecord
{
    private Long id;
    private final long sourceId;
    private final long destinationId;
    private LinkType type = LinkType.UNKNOWN;
    private String interfaceName;
    private Double signal;
    private Double noise;
    private Double quality;
    private Double neighborQuality;
    private Double txRate;
    private Double rxRate;
    private Double olsrCost;
    private Double distance;
    private Double bearing;
    private LinkStatus status = LinkStatus.CURRENT;
    private Instant lastSeen;

    public LinkRecord(long sourceId, long destinationId) {
        this.sourceId = sourceId;
        this.destinationId = destinationId;
    }

    public LinkRecord(LinkRecord other) {
        this(other.sourceId, other.destinationId);
        this.id = other.id;
        this.type = other.type;
        this.interfaceName = other.interfaceName;
        this.signal = other.signal;
        this.noise = other.noise;
        this.quality = other.quality;
        this.neighborQuality = other.neighborQuality;
        this.txRate = other.txRate;
        this.rxRate = other.rxRate;
        this.olsrCost = other.olsrCost;
        this.distance = other.distance;
        this.bearing = other.bearing;
        this.status = other.status;
        this.lastSeen = other.lastSeen;
    }

    public Long getId() { return id; }
    void setId(Long id) { this.id = id; }

    public long getSourceId() { return sourceId; }
    public long getDestinationId() { return destinationId; }

    public LinkType getType() { return type; }
    public void setType(LinkType type) { this.type = Objects.requireNonNull(type); }

    public String getInterfaceName() { return interfaceName; }
    public void setInterfaceName(String interfaceName) { this.interfaceName = interfaceName; }

    public Double getSignal() { return signal; }
    public void setSignal(Double signal) { this.signal = signal; }

    public Double getNoise() { return noise; }
    public void setNoise(Double noise) { this.noise = noise; }

    public Double getQuality() { return quality; }
    public void setQuality(Double quality) { this.quality = quality; }

    public Double getNeighborQuality() { return neighborQuality; }
    public void setNeighborQuality(Double neighborQuality) { this.neighborQuality = neighborQuality; }

    public Double getTxRate() { return txRate; }
    public void setTxRate(Double txRate) { this.txRate = txRate; }

    public Double getRxRate() { return rxRate; }
    public void setRxRate(Double rxRate) { this.rxRate = rxRate; }

    public Double getOlsrCost() { return olsrCost; }
    public void setOlsrCost(Double olsrCost) { this.olsrCost = olsrCost; }

    public Double getDistance() { return distance; }
    public void setDistance(Double distance) { this.distance = distance; }

    public Double getBearing() { return bearing; }
    public void setBearing(Double bearing) { this.bearing = bearing; }

    public LinkStatus getStatus() { return status; }
    public void setStatus(LinkStatus status) { this.status = Objects.requireNonNull(status); }

    public Instant getLastSeen() { return lastSeen; }
    public void setLastSeen(Instant lastSeen) { this.lastSeen = lastSeen; }

    @Override
    public String toString() {
        return "Link(" + sourceId + " -> " + destinationId + ", " + status + ")";
    }
}
