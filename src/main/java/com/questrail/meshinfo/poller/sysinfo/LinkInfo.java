package com.questrail.meshinfo.poller.sysinfo;

import java.util.Objects;

/**
 * One link of the merged topology, either self-reported by a node or built
 * from OLSR data.
 *
 * <p>Radio metrics are {@code null} when unknown. {@code olsrCost} is
 * {@code null} when neither the node nor the OLSR daemon supplied a cost.</p>
 */
public record LinkInfo(
        String source,
        String sourceIp,
        String destination,
        String destinationIp,
        LinkType type,
        String interfaceName,
        Double signal,
        Double noise,
        Double quality,
        Double neighborQuality,
        Double txRate,
        Double rxRate,
        Double olsrCost
) {
    /** Interface name used when a link did not come from the node itself. */
    public static final String UNKNOWN_INTERFACE = "unknown";

    public LinkInfo {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceIp, "sourceIp");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(destinationIp, "destinationIp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(interfaceName, "interfaceName");
    }

    /**
     * A link known only from OLSR: no radio metrics, unknown type and interface.
     */
    public static LinkInfo fromOlsr(String source, String sourceIp,
                                    String destination, String destinationIp, double cost) {
        return new LinkInfo(source, sourceIp, destination, destinationIp,
                LinkType.UNKNOWN, UNKNOWN_INTERFACE,
                null, null, null, null, null, null, cost);
    }

    public LinkInfo withOlsrCost(Double cost) {
        return new LinkInfo(source, sourceIp, destination, destinationIp, type, interfaceName,
                signal, noise, quality, neighborQuality, txRate, rxRate, cost);
    }

    @Override
    public String toString() {
        return type + " link " + source + " -> " + destination + " (" + destinationIp + ")";
    }
}
