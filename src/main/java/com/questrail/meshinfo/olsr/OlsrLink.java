package com.questrail.meshinfo.olsr;

import java.util.Objects;

/**
 * A directed link as exported by the OLSR daemon, measured only by cost.
 *
 * @param source      IP address of the advertising node
 * @param destination IP address of the neighbor
 * @param cost        link cost; {@value #INFINITE_COST} for an unreachable link
 */
public record OlsrLink(String source, String destination, double cost) {

    /** Label the daemon uses for an unreachable link. */
    public static final String INFINITE_LABEL = "INFINITE";

    /** Finite stand-in for {@link #INFINITE_LABEL} so costs stay totally ordered. */
    public static final double INFINITE_COST = 99.99;

    public OlsrLink {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
    }

    /**
     * Build a link from the raw strings of an export line.
     *
     * @throws NumberFormatException if the label is neither a number nor {@value #INFINITE_LABEL}
     */
    public static OlsrLink fromStrings(String source, String destination, String label) {
        double cost = INFINITE_LABEL.equals(label) ? INFINITE_COST : Double.parseDouble(label);
        return new OlsrLink(source, destination, cost);
    }

    @Override
    public String toString() {
        return source + " -> " + destination + " (" + cost + ")";
    }
}
