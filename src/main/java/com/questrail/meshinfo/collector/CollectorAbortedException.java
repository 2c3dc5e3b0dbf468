package com.questrail.meshinfo.collector;

/**
 * The collection loop gave up after repeated failures to connect to the OLSR daemon.
 */
public class CollectorAbortedException extends RuntimeException {

    private final String host;
    private final int port;
    private final int attempts;

    public CollectorAbortedException(String host, int port, int attempts, Throwable cause) {
        super("Failed to connect to OLSR daemon at " + host + ":" + port
                + " after " + attempts + (attempts == 1 ? " attempt" : " attempts"), cause);
        this.host = host;
        this.port = port;
        this.attempts = attempts;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int attempts() {
        return attempts;
    }
}
