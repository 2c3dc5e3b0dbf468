package com.questrail.meshinfo.olsr;

import java.time.Duration;

/**
 * Opens connections to an OLSR daemon.
 *
 * <p>A connector never retries; retry policy belongs to the caller.</p>
 */
@FunctionalInterface
public interface OlsrConnector
{
    /**
     * Connect to the daemon's text export.
     *
     * @param host    host name or address of the daemon
     * @param port    TCP port of the export plugin
     * @param timeout maximum time to establish the connection
     * @return an open line source, owned by the caller
     * @throws OlsrConnectException when the connection times out or fails
     */
    OlsrLineSource connect(String host, int port, Duration timeout) throws OlsrConnectException;
}
