package com.questrail.meshinfo.olsr;

/**
 * Indicates that a connection to the OLSR daemon could not be established.
 *
 * <p>Retryable: the service loop decides whether to try again.</p>
 */
public final class OlsrConnectException extends Exception
{
    private final String host;
    private final int port;

    public OlsrConnectException(String host, int port, String message, Throwable cause) {
        super(message + " (" + host + ":" + port + ")", cause);
        this.host = host;
        this.port = port;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }
}
