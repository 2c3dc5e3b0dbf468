package com.questrail.meshinfo.olsr;

/**
 * Indicates that an established OLSR stream failed before its orderly end.
 *
 * <p>Fatal for the current cycle only.</p>
 */
public final class OlsrStreamException extends RuntimeException
{
    public OlsrStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
