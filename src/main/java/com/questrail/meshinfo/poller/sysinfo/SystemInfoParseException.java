package com.questrail.meshinfo.poller.sysinfo;

/**
 * Indicates that a well-formed JSON status document could not be interpreted
 * as node information.
 */
public final class SystemInfoParseException extends RuntimeException
{
    public SystemInfoParseException(String message) {
        super(message);
    }

    public SystemInfoParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
