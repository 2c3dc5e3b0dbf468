package com.questrail.meshinfo.poller;

import com.questrail.meshinfo.poller.sysinfo.SystemInfo;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of polling one node: exactly one of {@link #systemInfo()} and
 * {@link #error()} is present.
 */
public final class NodeResult
{
    private final String ipAddress;
    private final String name;
    private final SystemInfo systemInfo;
    private final NodeError error;

    private NodeResult(String ipAddress, String name, SystemInfo systemInfo, NodeError error) {
        this.ipAddress = Objects.requireNonNull(ipAddress, "ipAddress");
        this.name = name == null ? "" : name;
        this.systemInfo = systemInfo;
        this.error = error;
    }

    public static NodeResult success(String ipAddress, SystemInfo systemInfo) {
        Objects.requireNonNull(systemInfo, "systemInfo");
        return new NodeResult(ipAddress, systemInfo.nodeName(), systemInfo, null);
    }

    /**
     * @param name best-effort display name from a reverse lookup; may be empty
     */
    public static NodeResult failure(String ipAddress, String name, NodeError error) {
        Objects.requireNonNull(error, "error");
        return new NodeResult(ipAddress, name, null, error);
    }

    /** The address that was polled. */
    public String ipAddress() {
        return ipAddress;
    }

    /** Declared name on success, resolved display name on failure; never null. */
    public String name() {
        return name;
    }

    public Optional<SystemInfo> systemInfo() {
        return Optional.ofNullable(systemInfo);
    }

    public Optional<NodeError> error() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return systemInfo != null;
    }

    /** {@code name (ip)}, used in log lines. */
    public String label() {
        return (name.isEmpty() ? "name unknown" : name) + " (" + ipAddress + ")";
    }

    @Override
    public String toString() {
        return isSuccess() ? label() : label() + ": " + error;
    }
}
