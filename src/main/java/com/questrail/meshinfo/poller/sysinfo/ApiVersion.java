package com.questrail.meshinfo.poller.sysinfo;

/**
 * Status API version reported by node firmware, compared as (major, minor).
 */
public record ApiVersion(int major, int minor) implements Comparable<ApiVersion> {

    /** Assumed when a node does not report a version. */
    public static final ApiVersion DEFAULT = new ApiVersion(1, 0);

    /**
     * Parse a dotted version string such as {@code 1.9} or {@code 1.10.2}.
     * Components beyond the minor version are ignored.
     *
     * @throws SystemInfoParseException if the string is not a dotted number
     */
    public static ApiVersion parse(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT;
        }
        String[] parts = text.trim().split("\\.");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return new ApiVersion(major, minor);
        } catch (NumberFormatException e) {
            throw new SystemInfoParseException("Invalid API version: " + text, e);
        }
    }

    public boolean isBefore(int major, int minor) {
        return compareTo(new ApiVersion(major, minor)) < 0;
    }

    @Override
    public int compareTo(ApiVersion other) {
        int c = Integer.compare(major, other.major);
        return c != 0 ? c : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
