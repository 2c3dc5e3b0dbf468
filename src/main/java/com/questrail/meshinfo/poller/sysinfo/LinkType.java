package com.questrail.meshinfo.poller.sysinfo;

/**
 * Physical kind of a link between two nodes.
 */
public enum LinkType {
    /** Radio link. */
    RF,
    /** Device-to-device cable. */
    DTD,
    /** Internet tunnel. */
    TUN,
    UNKNOWN;

    public static LinkType fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (LinkType type : values()) {
            if (type.name().equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
