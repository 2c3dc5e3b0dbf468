package com.questrail.meshinfo.poller.sysinfo;

/**
 * Mesh radio settings of a node; any field may be {@code null} when the
 * radio is off or the firmware does not report it.
 */
public record RadioInfo(String ssid, String channel, String channelBandwidth, String band) {

    public static final RadioInfo NONE = new RadioInfo(null, null, null, null);
}
