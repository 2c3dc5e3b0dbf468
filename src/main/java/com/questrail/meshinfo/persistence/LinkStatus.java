package com.questrail.meshinfo.persistence;

/**
 * Freshness of a stored link, most recent first.
 *
 * <ul>
 *   <li>{@link #CURRENT}: seen in the latest cycle</li>
 *   <li>{@link #RECENT}: seen before the latest cycle but within the link expiry window</li>
 *   <li>{@link #INACTIVE}: not seen within the expiry window</li>
 * </ul>
 */
public enum LinkStatus {
    CURRENT,
    RECENT,
    INACTIVE
}
