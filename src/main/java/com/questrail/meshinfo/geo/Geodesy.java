package com.questrail.meshinfo.geo;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Geodesy
 * =============================================================================
 * Great-circle helpers used when a link's endpoints both carry coordinates.
 *
 * <p>Inputs are degrees. Behavior outside valid latitude/longitude ranges is
 * unspecified.</p>
 */
public final class Geodesy
{
    /** Mean Earth radius in kilometers. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private Geodesy() {
    }

    /**
     * Distance between two points in kilometers (haversine), rounded to
     * 3 decimal places.
     */
    public static double distance(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double lonDelta = Math.toRadians(lon2 - lon1);

        double h = hav(phi2 - phi1) + Math.cos(phi1) * Math.cos(phi2) * hav(lonDelta);
        // rounding error can push h a hair above 1 for antipodal points
        double d = 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(Math.min(1.0, h)));
        return round(d, 3);
    }

    /**
     * Initial bearing from the first point toward the second, in degrees
     * within {@code [-180, 180]}, rounded to 1 decimal place.
     */
    public static double bearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double lonDelta = Math.toRadians(lon2 - lon1);

        double b = Math.atan2(
                Math.sin(lonDelta) * Math.cos(phi2),
                Math.cos(phi1) * Math.sin(phi2)
                        - Math.sin(phi1) * Math.cos(phi2) * Math.cos(lonDelta));
        return round(Math.toDegrees(b), 1);
    }

    static double hav(double theta) {
        double s = Math.sin(theta / 2);
        return s * s;
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
