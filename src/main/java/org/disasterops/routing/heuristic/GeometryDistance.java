package org.disasterops.routing.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance between latitude/longitude points.
 */
@UtilityClass
public final class GeometryDistance {
    private static final double EARTH_MEAN_RADIUS_KM = 6_371.0088d;

    /**
     * Haversine distance in kilometres.
     */
    public static double greatCircleDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = Math.max(0.0d, Math.min(1.0d, a));
        return EARTH_MEAN_RADIUS_KM * 2.0d * Math.asin(Math.sqrt(clampedA));
    }

    /**
     * Normalizes delta-longitude into {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }
}
