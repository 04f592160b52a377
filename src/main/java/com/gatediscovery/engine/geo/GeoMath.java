package com.gatediscovery.engine.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.Locale;

/**
 * Spherical geometry helpers shared by clustering, orphan assignment, duplicate
 * detection and validation.
 *
 * Distances use the haversine formula on a sphere of radius 6,371 km. For the
 * venue-scale distances involved (tens of meters) the error against the WGS84
 * ellipsoid is well under a meter.
 *
 * JTS points follow the PostGIS convention: x = longitude, y = latitude, SRID 4326.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;
    public static final int WGS84_SRID = 4326;

    /** Both coordinates this close to zero are treated as the null island placeholder. */
    private static final double NULL_ISLAND_EPSILON = 0.0001;

    private static final GeometryFactory GEOMETRY_FACTORY =
        new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoMath() {
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * True for coordinates inside WGS84 ranges that are not the (0, 0) placeholder
     * some scanners report when they have no fix.
     */
    public static boolean isValidCoordinate(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return false;
        }
        if (latitude.isNaN() || longitude.isNaN()) {
            return false;
        }
        if (latitude < -90.0 || latitude > 90.0 || longitude < -180.0 || longitude > 180.0) {
            return false;
        }
        return !(Math.abs(latitude) < NULL_ISLAND_EPSILON && Math.abs(longitude) < NULL_ISLAND_EPSILON);
    }

    /**
     * Rounds to 4 decimal places (about 11 m) and renders "lat,lon". Two clusters
     * whose centroids round to the same key describe the same physical gate.
     */
    public static String centroidKey(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude);
    }

    public static Point toPoint(double latitude, double longitude) {
        return GEOMETRY_FACTORY.createPoint(new Coordinate(longitude, latitude));
    }
}
