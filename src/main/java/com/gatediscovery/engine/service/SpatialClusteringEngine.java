package com.gatediscovery.engine.service;

import com.gatediscovery.engine.dto.GateCluster;
import com.gatediscovery.engine.dto.ScanPoint;
import com.gatediscovery.engine.geo.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single-linkage density clustering of scan locations.
 *
 * Two scans belong to the same cluster when a chain of scans, each within
 * epsilon meters (haversine) of the next, connects them. Groups smaller than
 * the minimum sample count are noise; groups whose spatial variance exceeds the
 * limit are too diffuse to be one gate.
 *
 * How it works:
 * 1. Points are sorted by check-in id so the result depends only on the input set
 * 2. Each point is dropped into a grid cell of a local equirectangular projection
 * 3. Only points in the same or adjacent cells are compared; haversine decides
 * 4. A union-find joins every linked pair
 * 5. Components are measured (centroid = mean, variance = mean squared distance)
 *
 * Output order: size descending, then lowest member id.
 *
 * Performance:
 * - Grid lookup keeps comparisons near O(n·k) for k neighbours per cell
 * - Input is capped upstream (discovery window, max clustering points)
 */
@Component
@Slf4j
public class SpatialClusteringEngine {

    private static final double METERS_PER_DEGREE_LAT = 110_574.0;
    private static final double METERS_PER_DEGREE_LON_AT_EQUATOR = 111_320.0;

    /**
     * Projected distance can slightly understate the haversine one, so cells are
     * a little wider than epsilon to keep every linked pair in adjacent cells.
     */
    private static final double CELL_PADDING = 1.5;

    public List<GateCluster> cluster(List<ScanPoint> input, double epsilonMeters, int minSamples,
                                     double maxSpatialVariance) {
        if (input == null || input.isEmpty()) {
            return List.of();
        }
        List<ScanPoint> points = new ArrayList<>(input);
        points.sort(Comparator.comparing(ScanPoint::checkinId));

        int n = points.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }

        double referenceLat = points.get(0).latitude();
        double metersPerDegreeLon = METERS_PER_DEGREE_LON_AT_EQUATOR * Math.cos(Math.toRadians(referenceLat));
        double cellSize = epsilonMeters * CELL_PADDING;

        Map<Long, List<Integer>> grid = new HashMap<>();
        long[][] cells = new long[n][2];
        for (int i = 0; i < n; i++) {
            ScanPoint p = points.get(i);
            long cx = (long) Math.floor(p.longitude() * metersPerDegreeLon / cellSize);
            long cy = (long) Math.floor(p.latitude() * METERS_PER_DEGREE_LAT / cellSize);
            cells[i][0] = cx;
            cells[i][1] = cy;
            grid.computeIfAbsent(cellKey(cx, cy), k -> new ArrayList<>()).add(i);
        }

        for (int i = 0; i < n; i++) {
            ScanPoint p = points.get(i);
            for (long dx = -1; dx <= 1; dx++) {
                for (long dy = -1; dy <= 1; dy++) {
                    List<Integer> neighbours = grid.get(cellKey(cells[i][0] + dx, cells[i][1] + dy));
                    if (neighbours == null) {
                        continue;
                    }
                    for (int j : neighbours) {
                        if (j <= i) {
                            continue;
                        }
                        ScanPoint q = points.get(j);
                        if (GeoMath.haversineMeters(p.latitude(), p.longitude(), q.latitude(), q.longitude())
                            <= epsilonMeters) {
                            union(parent, i, j);
                        }
                    }
                }
            }
        }

        // Members stay in id order because indices are visited in id order
        Map<Integer, List<ScanPoint>> components = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(points.get(i));
        }

        List<GateCluster> clusters = new ArrayList<>();
        int diffuse = 0;
        for (List<ScanPoint> members : components.values()) {
            if (members.size() < minSamples) {
                continue;
            }
            GateCluster cluster = measure(members);
            if (cluster.spatialVariance() > maxSpatialVariance) {
                diffuse++;
                log.debug("Discarding diffuse cluster of {} scans: variance {}m² > {}m²",
                    cluster.size(), String.format("%.1f", cluster.spatialVariance()), maxSpatialVariance);
                continue;
            }
            clusters.add(cluster);
        }

        clusters.sort(Comparator.comparingInt(GateCluster::size).reversed()
            .thenComparing(GateCluster::lowestMemberId));

        log.debug("Clustered {} scans into {} clusters ({} components, {} too diffuse)",
            n, clusters.size(), components.size(), diffuse);
        return clusters;
    }

    private GateCluster measure(List<ScanPoint> members) {
        double sumLat = 0.0;
        double sumLon = 0.0;
        Instant first = null;
        Instant last = null;
        Map<String, Integer> categories = new TreeMap<>();
        List<Long> ids = new ArrayList<>(members.size());

        for (ScanPoint p : members) {
            sumLat += p.latitude();
            sumLon += p.longitude();
            ids.add(p.checkinId());
            categories.merge(p.category(), 1, Integer::sum);
            if (p.timestamp() != null) {
                first = first == null || p.timestamp().isBefore(first) ? p.timestamp() : first;
                last = last == null || p.timestamp().isAfter(last) ? p.timestamp() : last;
            }
        }
        double centroidLat = sumLat / members.size();
        double centroidLon = sumLon / members.size();

        double sumSquared = 0.0;
        for (ScanPoint p : members) {
            double d = GeoMath.haversineMeters(centroidLat, centroidLon, p.latitude(), p.longitude());
            sumSquared += d * d;
        }
        double variance = sumSquared / members.size();

        return new GateCluster(ids, centroidLat, centroidLon, variance, first, last, categories);
    }

    private static long cellKey(long cx, long cy) {
        return (cx << 32) ^ (cy & 0xffffffffL);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        // Lower index wins so roots do not depend on the order pairs are found in
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }
}
