package com.gatediscovery.engine.entity;

import com.gatediscovery.engine.geo.GeoMath;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.Point;

import java.time.Instant;

/**
 * A physical entry point of a venue session, discovered from scan clusters or
 * entered by an operator.
 *
 * Identity:
 * - The rounded centroid ({@code centroidKey}) is unique per session. This is the
 *   database-level guarantee that two concurrent discovery runs cannot both create
 *   a gate for the same cluster.
 * - Gates are never deleted. A merged gate stays as INACTIVE with
 *   {@code mergedIntoGateId} pointing at the survivor.
 *
 * Geometry:
 * - latitude/longitude are the working values used by the haversine code.
 * - centroid mirrors them as a PostGIS point so candidate gates can be found with
 *   ST_DWithin instead of scanning every gate in Java.
 */
@Entity
@Table(
    name = "gates",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_gate_session_centroid_key", columnNames = {"session_id", "centroid_key"})
    },
    indexes = {
        @Index(name = "idx_gate_session_status", columnList = "session_id, status")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Gate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(nullable = false, length = 200)
    private String name;

    private Double latitude;

    private Double longitude;

    @Column(columnDefinition = "geometry(Point,4326)")
    private Point centroid;

    /**
     * Centroid rounded to 4 decimals, "lat,lon". Manual gates without a location
     * get a "manual:" key instead.
     */
    @Column(name = "centroid_key", nullable = false, length = 64)
    private String centroidKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "derivation_method", nullable = false, length = 20)
    private DerivationMethod derivationMethod;

    @Column(name = "health_score", nullable = false)
    @Builder.Default
    private int healthScore = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private GateStatus status = GateStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 20)
    @Builder.Default
    private ApprovalStatus approvalStatus = ApprovalStatus.PENDING;

    /**
     * Mean squared distance of the member scans to the centroid (m²).
     */
    @Column(name = "spatial_variance", nullable = false)
    @Builder.Default
    private double spatialVariance = 0.0;

    @Column(name = "sample_count", nullable = false)
    @Builder.Default
    private int sampleCount = 0;

    @Column(name = "first_seen_at")
    private Instant firstSeenAt;

    @Column(name = "last_seen_at")
    private Instant lastSeenAt;

    @Column(name = "merged_into_gate_id")
    private Long mergedIntoGateId;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isActive() {
        return status == GateStatus.ACTIVE;
    }

    public boolean hasLocation() {
        return GeoMath.isValidCoordinate(latitude, longitude);
    }

    public void moveCentroid(double newLatitude, double newLongitude) {
        this.latitude = newLatitude;
        this.longitude = newLongitude;
        this.centroid = GeoMath.toPoint(newLatitude, newLongitude);
    }

    public double distanceTo(double otherLatitude, double otherLongitude) {
        return GeoMath.haversineMeters(latitude, longitude, otherLatitude, otherLongitude);
    }

    /**
     * Folds another gate's footprint into this one: sample-weighted centroid and
     * variance, summed samples, widened first/last seen.
     */
    public void absorb(Gate source) {
        if (source.hasLocation() && hasLocation()) {
            double w0 = Math.max(sampleCount, 1);
            double w1 = Math.max(source.getSampleCount(), 1);
            double total = w0 + w1;
            moveCentroid(
                (latitude * w0 + source.getLatitude() * w1) / total,
                (longitude * w0 + source.getLongitude() * w1) / total
            );
            spatialVariance = (spatialVariance * w0 + source.getSpatialVariance() * w1) / total;
        } else if (source.hasLocation()) {
            moveCentroid(source.getLatitude(), source.getLongitude());
            spatialVariance = source.getSpatialVariance();
        }
        sampleCount += source.getSampleCount();
        firstSeenAt = earliest(firstSeenAt, source.getFirstSeenAt());
        lastSeenAt = latest(lastSeenAt, source.getLastSeenAt());
    }

    public void retireInto(Long targetGateId) {
        this.status = GateStatus.INACTIVE;
        this.mergedIntoGateId = targetGateId;
    }

    public static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    public static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    public String toLogString() {
        return String.format("Gate[id=%d, session=%d, name=%s, status=%s, samples=%d, health=%d]",
            id, sessionId, name, status, sampleCount, healthScore);
    }
}
