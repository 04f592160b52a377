package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.ApprovalStatus;
import com.gatediscovery.engine.entity.Gate;
import com.gatediscovery.engine.entity.GateStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Gate repository with PostGIS proximity lookup.
 *
 * PostGIS Functions Used:
 * - ST_DWithin(geography, geography, meters): distance filter in meters, index assisted
 * - ST_Distance(geography, geography): ordering by true distance
 * - ST_MakePoint(lon, lat): PostGIS takes (X, Y) = (longitude, latitude)
 */
@Repository
public interface GateRepository extends JpaRepository<Gate, Long> {

    List<Gate> findBySessionIdOrderByIdAsc(Long sessionId);

    List<Gate> findBySessionIdAndStatusOrderByIdAsc(Long sessionId, GateStatus status);

    Optional<Gate> findByIdAndSessionId(Long id, Long sessionId);

    Optional<Gate> findBySessionIdAndCentroidKey(Long sessionId, String centroidKey);

    long countBySessionId(Long sessionId);

    long countBySessionIdAndStatus(Long sessionId, GateStatus status);

    long countBySessionIdAndStatusAndApprovalStatus(Long sessionId, GateStatus status, ApprovalStatus approvalStatus);

    List<Gate> findBySessionIdAndMergedIntoGateIdIsNotNull(Long sessionId);

    /**
     * Row lock held by a merge for its whole transaction (SELECT ... FOR UPDATE).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Gate g WHERE g.id = :id AND g.sessionId = :sessionId")
    Optional<Gate> findByIdAndSessionIdForUpdate(@Param("id") Long id, @Param("sessionId") Long sessionId);

    /**
     * Shared row lock taken by ingestion on the gate it stores a check-in against.
     * Waits for a merge holding the row, then reads the committed merge pointer
     * straight from the table: 0 when the gate was never merged, empty when there
     * is no such gate.
     */
    @Query(value = """
        SELECT COALESCE(merged_into_gate_id, 0) FROM gates
        WHERE id = :id
        FOR SHARE
        """, nativeQuery = true)
    Optional<Long> lockMergedIntoForShare(@Param("id") Long id);

    /**
     * Active gates of a session whose centroid lies within {@code meters} of the point,
     * nearest first. Callers re-check the distance with haversine before using a result.
     */
    @Query(value = """
        SELECT * FROM gates
        WHERE session_id = :sessionId
        AND status = 'ACTIVE'
        AND centroid IS NOT NULL
        AND ST_DWithin(
            centroid::geography,
            ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)::geography,
            :meters
        )
        ORDER BY ST_Distance(
            centroid::geography,
            ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)::geography
        ), id
        """, nativeQuery = true)
    List<Gate> findActiveWithinDistance(
        @Param("sessionId") Long sessionId,
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("meters") double meters
    );
}
