package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.AssignmentMethod;
import com.gatediscovery.engine.entity.CheckinEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Check-in store. Background jobs read it in bounded, id-ordered windows and
 * change rows only through the conditional bulk updates below.
 */
@Repository
public interface CheckinEventRepository extends JpaRepository<CheckinEvent, Long> {

    Optional<CheckinEvent> findBySessionIdAndClientEventId(Long sessionId, String clientEventId);

    /**
     * Scans good enough to take part in clustering. Discovery milestones are
     * counted against this number.
     */
    @Query("""
        SELECT COUNT(c) FROM CheckinEvent c
        WHERE c.sessionId = :sessionId
        AND c.qualityWeight > 0
        AND c.qualityWeight >= :minWeight
        """)
    long countAccepted(@Param("sessionId") Long sessionId, @Param("minWeight") double minWeight);

    /**
     * Newest-first window of clustering input. Callers re-sort by id.
     */
    @Query("""
        SELECT c FROM CheckinEvent c
        WHERE c.sessionId = :sessionId
        AND c.outcome = com.gatediscovery.engine.entity.CheckinOutcome.SUCCESS
        AND c.qualityWeight > 0
        AND c.qualityWeight >= :minWeight
        AND c.latitude IS NOT NULL AND c.longitude IS NOT NULL
        AND c.timestamp >= :since
        ORDER BY c.id DESC
        """)
    List<CheckinEvent> findClusteringWindow(
        @Param("sessionId") Long sessionId,
        @Param("minWeight") double minWeight,
        @Param("since") Instant since,
        Pageable pageable
    );

    /**
     * Keyset page of orphans: no gate yet, but a usable location.
     */
    @Query("""
        SELECT c FROM CheckinEvent c
        WHERE c.sessionId = :sessionId
        AND c.gateId IS NULL
        AND c.qualityWeight > 0
        AND c.latitude IS NOT NULL AND c.longitude IS NOT NULL
        AND c.id > :afterId
        ORDER BY c.id ASC
        """)
    List<CheckinEvent> findOrphanPage(
        @Param("sessionId") Long sessionId,
        @Param("afterId") Long afterId,
        Pageable pageable
    );

    long countBySessionIdAndGateIdIsNull(Long sessionId);

    /**
     * GPS coverage of successful scans. Sums are null when the session has no scans.
     */
    @Query("""
        SELECT COUNT(c) AS total,
            SUM(CASE WHEN c.latitude IS NOT NULL AND c.longitude IS NOT NULL THEN 1 ELSE 0 END) AS withGps,
            SUM(CASE WHEN c.qualityWeight > 0 AND c.qualityWeight >= :minWeight THEN 1 ELSE 0 END) AS goodGps,
            AVG(c.accuracy) AS averageAccuracy
        FROM CheckinEvent c
        WHERE c.sessionId = :sessionId
        AND c.outcome = com.gatediscovery.engine.entity.CheckinOutcome.SUCCESS
        """)
    GpsCoverage summarizeGpsCoverage(@Param("sessionId") Long sessionId, @Param("minWeight") double minWeight);

    /**
     * Sets the gate only if no other writer got there first. Returns 0 when the
     * check-in was already resolved.
     */
    @Modifying
    @Query("""
        UPDATE CheckinEvent c SET c.gateId = :gateId, c.assignmentMethod = :method
        WHERE c.id = :checkinId AND c.gateId IS NULL
        """)
    int assignGateIfOrphan(
        @Param("checkinId") Long checkinId,
        @Param("gateId") Long gateId,
        @Param("method") AssignmentMethod method
    );

    @Query("""
        SELECT c FROM CheckinEvent c
        WHERE c.sessionId = :sessionId
        AND c.learned = false
        AND c.gateId IS NOT NULL
        AND c.outcome = com.gatediscovery.engine.entity.CheckinOutcome.SUCCESS
        ORDER BY c.id ASC
        """)
    List<CheckinEvent> findUnlearned(@Param("sessionId") Long sessionId, Pageable pageable);

    @Modifying
    @Query("UPDATE CheckinEvent c SET c.learned = true WHERE c.id IN :ids AND c.learned = false")
    int markLearned(@Param("ids") Collection<Long> ids);

    @Modifying
    @Query("""
        UPDATE CheckinEvent c SET c.gateId = :targetGateId,
            c.assignmentMethod = com.gatediscovery.engine.entity.AssignmentMethod.MERGE
        WHERE c.gateId = :sourceGateId
        """)
    int repointGate(@Param("sourceGateId") Long sourceGateId, @Param("targetGateId") Long targetGateId);

    long countByGateId(Long gateId);

    long countByGateIdIn(Collection<Long> gateIds);

    /**
     * Rows of [gateId, hourBucket, count].
     */
    @Query("""
        SELECT c.gateId, c.hourBucket, COUNT(c) FROM CheckinEvent c
        WHERE c.sessionId = :sessionId AND c.gateId IN :gateIds
        GROUP BY c.gateId, c.hourBucket
        """)
    List<Object[]> countByGateAndHour(@Param("sessionId") Long sessionId, @Param("gateIds") Collection<Long> gateIds);

    /**
     * Rows of [gateId, category, count].
     */
    @Query("""
        SELECT c.gateId, c.category, COUNT(c) FROM CheckinEvent c
        WHERE c.sessionId = :sessionId AND c.gateId IN :gateIds
        GROUP BY c.gateId, c.category
        """)
    List<Object[]> countByGateAndCategory(@Param("sessionId") Long sessionId, @Param("gateIds") Collection<Long> gateIds);

    interface GpsCoverage {
        Long getTotal();

        Long getWithGps();

        Long getGoodGps();

        Double getAverageAccuracy();
    }
}
