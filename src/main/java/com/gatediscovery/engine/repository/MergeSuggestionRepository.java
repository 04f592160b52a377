package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.MergeStatus;
import com.gatediscovery.engine.entity.MergeSuggestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MergeSuggestionRepository extends JpaRepository<MergeSuggestion, Long> {

    List<MergeSuggestion> findBySessionIdOrderByConfidenceDesc(Long sessionId);

    List<MergeSuggestion> findBySessionIdAndStatusOrderByConfidenceDesc(Long sessionId, MergeStatus status);

    /**
     * The suggestion for a gate pair in whichever direction it was recorded.
     */
    @Query("""
        SELECT m FROM MergeSuggestion m
        WHERE m.sessionId = :sessionId
        AND ((m.sourceGateId = :gateA AND m.targetGateId = :gateB)
          OR (m.sourceGateId = :gateB AND m.targetGateId = :gateA))
        ORDER BY m.id ASC
        """)
    List<MergeSuggestion> findForPair(
        @Param("sessionId") Long sessionId,
        @Param("gateA") Long gateA,
        @Param("gateB") Long gateB
    );

    @Query("""
        SELECT m FROM MergeSuggestion m
        WHERE m.sessionId = :sessionId
        AND m.status = com.gatediscovery.engine.entity.MergeStatus.PENDING
        AND (m.sourceGateId = :gateId OR m.targetGateId = :gateId)
        """)
    List<MergeSuggestion> findPendingInvolving(@Param("sessionId") Long sessionId, @Param("gateId") Long gateId);

    default Optional<MergeSuggestion> findFirstForPair(Long sessionId, Long gateA, Long gateB) {
        return findForPair(sessionId, gateA, gateB).stream().findFirst();
    }
}
