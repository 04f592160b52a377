package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.VenueSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VenueSessionRepository extends JpaRepository<VenueSession, Long> {

    @Query("SELECT s.id FROM VenueSession s WHERE s.active = true ORDER BY s.id")
    List<Long> findActiveIds();

    /**
     * Reads only the flag so long-running cycles can poll for cancellation cheaply.
     */
    @Query("SELECT s.active FROM VenueSession s WHERE s.id = :id")
    Optional<Boolean> findActiveFlag(@Param("id") Long id);
}
