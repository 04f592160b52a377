package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.AdaptiveThresholdConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AdaptiveThresholdConfigRepository extends JpaRepository<AdaptiveThresholdConfig, Long> {

    Optional<AdaptiveThresholdConfig> findBySessionId(Long sessionId);
}
