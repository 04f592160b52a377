package com.gatediscovery.engine.repository;

import com.gatediscovery.engine.entity.CategoryBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CategoryBindingRepository extends JpaRepository<CategoryBinding, Long> {

    List<CategoryBinding> findBySessionId(Long sessionId);

    List<CategoryBinding> findByGateId(Long gateId);

    List<CategoryBinding> findBySessionIdAndCategory(Long sessionId, String category);

    Optional<CategoryBinding> findByGateIdAndCategory(Long gateId, String category);

    long countByGateId(Long gateId);
}
