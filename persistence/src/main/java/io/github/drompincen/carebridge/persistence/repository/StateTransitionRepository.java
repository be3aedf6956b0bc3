package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.StateTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StateTransitionRepository extends JpaRepository<StateTransitionEntity, Long> {
    List<StateTransitionEntity> findBySessionCouchIdOrderByCreatedAtAscIdAsc(String sessionCouchId);
    boolean existsByTransitionUuid(String transitionUuid);
    long countBySessionCouchId(String sessionCouchId);
}
