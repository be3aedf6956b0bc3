package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.PendingTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PendingTransitionRepository extends JpaRepository<PendingTransitionEntity, Long> {
    List<PendingTransitionEntity> findBySessionCouchIdOrderByIdAsc(String sessionCouchId);
    boolean existsByTransitionUuid(String transitionUuid);
}
