package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Optional;

/**
 * Lookups by external document id shared by every mirrored table.
 */
@NoRepositoryBean
public interface MirroredEntityRepository<E extends MirroredEntity> extends JpaRepository<E, Long> {
    Optional<E> findByCouchId(String couchId);
    boolean existsByCouchId(String couchId);
    long countByDeletedFalse();
}
