package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.PatientEntity;

import java.util.Optional;

public interface PatientRepository extends MirroredEntityRepository<PatientEntity> {
    Optional<PatientEntity> findByCpt(String cpt);
    long countByEncryptedTrue();
}
