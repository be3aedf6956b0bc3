package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.RadiologyStudyEntity;

public interface RadiologyStudyRepository extends MirroredEntityRepository<RadiologyStudyEntity> {
}
