package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.AiRequestEntity;

public interface AiRequestRepository extends MirroredEntityRepository<AiRequestEntity> {
}
