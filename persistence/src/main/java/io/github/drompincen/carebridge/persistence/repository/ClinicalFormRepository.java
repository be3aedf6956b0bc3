package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.ClinicalFormEntity;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ClinicalFormRepository extends MirroredEntityRepository<ClinicalFormEntity> {
    List<ClinicalFormEntity> findBySessionCouchId(String sessionCouchId);

    @Query("select count(f) from ClinicalFormEntity f where f.sessionCouchId is not null and f.deleted = false "
            + "and not exists (select s.id from ClinicalSessionEntity s where s.couchId = f.sessionCouchId)")
    long countWithoutSession();
}
