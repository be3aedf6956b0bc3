package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.ReferralEntity;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ReferralRepository extends MirroredEntityRepository<ReferralEntity> {
    List<ReferralEntity> findBySessionCouchId(String sessionCouchId);
    boolean existsBySessionCouchIdAndPriority(String sessionCouchId, String priority);

    @Query("select count(r) from ReferralEntity r where r.deleted = false "
            + "and not exists (select s.id from ClinicalSessionEntity s where s.couchId = r.sessionCouchId)")
    long countWithoutSession();
}
