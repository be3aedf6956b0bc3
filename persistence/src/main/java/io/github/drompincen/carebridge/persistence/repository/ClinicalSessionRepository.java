package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ClinicalSessionRepository extends MirroredEntityRepository<ClinicalSessionEntity> {

    /**
     * Re-reads the session holding a row lock until the surrounding transaction ends.
     * Workflow transitions on one session are serialized through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ClinicalSessionEntity s where s.couchId = :couchId")
    Optional<ClinicalSessionEntity> findForUpdateByCouchId(@Param("couchId") String couchId);

    List<ClinicalSessionEntity> findByWorkflowState(WorkflowState workflowState);
    List<ClinicalSessionEntity> findByPatientCpt(String patientCpt);

    @Query("select s.workflowState, count(s) from ClinicalSessionEntity s where s.deleted = false group by s.workflowState")
    List<Object[]> countByWorkflowState();

    @Query("select s.triagePriority, count(s) from ClinicalSessionEntity s where s.deleted = false group by s.triagePriority")
    List<Object[]> countByTriagePriority();

    @Query("select count(s) from ClinicalSessionEntity s where s.patientCpt is not null and s.deleted = false "
            + "and not exists (select p.id from PatientEntity p where p.cpt = s.patientCpt)")
    long countWithoutPatient();
}
