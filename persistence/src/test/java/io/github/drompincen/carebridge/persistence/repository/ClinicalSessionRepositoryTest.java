package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.AbstractJpaIntegrationTest;
import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.PatientEntity;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClinicalSessionRepositoryTest extends AbstractJpaIntegrationTest {

    @Autowired
    private ClinicalSessionRepository sessionRepository;

    @Autowired
    private PatientRepository patientRepository;

    @Test
    void findByCouchIdAndDefaults() {
        sessionRepository.save(createSession("session:s1", "CPT1", WorkflowState.NEW, "red"));
        flushAndClear();

        ClinicalSessionEntity loaded = sessionRepository.findByCouchId("session:s1").orElseThrow();
        assertThat(loaded.getStage()).isEqualTo("registration");
        assertThat(loaded.getStatus()).isEqualTo("open");
        assertThat(loaded.getCreatedAt()).isNotNull();
        assertThat(sessionRepository.existsByCouchId("session:s1")).isTrue();
        assertThat(sessionRepository.existsByCouchId("session:missing")).isFalse();
    }

    @Test
    void findForUpdateByCouchId() {
        sessionRepository.save(createSession("session:s1", "CPT1", WorkflowState.TRIAGED, "yellow"));
        flushAndClear();

        assertThat(sessionRepository.findForUpdateByCouchId("session:s1"))
                .get()
                .extracting(ClinicalSessionEntity::getWorkflowState)
                .isEqualTo(WorkflowState.TRIAGED);
        assertThat(sessionRepository.findForUpdateByCouchId("session:none")).isEmpty();
    }

    @Test
    void groupedCountsIgnoreTombstones() {
        sessionRepository.save(createSession("session:s1", "CPT1", WorkflowState.NEW, "red"));
        sessionRepository.save(createSession("session:s2", "CPT1", WorkflowState.NEW, "green"));
        ClinicalSessionEntity deleted = createSession("session:s3", "CPT1", WorkflowState.CLOSED, "red");
        deleted.markDeleted();
        sessionRepository.save(deleted);
        flushAndClear();

        assertThat(toMap(sessionRepository.countByWorkflowState()))
                .containsEntry("NEW", 2L)
                .doesNotContainKey("CLOSED");
        assertThat(toMap(sessionRepository.countByTriagePriority()))
                .containsEntry("red", 1L)
                .containsEntry("green", 1L);
    }

    @Test
    void countWithoutPatient() {
        PatientEntity patient = new PatientEntity();
        patient.setCouchId("patient:CPT1");
        patient.setCpt("CPT1");
        patientRepository.save(patient);
        sessionRepository.save(createSession("session:s1", "CPT1", WorkflowState.NEW, "red"));
        sessionRepository.save(createSession("session:s2", "ORPHAN", WorkflowState.NEW, "red"));
        flushAndClear();

        assertThat(sessionRepository.countWithoutPatient()).isEqualTo(1);
    }

    @Test
    void couchIdIsUnique() {
        sessionRepository.saveAndFlush(createSession("session:s1", "CPT1", WorkflowState.NEW, "red"));
        ClinicalSessionEntity duplicate = createSession("session:s1", "CPT1", WorkflowState.NEW, "red");
        duplicate.setSessionUuid("other-uuid");

        assertThatThrownBy(() -> sessionRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private static Map<String, Long> toMap(List<Object[]> rows) {
        Map<String, Long> result = new HashMap<>();
        for (Object[] row : rows) {
            result.put(String.valueOf(row[0]), (Long) row[1]);
        }
        return result;
    }

    static ClinicalSessionEntity createSession(String couchId, String cpt, WorkflowState state, String triage) {
        ClinicalSessionEntity entity = new ClinicalSessionEntity();
        entity.setCouchId(couchId);
        entity.setSessionUuid(couchId.substring(couchId.indexOf(':') + 1));
        entity.setPatientCpt(cpt);
        entity.setWorkflowState(state);
        entity.setTriagePriority(triage);
        entity.setCouchUpdatedAt(Instant.parse("2024-03-01T10:00:00Z"));
        entity.setSyncedAt(Instant.now());
        entity.setRawDocument("{}");
        return entity;
    }
}
