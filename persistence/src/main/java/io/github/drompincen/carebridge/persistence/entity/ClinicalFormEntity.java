package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "clinical_forms", indexes = {
        @Index(name = "idx_forms_session", columnList = "session_couch_id"),
        @Index(name = "idx_forms_patient", columnList = "patient_cpt"),
        @Index(name = "idx_forms_schema", columnList = "schema_id")
})
public class ClinicalFormEntity extends MirroredEntity {

    @Column(name = "form_uuid", nullable = false, unique = true, length = 100)
    private String formUuid;

    @Column(name = "session_couch_id")
    private String sessionCouchId;

    @Column(name = "patient_cpt", length = 20)
    private String patientCpt;

    @Column(name = "schema_id", nullable = false, length = 100)
    private String schemaId = "unknown";

    @Column(name = "schema_version", length = 20)
    private String schemaVersion;

    @Column(name = "current_state_id", length = 100)
    private String currentStateId;

    @Column(nullable = false, length = 20)
    private String status = "draft";

    @Column(name = "sync_status", length = 20)
    private String syncStatus = "synced";

    @Lob
    @Column(name = "answers", nullable = false)
    private String answers = "{}";

    @Lob
    @Column(name = "calculated")
    private String calculated;

    @Lob
    @Column(name = "audit_log")
    private String auditLog;

    @Column(name = "form_created_at")
    private Instant formCreatedAt;

    @Column(name = "form_updated_at")
    private Instant formUpdatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public ClinicalFormEntity() {}

    public String getFormUuid() { return formUuid; }
    public void setFormUuid(String formUuid) { this.formUuid = formUuid; }

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public String getPatientCpt() { return patientCpt; }
    public void setPatientCpt(String patientCpt) { this.patientCpt = patientCpt; }

    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }

    public String getSchemaVersion() { return schemaVersion; }
    public void setSchemaVersion(String schemaVersion) { this.schemaVersion = schemaVersion; }

    public String getCurrentStateId() { return currentStateId; }
    public void setCurrentStateId(String currentStateId) { this.currentStateId = currentStateId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getSyncStatus() { return syncStatus; }
    public void setSyncStatus(String syncStatus) { this.syncStatus = syncStatus; }

    public String getAnswers() { return answers; }
    public void setAnswers(String answers) { this.answers = answers; }

    public String getCalculated() { return calculated; }
    public void setCalculated(String calculated) { this.calculated = calculated; }

    public String getAuditLog() { return auditLog; }
    public void setAuditLog(String auditLog) { this.auditLog = auditLog; }

    public Instant getFormCreatedAt() { return formCreatedAt; }
    public void setFormCreatedAt(Instant formCreatedAt) { this.formCreatedAt = formCreatedAt; }

    public Instant getFormUpdatedAt() { return formUpdatedAt; }
    public void setFormUpdatedAt(Instant formUpdatedAt) { this.formUpdatedAt = formUpdatedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
