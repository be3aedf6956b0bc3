package io.github.drompincen.carebridge.persistence.entity;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "clinical_sessions", indexes = {
        @Index(name = "idx_sessions_status_triage", columnList = "status, triage_priority"),
        @Index(name = "idx_sessions_patient_status", columnList = "patient_cpt, status"),
        @Index(name = "idx_sessions_workflow_state", columnList = "workflow_state"),
        @Index(name = "idx_sessions_created", columnList = "session_created_at")
})
public class ClinicalSessionEntity extends MirroredEntity {

    @Column(name = "session_uuid", nullable = false, unique = true, length = 100)
    private String sessionUuid;

    @Column(name = "patient_cpt", length = 20)
    private String patientCpt;

    @Column(nullable = false, length = 20)
    private String stage = "registration";

    @Column(nullable = false, length = 20)
    private String status = "open";

    @Enumerated(EnumType.STRING)
    @Column(name = "workflow_state", nullable = false, length = 20)
    private WorkflowState workflowState = WorkflowState.NEW;

    @Column(name = "workflow_state_updated_at")
    private Instant workflowStateUpdatedAt;

    @Column(name = "triage_priority", nullable = false, length = 10)
    private String triagePriority = "unknown";

    @Column(name = "chief_complaint")
    private String chiefComplaint;

    @Lob
    @Column(name = "notes")
    private String notes;

    @Lob
    @Column(name = "treatment_plan")
    private String treatmentPlan;

    @Lob
    @Column(name = "form_instance_ids")
    private String formInstanceIds;

    @Column(name = "session_created_at")
    private Instant sessionCreatedAt;

    @Column(name = "session_updated_at")
    private Instant sessionUpdatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public ClinicalSessionEntity() {}

    public String getSessionUuid() { return sessionUuid; }
    public void setSessionUuid(String sessionUuid) { this.sessionUuid = sessionUuid; }

    public String getPatientCpt() { return patientCpt; }
    public void setPatientCpt(String patientCpt) { this.patientCpt = patientCpt; }

    public String getStage() { return stage; }
    public void setStage(String stage) { this.stage = stage; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public WorkflowState getWorkflowState() { return workflowState; }
    public void setWorkflowState(WorkflowState workflowState) { this.workflowState = workflowState; }

    public Instant getWorkflowStateUpdatedAt() { return workflowStateUpdatedAt; }
    public void setWorkflowStateUpdatedAt(Instant workflowStateUpdatedAt) { this.workflowStateUpdatedAt = workflowStateUpdatedAt; }

    public String getTriagePriority() { return triagePriority; }
    public void setTriagePriority(String triagePriority) { this.triagePriority = triagePriority; }

    public String getChiefComplaint() { return chiefComplaint; }
    public void setChiefComplaint(String chiefComplaint) { this.chiefComplaint = chiefComplaint; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public String getTreatmentPlan() { return treatmentPlan; }
    public void setTreatmentPlan(String treatmentPlan) { this.treatmentPlan = treatmentPlan; }

    public String getFormInstanceIds() { return formInstanceIds; }
    public void setFormInstanceIds(String formInstanceIds) { this.formInstanceIds = formInstanceIds; }

    public Instant getSessionCreatedAt() { return sessionCreatedAt; }
    public void setSessionCreatedAt(Instant sessionCreatedAt) { this.sessionCreatedAt = sessionCreatedAt; }

    public Instant getSessionUpdatedAt() { return sessionUpdatedAt; }
    public void setSessionUpdatedAt(Instant sessionUpdatedAt) { this.sessionUpdatedAt = sessionUpdatedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
