package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Clinical sessions. The workflow state in the document only seeds a new row; afterwards the
 * state machine owns the column and document updates never overwrite it.
 */
@Component
public class ClinicalSessionTransformer extends AbstractDocumentTransformer {

    private static final Logger log = LoggerFactory.getLogger(ClinicalSessionTransformer.class);

    @Override
    public DocumentType type() {
        return DocumentType.CLINICAL_SESSION;
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String sessionUuid = doc.textOr(change.id(), "id");
        String patientCpt = doc.text("patientCpt", "patientId", "patient_cpt");
        String stage = doc.textOr("registration", "stage");
        String status = doc.textOr("open", "status");
        String triage = doc.textOr("unknown", "triage", "triagePriority", "triage_priority");
        String chiefComplaint = doc.text("chiefComplaint", "chief_complaint");
        String notes = doc.text("notes");
        String treatmentPlan = doc.json("treatmentPlan", "treatment_plan");
        String formInstanceIds = doc.json("formInstanceIds", "form_instance_ids");
        Instant createdAt = doc.instant("createdAt", "created_at");
        Instant updatedAt = header.businessTime();
        Instant completedAt = doc.instant("completedAt", "completed_at");
        String declaredState = doc.text("workflowState", "workflow_state");
        Instant declaredStateAt = doc.instant("workflowStateUpdatedAt", "workflow_state_updated_at");

        WorkflowState initialState = WorkflowState.parse(declaredState).orElseGet(() -> {
            if (declaredState != null) {
                log.warn("Session {} declares unknown workflow state {}, starting at NEW", change.id(), declaredState);
            }
            return WorkflowState.NEW;
        });

        return new MirroredDocument<>(type(), header, ClinicalSessionEntity.class, (session, inserted) -> {
            session.setSessionUuid(sessionUuid);
            session.setPatientCpt(patientCpt);
            session.setStage(stage);
            session.setStatus(status);
            session.setTriagePriority(triage);
            session.setChiefComplaint(chiefComplaint);
            session.setNotes(notes);
            session.setTreatmentPlan(treatmentPlan);
            session.setFormInstanceIds(formInstanceIds != null ? formInstanceIds : "[]");
            session.setSessionCreatedAt(createdAt);
            session.setSessionUpdatedAt(updatedAt);
            session.setCompletedAt(completedAt);
            if (inserted) {
                session.setWorkflowState(initialState);
                session.setWorkflowStateUpdatedAt(declaredStateAt != null ? declaredStateAt : Instant.now());
            }
        });
    }
}
