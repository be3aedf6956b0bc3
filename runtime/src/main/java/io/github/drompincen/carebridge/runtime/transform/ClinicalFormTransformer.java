package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.ClinicalFormEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ClinicalFormTransformer extends AbstractDocumentTransformer {

    @Override
    public DocumentType type() {
        return DocumentType.CLINICAL_FORM;
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String sessionCouchId = doc.text("sessionId", "session_id", "sessionCouchId");
        String patientCpt = doc.text("patientId", "patientCpt", "patient_cpt");
        String schemaId = doc.textOr("unknown", "schemaId", "schema_id");
        String schemaVersion = doc.text("schemaVersion", "schema_version");
        String currentStateId = doc.text("currentStateId", "current_state_id");
        String status = doc.textOr("draft", "status");
        String answers = doc.json("answers");
        String calculated = doc.json("calculated");
        String auditLog = doc.json("auditLog", "audit_log");
        Instant createdAt = doc.instant("createdAt", "created_at");
        Instant completedAt = doc.instant("completedAt", "completed_at");

        return new MirroredDocument<>(type(), header, ClinicalFormEntity.class, (form, inserted) -> {
            form.setFormUuid(change.id());
            form.setSessionCouchId(sessionCouchId);
            form.setPatientCpt(patientCpt);
            form.setSchemaId(schemaId);
            form.setSchemaVersion(schemaVersion);
            form.setCurrentStateId(currentStateId);
            form.setStatus(status);
            form.setSyncStatus("synced");
            form.setAnswers(answers != null ? answers : "{}");
            form.setCalculated(calculated);
            form.setAuditLog(auditLog);
            form.setFormCreatedAt(createdAt);
            form.setFormUpdatedAt(header.businessTime());
            form.setCompletedAt(completedAt);
        });
    }
}
