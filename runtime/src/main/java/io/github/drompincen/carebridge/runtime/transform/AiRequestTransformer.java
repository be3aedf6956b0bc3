package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.AiRequestEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * AI audit logs are written once on the device, so most carry only a creation time.
 */
@Component
public class AiRequestTransformer extends AbstractDocumentTransformer {

    @Override
    public DocumentType type() {
        return DocumentType.AI_REQUEST;
    }

    @Override
    protected Instant businessTime(DocumentFields fields) {
        Instant updatedAt = super.businessTime(fields);
        return updatedAt != null ? updatedAt : fields.instant("createdAt", "created_at");
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String task = doc.requiredText("task");
        String sessionCouchId = doc.text("sessionId", "session_id");
        String formCouchId = doc.text("formInstanceId", "formId", "form_couch_id");
        String patientCpt = doc.text("patientCpt", "patientId");
        String useCase = doc.text("useCase", "use_case");
        String promptVersion = doc.text("promptVersion", "prompt_version");
        String inputHash = doc.text("promptHash", "inputHash", "input_hash");
        String prompt = doc.text("prompt");
        String response = doc.text("output", "response");
        String model = doc.text("model");
        String modelVersion = doc.text("modelVersion", "model_version");
        Integer latencyMs = doc.integer("latencyMs", "latency_ms");
        boolean wasOverridden = doc.boolOr(false, "wasOverridden", "was_overridden");
        String riskFlags = doc.json("riskFlags", "risk_flags");
        Instant createdAt = doc.instant("createdAt", "created_at");

        return new MirroredDocument<>(type(), header, AiRequestEntity.class, (request, inserted) -> {
            request.setTask(task);
            request.setSessionCouchId(sessionCouchId);
            request.setFormCouchId(formCouchId);
            request.setPatientCpt(patientCpt);
            request.setUseCase(useCase);
            request.setPromptVersion(promptVersion);
            request.setInputHash(inputHash);
            request.setPrompt(prompt);
            request.setResponse(response);
            request.setModel(model);
            request.setModelVersion(modelVersion);
            request.setLatencyMs(latencyMs);
            request.setWasOverridden(wasOverridden);
            request.setRiskFlags(riskFlags);
            request.setRequestedAt(createdAt != null ? createdAt : Instant.now());
        });
    }
}
