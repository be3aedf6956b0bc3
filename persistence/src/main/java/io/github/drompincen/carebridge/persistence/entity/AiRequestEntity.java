package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Audit row for an AI assistance call made on the device. Only the log is mirrored; the call
 * itself is never replayed here.
 */
@Entity
@Table(name = "ai_requests", indexes = {
        @Index(name = "idx_ai_session", columnList = "session_couch_id"),
        @Index(name = "idx_ai_task", columnList = "task")
})
public class AiRequestEntity extends MirroredEntity {

    @Column(name = "session_couch_id")
    private String sessionCouchId;

    @Column(name = "form_couch_id")
    private String formCouchId;

    @Column(name = "patient_cpt", length = 20)
    private String patientCpt;

    @Column(nullable = false, length = 50)
    private String task;

    @Column(name = "use_case", length = 50)
    private String useCase;

    @Column(name = "prompt_version", length = 20)
    private String promptVersion;

    @Column(name = "input_hash", length = 128)
    private String inputHash;

    @Lob
    @Column(name = "prompt")
    private String prompt;

    @Lob
    @Column(name = "response")
    private String response;

    @Column(length = 100)
    private String model;

    @Column(name = "model_version", length = 50)
    private String modelVersion;

    @Column(name = "latency_ms")
    private Integer latencyMs;

    @Column(name = "was_overridden", nullable = false)
    private boolean wasOverridden;

    @Lob
    @Column(name = "risk_flags")
    private String riskFlags;

    @Column(name = "requested_at")
    private Instant requestedAt;

    public AiRequestEntity() {}

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public String getFormCouchId() { return formCouchId; }
    public void setFormCouchId(String formCouchId) { this.formCouchId = formCouchId; }

    public String getPatientCpt() { return patientCpt; }
    public void setPatientCpt(String patientCpt) { this.patientCpt = patientCpt; }

    public String getTask() { return task; }
    public void setTask(String task) { this.task = task; }

    public String getUseCase() { return useCase; }
    public void setUseCase(String useCase) { this.useCase = useCase; }

    public String getPromptVersion() { return promptVersion; }
    public void setPromptVersion(String promptVersion) { this.promptVersion = promptVersion; }

    public String getInputHash() { return inputHash; }
    public void setInputHash(String inputHash) { this.inputHash = inputHash; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getResponse() { return response; }
    public void setResponse(String response) { this.response = response; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }

    public Integer getLatencyMs() { return latencyMs; }
    public void setLatencyMs(Integer latencyMs) { this.latencyMs = latencyMs; }

    public boolean isWasOverridden() { return wasOverridden; }
    public void setWasOverridden(boolean wasOverridden) { this.wasOverridden = wasOverridden; }

    public String getRiskFlags() { return riskFlags; }
    public void setRiskFlags(String riskFlags) { this.riskFlags = riskFlags; }

    public Instant getRequestedAt() { return requestedAt; }
    public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }
}
