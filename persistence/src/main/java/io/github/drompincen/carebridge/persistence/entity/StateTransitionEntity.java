package io.github.drompincen.carebridge.persistence.entity;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Append-only audit of accepted workflow transitions. Rows are written once and never updated.
 */
@Entity
@Table(name = "state_transitions", indexes = {
        @Index(name = "idx_transitions_session_created", columnList = "session_couch_id, created_at"),
        @Index(name = "idx_transitions_to_state", columnList = "to_state")
})
public class StateTransitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_uuid", nullable = false, unique = true, updatable = false)
    private String transitionUuid;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private ClinicalSessionEntity session;

    @Column(name = "session_couch_id", nullable = false, updatable = false)
    private String sessionCouchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false, length = 20, updatable = false)
    private WorkflowState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, length = 20, updatable = false)
    private WorkflowState toState;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(length = 500, updatable = false)
    private String reason;

    @Lob
    @Column(name = "metadata", updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public StateTransitionEntity() {}

    public Long getId() { return id; }

    public String getTransitionUuid() { return transitionUuid; }
    public void setTransitionUuid(String transitionUuid) { this.transitionUuid = transitionUuid; }

    public ClinicalSessionEntity getSession() { return session; }
    public void setSession(ClinicalSessionEntity session) { this.session = session; }

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public WorkflowState getFromState() { return fromState; }
    public void setFromState(WorkflowState fromState) { this.fromState = fromState; }

    public WorkflowState getToState() { return toState; }
    public void setToState(WorkflowState toState) { this.toState = toState; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
