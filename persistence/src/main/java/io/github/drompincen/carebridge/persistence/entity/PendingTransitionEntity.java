package io.github.drompincen.carebridge.persistence.entity;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * A synced transition whose session has not been mirrored yet. Held until the session arrives,
 * then replayed in arrival order and removed.
 */
@Entity
@Table(name = "pending_transitions", indexes = {
        @Index(name = "idx_pending_transitions_session", columnList = "session_couch_id")
})
public class PendingTransitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_uuid", nullable = false, unique = true, updatable = false)
    private String transitionUuid;

    @Column(name = "session_couch_id", nullable = false, updatable = false)
    private String sessionCouchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, length = 20, updatable = false)
    private WorkflowState toState;

    @Column(name = "actor_user_id", updatable = false)
    private Long actorUserId;

    @Column(length = 500, updatable = false)
    private String reason;

    @Lob
    @Column(name = "metadata", updatable = false)
    private String metadata;

    @Column(name = "occurred_at", updatable = false)
    private Instant occurredAt;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    public PendingTransitionEntity() {}

    public Long getId() { return id; }

    public String getTransitionUuid() { return transitionUuid; }
    public void setTransitionUuid(String transitionUuid) { this.transitionUuid = transitionUuid; }

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public WorkflowState getToState() { return toState; }
    public void setToState(WorkflowState toState) { this.toState = toState; }

    public Long getActorUserId() { return actorUserId; }
    public void setActorUserId(Long actorUserId) { this.actorUserId = actorUserId; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }

    public Instant getOccurredAt() { return occurredAt; }
    public void setOccurredAt(Instant occurredAt) { this.occurredAt = occurredAt; }

    public Instant getReceivedAt() { return receivedAt; }
    public void setReceivedAt(Instant receivedAt) { this.receivedAt = receivedAt; }
}
