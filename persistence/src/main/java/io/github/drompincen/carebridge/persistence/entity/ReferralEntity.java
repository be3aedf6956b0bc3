package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "referrals", indexes = {
        @Index(name = "idx_referrals_session", columnList = "session_couch_id"),
        @Index(name = "idx_referrals_role_status", columnList = "assigned_to_role, status"),
        @Index(name = "idx_referrals_priority", columnList = "priority")
})
public class ReferralEntity extends MirroredEntity {

    public static final String AUTO_REFERRAL_PREFIX = "auto-referral:";

    @Column(name = "session_couch_id", nullable = false)
    private String sessionCouchId;

    @Column(name = "assigned_to_role", length = 50)
    private String assignedToRole;

    @Column(nullable = false, length = 20)
    private String status = "pending";

    @Column(nullable = false, length = 10)
    private String priority;

    @Column(length = 100)
    private String specialty;

    @Lob
    @Column(name = "reason")
    private String reason;

    @Lob
    @Column(name = "clinical_notes")
    private String clinicalNotes;

    @Lob
    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "assigned_to_user_id")
    private Long assignedToUserId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public ReferralEntity() {}

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public String getAssignedToRole() { return assignedToRole; }
    public void setAssignedToRole(String assignedToRole) { this.assignedToRole = assignedToRole; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getSpecialty() { return specialty; }
    public void setSpecialty(String specialty) { this.specialty = specialty; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getClinicalNotes() { return clinicalNotes; }
    public void setClinicalNotes(String clinicalNotes) { this.clinicalNotes = clinicalNotes; }

    public String getRejectionReason() { return rejectionReason; }
    public void setRejectionReason(String rejectionReason) { this.rejectionReason = rejectionReason; }

    public Long getAssignedToUserId() { return assignedToUserId; }
    public void setAssignedToUserId(Long assignedToUserId) { this.assignedToUserId = assignedToUserId; }

    public Instant getAssignedAt() { return assignedAt; }
    public void setAssignedAt(Instant assignedAt) { this.assignedAt = assignedAt; }

    public Instant getAcceptedAt() { return acceptedAt; }
    public void setAcceptedAt(Instant acceptedAt) { this.acceptedAt = acceptedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
