package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.ReferralEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ReferralTransformer extends AbstractDocumentTransformer {

    @Override
    public DocumentType type() {
        return DocumentType.REFERRAL;
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String sessionCouchId = doc.requiredText("sessionId", "session_id", "sessionCouchId");
        String priority = doc.requiredText("priority");
        String assignedToRole = doc.text("assignedToRole", "assigned_to_role", "toRole");
        String status = doc.textOr("pending", "status");
        String specialty = doc.text("specialty");
        String reason = doc.text("reason");
        String clinicalNotes = doc.text("clinicalNotes", "clinical_notes", "notes");
        String rejectionReason = doc.text("rejectionReason", "rejection_reason");
        Long assignedToUserId = doc.longValue("assignedToUserId", "assigned_to_user_id");
        Instant assignedAt = doc.instant("assignedAt", "assigned_at");
        Instant acceptedAt = doc.instant("acceptedAt", "accepted_at");
        Instant completedAt = doc.instant("completedAt", "completed_at");

        return new MirroredDocument<>(type(), header, ReferralEntity.class, (referral, inserted) -> {
            referral.setSessionCouchId(sessionCouchId);
            referral.setPriority(priority);
            referral.setAssignedToRole(assignedToRole);
            referral.setStatus(status);
            referral.setSpecialty(specialty);
            referral.setReason(reason);
            referral.setClinicalNotes(clinicalNotes);
            referral.setRejectionReason(rejectionReason);
            referral.setAssignedToUserId(assignedToUserId);
            referral.setAssignedAt(assignedAt);
            referral.setAcceptedAt(acceptedAt);
            referral.setCompletedAt(completedAt);
        });
    }
}
