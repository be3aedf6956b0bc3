package io.github.drompincen.carebridge.protocol.api;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.time.Instant;
import java.util.List;

public record ClinicalSessionDto(
        String couchId,
        String sessionUuid,
        String patientCpt,
        String stage,
        String status,
        WorkflowState workflowState,
        Instant workflowStateUpdatedAt,
        String triagePriority,
        String chiefComplaint,
        Long createdByUserId,
        String providerRole,
        Instant sessionUpdatedAt,
        Instant syncedAt,
        List<WorkflowState> allowedNextStates
) {}
