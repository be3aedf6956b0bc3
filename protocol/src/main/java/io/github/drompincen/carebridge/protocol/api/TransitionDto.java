package io.github.drompincen.carebridge.protocol.api;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.time.Instant;
import java.util.Map;

public record TransitionDto(
        String transitionUuid,
        String sessionCouchId,
        WorkflowState fromState,
        WorkflowState toState,
        Long userId,
        String reason,
        Map<String, Object> metadata,
        Instant createdAt
) {}
