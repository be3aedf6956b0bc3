package io.github.drompincen.carebridge.runtime.workflow;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.time.Instant;

/**
 * Published after a transition has been committed.
 */
public record SessionStateChangedEvent(
        String sessionCouchId,
        String transitionUuid,
        WorkflowState fromState,
        WorkflowState toState,
        Long userId,
        String reason,
        Instant changedAt
) {}
