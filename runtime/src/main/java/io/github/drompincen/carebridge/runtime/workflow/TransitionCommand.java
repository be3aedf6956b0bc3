package io.github.drompincen.carebridge.runtime.workflow;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A request to move one session to another workflow state.
 *
 * @param transitionUuid idempotency key; the source document id for device-authored transitions
 * @param occurredAt     when the transition was made, null for now
 */
public record TransitionCommand(
        String transitionUuid,
        String sessionCouchId,
        WorkflowState toState,
        Long actorId,
        String reason,
        Map<String, Object> metadata,
        Instant occurredAt
) {

    public static TransitionCommand direct(String sessionCouchId, WorkflowState toState, Long actorId,
                                           String reason, Map<String, Object> metadata) {
        return new TransitionCommand(UUID.randomUUID().toString(), sessionCouchId, toState, actorId,
                reason, metadata, null);
    }
}
