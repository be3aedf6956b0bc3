package io.github.drompincen.carebridge.protocol.api;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.util.List;

public record InvalidTransitionResponse(
        String error,
        String sessionCouchId,
        WorkflowState currentState,
        WorkflowState requestedState,
        List<WorkflowState> allowedNextStates
) {}
