package io.github.drompincen.carebridge.runtime.workflow;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.util.List;

public class InvalidTransitionException extends RuntimeException {

    private final String sessionCouchId;
    private final WorkflowState currentState;
    private final WorkflowState requestedState;
    private final List<WorkflowState> allowedNextStates;

    public InvalidTransitionException(String sessionCouchId, WorkflowState currentState,
                                      WorkflowState requestedState, List<WorkflowState> allowedNextStates) {
        super("Invalid transition from " + currentState + " to " + requestedState
                + " for session " + sessionCouchId + "; allowed: " + allowedNextStates);
        this.sessionCouchId = sessionCouchId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.allowedNextStates = List.copyOf(allowedNextStates);
    }

    public String getSessionCouchId() { return sessionCouchId; }
    public WorkflowState getCurrentState() { return currentState; }
    public WorkflowState getRequestedState() { return requestedState; }
    public List<WorkflowState> getAllowedNextStates() { return allowedNextStates; }
}
