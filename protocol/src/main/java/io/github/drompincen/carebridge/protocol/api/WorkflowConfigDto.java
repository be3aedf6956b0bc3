package io.github.drompincen.carebridge.protocol.api;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.util.List;
import java.util.Map;

public record WorkflowConfigDto(
        List<WorkflowState> states,
        List<WorkflowState> terminalStates,
        Map<WorkflowState, List<WorkflowState>> transitions,
        Map<String, List<String>> transitionReasons,
        Map<WorkflowState, String> labels
) {}
