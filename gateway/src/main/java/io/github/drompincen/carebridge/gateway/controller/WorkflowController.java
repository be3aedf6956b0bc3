package io.github.drompincen.carebridge.gateway.controller;

import io.github.drompincen.carebridge.protocol.api.WorkflowConfigDto;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import io.github.drompincen.carebridge.runtime.workflow.WorkflowStateMachine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.Map;

@RestController
@RequestMapping("/api/workflow")
public class WorkflowController {

    private final WorkflowStateMachine stateMachine;

    public WorkflowController(WorkflowStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @GetMapping("/config")
    public WorkflowConfigDto config() {
        Map<WorkflowState, String> labels = new EnumMap<>(WorkflowState.class);
        for (WorkflowState state : stateMachine.states()) {
            labels.put(state, state.label());
        }
        return new WorkflowConfigDto(
                stateMachine.states(),
                stateMachine.terminalStates(),
                stateMachine.edges(),
                stateMachine.reasonCatalogue(),
                labels);
    }
}
