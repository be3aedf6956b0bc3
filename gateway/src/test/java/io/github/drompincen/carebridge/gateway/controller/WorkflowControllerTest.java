package io.github.drompincen.carebridge.gateway.controller;

import io.github.drompincen.carebridge.protocol.api.WorkflowConfigDto;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import io.github.drompincen.carebridge.runtime.workflow.WorkflowStateMachine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowControllerTest {

    private final WorkflowController controller = new WorkflowController(new WorkflowStateMachine());

    @Test
    void configListsStatesEdgesAndReasons() {
        WorkflowConfigDto config = controller.config();

        assertThat(config.states()).hasSize(WorkflowState.values().length);
        assertThat(config.terminalStates()).containsExactlyInAnyOrder(WorkflowState.CLOSED, WorkflowState.CANCELLED);
        assertThat(config.transitions().get(WorkflowState.IN_GP_REVIEW))
                .containsExactly(WorkflowState.UNDER_TREATMENT, WorkflowState.REFERRED, WorkflowState.CANCELLED);
        assertThat(config.transitions().get(WorkflowState.CLOSED)).isEmpty();
        assertThat(config.transitionReasons()).isNotEmpty();
        assertThat(config.labels()).containsKeys(WorkflowState.values());
    }
}
