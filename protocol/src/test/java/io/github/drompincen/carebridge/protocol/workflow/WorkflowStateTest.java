package io.github.drompincen.carebridge.protocol.workflow;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowStateTest {

    @Test
    void allStatesExistInLifecycleOrder() {
        assertThat(WorkflowState.values()).containsExactly(
                WorkflowState.NEW,
                WorkflowState.TRIAGED,
                WorkflowState.REFERRED,
                WorkflowState.IN_GP_REVIEW,
                WorkflowState.UNDER_TREATMENT,
                WorkflowState.CLOSED,
                WorkflowState.CANCELLED);
    }

    @Test
    void onlyClosedAndCancelledAreTerminal() {
        assertThat(WorkflowState.CLOSED.isTerminal()).isTrue();
        assertThat(WorkflowState.CANCELLED.isTerminal()).isTrue();
        assertThat(WorkflowState.NEW.isTerminal()).isFalse();
        assertThat(WorkflowState.UNDER_TREATMENT.isTerminal()).isFalse();
    }

    @Test
    void parseIsCaseInsensitive() {
        assertThat(WorkflowState.parse("in_gp_review")).contains(WorkflowState.IN_GP_REVIEW);
        assertThat(WorkflowState.parse(" TRIAGED ")).contains(WorkflowState.TRIAGED);
    }

    @Test
    void parseRejectsUnknownAndBlank() {
        assertThat(WorkflowState.parse("DISCHARGED")).isEmpty();
        assertThat(WorkflowState.parse("")).isEmpty();
        assertThat(WorkflowState.parse(null)).isEmpty();
    }
}
