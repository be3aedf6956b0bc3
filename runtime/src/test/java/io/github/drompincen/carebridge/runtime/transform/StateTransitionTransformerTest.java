package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import io.github.drompincen.carebridge.runtime.transform.TransformException.Reason;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.drompincen.carebridge.runtime.transform.Documents.change;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateTransitionTransformerTest {

    private final StateTransitionTransformer transformer = new StateTransitionTransformer(Documents.MAPPER);

    @Test
    void readsTransitionCommand() {
        TransitionDocument doc = (TransitionDocument) transformer.transform(change(
                "{'_id':'transition:t1','type':'stateTransition','sessionId':'session:s1','toState':'in_gp_review',"
                        + "'reason':'gp_accepted','metadata':{'notes':'ok'},'userId':'5','createdAt':'2024-03-01T10:00:00Z'}"));

        assertThat(doc.sessionCouchId()).isEqualTo("session:s1");
        assertThat(doc.toState()).isEqualTo(WorkflowState.IN_GP_REVIEW);
        assertThat(doc.reason()).isEqualTo("gp_accepted");
        assertThat(doc.metadata()).containsEntry("notes", "ok");
        assertThat(doc.header().actorRef()).isEqualTo("5");
        assertThat(doc.header().businessTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void unknownTargetStateIsInvalid() {
        assertThatThrownBy(() -> transformer.transform(change(
                "{'_id':'transition:t1','type':'stateTransition','sessionId':'session:s1','toState':'DONE'}")))
                .isInstanceOf(TransformException.class)
                .extracting(e -> ((TransformException) e).getReason())
                .isEqualTo(Reason.INVALID_FIELD);
    }

    @Test
    void missingSessionIsRequired() {
        assertThatThrownBy(() -> transformer.transform(change(
                "{'_id':'transition:t1','type':'stateTransition','toState':'CLOSED'}")))
                .isInstanceOf(TransformException.class)
                .extracting(e -> ((TransformException) e).getReason())
                .isEqualTo(Reason.MISSING_REQUIRED_FIELD);
    }
}
