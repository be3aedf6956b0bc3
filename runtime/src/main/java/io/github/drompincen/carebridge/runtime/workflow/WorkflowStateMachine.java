package io.github.drompincen.carebridge.runtime.workflow;

import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.CANCELLED;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.CLOSED;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.IN_GP_REVIEW;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.NEW;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.REFERRED;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.TRIAGED;
import static io.github.drompincen.carebridge.protocol.workflow.WorkflowState.UNDER_TREATMENT;

/**
 * The clinical session lifecycle as a fixed edge table. Every method here is a pure function of
 * its arguments; persistence lives in {@link SessionWorkflowService}.
 */
@Component
public class WorkflowStateMachine {

    private static final Map<WorkflowState, List<WorkflowState>> EDGES = new EnumMap<>(WorkflowState.class);
    private static final Map<String, List<String>> REASONS = new LinkedHashMap<>();

    static {
        EDGES.put(NEW, List.of(TRIAGED, CANCELLED));
        EDGES.put(TRIAGED, List.of(REFERRED, CANCELLED));
        EDGES.put(REFERRED, List.of(IN_GP_REVIEW, CANCELLED));
        EDGES.put(IN_GP_REVIEW, List.of(UNDER_TREATMENT, REFERRED, CANCELLED));
        EDGES.put(UNDER_TREATMENT, List.of(CLOSED, CANCELLED));
        EDGES.put(CLOSED, List.of());
        EDGES.put(CANCELLED, List.of());

        reasons(NEW, TRIAGED, "assessment_completed", "vitals_recorded");
        reasons(TRIAGED, REFERRED, "specialist_needed", "gp_consultation_required", "complex_case");
        reasons(REFERRED, IN_GP_REVIEW, "gp_accepted", "review_started");
        reasons(IN_GP_REVIEW, UNDER_TREATMENT, "treatment_plan_created", "medication_started");
        reasons(IN_GP_REVIEW, REFERRED, "specialist_referral", "secondary_consultation");
        reasons(UNDER_TREATMENT, CLOSED, "treatment_completed", "patient_recovered");
        for (WorkflowState state : WorkflowState.values()) {
            if (!state.isTerminal()) {
                reasons(state, CANCELLED, "patient_withdrew", "duplicate_session", "entered_in_error");
            }
        }
    }

    private static void reasons(WorkflowState from, WorkflowState to, String... reasons) {
        REASONS.put(key(from, to), List.of(reasons));
    }

    private static String key(WorkflowState from, WorkflowState to) {
        return from.name() + "->" + to.name();
    }

    public List<WorkflowState> allowedTransitions(WorkflowState from) {
        return EDGES.getOrDefault(from, List.of());
    }

    public boolean canTransition(WorkflowState from, WorkflowState to) {
        return from != null && to != null && allowedTransitions(from).contains(to);
    }

    public boolean isTerminal(WorkflowState state) {
        return state.isTerminal();
    }

    /**
     * Suggested reasons for an edge. Advisory only; any reason is accepted.
     */
    public List<String> validReasons(WorkflowState from, WorkflowState to) {
        return REASONS.getOrDefault(key(from, to), List.of());
    }

    public void validate(String sessionCouchId, WorkflowState from, WorkflowState to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(sessionCouchId, from, to, allowedTransitions(from));
        }
    }

    public List<WorkflowState> states() {
        return Arrays.asList(WorkflowState.values());
    }

    public List<WorkflowState> terminalStates() {
        return states().stream().filter(WorkflowState::isTerminal).toList();
    }

    public Map<WorkflowState, List<WorkflowState>> edges() {
        return Collections.unmodifiableMap(EDGES);
    }

    public Map<String, List<String>> reasonCatalogue() {
        return Collections.unmodifiableMap(REASONS);
    }
}
