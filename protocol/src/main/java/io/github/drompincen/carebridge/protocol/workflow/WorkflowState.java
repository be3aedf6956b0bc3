package io.github.drompincen.carebridge.protocol.workflow;

import java.util.Arrays;
import java.util.Optional;

public enum WorkflowState {
    NEW("New Patient"),
    TRIAGED("Assessment Completed"),
    REFERRED("Referred"),
    IN_GP_REVIEW("GP Review"),
    UNDER_TREATMENT("Under Treatment"),
    CLOSED("Closed"),
    CANCELLED("Cancelled");

    private final String label;

    WorkflowState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == CANCELLED;
    }

    /**
     * Case-insensitive lookup; empty for null or unknown names.
     */
    public static Optional<WorkflowState> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalized))
                .findFirst();
    }
}
