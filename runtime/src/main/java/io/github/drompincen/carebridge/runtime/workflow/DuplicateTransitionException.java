package io.github.drompincen.carebridge.runtime.workflow;

/**
 * The transition was already recorded under the same id.
 */
public class DuplicateTransitionException extends RuntimeException {

    private final String transitionUuid;

    public DuplicateTransitionException(String transitionUuid) {
        super("Transition already recorded: " + transitionUuid);
        this.transitionUuid = transitionUuid;
    }

    public String getTransitionUuid() { return transitionUuid; }
}
