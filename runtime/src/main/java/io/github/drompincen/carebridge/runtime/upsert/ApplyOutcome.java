package io.github.drompincen.carebridge.runtime.upsert;

public enum ApplyOutcome {
    APPLIED,
    DUPLICATE,
    SKIPPED_CONFLICT,
    SKIPPED_CONSTRAINT,
    SKIPPED_INVALID,
    TRANSITION_REJECTED,
    /** transition held until its session is mirrored */
    DEFERRED;

    public boolean isSkip() {
        return this == SKIPPED_CONSTRAINT || this == SKIPPED_INVALID || this == TRANSITION_REJECTED;
    }
}
