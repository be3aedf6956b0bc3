package io.github.drompincen.carebridge.runtime.sync;

/**
 * How one change ended up, as counted by the cycle.
 */
public enum DocumentResult {
    APPLIED,
    DELETED,
    /** nothing to do: a replayed transition or a deletion of a document never mirrored */
    UNCHANGED,
    /** held back until a document it depends on arrives */
    DEFERRED,
    SKIPPED,
    CONFLICT,
    ERRORED
}
