package io.github.drompincen.carebridge.protocol.api;

public enum CycleStatus {
    COMPLETED,
    INTERRUPTED,
    FETCH_FAILED,
    STORE_UNAVAILABLE,
    BUSY
}
