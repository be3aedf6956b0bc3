package io.github.drompincen.carebridge.runtime.sync;

/**
 * The relational store cannot be reached. Aborts the cycle without moving the cursor.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
