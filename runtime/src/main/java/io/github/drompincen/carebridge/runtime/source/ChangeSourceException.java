package io.github.drompincen.carebridge.runtime.source;

/**
 * The change feed could not be read. The cycle that hit it must not advance the cursor.
 */
public class ChangeSourceException extends RuntimeException {

    public ChangeSourceException(String message) {
        super(message);
    }

    public ChangeSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
