package io.github.drompincen.carebridge.runtime.transform;

/**
 * A document that cannot be turned into a relational record. The document is skipped; the
 * cycle carries on.
 */
public class TransformException extends RuntimeException {

    public enum Reason {
        UNKNOWN_TYPE,
        MISSING_TYPE,
        MISSING_REQUIRED_FIELD,
        INVALID_FIELD
    }

    private final Reason reason;
    private final String externalId;

    public TransformException(Reason reason, String externalId, String message) {
        super(message);
        this.reason = reason;
        this.externalId = externalId;
    }

    public TransformException(Reason reason, String externalId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.externalId = externalId;
    }

    public Reason getReason() { return reason; }
    public String getExternalId() { return externalId; }
}
