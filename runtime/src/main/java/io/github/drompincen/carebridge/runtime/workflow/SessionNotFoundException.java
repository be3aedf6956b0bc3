package io.github.drompincen.carebridge.runtime.workflow;

public class SessionNotFoundException extends RuntimeException {

    private final String sessionCouchId;

    public SessionNotFoundException(String sessionCouchId) {
        super("Clinical session not found: " + sessionCouchId);
        this.sessionCouchId = sessionCouchId;
    }

    public String getSessionCouchId() { return sessionCouchId; }
}
