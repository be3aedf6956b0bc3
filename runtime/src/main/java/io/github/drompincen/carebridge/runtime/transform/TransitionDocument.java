package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;

import java.util.Map;

/**
 * A workflow transition authored on a device. Applied through the state machine, never upserted.
 */
public record TransitionDocument(
        DocumentHeader header,
        String sessionCouchId,
        WorkflowState toState,
        String reason,
        Map<String, Object> metadata
) implements TransformedDocument {

    @Override
    public DocumentType type() {
        return DocumentType.STATE_TRANSITION;
    }
}
