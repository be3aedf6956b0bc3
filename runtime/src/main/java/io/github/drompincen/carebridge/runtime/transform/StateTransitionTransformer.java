package io.github.drompincen.carebridge.runtime.transform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import io.github.drompincen.carebridge.runtime.transform.TransformException.Reason;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

@Component
public class StateTransitionTransformer extends AbstractDocumentTransformer {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StateTransitionTransformer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DocumentType type() {
        return DocumentType.STATE_TRANSITION;
    }

    @Override
    protected Instant businessTime(DocumentFields fields) {
        return fields.instant("createdAt", "created_at");
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String sessionCouchId = doc.requiredText("sessionId", "sessionCouchId", "session_couch_id");
        String requested = doc.requiredText("toState", "to_state");
        WorkflowState toState = WorkflowState.parse(requested)
                .orElseThrow(() -> new TransformException(Reason.INVALID_FIELD, change.id(),
                        "Transition " + change.id() + " targets unknown state " + requested));

        Map<String, Object> metadata = Map.of();
        JsonNode metadataNode = doc.node().get("metadata");
        if (metadataNode != null && !metadataNode.isNull()) {
            if (!metadataNode.isObject()) {
                throw new TransformException(Reason.INVALID_FIELD, change.id(),
                        "Transition " + change.id() + " has non-object metadata");
            }
            metadata = objectMapper.convertValue(metadataNode, METADATA_TYPE);
        }

        return new TransitionDocument(header, sessionCouchId, toState, doc.text("reason"), metadata);
    }
}
