package io.github.drompincen.carebridge.runtime.transform;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Extraction of the header fields shared by every document type.
 */
public abstract class AbstractDocumentTransformer implements DocumentTransformer {

    private static final Logger log = LoggerFactory.getLogger(AbstractDocumentTransformer.class);

    static final String[] ACTOR_FIELDS = {
            "createdBy", "created_by", "userId", "user_id",
            "providerId", "provider_id", "nurseId", "authorId"
    };
    static final String[] ROLE_FIELDS = {"providerRole", "provider_role", "role", "creatorRole"};
    static final String[] ACTOR_OBJECT_KEYS = {"id", "email", "uuid"};

    protected DocumentFields fields(ChangeRecord change) {
        return new DocumentFields(change.doc(), change.id());
    }

    protected DocumentHeader header(ChangeRecord change, DocumentFields fields) {
        return new DocumentHeader(
                change.id(),
                change.revision(),
                businessTime(fields),
                actorRef(fields),
                actorRole(fields),
                change.doc().toString());
    }

    /**
     * The client-side last-modified time used to order versions of one document.
     */
    protected Instant businessTime(DocumentFields fields) {
        return fields.instant("updatedAt", "updated_at");
    }

    /**
     * Attribution never fails a document: an unreadable actor is dropped and the record is
     * stored unattributed.
     */
    static String actorRef(DocumentFields fields) {
        JsonNode value = present(fields.node(), ACTOR_FIELDS);
        if (value == null) return null;
        if (value.isValueNode()) return value.asText();
        if (value.isObject()) {
            for (String key : ACTOR_OBJECT_KEYS) {
                JsonNode child = value.get(key);
                if (child != null && child.isValueNode() && !child.isNull()) {
                    return child.asText();
                }
            }
        }
        log.debug("Ignoring unreadable actor reference on {}: {}", fields.externalId(), value);
        return null;
    }

    static String actorRole(DocumentFields fields) {
        JsonNode value = present(fields.node(), ROLE_FIELDS);
        if (value == null) return null;
        if (value.isValueNode()) return value.asText();
        log.debug("Ignoring non-scalar actor role on {}: {}", fields.externalId(), value);
        return null;
    }

    private static JsonNode present(JsonNode node, String[] names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return value;
            }
        }
        return null;
    }
}
