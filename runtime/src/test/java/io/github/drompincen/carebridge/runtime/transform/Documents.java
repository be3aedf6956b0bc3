package io.github.drompincen.carebridge.runtime.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;

/**
 * Builds change records from JSON text for tests.
 */
public final class Documents {

    public static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private Documents() {}

    public static ChangeRecord change(String json) {
        JsonNode doc = parse(json.replace('\'', '"'));
        return new ChangeRecord(doc.path("_id").asText(), doc.path("_rev").asText(null), "1", false, doc);
    }

    public static ChangeRecord deletion(String id, String rev) {
        return new ChangeRecord(id, rev, "1", true, MAPPER.createObjectNode());
    }

    private static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(json, e);
        }
    }
}
