package io.github.drompincen.carebridge.protocol.sync;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of the document store's change feed.
 *
 * @param id       external document id
 * @param revision revision marker of this version ({@code _rev}), may be null for deletions without a body
 * @param sequence feed position the change was observed at
 * @param deleted  true when the source reports the document as deleted
 * @param doc      full document body, never null (an empty object when the feed carried none)
 */
public record ChangeRecord(
        String id,
        String revision,
        String sequence,
        boolean deleted,
        JsonNode doc
) {

    public static final String TYPE_FIELD = "type";

    /**
     * The type discriminator, or null when the document carries none.
     */
    public String type() {
        JsonNode type = doc.get(TYPE_FIELD);
        if (type == null || type.isNull() || !type.isTextual() || type.asText().isBlank()) {
            return null;
        }
        return type.asText();
    }
}
