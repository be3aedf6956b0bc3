package io.github.drompincen.carebridge.runtime.transform;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.carebridge.runtime.transform.TransformException.Reason;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Typed, first-present lookups over a document body. Each lookup takes candidate field names
 * in priority order; a field that is absent or JSON null counts as not present.
 */
public final class DocumentFields {

    private final JsonNode node;
    private final String externalId;

    public DocumentFields(JsonNode node, String externalId) {
        this.node = node;
        this.externalId = externalId;
    }

    public String externalId() {
        return externalId;
    }

    public JsonNode node() {
        return node;
    }

    /**
     * The named sub-object when present, otherwise this document.
     */
    public DocumentFields objectOrSelf(String name) {
        JsonNode child = node.get(name);
        return child != null && child.isObject() ? new DocumentFields(child, externalId) : this;
    }

    public boolean has(String... names) {
        return first(names) != null;
    }

    public String text(String... names) {
        JsonNode value = first(names);
        if (value == null) return null;
        if (value.isContainerNode()) {
            throw invalid(names, "expected a scalar");
        }
        return value.asText();
    }

    public String textOr(String defaultValue, String... names) {
        String value = text(names);
        return value != null ? value : defaultValue;
    }

    public String requiredText(String... names) {
        String value = text(names);
        if (value == null || value.isBlank()) {
            throw new TransformException(Reason.MISSING_REQUIRED_FIELD, externalId,
                    "Document " + externalId + " is missing required field " + names[0]);
        }
        return value;
    }

    /**
     * @throws TransformException when the value has a fraction or does not fit an {@code int}
     */
    public Integer integer(String... names) {
        Long value = longValue(names);
        if (value == null) return null;
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw invalid(names, "integer out of range: " + value);
        }
        return value.intValue();
    }

    /**
     * @throws TransformException when the value has a fraction or does not fit a {@code long}
     */
    public Long longValue(String... names) {
        JsonNode value = first(names);
        if (value == null) return null;
        if (value.isNumber()) {
            if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                throw invalid(names, "expected a whole number, got " + value.asText());
            }
            return value.longValue();
        }
        try {
            return Long.valueOf(value.asText().trim());
        } catch (NumberFormatException e) {
            throw invalid(names, "expected a whole number");
        }
    }

    public BigDecimal decimal(String... names) {
        JsonNode value = first(names);
        if (value == null) return null;
        if (value.isNumber()) return value.decimalValue();
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw invalid(names, "expected a number");
        }
    }

    public Boolean bool(String... names) {
        JsonNode value = first(names);
        if (value == null) return null;
        if (value.isBoolean()) return value.asBoolean();
        String text = value.asText().trim();
        if ("true".equalsIgnoreCase(text) || "1".equals(text)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(text) || "0".equals(text)) return Boolean.FALSE;
        throw invalid(names, "expected a boolean");
    }

    public boolean boolOr(boolean defaultValue, String... names) {
        Boolean value = bool(names);
        return value != null ? value : defaultValue;
    }

    public Instant instant(String... names) {
        JsonNode value = first(names);
        if (value == null) return null;
        if (value.isNumber()) {
            return TimestampParser.fromEpochMillis(value.asLong());
        }
        try {
            return TimestampParser.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new TransformException(Reason.INVALID_FIELD, externalId,
                    "Document " + externalId + " has unparseable timestamp in " + names[0] + ": " + value.asText(), e);
        }
    }

    public LocalDate date(String... names) {
        Instant instant = instant(names);
        return instant == null ? null : LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * The field serialized back to JSON text, for columns that hold structured values.
     */
    public String json(String... names) {
        JsonNode value = first(names);
        return value == null ? null : value.toString();
    }

    private JsonNode first(String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return value;
            }
        }
        return null;
    }

    private TransformException invalid(String[] names, String detail) {
        return new TransformException(Reason.INVALID_FIELD, externalId,
                "Document " + externalId + " has invalid " + names[0] + ": " + detail);
    }
}
