package io.botflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Lenient field readers shared by the deserializers.
///
/// Every reader tolerates a missing field, an explicit `null` and a value of the wrong
/// JSON type, answering the fallback instead of failing. Imported documents are repaired
/// by the normalizer afterwards.
final class JsonFields {

    private JsonFields() {}

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    static int intOr(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        return value.asInt();
    }

    static boolean booleanOr(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            return fallback;
        }
        return value.asBoolean();
    }

    /// Returns the array elements of a field, or an empty list when it is not an array.
    static List<JsonNode> elements(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<JsonNode> result = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(result::add);
        }
        return result;
    }

    /// Returns the textual array elements of a field; other elements are skipped.
    static List<String> strings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        for (JsonNode element : elements(node, field)) {
            if (element.isTextual()) {
                result.add(element.asText());
            }
        }
        return result;
    }

    /// Writes a string field, emitting JSON `null` for a null value.
    static void writeNullable(JsonGenerator gen, String field, String value) throws IOException {
        if (value == null) {
            gen.writeNullField(field);
        } else {
            gen.writeStringField(field, value);
        }
    }

    static void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
