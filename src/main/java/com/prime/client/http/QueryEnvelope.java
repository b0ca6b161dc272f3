package com.prime.client.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * View over the {@code queryResponse} envelope the API wraps data queries in:
 * <pre>
 * {"queryResponse": {"@count": 2500, "@first": 0, "@last": 999, "entity": [ ... ]}}
 * </pre>
 * The envelope key is matched case-insensitively and the count key is
 * {@code @count} or {@code @counts} depending on the server version.
 *
 * @param present  whether the payload carried an envelope at all
 * @param count    the record count reported by the server, -1 when absent
 * @param entities the entities of this page in server order
 */
public record QueryEnvelope(boolean present, long count, List<JsonNode> entities) {

    private static final String ENVELOPE_KEY = "queryResponse";
    private static final String[] COUNT_KEYS = {"@count", "@counts"};
    private static final String ENTITY_KEY = "entity";

    public QueryEnvelope {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static QueryEnvelope absent() {
        return new QueryEnvelope(false, -1, List.of());
    }

    public static QueryEnvelope of(JsonNode payload) {
        JsonNode envelope = findEnvelope(payload);
        if (envelope == null) {
            return absent();
        }
        return new QueryEnvelope(true, readCount(envelope), readEntities(envelope));
    }

    public boolean hasCount() {
        return count >= 0;
    }

    private static JsonNode findEnvelope(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ENVELOPE_KEY.equalsIgnoreCase(field.getKey()) && field.getValue().isObject()) {
                return field.getValue();
            }
        }
        return null;
    }

    private static long readCount(JsonNode envelope) {
        for (String key : COUNT_KEYS) {
            JsonNode node = envelope.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.canConvertToLong()) {
                return node.asLong();
            }
            if (node.isTextual()) {
                try {
                    return Long.parseLong(node.asText().trim());
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
        }
        return -1;
    }

    private static List<JsonNode> readEntities(JsonNode envelope) {
        JsonNode node = envelope.get(ENTITY_KEY);
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<JsonNode> entities = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(entities::add);
        } else {
            // single-entity pages are sometimes sent without the array wrapper
            entities.add(node);
        }
        return entities;
    }
}
