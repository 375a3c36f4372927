package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Case-insensitive alias lookups over Jackson object nodes. */
final class JsonNodes {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonNodes() {}

    /** Lower-cased field name to node, first occurrence wins. */
    static Map<String, JsonNode> lowerCaseFields(JsonNode object) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fields.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        return fields;
    }

    static JsonNode firstPresent(Map<String, JsonNode> fields, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode node = fields.get(alias);
            if (node == null || node.isNull()) continue;
            if (node.isTextual() && node.asText().isBlank()) continue;
            return node;
        }
        return null;
    }

    static String firstText(Map<String, JsonNode> fields, List<String> aliases) {
        return MeasurementFields.text(firstPresent(fields, aliases));
    }

    static Map<String, Object> toMap(ObjectMapper mapper, JsonNode object) {
        if (object == null || !object.isObject() || object.isEmpty()) return null;
        return mapper.convertValue(object, MAP_TYPE);
    }
}
