package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flat record array as produced by third-party open-data exports. Each element is resolved through
 * the alias table; unrecognized fields become tags. Elements are pulled from the stream one at a time.
 */
final class JsonArrayRowSource extends AbstractRowSource {

    private final ObjectMapper mapper;
    private final JsonParser parser;
    private final Iterator<JsonNode> buffered;
    private long position;

    /** Streams elements from a parser positioned on {@link JsonToken#START_ARRAY}. */
    JsonArrayRowSource(ObjectMapper mapper, JsonParser parser) {
        super(PayloadShape.JSON_ARRAY);
        this.mapper = mapper;
        this.parser = parser;
        this.buffered = null;
    }

    /** Elements already in memory, e.g. a lone record object. */
    JsonArrayRowSource(ObjectMapper mapper, List<JsonNode> elements) {
        super(PayloadShape.JSON_ARRAY);
        this.mapper = mapper;
        this.parser = null;
        this.buffered = elements.iterator();
    }

    @Override
    protected MeasurementRow fetchNext() {
        JsonNode element;
        while ((element = nextElement()) != null) {
            long current = position++;
            if (!element.isObject()) {
                reject(current, "element is not a JSON object");
                continue;
            }
            MeasurementRow row = toRow(element);
            if (row == null) {
                reject(current, "missing device, metric or timestamp");
                continue;
            }
            return row;
        }
        return null;
    }

    private MeasurementRow toRow(JsonNode element) {
        Map<String, JsonNode> fields = JsonNodes.lowerCaseFields(element);
        String device = JsonNodes.firstText(fields, MeasurementFields.DEVICE_ALIASES);
        String metric = JsonNodes.firstText(fields, MeasurementFields.METRIC_ALIASES);
        if (!MeasurementFields.isValidIdentifier(device) || !MeasurementFields.isValidIdentifier(metric)) {
            return null;
        }
        Instant recordedAt =
                MeasurementFields.parseInstant(JsonNodes.firstPresent(fields, MeasurementFields.TIMESTAMP_ALIASES));
        if (recordedAt == null) {
            return null;
        }
        Double value = MeasurementFields.parseValue(JsonNodes.firstPresent(fields, MeasurementFields.VALUE_ALIASES));
        return new MeasurementRow(device, metric, recordedAt, value, tags(element, fields));
    }

    private Map<String, Object> tags(JsonNode element, Map<String, JsonNode> fields) {
        Map<String, Object> tags = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = element.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            if (MeasurementFields.RESERVED_KEYS.contains(key.toLowerCase(Locale.ROOT))) continue;
            if (e.getValue() == null || e.getValue().isNull()) continue;
            tags.put(key, mapper.convertValue(e.getValue(), Object.class));
        }
        Map<String, Object> explicit = JsonNodes.toMap(mapper, fields.get(MeasurementFields.TAGS_FIELD));
        if (explicit != null) {
            tags.putAll(explicit);
        }
        return tags.isEmpty() ? null : tags;
    }

    private JsonNode nextElement() {
        if (buffered != null) {
            return buffered.hasNext() ? buffered.next() : null;
        }
        try {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new MalformedPayloadException("Unexpected end of JSON array");
            }
            if (token == JsonToken.END_ARRAY) {
                return null;
            }
            return parser.readValueAsTree();
        } catch (JsonProcessingException ex) {
            throw new MalformedPayloadException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public void close() {
        if (parser == null) return;
        try {
            parser.close();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
