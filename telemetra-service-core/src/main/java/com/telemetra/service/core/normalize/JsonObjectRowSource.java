package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;

/**
 * Single-metric upload: top-level device and metric, entries under {@code rows}. An entry may
 * override the inherited device or metric.
 */
final class JsonObjectRowSource extends AbstractRowSource {

    private final ObjectMapper mapper;
    private final JsonNode rows;
    private final String defaultDevice;
    private final String defaultMetric;
    private int index;

    JsonObjectRowSource(ObjectMapper mapper, JsonNode root) {
        super(PayloadShape.JSON_OBJECT);
        this.mapper = mapper;
        JsonNode rowsNode = root.get("rows");
        if (rowsNode == null || !rowsNode.isArray()) {
            throw new MalformedPayloadException("'rows' must be a JSON array");
        }
        this.rows = rowsNode;
        Map<String, JsonNode> top = JsonNodes.lowerCaseFields(root);
        this.defaultDevice = JsonNodes.firstText(top, MeasurementFields.DEVICE_ALIASES);
        this.defaultMetric = JsonNodes.firstText(top, MeasurementFields.METRIC_ALIASES);
    }

    @Override
    protected MeasurementRow fetchNext() {
        while (index < rows.size()) {
            int position = index++;
            JsonNode entry = rows.get(position);
            if (!entry.isObject()) {
                reject(position, "entry is not a JSON object");
                continue;
            }
            Map<String, JsonNode> fields = JsonNodes.lowerCaseFields(entry);
            String device = JsonNodes.firstText(fields, MeasurementFields.DEVICE_ALIASES);
            if (device.isEmpty()) device = defaultDevice;
            String metric = JsonNodes.firstText(fields, MeasurementFields.METRIC_ALIASES);
            if (metric.isEmpty()) metric = defaultMetric;
            if (!MeasurementFields.isValidIdentifier(device) || !MeasurementFields.isValidIdentifier(metric)) {
                reject(position, "device and metric must be non-empty and at most 255 characters");
                continue;
            }
            Instant recordedAt =
                    MeasurementFields.parseInstant(JsonNodes.firstPresent(fields, MeasurementFields.TIMESTAMP_ALIASES));
            if (recordedAt == null) {
                reject(position, "missing or unparseable timestamp");
                continue;
            }
            Double value = MeasurementFields.parseValue(JsonNodes.firstPresent(fields, MeasurementFields.VALUE_ALIASES));
            Map<String, Object> tags = JsonNodes.toMap(mapper, fields.get(MeasurementFields.TAGS_FIELD));
            return new MeasurementRow(device, metric, recordedAt, value, tags);
        }
        return null;
    }

    @Override
    public void close() {}
}
