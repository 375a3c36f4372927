package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

/**
 * CSV-like upload. The header row names the columns (matched through the alias table); the
 * {@code tags} cell holds a JSON object and every other non-empty unrecognized cell becomes a tag.
 */
@Slf4j
final class DelimitedRowSource extends AbstractRowSource {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_EMPTY)
            .build();

    private final ObjectMapper mapper;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    /** lower-cased header name to the header as written */
    private final Map<String, String> columns = new LinkedHashMap<>();

    DelimitedRowSource(ObjectMapper mapper, Reader reader) {
        super(PayloadShape.DELIMITED);
        this.mapper = mapper;
        try {
            this.parser = FORMAT.parse(reader);
        } catch (IOException | UncheckedIOException ex) {
            throw new MalformedPayloadException("Invalid CSV payload: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new MalformedPayloadException("Invalid CSV header: " + ex.getMessage(), ex);
        }
        List<String> headerNames = parser.getHeaderNames();
        for (String header : headerNames) {
            String name = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, header);
            }
        }
        if (columns.isEmpty()) {
            closeQuietly();
            throw new MalformedPayloadException("CSV payload has no header row");
        }
        if (!declaresAny(MeasurementFields.DEVICE_ALIASES) || !declaresAny(MeasurementFields.TIMESTAMP_ALIASES)) {
            closeQuietly();
            throw new MalformedPayloadException(
                    "CSV header must declare a device column and a timestamp column, got " + columns.keySet());
        }
        this.records = parser.iterator();
    }

    @Override
    protected MeasurementRow fetchNext() {
        while (true) {
            CSVRecord record;
            try {
                if (!records.hasNext()) return null;
                record = records.next();
            } catch (UncheckedIOException ex) {
                throw new MalformedPayloadException("Invalid CSV payload: " + ex.getCause().getMessage(), ex);
            }
            long position = record.getRecordNumber();
            String device = first(record, MeasurementFields.DEVICE_ALIASES);
            String metric = first(record, MeasurementFields.METRIC_ALIASES);
            if (!MeasurementFields.isValidIdentifier(device) || !MeasurementFields.isValidIdentifier(metric)) {
                reject(position, "device and metric must be non-empty and at most 255 characters");
                continue;
            }
            Instant recordedAt = MeasurementFields.parseInstant(first(record, MeasurementFields.TIMESTAMP_ALIASES));
            if (recordedAt == null) {
                reject(position, "missing or unparseable timestamp");
                continue;
            }
            Double value = MeasurementFields.parseValue(first(record, MeasurementFields.VALUE_ALIASES));
            return new MeasurementRow(device, metric, recordedAt, value, tags(record));
        }
    }

    private boolean declaresAny(List<String> aliases) {
        for (String alias : aliases) {
            if (columns.containsKey(alias)) return true;
        }
        return false;
    }

    private String cell(CSVRecord record, String lowerName) {
        String header = columns.get(lowerName);
        if (header == null || !record.isSet(header)) return "";
        String v = record.get(header);
        return v == null ? "" : v.trim();
    }

    private String first(CSVRecord record, List<String> aliases) {
        for (String alias : aliases) {
            String v = cell(record, alias);
            if (!v.isEmpty()) return v;
        }
        return "";
    }

    private Map<String, Object> tags(CSVRecord record) {
        Map<String, Object> tags = new LinkedHashMap<>();
        for (Map.Entry<String, String> column : columns.entrySet()) {
            if (MeasurementFields.RESERVED_KEYS.contains(column.getKey())) continue;
            String v = cell(record, column.getKey());
            if (!v.isEmpty()) {
                tags.put(column.getValue(), v);
            }
        }
        String encoded = cell(record, MeasurementFields.TAGS_FIELD);
        if (!encoded.isEmpty()) {
            try {
                Map<String, Object> parsed = mapper.readValue(encoded, MAP_TYPE);
                if (parsed != null) tags.putAll(parsed);
            } catch (JsonProcessingException ex) {
                // not an object; the row is still usable without it
                log.debug("Ignoring unparseable tags cell in CSV row #{}", record.getRecordNumber());
            }
        }
        return tags.isEmpty() ? null : tags;
    }

    private void closeQuietly() {
        try {
            parser.close();
        } catch (IOException ex) {
            log.debug("Failed to close CSV parser", ex);
        }
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
