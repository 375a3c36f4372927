package com.telemetra.service.core.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/** Loads the measurement table description once at startup. */
@Component
@Slf4j
public class TableSchemaProvider {

    private final TableSchema schema;

    public TableSchemaProvider(
            ObjectMapper objectMapper,
            @Value("${telemetra.query.schema-location:classpath:telemetra/measurement-schema.json}") Resource location) {
        this.schema = load(objectMapper, location);
        log.info("Loaded schema for table {} with {} columns", schema.tableName(), schema.columns().size());
    }

    public TableSchema schema() {
        return schema;
    }

    private static TableSchema load(ObjectMapper objectMapper, Resource location) {
        try (InputStream in = location.getInputStream()) {
            TableSchema loaded = objectMapper.readValue(in, TableSchema.class);
            if (loaded.tableName() == null || loaded.columns().isEmpty()) {
                throw new IllegalStateException("Schema resource " + location + " has no table name or columns");
            }
            return loaded;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read schema resource " + location, ex);
        }
    }
}
