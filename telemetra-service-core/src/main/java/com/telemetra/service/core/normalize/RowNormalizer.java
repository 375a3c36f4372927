package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns an upload into a lazy {@link RowSource}. The payload shape is decided once from the
 * container structure; row-level defects are counted by the returned source, container defects
 * raise {@link MalformedPayloadException}.
 */
@Component
@Slf4j
public class RowNormalizer {

    private final ObjectMapper mapper;

    public RowNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Opens a source over {@code in}; the source owns the stream and closes it. */
    public RowSource open(InputStream in, PayloadFormat format) {
        return switch (format) {
            case JSON -> openJson(in);
            case CSV -> new DelimitedRowSource(mapper, new InputStreamReader(in, StandardCharsets.UTF_8));
        };
    }

    /** Drains {@code in} into memory; used for small synchronous uploads so container defects surface before any write. */
    public RowSource buffer(InputStream in, PayloadFormat format) {
        try (RowSource source = open(in, format)) {
            List<MeasurementRow> rows = new ArrayList<>();
            source.forEachRemaining(rows::add);
            return RowSource.of(source.shape(), rows, source.rejected());
        }
    }

    private RowSource openJson(InputStream in) {
        JsonParser parser = null;
        try {
            parser = mapper.createParser(in);
            JsonToken first = parser.nextToken();
            if (first == JsonToken.START_ARRAY) {
                log.debug("Detected JSON array payload");
                return new JsonArrayRowSource(mapper, parser);
            }
            if (first == JsonToken.START_OBJECT) {
                JsonNode root = parser.readValueAsTree();
                parser.close();
                if (root.has("rows")) {
                    log.debug("Detected single-metric JSON object payload");
                    return new JsonObjectRowSource(mapper, root);
                }
                log.debug("Detected lone JSON record, treating it as a one-element array");
                return new JsonArrayRowSource(mapper, List.of(root));
            }
            parser.close();
            if (first == null) {
                throw new MalformedPayloadException("Empty JSON payload");
            }
            throw new MalformedPayloadException("Unsupported JSON structure: expected an object or an array, got " + first);
        } catch (JsonProcessingException ex) {
            closeQuietly(parser);
            throw new MalformedPayloadException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            closeQuietly(parser);
            throw new UncheckedIOException(ex);
        }
    }

    private static void closeQuietly(JsonParser parser) {
        if (parser == null) return;
        try {
            parser.close();
        } catch (IOException ex) {
            log.debug("Failed to close JSON parser", ex);
        }
    }
}
