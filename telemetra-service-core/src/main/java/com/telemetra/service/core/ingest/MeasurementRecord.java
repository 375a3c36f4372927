package com.telemetra.service.core.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A stored measurement as returned by the preview endpoint. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MeasurementRecord(
        UUID id,
        @JsonProperty("device_id") String deviceId,
        String metric,
        @JsonProperty("recorded_at") Instant recordedAt,
        Double value,
        Map<String, Object> tags,
        @JsonProperty("ingested_at") Instant ingestedAt) {}
