package com.telemetra.service.core.normalize;

import java.time.Instant;
import java.util.Map;

/**
 * Canonical measurement produced by the normalizer, independent of the upload format.
 *
 * @param value nullable; absent or non-finite readings are kept as {@code null}
 * @param tags nullable; empty tag sets are stored as {@code null}
 */
public record MeasurementRow(String deviceId, String metric, Instant recordedAt, Double value, Map<String, Object> tags) {}
