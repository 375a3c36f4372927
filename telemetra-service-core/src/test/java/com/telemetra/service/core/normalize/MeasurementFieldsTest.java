package com.telemetra.service.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MeasurementFieldsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void parsesIsoInstantsWithOffset() {
        assertThat(MeasurementFields.parseInstant("2025-01-01T00:00:00Z")).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(MeasurementFields.parseInstant("2025-01-01T02:00:00.250+02:00"))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00.250Z"));
        assertThat(MeasurementFields.parseInstant("2025-01-01 00:00:00+0000"))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void localTimestampsAndGarbageAreNotAbsolute() {
        assertThat(MeasurementFields.parseInstant("2025-01-01T00:00:00")).isNull();
        assertThat(MeasurementFields.parseInstant("yesterday")).isNull();
        assertThat(MeasurementFields.parseInstant("   ")).isNull();
        assertThat(MeasurementFields.parseInstant((String) null)).isNull();
    }

    @Test
    void epochNumbersAreSecondsOrMillis() throws Exception {
        assertThat(MeasurementFields.parseInstant("1700000000")).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree("1700000000000")))
                .isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree("{\"utc\": \"2025-01-01T00:00:00Z\"}")))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree("12.5"))).isNull();
        assertThat(MeasurementFields.parseInstant("-1700000000000")).isEqualTo(Instant.ofEpochMilli(-1_700_000_000_000L));
    }

    @Test
    void epochNumbersOutsideTheInstantRangeAreRejectedNotThrown() throws Exception {
        assertThat(MeasurementFields.parseInstant(String.valueOf(Long.MIN_VALUE))).isNull();
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree(String.valueOf(Long.MIN_VALUE)))).isNull();
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree("9223372036854775808"))).isNull();
        assertThat(MeasurementFields.parseInstant(MAPPER.readTree("-99999999999999999999999"))).isNull();
    }

    @Test
    void valuesMustBeFiniteNumbers() throws Exception {
        assertThat(MeasurementFields.parseValue(" 3.5 ")).isEqualTo(3.5);
        assertThat(MeasurementFields.parseValue("NaN")).isNull();
        assertThat(MeasurementFields.parseValue("Infinity")).isNull();
        assertThat(MeasurementFields.parseValue("abc")).isNull();
        assertThat(MeasurementFields.parseValue(MAPPER.readTree("7"))).isEqualTo(7.0);
        assertThat(MeasurementFields.parseValue(MAPPER.readTree("true"))).isNull();
        assertThat(MeasurementFields.parseValue(MAPPER.readTree("{\"v\": 1}"))).isNull();
    }

    @Test
    void identifiersAreBoundedAndNonEmpty() {
        assertThat(MeasurementFields.isValidIdentifier("dev-1")).isTrue();
        assertThat(MeasurementFields.isValidIdentifier("")).isFalse();
        assertThat(MeasurementFields.isValidIdentifier("x".repeat(255))).isTrue();
        assertThat(MeasurementFields.isValidIdentifier("x".repeat(256))).isFalse();
    }

    @Test
    void formatDetectionPrefersDeclaredTypeThenExtensionThenContent() {
        byte[] json = "  [ ]".getBytes(StandardCharsets.UTF_8);
        byte[] csv = "device_id,metric".getBytes(StandardCharsets.UTF_8);

        assertThat(PayloadFormat.detect("application/json; charset=UTF-8", "data.csv", csv)).isEqualTo(PayloadFormat.JSON);
        assertThat(PayloadFormat.detect("application/octet-stream", "data.csv", json)).isEqualTo(PayloadFormat.CSV);
        assertThat(PayloadFormat.detect(null, null, json)).isEqualTo(PayloadFormat.JSON);
        assertThat(PayloadFormat.detect(null, "upload.bin", csv)).isEqualTo(PayloadFormat.CSV);
        assertThat(PayloadFormat.fromWire("JSON")).isEqualTo(PayloadFormat.JSON);
    }
}
