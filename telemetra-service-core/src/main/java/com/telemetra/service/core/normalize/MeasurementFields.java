package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field alias table and value coercions shared by every payload shape.
 *
 * <p>Aliases are matched case-insensitively and in declaration order; the first alias carrying a
 * non-empty value wins.
 */
public final class MeasurementFields {

    public static final List<String> DEVICE_ALIASES =
            List.of("device_id", "deviceid", "device", "location", "sensor", "sensor_id", "name");
    public static final List<String> METRIC_ALIASES =
            List.of("metric", "parameter", "measurement", "type", "metric_name");
    public static final List<String> TIMESTAMP_ALIASES =
            List.of("recorded_at", "timestamp", "time", "datetime", "date", "created_at");
    public static final List<String> VALUE_ALIASES = List.of("value", "reading", "amount");
    public static final String TAGS_FIELD = "tags";

    /** Keys never copied into tags because they feed canonical columns. */
    public static final Set<String> RESERVED_KEYS;

    public static final int MAX_IDENTIFIER_LENGTH = 255;

    // Epoch numbers at or above this are milliseconds (~ year 5138 in seconds).
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;
    private static final Pattern EPOCH_DIGITS = Pattern.compile("-?\\d{1,19}");

    private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM:ss", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHmm", "Z")
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    static {
        Set<String> reserved = new LinkedHashSet<>();
        reserved.addAll(DEVICE_ALIASES);
        reserved.addAll(METRIC_ALIASES);
        reserved.addAll(TIMESTAMP_ALIASES);
        reserved.addAll(VALUE_ALIASES);
        reserved.add(TAGS_FIELD);
        RESERVED_KEYS = Set.copyOf(reserved);
    }

    private MeasurementFields() {}

    /**
     * Parses an absolute instant. Values without a zone offset are not absolute and yield {@code null}.
     */
    public static Instant parseInstant(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        if (EPOCH_DIGITS.matcher(s).matches()) {
            try {
                return fromEpoch(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        try {
            TemporalAccessor parsed = OFFSET_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime odt ? odt.toInstant() : null;
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * JSON variant: numbers are epoch seconds (or millis when large), objects may carry {@code utc}
     * or {@code local} as exported by OpenAQ.
     */
    public static Instant parseInstant(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? fromEpoch(node.longValue()) : null;
        }
        if (node.isObject()) {
            JsonNode utc = node.get("utc");
            if (utc != null && !utc.isNull()) return parseInstant(utc);
            JsonNode local = node.get("local");
            return local == null ? null : parseInstant(local);
        }
        if (node.isTextual()) {
            return parseInstant(node.asText());
        }
        return null;
    }

    /** Finite numbers only; anything else is treated as an absent reading. */
    public static Double parseValue(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static Double parseValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) {
            double d = node.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (node.isTextual()) {
            return parseValue(node.asText());
        }
        return null;
    }

    /** Scalar text of a node, trimmed; containers and nulls become the empty string. */
    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) return "";
        return node.asText().trim();
    }

    public static boolean isValidIdentifier(String s) {
        return s != null && !s.isEmpty() && s.length() <= MAX_IDENTIFIER_LENGTH;
    }

    /** {@code null} when the instant is outside the supported range. */
    private static Instant fromEpoch(long epoch) {
        try {
            boolean millis = epoch <= -EPOCH_MILLIS_THRESHOLD || epoch >= EPOCH_MILLIS_THRESHOLD;
            return millis ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        } catch (DateTimeException ex) {
            return null;
        }
    }
}
