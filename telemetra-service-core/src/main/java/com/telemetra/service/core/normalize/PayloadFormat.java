package com.telemetra.service.core.normalize;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Declared or detected encoding of an upload. */
public enum PayloadFormat {
    JSON("json"),
    CSV("csv");

    private final String wireValue;

    PayloadFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static PayloadFormat fromWire(String value) {
        for (PayloadFormat format : values()) {
            if (format.wireValue.equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported source format: " + value);
    }

    /**
     * Resolves the format from the content type and file name, falling back to the first
     * non-whitespace byte of the payload ({@code {} or {@code [} mean JSON).
     */
    public static PayloadFormat detect(String contentType, String fileName, byte[] head) {
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (type.contains("json")) {
            return JSON;
        }
        if (type.contains("csv")) {
            return CSV;
        }
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".csv") || name.endsWith(".txt")) {
            return CSV;
        }
        if (head != null) {
            for (byte b : head) {
                if (Character.isWhitespace(b) || b == (byte) 0xEF || b == (byte) 0xBB || b == (byte) 0xBF) {
                    continue;
                }
                return (b == '{' || b == '[') ? JSON : CSV;
            }
        }
        return CSV;
    }
}
