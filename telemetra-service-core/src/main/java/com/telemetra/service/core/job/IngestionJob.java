package com.telemetra.service.core.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.telemetra.service.core.normalize.PayloadFormat;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * Snapshot of a background ingestion job. {@code totalRows} stays null until the payload has been
 * counted; {@code errorMessage} is only set on {@link JobStatus#FAILED}. {@code logs} holds timestamped
 * progress lines, appended while the job runs and capped at {@link #MAX_LOG_CHARS}.
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestionJob(
        UUID id,
        @JsonIgnore UUID tenantId,
        String fileName,
        PayloadFormat sourceFormat,
        @JsonIgnore String payloadRef,
        JobStatus status,
        Long totalRows,
        long processedRows,
        long failedRows,
        long rejectedRows,
        int progress,
        String errorMessage,
        String logs,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt) {

    /** Lines that would grow the log past this size are dropped. */
    public static final int MAX_LOG_CHARS = 65_536;

    static final int MAX_LOG_MESSAGE_CHARS = 1_000;

    /** {@code [instant] message} followed by a newline; long messages are cut. */
    public static String logLine(Instant at, String message) {
        String text = message == null ? "" : message;
        if (text.length() > MAX_LOG_MESSAGE_CHARS) {
            text = text.substring(0, MAX_LOG_MESSAGE_CHARS) + "...";
        }
        return "[" + at + "] " + text + "\n";
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
