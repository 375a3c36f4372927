package com.telemetra.service.core.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent job registry. Every mutating method is conditional on the current status and returns
 * whether a row was changed; a terminal job is never modified.
 */
public interface IngestionJobRepository {

    void insert(IngestionJob job);

    Optional<IngestionJob> findById(UUID jobId);

    Optional<IngestionJob> findByTenant(UUID tenantId, UUID jobId);

    List<IngestionJob> findRecent(UUID tenantId, int limit);

    List<UUID> findPendingIds(int limit);

    /** {@code pending -> processing}; false when another worker got there first. */
    boolean claim(UUID jobId, Instant now);

    boolean updateTotal(UUID jobId, long totalRows, Instant now);

    /** Counters only move forward. */
    boolean updateProgress(UUID jobId, long processedRows, long failedRows, long rejectedRows, int progress, Instant now);

    boolean complete(UUID jobId, long processedRows, long failedRows, long rejectedRows, long totalRows, Instant now);

    /** Appends one {@link IngestionJob#logLine} to a {@code processing} job; dropped once the log is full. */
    boolean appendLog(UUID jobId, String message, Instant now);

    /** Also appends {@code Error: <errorMessage>} to the job log. */
    boolean fail(UUID jobId, String errorMessage, Instant now);

    /**
     * Fails {@code processing} jobs that have not reported since {@code staleBefore}, logging the error
     * the same way as {@link #fail}.
     *
     * @return payload references of the jobs that were failed
     */
    List<String> failStale(Instant staleBefore, String errorMessage, Instant now);
}
