package com.telemetra.service.core.job;

import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.ingest.BatchListener;
import com.telemetra.service.core.ingest.IngestionResult;
import com.telemetra.service.core.ingest.MeasurementIngestExecutor;
import com.telemetra.service.core.normalize.MalformedPayloadException;
import com.telemetra.service.core.normalize.PayloadShape;
import com.telemetra.service.core.normalize.RowNormalizer;
import com.telemetra.service.core.normalize.RowSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Drives one job from {@code pending} to a terminal status: claim, count, ingest with progress,
 * then complete or fail. The spooled payload is removed once the job is terminal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionJobRunner {

    private final IngestionJobRepository repository;
    private final PayloadSpool spool;
    private final RowNormalizer normalizer;
    private final MeasurementIngestExecutor ingestExecutor;
    private final TelemetraProperties properties;
    private final Clock clock;

    /** @return true when this call claimed and finished the job */
    public boolean run(UUID jobId) {
        if (!repository.claim(jobId, clock.instant())) {
            log.debug("Ingestion job {} is no longer pending, skipping", jobId);
            return false;
        }
        IngestionJob job = repository
                .findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Claimed job disappeared: " + jobId));
        log.info("Ingestion job {} started file={} format={}", jobId, job.fileName(), job.sourceFormat().wireValue());
        appendLog(jobId, "Started processing " + job.sourceFormat().wireValue() + " file: " + job.fileName());
        try {
            long total = countRows(job);
            repository.updateTotal(jobId, total, clock.instant());

            IngestionResult result;
            try (RowSource source = normalizer.open(spool.open(job.payloadRef()), job.sourceFormat())) {
                result = ingestExecutor.ingest(
                        job.tenantId(), source, properties.getIngest().getBatchSize(), progressListener(jobId, total));
            }
            appendLog(
                    jobId,
                    String.format(
                            "Completed: %d records created, %d rejected, %d failed",
                            result.created(), result.rejected(), result.failed()));
            if (repository.complete(jobId, result.created(), result.failed(), result.rejected(), total, clock.instant())) {
                log.info(
                        "Ingestion job {} completed total={} created={} rejected={} failed={}",
                        jobId,
                        total,
                        result.created(),
                        result.rejected(),
                        result.failed());
            } else {
                log.warn("Ingestion job {} was already terminal when completing", jobId);
            }
        } catch (MalformedPayloadException ex) {
            fail(jobId, "Malformed payload: " + ex.getMessage(), ex);
        } catch (IOException | UncheckedIOException ex) {
            fail(jobId, "Could not read the uploaded payload", ex);
        } catch (DataAccessException ex) {
            fail(jobId, "Measurement store failure: " + ex.getMostSpecificCause().getMessage(), ex);
        } catch (RuntimeException ex) {
            fail(jobId, "Unexpected ingestion error: " + ex.getClass().getSimpleName(), ex);
        } finally {
            spool.delete(job.payloadRef());
        }
        return true;
    }

    private long countRows(IngestionJob job) throws IOException {
        try (RowSource source = normalizer.open(spool.open(job.payloadRef()), job.sourceFormat())) {
            while (source.hasNext()) {
                source.next();
            }
            long total = source.accepted() + source.rejected();
            appendLog(
                    job.id(),
                    String.format(
                            "Detected %s payload with %d records: %d valid, %d rejected",
                            shapeName(source.shape()), total, source.accepted(), source.rejected()));
            return total;
        }
    }

    private BatchListener progressListener(UUID jobId, long total) {
        return new BatchListener() {
            @Override
            public void afterBatch(IngestionResult totals, long rowsRead) {
                repository.updateProgress(
                        jobId,
                        totals.created(),
                        totals.failed(),
                        totals.rejected(),
                        progressOf(rowsRead, total),
                        clock.instant());
            }

            @Override
            public void batchFailed(int batchNumber, int rows, DataAccessException cause) {
                appendLog(
                        jobId,
                        String.format(
                                "Batch %d failed (%d records): %s",
                                batchNumber, rows, cause.getMostSpecificCause().getMessage()));
            }
        };
    }

    private static String shapeName(PayloadShape shape) {
        return switch (shape) {
            case JSON_OBJECT -> "JSON object";
            case JSON_ARRAY -> "JSON array";
            case DELIMITED -> "delimited";
        };
    }

    private void appendLog(UUID jobId, String message) {
        if (!repository.appendLog(jobId, message, clock.instant())) {
            log.debug("Ingestion job {} log line dropped: {}", jobId, message);
        }
    }

    static int progressOf(long rowsRead, long total) {
        if (total <= 0) {
            return 0;
        }
        // 100 is reserved for completion
        return (int) Math.min(99, rowsRead * 100 / total);
    }

    private void fail(UUID jobId, String message, Exception cause) {
        log.error("Ingestion job {} failed: {}", jobId, message, cause);
        try {
            if (!repository.fail(jobId, message, clock.instant())) {
                log.warn("Ingestion job {} was already terminal when failing", jobId);
            }
        } catch (DataAccessException ex) {
            log.error("Could not record failure of ingestion job {}; stale-job sweep will fail it", jobId, ex);
        }
    }
}
