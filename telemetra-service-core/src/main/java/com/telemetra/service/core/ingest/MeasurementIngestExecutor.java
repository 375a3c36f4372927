package com.telemetra.service.core.ingest;

import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.normalize.MeasurementRow;
import com.telemetra.service.core.normalize.RowSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes normalized rows in fixed-size batches, each batch in its own transaction. A batch that
 * keeps failing is counted as failed and ingestion moves on; committed batches stay committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MeasurementIngestExecutor {

    private final MeasurementRepository repository;
    private final TransactionTemplate txTemplate;
    private final TelemetraProperties properties;

    public IngestionResult ingest(UUID tenantId, RowSource source, int batchSize) {
        return ingest(tenantId, source, batchSize, BatchListener.NONE);
    }

    public IngestionResult ingest(UUID tenantId, RowSource source, int batchSize, BatchListener listener) {
        int size = batchSize > 0 ? batchSize : properties.getIngest().getBatchSize();
        long created = 0;
        long failed = 0;
        int batchNumber = 0;
        List<MeasurementRow> batch = new ArrayList<>(size);
        while (source.hasNext()) {
            batch.add(source.next());
            if (batch.size() >= size) {
                int inserted = persist(tenantId, batch, ++batchNumber, listener);
                if (inserted < 0) {
                    failed += batch.size();
                } else {
                    created += inserted;
                }
                batch = new ArrayList<>(size);
                listener.afterBatch(
                        new IngestionResult(created, source.rejected(), failed),
                        source.accepted() + source.rejected());
            }
        }
        if (!batch.isEmpty()) {
            int inserted = persist(tenantId, batch, ++batchNumber, listener);
            if (inserted < 0) {
                failed += batch.size();
            } else {
                created += inserted;
            }
            listener.afterBatch(
                    new IngestionResult(created, source.rejected(), failed), source.accepted() + source.rejected());
        }
        IngestionResult result = new IngestionResult(created, source.rejected(), failed);
        log.info(
                "Ingested measurements tenant={} shape={} created={} rejected={} failed={}",
                tenantId,
                source.shape(),
                result.created(),
                result.rejected(),
                result.failed());
        return result;
    }

    /** @return rows inserted, or -1 when the batch was given up */
    private int persist(UUID tenantId, List<MeasurementRow> batch, int batchNumber, BatchListener listener) {
        int maxAttempts = Math.max(1, properties.getIngest().getMaxBatchAttempts());
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                Integer inserted = txTemplate.execute(status -> repository.insertIgnoringDuplicates(tenantId, batch));
                return inserted == null ? 0 : inserted;
            } catch (DataAccessResourceFailureException | TransientDataAccessResourceException ex) {
                log.error("Measurement store unavailable while persisting batch of {} rows", batch.size(), ex);
                throw ex;
            } catch (DataAccessException ex) {
                if (!isTransient(ex)) {
                    log.error("Failed to persist batch of {} rows for tenant {}", batch.size(), tenantId, ex);
                    listener.batchFailed(batchNumber, batch.size(), ex);
                    return -1;
                }
                if (attempts >= maxAttempts) {
                    log.error(
                            "Giving up on batch of {} rows for tenant {} after {} attempts",
                            batch.size(),
                            tenantId,
                            attempts,
                            ex);
                    listener.batchFailed(batchNumber, batch.size(), ex);
                    return -1;
                }
                long base = 50L << Math.min(attempts, 6); // capped exponential
                long jitter = ThreadLocalRandom.current().nextLong(base, base * 2);
                long backoffMs = Math.min(jitter, 2_000L);
                log.warn(
                        "Transient failure while persisting measurements. Retrying attempt {}/{} after {} ms",
                        attempts + 1,
                        maxAttempts,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }

    static boolean isTransient(Throwable ex) {
        if (ex instanceof TransientDataAccessException) {
            return true;
        }
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx) {
                String state = sqlEx.getSQLState();
                if ("40P01".equals(state) || "40001".equals(state)) {
                    return true;
                }
            }
            cause = cause.getCause();
        }
        return false;
    }
}
