package com.telemetra.service.core.job;

import com.telemetra.service.core.normalize.PayloadFormat;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionJobService {

    static final int MAX_LIST_LIMIT = 200;

    private final IngestionJobRepository repository;
    private final PayloadSpool spool;
    private final IngestionJobExecutor executor;
    private final Clock clock;

    /** Spools the payload, records a {@code pending} job and dispatches it to the worker pool. */
    public IngestionJob submit(UUID tenantId, String fileName, PayloadFormat format, InputStream payload)
            throws IOException {
        UUID jobId = UUID.randomUUID();
        String ref = spool.store(jobId, payload);
        Instant now = clock.instant();
        IngestionJob job = IngestionJob.builder()
                .id(jobId)
                .tenantId(tenantId)
                .fileName(fileName)
                .sourceFormat(format)
                .payloadRef(ref)
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            repository.insert(job);
        } catch (RuntimeException ex) {
            spool.delete(ref);
            throw ex;
        }
        log.info("Queued ingestion job {} tenant={} file={} format={}", jobId, tenantId, fileName, format.wireValue());
        executor.enqueue(jobId);
        return job;
    }

    public IngestionJob get(UUID tenantId, UUID jobId) {
        return repository.findByTenant(tenantId, jobId).orElseThrow(() -> new IngestionJobNotFoundException(jobId));
    }

    public List<IngestionJob> list(UUID tenantId, Integer limit) {
        int lim = (limit == null || limit <= 0) ? 20 : Math.min(limit, MAX_LIST_LIMIT);
        return repository.findRecent(tenantId, lim);
    }
}
