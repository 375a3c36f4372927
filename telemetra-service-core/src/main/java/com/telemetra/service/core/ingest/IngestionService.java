package com.telemetra.service.core.ingest;

import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.job.IngestionJobService;
import com.telemetra.service.core.normalize.PayloadFormat;
import com.telemetra.service.core.normalize.RowNormalizer;
import com.telemetra.service.core.normalize.RowSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Service;

/**
 * Entry point for uploads. Payloads up to {@code telemetra.ingest.async-threshold-bytes} are
 * normalized in full before the first write and ingested on the caller's thread; larger ones
 * become background jobs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private static final int SNIFF_BYTES = 64;

    private final RowNormalizer normalizer;
    private final MeasurementIngestExecutor executor;
    private final IngestionJobService jobService;
    private final TelemetraProperties properties;

    public IngestionOutcome ingest(
            UUID tenantId, String fileName, String contentType, long size, InputStreamSource payload)
            throws IOException {
        PayloadFormat format = detectFormat(fileName, contentType, payload);
        try (InputStream in = payload.getInputStream()) {
            if (size > properties.getIngest().getAsyncThresholdBytes()) {
                log.info("Upload of {} bytes exceeds sync threshold, queuing as job", size);
                return new IngestionOutcome.Queued(jobService.submit(tenantId, fileName, format, in));
            }
            return new IngestionOutcome.Completed(ingestNow(tenantId, format, in));
        }
    }

    /** Normalizes the whole payload, then writes it; a container defect fails before anything is stored. */
    public IngestionResult ingestNow(UUID tenantId, PayloadFormat format, InputStream in) {
        try (RowSource rows = normalizer.buffer(in, format)) {
            return executor.ingest(tenantId, rows, properties.getIngest().getBatchSize());
        }
    }

    public PayloadFormat detectFormat(String fileName, String contentType, InputStreamSource payload)
            throws IOException {
        try (InputStream in = payload.getInputStream()) {
            return PayloadFormat.detect(contentType, fileName, in.readNBytes(SNIFF_BYTES));
        }
    }
}
