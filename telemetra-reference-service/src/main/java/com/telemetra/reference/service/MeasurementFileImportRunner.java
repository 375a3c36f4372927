package com.telemetra.reference.service;

import com.telemetra.service.core.ingest.IngestionResult;
import com.telemetra.service.core.ingest.MeasurementIngestExecutor;
import com.telemetra.service.core.normalize.PayloadFormat;
import com.telemetra.service.core.normalize.RowNormalizer;
import com.telemetra.service.core.normalize.RowSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Imports a local measurement file at startup, e.g.
 * {@code --telemetra.import.file=air_quality.json --telemetra.import.tenant=<uuid>}.
 * Does nothing unless both properties are set.
 */
@Component
@Slf4j
public class MeasurementFileImportRunner implements ApplicationRunner {

    private final RowNormalizer normalizer;
    private final MeasurementIngestExecutor executor;
    private final String file;
    private final String tenant;
    private final int batchSize;

    public MeasurementFileImportRunner(
            RowNormalizer normalizer,
            MeasurementIngestExecutor executor,
            @Value("${telemetra.import.file:}") String file,
            @Value("${telemetra.import.tenant:}") String tenant,
            @Value("${telemetra.import.batch-size:1000}") int batchSize) {
        this.normalizer = normalizer;
        this.executor = executor;
        this.file = file;
        this.tenant = tenant;
        this.batchSize = batchSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (file.isBlank() || tenant.isBlank()) {
            return;
        }
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Import file not found: " + path);
        }
        UUID tenantId = UUID.fromString(tenant.trim());
        importFile(path, tenantId);
    }

    IngestionResult importFile(Path path, UUID tenantId) {
        try {
            PayloadFormat format;
            try (InputStream head = Files.newInputStream(path)) {
                format = PayloadFormat.detect(null, path.getFileName().toString(), head.readNBytes(64));
            }
            log.info("Importing {} as {} for tenant {} (batch size {})", path, format.wireValue(), tenantId, batchSize);
            try (RowSource rows = normalizer.open(Files.newInputStream(path), format)) {
                IngestionResult result = executor.ingest(tenantId, rows, batchSize);
                log.info(
                        "Import finished: created={} rejected={} failed={}",
                        result.created(),
                        result.rejected(),
                        result.failed());
                return result;
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read import file " + path, ex);
        }
    }
}
