package com.telemetra.service.core.job;

import java.util.UUID;

public class IngestionJobNotFoundException extends RuntimeException {

    public IngestionJobNotFoundException(UUID jobId) {
        super("Ingestion job not found: " + jobId);
    }
}
