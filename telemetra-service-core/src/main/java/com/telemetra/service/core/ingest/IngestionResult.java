package com.telemetra.service.core.ingest;

/**
 * Counters of one ingestion run.
 *
 * @param created rows actually inserted; natural-key duplicates are not counted
 * @param rejected rows the normalizer skipped
 * @param failed rows of batches that could not be persisted
 */
public record IngestionResult(long created, long rejected, long failed) {

    public static IngestionResult empty() {
        return new IngestionResult(0, 0, 0);
    }
}
