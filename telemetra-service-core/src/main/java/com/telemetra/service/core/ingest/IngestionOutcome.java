package com.telemetra.service.core.ingest;

import com.telemetra.service.core.job.IngestionJob;

/** Result of an upload: ingested inline, or handed to a background job. */
public sealed interface IngestionOutcome permits IngestionOutcome.Completed, IngestionOutcome.Queued {

    record Completed(IngestionResult result) implements IngestionOutcome {}

    record Queued(IngestionJob job) implements IngestionOutcome {}
}
