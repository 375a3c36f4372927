package com.telemetra.service.core.ingest;

import org.springframework.dao.DataAccessException;

/** Callback invoked after every batch with cumulative totals. */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = (totals, rowsRead) -> {};

    /**
     * @param totals cumulative counters so far
     * @param rowsRead records consumed from the source so far, accepted or rejected
     */
    void afterBatch(IngestionResult totals, long rowsRead);

    /**
     * Called when a batch is given up, before {@link #afterBatch}.
     *
     * @param batchNumber 1-based position of the batch in the pass
     */
    default void batchFailed(int batchNumber, int rows, DataAccessException cause) {}
}
