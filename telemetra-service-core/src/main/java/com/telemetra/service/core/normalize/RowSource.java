package com.telemetra.service.core.normalize;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy sequence of canonical rows with running counters. Malformed rows are skipped and counted;
 * {@link #hasNext()} only throws {@link MalformedPayloadException} when the container itself breaks.
 */
public interface RowSource extends Iterator<MeasurementRow>, Closeable {

    PayloadShape shape();

    /** Rows handed out so far. */
    long accepted();

    /** Rows skipped so far because of row-level defects. */
    long rejected();

    @Override
    void close();

    /** Wraps rows that were already normalized, e.g. to replay a buffered synchronous upload. */
    static RowSource of(PayloadShape shape, List<MeasurementRow> rows, long rejected) {
        return new BufferedRowSource(shape, rows, rejected);
    }
}
