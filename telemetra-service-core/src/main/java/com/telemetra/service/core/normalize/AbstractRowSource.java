package com.telemetra.service.core.normalize;

import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;

/** Look-ahead iterator skeleton: subclasses return the next well-formed row or {@code null} at the end. */
@Slf4j
abstract class AbstractRowSource implements RowSource {

    private final PayloadShape shape;
    private MeasurementRow lookahead;
    private boolean exhausted;
    private long accepted;
    private long rejected;

    AbstractRowSource(PayloadShape shape) {
        this.shape = shape;
    }

    /** Reads until a well-formed row is found; calls {@link #reject} for each skipped one. */
    protected abstract MeasurementRow fetchNext();

    protected void reject(long position, String reason) {
        rejected++;
        if (log.isDebugEnabled()) {
            log.debug("Rejected {} row #{}: {}", shape, position, reason);
        }
    }

    @Override
    public PayloadShape shape() {
        return shape;
    }

    @Override
    public long accepted() {
        return accepted;
    }

    @Override
    public long rejected() {
        return rejected;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (exhausted) return false;
        lookahead = fetchNext();
        if (lookahead == null) {
            exhausted = true;
            return false;
        }
        return true;
    }

    @Override
    public MeasurementRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        MeasurementRow row = lookahead;
        lookahead = null;
        accepted++;
        return row;
    }
}
