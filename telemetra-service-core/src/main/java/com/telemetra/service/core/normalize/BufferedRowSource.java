package com.telemetra.service.core.normalize;

import java.util.List;
import java.util.NoSuchElementException;

final class BufferedRowSource implements RowSource {

    private final PayloadShape shape;
    private final List<MeasurementRow> rows;
    private final long rejected;
    private int position;

    BufferedRowSource(PayloadShape shape, List<MeasurementRow> rows, long rejected) {
        this.shape = shape;
        this.rows = List.copyOf(rows);
        this.rejected = rejected;
    }

    @Override
    public PayloadShape shape() {
        return shape;
    }

    @Override
    public long accepted() {
        return position;
    }

    @Override
    public long rejected() {
        return rejected;
    }

    @Override
    public boolean hasNext() {
        return position < rows.size();
    }

    @Override
    public MeasurementRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return rows.get(position++);
    }

    @Override
    public void close() {}
}
