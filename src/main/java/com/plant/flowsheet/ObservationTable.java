package com.plant.flowsheet;

import com.plant.flowsheet.wiring.ObservationSink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory time series of observed edge values, one row per step.
 *
 * Columns are named {@code edgeId[i]}, one per element of each observed
 * stream vector. Safe to fill from a publisher thread and read afterwards.
 */
public final class ObservationTable implements ObservationSink {
    private final List<String> columns;
    private final List<double[]> rows = new ArrayList<>();
    private final List<Double> times = new ArrayList<>();
    private final List<Long> steps = new ArrayList<>();

    public ObservationTable(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public synchronized void onRow(long step, double time, double[] values, int length) {
        steps.add(step);
        times.add(time);
        rows.add(Arrays.copyOf(values, length));
    }

    public List<String> columns() {
        return columns;
    }

    public synchronized int rowCount() {
        return rows.size();
    }

    public synchronized double time(int row) {
        return times.get(row);
    }

    public synchronized long step(int row) {
        return steps.get(row);
    }

    public synchronized double[] row(int row) {
        return rows.get(row).clone();
    }

    public synchronized double value(int row, String column) {
        return rows.get(row)[columnIndex(column)];
    }

    /** All values of one column, in row order. */
    public synchronized double[] column(String column) {
        int c = columnIndex(column);
        double[] out = new double[rows.size()];
        for (int r = 0; r < out.length; r++)
            out[r] = rows.get(r)[c];
        return out;
    }

    public synchronized double[] lastRow() {
        if (rows.isEmpty())
            throw new IllegalStateException("Table is empty");
        return rows.get(rows.size() - 1).clone();
    }

    private int columnIndex(String column) {
        int c = columns.indexOf(column);
        if (c < 0)
            throw new IllegalArgumentException("Unknown column: " + column);
        return c;
    }
}
