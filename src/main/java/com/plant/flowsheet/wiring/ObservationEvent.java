package com.plant.flowsheet.wiring;

/**
 * Mutable carrier of one observation row inside the ring buffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * the life of the publisher. The value buffer grows to the widest row seen
 * and is then reused, so steady-state publishing does not allocate.
 */
public final class ObservationEvent {
    private long step;
    private double time;
    private double[] values = new double[0];
    private int length;

    /** Copies a row into this event. */
    public void set(long step, double time, double[] row) {
        this.step = step;
        this.time = time;
        if (values.length < row.length)
            values = new double[row.length];
        System.arraycopy(row, 0, values, 0, row.length);
        this.length = row.length;
    }

    public long step() {
        return step;
    }

    public double time() {
        return time;
    }

    /** Backing buffer; only the first {@link #length()} entries are valid. */
    public double[] values() {
        return values;
    }

    public int length() {
        return length;
    }

    public void clear() {
        step = 0;
        time = 0;
        length = 0;
    }
}
