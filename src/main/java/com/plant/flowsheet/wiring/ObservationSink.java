package com.plant.flowsheet.wiring;

/**
 * Receives observation rows on the publisher's consumer thread.
 */
public interface ObservationSink extends AutoCloseable {

    /**
     * @param values Row buffer, reused after the call returns. Only the first
     *               {@code length} entries belong to this row.
     */
    void onRow(long step, double time, double[] values, int length);

    /** No more rows are immediately available. */
    default void onBatchEnd() {
    }

    @Override
    default void close() {
    }
}
