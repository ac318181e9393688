package com.plant.flowsheet.wiring;

import org.junit.Test;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ObservationPublisherTest {

    private static final class CollectingSink implements ObservationSink {
        final List<double[]> rows = new ArrayList<>();
        final List<Long> steps = new ArrayList<>();
        volatile boolean closed;
        int batches;

        @Override
        public void onRow(long step, double time, double[] values, int length) {
            steps.add(step);
            double[] copy = new double[length + 1];
            copy[0] = time;
            System.arraycopy(values, 0, copy, 1, length);
            rows.add(copy);
        }

        @Override
        public void onBatchEnd() {
            batches++;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    public void testRowsArriveInOrderAfterClose() {
        CollectingSink sink = new CollectingSink();
        ObservationPublisher publisher = new ObservationPublisher(sink, 8);
        double[] row = new double[2];
        for (int i = 0; i < 100; i++) {
            row[0] = i;
            row[1] = -i;
            // Same buffer every time: the publisher must copy
            publisher.publish(i, i * 0.5, row);
        }
        publisher.close();

        assertTrue(sink.closed);
        assertEquals(100, sink.rows.size());
        assertTrue(sink.batches >= 1);
        for (int i = 0; i < 100; i++) {
            assertEquals(Long.valueOf(i), sink.steps.get(i));
            assertArrayEquals(new double[] { i * 0.5, i, -i }, sink.rows.get(i), 0.0);
        }
        assertEquals(0, publisher.sinkErrors());
    }

    @Test
    public void testVaryingRowLength() {
        CollectingSink sink = new CollectingSink();
        try (ObservationPublisher publisher = new ObservationPublisher(sink)) {
            publisher.publish(0, 0.0, new double[] { 1.0, 2.0, 3.0 });
            publisher.publish(1, 1.0, new double[] { 4.0 });
        }
        assertArrayEquals(new double[] { 0.0, 1.0, 2.0, 3.0 }, sink.rows.get(0), 0.0);
        assertArrayEquals(new double[] { 1.0, 4.0 }, sink.rows.get(1), 0.0);
    }

    @Test
    public void testFailingSinkDoesNotStopConsumer() {
        CollectingSink good = new CollectingSink();
        ObservationSink flaky = (step, time, values, length) -> {
            if (step % 2 == 0)
                throw new IllegalStateException("disk full");
            good.onRow(step, time, values, length);
        };
        ObservationPublisher publisher = new ObservationPublisher(flaky, 16);
        for (int i = 0; i < 10; i++)
            publisher.publish(i, i, new double[] { i });
        publisher.close();

        assertEquals(5, publisher.sinkErrors());
        assertEquals(5, good.rows.size());
    }

    @Test
    public void testCsvSink() {
        StringWriter out = new StringWriter();
        try (ObservationPublisher publisher = new ObservationPublisher(
                new CsvObservationSink(out, List.of("e1[0]", "e1[1]")), 4)) {
            publisher.publish(0, 0.25, new double[] { 1.5, 2.0 });
            publisher.publish(1, 0.5, new double[] { 3.0, 4.0 });
        }
        assertEquals("step,time,e1[0],e1[1]\n0,0.25,1.5,2.0\n1,0.5,3.0,4.0\n", out.toString());
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishAfterClose() {
        ObservationPublisher publisher = new ObservationPublisher(new CollectingSink(), 4);
        publisher.close();
        publisher.publish(0, 0.0, new double[0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBufferSizeMustBePowerOfTwo() {
        new ObservationPublisher(new CollectingSink(), 100);
    }
}
