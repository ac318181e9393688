package com.plant.flowsheet.wiring;

import java.util.concurrent.atomic.AtomicLong;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Streams observation rows from the simulation thread to an
 * {@link ObservationSink} on a dedicated consumer thread.
 *
 * Wiring:
 * - One LMAX Disruptor ring buffer of pre-allocated {@link ObservationEvent}s.
 * - ProducerType.SINGLE: only the simulation thread publishes.
 * - BlockingWaitStrategy: the consumer sleeps when idle, and a full buffer
 * makes the producer wait rather than drop rows.
 *
 * A sink that throws is logged and skipped for that row; the consumer thread
 * stays alive. {@link #close()} drains every published row before returning
 * and then closes the sink.
 */
public final class ObservationPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ObservationPublisher.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<ObservationEvent> disruptor;
    private final RingBuffer<ObservationEvent> ringBuffer;
    private final ObservationSink sink;
    private final AtomicLong sinkErrors = new AtomicLong();
    private volatile boolean closed;

    public ObservationPublisher(ObservationSink sink) {
        this(sink, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize Ring buffer size, a power of two.
     */
    public ObservationPublisher(ObservationSink sink, int bufferSize) {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2: " + bufferSize);
        this.sink = sink;
        this.disruptor = new Disruptor<>(
                ObservationEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.setDefaultExceptionHandler(new LoggingExceptionHandler());
        disruptor.handleEventsWith(new SinkHandler());
        this.ringBuffer = disruptor.start();
    }

    /**
     * Copies a row into the ring buffer. Blocks while the buffer is full.
     *
     * @throws IllegalStateException if the publisher was closed.
     */
    public void publish(long step, double time, double[] row) {
        if (closed)
            throw new IllegalStateException("Publisher is closed");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(step, time, row);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Number of rows the sink failed on. */
    public long sinkErrors() {
        return sinkErrors.get();
    }

    /** Waits for every published row to reach the sink, then closes the sink. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        sink.close();
        log.debug("Observation publisher closed ({} sink errors)", sinkErrors.get());
    }

    private final class SinkHandler implements EventHandler<ObservationEvent> {
        @Override
        public void onEvent(ObservationEvent event, long sequence, boolean endOfBatch) {
            sink.onRow(event.step(), event.time(), event.values(), event.length());
            if (endOfBatch)
                sink.onBatchEnd();
        }
    }

    private final class LoggingExceptionHandler implements ExceptionHandler<ObservationEvent> {
        @Override
        public void handleEventException(Throwable ex, long sequence, ObservationEvent event) {
            sinkErrors.incrementAndGet();
            log.error("Observation sink failed on step {} (sequence {})", event.step(), sequence, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Observation consumer failed to start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Observation consumer failed to shut down", ex);
        }
    }
}
