package com.plant.flowsheet.util;

import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.api.ExecutorState;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ListenersTest {

    @Test
    public void testCompositeFansOut() {
        List<String> calls = new ArrayList<>();
        ExecutionListener a = new ExecutionListener() {
            @Override
            public void onStepEnd(long step, boolean success) {
                calls.add("a" + step);
            }
        };
        ExecutionListener b = new ExecutionListener() {
            @Override
            public void onStepEnd(long step, boolean success) {
                calls.add("b" + step);
            }
        };
        CompositeExecutionListener composite = new CompositeExecutionListener(a).add(b);
        assertEquals(2, composite.size());

        composite.onStepEnd(3, true);
        composite.onStepStart(3, 0.0);
        assertEquals(List.of("a3", "b3"), calls);
    }

    @Test
    public void testConvergenceTracking() {
        ConvergenceTrackingListener t = new ConvergenceTrackingListener();
        t.onLoopIteration(0, 2, 1, 1.0);
        t.onLoopIteration(0, 2, 2, 0.1);
        t.onStageEnd(0, 2, ExecutorState.CONVERGED, 2, 0.1);
        t.onLoopIteration(1, 2, 1, 0.5);
        t.onStageEnd(1, 2, ExecutorState.ITERATION_CAP_REACHED, 1, 0.5);
        // Linear stage: no iterations reported, not tracked
        t.onStageEnd(1, 0, ExecutorState.CONVERGED, 1, 0.0);

        assertEquals(List.of(2), t.trackedStages());
        assertEquals(List.of(0.5), t.residuals(2));
        assertEquals(List.of(2, 1), t.iterationHistory(2));
        assertEquals(1, t.capHits(2));
        assertTrue(t.residuals(0).isEmpty());
        assertTrue(t.dump().contains("1.50"));

        t.reset();
        assertTrue(t.trackedStages().isEmpty());
    }

    @Test
    public void testErrorRateLimiter() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ListenersTest.class), 60_000);
        RuntimeException boom = new RuntimeException("expected in test");
        assertTrue(limiter.log("first", boom));
        assertFalse(limiter.log("second", boom));
        assertFalse(limiter.log("third", boom));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testLoggingListenerThrottlesNodeErrors() {
        LoggingExecutionListener l = new LoggingExecutionListener(60_000);
        // Must not throw, whatever the log level
        l.onNodeError(0, 0, "n", new IllegalStateException("expected in test"));
        l.onNodeError(1, 0, "n", new IllegalStateException("expected in test"));
        l.onStageEnd(1, 0, ExecutorState.ITERATION_CAP_REACHED, 50, 1.0);
        l.onStepEnd(1, false);
    }
}
