package com.plant.flowsheet.util;

import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.api.ExecutorState;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link ExecutionListener}s, in registration
 * order, without allocating per callback.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public CompositeExecutionListener(ExecutionListener... initial) {
        for (ExecutionListener l : initial)
            add(l);
    }

    public synchronized CompositeExecutionListener add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStepStart(long step, double time) {
        for (ExecutionListener l : listeners)
            l.onStepStart(step, time);
    }

    @Override
    public void onNodeEvaluated(long step, int stageIndex, String nodeId, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeEvaluated(step, stageIndex, nodeId, durationNanos);
    }

    @Override
    public void onLoopIteration(long step, int stageIndex, int iteration, double residual) {
        for (ExecutionListener l : listeners)
            l.onLoopIteration(step, stageIndex, iteration, residual);
    }

    @Override
    public void onStageEnd(long step, int stageIndex, ExecutorState outcome, int iterations, double residual) {
        for (ExecutionListener l : listeners)
            l.onStageEnd(step, stageIndex, outcome, iterations, residual);
    }

    @Override
    public void onNodeError(long step, int stageIndex, String nodeId, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onNodeError(step, stageIndex, nodeId, error);
    }

    @Override
    public void onStepEnd(long step, boolean success) {
        for (ExecutionListener l : listeners)
            l.onStepEnd(step, success);
    }
}
