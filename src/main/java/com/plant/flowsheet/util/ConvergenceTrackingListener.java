package com.plant.flowsheet.util;

import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.api.ExecutorState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records how loop stages converge.
 *
 * Captures, per loop stage:
 * - the residual of every iteration of the most recent step,
 * - iteration counts of every completed step,
 * - how often the stage hit its iteration cap.
 *
 * Linear stages are ignored.
 */
public final class ConvergenceTrackingListener implements ExecutionListener {
    private final Map<Integer, Track> tracks = new ConcurrentHashMap<>();

    private static final class Track {
        final List<Double> lastResiduals = new ArrayList<>();
        final List<Integer> iterationsPerStep = new ArrayList<>();
        long lastStep = -1;
        int capHits;
    }

    @Override
    public void onLoopIteration(long step, int stageIndex, int iteration, double residual) {
        Track t = tracks.computeIfAbsent(stageIndex, k -> new Track());
        synchronized (t) {
            if (t.lastStep != step) {
                t.lastStep = step;
                t.lastResiduals.clear();
            }
            t.lastResiduals.add(residual);
        }
    }

    @Override
    public void onStageEnd(long step, int stageIndex, ExecutorState outcome, int iterations, double residual) {
        Track t = tracks.get(stageIndex);
        if (t == null)
            return;
        synchronized (t) {
            t.iterationsPerStep.add(iterations);
            if (outcome == ExecutorState.ITERATION_CAP_REACHED)
                t.capHits++;
        }
    }

    /** Residuals of the most recent step of a loop stage, in iteration order. */
    public List<Double> residuals(int stageIndex) {
        Track t = tracks.get(stageIndex);
        if (t == null)
            return List.of();
        synchronized (t) {
            return List.copyOf(t.lastResiduals);
        }
    }

    /** Iterations needed by a loop stage, one entry per step. */
    public List<Integer> iterationHistory(int stageIndex) {
        Track t = tracks.get(stageIndex);
        if (t == null)
            return List.of();
        synchronized (t) {
            return List.copyOf(t.iterationsPerStep);
        }
    }

    public int capHits(int stageIndex) {
        Track t = tracks.get(stageIndex);
        if (t == null)
            return 0;
        synchronized (t) {
            return t.capHits;
        }
    }

    /** Indices of the loop stages seen so far. */
    public List<Integer> trackedStages() {
        List<Integer> out = new ArrayList<>(tracks.keySet());
        Collections.sort(out);
        return out;
    }

    public void reset() {
        tracks.clear();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s | %10s | %10s | %10s | %8s\n", "Stage", "Steps", "Avg iter", "Max iter",
                "Cap hits"));
        sb.append("------------------------------------------------------------\n");
        for (int stage : trackedStages()) {
            List<Integer> history = iterationHistory(stage);
            double avg = history.stream().mapToInt(Integer::intValue).average().orElse(0);
            int max = history.stream().mapToInt(Integer::intValue).max().orElse(0);
            sb.append(String.format("%-8d | %10d | %10.2f | %10d | %8d\n", stage, history.size(), avg, max,
                    capHits(stage)));
        }
        return sb.toString();
    }
}
