package com.plant.flowsheet.engine;

import com.plant.flowsheet.api.Component;
import com.plant.flowsheet.api.ComputationException;
import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.api.ExecutorState;
import com.plant.flowsheet.api.NonConvergenceException;
import com.plant.flowsheet.api.Snapshotable;
import com.plant.flowsheet.graph.EdgeSpec;
import com.plant.flowsheet.graph.FlowsheetGraph;
import com.plant.flowsheet.plan.ExecutionPlan;
import com.plant.flowsheet.plan.LinearStage;
import com.plant.flowsheet.plan.LoopStage;
import com.plant.flowsheet.plan.SolverSettings;
import com.plant.flowsheet.plan.Stage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one simulation step at a time over an {@link ExecutionPlan}.
 *
 * The executor owns the live value of every edge. Components only see the
 * values of the edges feeding them, and only through {@link Component#step}.
 *
 * Algorithm of a step:
 *
 * 1. Snapshot: copy all edge values and the state of every
 * {@link Snapshotable} component.
 *
 * 2. Stages: run the plan's stages in index order. A linear stage evaluates
 * its node once and writes the outputs to the outgoing edges immediately. A
 * loop stage sweeps its nodes in the planned internal order until the tear
 * edges settle:
 * - At the start of each iteration the tear values are frozen. Reads of a tear
 * edge see the frozen value; all other reads see the freshest value.
 * - After the sweep the residual is the largest change of any tear edge,
 * measured with the stage's {@link SolverSettings.ResidualNorm}.
 * - Tear values are relaxed: {@code x = (1-w)*old + w*new}.
 * - The loop ends when the residual drops below tolerance (CONVERGED) or the
 * iteration cap is hit (ITERATION_CAP_REACHED).
 *
 * 3. Commit or roll back: on success every component gets
 * {@link Component#commitStep()} and then listeners get
 * {@code onStepEnd(step, true)}. If any stage, commit or step listener
 * callback throws, edge values and snapshotable component state are restored
 * from the snapshot, listeners are told the step failed, and the exception
 * propagates. A listener that also fails in that failure callback is
 * attached to the original exception as suppressed. The step counter and the simulation time
 * only advance on success. Converged values stay on the edges and are the
 * starting point of the next step (warm start).
 *
 * Parallel mode:
 * With an {@link ExecutorService} set, stages on the same plan level run as
 * concurrent tasks. Such stages share no edges, and levels run strictly in
 * order, so the result equals the sequential run.
 *
 * The executor is single-threaded from the caller's point of view and not
 * reentrant.
 */
public final class FlowsheetExecutor {
    private static final Logger log = LogManager.getLogger(FlowsheetExecutor.class);

    private static final ExecutionListener NO_LISTENER = new ExecutionListener() {
    };

    private final FlowsheetGraph graph;
    private final Component[] components;
    private final int[] snapshotable;

    // Live edge values, indexed by edge. null means "no value yet".
    private final double[][] values;
    // Tear values frozen at the start of the running iteration.
    private final double[][] frozen;
    private final boolean[] tear;

    // Per-node wiring, precomputed from the graph
    private final int[][] inEdgesOf;
    private final String[][] inPortsOf;
    private final int[][] outEdgesOf;
    private final String[] outPortOf;

    private volatile ExecutionPlan plan;
    private volatile ExecutorState state = ExecutorState.IDLE;
    private long stepCount;
    private double time;
    private ExecutionListener listener = NO_LISTENER;
    private ExecutorService executorService;

    /**
     * @param plan       Plan to execute; its graph defines the edges.
     * @param components One component per node, keyed by node id.
     * @throws IllegalArgumentException if a node has no component.
     */
    public FlowsheetExecutor(ExecutionPlan plan, Map<String, Component> components) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.graph = plan.graph();
        final int n = graph.nodeCount();
        final int m = graph.edgeCount();

        this.components = new Component[n];
        List<Integer> stateful = new ArrayList<>();
        for (int ni = 0; ni < n; ni++) {
            Component c = components.get(graph.nodeId(ni));
            if (c == null)
                throw new IllegalArgumentException("No component bound to node '" + graph.nodeId(ni) + "'");
            this.components[ni] = c;
            if (c instanceof Snapshotable)
                stateful.add(ni);
        }
        this.snapshotable = stateful.stream().mapToInt(Integer::intValue).toArray();

        this.tear = new boolean[m];
        for (LoopStage loop : plan.loopStages())
            for (int ei : loop.tearEdges())
                tear[ei] = true;

        this.values = new double[m][];
        this.frozen = new double[m][];
        this.outPortOf = new String[m];
        final int width = plan.settings().streamWidth();
        for (int ei = 0; ei < m; ei++) {
            EdgeSpec e = graph.edge(ei);
            outPortOf[ei] = e.sourcePort();
            if (e.hasInitialValue())
                values[ei] = e.initialValue();
            else if (tear[ei])
                values[ei] = new double[width];
        }

        this.inEdgesOf = new int[n][];
        this.inPortsOf = new String[n][];
        this.outEdgesOf = new int[n][];
        for (int ni = 0; ni < n; ni++) {
            inEdgesOf[ni] = graph.inEdges(ni);
            inPortsOf[ni] = new String[inEdgesOf[ni].length];
            for (int k = 0; k < inEdgesOf[ni].length; k++)
                inPortsOf[ni][k] = graph.edge(inEdgesOf[ni][k]).targetPort();
            outEdgesOf[ni] = graph.outEdges(ni);
        }
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener == null ? NO_LISTENER : listener;
    }

    /**
     * Runs same-level stages on the given service. Pass null to go back to
     * sequential execution. The service is not shut down by the executor.
     */
    public void setExecutorService(ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Advances the simulation by one step of size dt.
     *
     * @return Summary of the step, including the outcome of every loop stage.
     * @throws IllegalArgumentException if dt is not a positive finite number.
     * @throws IllegalStateException    if a step is already running.
     * @throws ComputationException     if a component failed; the step was
     *                                  rolled back.
     * @throws NonConvergenceException  if a loop stage hit its iteration cap
     *                                  under the FAIL policy; the step was
     *                                  rolled back.
     */
    public StepResult advance(double dt) {
        if (!(dt > 0) || Double.isInfinite(dt))
            throw new IllegalArgumentException("dt must be positive and finite: " + dt);
        if (state != ExecutorState.IDLE)
            throw new IllegalStateException("A step is already running (state " + state + ")");

        final long current = stepCount;
        final ExecutionListener l = this.listener;
        final ExecutionPlan p = this.plan;
        final ExecutorService pool = this.executorService;

        double[][] edgeSnapshot = snapshotEdges();
        double[][] componentSnapshot = snapshotComponents();
        LoopOutcome[] outcomes = new LoopOutcome[p.stageCount()];
        boolean ended = false;
        state = ExecutorState.RUNNING_STAGE;
        try {
            l.onStepStart(current, time);
            if (pool == null) {
                for (Stage stage : p.stages())
                    outcomes[stage.index()] = runStage(p, stage, current, dt);
            } else {
                for (List<Integer> level : p.levels())
                    runLevel(p, pool, level, current, dt, outcomes);
            }
            commitAll();
            // A listener fault here still fails the step and rolls it back
            ended = true;
            l.onStepEnd(current, true);
        } catch (RuntimeException e) {
            state = ExecutorState.FAILED;
            restore(edgeSnapshot, componentSnapshot, e);
            log.debug("Step {} rolled back: {}", current, e.getMessage());
            if (!ended) {
                try {
                    l.onStepEnd(current, false);
                } catch (RuntimeException listenerFault) {
                    e.addSuppressed(listenerFault);
                }
            }
            throw e;
        } finally {
            state = ExecutorState.IDLE;
        }

        stepCount++;
        time += dt;
        List<LoopOutcome> loops = Arrays.stream(outcomes).filter(Objects::nonNull).toList();
        return new StepResult(current, time, loops);
    }

    private void runLevel(ExecutionPlan p, ExecutorService pool, List<Integer> level, long step, double dt,
            LoopOutcome[] outcomes) {
        if (level.size() == 1) {
            for (int si : level)
                outcomes[si] = runStage(p, p.stage(si), step, dt);
            return;
        }

        List<Callable<LoopOutcome>> tasks = new ArrayList<>(level.size());
        for (int si : level) {
            Stage stage = p.stage(si);
            tasks.add(() -> runStage(p, stage, step, dt));
        }
        List<Future<LoopOutcome>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException("Interrupted while running level " + p.stage(level.get(0)).level(), e);
        }

        // Report failures in stage order
        RuntimeException first = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes[level.get(i)] = futures.get(i).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                RuntimeException failure = cause instanceof RuntimeException re ? re
                        : new ComputationException(String.valueOf(cause), cause);
                if (first == null)
                    first = failure;
                else
                    first.addSuppressed(failure);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ComputationException("Interrupted while waiting for stage " + level.get(i), e);
            }
        }
        if (first != null)
            throw first;
    }

    private LoopOutcome runStage(ExecutionPlan p, Stage stage, long step, double dt) {
        state = ExecutorState.RUNNING_STAGE;
        try {
            if (stage instanceof LoopStage loop)
                return runLoop(loop, step, dt);

            LinearStage linear = (LinearStage) stage;
            evaluate(linear.node(), linear.index(), step, dt, p.settings());
            listener.onStageEnd(step, linear.index(), ExecutorState.CONVERGED, 1, 0.0);
            return null;
        } catch (ComputationException e) {
            listener.onStageEnd(step, stage.index(), ExecutorState.FAILED, 0, Double.NaN);
            throw e;
        }
    }

    private LoopOutcome runLoop(LoopStage loop, long step, double dt) {
        final SolverSettings s = loop.settings();
        final List<Integer> order = loop.nodes();
        final List<Integer> tears = loop.tearEdges();
        final double w = s.relaxation();

        ExecutorState outcome = ExecutorState.ITERATION_CAP_REACHED;
        double residual = Double.POSITIVE_INFINITY;
        int iteration = 0;
        while (iteration < s.maxIterations()) {
            iteration++;
            for (int ei : tears)
                frozen[ei] = copyInto(frozen[ei], values[ei]);

            for (int ni : order)
                evaluate(ni, loop.index(), step, dt, s);

            residual = 0.0;
            for (int ei : tears) {
                double[] old = frozen[ei];
                double[] now = values[ei];
                residual = Math.max(residual, s.residual(old, now));
                if (w < 1.0 && old.length == now.length)
                    for (int i = 0; i < now.length; i++)
                        now[i] = (1.0 - w) * old[i] + w * now[i];
            }
            listener.onLoopIteration(step, loop.index(), iteration, residual);

            if (residual < s.tolerance()) {
                outcome = ExecutorState.CONVERGED;
                break;
            }
        }

        state = outcome;
        listener.onStageEnd(step, loop.index(), outcome, iteration, residual);
        log.debug("Step {} loop stage {}: {} after {} iterations (residual {})", step, loop.index(), outcome,
                iteration, residual);

        if (outcome == ExecutorState.ITERATION_CAP_REACHED) {
            if (s.nonConvergencePolicy() == SolverSettings.NonConvergencePolicy.FAIL)
                throw new NonConvergenceException(loop.index(), loop.nodeIds(), iteration, residual, s.tolerance());
            log.warn("Step {}: loop stage {} {} accepted unconverged after {} iterations (residual {}, tolerance {})",
                    step, loop.index(), loop.nodeIds(), iteration, residual, s.tolerance());
        }
        return new LoopOutcome(loop.index(), loop.nodeIds(), outcome, iteration, residual);
    }

    /**
     * Steps one component and writes its outputs to every edge leaving the
     * produced ports.
     */
    private void evaluate(int ni, int stageIndex, long step, double dt, SolverSettings s) {
        final String nodeId = graph.nodeId(ni);
        final int[] ins = inEdgesOf[ni];
        Map<String, double[]> inputs = new HashMap<>(ins.length * 2);
        for (int k = 0; k < ins.length; k++) {
            int ei = ins[k];
            double[] v = tear[ei] ? frozen[ei] : values[ei];
            if (v != null)
                inputs.put(inPortsOf[ni][k], v);
        }

        Map<String, double[]> outputs;
        long start = System.nanoTime();
        try {
            outputs = components[ni].step(inputs, dt);
        } catch (ComputationException e) {
            throw fail(step, stageIndex, nodeId, e.forNode(nodeId));
        } catch (RuntimeException e) {
            throw fail(step, stageIndex, nodeId,
                    new ComputationException(nodeId, e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
        long duration = System.nanoTime() - start;

        if (outputs == null)
            throw fail(step, stageIndex, nodeId, new ComputationException(nodeId, "step returned no outputs", null));
        if (s.rejectNonFinite()) {
            for (Map.Entry<String, double[]> out : outputs.entrySet()) {
                double[] v = out.getValue();
                if (v == null)
                    continue;
                for (int i = 0; i < v.length; i++)
                    if (!Double.isFinite(v[i]))
                        throw fail(step, stageIndex, nodeId, new ComputationException(nodeId,
                                "non-finite value " + v[i] + " on port '" + out.getKey() + "' at index " + i, null));
            }
        }

        for (int ei : outEdgesOf[ni]) {
            double[] v = outputs.get(outPortOf[ei]);
            if (v != null)
                values[ei] = copyInto(values[ei], v);
        }
        listener.onNodeEvaluated(step, stageIndex, nodeId, duration);
    }

    private void commitAll() {
        for (int ni = 0; ni < components.length; ni++) {
            try {
                components[ni].commitStep();
            } catch (RuntimeException e) {
                throw new ComputationException(graph.nodeId(ni), "commit failed: " + e.getMessage(), e);
            }
        }
    }

    private ComputationException fail(long step, int stageIndex, String nodeId, ComputationException e) {
        listener.onNodeError(step, stageIndex, nodeId, e);
        return e;
    }

    private double[][] snapshotEdges() {
        double[][] copy = new double[values.length][];
        for (int ei = 0; ei < values.length; ei++)
            copy[ei] = values[ei] == null ? null : values[ei].clone();
        return copy;
    }

    private double[][] snapshotComponents() {
        double[][] copy = new double[snapshotable.length][];
        for (int i = 0; i < snapshotable.length; i++)
            copy[i] = ((Snapshotable) components[snapshotable[i]]).captureState();
        return copy;
    }

    private void restore(double[][] edgeSnapshot, double[][] componentSnapshot, RuntimeException failure) {
        System.arraycopy(edgeSnapshot, 0, values, 0, values.length);
        for (int i = 0; i < snapshotable.length; i++) {
            try {
                ((Snapshotable) components[snapshotable[i]]).restoreState(componentSnapshot[i]);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }

    private static double[] copyInto(double[] target, double[] source) {
        if (target == null || target.length != source.length)
            return source.clone();
        System.arraycopy(source, 0, target, 0, source.length);
        return target;
    }

    /**
     * Replaces the solver settings of every loop stage. Typically used to
     * retry with a looser tolerance or stronger relaxation after a
     * {@link NonConvergenceException}.
     */
    public void updateSolverSettings(SolverSettings settings) {
        requireIdle("update solver settings");
        this.plan = plan.withSettings(Objects.requireNonNull(settings, "settings"));
        log.info("Solver settings updated: {}", settings);
    }

    /** Returns a copy of the current value of an edge, or null if it has none yet. */
    public double[] edgeValue(String edgeId) {
        double[] v = values[graph.edgeIndex(edgeId)];
        return v == null ? null : v.clone();
    }

    /**
     * Seeds an edge, for example to give a tear edge a better initial guess.
     * Only allowed between steps.
     */
    public void setEdgeValue(String edgeId, double[] value) {
        requireIdle("set edge values");
        Objects.requireNonNull(value, "value");
        values[graph.edgeIndex(edgeId)] = value.clone();
    }

    public boolean isTearEdge(String edgeId) {
        return tear[graph.edgeIndex(edgeId)];
    }

    private void requireIdle(String action) {
        if (state != ExecutorState.IDLE)
            throw new IllegalStateException("Cannot " + action + " while a step is running");
    }

    public ExecutorState state() {
        return state;
    }

    /** Number of completed steps. */
    public long stepCount() {
        return stepCount;
    }

    /** Simulation time after the last completed step. */
    public double time() {
        return time;
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public FlowsheetGraph graph() {
        return graph;
    }

    /** The component bound to a node. */
    public Component component(String nodeId) {
        return components[graph.nodeIndex(nodeId)];
    }
}
