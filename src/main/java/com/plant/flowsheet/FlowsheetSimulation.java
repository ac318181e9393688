package com.plant.flowsheet;

import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.engine.FlowsheetExecutor;
import com.plant.flowsheet.engine.StepResult;
import com.plant.flowsheet.io.CompiledFlowsheet;
import com.plant.flowsheet.io.FlowsheetCompiler;
import com.plant.flowsheet.io.FlowsheetDefinition;
import com.plant.flowsheet.io.FlowsheetLoader;
import com.plant.flowsheet.util.CompositeExecutionListener;
import com.plant.flowsheet.util.ConvergenceTrackingListener;
import com.plant.flowsheet.util.LoggingExecutionListener;
import com.plant.flowsheet.util.PlanExplain;
import com.plant.flowsheet.wiring.ObservationPublisher;
import com.plant.flowsheet.wiring.ObservationSink;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * High-level driver: load a flowsheet, run it for a duration, collect the
 * observed streams.
 *
 * This class handles:
 * <ul>
 * <li>Loading and compiling the JSON definition</li>
 * <li>Setting up the {@link FlowsheetExecutor} with a composite listener
 * (logging by default)</li>
 * <li>Recording the observed edges after every step into an
 * {@link ObservationTable}</li>
 * <li>Optionally streaming the same rows to a sink through the
 * {@link ObservationPublisher}</li>
 * </ul>
 *
 * The column layout is fixed on the first recorded row. An observed edge that
 * has no value yet contributes {@code streamWidth} columns of NaN. Values past
 * the fixed width of an edge are dropped with a warning.
 */
public class FlowsheetSimulation implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(FlowsheetSimulation.class);

    private final CompiledFlowsheet compiled;
    private final FlowsheetExecutor executor;
    private final CompositeExecutionListener listeners = new CompositeExecutionListener();
    private final List<String> observed;
    private final Set<String> truncated = new HashSet<>();

    private int[] widths;
    private double[] rowBuffer;
    private ObservationTable table;
    private Function<List<String>, ObservationSink> sinkFactory;
    private ObservationPublisher publisher;

    public FlowsheetSimulation(Path jsonPath) {
        this(FlowsheetLoader.load(jsonPath));
    }

    /** Loads a definition from the classpath, e.g. {@code flowsheets/recycle_demo.json}. */
    public static FlowsheetSimulation fromResource(String resource) {
        return new FlowsheetSimulation(FlowsheetLoader.loadResource(resource));
    }

    public FlowsheetSimulation(FlowsheetDefinition definition) {
        this(new FlowsheetCompiler().compile(definition));
    }

    public FlowsheetSimulation(CompiledFlowsheet compiled) {
        this.compiled = compiled;
        this.executor = compiled.newExecutor();
        this.observed = new ArrayList<>(compiled.observed());
        listeners.add(new LoggingExecutionListener());
        executor.setListener(listeners);
        if (log.isDebugEnabled())
            log.debug("\n{}", new PlanExplain(compiled.plan(), compiled.labels()).describe());
    }

    /** Adds a listener next to the built-in logging listener. */
    public FlowsheetSimulation addListener(ExecutionListener listener) {
        listeners.add(listener);
        return this;
    }

    public ConvergenceTrackingListener enableConvergenceTracking() {
        ConvergenceTrackingListener tracker = new ConvergenceTrackingListener();
        listeners.add(tracker);
        return tracker;
    }

    /** Runs same-level stages on the given service. The caller owns the service. */
    public FlowsheetSimulation parallel(ExecutorService service) {
        executor.setExecutorService(service);
        return this;
    }

    /**
     * Adds an edge to the observed set. Only allowed before the first step.
     */
    public FlowsheetSimulation observe(String edgeId) {
        if (widths != null)
            throw new IllegalStateException("Observation layout is fixed once the first step has run");
        if (!compiled.graph().containsEdge(edgeId))
            throw new IllegalArgumentException("Unknown edge: " + edgeId);
        if (!observed.contains(edgeId))
            observed.add(edgeId);
        return this;
    }

    /**
     * Streams every recorded row to a sink on a background thread. The factory
     * receives the column names once the layout is known.
     */
    public FlowsheetSimulation streamTo(Function<List<String>, ObservationSink> sinkFactory) {
        if (widths != null)
            throw new IllegalStateException("Streaming must be configured before the first step");
        this.sinkFactory = sinkFactory;
        return this;
    }

    /** Advances one step and records the observed edges. */
    public StepResult step(double dt) {
        StepResult result = executor.advance(dt);
        record(result);
        return result;
    }

    /**
     * Advances {@code ceil(duration / dt)} steps.
     *
     * @return The table of observations, including rows of earlier steps.
     */
    public ObservationTable run(double dt, double duration) {
        if (!(dt > 0))
            throw new IllegalArgumentException("dt must be positive: " + dt);
        if (!(duration >= 0))
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        // Absorb rounding so that 1.0 / 0.1 gives 10 steps, not 11
        long steps = (long) Math.ceil(duration / dt - 1e-9);

        log.info("Simulating '{}' for {} steps of {} (t = {} .. {})", compiled.name(), steps, dt, executor.time(),
                executor.time() + steps * dt);
        long start = System.nanoTime();
        int unconverged = 0;
        for (long i = 0; i < steps; i++)
            unconverged += step(dt).unconvergedLoops().size();
        log.info("Simulation '{}' finished at t = {} in {} ms ({} unconverged loop solves)", compiled.name(),
                executor.time(), (System.nanoTime() - start) / 1_000_000, unconverged);
        return table();
    }

    /**
     * Observations so far. Before the first step this is an empty table with
     * no columns, and the layout stays open for {@link #observe} and
     * {@link #streamTo}.
     */
    public ObservationTable table() {
        return table != null ? table : new ObservationTable(List.of());
    }

    private void record(StepResult result) {
        if (widths == null)
            initLayout();
        int pos = 0;
        for (int k = 0; k < observed.size(); k++) {
            double[] v = executor.edgeValue(observed.get(k));
            int w = widths[k];
            if (v != null && v.length > w && truncated.add(observed.get(k)))
                log.warn("Edge '{}' carries {} values but only the first {} are recorded (step {})",
                        observed.get(k), v.length, w, result.step());
            for (int i = 0; i < w; i++)
                rowBuffer[pos + i] = v != null && i < v.length ? v[i] : Double.NaN;
            pos += w;
        }
        table.onRow(result.step(), result.time(), rowBuffer, rowBuffer.length);
        if (publisher != null)
            publisher.publish(result.step(), result.time(), rowBuffer);
    }

    private void initLayout() {
        int fallback = compiled.plan().settings().streamWidth();
        widths = new int[observed.size()];
        List<String> columns = new ArrayList<>();
        for (int k = 0; k < observed.size(); k++) {
            double[] v = executor.edgeValue(observed.get(k));
            widths[k] = v != null ? v.length : fallback;
            for (int i = 0; i < widths[k]; i++)
                columns.add(observed.get(k) + "[" + i + "]");
        }
        rowBuffer = new double[Arrays.stream(widths).sum()];
        table = new ObservationTable(columns);
        if (sinkFactory != null)
            publisher = new ObservationPublisher(sinkFactory.apply(columns));
    }

    public FlowsheetExecutor executor() {
        return executor;
    }

    public CompiledFlowsheet compiled() {
        return compiled;
    }

    public double[] edgeValue(String edgeId) {
        return executor.edgeValue(edgeId);
    }

    /** Drains and closes the observation stream, if any. */
    @Override
    public void close() {
        if (publisher != null)
            publisher.close();
    }
}
