package com.plant.flowsheet.io;

import com.plant.flowsheet.api.ComponentFactory;
import com.plant.flowsheet.api.InvalidParameterException;
import com.plant.flowsheet.api.UnknownComponentTypeException;
import com.plant.flowsheet.component.AffineComponent;
import com.plant.flowsheet.component.CombinerComponent;
import com.plant.flowsheet.component.FirstOrderTankComponent;
import com.plant.flowsheet.component.InfluentComponent;
import com.plant.flowsheet.component.SinkComponent;
import com.plant.flowsheet.component.SplitterComponent;
import com.plant.flowsheet.component.Streams;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.plant.flowsheet.io.FlowsheetCompiler.getInt;
import static com.plant.flowsheet.io.FlowsheetCompiler.getVector;
import static com.plant.flowsheet.io.FlowsheetCompiler.requireDouble;
import static com.plant.flowsheet.io.FlowsheetCompiler.requireVector;

/**
 * Registry mapping component-type tags to their default ports and factories.
 */
public final class ComponentRegistry {

    /**
     * Metadata of one component type.
     *
     * @param inputs  Input ports used when a node declares none.
     * @param outputs Output ports used when a node declares none.
     */
    public record ComponentType(String name, List<String> inputs, List<String> outputs, ComponentFactory factory) {
        public ComponentType {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }
    }

    private final Map<String, ComponentType> registry = new LinkedHashMap<>();

    public ComponentRegistry() {
        registerBuiltIns();
    }

    public ComponentRegistry register(String type, List<String> inputs, List<String> outputs,
            ComponentFactory factory) {
        registry.put(type, new ComponentType(type, inputs, outputs, factory));
        return this;
    }

    /** Makes an existing type available under a second tag. */
    public ComponentRegistry alias(String alias, String type) {
        ComponentType target = registry.get(type);
        if (target == null)
            throw new IllegalArgumentException("Cannot alias unknown type " + type);
        registry.put(alias, target);
        return this;
    }

    /** Returns the metadata for a type, or null. */
    public ComponentType get(String type) {
        return registry.get(type);
    }

    /**
     * @throws UnknownComponentTypeException if nothing is registered under the
     *                                       tag.
     */
    public ComponentType require(String nodeId, String type) {
        ComponentType t = type == null ? null : registry.get(type);
        if (t == null)
            throw new UnknownComponentTypeException(nodeId, type);
        return t;
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    // ── Built-in Factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        register("influent", List.of(), List.of("out_main"), (id, p, in, out) -> {
            double[] composition = p.containsKey("y_in_constant") ? requireVector(id, p, "y_in_constant")
                    : requireVector(id, p, "composition");
            return new InfluentComponent(port(id, out, "output"), composition);
        });
        alias("influent_static", "influent");

        register("combiner", List.of("in_1", "in_2"), List.of("out_combined"), (id, p, in, out) -> {
            if (in.isEmpty())
                throw new InvalidParameterException(id, "inputs", "must declare at least one input port");
            return new CombinerComponent(in, port(id, out, "output"), flowIndex(id, p));
        });

        register("splitter", List.of("in_main"), List.of("out_1", "out_2"), (id, p, in, out) -> {
            String input = port(id, in, "input");
            int flowIndex = flowIndex(id, p);
            try {
                if (p.containsKey("ratios"))
                    return SplitterComponent.ratio(input, out, requireVector(id, p, "ratios"), flowIndex);
                if (p.containsKey("threshold"))
                    return SplitterComponent.threshold(input, out, requireDouble(id, p, "threshold"), flowIndex);
                if (p.containsKey("qintr"))
                    return SplitterComponent.fixedSecond(input, out, requireDouble(id, p, "qintr"), flowIndex);
                if (p.containsKey("recycleFlow"))
                    return SplitterComponent.fixedSecond(input, out, requireDouble(id, p, "recycleFlow"), flowIndex);
            } catch (IllegalArgumentException e) {
                throw new InvalidParameterException(id, "ratios", e.getMessage());
            }
            throw new InvalidParameterException(id, "ratios", "is required (or 'threshold' / 'recycleFlow')");
        });

        register("affine", List.of("in"), List.of("out"), (id, p, in, out) -> new AffineComponent(
                port(id, in, "input"), port(id, out, "output"),
                getVector(id, p, "gain", new double[] { 1.0 }),
                getVector(id, p, "offset", new double[] { 0.0 })));

        register("first_order", List.of("in_main"), List.of("out_main"), (id, p, in, out) -> {
            double tau = requireDouble(id, p, "tau");
            if (!(tau > 0))
                throw new InvalidParameterException(id, "tau", "must be positive, got " + tau);
            return new FirstOrderTankComponent(port(id, in, "input"), port(id, out, "output"), tau,
                    getVector(id, p, "initial", null));
        });

        register("sink", List.of("in_main"), List.of("out_final"), (id, p, in, out) -> new SinkComponent(
                port(id, in, "input"), out.isEmpty() ? null : out.get(0)));
        alias("effluent", "sink");
    }

    private static int flowIndex(String nodeId, Map<String, Object> p) {
        int idx = getInt(nodeId, p, "flowIndex", Streams.ASM1_FLOW_INDEX);
        if (idx < 0)
            throw new InvalidParameterException(nodeId, "flowIndex", "must not be negative");
        return idx;
    }

    private static String port(String nodeId, List<String> ports, String kind) {
        if (ports.isEmpty())
            throw new InvalidParameterException(nodeId, kind + "s", "must declare at least one " + kind + " port");
        return ports.get(0);
    }
}
