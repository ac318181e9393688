package com.plant.flowsheet.io;

import com.plant.flowsheet.api.Component;
import com.plant.flowsheet.api.ConfigurationException;
import com.plant.flowsheet.api.InvalidParameterException;
import com.plant.flowsheet.api.ParameterResolver;
import com.plant.flowsheet.graph.EdgeSpec;
import com.plant.flowsheet.graph.FlowsheetGraph;
import com.plant.flowsheet.graph.NodeSpec;
import com.plant.flowsheet.plan.ExecutionPlan;
import com.plant.flowsheet.plan.SolverSettings;
import com.plant.flowsheet.plan.StagePlanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link FlowsheetDefinition} into a runnable
 * {@link CompiledFlowsheet}.
 *
 * Steps:
 * 1. Nodes: look up the component type, order the declared ports by position
 * (or take the type's default ports) and resolve parameters.
 * 2. Edges: copy into edge specs; the graph builder validates ids, references
 * and fan-in.
 * 3. Plan the graph with the solver settings of the definition.
 * 4. Instantiate one component per node.
 *
 * Every failure is a {@link ConfigurationException} raised before anything
 * runs.
 */
@Log4j2
public final class FlowsheetCompiler {
    private final ComponentRegistry registry;
    private final StagePlanner planner;

    public FlowsheetCompiler() {
        this(new ComponentRegistry(), new StagePlanner());
    }

    public FlowsheetCompiler(ComponentRegistry registry, StagePlanner planner) {
        this.registry = registry;
        this.planner = planner;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    /**
     * Compiles the definition, resolving parameter references against its own
     * {@code parameterTables}.
     */
    public CompiledFlowsheet compile(FlowsheetDefinition def) {
        return compile(def, new TableParameterResolver(def.getParameterTables()));
    }

    /**
     * Compiles the definition.
     *
     * @param resolver Receives every string parameter value.
     */
    public CompiledFlowsheet compile(FlowsheetDefinition def, ParameterResolver resolver) {
        List<FlowsheetDefinition.NodeDef> nodeDefs = def.getNodes() != null ? def.getNodes() : List.of();
        List<FlowsheetDefinition.EdgeDef> edgeDefs = def.getEdges() != null ? def.getEdges() : List.of();

        // 1. Nodes
        FlowsheetGraph.Builder builder = FlowsheetGraph.builder();
        Map<String, String> labels = new LinkedHashMap<>();
        for (FlowsheetDefinition.NodeDef nd : nodeDefs) {
            if (nd.getId() == null || nd.getId().isBlank())
                throw new ConfigurationException("Node without id (type " + nd.getType() + ")");
            ComponentRegistry.ComponentType type = registry.require(nd.getId(), nd.getType());

            List<String> inputs = nd.getInputs() != null && !nd.getInputs().isEmpty() ? ports(nd.getInputs())
                    : type.inputs();
            List<String> outputs = nd.getOutputs() != null && !nd.getOutputs().isEmpty() ? ports(nd.getOutputs())
                    : type.outputs();
            Map<String, Object> params = resolveParameters(nd.getId(),
                    nd.getParameters() != null ? nd.getParameters() : Collections.emptyMap(), resolver);

            builder.addNode(new NodeSpec(nd.getId(), nd.getType(), params, inputs, outputs));
            if (nd.getLabel() != null)
                labels.put(nd.getId(), nd.getLabel());
        }

        // 2. Edges
        for (int i = 0; i < edgeDefs.size(); i++) {
            FlowsheetDefinition.EdgeDef ed = edgeDefs.get(i);
            if (ed.getId() == null || ed.getId().isBlank())
                throw new ConfigurationException("Edge #" + i + " has no id");
            builder.addEdge(new EdgeSpec(ed.getId(), ed.getSource(), ed.getSourcePort(), ed.getTarget(),
                    ed.getTargetPort(), ed.getInitial()));
        }
        FlowsheetGraph graph = builder.build();

        List<String> observed = def.getObserve() != null ? List.copyOf(def.getObserve()) : List.of();
        for (String edgeId : observed)
            if (!graph.containsEdge(edgeId))
                throw new ConfigurationException("Observed edge '" + edgeId + "' does not exist");

        // 3. Plan
        ExecutionPlan plan = planner.plan(graph, solverSettings(def.getSolver()));

        // 4. Components
        Map<String, Component> components = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (int ni = 0; ni < graph.nodeCount(); ni++) {
            NodeSpec node = graph.node(ni);
            ComponentRegistry.ComponentType type = registry.require(node.id(), node.type());
            try {
                components.put(node.id(),
                        type.factory().create(node.id(), node.parameters(), node.inputPorts(), node.outputPorts()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Node '" + node.id() + "' (" + node.type() + "): " + e.getMessage(),
                        e);
            }
        }

        log.info("Compiled flowsheet '{}': {} nodes, {} edges, {} stages", def.getName(), graph.nodeCount(),
                graph.edgeCount(), plan.stageCount());
        return new CompiledFlowsheet(def.getName(), graph, plan, Collections.unmodifiableMap(components),
                Collections.unmodifiableMap(labels), observed);
    }

    private static List<String> ports(List<FlowsheetDefinition.PortDef> defs) {
        List<FlowsheetDefinition.PortDef> sorted = new ArrayList<>(defs);
        sorted.sort(Comparator.comparingInt(FlowsheetDefinition.PortDef::getPosition));
        return sorted.stream().map(FlowsheetDefinition.PortDef::getId).toList();
    }

    // ── Parameter resolution ────────────────────────────────────────

    /**
     * Resolves a parameter map: strings go to the resolver, lists are resolved
     * element-wise (all-numeric lists become double[]), maps recursively.
     */
    static Map<String, Object> resolveParameters(String nodeId, Map<String, Object> params,
            ParameterResolver resolver) {
        Map<String, Object> out = new LinkedHashMap<>(params.size() * 2);
        for (Map.Entry<String, Object> e : params.entrySet())
            out.put(e.getKey(), resolveValue(nodeId, e.getKey(), e.getValue(), resolver));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object resolveValue(String nodeId, String key, Object value, ParameterResolver resolver) {
        if (value instanceof String s)
            return resolver.resolve(s);
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof Map<?, ?> m)
            return resolveParameters(nodeId, (Map<String, Object>) m, resolver);
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            boolean numeric = true;
            for (Object item : list) {
                Object r = resolveValue(nodeId, key, item, resolver);
                numeric &= r instanceof Double;
                resolved.add(r);
            }
            if (!numeric)
                return resolved;
            double[] arr = new double[resolved.size()];
            for (int i = 0; i < arr.length; i++)
                arr[i] = (Double) resolved.get(i);
            return arr;
        }
        return value;
    }

    static SolverSettings solverSettings(FlowsheetDefinition.SolverDef sd) {
        SolverSettings s = SolverSettings.defaults();
        if (sd == null)
            return s;
        try {
            if (sd.getTolerance() != null)
                s = s.withTolerance(sd.getTolerance());
            if (sd.getMaxIterations() != null)
                s = s.withMaxIterations(sd.getMaxIterations());
            if (sd.getResidualNorm() != null)
                s = s.withResidualNorm(
                        SolverSettings.ResidualNorm.valueOf(sd.getResidualNorm().toUpperCase(Locale.ROOT)));
            if (sd.getRelativeFloor() != null)
                s = s.withRelativeFloor(sd.getRelativeFloor());
            if (sd.getRelaxation() != null)
                s = s.withRelaxation(sd.getRelaxation());
            if (sd.getNonConvergencePolicy() != null)
                s = s.withNonConvergencePolicy(SolverSettings.NonConvergencePolicy
                        .valueOf(sd.getNonConvergencePolicy().toUpperCase(Locale.ROOT)));
            if (sd.getStreamWidth() != null)
                s = s.withStreamWidth(sd.getStreamWidth());
            if (sd.getRejectNonFinite() != null)
                s = s.withRejectNonFinite(sd.getRejectNonFinite());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid solver settings: " + e.getMessage(), e);
        }
        return s;
    }

    // ── Parameter access helpers ────────────────────────────────────

    static double getDouble(String nodeId, Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Number n)
            return n.doubleValue();
        throw new InvalidParameterException(nodeId, key, "must be a number, got " + describe(v));
    }

    static double requireDouble(String nodeId, Map<String, Object> props, String key) {
        if (props.get(key) == null)
            throw new InvalidParameterException(nodeId, key, "is required");
        return getDouble(nodeId, props, key, Double.NaN);
    }

    static int getInt(String nodeId, Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()))
            return n.intValue();
        throw new InvalidParameterException(nodeId, key, "must be an integer, got " + describe(v));
    }

    /** A vector parameter; a single number is a vector of length 1. */
    static double[] getVector(String nodeId, Map<String, Object> props, String key, double[] def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof double[] arr)
            return arr.clone();
        if (v instanceof Number n)
            return new double[] { n.doubleValue() };
        throw new InvalidParameterException(nodeId, key, "must be a number or a list of numbers, got " + describe(v));
    }

    static double[] requireVector(String nodeId, Map<String, Object> props, String key) {
        double[] v = getVector(nodeId, props, key, null);
        if (v == null)
            throw new InvalidParameterException(nodeId, key, "is required");
        return v;
    }

    private static String describe(Object v) {
        return v instanceof double[] arr ? "a list of " + arr.length + " numbers" : String.valueOf(v);
    }
}
