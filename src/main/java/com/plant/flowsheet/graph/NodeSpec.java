package com.plant.flowsheet.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static description of one node: a component instance in the flowsheet.
 *
 * @param id          Unique node id.
 * @param type        Component-type tag used to look up the factory.
 * @param parameters  Resolved parameter values.
 * @param inputPorts  Declared input port names, in position order.
 * @param outputPorts Declared output port names, in position order.
 */
public record NodeSpec(String id, String type, Map<String, Object> parameters,
        List<String> inputPorts, List<String> outputPorts) {

    public NodeSpec {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        inputPorts = inputPorts == null ? List.of() : List.copyOf(inputPorts);
        outputPorts = outputPorts == null ? List.of() : List.copyOf(outputPorts);
    }

    /** Shorthand for nodes that only take part in scheduling. */
    public static NodeSpec of(String id, List<String> inputPorts, List<String> outputPorts) {
        return new NodeSpec(id, "generic", Map.of(), inputPorts, outputPorts);
    }

    public boolean hasInputPort(String port) {
        return inputPorts.contains(port);
    }

    public boolean hasOutputPort(String port) {
        return outputPorts.contains(port);
    }
}
