package com.plant.flowsheet.api;

import java.util.List;
import java.util.Map;

/** Creates a component instance for one node. */
@FunctionalInterface
public interface ComponentFactory {

    /**
     * @param nodeId      Id of the node being instantiated.
     * @param parameters  Resolved parameters: Double, double[], Boolean, String
     *                    or nested maps of those.
     * @param inputPorts  The node's input ports, in position order.
     * @param outputPorts The node's output ports, in position order.
     * @throws ConfigurationException if a parameter is missing or invalid.
     */
    Component create(String nodeId, Map<String, Object> parameters, List<String> inputPorts,
            List<String> outputPorts);
}
