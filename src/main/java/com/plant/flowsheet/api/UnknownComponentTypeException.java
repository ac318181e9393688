package com.plant.flowsheet.api;

/** No factory is registered for a node's component-type tag. */
public class UnknownComponentTypeException extends ConfigurationException {
    private final String type;

    public UnknownComponentTypeException(String nodeId, String type) {
        super("No component registered for type '" + type + "' (node '" + nodeId + "')");
        this.type = type;
    }

    public String type() {
        return type;
    }
}
