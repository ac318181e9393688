package com.plant.flowsheet.api;

/**
 * The flowsheet description is malformed: unknown references, duplicate ids,
 * fan-in violations, unknown component types or unresolvable parameters.
 */
public class ConfigurationException extends FlowsheetException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
