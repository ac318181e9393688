package com.plant.flowsheet.api;

/** A parameter reference could not be resolved to a value. */
public class UnknownParameterException extends ConfigurationException {
    private final String reference;

    public UnknownParameterException(String reference) {
        super("Could not resolve parameter: " + reference);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
