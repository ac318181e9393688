package com.plant.flowsheet.api;

/** A resolved parameter is missing, of the wrong shape, or out of range. */
public class InvalidParameterException extends ConfigurationException {

    public InvalidParameterException(String nodeId, String parameter, String detail) {
        super("Node '" + nodeId + "': parameter '" + parameter + "' " + detail);
    }
}
