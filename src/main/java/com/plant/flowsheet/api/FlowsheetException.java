package com.plant.flowsheet.api;

/**
 * Root of every error raised by the flowsheet engine.
 *
 * Three kinds are distinguished so callers can apply different recovery
 * policies:
 * - {@link ConfigurationException}: the flowsheet description is invalid.
 * Raised while building, never recovered automatically.
 * - {@link ComputationException}: a component failed for the inputs it was
 * given. Fatal for the current step.
 * - {@link NonConvergenceException}: a loop stage hit its iteration cap.
 * The caller may retry with relaxed solver settings.
 */
public abstract class FlowsheetException extends RuntimeException {

    protected FlowsheetException(String message) {
        super(message);
    }

    protected FlowsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
