package com.plant.flowsheet.api;

/**
 * Maps a parameter reference to its value.
 *
 * The engine never interprets the reference syntax; it hands every string
 * parameter to the resolver and uses whatever comes back.
 */
@FunctionalInterface
public interface ParameterResolver {

    /**
     * @param reference The reference as written in the configuration.
     * @return A {@code Double} or a {@code double[]}.
     * @throws UnknownParameterException if the reference cannot be resolved.
     */
    Object resolve(String reference);

    /** A resolver that knows nothing; every reference fails. */
    static ParameterResolver none() {
        return reference -> {
            throw new UnknownParameterException(reference);
        };
    }
}
