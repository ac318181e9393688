package com.plant.flowsheet.plan;

/**
 * Convergence settings for loop stages.
 *
 * @param tolerance             A loop has converged when the residual drops
 *                              below this value.
 * @param maxIterations         Iteration cap per loop stage and step.
 * @param residualNorm          How the change of a tear edge is measured.
 * @param relativeFloor         Lower bound on the denominator of a relative
 *                              change, so near-zero components do not blow up.
 * @param relaxation            Weight w of the new value in
 *                              {@code x = (1-w)*old + w*new}; 1 is plain
 *                              fixed-point iteration.
 * @param nonConvergencePolicy  What happens when the cap is hit.
 * @param streamWidth           Length of the zero vector used as the initial
 *                              guess of tear edges without a configured value.
 * @param rejectNonFinite       Treat NaN or infinite outputs as computation
 *                              errors.
 */
public record SolverSettings(double tolerance, int maxIterations, ResidualNorm residualNorm,
        double relativeFloor, double relaxation, NonConvergencePolicy nonConvergencePolicy,
        int streamWidth, boolean rejectNonFinite) {

    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 50;
    // ASM1 stream layout: 21 state components including flow and temperature
    public static final int DEFAULT_STREAM_WIDTH = 21;

    /** Measure of change between two iterations of a tear edge. */
    public enum ResidualNorm {
        /** max |new - old| */
        ABSOLUTE,
        /** max |new - old| / max(|old|, relativeFloor) */
        RELATIVE
    }

    /** Reaction to a loop stage hitting its iteration cap. */
    public enum NonConvergencePolicy {
        /** Roll the step back and throw NonConvergenceException. */
        FAIL,
        /** Keep the unconverged values, log a warning and report the loop in the step result. */
        ACCEPT
    }

    public SolverSettings {
        if (!(tolerance > 0))
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        if (!(relaxation > 0 && relaxation <= 1))
            throw new IllegalArgumentException("relaxation must be in (0, 1]: " + relaxation);
        if (!(relativeFloor > 0))
            throw new IllegalArgumentException("relativeFloor must be positive: " + relativeFloor);
        if (streamWidth < 1)
            throw new IllegalArgumentException("streamWidth must be at least 1: " + streamWidth);
        if (residualNorm == null || nonConvergencePolicy == null)
            throw new IllegalArgumentException("residualNorm and nonConvergencePolicy are required");
    }

    public static SolverSettings defaults() {
        return new SolverSettings(DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS, ResidualNorm.ABSOLUTE, 1e-12, 1.0,
                NonConvergencePolicy.FAIL, DEFAULT_STREAM_WIDTH, true);
    }

    public SolverSettings withTolerance(double value) {
        return new SolverSettings(value, maxIterations, residualNorm, relativeFloor, relaxation,
                nonConvergencePolicy, streamWidth, rejectNonFinite);
    }

    public SolverSettings withMaxIterations(int value) {
        return new SolverSettings(tolerance, value, residualNorm, relativeFloor, relaxation,
                nonConvergencePolicy, streamWidth, rejectNonFinite);
    }

    public SolverSettings withResidualNorm(ResidualNorm value) {
        return new SolverSettings(tolerance, maxIterations, value, relativeFloor, relaxation,
                nonConvergencePolicy, streamWidth, rejectNonFinite);
    }

    public SolverSettings withRelativeFloor(double value) {
        return new SolverSettings(tolerance, maxIterations, residualNorm, value, relaxation,
                nonConvergencePolicy, streamWidth, rejectNonFinite);
    }

    public SolverSettings withRelaxation(double value) {
        return new SolverSettings(tolerance, maxIterations, residualNorm, relativeFloor, value,
                nonConvergencePolicy, streamWidth, rejectNonFinite);
    }

    public SolverSettings withNonConvergencePolicy(NonConvergencePolicy value) {
        return new SolverSettings(tolerance, maxIterations, residualNorm, relativeFloor, relaxation,
                value, streamWidth, rejectNonFinite);
    }

    public SolverSettings withStreamWidth(int value) {
        return new SolverSettings(tolerance, maxIterations, residualNorm, relativeFloor, relaxation,
                nonConvergencePolicy, value, rejectNonFinite);
    }

    public SolverSettings withRejectNonFinite(boolean value) {
        return new SolverSettings(tolerance, maxIterations, residualNorm, relativeFloor, relaxation,
                nonConvergencePolicy, streamWidth, value);
    }

    /**
     * Change between two iterations of one tear edge under this norm.
     * Vectors of different length count as infinitely far apart.
     */
    public double residual(double[] previous, double[] current) {
        if (previous.length != current.length)
            return Double.POSITIVE_INFINITY;
        double max = 0.0;
        for (int i = 0; i < current.length; i++) {
            double diff = Math.abs(current[i] - previous[i]);
            if (residualNorm == ResidualNorm.RELATIVE)
                diff /= Math.max(Math.abs(previous[i]), relativeFloor);
            if (Double.isNaN(diff))
                return Double.NaN;
            if (diff > max)
                max = diff;
        }
        return max;
    }
}
