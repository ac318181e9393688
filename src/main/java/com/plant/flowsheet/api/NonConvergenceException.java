package com.plant.flowsheet.api;

import java.util.List;

/**
 * A loop stage reached its iteration cap without the tear-edge residual
 * dropping below tolerance.
 */
public class NonConvergenceException extends FlowsheetException {
    private final int stageIndex;
    private final List<String> nodeIds;
    private final int iterations;
    private final double residual;

    public NonConvergenceException(int stageIndex, List<String> nodeIds, int iterations, double residual,
            double tolerance) {
        super(String.format("Loop stage %d %s did not converge after %d iterations (residual %.3e, tolerance %.3e)",
                stageIndex, nodeIds, iterations, residual, tolerance));
        this.stageIndex = stageIndex;
        this.nodeIds = List.copyOf(nodeIds);
        this.iterations = iterations;
        this.residual = residual;
    }

    public int stageIndex() {
        return stageIndex;
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public int iterations() {
        return iterations;
    }

    public double residual() {
        return residual;
    }
}
