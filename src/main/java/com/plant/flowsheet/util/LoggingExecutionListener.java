package com.plant.flowsheet.util;

import com.plant.flowsheet.api.ExecutionListener;
import com.plant.flowsheet.api.ExecutorState;

import lombok.extern.log4j.Log4j2;

/**
 * Logs executor activity: node failures at ERROR (throttled), loop outcomes
 * at DEBUG, failed steps at WARN.
 */
@Log4j2
public final class LoggingExecutionListener implements ExecutionListener {
    private final ErrorRateLimiter errLimiter;

    public LoggingExecutionListener() {
        this(1000);
    }

    public LoggingExecutionListener(long minErrorIntervalMillis) {
        this.errLimiter = new ErrorRateLimiter(log, minErrorIntervalMillis);
    }

    @Override
    public void onNodeError(long step, int stageIndex, String nodeId, Throwable error) {
        errLimiter.log(String.format("Step %d, stage %d: node '%s' failed: %s", step, stageIndex, nodeId,
                error.getMessage()), error);
    }

    @Override
    public void onStageEnd(long step, int stageIndex, ExecutorState outcome, int iterations, double residual) {
        if (iterations > 1 || outcome != ExecutorState.CONVERGED)
            log.debug("Step {}, stage {}: {} after {} iterations, residual {}", step, stageIndex, outcome, iterations,
                    residual);
    }

    @Override
    public void onStepEnd(long step, boolean success) {
        if (!success)
            log.warn("Step {} failed and was rolled back", step);
    }
}
