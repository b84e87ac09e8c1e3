package taskweave.engine.workflow;

import taskweave.engine.model.ExecutionStrategy;

/**
 * Scheduling settings of one workflow.
 *
 * @param strategy               how the slot budget is sized each tick
 * @param maxConcurrent          upper bound on tasks running at once
 * @param adaptiveCountsDegraded when false, ADAPTIVE sizing ignores ready tasks
 *                               whose dependencies did not all succeed
 */
public record WorkflowOptions(ExecutionStrategy strategy, int maxConcurrent, boolean adaptiveCountsDegraded) {

    public WorkflowOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
    }

    public static WorkflowOptions defaults() {
        return new WorkflowOptions(ExecutionStrategy.ADAPTIVE, 5, true);
    }

    public WorkflowOptions withStrategy(ExecutionStrategy value) {
        return new WorkflowOptions(value, maxConcurrent, adaptiveCountsDegraded);
    }

    public WorkflowOptions withMaxConcurrent(int value) {
        return new WorkflowOptions(strategy, value, adaptiveCountsDegraded);
    }

    public WorkflowOptions withAdaptiveCountsDegraded(boolean value) {
        return new WorkflowOptions(strategy, maxConcurrent, value);
    }

    /** Slot budget for one scheduling tick */
    public int effectiveConcurrency(int readyWidth) {
        return strategy.effectiveConcurrency(maxConcurrent, readyWidth);
    }
}
