package taskweave.engine.model;

import java.util.Locale;

/**
 * How many worker slots a workflow may use on a given scheduling tick.
 */
public enum ExecutionStrategy {
    /** One task at a time, strictly by priority then submission order */
    SEQUENTIAL,
    /** Up to max concurrent, pure priority scheduling */
    PARALLEL,
    /** Concurrency follows the width of the current ready set */
    ADAPTIVE;

    /**
     * Effective slot budget for this tick.
     *
     * @param maxConcurrent configured slot count
     * @param readyWidth    number of ready tasks counted for sizing
     */
    public int effectiveConcurrency(int maxConcurrent, int readyWidth) {
        return switch (this) {
            case SEQUENTIAL -> 1;
            case PARALLEL -> maxConcurrent;
            case ADAPTIVE -> Math.min(maxConcurrent, Math.max(1, readyWidth));
        };
    }

    public static ExecutionStrategy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
