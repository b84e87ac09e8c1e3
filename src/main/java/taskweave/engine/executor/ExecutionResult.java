package taskweave.engine.executor;

/**
 * What an executor returns for one attempt.
 *
 * @param success   whether the attempt succeeded
 * @param result    value stored on the task when successful
 * @param error     error message when not successful
 * @param retryable false marks the failure permanent, skipping remaining attempts
 */
public record ExecutionResult(boolean success, Object result, String error, boolean retryable) {

    public static ExecutionResult success(Object result) {
        return new ExecutionResult(true, result, null, false);
    }

    /** Success without a result value */
    public static ExecutionResult ok() {
        return success(null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, null, error, true);
    }

    public static ExecutionResult permanentFailure(String error) {
        return new ExecutionResult(false, null, error, false);
    }
}
