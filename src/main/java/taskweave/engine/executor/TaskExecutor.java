package taskweave.engine.executor;

import taskweave.engine.model.Task;

/**
 * Externally supplied callable that performs the work behind a task.
 *
 * Implementations receive the task (its payload is theirs to interpret) and a
 * cancellation token. They must check the token at reasonable intervals and
 * return promptly once it is set; the queue never force-kills a worker.
 *
 * Returning {@link ExecutionResult#failure(String)} or throwing any exception
 * counts as a failed attempt. Throwing
 * {@link taskweave.engine.error.TaskCancelledException} counts as a cancellation.
 */
@FunctionalInterface
public interface TaskExecutor {

    ExecutionResult execute(Task task, CancellationToken token) throws Exception;
}
