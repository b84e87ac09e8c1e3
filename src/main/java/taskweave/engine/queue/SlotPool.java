package taskweave.engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.executor.CancellationToken;
import taskweave.engine.executor.ExecutionResult;
import taskweave.engine.executor.TaskExecutor;
import taskweave.engine.model.Task;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Concurrency limiter: tracks which attempts hold a worker slot.
 *
 * Workers come from a cached daemon pool, so an abandoned attempt (timed out
 * or cancelled) that keeps running does not hold a slot. Outcomes are posted
 * to a sink; the owner calls {@link #release(String, int)} when it processes
 * them, and outcomes of abandoned attempts are recognised as stale.
 *
 * Slot accounting is not thread-safe; the orchestrator calls it under its lock.
 */
public final class SlotPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlotPool.class);
    private static final AtomicInteger POOL_IDS = new AtomicInteger(1);

    /** One attempt currently holding a slot */
    public record RunningAttempt(
            String taskId,
            int attempt,
            CancellationToken token,
            Future<?> future,
            Instant startedAt,
            Instant deadline) {
    }

    /**
     * What a worker reports when an attempt returns.
     *
     * @param result executor result, null if it threw
     * @param error  thrown exception, null if it returned
     */
    public record AttemptOutcome(
            String taskId,
            int attempt,
            ExecutionResult result,
            Throwable error,
            Instant finishedAt) {
    }

    private final int maxSlots;
    private final Clock clock;
    private final ExecutorService workers;
    private final Map<String, RunningAttempt> running = new LinkedHashMap<>();

    public SlotPool(int maxSlots, Clock clock) {
        if (maxSlots < 1) {
            throw new IllegalArgumentException("maxSlots must be >= 1");
        }
        this.maxSlots = maxSlots;
        this.clock = clock;
        int poolId = POOL_IDS.getAndIncrement();
        AtomicInteger threadIds = new AtomicInteger(1);
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskweave-worker-" + poolId + "-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public int maxSlots() {
        return maxSlots;
    }

    public int inUse() {
        return running.size();
    }

    public boolean isIdle() {
        return running.isEmpty();
    }

    public boolean isRunning(String taskId) {
        return running.containsKey(taskId);
    }

    /** Ids of running tasks in dispatch order */
    public List<String> runningIds() {
        return List.copyOf(running.keySet());
    }

    /**
     * Take a slot and start the attempt on a worker thread.
     *
     * @param task the task, already marked RUNNING with its attempt counted
     * @param sink receives the outcome once the executor returns or throws
     * @throws IllegalStateException if no slot is free
     */
    public RunningAttempt dispatch(Task task, TaskExecutor executor, Consumer<AttemptOutcome> sink) {
        if (running.size() >= maxSlots) {
            throw new IllegalStateException("No free slot for task " + task.id());
        }
        if (running.containsKey(task.id())) {
            throw new IllegalStateException("Task " + task.id() + " already holds a slot");
        }

        CancellationToken token = new CancellationToken();
        int attempt = task.attempts();
        Future<?> future = workers.submit(() -> {
            ExecutionResult result = null;
            Throwable error = null;
            try {
                result = executor.execute(task, token);
            } catch (Throwable t) {
                error = t;
            }
            sink.accept(new AttemptOutcome(task.id(), attempt, result, error, clock.instant()));
        });

        RunningAttempt ra = new RunningAttempt(task.id(), attempt, token, future, task.startedAt(), task.deadline());
        running.put(task.id(), ra);
        log.debug("Slot taken by {} (attempt {}), {}/{} in use", task.id(), attempt, running.size(), maxSlots);
        return ra;
    }

    /**
     * Free the slot of a finished attempt.
     *
     * @return the attempt, or empty if the outcome is stale (attempt already abandoned)
     */
    public Optional<RunningAttempt> release(String taskId, int attempt) {
        RunningAttempt ra = running.get(taskId);
        if (ra == null || ra.attempt() != attempt) {
            return Optional.empty();
        }
        running.remove(taskId);
        return Optional.of(ra);
    }

    /**
     * Abandon every attempt whose deadline has passed: signal its token, interrupt
     * its worker and free its slot.
     */
    public List<RunningAttempt> expire(Instant now) {
        List<RunningAttempt> expired = new ArrayList<>();
        for (RunningAttempt ra : running.values()) {
            if (ra.deadline() != null && !now.isBefore(ra.deadline())) {
                expired.add(ra);
            }
        }
        for (RunningAttempt ra : expired) {
            abandon(ra, "timeout");
        }
        return expired;
    }

    /** Abandon one running attempt, freeing its slot */
    public Optional<RunningAttempt> abandon(String taskId, String reason) {
        RunningAttempt ra = running.get(taskId);
        if (ra == null) {
            return Optional.empty();
        }
        abandon(ra, reason);
        return Optional.of(ra);
    }

    /** Abandon all running attempts */
    public List<RunningAttempt> abandonAll(String reason) {
        List<RunningAttempt> all = new ArrayList<>(running.values());
        for (RunningAttempt ra : all) {
            abandon(ra, reason);
        }
        return all;
    }

    /** Earliest deadline among running attempts */
    public Optional<Instant> nextDeadline() {
        return running.values().stream()
                .map(RunningAttempt::deadline)
                .filter(d -> d != null)
                .min(Instant::compareTo);
    }

    private void abandon(RunningAttempt ra, String reason) {
        running.remove(ra.taskId());
        ra.token().cancel(reason);
        ra.future().cancel(true);
        log.debug("Slot of {} released ({}), {}/{} in use", ra.taskId(), reason, running.size(), maxSlots);
    }

    @Override
    public void close() {
        abandonAll("shutdown");
        workers.shutdownNow();
    }
}
