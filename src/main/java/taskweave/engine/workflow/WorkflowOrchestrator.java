package taskweave.engine.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.SnapshotException;
import taskweave.engine.error.TaskCancelledException;
import taskweave.engine.error.TaskExecutionException;
import taskweave.engine.error.TaskTimeoutException;
import taskweave.engine.error.TaskValidationException;
import taskweave.engine.executor.ExecutionResult;
import taskweave.engine.executor.TaskExecutor;
import taskweave.engine.model.ExecutionPlan;
import taskweave.engine.model.QueueStats;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskDescriptor;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.model.WorkflowStatus;
import taskweave.engine.model.WorkflowSummary;
import taskweave.engine.model.WorkflowView;
import taskweave.engine.queue.QueueOptions;
import taskweave.engine.queue.SlotPool;
import taskweave.engine.queue.SlotPool.AttemptOutcome;
import taskweave.engine.queue.SlotPool.RunningAttempt;
import taskweave.engine.queue.TaskQueue;
import taskweave.engine.retry.RetryController;
import taskweave.engine.retry.RetryDecision;
import taskweave.engine.store.QueueSnapshot;
import taskweave.engine.store.SnapshotStore;
import taskweave.engine.store.TaskRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Drives one workflow: owns its task queue, slot pool and lifecycle.
 *
 * <p>
 * {@link #processQueue(TaskExecutor)} runs the coordinating loop on the calling
 * thread. Each tick, under the orchestrator lock, it:
 * <ol>
 * <li>applies finished attempts (success, retry or terminal failure)</li>
 * <li>abandons attempts past their deadline</li>
 * <li>promotes newly eligible tasks to READY</li>
 * <li>dispatches ready tasks while the strategy's slot budget allows</li>
 * </ol>
 * then releases the lock and sleeps until an attempt finishes, a retry or
 * deadline comes due, or a lifecycle call wakes it.
 *
 * <p>
 * Pause, resume, cancel and the queries may be called from any thread.
 */
public final class WorkflowOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    /** Upper bound on one sleep of the loop */
    static final Duration MAX_IDLE_WAIT = Duration.ofSeconds(1);

    /** Loop wake-up; carries an outcome, or nothing for a plain wake */
    private record Signal(AttemptOutcome outcome) {
        static final Signal WAKE = new Signal(null);
    }

    private final String workflowId;
    private final TaskQueue queue;
    private final WorkflowOptions options;
    private final RetryController retryController;
    private final SnapshotStore snapshotStore;
    private final Clock clock;
    private final SlotPool slotPool;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedBlockingDeque<Signal> signals = new LinkedBlockingDeque<>();
    private final List<WorkflowListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean();
    private final List<String> rootCauses = new ArrayList<>();

    private WorkflowStatus status;
    private Instant startedAt;
    private Instant finishedAt;
    private ExecutorService coordinator;
    private volatile boolean closed;
    private volatile WorkflowView view;

    public WorkflowOrchestrator(TaskQueue queue, WorkflowOptions options, RetryController retryController) {
        this(queue, options, retryController, SnapshotStore.none(), Clock.systemUTC());
    }

    public WorkflowOrchestrator(TaskQueue queue, WorkflowOptions options, RetryController retryController,
            SnapshotStore snapshotStore, Clock clock) {
        this(queue, options, retryController, snapshotStore, clock, WorkflowStatus.PENDING, List.of(), null, null);
    }

    private WorkflowOrchestrator(TaskQueue queue, WorkflowOptions options, RetryController retryController,
            SnapshotStore snapshotStore, Clock clock, WorkflowStatus status, List<String> rootCauses,
            Instant startedAt, Instant finishedAt) {
        this.workflowId = queue.workflowId();
        this.queue = queue;
        this.options = options;
        this.retryController = retryController;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
        this.slotPool = new SlotPool(options.maxConcurrent(), clock);
        this.status = status;
        this.rootCauses.addAll(rootCauses);
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        publishView();
    }

    /**
     * Rebuild an orchestrator from a snapshot.
     *
     * Tasks that were RUNNING or READY go back to PENDING. A RUNNING workflow
     * comes back PENDING and resumes on the next {@link #processQueue} call; a
     * PAUSED one stays paused; terminal workflows stay terminal.
     *
     * @param queueDefaults defaults for tasks submitted after the restore
     * @param defaults      options whose strategy and max concurrency are replaced by the snapshot's
     * @throws SnapshotException if the snapshot does not describe a valid graph
     */
    public static WorkflowOrchestrator restore(QueueSnapshot snapshot, QueueOptions queueDefaults,
            WorkflowOptions defaults, RetryController retryController, SnapshotStore snapshotStore, Clock clock) {
        String id = snapshot.workflowId();
        List<Task> tasks = snapshot.tasks().stream().map(r -> r.toTask(id)).toList();
        TaskQueue queue;
        try {
            queue = TaskQueue.restore(id, queueDefaults.withContinueOnFailure(snapshot.continueOnFailure()),
                    clock, tasks, snapshot.nextSequence());
        } catch (TaskValidationException e) {
            throw new SnapshotException("Snapshot of workflow " + id + " is inconsistent: " + e.getMessage(), e);
        }

        WorkflowStatus status = switch (snapshot.status()) {
            case PENDING, RUNNING -> WorkflowStatus.PENDING;
            default -> snapshot.status();
        };
        if (status.isTerminal()) {
            queue.close();
        }

        WorkflowOptions restoredOptions = defaults
                .withStrategy(snapshot.strategy())
                .withMaxConcurrent(snapshot.maxConcurrent());
        log.info("Workflow {} restored: {} -> {}", id, snapshot.status(), status);
        return new WorkflowOrchestrator(queue, restoredOptions, retryController, snapshotStore, clock, status,
                snapshot.rootCauseTaskIds(), snapshot.startedAt(), snapshot.finishedAt());
    }

    // Getters
    public String workflowId() {
        return workflowId;
    }

    public WorkflowOptions options() {
        return options;
    }

    public TaskQueue queue() {
        return queue;
    }

    public void addListener(WorkflowListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WorkflowListener listener) {
        listeners.remove(listener);
    }

    /** True while a coordinating loop is active */
    public boolean isProcessing() {
        return processing.get();
    }

    // ---------------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------------

    /**
     * Submit one task. Allowed before and while the loop runs.
     *
     * @throws TaskValidationException on an invalid submission or a finished workflow
     */
    public Task addTask(TaskDescriptor descriptor) {
        return addTasks(List.of(descriptor)).get(0);
    }

    /** Submit a batch of tasks atomically */
    public List<Task> addTasks(List<TaskDescriptor> descriptors) {
        lock.lock();
        try {
            List<Task> added = queue.addTasks(descriptors);
            publishView();
            return added;
        } finally {
            lock.unlock();
            signals.offer(Signal.WAKE);
        }
    }

    // ---------------------------------------------------------------------
    // Coordinating loop
    // ---------------------------------------------------------------------

    /**
     * Run the workflow until no work is left, it is paused and idle, or it is
     * cancelled. Returns immediately for a finished workflow.
     *
     * @throws IllegalStateException if another loop is already processing this workflow
     */
    public WorkflowSummary processQueue(TaskExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor is required");
        }
        if (!processing.compareAndSet(false, true)) {
            throw new IllegalStateException("Workflow " + workflowId + " is already being processed");
        }
        try {
            lock.lock();
            try {
                if (status.isTerminal()) {
                    return summary();
                }
                if (status == WorkflowStatus.PENDING) {
                    transition(WorkflowStatus.RUNNING, clock.instant());
                }
                log.info("Processing workflow {} (strategy={}, maxConcurrent={}, continueOnFailure={})",
                        workflowId, options.strategy(), options.maxConcurrent(),
                        queue.options().continueOnFailure());
            } finally {
                lock.unlock();
            }

            runLoop(executor);

            lock.lock();
            try {
                publishView();
                return summary();
            } finally {
                lock.unlock();
            }
        } finally {
            processing.set(false);
        }
    }

    /**
     * Run {@link #processQueue} on a dedicated coordinator thread.
     */
    public CompletableFuture<WorkflowSummary> processQueueAsync(TaskExecutor executor) {
        return CompletableFuture.supplyAsync(() -> processQueue(executor), coordinator());
    }

    private void runLoop(TaskExecutor executor) {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                if (closed) {
                    log.warn("Workflow {} closed while processing", workflowId);
                    return;
                }
                Instant now = clock.instant();
                drainSignals();
                expireOverdue(now);
                if (status.isTerminal()) {
                    return;
                }

                queue.promoteReady(now);
                if (status == WorkflowStatus.RUNNING) {
                    dispatch(executor, now);
                }

                if (slotPool.isIdle()) {
                    if (status == WorkflowStatus.PAUSED) {
                        log.info("Workflow {} paused, no tasks running", workflowId);
                        publishView();
                        return;
                    }
                    if (!queue.hasUnfinishedWork()) {
                        finish(now);
                        return;
                    }
                }
                publishView();
                waitNanos = nextWaitNanos(now);
            } finally {
                lock.unlock();
            }

            if (!awaitSignal(waitNanos)) {
                lock.lock();
                try {
                    log.warn("Loop of workflow {} interrupted", workflowId);
                    if (status == WorkflowStatus.RUNNING) {
                        transition(WorkflowStatus.PAUSED, clock.instant());
                    }
                } finally {
                    lock.unlock();
                }
                return;
            }
        }
    }

    private void drainSignals() {
        List<Signal> batch = new ArrayList<>();
        signals.drainTo(batch);
        for (Signal signal : batch) {
            if (signal.outcome() != null) {
                handleOutcome(signal.outcome());
            }
        }
    }

    private void dispatch(TaskExecutor executor, Instant now) {
        int width = queue.readyWidth(options.adaptiveCountsDegraded());
        int budget = options.effectiveConcurrency(width);
        while (slotPool.inUse() < budget) {
            Optional<Task> next = queue.pollReady();
            if (next.isEmpty()) {
                break;
            }
            Task running = queue.markRunning(next.get().id(), now);
            slotPool.dispatch(running, executor, outcome -> signals.offer(new Signal(outcome)));
            log.info("Dispatched task {} (priority={}, attempt {}/{}, slots {}/{})", running.id(),
                    running.priority(), running.attempts(), running.maxAttempts(), slotPool.inUse(), budget);
        }
    }

    private void handleOutcome(AttemptOutcome outcome) {
        Optional<RunningAttempt> attempt = slotPool.release(outcome.taskId(), outcome.attempt());
        if (attempt.isEmpty()) {
            log.debug("Ignoring outcome of abandoned attempt {} of task {}", outcome.attempt(), outcome.taskId());
            return;
        }
        Task task = queue.getTask(outcome.taskId()).orElseThrow();
        Instant now = outcome.finishedAt();

        if (outcome.error() instanceof TaskCancelledException e) {
            List<Task> blocked = queue.markCancelled(task.id(), e.getMessage(), true, now);
            rootCauses.add(task.id());
            log.info("Task {} cancelled by its executor: {}", task.id(), e.getMessage());
            fire(l -> l.onTaskFailed(queue.getTask(task.id()).orElseThrow()));
            fireBlocked(blocked);
            return;
        }
        if (outcome.error() != null) {
            onAttemptFailed(task, outcome.error(), now);
            return;
        }

        ExecutionResult result = outcome.result();
        if (result == null) {
            onAttemptFailed(task, new TaskExecutionException("Executor returned no result"), now);
        } else if (result.success()) {
            Task done = queue.markSucceeded(task.id(), result.result(), now);
            log.info("Task {} succeeded (attempt {}/{})", task.id(), done.attempts(), done.maxAttempts());
            fire(l -> l.onTaskSucceeded(done));
        } else {
            String message = result.error() != null ? result.error() : "Executor reported failure";
            onAttemptFailed(task, new TaskExecutionException(message, result.retryable()), now);
        }
    }

    private void onAttemptFailed(Task task, Throwable error, Instant now) {
        RetryDecision decision = retryController.onFailure(task, error, now);
        if (decision.retry()) {
            Task retrying = queue.markRetryPending(task.id(), decision.wakeAt(), decision.kind(),
                    decision.message(), now);
            log.warn("Task {} failed (attempt {}/{}): {} - retrying in {}ms", task.id(), task.attempts(),
                    task.maxAttempts(), decision.message(), decision.delay().toMillis());
            fire(l -> l.onTaskRetrying(retrying, decision));
            return;
        }

        List<Task> blocked = queue.markFailed(task.id(), decision.kind(), decision.message(), now);
        rootCauses.add(task.id());
        log.error("Task {} failed permanently after {} attempt(s): {} ({})", task.id(), task.attempts(),
                decision.message(), decision.kind());
        Task failed = queue.getTask(task.id()).orElseThrow();
        fire(l -> l.onTaskFailed(failed));
        fireBlocked(blocked);
    }

    private void expireOverdue(Instant now) {
        for (RunningAttempt overdue : slotPool.expire(now)) {
            Task task = queue.getTask(overdue.taskId()).orElseThrow();
            log.warn("Task {} exceeded its timeout of {}ms (attempt {})", task.id(),
                    task.timeout().toMillis(), overdue.attempt());
            onAttemptFailed(task, new TaskTimeoutException(task.id(), task.timeout()), now);
        }
    }

    private long nextWaitNanos(Instant now) {
        Instant wake = now.plus(MAX_IDLE_WAIT);
        if (status == WorkflowStatus.RUNNING) {
            Optional<Instant> retry = queue.nextRetryAt();
            if (retry.isPresent() && retry.get().isBefore(wake)) {
                wake = retry.get();
            }
        }
        Optional<Instant> deadline = slotPool.nextDeadline();
        if (deadline.isPresent() && deadline.get().isBefore(wake)) {
            wake = deadline.get();
        }
        return Math.max(0L, Duration.between(now, wake).toNanos());
    }

    /** @return false if the waiting thread was interrupted */
    private boolean awaitSignal(long nanos) {
        if (nanos == 0L) {
            return true;
        }
        try {
            Signal signal = signals.poll(nanos, TimeUnit.NANOSECONDS);
            if (signal != null) {
                signals.offerFirst(signal);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void finish(Instant now) {
        QueueStats stats = queue.getQueueStats();
        boolean accepted = queue.options().continueOnFailure()
                || stats.count(TaskStatus.SUCCEEDED) == stats.total();
        transition(accepted ? WorkflowStatus.COMPLETED : WorkflowStatus.FAILED, now);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Stop dispatching. Running tasks finish normally.
     *
     * @return false if the workflow is not PENDING or RUNNING
     */
    public boolean pause() {
        lock.lock();
        try {
            if (status != WorkflowStatus.RUNNING && status != WorkflowStatus.PENDING) {
                log.warn("Cannot pause workflow {} in state {}", workflowId, status);
                return false;
            }
            transition(WorkflowStatus.PAUSED, clock.instant());
            return true;
        } finally {
            lock.unlock();
            signals.offer(Signal.WAKE);
        }
    }

    /**
     * Re-enable dispatching of a paused workflow. If no loop is active, the next
     * {@link #processQueue} call continues the work.
     *
     * @return false if the workflow is not PAUSED
     */
    public boolean resume() {
        lock.lock();
        try {
            if (status != WorkflowStatus.PAUSED) {
                log.warn("Cannot resume workflow {} in state {}", workflowId, status);
                return false;
            }
            transition(WorkflowStatus.RUNNING, clock.instant());
            return true;
        } finally {
            lock.unlock();
            signals.offer(Signal.WAKE);
        }
    }

    /**
     * Cancel the workflow: signal running tasks, cancel every waiting task and
     * mark the workflow CANCELLED.
     *
     * @return false if the workflow is already terminal
     */
    public boolean cancel() {
        lock.lock();
        try {
            if (status.isTerminal()) {
                log.warn("Cannot cancel workflow {} - already in terminal state: {}", workflowId, status);
                return false;
            }
            Instant now = clock.instant();
            List<RunningAttempt> running = slotPool.abandonAll("workflow cancelled");
            List<Task> discarded = queue.cancelWaiting("Workflow cancelled", now);
            for (RunningAttempt attempt : running) {
                queue.markCancelled(attempt.taskId(), "Workflow cancelled", false, now);
            }
            log.info("Cancelling workflow {}: {} running task(s) signalled, {} waiting task(s) discarded",
                    workflowId, running.size(), discarded.size());
            transition(WorkflowStatus.CANCELLED, now);
            return true;
        } finally {
            lock.unlock();
            signals.offer(Signal.WAKE);
        }
    }

    /**
     * Cancel one task. A running task is signalled and its slot released.
     * Dependents are then handled as after a terminal failure.
     *
     * @return false if the task is unknown or already terminal
     */
    public boolean cancelTask(String taskId) {
        lock.lock();
        try {
            Optional<Task> task = queue.getTask(taskId);
            if (task.isEmpty() || task.get().isTerminal()) {
                log.warn("Cannot cancel task {}: {}", taskId,
                        task.map(t -> "already " + t.status()).orElse("not found"));
                return false;
            }
            Instant now = clock.instant();
            slotPool.abandon(taskId, "task cancelled");
            List<Task> blocked = queue.markCancelled(taskId, "Cancelled by request", true, now);
            rootCauses.add(taskId);
            log.info("Task {} cancelled ({} dependent(s) blocked)", taskId, blocked.size());
            Task cancelled = queue.getTask(taskId).orElseThrow();
            fire(l -> l.onTaskFailed(cancelled));
            fireBlocked(blocked);
            publishView();
            return true;
        } finally {
            lock.unlock();
            signals.offer(Signal.WAKE);
        }
    }

    private void transition(WorkflowStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Workflow " + workflowId + ": illegal transition "
                    + status + " -> " + target);
        }
        WorkflowStatus previous = status;
        status = target;
        if (target == WorkflowStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal()) {
            finishedAt = now;
            queue.close();
        }
        log.info("Workflow {}: {} -> {}", workflowId, previous, target);
        publishView();
        persist();

        if (target.isTerminal()) {
            WorkflowSummary summary = summary();
            log.info("Workflow {} finished {} in {}ms: {}", workflowId, target, summary.duration().toMillis(),
                    summary.stats().byStatus());
            fire(l -> l.onWorkflowFinished(summary));
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<TaskStatus> getTaskStatus(String taskId) {
        return queue.getTaskStatus(taskId);
    }

    public Optional<Task> getTask(String taskId) {
        return queue.getTask(taskId);
    }

    public QueueStats getQueueStats() {
        return queue.getQueueStats();
    }

    /** Consistent view of the workflow; never blocks on the loop */
    public WorkflowView getWorkflowStatus() {
        return view;
    }

    public List<Task> findByStatus(TaskStatus status) {
        return queue.findByStatus(status);
    }

    public List<Task> findByTag(String tag) {
        return queue.findByTag(tag);
    }

    public ExecutionPlan executionPlan() {
        return queue.executionPlan();
    }

    /** Remove SUCCEEDED tasks nothing unfinished depends on */
    public int clearCompleted() {
        lock.lock();
        try {
            int removed = queue.clearCompleted();
            publishView();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Summary of the workflow as it stands now */
    public WorkflowSummary summary() {
        lock.lock();
        try {
            Map<String, String> errors = new LinkedHashMap<>();
            for (Task t : queue.tasks()) {
                if (t.status() != TaskStatus.SUCCEEDED && t.errorMessage() != null) {
                    errors.put(t.id(), t.errorMessage());
                }
            }
            return new WorkflowSummary(workflowId, status, options.strategy(), queue.getQueueStats(),
                    rootCauses, errors, startedAt, finishedAt);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------------

    /** Capture the current state without persisting it */
    public QueueSnapshot captureSnapshot() {
        lock.lock();
        try {
            return new QueueSnapshot(
                    workflowId,
                    status,
                    options.strategy(),
                    options.maxConcurrent(),
                    queue.options().continueOnFailure(),
                    queue.nextSequence(),
                    rootCauses,
                    startedAt,
                    finishedAt,
                    clock.instant(),
                    queue.tasks().stream().map(TaskRecord::from).toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Capture and persist the current state.
     *
     * @throws SnapshotException if the store fails
     */
    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            QueueSnapshot snapshot = captureSnapshot();
            snapshotStore.save(snapshot);
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    // Lifecycle transitions must not fail because the store is down.
    private void persist() {
        try {
            snapshotStore.save(captureSnapshot());
        } catch (SnapshotException e) {
            log.error("Failed to persist workflow {}: {}", workflowId, e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------

    private void publishView() {
        view = new WorkflowView(
                workflowId,
                status,
                options.strategy(),
                options.maxConcurrent(),
                queue.options().continueOnFailure(),
                queue.getQueueStats(),
                slotPool.runningIds(),
                rootCauses,
                startedAt,
                finishedAt);
    }

    private void fire(Consumer<WorkflowListener> event) {
        for (WorkflowListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.error("Workflow listener {} failed", listener.getClass().getName(), e);
            }
        }
    }

    private void fireBlocked(List<Task> blocked) {
        for (Task t : blocked) {
            fire(l -> l.onTaskBlocked(t));
        }
    }

    private ExecutorService coordinator() {
        lock.lock();
        try {
            if (coordinator == null) {
                coordinator = Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "taskweave-coordinator-" + workflowId);
                    t.setDaemon(true);
                    return t;
                });
            }
            return coordinator;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release worker threads. Running attempts are signalled; the workflow status
     * is left as is so a later restore can pick it up.
     */
    @Override
    public void close() {
        closed = true;
        signals.offer(Signal.WAKE);
        lock.lock();
        try {
            slotPool.close();
            if (coordinator != null) {
                coordinator.shutdownNow();
            }
        } finally {
            lock.unlock();
        }
    }
}
