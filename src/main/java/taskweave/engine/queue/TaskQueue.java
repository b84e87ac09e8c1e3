package taskweave.engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.DependencyFailedException;
import taskweave.engine.error.TaskValidationException;
import taskweave.engine.error.TaskValidationException.Reason;
import taskweave.engine.graph.DependencyGraph;
import taskweave.engine.graph.DependencyResolver;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.ExecutionPlan;
import taskweave.engine.model.QueueStats;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskDescriptor;
import taskweave.engine.model.TaskStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Task registry, dependency graph and ready queue of one workflow.
 *
 * All mutations run under an internal lock and end by republishing an immutable
 * view, so {@link #getTask}, {@link #getQueueStats} and the other queries never
 * block on the coordinating loop.
 */
public final class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final String workflowId;
    private final QueueOptions options;
    private final Clock clock;
    private final DependencyResolver resolver;
    private final DependencyGraph graph = new DependencyGraph();
    private final ReadyQueue readyQueue = new ReadyQueue();
    private final TaskRegistry registry;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile QueueStats stats;
    private boolean closed;

    public TaskQueue(String workflowId, QueueOptions options) {
        this(workflowId, options, Clock.systemUTC());
    }

    public TaskQueue(String workflowId, QueueOptions options, Clock clock) {
        this(workflowId, options, clock, 0L);
    }

    private TaskQueue(String workflowId, QueueOptions options, Clock clock, long nextSequence) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resolver = new DependencyResolver(options.continueOnFailure());
        this.registry = new TaskRegistry(nextSequence);
        publish();
    }

    public String workflowId() {
        return workflowId;
    }

    public QueueOptions options() {
        return options;
    }

    // ---------------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------------

    /**
     * Add one task.
     *
     * @throws TaskValidationException if the descriptor is invalid, the id is taken,
     *                                 a dependency is unknown or the task closes a cycle
     */
    public Task addTask(TaskDescriptor descriptor) {
        return addTasks(List.of(descriptor)).get(0);
    }

    /**
     * Add a batch of tasks atomically. Dependencies may point at tasks earlier
     * or later in the same batch. Either every task is added or none is.
     */
    public List<Task> addTasks(List<TaskDescriptor> descriptors) {
        lock.lock();
        try {
            if (closed) {
                throw new TaskValidationException(Reason.WORKFLOW_CLOSED, null,
                        "Workflow " + workflowId + " no longer accepts tasks");
            }
            Map<String, Set<String>> batch = new LinkedHashMap<>();
            for (TaskDescriptor d : descriptors) {
                validate(d);
                if (batch.put(d.id(), d.dependencies()) != null) {
                    throw new TaskValidationException(Reason.DUPLICATE_ID, d.id(),
                            "Task " + d.id() + " submitted twice in one batch");
                }
            }
            graph.addAll(batch);

            Instant now = clock.instant();
            List<Task> added = new ArrayList<>(descriptors.size());
            for (TaskDescriptor d : descriptors) {
                Task task = Task.builder()
                        .id(d.id())
                        .workflowId(workflowId)
                        .payload(d.payload())
                        .priority(d.priority())
                        .dependencies(d.dependencies())
                        .tags(d.tags())
                        .status(TaskStatus.PENDING)
                        .maxAttempts(d.maxAttempts() != null ? d.maxAttempts() : options.defaultMaxAttempts())
                        .timeout(d.timeout() != null ? d.timeout() : options.defaultTimeout())
                        .sequence(registry.allocateSequence())
                        .createdAt(now)
                        .build();
                registry.put(task);
                added.add(task);
                log.info("Task {} added (priority={}, dependencies={})", task.id(), task.priority(),
                        task.dependencies());
            }
            if (resolver.propagatesFailure()) {
                for (Task task : added) {
                    blockIfUpstreamFailed(task.id(), now);
                }
            }
            return added.stream().map(t -> registry.get(t.id())).toList();
        } finally {
            publish();
            lock.unlock();
        }
    }

    private static void validate(TaskDescriptor d) {
        if (d == null) {
            throw new TaskValidationException(Reason.INVALID_DESCRIPTOR, null, "descriptor is required");
        }
        if (d.id() == null || d.id().isBlank()) {
            throw new TaskValidationException(Reason.INVALID_DESCRIPTOR, d.id(), "task id is required");
        }
        if (d.payload() == null) {
            throw new TaskValidationException(Reason.INVALID_DESCRIPTOR, d.id(),
                    "Task " + d.id() + " has no payload");
        }
        if (d.maxAttempts() != null && d.maxAttempts() < 1) {
            throw new TaskValidationException(Reason.INVALID_DESCRIPTOR, d.id(),
                    "Task " + d.id() + ": maxAttempts must be >= 1");
        }
        Duration timeout = d.timeout();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new TaskValidationException(Reason.INVALID_DESCRIPTOR, d.id(),
                    "Task " + d.id() + ": timeout must be positive");
        }
    }

    /** Stop accepting new tasks; called once the workflow is terminal */
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    /**
     * Tasks that could enter the ready queue right now. Does not change state.
     */
    public List<Task> readySet(Instant now) {
        lock.lock();
        try {
            return resolver.readySet(registry.all(), registry::get, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move every eligible task to READY and into the ready queue.
     *
     * @return the tasks promoted by this call
     */
    public List<Task> promoteReady(Instant now) {
        lock.lock();
        try {
            List<Task> promoted = new ArrayList<>();
            for (Task t : resolver.readySet(registry.all(), registry::get, now)) {
                Task ready = registry.transition(t.id(), TaskStatus.READY, b -> b.nextAttemptAt(null));
                readyQueue.offer(ready);
                promoted.add(ready);
            }
            if (!promoted.isEmpty()) {
                log.debug("Promoted {} task(s) to READY, {} queued", promoted.size(), readyQueue.size());
            }
            return promoted;
        } finally {
            publish();
            lock.unlock();
        }
    }

    /**
     * Number of queued ready tasks used to size adaptive concurrency.
     *
     * @param countDegraded include tasks that have a dependency which ended without succeeding
     */
    public int readyWidth(boolean countDegraded) {
        lock.lock();
        try {
            if (countDegraded) {
                return readyQueue.size();
            }
            int width = 0;
            for (String id : readyQueue.ids()) {
                if (!resolver.isDegraded(registry.get(id), registry::get)) {
                    width++;
                }
            }
            return width;
        } finally {
            lock.unlock();
        }
    }

    /** Remove the most urgent ready task from the queue, without changing its status */
    public Optional<Task> pollReady() {
        lock.lock();
        try {
            return readyQueue.poll().map(registry::get);
        } finally {
            lock.unlock();
        }
    }

    public int readyCount() {
        lock.lock();
        try {
            return readyQueue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Earliest wake time among RETRY_PENDING tasks */
    public Optional<Instant> nextRetryAt() {
        lock.lock();
        try {
            return registry.all().stream()
                    .filter(t -> t.status() == TaskStatus.RETRY_PENDING && t.nextAttemptAt() != null)
                    .map(Task::nextAttemptAt)
                    .min(Instant::compareTo);
        } finally {
            lock.unlock();
        }
    }

    /** Any task not yet terminal */
    public boolean hasUnfinishedWork() {
        lock.lock();
        try {
            return registry.all().stream().anyMatch(t -> !t.isTerminal());
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // State transitions
    // ---------------------------------------------------------------------

    /** READY -> RUNNING; counts the attempt and stamps the start time */
    public Task markRunning(String id, Instant now) {
        return mutate(() -> registry.transition(id, TaskStatus.RUNNING, b -> b
                .attempts(registry.get(id).attempts() + 1)
                .startedAt(now)
                .finishedAt(null)));
    }

    /** RUNNING -> SUCCEEDED */
    public Task markSucceeded(String id, Object result, Instant now) {
        return mutate(() -> registry.transition(id, TaskStatus.SUCCEEDED, b -> b
                .result(result)
                .finishedAt(now)
                .errorMessage(null)
                .errorKind(null)));
    }

    /** RUNNING -> RETRY_PENDING; the task re-enters the ready set at {@code wakeAt} */
    public Task markRetryPending(String id, Instant wakeAt, ErrorKind kind, String message, Instant now) {
        return mutate(() -> {
            int attempt = registry.get(id).attempts();
            return registry.transition(id, TaskStatus.RETRY_PENDING, b -> b
                    .nextAttemptAt(wakeAt)
                    .finishedAt(now)
                    .errorKind(kind)
                    .errorMessage(message)
                    .addError("Attempt " + attempt + ": " + message));
        });
    }

    /**
     * RUNNING -> FAILED, then block dependents unless continue-on-failure is set.
     *
     * @return the dependents that were blocked
     */
    public List<Task> markFailed(String id, ErrorKind kind, String message, Instant now) {
        lock.lock();
        try {
            int attempt = registry.get(id).attempts();
            registry.transition(id, TaskStatus.FAILED, b -> b
                    .finishedAt(now)
                    .errorKind(kind)
                    .errorMessage(message)
                    .addError("Attempt " + attempt + ": " + message));
            return resolver.propagatesFailure() ? blockDependents(id, now) : List.of();
        } finally {
            publish();
            lock.unlock();
        }
    }

    /**
     * Cancel one task (waiting or running).
     *
     * @param propagate block dependents as after a terminal failure
     * @return the dependents that were blocked
     */
    public List<Task> markCancelled(String id, String reason, boolean propagate, Instant now) {
        lock.lock();
        try {
            readyQueue.remove(id);
            registry.transition(id, TaskStatus.CANCELLED, b -> b
                    .finishedAt(now)
                    .nextAttemptAt(null)
                    .errorKind(ErrorKind.CANCELLED)
                    .errorMessage(reason));
            return propagate && resolver.propagatesFailure() ? blockDependents(id, now) : List.of();
        } finally {
            publish();
            lock.unlock();
        }
    }

    /**
     * Cancel every PENDING, READY and RETRY_PENDING task and empty the ready queue.
     *
     * @return the cancelled tasks
     */
    public List<Task> cancelWaiting(String reason, Instant now) {
        lock.lock();
        try {
            readyQueue.clear();
            List<Task> cancelled = new ArrayList<>();
            for (Task t : new ArrayList<>(registry.all())) {
                if (t.status().isWaiting()) {
                    cancelled.add(registry.transition(t.id(), TaskStatus.CANCELLED, b -> b
                            .finishedAt(now)
                            .nextAttemptAt(null)
                            .errorKind(ErrorKind.CANCELLED)
                            .errorMessage(reason)));
                }
            }
            return cancelled;
        } finally {
            publish();
            lock.unlock();
        }
    }

    // Late submission whose dependency already ended without succeeding.
    private void blockIfUpstreamFailed(String id, Instant now) {
        Task task = registry.get(id);
        if (task.status() != TaskStatus.PENDING) {
            return;
        }
        for (String depId : task.dependencies()) {
            Task dep = registry.get(depId);
            if (dep != null && dep.isTerminal() && dep.status() != TaskStatus.SUCCEEDED) {
                String message = new DependencyFailedException(id, depId).getMessage();
                registry.transition(id, TaskStatus.BLOCKED, b -> b
                        .finishedAt(now)
                        .errorKind(ErrorKind.DEPENDENCY_FAILED)
                        .errorMessage(message));
                log.warn("Task {} blocked on submission by failed dependency {}", id, depId);
                blockDependents(id, now);
                return;
            }
        }
    }

    private List<Task> blockDependents(String rootId, Instant now) {
        List<Task> blocked = new ArrayList<>();
        for (String depId : graph.transitiveDependents(rootId)) {
            Task dependent = registry.get(depId);
            if (dependent == null || !dependent.status().isWaiting()) {
                continue;
            }
            String message = new DependencyFailedException(depId, rootId).getMessage();
            readyQueue.remove(depId);
            blocked.add(registry.transition(depId, TaskStatus.BLOCKED, b -> b
                    .finishedAt(now)
                    .nextAttemptAt(null)
                    .errorKind(ErrorKind.DEPENDENCY_FAILED)
                    .errorMessage(message)));
            log.warn("Task {} blocked by failed dependency {}", depId, rootId);
        }
        return blocked;
    }

    // ---------------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------------

    /**
     * Remove SUCCEEDED tasks that no unfinished task depends on. Terminal
     * dependents of a removed task drop it from their dependency set.
     *
     * @return number of tasks removed
     */
    public int clearCompleted() {
        lock.lock();
        try {
            List<String> removable = new ArrayList<>();
            for (Task t : registry.all()) {
                if (t.status() != TaskStatus.SUCCEEDED) {
                    continue;
                }
                boolean needed = graph.dependentsOf(t.id()).stream()
                        .map(registry::get)
                        .anyMatch(d -> d != null && !d.isTerminal());
                if (!needed) {
                    removable.add(t.id());
                }
            }
            for (String id : removable) {
                for (String dependent : graph.dependentsOf(id)) {
                    if (!removable.contains(dependent)) {
                        registry.update(dependent, b -> b.dependencies(without(registry.get(dependent), id)));
                    }
                }
                graph.remove(id);
                registry.remove(id);
            }
            if (!removable.isEmpty()) {
                log.info("Cleared {} completed task(s) from workflow {}", removable.size(), workflowId);
            }
            return removable.size();
        } finally {
            publish();
            lock.unlock();
        }
    }

    private static Set<String> without(Task task, String id) {
        Set<String> deps = new LinkedHashSet<>(task.dependencies());
        deps.remove(id);
        return deps;
    }

    // ---------------------------------------------------------------------
    // Queries (lock-free, read the published view)
    // ---------------------------------------------------------------------

    public Optional<Task> getTask(String id) {
        return Optional.ofNullable(registry.view().get(id));
    }

    public Optional<TaskStatus> getTaskStatus(String id) {
        return getTask(id).map(Task::status);
    }

    public QueueStats getQueueStats() {
        return stats;
    }

    /** All tasks in submission order */
    public List<Task> tasks() {
        return List.copyOf(registry.view().values());
    }

    public List<Task> findByStatus(TaskStatus status) {
        return registry.view().values().stream().filter(t -> t.status() == status).toList();
    }

    public List<Task> findByTag(String tag) {
        return registry.view().values().stream().filter(t -> t.hasTag(tag)).toList();
    }

    /** Sequence number the next submitted task will receive */
    public long nextSequence() {
        lock.lock();
        try {
            return registry.nextSequence();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dependency levels, each sorted by dispatch key, plus a topological order.
     */
    public ExecutionPlan executionPlan() {
        lock.lock();
        try {
            Comparator<String> byDispatchKey = dispatchOrder(registry.view());
            List<List<String>> levels = graph.levels(byDispatchKey);
            List<String> order = new ArrayList<>();
            levels.forEach(order::addAll);
            return new ExecutionPlan(levels, order);
        } finally {
            lock.unlock();
        }
    }

    private static Comparator<String> dispatchOrder(Map<String, Task> tasks) {
        return Comparator.<String>comparingInt(id -> tasks.get(id).priority().level())
                .thenComparingLong(id -> tasks.get(id).sequence());
    }

    // ---------------------------------------------------------------------
    // Restore
    // ---------------------------------------------------------------------

    /**
     * Rebuild a queue from persisted task records.
     *
     * RUNNING and READY tasks go back to PENDING with their start time cleared.
     * A RUNNING task also gives back the attempt it was interrupted in, since
     * dispatch counts that attempt again. Every other status is kept as recorded.
     *
     * @throws TaskValidationException if the records do not form a valid graph
     */
    public static TaskQueue restore(String workflowId, QueueOptions options, Clock clock,
            Collection<Task> tasks, long nextSequence) {
        long maxSeen = tasks.stream().mapToLong(Task::sequence).max().orElse(-1L);
        TaskQueue queue = new TaskQueue(workflowId, options, clock, Math.max(nextSequence, maxSeen + 1));

        List<Task> ordered = tasks.stream().sorted(Comparator.comparingLong(Task::sequence)).toList();
        Map<String, Set<String>> batch = new LinkedHashMap<>();
        for (Task t : ordered) {
            if (batch.put(t.id(), t.dependencies()) != null) {
                throw new TaskValidationException(Reason.DUPLICATE_ID, t.id(),
                        "Task " + t.id() + " appears twice in snapshot");
            }
        }
        queue.graph.addAll(batch);

        int reset = 0;
        for (Task t : ordered) {
            Task restored = t;
            if (t.status() == TaskStatus.RUNNING || t.status() == TaskStatus.READY) {
                // an interrupted attempt never reported an outcome; dispatch counts it again
                int attempts = t.status() == TaskStatus.RUNNING ? Math.max(0, t.attempts() - 1) : t.attempts();
                restored = t.toBuilder()
                        .status(TaskStatus.PENDING)
                        .attempts(attempts)
                        .startedAt(null)
                        .finishedAt(null)
                        .build();
                reset++;
            }
            queue.registry.put(restored.toBuilder().workflowId(workflowId).build());
        }
        queue.publish();
        log.info("Restored workflow {} with {} task(s), {} reset to PENDING", workflowId, ordered.size(), reset);
        return queue;
    }

    private Task mutate(Supplier<Task> change) {
        lock.lock();
        try {
            return change.get();
        } finally {
            publish();
            lock.unlock();
        }
    }

    private void publish() {
        registry.publish();
        stats = QueueStats.of(registry.view().values(), readyQueue.size());
    }
}
