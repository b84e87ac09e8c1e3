package taskweave.engine.workflow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import taskweave.engine.error.TaskValidationException;
import taskweave.engine.error.WorkflowFailedException;
import taskweave.engine.executor.CancellationToken;
import taskweave.engine.executor.ExecutionResult;
import taskweave.engine.executor.TaskExecutor;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.ExecutionStrategy;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskDescriptor;
import taskweave.engine.model.TaskPriority;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.model.WorkflowStatus;
import taskweave.engine.model.WorkflowSummary;
import taskweave.engine.model.WorkflowView;
import taskweave.engine.queue.QueueOptions;
import taskweave.engine.queue.TaskQueue;
import taskweave.engine.retry.RetryController;
import taskweave.engine.retry.RetryDecision;
import taskweave.engine.retry.RetryPolicy;
import taskweave.engine.store.JsonFileSnapshotStore;
import taskweave.engine.store.QueueSnapshot;
import taskweave.engine.store.SnapshotStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class WorkflowOrchestratorTest {

    private static final RetryPolicy FAST_RETRY =
            new RetryPolicy(Duration.ofMillis(30), 2.0, Duration.ofMillis(500), false);

    private final List<WorkflowOrchestrator> created = new ArrayList<>();

    @AfterEach
    void tearDown() {
        created.forEach(WorkflowOrchestrator::close);
    }

    private WorkflowOrchestrator orchestrator(WorkflowOptions options, QueueOptions queueOptions) {
        return orchestrator(options, queueOptions, SnapshotStore.none());
    }

    private WorkflowOrchestrator orchestrator(WorkflowOptions options, QueueOptions queueOptions,
            SnapshotStore store) {
        WorkflowOrchestrator o = new WorkflowOrchestrator(new TaskQueue("wf-test", queueOptions),
                options, new RetryController(FAST_RETRY), store, Clock.systemUTC());
        created.add(o);
        return o;
    }

    private WorkflowOrchestrator parallel(int maxConcurrent) {
        return orchestrator(WorkflowOptions.defaults().withStrategy(ExecutionStrategy.PARALLEL)
                .withMaxConcurrent(maxConcurrent), QueueOptions.defaults());
    }

    private static TaskDescriptor task(String id, String... deps) {
        return TaskDescriptor.builder(id).payload("step").dependsOn(deps).build();
    }

    private static TaskExecutor succeedAll() {
        return (task, token) -> ExecutionResult.success(task.id() + "-done");
    }

    /** Executor that tracks how many attempts overlap */
    private static final class ConcurrencyProbe implements TaskExecutor {
        final AtomicInteger current = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();
        private final long sleepMillis;

        ConcurrencyProbe(long sleepMillis) {
            this.sleepMillis = sleepMillis;
        }

        @Override
        public ExecutionResult execute(Task task, CancellationToken token) throws Exception {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(sleepMillis);
            } finally {
                current.decrementAndGet();
            }
            return ExecutionResult.ok();
        }
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("With a single slot, tasks run by priority then submission order")
    void priorityOrderWithSingleSlot() {
        WorkflowOrchestrator o = parallel(1);
        o.addTasks(List.of(
                TaskDescriptor.builder("low").payload("x").priority(TaskPriority.LOW).build(),
                TaskDescriptor.builder("normal-1").payload("x").build(),
                TaskDescriptor.builder("high").payload("x").priority(TaskPriority.HIGH).build(),
                TaskDescriptor.builder("normal-2").payload("x").build()));
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        WorkflowSummary summary = o.processQueue((task, token) -> {
            order.add(task.id());
            return ExecutionResult.ok();
        });

        assertEquals(List.of("high", "normal-1", "normal-2", "low"), order);
        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        assertTrue(summary.isSuccess());
    }

    @Test
    void sequentialStrategyRunsOneAtATime() {
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults().withStrategy(ExecutionStrategy.SEQUENTIAL)
                .withMaxConcurrent(4), QueueOptions.defaults());
        for (int i = 0; i < 5; i++) {
            o.addTask(task("t" + i));
        }
        ConcurrencyProbe probe = new ConcurrencyProbe(10);

        o.processQueue(probe);

        assertEquals(1, probe.peak.get());
    }

    @Test
    void maxConcurrentIsNeverExceeded() {
        WorkflowOrchestrator o = parallel(3);
        for (int i = 0; i < 12; i++) {
            o.addTask(task("t" + i));
        }
        ConcurrencyProbe probe = new ConcurrencyProbe(30);

        WorkflowSummary summary = o.processQueue(probe);

        assertTrue(probe.peak.get() <= 3, "peak was " + probe.peak.get());
        assertTrue(probe.peak.get() > 1, "tasks never overlapped");
        assertEquals(12, summary.stats().count(TaskStatus.SUCCEEDED));
    }

    @Test
    void dependenciesRunInOrder() {
        WorkflowOrchestrator o = parallel(4);
        o.addTasks(List.of(task("package", "test"), task("test", "compile"), task("compile")));
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        o.processQueue((task, token) -> {
            order.add(task.id());
            return ExecutionResult.ok();
        });

        assertEquals(List.of("compile", "test", "package"), order);
    }

    @Test
    void resultIsStoredOnTask() {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(task("a"));

        o.processQueue(succeedAll());

        Task a = o.getTask("a").orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, a.status());
        assertEquals("a-done", a.result());
        assertEquals(1, a.attempts());
        assertNotNull(a.startedAt());
        assertNotNull(a.finishedAt());
    }

    @Test
    void emptyWorkflowCompletesImmediately() {
        WorkflowOrchestrator o = parallel(2);

        WorkflowSummary summary = o.processQueue(succeedAll());

        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        assertEquals(0, summary.stats().total());
    }

    // ---------------------------------------------------------------------
    // Retries and failure propagation
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("A flaky task succeeds on its third attempt after growing backoff gaps")
    void retriesWithBackoff() {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(task("flaky"));
        List<Long> starts = Collections.synchronizedList(new ArrayList<>());

        WorkflowSummary summary = o.processQueue((task, token) -> {
            starts.add(System.nanoTime());
            if (task.attempts() < 3) {
                throw new IllegalStateException("transient glitch " + task.attempts());
            }
            return ExecutionResult.ok();
        });

        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        Task flaky = o.getTask("flaky").orElseThrow();
        assertEquals(3, flaky.attempts());
        assertEquals(List.of("Attempt 1: transient glitch 1", "Attempt 2: transient glitch 2"),
                flaky.errorHistory());
        assertEquals(3, starts.size());
        long firstGap = TimeUnit.NANOSECONDS.toMillis(starts.get(1) - starts.get(0));
        long secondGap = TimeUnit.NANOSECONDS.toMillis(starts.get(2) - starts.get(1));
        assertTrue(firstGap >= 25, "first gap " + firstGap + "ms");
        assertTrue(secondGap >= 55, "second gap " + secondGap + "ms");
    }

    @Test
    @DisplayName("When A fails terminally, B is blocked and never dispatched")
    void failedDependencyBlocksDependents() {
        WorkflowOrchestrator o = parallel(2);
        o.addTasks(List.of(task("a"), task("b", "a"), task("c", "b"), task("independent")));
        Map<String, Integer> calls = new ConcurrentHashMap<>();

        WorkflowSummary summary = o.processQueue((task, token) -> {
            calls.merge(task.id(), 1, Integer::sum);
            if (task.id().equals("a")) {
                return ExecutionResult.failure("compile error");
            }
            return ExecutionResult.ok();
        });

        assertEquals(WorkflowStatus.FAILED, summary.status());
        assertEquals(3, calls.get("a"));
        assertFalse(calls.containsKey("b"));
        assertFalse(calls.containsKey("c"));
        assertEquals(1, calls.get("independent"));
        assertEquals(TaskStatus.FAILED, o.getTaskStatus("a").orElseThrow());
        assertEquals(TaskStatus.BLOCKED, o.getTaskStatus("b").orElseThrow());
        assertEquals(TaskStatus.BLOCKED, o.getTaskStatus("c").orElseThrow());
        assertEquals(ErrorKind.DEPENDENCY_FAILED, o.getTask("c").orElseThrow().errorKind());
        assertEquals(List.of("a"), summary.rootCauseTaskIds());
        assertEquals("compile error", summary.errors().get("a"));
        assertThrows(WorkflowFailedException.class, summary::orThrow);
    }

    @Test
    void permanentFailureSkipsRemainingAttempts() {
        WorkflowOrchestrator o = parallel(1);
        o.addTask(TaskDescriptor.builder("a").payload("x").maxAttempts(5).build());
        AtomicInteger calls = new AtomicInteger();

        o.processQueue((task, token) -> {
            calls.incrementAndGet();
            return ExecutionResult.permanentFailure("schema mismatch");
        });

        assertEquals(1, calls.get());
        assertEquals(TaskStatus.FAILED, o.getTaskStatus("a").orElseThrow());
    }

    @Test
    void continueOnFailureRunsDependentsAnyway() {
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults(),
                QueueOptions.defaults().withContinueOnFailure(true).withDefaultMaxAttempts(1));
        o.addTasks(List.of(task("a"), task("b", "a")));
        List<String> ran = Collections.synchronizedList(new ArrayList<>());

        WorkflowSummary summary = o.processQueue((task, token) -> {
            ran.add(task.id());
            if (task.id().equals("a")) {
                throw new RuntimeException("disk full");
            }
            return ExecutionResult.ok();
        });

        assertEquals(List.of("a", "b"), ran);
        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        assertFalse(summary.isSuccess());
        assertEquals(TaskStatus.SUCCEEDED, o.getTaskStatus("b").orElseThrow());
        assertEquals(List.of("a"), summary.rootCauseTaskIds());
    }

    @Test
    void timedOutAttemptIsAbandoned() {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(TaskDescriptor.builder("slow").payload("x").maxAttempts(1)
                .timeout(Duration.ofMillis(100)).build());
        long started = System.nanoTime();

        WorkflowSummary summary = o.processQueue((task, token) -> {
            Thread.sleep(10_000);
            return ExecutionResult.ok();
        });

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
        assertEquals(WorkflowStatus.FAILED, summary.status());
        Task slow = o.getTask("slow").orElseThrow();
        assertEquals(TaskStatus.FAILED, slow.status());
        assertEquals(ErrorKind.TIMEOUT, slow.errorKind());
    }

    @Test
    void timedOutAttemptIsRetried() {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(TaskDescriptor.builder("slow-once").payload("x").maxAttempts(2)
                .timeout(Duration.ofMillis(100)).build());

        WorkflowSummary summary = o.processQueue((task, token) -> {
            if (task.attempts() == 1) {
                Thread.sleep(10_000);
            }
            return ExecutionResult.ok();
        });

        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        Task t = o.getTask("slow-once").orElseThrow();
        assertEquals(2, t.attempts());
        assertEquals(1, t.errorHistory().size());
    }

    // ---------------------------------------------------------------------
    // Adaptive concurrency
    // ---------------------------------------------------------------------

    @Test
    void adaptiveFollowsReadyWidth() {
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults().withMaxConcurrent(5),
                QueueOptions.defaults());
        o.addTasks(List.of(task("root"), task("x", "root"), task("y", "root")));
        ConcurrencyProbe probe = new ConcurrencyProbe(50);

        o.processQueue(probe);

        assertEquals(2, probe.peak.get());
    }

    @Test
    @DisplayName("Degraded ready tasks only widen adaptive concurrency when configured to")
    void adaptiveDegradedCounting() {
        assertEquals(3, peakWithDegraded(true));
        assertEquals(1, peakWithDegraded(false));
    }

    private int peakWithDegraded(boolean countDegraded) {
        WorkflowOrchestrator o = orchestrator(
                WorkflowOptions.defaults().withMaxConcurrent(5).withAdaptiveCountsDegraded(countDegraded),
                QueueOptions.defaults().withContinueOnFailure(true).withDefaultMaxAttempts(1));
        o.addTasks(List.of(task("root"), task("x", "root"), task("y", "root"), task("z", "root")));
        ConcurrencyProbe probe = new ConcurrencyProbe(80);

        o.processQueue((task, token) -> {
            if (task.id().equals("root")) {
                return ExecutionResult.failure("root failed");
            }
            return probe.execute(task, token);
        });
        return probe.peak.get();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void pauseLetsRunningTaskFinishThenResumeContinues() throws Exception {
        WorkflowOrchestrator o = parallel(1);
        o.addTasks(List.of(task("a"), task("b"), task("c")));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> ran = Collections.synchronizedList(new ArrayList<>());
        TaskExecutor executor = (task, token) -> {
            ran.add(task.id());
            if (task.id().equals("a")) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
            return ExecutionResult.ok();
        };

        CompletableFuture<WorkflowSummary> run = o.processQueueAsync(executor);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(o.pause());
        assertFalse(o.pause());
        release.countDown();

        WorkflowSummary paused = run.get(5, TimeUnit.SECONDS);
        assertEquals(WorkflowStatus.PAUSED, paused.status());
        assertEquals(List.of("a"), ran);
        assertEquals(TaskStatus.SUCCEEDED, o.getTaskStatus("a").orElseThrow());
        assertFalse(o.getTaskStatus("b").orElseThrow().isTerminal());

        assertTrue(o.resume());
        assertFalse(o.resume());
        WorkflowSummary done = o.processQueue(executor);
        assertEquals(WorkflowStatus.COMPLETED, done.status());
        assertEquals(List.of("a", "b", "c"), ran);
    }

    @Test
    void pauseBeforeStartDispatchesNothing() {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(task("a"));
        AtomicInteger calls = new AtomicInteger();

        assertTrue(o.pause());
        WorkflowSummary summary = o.processQueue((task, token) -> {
            calls.incrementAndGet();
            return ExecutionResult.ok();
        });

        assertEquals(WorkflowStatus.PAUSED, summary.status());
        assertEquals(0, calls.get());
    }

    @Test
    void cancelSignalsRunningAndDiscardsWaiting() throws Exception {
        WorkflowOrchestrator o = parallel(1);
        o.addTasks(List.of(task("a"), task("b", "a"), task("c")));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch sawCancel = new CountDownLatch(1);

        CompletableFuture<WorkflowSummary> run = o.processQueueAsync((task, token) -> {
            started.countDown();
            token.onCancel(sawCancel::countDown);
            while (!token.isCancelled()) {
                Thread.sleep(5);
            }
            token.throwIfCancelled();
            return ExecutionResult.ok();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(o.cancel());
        assertFalse(o.cancel());

        WorkflowSummary summary = run.get(5, TimeUnit.SECONDS);
        assertTrue(sawCancel.await(5, TimeUnit.SECONDS));
        assertEquals(WorkflowStatus.CANCELLED, summary.status());
        for (String id : List.of("a", "b", "c")) {
            assertEquals(TaskStatus.CANCELLED, o.getTaskStatus(id).orElseThrow(), id);
        }
        TaskValidationException e = assertThrows(TaskValidationException.class, () -> o.addTask(task("late")));
        assertEquals(TaskValidationException.Reason.WORKFLOW_CLOSED, e.reason());
    }

    @Test
    void cancelTaskBlocksDependents() {
        WorkflowOrchestrator o = parallel(2);
        o.addTasks(List.of(task("a"), task("b", "a"), task("c")));

        assertTrue(o.cancelTask("a"));
        assertFalse(o.cancelTask("a"));
        assertFalse(o.cancelTask("missing"));
        WorkflowSummary summary = o.processQueue(succeedAll());

        assertEquals(TaskStatus.CANCELLED, o.getTaskStatus("a").orElseThrow());
        assertEquals(TaskStatus.BLOCKED, o.getTaskStatus("b").orElseThrow());
        assertEquals(TaskStatus.SUCCEEDED, o.getTaskStatus("c").orElseThrow());
        assertEquals(WorkflowStatus.FAILED, summary.status());
        assertEquals(List.of("a"), summary.rootCauseTaskIds());
    }

    @Test
    void tasksAddedWhileRunningArePickedUp() throws Exception {
        WorkflowOrchestrator o = parallel(2);
        o.addTask(task("a"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<WorkflowSummary> run = o.processQueueAsync((task, token) -> {
            if (task.id().equals("a")) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
            return ExecutionResult.ok();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        WorkflowView view = awaitView(o, v -> !v.runningTaskIds().isEmpty());
        assertEquals(WorkflowStatus.RUNNING, view.status());
        assertEquals(List.of("a"), view.runningTaskIds());
        assertEquals(TaskStatus.RUNNING, o.getTaskStatus("a").orElseThrow());

        o.addTask(task("b", "a"));
        release.countDown();

        WorkflowSummary summary = run.get(5, TimeUnit.SECONDS);
        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        assertEquals(2, summary.stats().count(TaskStatus.SUCCEEDED));
        assertEquals(100, o.getWorkflowStatus().progressPercent());
    }

    private static WorkflowView awaitView(WorkflowOrchestrator o, Predicate<WorkflowView> condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            WorkflowView view = o.getWorkflowStatus();
            if (condition.test(view)) {
                return view;
            }
            Thread.sleep(5);
        }
        return fail("view never matched: " + o.getWorkflowStatus());
    }

    @Test
    void secondConcurrentLoopIsRejected() throws Exception {
        WorkflowOrchestrator o = parallel(1);
        o.addTask(task("a"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<WorkflowSummary> run = o.processQueueAsync((task, token) -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return ExecutionResult.ok();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(o.isProcessing());
        assertThrows(IllegalStateException.class, () -> o.processQueue(succeedAll()));
        release.countDown();
        assertEquals(WorkflowStatus.COMPLETED, run.get(5, TimeUnit.SECONDS).status());
    }

    @Test
    void finishedWorkflowReturnsImmediately() {
        WorkflowOrchestrator o = parallel(1);
        o.addTask(task("a"));
        o.processQueue(succeedAll());
        AtomicInteger calls = new AtomicInteger();

        WorkflowSummary again = o.processQueue((task, token) -> {
            calls.incrementAndGet();
            return ExecutionResult.ok();
        });

        assertEquals(WorkflowStatus.COMPLETED, again.status());
        assertEquals(0, calls.get());
    }

    // ---------------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------------

    @Test
    void listenersReceiveEvents() {
        WorkflowOrchestrator o = parallel(2);
        o.addTasks(List.of(task("ok"), task("flaky"), task("doomed"), task("child", "doomed")));
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        o.addListener(new WorkflowListener() {
            @Override
            public void onTaskSucceeded(Task task) {
                events.add("succeeded:" + task.id());
            }

            @Override
            public void onTaskRetrying(Task task, RetryDecision decision) {
                events.add("retrying:" + task.id());
            }

            @Override
            public void onTaskFailed(Task task) {
                events.add("failed:" + task.id());
            }

            @Override
            public void onTaskBlocked(Task task) {
                events.add("blocked:" + task.id());
            }

            @Override
            public void onWorkflowFinished(WorkflowSummary summary) {
                events.add("finished:" + summary.status());
            }
        });
        o.addListener(new WorkflowListener() {
            @Override
            public void onTaskSucceeded(Task task) {
                throw new IllegalStateException("listener bug");
            }
        });

        o.processQueue((task, token) -> switch (task.id()) {
            case "flaky" -> task.attempts() == 1 ? ExecutionResult.failure("once") : ExecutionResult.ok();
            case "doomed" -> ExecutionResult.permanentFailure("nope");
            default -> ExecutionResult.ok();
        });

        assertTrue(events.contains("succeeded:ok"));
        assertTrue(events.contains("retrying:flaky"));
        assertTrue(events.contains("succeeded:flaky"));
        assertTrue(events.contains("failed:doomed"));
        assertTrue(events.contains("blocked:child"));
        assertEquals("finished:FAILED", events.get(events.size() - 1));
    }

    // ---------------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------------

    /** Keeps the last saved snapshot per workflow */
    private static final class MemoryStore implements SnapshotStore {
        final Map<String, QueueSnapshot> saved = new ConcurrentHashMap<>();

        @Override
        public void save(QueueSnapshot snapshot) {
            saved.put(snapshot.workflowId(), snapshot);
        }

        @Override
        public Optional<QueueSnapshot> load(String workflowId) {
            return Optional.ofNullable(saved.get(workflowId));
        }

        @Override
        public void delete(String workflowId) {
            saved.remove(workflowId);
        }

        @Override
        public String kind() {
            return "memory";
        }
    }

    @Test
    void lifecycleTransitionsArePersisted() {
        MemoryStore store = new MemoryStore();
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults(), QueueOptions.defaults(), store);
        o.addTask(task("a"));

        o.processQueue(succeedAll());

        QueueSnapshot last = store.load("wf-test").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, last.status());
        assertEquals(TaskStatus.SUCCEEDED, last.task("a").orElseThrow().status());
    }

    @Test
    @DisplayName("A result Jackson cannot encode does not stop later snapshots")
    void unserializableResultIsPersistedAsText(@TempDir Path dir) {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults(), QueueOptions.defaults(), store);
        o.addTasks(List.of(task("a"), task("b", "a")));
        Object handle = new Object() {
            @Override
            public String toString() {
                return "connection-handle";
            }
        };

        WorkflowSummary summary = o.processQueue((task, token) -> ExecutionResult.success(handle));

        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        QueueSnapshot saved = store.load("wf-test").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, saved.status());
        assertEquals(TaskStatus.SUCCEEDED, saved.task("a").orElseThrow().status());
        assertEquals("connection-handle", saved.task("b").orElseThrow().result());
        assertSame(handle, o.getTask("a").orElseThrow().result());
        assertNotNull(o.snapshot());
    }

    @Test
    void restoredWorkflowFinishesRemainingWork() {
        MemoryStore store = new MemoryStore();
        WorkflowOrchestrator o = orchestrator(WorkflowOptions.defaults().withStrategy(ExecutionStrategy.PARALLEL)
                .withMaxConcurrent(3), QueueOptions.defaults(), store);
        o.addTasks(List.of(task("a"), task("b", "a"), task("c", "b")));
        o.addListener(new WorkflowListener() {
            @Override
            public void onTaskSucceeded(Task task) {
                if (task.id().equals("a")) {
                    o.pause();
                }
            }
        });
        o.processQueue(succeedAll());
        QueueSnapshot snapshot = o.snapshot();
        o.close();
        assertEquals(WorkflowStatus.PAUSED, snapshot.status());

        WorkflowOrchestrator restored = WorkflowOrchestrator.restore(store.load("wf-test").orElseThrow(),
                QueueOptions.defaults(), WorkflowOptions.defaults(), new RetryController(FAST_RETRY), store,
                Clock.systemUTC());
        created.add(restored);
        List<String> ran = Collections.synchronizedList(new ArrayList<>());

        assertEquals(ExecutionStrategy.PARALLEL, restored.options().strategy());
        assertEquals(3, restored.options().maxConcurrent());
        assertEquals(WorkflowStatus.PAUSED, restored.getWorkflowStatus().status());
        assertTrue(restored.resume());
        WorkflowSummary summary = restored.processQueue((task, token) -> {
            ran.add(task.id());
            return ExecutionResult.ok();
        });

        assertEquals(List.of("b", "c"), ran);
        assertEquals(WorkflowStatus.COMPLETED, summary.status());
        assertEquals("a-done", restored.getTask("a").orElseThrow().result());
    }

    @Test
    void clearCompletedDropsFinishedTasks() {
        WorkflowOrchestrator o = parallel(2);
        o.addTasks(List.of(task("a"), task("b")));
        o.processQueue(succeedAll());

        assertEquals(2, o.clearCompleted());
        assertEquals(0, o.getQueueStats().total());
        assertTrue(o.findByStatus(TaskStatus.SUCCEEDED).isEmpty());
    }
}
