package taskweave.engine.scheduler;

import taskweave.engine.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Takes periodic snapshots of a workflow while it is not terminal.
 * The orchestrator captures each snapshot under its own lock, so a snapshot
 * never sees a half-applied tick.
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class SnapshotScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotScheduler.class);

    private final ScheduledExecutorService executor;
    private final WorkflowOrchestrator orchestrator;
    private final Duration interval;

    private volatile boolean running = false;
    private final AtomicLong snapshotsTaken = new AtomicLong();

    public SnapshotScheduler(WorkflowOrchestrator orchestrator, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskweave-snapshots");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = orchestrator;
        this.interval = interval;
    }

    public void start() {
        if (running) {
            log.warn("Snapshot scheduler already running");
            return;
        }
        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable("snapshot", this::runOnce),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Snapshots of workflow {} scheduled every {}ms", orchestrator.workflowId(), intervalMs);
    }

    /**
     * Take one snapshot now unless the workflow is already terminal (its final
     * state was persisted by the transition itself).
     *
     * @return true if a snapshot was written
     */
    public boolean runOnce() {
        if (orchestrator.getWorkflowStatus().status().isTerminal()) {
            return false;
        }
        orchestrator.snapshot();
        long n = snapshotsTaken.incrementAndGet();
        log.debug("Periodic snapshot #{} of workflow {}", n, orchestrator.workflowId());
        return true;
    }

    public long snapshotsTaken() {
        return snapshotsTaken.get();
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Snapshot scheduler forcefully stopped");
            } else {
                log.info("Snapshot scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
        executor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
