package taskweave.engine.config;

import taskweave.engine.api.v1.HealthController;
import taskweave.engine.api.v1.TaskController;
import taskweave.engine.api.v1.WorkflowController;
import taskweave.engine.queue.TaskQueue;
import taskweave.engine.retry.RetryController;
import taskweave.engine.scheduler.SnapshotScheduler;
import taskweave.engine.server.EngineHttpServer;
import taskweave.engine.server.RouterHandler;
import taskweave.engine.store.Database;
import taskweave.engine.store.JdbcSnapshotStore;
import taskweave.engine.store.JsonFileSnapshotStore;
import taskweave.engine.store.QueueSnapshot;
import taskweave.engine.store.SnapshotStore;
import taskweave.engine.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Manual dependency injection container for one workflow.
 * Creates and wires the store, queue, orchestrator, HTTP router and scheduler.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv(), "nightly-build");
 * deps.orchestrator().addTask(...);
 * deps.startScheduler();            // periodic snapshots
 * deps.startServer();               // optional HTTP API
 * deps.orchestrator().processQueue(executor);
 * deps.close();
 * </pre>
 *
 * If the configured store holds a snapshot for the workflow id, the
 * orchestrator is restored from it instead of starting empty.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database; // null unless persistence is JDBC
    private final SnapshotStore snapshotStore;
    private final RetryController retryController;
    private final WorkflowOrchestrator orchestrator;
    private final boolean restored;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final WorkflowController workflowController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private SnapshotScheduler scheduler;
    private EngineHttpServer server;

    private Dependencies(EngineConfig config, String workflowId, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies for workflow {} with config: {}", workflowId, config);

        // Infrastructure
        switch (config.persistence()) {
            case JDBC -> {
                this.database = new Database(config);
                this.snapshotStore = new JdbcSnapshotStore(database);
            }
            case FILE -> {
                this.database = null;
                this.snapshotStore = new JsonFileSnapshotStore(config.snapshotDir());
            }
            default -> {
                this.database = null;
                this.snapshotStore = SnapshotStore.none();
            }
        }

        // Engine
        this.retryController = new RetryController(config.toRetryPolicy());
        Optional<QueueSnapshot> snapshot = snapshotStore.load(workflowId);
        this.restored = snapshot.isPresent();
        this.orchestrator = snapshot
                .map(s -> WorkflowOrchestrator.restore(s, config.toQueueOptions(), config.toWorkflowOptions(),
                        retryController, snapshotStore, clock))
                .orElseGet(() -> new WorkflowOrchestrator(
                        new TaskQueue(workflowId, config.toQueueOptions(), clock),
                        config.toWorkflowOptions(), retryController, snapshotStore, clock));

        // Controllers (public API)
        this.healthController = new HealthController(orchestrator, snapshotStore);
        this.taskController = new TaskController(orchestrator);
        this.workflowController = new WorkflowController(orchestrator);

        log.info("Dependencies initialized successfully ({} workflow {})",
                restored ? "restored" : "new", workflowId);
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config, String workflowId) {
        return new Dependencies(config, workflowId, Clock.systemUTC());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create(String workflowId) {
        return create(EngineConfig.fromEnv(), workflowId);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public SnapshotStore snapshotStore() {
        return snapshotStore;
    }

    public RetryController retryController() {
        return retryController;
    }

    public WorkflowOrchestrator orchestrator() {
        return orchestrator;
    }

    /** True when the orchestrator was rebuilt from a stored snapshot */
    public boolean restored() {
        return restored;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(workflowController);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    public synchronized EngineHttpServer server() {
        if (server == null) {
            server = new EngineHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return server;
    }

    /**
     * Start the HTTP API.
     *
     * @return false if the port could not be bound
     */
    public boolean startServer() {
        return server().start();
    }

    public synchronized SnapshotScheduler scheduler() {
        if (scheduler == null) {
            scheduler = new SnapshotScheduler(orchestrator, config.snapshotInterval());
        }
        return scheduler;
    }

    /**
     * Start periodic snapshots. Does nothing without a persistent store.
     */
    public void startScheduler() {
        if (config.persistence() == PersistenceMode.NONE) {
            log.info("Persistence disabled, periodic snapshots not scheduled");
            return;
        }
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.close();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator: {}", e.getMessage());
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
