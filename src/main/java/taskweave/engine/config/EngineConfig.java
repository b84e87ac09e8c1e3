package taskweave.engine.config;

import taskweave.engine.model.ExecutionStrategy;
import taskweave.engine.queue.QueueOptions;
import taskweave.engine.retry.RetryPolicy;
import taskweave.engine.workflow.WorkflowOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Workflow settings
    private ExecutionStrategy strategy = ExecutionStrategy.ADAPTIVE;
    private int maxConcurrent = 5;
    private boolean continueOnFailure = false;
    private boolean adaptiveCountsDegraded = true;

    // Task settings
    private int defaultMaxAttempts = 3;
    private Duration defaultTaskTimeout = null; // no deadline

    // Retry settings
    private Duration backoffBase = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(60);
    private boolean classifyErrors = false;

    // Persistence settings
    private PersistenceMode persistence = PersistenceMode.NONE;
    private Path snapshotDir = Path.of("data", "snapshots");
    private Duration snapshotInterval = Duration.ofSeconds(30);
    private String databaseUrl = "jdbc:h2:file:./data/taskweave;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Defaults overridden by {@code TASKWEAVE_*} variables found in {@code env}.
     */
    public static EngineConfig fromEnv(Map<String, String> env) {
        EngineConfig config = new EngineConfig();

        String strategy = env.get("TASKWEAVE_STRATEGY");
        if (strategy != null && !strategy.isBlank()) {
            config.strategy = ExecutionStrategy.parse(strategy);
        }

        String maxConcurrent = env.get("TASKWEAVE_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config.maxConcurrent = Integer.parseInt(maxConcurrent.trim());
        }

        String continueOnFailure = env.get("TASKWEAVE_CONTINUE_ON_FAILURE");
        if (continueOnFailure != null && !continueOnFailure.isBlank()) {
            config.continueOnFailure = Boolean.parseBoolean(continueOnFailure.trim());
        }

        String maxAttempts = env.get("TASKWEAVE_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String timeoutMs = env.get("TASKWEAVE_TASK_TIMEOUT_MS");
        if (timeoutMs != null && !timeoutMs.isBlank()) {
            config.defaultTaskTimeout = Duration.ofMillis(Long.parseLong(timeoutMs.trim()));
        }

        String backoffMs = env.get("TASKWEAVE_BACKOFF_BASE_MS");
        if (backoffMs != null && !backoffMs.isBlank()) {
            config.backoffBase = Duration.ofMillis(Long.parseLong(backoffMs.trim()));
        }

        String persistence = env.get("TASKWEAVE_PERSISTENCE");
        if (persistence != null && !persistence.isBlank()) {
            config.persistence = PersistenceMode.parse(persistence);
        }

        String snapshotDir = env.get("TASKWEAVE_SNAPSHOT_DIR");
        if (snapshotDir != null && !snapshotDir.isBlank()) {
            config.snapshotDir = Path.of(snapshotDir.trim());
        }

        String dbUrl = env.get("TASKWEAVE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("TASKWEAVE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        return config;
    }

    /**
     * Defaults overridden by the sections of an INI file.
     *
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static EngineConfig fromIni(Path file) {
        return IniConfigLoader.apply(file, new EngineConfig());
    }

    // Derived value objects
    public QueueOptions toQueueOptions() {
        return new QueueOptions(defaultMaxAttempts, defaultTaskTimeout, continueOnFailure);
    }

    public WorkflowOptions toWorkflowOptions() {
        return new WorkflowOptions(strategy, maxConcurrent, adaptiveCountsDegraded);
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(backoffBase, backoffMultiplier, maxBackoff, classifyErrors);
    }

    // Getters
    public ExecutionStrategy strategy() {
        return strategy;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public boolean continueOnFailure() {
        return continueOnFailure;
    }

    public boolean adaptiveCountsDegraded() {
        return adaptiveCountsDegraded;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public Duration defaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public boolean classifyErrors() {
        return classifyErrors;
    }

    public PersistenceMode persistence() {
        return persistence;
    }

    public Path snapshotDir() {
        return snapshotDir;
    }

    public Duration snapshotInterval() {
        return snapshotInterval;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    // Fluent setters for testing/customization
    public EngineConfig withStrategy(ExecutionStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public EngineConfig withMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    public EngineConfig withContinueOnFailure(boolean continueOnFailure) {
        this.continueOnFailure = continueOnFailure;
        return this;
    }

    public EngineConfig withAdaptiveCountsDegraded(boolean adaptiveCountsDegraded) {
        this.adaptiveCountsDegraded = adaptiveCountsDegraded;
        return this;
    }

    public EngineConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public EngineConfig withTaskTimeout(Duration timeout) {
        this.defaultTaskTimeout = timeout;
        return this;
    }

    public EngineConfig withBackoffBase(Duration base) {
        this.backoffBase = base;
        return this;
    }

    public EngineConfig withBackoffMultiplier(double multiplier) {
        this.backoffMultiplier = multiplier;
        return this;
    }

    public EngineConfig withMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
        return this;
    }

    public EngineConfig withClassifyErrors(boolean classifyErrors) {
        this.classifyErrors = classifyErrors;
        return this;
    }

    public EngineConfig withPersistence(PersistenceMode persistence) {
        this.persistence = persistence;
        return this;
    }

    public EngineConfig withSnapshotDir(Path dir) {
        this.snapshotDir = dir;
        return this;
    }

    public EngineConfig withSnapshotInterval(Duration interval) {
        this.snapshotInterval = interval;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public EngineConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "strategy=" + strategy +
                ", maxConcurrent=" + maxConcurrent +
                ", continueOnFailure=" + continueOnFailure +
                ", maxAttempts=" + defaultMaxAttempts +
                ", backoff=" + backoffBase.toMillis() + "ms x" + backoffMultiplier +
                ", persistence=" + persistence +
                ", serverPort=" + serverPort +
                '}';
    }
}
