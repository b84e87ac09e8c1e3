package taskweave.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.model.ExecutionStrategy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads engine settings from an INI file.
 * Supports sections [WORKFLOW], [RETRY], [PERSISTENCE] and [SERVER]; all are optional
 * and missing keys keep their current value.
 */
final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    static EngineConfig apply(Path file, EngineConfig config) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }

        try {
            Profile.Section workflow = ini.get("WORKFLOW");
            if (workflow != null) {
                String strategy = opt(workflow, "strategy");
                if (strategy != null) config.withStrategy(ExecutionStrategy.parse(strategy));
                String maxConcurrent = opt(workflow, "max_concurrent");
                if (maxConcurrent != null) config.withMaxConcurrent(Integer.parseInt(maxConcurrent));
                String cof = opt(workflow, "continue_on_failure");
                if (cof != null) config.withContinueOnFailure(Boolean.parseBoolean(cof));
                String degraded = opt(workflow, "adaptive_counts_degraded");
                if (degraded != null) config.withAdaptiveCountsDegraded(Boolean.parseBoolean(degraded));
                String maxAttempts = opt(workflow, "max_attempts");
                if (maxAttempts != null) config.withMaxAttempts(Integer.parseInt(maxAttempts));
                String timeout = opt(workflow, "task_timeout_ms");
                if (timeout != null) config.withTaskTimeout(Duration.ofMillis(Long.parseLong(timeout)));
            }

            Profile.Section retry = ini.get("RETRY");
            if (retry != null) {
                String base = opt(retry, "backoff_base_ms");
                if (base != null) config.withBackoffBase(Duration.ofMillis(Long.parseLong(base)));
                String multiplier = opt(retry, "backoff_multiplier");
                if (multiplier != null) config.withBackoffMultiplier(Double.parseDouble(multiplier));
                String max = opt(retry, "max_backoff_ms");
                if (max != null) config.withMaxBackoff(Duration.ofMillis(Long.parseLong(max)));
                String classify = opt(retry, "classify_errors");
                if (classify != null) config.withClassifyErrors(Boolean.parseBoolean(classify));
            }

            Profile.Section persistence = ini.get("PERSISTENCE");
            if (persistence != null) {
                String kind = opt(persistence, "kind");
                if (kind != null) config.withPersistence(PersistenceMode.parse(kind));
                String dir = opt(persistence, "snapshot_dir");
                if (dir != null) config.withSnapshotDir(Path.of(dir));
                String interval = opt(persistence, "snapshot_interval_ms");
                if (interval != null) config.withSnapshotInterval(Duration.ofMillis(Long.parseLong(interval)));
                String url = opt(persistence, "database_url");
                if (url != null) config.withDatabaseUrl(url);
                String pool = opt(persistence, "database_pool_size");
                if (pool != null) config.withDatabasePoolSize(Integer.parseInt(pool));
            }

            Profile.Section server = ini.get("SERVER");
            if (server != null) {
                String host = opt(server, "host");
                if (host != null) config.withServerHost(host);
                String port = opt(server, "port");
                if (port != null) config.withServerPort(Integer.parseInt(port));
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value in " + file + ": " + e.getMessage(), e);
        }

        log.info("Loaded config from {}: {}", file, config);
        return config;
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.fetch(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
