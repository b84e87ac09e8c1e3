package taskweave.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.config.EngineConfig;
import taskweave.engine.error.SnapshotException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskweave-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);
        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- WORKFLOWS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflows (
                            id                  VARCHAR(128) PRIMARY KEY,
                            status              VARCHAR(20) NOT NULL,
                            strategy            VARCHAR(20) NOT NULL,
                            max_concurrent      INT NOT NULL,
                            continue_on_failure BOOLEAN NOT NULL,
                            next_sequence       BIGINT NOT NULL,
                            root_causes         CLOB,
                            started_at          TIMESTAMP(9),
                            finished_at         TIMESTAMP(9),
                            taken_at            TIMESTAMP(9) NOT NULL
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            workflow_id     VARCHAR(128) NOT NULL,
                            id              VARCHAR(256) NOT NULL,
                            payload         CLOB NOT NULL,
                            priority        INT NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            attempts        INT DEFAULT 0,
                            max_attempts    INT DEFAULT 3,
                            timeout_ms      BIGINT,
                            sequence_no     BIGINT NOT NULL,
                            tags            CLOB,
                            created_at      TIMESTAMP(9),
                            started_at      TIMESTAMP(9),
                            finished_at     TIMESTAMP(9),
                            next_attempt_at TIMESTAMP(9),
                            result          CLOB,
                            error_message   VARCHAR(4096),
                            error_kind      VARCHAR(32),
                            error_history   CLOB,
                            PRIMARY KEY (workflow_id, id)
                        );
                    """);

            // ---------- DEPENDENCIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_dependencies (
                            workflow_id VARCHAR(128) NOT NULL,
                            task_id     VARCHAR(256) NOT NULL,
                            depends_on  VARCHAR(256) NOT NULL,
                            dep_order   INT NOT NULL,
                            PRIMARY KEY (workflow_id, task_id, depends_on)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_workflow_seq ON tasks(workflow_id, sequence_no);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_deps_workflow ON task_dependencies(workflow_id, task_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new SnapshotException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
