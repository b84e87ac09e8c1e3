package taskweave.engine.store;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.SnapshotException;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.ExecutionStrategy;
import taskweave.engine.model.TaskPayload;
import taskweave.engine.model.TaskPriority;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.model.WorkflowStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of SnapshotStore.
 * A save replaces the workflow's rows in a single transaction.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcSnapshotStore(Database db) {
        this.db = db;
    }

    @Override
    public void save(QueueSnapshot snapshot) {
        String workflowId = snapshot.workflowId();
        try (Connection conn = db.getConnection()) {
            try {
                deleteRows(conn, workflowId);
                insertWorkflow(conn, snapshot);
                insertTasks(conn, snapshot);
                insertDependencies(conn, snapshot);
                conn.commit();
                log.debug("Snapshot of {} committed ({} tasks)", workflowId, snapshot.tasks().size());
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SnapshotException("Failed to save snapshot of workflow: " + workflowId, e);
        }
    }

    @Override
    public Optional<QueueSnapshot> load(String workflowId) {
        String sql = "SELECT * FROM workflows WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    log.info("No persisted state found for workflow {}", workflowId);
                    return Optional.empty();
                }
                Map<String, List<String>> deps = loadDependencies(conn, workflowId);
                List<TaskRecord> tasks = loadTasks(conn, workflowId, deps);
                QueueSnapshot snapshot = new QueueSnapshot(
                        rs.getString("id"),
                        WorkflowStatus.valueOf(rs.getString("status")),
                        ExecutionStrategy.valueOf(rs.getString("strategy")),
                        rs.getInt("max_concurrent"),
                        rs.getBoolean("continue_on_failure"),
                        rs.getLong("next_sequence"),
                        readList(rs.getString("root_causes")),
                        toInstant(rs.getTimestamp("started_at")),
                        toInstant(rs.getTimestamp("finished_at")),
                        toInstant(rs.getTimestamp("taken_at")),
                        tasks);
                conn.commit();
                return Optional.of(snapshot);
            }
        } catch (SQLException e) {
            throw new SnapshotException("Failed to load snapshot of workflow: " + workflowId, e);
        }
    }

    @Override
    public void delete(String workflowId) {
        try (Connection conn = db.getConnection()) {
            try {
                deleteRows(conn, workflowId);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SnapshotException("Failed to delete snapshot of workflow: " + workflowId, e);
        }
    }

    /** Ids of every workflow with a stored snapshot */
    public List<String> listWorkflowIds() {
        String sql = "SELECT id FROM workflows ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(rs.getString("id"));
            }
            conn.commit();
            return ids;
        } catch (SQLException e) {
            throw new SnapshotException("Failed to list workflows", e);
        }
    }

    @Override
    public String kind() {
        return "jdbc";
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // ---------- write ----------

    private void deleteRows(Connection conn, String workflowId) throws SQLException {
        for (String sql : List.of(
                "DELETE FROM task_dependencies WHERE workflow_id = ?",
                "DELETE FROM tasks WHERE workflow_id = ?",
                "DELETE FROM workflows WHERE id = ?")) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, workflowId);
                ps.executeUpdate();
            }
        }
    }

    private void insertWorkflow(Connection conn, QueueSnapshot s) throws SQLException {
        String sql = """
                    INSERT INTO workflows (id, status, strategy, max_concurrent, continue_on_failure,
                                           next_sequence, root_causes, started_at, finished_at, taken_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, s.workflowId());
            ps.setString(2, s.status().name());
            ps.setString(3, s.strategy().name());
            ps.setInt(4, s.maxConcurrent());
            ps.setBoolean(5, s.continueOnFailure());
            ps.setLong(6, s.nextSequence());
            ps.setString(7, SnapshotCodec.write(s.rootCauseTaskIds()));
            setTimestamp(ps, 8, s.startedAt());
            setTimestamp(ps, 9, s.finishedAt());
            setTimestamp(ps, 10, s.takenAt() != null ? s.takenAt() : Instant.now());
            ps.executeUpdate();
        }
    }

    private void insertTasks(Connection conn, QueueSnapshot s) throws SQLException {
        if (s.tasks().isEmpty())
            return;

        String sql = """
                    INSERT INTO tasks (workflow_id, id, payload, priority, status, attempts, max_attempts,
                                       timeout_ms, sequence_no, tags, created_at, started_at, finished_at,
                                       next_attempt_at, result, error_message, error_kind, error_history)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (TaskRecord t : s.tasks()) {
                ps.setString(1, s.workflowId());
                ps.setString(2, t.id());
                ps.setString(3, SnapshotCodec.write(t.payload()));
                ps.setInt(4, t.priority().level());
                ps.setString(5, t.status().name());
                ps.setInt(6, t.attempts());
                ps.setInt(7, t.maxAttempts());
                setLongOrNull(ps, 8, t.timeoutMs());
                ps.setLong(9, t.sequence());
                ps.setString(10, SnapshotCodec.write(t.tags()));
                setTimestamp(ps, 11, t.createdAt());
                setTimestamp(ps, 12, t.startedAt());
                setTimestamp(ps, 13, t.finishedAt());
                setTimestamp(ps, 14, t.nextAttemptAt());
                ps.setString(15, t.result() != null ? SnapshotCodec.write(t.result()) : null);
                ps.setString(16, t.errorMessage());
                ps.setString(17, t.errorKind() != null ? t.errorKind().name() : null);
                ps.setString(18, SnapshotCodec.write(t.errorHistory()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertDependencies(Connection conn, QueueSnapshot s) throws SQLException {
        String sql = "INSERT INTO task_dependencies (workflow_id, task_id, depends_on, dep_order) VALUES (?, ?, ?, ?)";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int rows = 0;
            for (TaskRecord t : s.tasks()) {
                int order = 0;
                for (String dep : t.dependencies()) {
                    ps.setString(1, s.workflowId());
                    ps.setString(2, t.id());
                    ps.setString(3, dep);
                    ps.setInt(4, order++);
                    ps.addBatch();
                    rows++;
                }
            }
            if (rows > 0) {
                ps.executeBatch();
            }
        }
    }

    // ---------- read ----------

    private Map<String, List<String>> loadDependencies(Connection conn, String workflowId) throws SQLException {
        String sql = "SELECT task_id, depends_on FROM task_dependencies WHERE workflow_id = ? ORDER BY task_id, dep_order";

        Map<String, List<String>> deps = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    deps.computeIfAbsent(rs.getString("task_id"), k -> new ArrayList<>())
                            .add(rs.getString("depends_on"));
                }
            }
        }
        return deps;
    }

    private List<TaskRecord> loadTasks(Connection conn, String workflowId, Map<String, List<String>> deps)
            throws SQLException {
        String sql = "SELECT * FROM tasks WHERE workflow_id = ? ORDER BY sequence_no";

        List<TaskRecord> tasks = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapRow(rs, deps));
                }
            }
        }
        return tasks;
    }

    private TaskRecord mapRow(ResultSet rs, Map<String, List<String>> deps) throws SQLException {
        String id = rs.getString("id");
        String result = rs.getString("result");
        String errorKind = rs.getString("error_kind");
        return new TaskRecord(
                id,
                SnapshotCodec.read(rs.getString("payload"), TaskPayload.class),
                TaskPriority.fromLevel(rs.getInt("priority")),
                deps.getOrDefault(id, List.of()),
                readList(rs.getString("tags")),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                getLongOrNull(rs, "timeout_ms"),
                rs.getLong("sequence_no"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")),
                toInstant(rs.getTimestamp("next_attempt_at")),
                result != null ? SnapshotCodec.read(result, Object.class) : null,
                rs.getString("error_message"),
                errorKind != null ? ErrorKind.valueOf(errorKind) : null,
                readList(rs.getString("error_history")));
    }

    private static List<String> readList(String json) {
        return json == null ? List.of() : SnapshotCodec.read(json, STRING_LIST);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setLongOrNull(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
