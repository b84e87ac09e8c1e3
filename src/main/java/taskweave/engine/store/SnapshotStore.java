package taskweave.engine.store;

import java.util.Optional;

/**
 * Durable home for workflow snapshots. One snapshot per workflow id; a save
 * replaces the previous one.
 */
public interface SnapshotStore extends AutoCloseable {

    /**
     * Persist a snapshot, replacing any earlier one for the same workflow.
     *
     * @throws taskweave.engine.error.SnapshotException if the write fails
     */
    void save(QueueSnapshot snapshot);

    /**
     * Load the latest snapshot of a workflow.
     *
     * @param workflowId workflow to load
     * @return the snapshot, or empty if none was saved
     * @throws taskweave.engine.error.SnapshotException if the stored data cannot be read
     */
    Optional<QueueSnapshot> load(String workflowId);

    /** Remove the snapshot of a workflow; no-op if there is none */
    void delete(String workflowId);

    /** Short name used in logs and health output */
    String kind();

    default boolean isHealthy() {
        return true;
    }

    @Override
    default void close() {
    }

    /** Store that keeps nothing */
    static SnapshotStore none() {
        return NoopSnapshotStore.INSTANCE;
    }
}
