package taskweave.engine.store;

import java.util.Optional;

final class NoopSnapshotStore implements SnapshotStore {

    static final NoopSnapshotStore INSTANCE = new NoopSnapshotStore();

    private NoopSnapshotStore() {
    }

    @Override
    public void save(QueueSnapshot snapshot) {
    }

    @Override
    public Optional<QueueSnapshot> load(String workflowId) {
        return Optional.empty();
    }

    @Override
    public void delete(String workflowId) {
    }

    @Override
    public String kind() {
        return "none";
    }
}
