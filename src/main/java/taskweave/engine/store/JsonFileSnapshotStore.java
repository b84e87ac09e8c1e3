package taskweave.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.SnapshotException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps each workflow's snapshot as {@code <directory>/<workflowId>.json}.
 * Writes go to a temp file in the same directory that is then moved into
 * place, so a crash mid-write leaves the previous snapshot intact.
 */
public final class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    public JsonFileSnapshotStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SnapshotException("Cannot create snapshot directory " + directory, e);
        }
        log.info("Snapshot directory: {}", directory.toAbsolutePath());
    }

    public Path directory() {
        return directory;
    }

    /** File that holds the snapshot of {@code workflowId} */
    public Path fileFor(String workflowId) {
        if (workflowId == null || !SAFE_ID.matcher(workflowId).matches()) {
            throw new IllegalArgumentException("Workflow id not usable as a file name: " + workflowId);
        }
        return directory.resolve(workflowId + ".json");
    }

    @Override
    public void save(QueueSnapshot snapshot) {
        Path target = fileFor(snapshot.workflowId());
        String json = SnapshotCodec.write(snapshot);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, snapshot.workflowId() + "-", ".tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Snapshot of {} written to {} ({} tasks)", snapshot.workflowId(), target,
                    snapshot.tasks().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new SnapshotException("Failed to write snapshot " + target, e);
        }
    }

    @Override
    public Optional<QueueSnapshot> load(String workflowId) {
        Path file = fileFor(workflowId);
        if (!Files.exists(file)) {
            log.info("No persisted state found for workflow {}", workflowId);
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(SnapshotCodec.read(json, QueueSnapshot.class));
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot " + file, e);
        }
    }

    @Override
    public void delete(String workflowId) {
        Path file = fileFor(workflowId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new SnapshotException("Failed to delete snapshot " + file, e);
        }
    }

    @Override
    public String kind() {
        return "file";
    }

    @Override
    public boolean isHealthy() {
        return Files.isDirectory(directory) && Files.isWritable(directory);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
