package taskweave.engine.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import taskweave.engine.error.SnapshotException;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileSnapshotStoreTest {

    @TempDir
    Path dir;

    @Test
    void saveThenLoadKeepsEveryField() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);
        QueueSnapshot original = SnapshotFixtures.sample("nightly");

        store.save(original);
        QueueSnapshot loaded = store.load("nightly").orElseThrow();

        assertEquals(original, loaded);
        Task parse = loaded.task("parse").orElseThrow().toTask("nightly");
        assertEquals(Duration.ofMillis(1500), parse.timeout());
        assertEquals(List.of("fetch"), List.copyOf(parse.dependencies()));
        assertEquals("https://example.org/data.csv",
                loaded.task("fetch").orElseThrow().payload().attributes().get("url"));
        assertEquals(1, loaded.count(TaskStatus.RETRY_PENDING));
    }

    @Test
    void saveReplacesPreviousSnapshotWithoutLeavingTempFiles() throws Exception {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);
        store.save(SnapshotFixtures.sample("nightly"));
        QueueSnapshot second = SnapshotFixtures.sample("nightly");
        second = new QueueSnapshot(second.workflowId(), second.status(), second.strategy(), 9,
                second.continueOnFailure(), second.nextSequence(), second.rootCauseTaskIds(), second.startedAt(),
                second.finishedAt(), second.takenAt(), second.tasks());

        store.save(second);

        assertEquals(9, store.load("nightly").orElseThrow().maxConcurrent());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(store.fileFor("nightly")), files.toList());
        }
    }

    @Test
    void missingSnapshotIsEmpty() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);

        assertTrue(store.load("never-saved").isEmpty());
    }

    @Test
    void deleteRemovesFile() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);
        store.save(SnapshotFixtures.sample("nightly"));

        store.delete("nightly");
        store.delete("nightly");

        assertTrue(store.load("nightly").isEmpty());
    }

    @Test
    void corruptFileIsReported() throws Exception {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);
        Files.writeString(store.fileFor("broken"), "{ not json");

        assertThrows(SnapshotException.class, () -> store.load("broken"));
    }

    @Test
    void unsafeWorkflowIdRejected() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(dir);

        assertThrows(IllegalArgumentException.class, () -> store.fileFor("../escape"));
        assertTrue(store.isHealthy());
        assertEquals("file", store.kind());
    }
}
