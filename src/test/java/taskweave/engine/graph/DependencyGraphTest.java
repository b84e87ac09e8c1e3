package taskweave.engine.graph;

import org.junit.jupiter.api.Test;
import taskweave.engine.error.TaskValidationException;
import taskweave.engine.error.TaskValidationException.Reason;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static Map<String, Set<String>> batch(Object... pairs) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            Set<String> deps = (Set<String>) pairs[i + 1];
            map.put((String) pairs[i], deps);
        }
        return map;
    }

    @Test
    void forwardReferencesInsideBatchAreAccepted() {
        DependencyGraph graph = new DependencyGraph();
        graph.addAll(batch("b", Set.of("a"), "a", Set.of()));

        assertEquals(2, graph.size());
        assertEquals(Set.of("a"), graph.dependenciesOf("b"));
        assertEquals(Set.of("b"), graph.dependentsOf("a"));
    }

    @Test
    void duplicateIdRejected() {
        DependencyGraph graph = new DependencyGraph();
        graph.addAll(batch("a", Set.of()));

        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> graph.addAll(batch("a", Set.of())));
        assertEquals(Reason.DUPLICATE_ID, e.reason());
    }

    @Test
    void unknownDependencyRejectedWithoutPartialMutation() {
        DependencyGraph graph = new DependencyGraph();

        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> graph.addAll(batch("a", Set.of(), "b", Set.of("ghost"))));
        assertEquals(Reason.UNKNOWN_DEPENDENCY, e.reason());
        assertEquals("b", e.taskId());
        assertEquals(0, graph.size());
        assertFalse(graph.contains("a"));
    }

    @Test
    void cycleRejectedWithPath() {
        DependencyGraph graph = new DependencyGraph();
        graph.addAll(batch("root", Set.of()));

        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> graph.addAll(batch("a", Set.of("b"), "b", Set.of("a", "root"))));
        assertEquals(Reason.CYCLE_DETECTED, e.reason());
        assertTrue(e.getMessage().contains("->"), e.getMessage());
        assertEquals(Set.of("root"), graph.ids());
        assertTrue(graph.dependentsOf("root").isEmpty());
    }

    @Test
    void selfDependencyIsACycle() {
        DependencyGraph graph = new DependencyGraph();

        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> graph.addAll(batch("a", Set.of("a"))));
        assertEquals(Reason.CYCLE_DETECTED, e.reason());
    }

    @Test
    void levelsGroupByDepth() {
        DependencyGraph graph = new DependencyGraph();
        graph.addAll(batch(
                "fetch", Set.of(),
                "lint", Set.of(),
                "compile", Set.of("fetch"),
                "test", Set.of("compile", "lint"),
                "package", Set.of("test")));

        List<List<String>> levels = graph.levels(Comparator.naturalOrder());

        assertEquals(List.of(
                List.of("fetch", "lint"),
                List.of("compile"),
                List.of("test"),
                List.of("package")), levels);
        assertEquals(List.of("fetch", "lint", "compile", "test", "package"),
                graph.topologicalOrder(Comparator.naturalOrder()));
    }

    @Test
    void transitiveDependentsAndRemove() {
        DependencyGraph graph = new DependencyGraph();
        graph.addAll(batch("a", Set.of(), "b", Set.of("a"), "c", Set.of("b"), "d", Set.of()));

        assertEquals(List.of("b", "c"), graph.transitiveDependents("a"));
        assertTrue(graph.transitiveDependents("d").isEmpty());

        graph.remove("b");
        assertFalse(graph.contains("b"));
        assertTrue(graph.dependentsOf("a").isEmpty());
        assertTrue(graph.dependenciesOf("c").isEmpty());
    }
}
