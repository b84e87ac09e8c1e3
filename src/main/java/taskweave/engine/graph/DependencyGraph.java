package taskweave.engine.graph;

import taskweave.engine.error.TaskValidationException;
import taskweave.engine.error.TaskValidationException.Reason;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of task ids. An edge {@code a -> b} means "a depends on b".
 *
 * Additions are validated as a whole batch before anything is mutated, so a
 * rejected batch leaves the graph unchanged. Iteration order is insertion order.
 *
 * Not thread-safe; owned by a {@code TaskQueue} and used under its lock.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();

    public boolean contains(String id) {
        return dependencies.containsKey(id);
    }

    public int size() {
        return dependencies.size();
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    public Set<String> dependenciesOf(String id) {
        Set<String> deps = dependencies.get(id);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    public Set<String> dependentsOf(String id) {
        Set<String> deps = dependents.get(id);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    /**
     * Validate and add a batch of nodes.
     *
     * @param batch node id to its dependency ids, in submission order
     * @throws TaskValidationException on a duplicate id, an unknown dependency or a cycle
     */
    public void addAll(Map<String, ? extends Set<String>> batch) {
        for (Map.Entry<String, ? extends Set<String>> e : batch.entrySet()) {
            String id = e.getKey();
            if (dependencies.containsKey(id)) {
                throw new TaskValidationException(Reason.DUPLICATE_ID, id,
                        "Task " + id + " already exists");
            }
            for (String dep : e.getValue()) {
                if (!dependencies.containsKey(dep) && !batch.containsKey(dep)) {
                    throw new TaskValidationException(Reason.UNKNOWN_DEPENDENCY, id,
                            "Task " + id + " depends on unknown task " + dep);
                }
            }
        }

        List<String> cycle = findCycle(batch);
        if (!cycle.isEmpty()) {
            throw new TaskValidationException(Reason.CYCLE_DETECTED, cycle.get(0),
                    "Dependency cycle: " + String.join(" -> ", cycle));
        }

        for (Map.Entry<String, ? extends Set<String>> e : batch.entrySet()) {
            dependencies.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
            dependents.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>());
        }
        for (Map.Entry<String, ? extends Set<String>> e : batch.entrySet()) {
            for (String dep : e.getValue()) {
                dependents.get(dep).add(e.getKey());
            }
        }
    }

    /**
     * Remove a node together with every edge pointing at it.
     */
    public void remove(String id) {
        Set<String> deps = dependencies.remove(id);
        if (deps == null) {
            return;
        }
        for (String dep : deps) {
            Set<String> back = dependents.get(dep);
            if (back != null) {
                back.remove(id);
            }
        }
        for (String dependent : dependents.remove(id)) {
            Set<String> fwd = dependencies.get(dependent);
            if (fwd != null) {
                fwd.remove(id);
            }
        }
    }

    /**
     * Every task that depends on {@code id}, directly or transitively, in breadth-first order.
     */
    public List<String> transitiveDependents(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependentsOf(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependentsOf(next));
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * Group nodes into dependency levels (Kahn's algorithm). Level 0 holds nodes
     * without dependencies; level n holds nodes whose dependencies all lie below n.
     *
     * @param order sort applied inside each level
     */
    public List<List<String>> levels(Comparator<String> order) {
        Map<String, Integer> remaining = new HashMap<>();
        List<String> current = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : dependencies.entrySet()) {
            remaining.put(e.getKey(), e.getValue().size());
            if (e.getValue().isEmpty()) {
                current.add(e.getKey());
            }
        }

        List<List<String>> levels = new ArrayList<>();
        while (!current.isEmpty()) {
            current.sort(order);
            levels.add(current);
            List<String> next = new ArrayList<>();
            for (String id : current) {
                for (String dependent : dependents.get(id)) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            current = next;
        }
        return levels;
    }

    /** Flattened {@link #levels(Comparator)}, a valid topological order */
    public List<String> topologicalOrder(Comparator<String> order) {
        List<String> result = new ArrayList<>(size());
        for (List<String> level : levels(order)) {
            result.addAll(level);
        }
        return result;
    }

    // Three-colour DFS over the batch. Existing nodes never point into the batch,
    // so only paths that start in the batch can close a cycle.
    private List<String> findCycle(Map<String, ? extends Set<String>> batch) {
        Map<String, Integer> colour = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (String id : batch.keySet()) {
            List<String> cycle = visit(id, batch, colour, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }

    private List<String> visit(String id, Map<String, ? extends Set<String>> batch,
            Map<String, Integer> colour, Deque<String> path) {
        int c = colour.getOrDefault(id, 0);
        if (c == 2 || !batch.containsKey(id)) {
            return List.of();
        }
        if (c == 1) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String p : (Iterable<String>) path::descendingIterator) {
                if (p.equals(id)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(p);
                }
            }
            cycle.add(id);
            return cycle;
        }

        colour.put(id, 1);
        path.push(id);
        for (String dep : batch.get(id)) {
            List<String> cycle = visit(dep, batch, colour, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        path.pop();
        colour.put(id, 2);
        return List.of();
    }
}
