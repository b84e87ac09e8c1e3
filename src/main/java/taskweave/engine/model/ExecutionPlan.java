package taskweave.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static view of a task graph: dependency levels plus one topological order.
 * Every task in level n depends only on tasks in levels below n.
 */
public record ExecutionPlan(
        @JsonProperty("levels") List<List<String>> levels,
        @JsonProperty("order") List<String> order) {

    public ExecutionPlan {
        levels = levels.stream().map(List::copyOf).toList();
        order = List.copyOf(order);
    }

    /** Widest level, an upper bound on useful parallelism */
    public int maxWidth() {
        return levels.stream().mapToInt(List::size).max().orElse(0);
    }
}
