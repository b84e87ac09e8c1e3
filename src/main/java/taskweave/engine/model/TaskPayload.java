package taskweave.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Opaque tagged value handed to the executor. The queue never looks inside it.
 */
public record TaskPayload(
        @JsonProperty("type") String type,
        @JsonProperty("attributes") Map<String, Object> attributes) {

    @JsonCreator
    public TaskPayload {
        Objects.requireNonNull(type, "type is required");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static TaskPayload of(String type) {
        return new TaskPayload(type, Map.of());
    }

    public static TaskPayload of(String type, Map<String, Object> attributes) {
        return new TaskPayload(type, attributes);
    }
}
