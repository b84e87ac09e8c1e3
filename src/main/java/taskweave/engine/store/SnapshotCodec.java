package taskweave.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import taskweave.engine.error.SnapshotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared Jackson mapper for snapshot files and JSON columns.
 */
final class SnapshotCodec {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCodec.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private SnapshotCodec() {
    }

    /**
     * Convert an opaque task result to plain JSON values (maps, lists, strings,
     * numbers, booleans). A value Jackson cannot serialize is kept as its
     * {@code toString()}.
     */
    static Object toPlainValue(String taskId, Object value) {
        if (value == null) {
            return null;
        }
        try {
            JsonNode tree = MAPPER.valueToTree(value);
            return MAPPER.treeToValue(tree, Object.class);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Result of task {} ({}) is not JSON serializable, persisting its string form: {}",
                    taskId, value.getClass().getName(), e.getMessage());
            return String.valueOf(value);
        }
    }

    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to decode " + type.getType(), e);
        }
    }
}
