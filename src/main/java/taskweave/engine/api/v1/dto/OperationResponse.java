package taskweave.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a control operation (pause, resume, cancel).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error) {

    public static OperationResponse success(String status) {
        return new OperationResponse(true, status, null);
    }

    public static OperationResponse rejected(String status, String error) {
        return new OperationResponse(false, status, error);
    }
}
