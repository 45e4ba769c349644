package conductor.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error) {
    /** Success response carrying the resulting status */
    public static OperationResponse success(String status) {
        return new OperationResponse(true, status, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }
}
