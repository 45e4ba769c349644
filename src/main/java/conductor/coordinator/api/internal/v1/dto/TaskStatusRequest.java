package conductor.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.TaskStatus;

/**
 * Request DTO for a task status report.
 * POST /internal/v1/tasks/{taskId}/status
 */
public record TaskStatusRequest(
        @JsonProperty("status") String status,
        @JsonProperty("result") String result) {

    public void validate() {
        statusValue();
    }

    public TaskStatus statusValue() {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return TaskStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task status: " + status);
        }
    }
}
