package conductor.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.WorkerStatus;

/**
 * Request DTO for a worker status report.
 * POST /internal/v1/workers/{workerId}/status
 */
public record WorkerStatusRequest(
        @JsonProperty("status") String status,
        @JsonProperty("currentTask") String currentTask) {

    public void validate() {
        statusValue();
    }

    public WorkerStatus statusValue() {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return WorkerStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown worker status: " + status);
        }
    }
}
