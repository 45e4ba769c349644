package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.Task;

import java.time.Instant;

/**
 * Response DTO for a task.
 * GET /api/v1/tasks/{taskId}, also embedded in state and next-task responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("command") String command,
        @JsonProperty("resourceContext") String resourceContext,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("result") String result) {
    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.command(),
                task.resourceContext(),
                task.priority().name(),
                task.status().name(),
                task.workerId(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.result());
    }
}
