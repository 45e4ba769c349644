package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.TaskPriority;

/**
 * Request DTO for queueing a task.
 * POST /api/v1/tasks
 */
public record EnqueueTaskRequest(
        @JsonProperty("command") String command,
        @JsonProperty("resourceContext") String resourceContext,
        @JsonProperty("priority") String priority) {

    /** Validate the request */
    public void validate() {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        TaskPriority.parse(priority);
    }

    /** Priority as enum, NORMAL when omitted */
    public TaskPriority priorityValue() {
        return TaskPriority.parse(priority);
    }
}
