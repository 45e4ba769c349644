package conductor.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * Persisted form of a {@link Task}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecord(
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonProperty("resourceContext") String resourceContext,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("result") String result) {

    public static TaskRecord from(Task t) {
        return new TaskRecord(t.id(), t.command(), t.resourceContext(), t.priority().name(), t.status().name(),
                t.workerId(), t.createdAt(), t.startedAt(), t.completedAt(), t.result());
    }

    public Task toTask() {
        return Task.builder()
                .id(id)
                .command(command != null ? command : "")
                .resourceContext(resourceContext != null ? resourceContext : "")
                .priority(TaskPriority.valueOf(priority))
                .status(TaskStatus.valueOf(status))
                .workerId(workerId)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .result(result)
                .build();
    }
}
