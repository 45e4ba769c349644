package conductor.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;

import java.time.Instant;

/**
 * Persisted form of a {@link Worker}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("resourceContext") String resourceContext,
        @JsonProperty("status") String status,
        @JsonProperty("lastActivity") Instant lastActivity,
        @JsonProperty("currentTask") String currentTask,
        @JsonProperty("sessionRef") String sessionRef) {

    public static WorkerRecord from(Worker w) {
        return new WorkerRecord(w.id(), w.name(), w.kind(), w.resourceContext(), w.status().name(),
                w.lastActivity(), w.currentTaskRef(), w.sessionRef());
    }

    public Worker toWorker() {
        return Worker.builder()
                .id(id)
                .name(name)
                .kind(kind)
                .resourceContext(resourceContext != null ? resourceContext : "")
                .status(WorkerStatus.valueOf(status))
                .lastActivity(lastActivity)
                .currentTaskRef(currentTask)
                .sessionRef(sessionRef)
                .build();
    }
}
