package conductor.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.RegistrySnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Top-level JSON document written by the file snapshot store.
 */
public record SnapshotDocument(
        @JsonProperty("workers") List<WorkerRecord> workers,
        @JsonProperty("tasks") List<TaskRecord> tasks,
        @JsonProperty("lastUpdate") Instant lastUpdate) {

    public static SnapshotDocument from(RegistrySnapshot snapshot) {
        return new SnapshotDocument(
                snapshot.workers().stream().map(WorkerRecord::from).toList(),
                snapshot.tasks().stream().map(TaskRecord::from).toList(),
                snapshot.takenAt());
    }

    public RegistrySnapshot toSnapshot() {
        return new RegistrySnapshot(
                workers == null ? List.of() : workers.stream().map(WorkerRecord::toWorker).toList(),
                tasks == null ? List.of() : tasks.stream().map(TaskRecord::toTask).toList(),
                lastUpdate != null ? lastUpdate : Instant.now());
    }
}
