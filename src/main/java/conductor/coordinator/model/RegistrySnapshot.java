package conductor.coordinator.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time, read-only view of all workers and tasks.
 * Tasks are in queue order.
 */
public record RegistrySnapshot(
        List<Worker> workers,
        List<Task> tasks,
        Instant takenAt) {

    public RegistrySnapshot {
        workers = workers == null ? List.of() : List.copyOf(workers);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(List.of(), List.of(), Instant.now());
    }

    /** Tasks that no worker has been attached to yet */
    public List<Task> unassignedTasks() {
        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.PENDING && t.isUnassigned())
                .toList();
    }

    public List<Worker> idleWorkers() {
        return workers.stream()
                .filter(Worker::isIdle)
                .toList();
    }

    public long countTasks(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }
}
