package conductor.coordinator.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of submitted work.
 * State changes produce new instances through {@link #toBuilder()}.
 */
public final class Task {

    /**
     * Queue order: priority descending, then creation time ascending.
     * Used with a stable sort, so equal keys keep insertion order.
     */
    public static final Comparator<Task> QUEUE_ORDER = Comparator
            .comparingInt((Task t) -> t.priority().weight()).reversed()
            .thenComparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final String id;
    private final String command;
    private final String resourceContext;
    private final TaskPriority priority;
    private final TaskStatus status;
    private final String workerId; // null until assigned
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String result;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.resourceContext = builder.resourceContext;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.workerId = builder.workerId;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.result = builder.result;
    }

    // Getters
    public String id() {
        return id;
    }

    public String command() {
        return command;
    }

    public String resourceContext() {
        return resourceContext;
    }

    public TaskPriority priority() {
        return priority;
    }

    public TaskStatus status() {
        return status;
    }

    public String workerId() {
        return workerId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String result() {
        return result;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True while no worker has been attached to the task */
    public boolean isUnassigned() {
        return workerId == null || workerId.isEmpty();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .command(command)
                .resourceContext(resourceContext)
                .priority(priority)
                .status(status)
                .workerId(workerId)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .result(result);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String command;
        private String resourceContext = "";
        private TaskPriority priority = TaskPriority.NORMAL;
        private TaskStatus status = TaskStatus.PENDING;
        private String workerId;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private String result;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder resourceContext(String resourceContext) {
            this.resourceContext = resourceContext;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", priority=" + priority + ", workerId='" + workerId + "'}";
    }
}
