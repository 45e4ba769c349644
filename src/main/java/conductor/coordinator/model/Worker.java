package conductor.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a worker agent bound to one resource
 * context (repository).
 */
public final class Worker {
    private final String id;
    private final String name;
    private final String kind;
    private final String resourceContext;
    private final WorkerStatus status;
    private final Instant lastActivity;
    private final String currentTaskRef;
    private final String sessionRef;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.kind = builder.kind;
        this.resourceContext = builder.resourceContext;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastActivity = builder.lastActivity;
        this.currentTaskRef = builder.currentTaskRef;
        this.sessionRef = builder.sessionRef;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String kind() {
        return kind;
    }

    public String resourceContext() {
        return resourceContext;
    }

    public WorkerStatus status() {
        return status;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public String currentTaskRef() {
        return currentTaskRef;
    }

    public String sessionRef() {
        return sessionRef;
    }

    public boolean isIdle() {
        return status == WorkerStatus.IDLE;
    }

    /** Create a builder from this worker (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .kind(kind)
                .resourceContext(resourceContext)
                .status(status)
                .lastActivity(lastActivity)
                .currentTaskRef(currentTaskRef)
                .sessionRef(sessionRef);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String kind;
        private String resourceContext = "";
        private WorkerStatus status = WorkerStatus.IDLE;
        private Instant lastActivity;
        private String currentTaskRef;
        private String sessionRef;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder resourceContext(String resourceContext) {
            this.resourceContext = resourceContext;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastActivity(Instant lastActivity) {
            this.lastActivity = lastActivity;
            return this;
        }

        public Builder currentTaskRef(String currentTaskRef) {
            this.currentTaskRef = currentTaskRef;
            return this;
        }

        public Builder sessionRef(String sessionRef) {
            this.sessionRef = sessionRef;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", context='" + resourceContext + "'}";
    }
}
