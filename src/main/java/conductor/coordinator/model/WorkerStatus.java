package conductor.coordinator.model;

/**
 * Worker status.
 */
public enum WorkerStatus {
    /** Worker is available and holds no task */
    IDLE,
    /** Worker is executing (or has been handed) a task */
    BUSY,
    /** Worker reported an error */
    ERROR,
    /** Worker is not reachable */
    OFFLINE;

    /** IDLE and BUSY workers count as available for lookups */
    public boolean isAvailable() {
        return this == IDLE || this == BUSY;
    }
}
