package conductor.coordinator.model;

/**
 * Task execution status. Declaration order is the lifecycle order:
 * a task only ever moves to a later constant.
 */
public enum TaskStatus {
    /** Task queued, waiting for a worker */
    PENDING,
    /** Task matched to a worker, not yet started */
    ASSIGNED,
    /** Worker reported the task as started */
    IN_PROGRESS,
    /** Task completed successfully */
    COMPLETED,
    /** Task failed */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** States that carry a worker id */
    public boolean isHeldByWorker() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }
}
