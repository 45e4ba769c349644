package conductor.coordinator.store;

/**
 * Thrown when a snapshot cannot be persisted.
 */
public class SnapshotStoreException extends RuntimeException {

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
