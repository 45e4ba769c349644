package conductor.coordinator.store;

import conductor.coordinator.model.RegistrySnapshot;

import java.util.Optional;

/**
 * Durable sink for registry snapshots, used for crash recovery.
 * Implementations can use a JSON file, JDBC, or nothing at all.
 */
public interface SnapshotStore {

    /** Store that keeps nothing */
    SnapshotStore NONE = new SnapshotStore() {
        @Override
        public void save(RegistrySnapshot snapshot) {
        }

        @Override
        public Optional<RegistrySnapshot> load() {
            return Optional.empty();
        }
    };

    /**
     * Persist a snapshot, replacing the previous one.
     *
     * @throws SnapshotStoreException if the snapshot could not be written
     */
    void save(RegistrySnapshot snapshot);

    /**
     * Load the last saved snapshot.
     *
     * @return the snapshot, or empty if none was saved or it is unreadable
     */
    Optional<RegistrySnapshot> load();
}
