package conductor.coordinator.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import conductor.coordinator.model.RegistrySnapshot;
import conductor.coordinator.store.model.SnapshotDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Snapshot store backed by a single JSON file.
 * Writes go to a sibling temp file first and are moved into place, so a
 * crash mid-write leaves the previous snapshot intact.
 */
public class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path file;

    public JsonFileSnapshotStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    @Override
    public synchronized void save(RegistrySnapshot snapshot) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(tmp.toFile(), SnapshotDocument.from(snapshot));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved snapshot ({} workers, {} tasks) to {}",
                    snapshot.workers().size(), snapshot.tasks().size(), file);
        } catch (IOException e) {
            throw new SnapshotStoreException("Failed to write snapshot to " + file, e);
        }
    }

    @Override
    public synchronized Optional<RegistrySnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            SnapshotDocument doc = MAPPER.readValue(file.toFile(), SnapshotDocument.class);
            return Optional.of(doc.toSnapshot());
        } catch (IOException | RuntimeException e) {
            // corrupt or foreign file: boot with an empty registry
            log.warn("Ignoring unreadable snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Path file() {
        return file;
    }
}
