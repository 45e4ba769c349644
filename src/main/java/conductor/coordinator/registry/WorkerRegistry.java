package conductor.coordinator.registry;

import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.util.ResourceContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of workers keyed by id.
 *
 * Every operation runs under one lock, so a write is visible to the next
 * read from any thread. The assignment engine relies on this to avoid
 * handing the same idle worker two tasks.
 *
 * Full replacement builds the new map outside the lock and publishes it
 * with a single reference swap, so readers never observe an empty registry
 * between "clear" and "insert".
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    // insertion ordered, replaced wholesale by replaceAll/clearAll
    private Map<String, Worker> workers = new LinkedHashMap<>();

    public WorkerRegistry() {
        this(Clock.systemUTC());
    }

    public WorkerRegistry(Clock clock) {
        this.clock = clock;
    }

    public Optional<Worker> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(workers.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of all workers, in registration order.
     */
    public List<Worker> getAll() {
        lock.lock();
        try {
            return List.copyOf(workers.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace a worker.
     *
     * @return false only when the worker or its id is missing
     */
    public boolean register(Worker worker) {
        if (worker == null || worker.id().isBlank()) {
            log.warn("Rejected worker registration without id");
            return false;
        }
        Worker toStore = worker.lastActivity() != null
                ? worker
                : worker.toBuilder().lastActivity(clock.instant()).build();

        lock.lock();
        try {
            workers.put(toStore.id(), toStore);
        } finally {
            lock.unlock();
        }
        log.debug("Registered worker {} ({}) for '{}'", toStore.id(), toStore.status(), toStore.resourceContext());
        return true;
    }

    /**
     * Set the status of a known worker and refresh its activity timestamp.
     * The current task reference is replaced only when a non-empty value is given.
     *
     * @return false if the worker is unknown
     */
    public boolean updateStatus(String id, WorkerStatus status, String currentTaskRef) {
        if (id == null || id.isBlank() || status == null) {
            return false;
        }
        lock.lock();
        try {
            Worker existing = workers.get(id);
            if (existing == null) {
                return false;
            }
            Worker.Builder updated = existing.toBuilder()
                    .status(status)
                    .lastActivity(clock.instant());
            if (currentTaskRef != null && !currentTaskRef.isEmpty()) {
                updated.currentTaskRef(currentTaskRef);
            }
            workers.put(id, updated.build());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Workers in IDLE or BUSY status, optionally restricted to a resource context.
     *
     * @param resourceContext context to match; empty means any
     */
    public List<Worker> findAvailable(String resourceContext) {
        boolean filterContext = !ResourceContexts.isEmpty(resourceContext);
        lock.lock();
        try {
            List<Worker> result = new ArrayList<>();
            for (Worker w : workers.values()) {
                if (!w.status().isAvailable()) {
                    continue;
                }
                if (filterContext && !ResourceContexts.matches(w.resourceContext(), resourceContext)) {
                    continue;
                }
                result.add(w);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void clearAll() {
        lock.lock();
        try {
            workers = new LinkedHashMap<>();
        } finally {
            lock.unlock();
        }
        log.debug("Worker registry cleared");
    }

    /**
     * Replace the whole registry content. Later duplicates of an id win.
     */
    public void replaceAll(Collection<Worker> replacement) {
        Map<String, Worker> fresh = new LinkedHashMap<>();
        for (Worker w : replacement) {
            if (w != null && !w.id().isBlank()) {
                fresh.put(w.id(), w);
            }
        }
        lock.lock();
        try {
            workers = fresh;
        } finally {
            lock.unlock();
        }
        log.debug("Worker registry replaced with {} workers", fresh.size());
    }

    public int size() {
        lock.lock();
        try {
            return workers.size();
        } finally {
            lock.unlock();
        }
    }
}
