package conductor.coordinator.service;

import conductor.coordinator.core.AppBus;
import conductor.coordinator.discovery.DiscoveryRefresher;
import conductor.coordinator.engine.AssignmentEngine;
import conductor.coordinator.model.RegistrySnapshot;
import conductor.coordinator.model.RepositoryInfo;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.registry.WorkerRegistry;
import conductor.coordinator.store.SnapshotStore;
import conductor.coordinator.store.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for callers of the orchestrator (HTTP controllers, CLI, UI).
 *
 * Restores the last snapshot on construction and saves a fresh one whenever
 * the bus reports a change, so state written by the engine, the assignment
 * loop or discovery is persisted the same way as caller mutations.
 */
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private final WorkerRegistry registry;
    private final AssignmentEngine engine;
    private final SnapshotStore store;
    private final AppBus bus;
    private final DiscoveryRefresher refresher;
    private final Clock clock;

    private final Object persistLock = new Object();

    public OrchestratorService(WorkerRegistry registry, AssignmentEngine engine, SnapshotStore store,
            AppBus bus, DiscoveryRefresher refresher) {
        this(registry, engine, store, bus, refresher, Clock.systemUTC());
    }

    /**
     * @param refresher discovery round to run on {@link #refreshWorkers()}; null when discovery is off
     */
    public OrchestratorService(WorkerRegistry registry, AssignmentEngine engine, SnapshotStore store,
            AppBus bus, DiscoveryRefresher refresher, Clock clock) {
        this.registry = registry;
        this.engine = engine;
        this.store = store;
        this.bus = bus;
        this.refresher = refresher;
        this.clock = clock;

        restore();

        bus.onTasksChanged(this::persist);
        bus.onWorkersChanged(this::persist);
    }

    /**
     * Queue a task and try to assign it right away.
     *
     * @return the generated task id
     */
    public String enqueue(String command, String resourceContext, TaskPriority priority) {
        return engine.enqueue(command, resourceContext, priority);
    }

    /**
     * Workers in registration order and tasks in queue order, copied.
     */
    public RegistrySnapshot getSnapshot() {
        return new RegistrySnapshot(registry.getAll(), engine.tasks(), clock.instant());
    }

    public Optional<Task> findTask(String taskId) {
        return engine.findTask(taskId);
    }

    public Optional<Worker> findWorker(String workerId) {
        return registry.get(workerId);
    }

    public List<Worker> workers() {
        return registry.getAll();
    }

    /**
     * Register (or replace) a worker by hand. Discovery replaces the whole
     * registry on its next round, so manual entries last until then.
     */
    public boolean registerWorker(Worker worker) {
        if (!registry.register(worker)) {
            return false;
        }
        log.info("Registered worker {} for '{}'", worker.id(), worker.resourceContext());
        bus.fireWorkersChanged();
        return true;
    }

    /**
     * Status report from a worker. An IDLE report makes it eligible for the
     * next assignment sweep.
     */
    public boolean updateWorkerStatus(String workerId, WorkerStatus status, String currentTaskRef) {
        if (!registry.updateStatus(workerId, status, currentTaskRef)) {
            log.debug("Status update for unknown worker {}", workerId);
            return false;
        }
        log.debug("Worker {} reported {}", workerId, status);
        bus.fireWorkersChanged();
        return true;
    }

    public boolean updateTaskStatus(String taskId, TaskStatus status, String result) {
        return engine.updateTaskStatus(taskId, status, result);
    }

    /**
     * Run an assignment sweep now.
     *
     * @return number of tasks assigned
     */
    public int triggerAssignment() {
        return engine.triggerAssignment();
    }

    public void clearWorkers() {
        registry.clearAll();
        log.info("All workers cleared");
        bus.fireWorkersChanged();
    }

    public boolean discoveryEnabled() {
        return refresher != null;
    }

    /**
     * Run a discovery round now.
     *
     * @return number of workers registered, or {@link DiscoveryRefresher#PROVIDER_FAILED}
     * @throws IllegalStateException if no discovery provider is configured
     */
    public int refreshWorkers() {
        if (refresher == null) {
            throw new IllegalStateException("worker discovery is not configured");
        }
        return refresher.refresh();
    }

    public Optional<Task> nextTaskForWorker(String workerId) {
        return engine.nextTaskForWorker(workerId);
    }

    public List<RepositoryInfo> repositories() {
        return RepositoryInfo.groupByContext(registry.getAll());
    }

    /**
     * Save the current state. Failures are logged; the in-memory state stays authoritative.
     */
    public void persist() {
        synchronized (persistLock) {
            RegistrySnapshot snapshot = getSnapshot();
            try {
                store.save(snapshot);
            } catch (SnapshotStoreException e) {
                log.error("Failed to persist snapshot: {}", e.getMessage(), e);
            }
        }
    }

    private void restore() {
        Optional<RegistrySnapshot> saved = store.load();
        if (saved.isEmpty()) {
            log.info("No saved state, starting empty");
            return;
        }
        RegistrySnapshot snapshot = saved.get();
        registry.replaceAll(snapshot.workers());
        engine.restore(snapshot.tasks());
        log.info("Restored state from {}: {} workers, {} tasks ({} pending)",
                snapshot.takenAt(), snapshot.workers().size(), snapshot.tasks().size(),
                snapshot.countTasks(TaskStatus.PENDING));
    }
}
