package conductor.coordinator.engine;

import conductor.coordinator.core.AppBus;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.registry.WorkerRegistry;
import conductor.coordinator.util.ResourceContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the task queue and matches pending tasks to idle workers.
 *
 * Enqueue, sweeps and task status updates share one lock. The lock also
 * covers flipping the chosen worker to BUSY, so "find an idle worker" and
 * "mark it busy" happen as one step on every call path and a worker is
 * never handed two tasks.
 *
 * Observers are notified through {@link AppBus#fireTasksChanged()} after
 * the lock has been released.
 */
public class AssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AssignmentEngine.class);

    private static final Comparator<Worker> OLDEST_ACTIVITY_FIRST = Comparator.comparing(
            Worker::lastActivity, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final WorkerRegistry registry;
    private final AppBus bus;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // insertion ordered; queue order is computed per sweep
    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public AssignmentEngine(WorkerRegistry registry, AppBus bus) {
        this(registry, bus, Clock.systemUTC());
    }

    public AssignmentEngine(WorkerRegistry registry, AppBus bus, Clock clock) {
        this.registry = registry;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * Queue a task. Tries to match it right away, then sweeps the whole
     * queue so older pending tasks get a chance against the current
     * worker state as well.
     *
     * @return the generated task id
     */
    public String enqueue(String command, String resourceContext, TaskPriority priority) {
        String taskId;
        lock.lock();
        try {
            taskId = generateTaskId();
            Task task = Task.builder()
                    .id(taskId)
                    .command(command != null ? command : "")
                    .resourceContext(resourceContext != null ? resourceContext : "")
                    .priority(priority != null ? priority : TaskPriority.NORMAL)
                    .status(TaskStatus.PENDING)
                    .createdAt(clock.instant())
                    .build();
            tasks.put(taskId, task);
            log.info("Queued task {} (priority={}, context='{}')", taskId, task.priority(), task.resourceContext());

            Optional<Worker> worker = findBestWorker(task.resourceContext());
            if (worker.isPresent()) {
                assign(task, worker.get());
            } else {
                log.debug("No idle worker for task {}, left pending", taskId);
            }

            sweep();
        } finally {
            lock.unlock();
        }
        bus.fireTasksChanged();
        return taskId;
    }

    /**
     * Pick the idle worker for a resource context: an exact (normalized)
     * context match first, otherwise any idle worker. Among candidates the
     * one with the oldest activity wins.
     */
    public Optional<Worker> findBestWorker(String resourceContext) {
        lock.lock();
        try {
            if (!ResourceContexts.isEmpty(resourceContext)) {
                Optional<Worker> affine = registry.findAvailable(resourceContext).stream()
                        .filter(Worker::isIdle)
                        .min(OLDEST_ACTIVITY_FIRST);
                if (affine.isPresent()) {
                    return affine;
                }
            }
            return registry.findAvailable("").stream()
                    .filter(Worker::isIdle)
                    .min(OLDEST_ACTIVITY_FIRST);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Match every pending task, in queue order, against the idle workers.
     * Running it again without a state change in between assigns nothing.
     *
     * @return number of tasks assigned by this sweep
     */
    public int assignUnassignedTasks() {
        int assigned;
        lock.lock();
        try {
            assigned = sweep();
        } finally {
            lock.unlock();
        }
        if (assigned > 0) {
            bus.fireTasksChanged();
        }
        return assigned;
    }

    /**
     * Same sweep as {@link #assignUnassignedTasks()}, for external triggers.
     */
    public int triggerAssignment() {
        return assignUnassignedTasks();
    }

    /**
     * Move a task forward in its lifecycle. Rejected moves leave the task untouched.
     * The worker holding the task is not updated; workers report their own status.
     *
     * @return true if the transition was applied
     */
    public boolean updateTaskStatus(String taskId, TaskStatus newStatus, String result) {
        if (taskId == null || taskId.isBlank() || newStatus == null) {
            return false;
        }
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                log.warn("Status update for unknown task {}", taskId);
                return false;
            }
            if (!isAllowed(task.status(), newStatus)) {
                log.warn("Rejected transition {} -> {} for task {}", task.status(), newStatus, taskId);
                return false;
            }

            Instant now = clock.instant();
            Task.Builder updated = task.toBuilder().status(newStatus);
            if (newStatus == TaskStatus.IN_PROGRESS && task.startedAt() == null) {
                updated.startedAt(now);
            }
            if (newStatus.isTerminal()) {
                updated.completedAt(now).result(result);
            }
            tasks.put(taskId, updated.build());
            log.info("Task {} moved {} -> {}", taskId, task.status(), newStatus);
        } finally {
            lock.unlock();
        }
        bus.fireTasksChanged();
        return true;
    }

    /**
     * First task handed to the given worker and not yet started, in queue order.
     */
    public Optional<Task> nextTaskForWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            return Optional.empty();
        }
        return tasks().stream()
                .filter(t -> t.status() == TaskStatus.ASSIGNED && workerId.equals(t.workerId()))
                .findFirst();
    }

    public Optional<Task> findTask(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of all tasks in queue order.
     */
    public List<Task> tasks() {
        lock.lock();
        try {
            return queueOrdered(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the queue content with previously persisted tasks.
     */
    public void restore(Collection<Task> restored) {
        lock.lock();
        try {
            tasks.clear();
            List<Task> ordered = new ArrayList<>(restored);
            ordered.sort(Comparator.comparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
            for (Task t : ordered) {
                tasks.put(t.id(), t);
            }
        } finally {
            lock.unlock();
        }
        log.info("Restored {} tasks", restored.size());
    }

    // ---- internals, called with the lock held ----

    private int sweep() {
        int assigned = 0;
        for (Task task : queueOrdered(tasks.values())) {
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            Optional<Worker> worker = findBestWorker(task.resourceContext());
            if (worker.isEmpty()) {
                // no idle worker left at all, the rest of the queue cannot match either
                break;
            }
            if (assign(task, worker.get())) {
                assigned++;
            }
        }
        if (assigned > 0) {
            log.info("Sweep assigned {} tasks", assigned);
        }
        return assigned;
    }

    private boolean assign(Task task, Worker worker) {
        // flip the worker first: it may have disappeared in a discovery replace
        if (!registry.updateStatus(worker.id(), WorkerStatus.BUSY, task.id())) {
            log.warn("Worker {} vanished before task {} could be assigned", worker.id(), task.id());
            return false;
        }
        Task assigned = task.toBuilder()
                .status(TaskStatus.ASSIGNED)
                .workerId(worker.id())
                .startedAt(clock.instant())
                .build();
        tasks.put(task.id(), assigned);
        log.info("Assigned task {} to worker {}", task.id(), worker.id());
        return true;
    }

    private static boolean isAllowed(TaskStatus from, TaskStatus to) {
        if (from.isTerminal() || to.ordinal() <= from.ordinal()) {
            return false;
        }
        if (to == TaskStatus.ASSIGNED) {
            // only the matcher attaches workers
            return false;
        }
        if (from == TaskStatus.PENDING) {
            // nothing can start or complete without a worker; abandoning is allowed
            return to == TaskStatus.FAILED;
        }
        return true;
    }

    private static List<Task> queueOrdered(Collection<Task> values) {
        List<Task> ordered = new ArrayList<>(values);
        ordered.sort(Task.QUEUE_ORDER);
        return ordered;
    }

    private String generateTaskId() {
        String id;
        do {
            id = "task-" + UUID.randomUUID().toString().substring(0, 8);
        } while (tasks.containsKey(id));
        return id;
    }
}
