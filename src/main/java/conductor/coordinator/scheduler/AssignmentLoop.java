package conductor.coordinator.scheduler;

import conductor.coordinator.engine.AssignmentEngine;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that re-runs the assignment sweep whenever pending tasks
 * and idle workers exist at the same time. Closes the gap between "a worker
 * became idle" and "a queued task gets picked up" without any caller action.
 *
 * Each cycle reschedules the next one: the normal interval after a clean
 * cycle, the backoff interval after a failed one. {@link #stop()} cancels the
 * pending cycle; a cycle already running is allowed to finish.
 */
public class AssignmentLoop {

    private static final Logger log = LoggerFactory.getLogger(AssignmentLoop.class);

    public enum State { NEW, RUNNING, STOPPED }

    /**
     * Outcome of one cycle, for logging and tests.
     */
    public record CycleOutcome(int unassignedBefore, int availableWorkers, int assignedCount, boolean triggered) {
        static CycleOutcome skipped(int unassigned, int available) {
            return new CycleOutcome(unassigned, available, 0, false);
        }
    }

    private final AssignmentEngine engine;
    private final WorkerRegistry registry;
    private final Duration interval;
    private final Duration backoff;

    private final Object stateLock = new Object();
    private State state = State.NEW;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;

    public AssignmentLoop(AssignmentEngine engine, WorkerRegistry registry, Duration interval, Duration backoff) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.engine = engine;
        this.registry = registry;
        this.interval = interval;
        this.backoff = backoff;
    }

    /**
     * Start ticking on the given executor. A stopped loop cannot be restarted.
     */
    public void start(ScheduledExecutorService executor) {
        synchronized (stateLock) {
            if (state != State.NEW) {
                log.warn("Assignment loop already {}", state);
                return;
            }
            this.executor = executor;
            state = State.RUNNING;
            scheduleNext(interval);
        }
        log.info("Assignment loop started, interval {}ms, backoff {}ms", interval.toMillis(), backoff.toMillis());
    }

    public void stop() {
        synchronized (stateLock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        log.info("Assignment loop stopped");
    }

    public State state() {
        synchronized (stateLock) {
            return state;
        }
    }

    /**
     * Run one reconciliation cycle.
     */
    public CycleOutcome processCycle() {
        List<Task> unassigned = unassignedTasks();
        List<Worker> available = idleWorkers();

        if (unassigned.isEmpty() || available.isEmpty()) {
            if (!unassigned.isEmpty()) {
                log.debug("{} unassigned tasks but no idle workers", unassigned.size());
            }
            return CycleOutcome.skipped(unassigned.size(), available.size());
        }

        log.info("Found {} unassigned tasks and {} idle workers, triggering assignment",
                unassigned.size(), available.size());
        engine.triggerAssignment();

        int remaining = unassignedTasks().size();
        int assignedCount = unassigned.size() - remaining;
        if (assignedCount > 0) {
            log.info("Assigned {} tasks, {} remain unassigned", assignedCount, remaining);
        }
        return new CycleOutcome(unassigned.size(), available.size(), assignedCount, true);
    }

    private void tick() {
        if (state() != State.RUNNING) {
            return;
        }
        Duration next = interval;
        try {
            processCycle();
        } catch (Exception e) {
            log.error("Assignment cycle failed, backing off for {}ms", backoff.toMillis(), e);
            next = backoff;
        }
        synchronized (stateLock) {
            if (state == State.RUNNING) {
                scheduleNext(next);
            }
        }
    }

    // caller holds stateLock
    private void scheduleNext(Duration delay) {
        pending = executor.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private List<Task> unassignedTasks() {
        return engine.tasks().stream()
                .filter(t -> t.status() == TaskStatus.PENDING && t.isUnassigned())
                .toList();
    }

    private List<Worker> idleWorkers() {
        return registry.getAll().stream()
                .filter(Worker::isIdle)
                .toList();
    }
}
