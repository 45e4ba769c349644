package conductor.coordinator.engine;

import conductor.coordinator.MutableClock;
import conductor.coordinator.core.AppBus;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.registry.WorkerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentEngineTest {

    private MutableClock clock;
    private AppBus bus;
    private WorkerRegistry registry;
    private AssignmentEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        bus = new AppBus();
        registry = new WorkerRegistry(clock);
        engine = new AssignmentEngine(registry, bus, clock);
    }

    // ---------------- enqueue ----------------

    @Test
    void enqueueAssignsToIdleWorkerImmediately() {
        register("w1", "/repo", WorkerStatus.IDLE);

        String taskId = engine.enqueue("build", "/repo", TaskPriority.NORMAL);

        Task task = engine.findTask(taskId).orElseThrow();
        assertEquals(TaskStatus.ASSIGNED, task.status());
        assertEquals("w1", task.workerId());
        assertEquals(clock.instant(), task.startedAt());

        Worker w1 = registry.get("w1").orElseThrow();
        assertEquals(WorkerStatus.BUSY, w1.status());
        assertEquals(taskId, w1.currentTaskRef());
    }

    @Test
    void enqueueWithoutWorkersStaysPending() {
        String taskId = engine.enqueue("build", "/repo", TaskPriority.HIGH);

        Task task = engine.findTask(taskId).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.status());
        assertTrue(task.isUnassigned());
        assertEquals(clock.instant(), task.createdAt());
        assertTrue(taskId.matches("task-[0-9a-f]{8}"), taskId);
    }

    @Test
    void enqueueDefaultsMissingFields() {
        String taskId = engine.enqueue(null, null, null);

        Task task = engine.findTask(taskId).orElseThrow();
        assertEquals("", task.command());
        assertEquals("", task.resourceContext());
        assertEquals(TaskPriority.NORMAL, task.priority());
    }

    @Test
    void enqueueGeneratesUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(engine.enqueue("cmd", "", TaskPriority.LOW));
        }
        assertEquals(200, ids.size());
    }

    @Test
    void enqueueSweepsOlderPendingTasksToo() {
        String older = engine.enqueue("old", "/a", TaskPriority.CRITICAL);
        register("w1", "/a", WorkerStatus.IDLE);
        register("w2", "/b", WorkerStatus.IDLE);

        String newer = engine.enqueue("new", "/b", TaskPriority.NORMAL);

        assertEquals("w2", engine.findTask(newer).orElseThrow().workerId());
        assertEquals("w1", engine.findTask(older).orElseThrow().workerId(),
                "the sweep after enqueue picks up tasks queued before the worker appeared");
    }

    // ---------------- matching ----------------

    @Test
    @DisplayName("N pending tasks, M<N idle workers: exactly M assigned, each to a distinct worker")
    void atMostOneAssignmentPerWorker() {
        for (int i = 0; i < 7; i++) {
            engine.enqueue("cmd-" + i, "", TaskPriority.NORMAL);
        }
        for (int i = 0; i < 3; i++) {
            register("w" + i, "", WorkerStatus.IDLE);
        }

        int assigned = engine.assignUnassignedTasks();

        assertEquals(3, assigned);
        List<Task> held = engine.tasks().stream().filter(t -> t.status() == TaskStatus.ASSIGNED).toList();
        assertEquals(3, held.size());
        assertEquals(3, held.stream().map(Task::workerId).distinct().count());
        assertTrue(registry.getAll().stream().allMatch(w -> w.status() == WorkerStatus.BUSY));
    }

    @Test
    void concurrentEnqueueNeverDoubleBooksAWorker() throws Exception {
        for (int i = 0; i < 5; i++) {
            register("w" + i, "", WorkerStatus.IDLE);
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return engine.enqueue("cmd", "", TaskPriority.NORMAL);
            }));
        }
        start.countDown();
        for (Future<String> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<Task> held = engine.tasks().stream().filter(t -> t.status() == TaskStatus.ASSIGNED).toList();
        assertEquals(5, held.size());
        assertEquals(5, held.stream().map(Task::workerId).distinct().count());
        assertEquals(35, engine.tasks().stream().filter(t -> t.status() == TaskStatus.PENDING).count());
    }

    @Test
    void sweepIsIdempotent() {
        engine.enqueue("a", "", TaskPriority.NORMAL);
        engine.enqueue("b", "", TaskPriority.NORMAL);
        register("w1", "", WorkerStatus.IDLE);

        assertEquals(1, engine.assignUnassignedTasks());
        List<Task> afterFirst = engine.tasks();
        List<Worker> workersAfterFirst = registry.getAll();

        assertEquals(0, engine.assignUnassignedTasks());
        assertEquals(snapshot(afterFirst), snapshot(engine.tasks()));
        assertEquals(workersAfterFirst.get(0).status(), registry.get("w1").orElseThrow().status());
    }

    @Test
    @DisplayName("Queue [Normal, Critical, Normal, High] is served Critical, High, then Normals by age")
    void priorityOrdering() {
        // one worker exists but is busy while the tasks are queued
        register("w1", "", WorkerStatus.BUSY);

        String normal1 = engine.enqueue("n1", "", TaskPriority.NORMAL);
        clock.advance(Duration.ofSeconds(1));
        String critical = engine.enqueue("c", "", TaskPriority.CRITICAL);
        clock.advance(Duration.ofSeconds(1));
        String normal2 = engine.enqueue("n2", "", TaskPriority.NORMAL);
        clock.advance(Duration.ofSeconds(1));
        String high = engine.enqueue("h", "", TaskPriority.HIGH);

        List<String> served = new ArrayList<>();
        for (int round = 0; round < 4; round++) {
            registry.updateStatus("w1", WorkerStatus.IDLE, null);
            assertEquals(1, engine.assignUnassignedTasks());
            String picked = engine.nextTaskForWorker("w1").orElseThrow().id();
            served.add(picked);

            long stillPending = engine.tasks().stream().filter(t -> t.status() == TaskStatus.PENDING).count();
            assertEquals(3 - round, stillPending);

            engine.updateTaskStatus(picked, TaskStatus.IN_PROGRESS, null);
            engine.updateTaskStatus(picked, TaskStatus.COMPLETED, "done");
        }

        assertEquals(List.of(critical, high, normal1, normal2), served);
    }

    @Test
    void findBestWorkerPrefersAffinity() {
        register("match", "/repo/a", WorkerStatus.IDLE);
        register("other", "/repo/b", WorkerStatus.IDLE);

        assertEquals("match", engine.findBestWorker("/repo/a").orElseThrow().id());
        assertEquals("match", engine.findBestWorker("\\REPO\\A\\").orElseThrow().id());
    }

    @Test
    void findBestWorkerFallsBackToAnyIdleWorker() {
        register("other", "/repo/b", WorkerStatus.IDLE);

        assertEquals("other", engine.findBestWorker("/repo/a").orElseThrow().id());
    }

    @Test
    void findBestWorkerIgnoresBusyAffinityMatch() {
        register("match", "/repo/a", WorkerStatus.BUSY);
        register("other", "/repo/b", WorkerStatus.IDLE);

        assertEquals("other", engine.findBestWorker("/repo/a").orElseThrow().id());
    }

    @Test
    void findBestWorkerPicksOldestActivity() {
        registry.register(worker("recent", "/repo", clock.instant()));
        registry.register(worker("stale", "/repo", clock.instant().minus(Duration.ofHours(1))));
        registry.register(worker("middle", "/repo", clock.instant().minus(Duration.ofMinutes(5))));

        assertEquals("stale", engine.findBestWorker("/repo").orElseThrow().id());
    }

    @Test
    void findBestWorkerEmptyWhenNobodyIdle() {
        register("busy", "/repo", WorkerStatus.BUSY);
        register("broken", "/repo", WorkerStatus.ERROR);

        assertTrue(engine.findBestWorker("/repo").isEmpty());
    }

    @Test
    @DisplayName("Enqueue with zero workers, register W1, next sweep assigns to W1")
    void endToEndExample() {
        String taskId = engine.enqueue("build", "repoA", TaskPriority.NORMAL);
        Task pending = engine.findTask(taskId).orElseThrow();
        assertEquals(TaskStatus.PENDING, pending.status());
        assertTrue(pending.isUnassigned());

        register("W1", "repoA", WorkerStatus.IDLE);
        engine.triggerAssignment();

        Task assigned = engine.findTask(taskId).orElseThrow();
        assertEquals(TaskStatus.ASSIGNED, assigned.status());
        assertEquals("W1", assigned.workerId());
        assertEquals(WorkerStatus.BUSY, registry.get("W1").orElseThrow().status());
    }

    // ---------------- status transitions ----------------

    @Test
    void forwardTransitionsAreApplied() {
        register("w1", "", WorkerStatus.IDLE);
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);
        Instant assignedAt = engine.findTask(taskId).orElseThrow().startedAt();

        clock.advance(Duration.ofSeconds(30));
        assertTrue(engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null));
        assertEquals(assignedAt, engine.findTask(taskId).orElseThrow().startedAt(), "startedAt is kept");

        clock.advance(Duration.ofSeconds(30));
        assertTrue(engine.updateTaskStatus(taskId, TaskStatus.COMPLETED, "exit 0"));

        Task done = engine.findTask(taskId).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(clock.instant(), done.completedAt());
        assertEquals("exit 0", done.result());
        assertEquals("w1", done.workerId());
        assertEquals(WorkerStatus.BUSY, registry.get("w1").orElseThrow().status(),
                "workers report their own status");
    }

    @Test
    void assignedTaskCanFailDirectly() {
        register("w1", "", WorkerStatus.IDLE);
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);

        assertTrue(engine.updateTaskStatus(taskId, TaskStatus.FAILED, "crashed"));
        assertEquals(TaskStatus.FAILED, engine.findTask(taskId).orElseThrow().status());
    }

    @Test
    void backwardAndTerminalTransitionsAreRejected() {
        register("w1", "", WorkerStatus.IDLE);
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);
        engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null);

        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null), "same state");
        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.ASSIGNED, null), "backward");
        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.PENDING, null), "backward");

        assertTrue(engine.updateTaskStatus(taskId, TaskStatus.COMPLETED, "ok"));
        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.FAILED, "late"), "terminal");
        assertEquals("ok", engine.findTask(taskId).orElseThrow().result());
    }

    @Test
    void pendingTaskCanOnlyBeAbandoned() {
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);

        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.ASSIGNED, null));
        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null));
        assertFalse(engine.updateTaskStatus(taskId, TaskStatus.COMPLETED, null));
        assertTrue(engine.updateTaskStatus(taskId, TaskStatus.FAILED, "cancelled"));

        register("w1", "", WorkerStatus.IDLE);
        assertEquals(0, engine.assignUnassignedTasks(), "failed tasks are never assigned");
    }

    @Test
    void unknownOrInvalidUpdatesAreRejected() {
        assertFalse(engine.updateTaskStatus("task-missing", TaskStatus.COMPLETED, null));
        assertFalse(engine.updateTaskStatus("", TaskStatus.COMPLETED, null));
        assertFalse(engine.updateTaskStatus(null, TaskStatus.COMPLETED, null));
        String taskId = engine.enqueue("x", "", TaskPriority.NORMAL);
        assertFalse(engine.updateTaskStatus(taskId, null, null));
    }

    // ---------------- queries and events ----------------

    @Test
    void nextTaskForWorkerReturnsOnlyAssignedTasks() {
        register("w1", "", WorkerStatus.IDLE);
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);

        assertEquals(taskId, engine.nextTaskForWorker("w1").orElseThrow().id());
        assertEquals(taskId, engine.nextTaskForWorker("w1").orElseThrow().id(), "read only");

        engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null);
        assertTrue(engine.nextTaskForWorker("w1").isEmpty());
        assertTrue(engine.nextTaskForWorker("nobody").isEmpty());
        assertTrue(engine.nextTaskForWorker(null).isEmpty());
    }

    @Test
    void tasksAreReturnedInQueueOrder() {
        String low = engine.enqueue("l", "", TaskPriority.LOW);
        clock.advance(Duration.ofSeconds(1));
        String critical = engine.enqueue("c", "", TaskPriority.CRITICAL);

        assertEquals(List.of(critical, low), engine.tasks().stream().map(Task::id).toList());
    }

    @Test
    void restoreReplacesQueue() {
        engine.enqueue("dropped", "", TaskPriority.NORMAL);
        Task restored = Task.builder()
                .id("task-restored")
                .command("build")
                .status(TaskStatus.PENDING)
                .createdAt(clock.instant())
                .build();

        engine.restore(List.of(restored));

        assertEquals(List.of("task-restored"), engine.tasks().stream().map(Task::id).toList());
        register("w1", "", WorkerStatus.IDLE);
        assertEquals(1, engine.assignUnassignedTasks());
    }

    @Test
    void changesAreAnnouncedOnTheBus() {
        AtomicInteger events = new AtomicInteger();
        bus.onTasksChanged(events::incrementAndGet);

        String taskId = engine.enqueue("a", "", TaskPriority.NORMAL);
        assertEquals(1, events.get());

        assertEquals(0, engine.assignUnassignedTasks());
        assertEquals(1, events.get(), "empty sweep is silent");

        register("w1", "", WorkerStatus.IDLE);
        engine.assignUnassignedTasks();
        assertEquals(2, events.get());

        engine.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS, null);
        assertEquals(3, events.get());

        engine.updateTaskStatus(taskId, TaskStatus.PENDING, null);
        assertEquals(3, events.get(), "rejected update is silent");
    }

    @Test
    void failingListenerDoesNotBreakEnqueue() {
        bus.onTasksChanged(() -> {
            throw new IllegalStateException("listener down");
        });

        String taskId = engine.enqueue("a", "", TaskPriority.NORMAL);
        assertTrue(engine.findTask(taskId).isPresent());
    }

    private void register(String id, String ctx, WorkerStatus status) {
        registry.register(Worker.builder().id(id).name(id).kind("test").resourceContext(ctx).status(status).build());
    }

    private static Worker worker(String id, String ctx, Instant lastActivity) {
        return Worker.builder().id(id).resourceContext(ctx).status(WorkerStatus.IDLE).lastActivity(lastActivity).build();
    }

    private static List<String> snapshot(List<Task> tasks) {
        return tasks.stream().map(t -> t.id() + ":" + t.status() + ":" + t.workerId()).toList();
    }
}
