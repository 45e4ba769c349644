package conductor.coordinator.scheduler;

import conductor.coordinator.core.AppBus;
import conductor.coordinator.engine.AssignmentEngine;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.registry.WorkerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentLoopTest {

    private WorkerRegistry registry;
    private AssignmentEngine engine;
    private ScheduledExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new WorkerRegistry();
        engine = new AssignmentEngine(registry, new AppBus());
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void cycleSkippedWithoutPendingTasks() {
        register("w1", WorkerStatus.IDLE);
        AssignmentLoop loop = loop(Duration.ofSeconds(5));

        AssignmentLoop.CycleOutcome outcome = loop.processCycle();

        assertFalse(outcome.triggered());
        assertEquals(0, outcome.unassignedBefore());
        assertEquals(1, outcome.availableWorkers());
    }

    @Test
    void cycleSkippedWithoutIdleWorkers() {
        register("w1", WorkerStatus.BUSY);
        engine.enqueue("build", "", TaskPriority.NORMAL);
        AssignmentLoop loop = loop(Duration.ofSeconds(5));

        AssignmentLoop.CycleOutcome outcome = loop.processCycle();

        assertFalse(outcome.triggered());
        assertEquals(1, outcome.unassignedBefore());
        assertEquals(0, outcome.availableWorkers());
        assertEquals(0, outcome.assignedCount());
    }

    @Test
    void cycleAssignsWhenBothSidesPresent() {
        register("w1", WorkerStatus.BUSY);
        register("w2", WorkerStatus.BUSY);
        engine.enqueue("a", "", TaskPriority.NORMAL);
        engine.enqueue("b", "", TaskPriority.NORMAL);
        engine.enqueue("c", "", TaskPriority.NORMAL);
        registry.updateStatus("w1", WorkerStatus.IDLE, null);
        registry.updateStatus("w2", WorkerStatus.IDLE, null);
        AssignmentLoop loop = loop(Duration.ofSeconds(5));

        AssignmentLoop.CycleOutcome outcome = loop.processCycle();

        assertTrue(outcome.triggered());
        assertEquals(3, outcome.unassignedBefore());
        assertEquals(2, outcome.availableWorkers());
        assertEquals(2, outcome.assignedCount());
    }

    @Test
    @DisplayName("A worker turning idle picks up a queued task within about one interval")
    void runningLoopPicksUpTaskWhenWorkerFreesUp() throws Exception {
        register("w1", WorkerStatus.BUSY);
        String taskId = engine.enqueue("build", "", TaskPriority.NORMAL);
        AssignmentLoop loop = loop(Duration.ofMillis(50));
        loop.start(executor);

        registry.updateStatus("w1", WorkerStatus.IDLE, null);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (engine.findTask(taskId).orElseThrow().status() != TaskStatus.ASSIGNED) {
            assertTrue(System.nanoTime() < deadline, "task was not picked up");
            Thread.sleep(10);
        }
        loop.stop();

        assertEquals("w1", engine.findTask(taskId).orElseThrow().workerId());
    }

    @Test
    void failedCycleBacksOffAndRecovers() throws Exception {
        CountDownLatch twoCalls = new CountDownLatch(2);
        AtomicInteger calls = new AtomicInteger();
        AssignmentEngine flaky = new AssignmentEngine(registry, new AppBus()) {
            @Override
            public int triggerAssignment() {
                twoCalls.countDown();
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("registry unavailable");
                }
                return super.triggerAssignment();
            }
        };
        register("w1", WorkerStatus.BUSY);
        flaky.enqueue("build", "", TaskPriority.NORMAL);
        registry.updateStatus("w1", WorkerStatus.IDLE, null);

        AssignmentLoop loop = new AssignmentLoop(flaky, registry, Duration.ofMillis(20), Duration.ofMillis(100));
        loop.start(executor);

        assertTrue(twoCalls.await(5, TimeUnit.SECONDS), "loop did not survive a failing cycle");
        loop.stop();
        assertEquals(AssignmentLoop.State.STOPPED, loop.state());
    }

    @Test
    void lifecycle() {
        AssignmentLoop loop = loop(Duration.ofSeconds(5));
        assertEquals(AssignmentLoop.State.NEW, loop.state());

        loop.start(executor);
        assertEquals(AssignmentLoop.State.RUNNING, loop.state());

        loop.stop();
        assertEquals(AssignmentLoop.State.STOPPED, loop.state());

        loop.start(executor);
        assertEquals(AssignmentLoop.State.STOPPED, loop.state(), "stopped loop cannot restart");
        loop.stop();
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> loop(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> loop(Duration.ofMillis(-1)));
    }

    private AssignmentLoop loop(Duration interval) {
        return new AssignmentLoop(engine, registry, interval, Duration.ofSeconds(1));
    }

    private void register(String id, WorkerStatus status) {
        registry.register(Worker.builder().id(id).status(status).build());
    }
}
