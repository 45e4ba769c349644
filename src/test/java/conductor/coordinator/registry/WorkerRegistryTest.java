package conductor.coordinator.registry;

import conductor.coordinator.MutableClock;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private MutableClock clock;
    private WorkerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        registry = new WorkerRegistry(clock);
    }

    @Test
    void registerAndGet() {
        assertTrue(registry.register(worker("w1", "/repo", WorkerStatus.IDLE)));

        Worker w = registry.get("w1").orElseThrow();
        assertEquals("/repo", w.resourceContext());
        assertEquals(WorkerStatus.IDLE, w.status());
        assertEquals(clock.instant(), w.lastActivity(), "missing lastActivity is filled with now");
        assertEquals(1, registry.size());
    }

    @Test
    void registerReplacesExisting() {
        registry.register(worker("w1", "/a", WorkerStatus.IDLE));
        registry.register(worker("w1", "/b", WorkerStatus.BUSY));

        assertEquals(1, registry.size());
        assertEquals("/b", registry.get("w1").orElseThrow().resourceContext());
    }

    @Test
    void registerRejectsMissingId() {
        assertFalse(registry.register(null));
        assertFalse(registry.register(worker("  ", "/a", WorkerStatus.IDLE)));
        assertEquals(0, registry.size());
    }

    @Test
    void getUnknownIsEmpty() {
        assertTrue(registry.get("nope").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void updateStatusRefreshesActivity() {
        registry.register(worker("w1", "/repo", WorkerStatus.IDLE));
        clock.advance(Duration.ofMinutes(5));

        assertTrue(registry.updateStatus("w1", WorkerStatus.BUSY, "task-1"));

        Worker w = registry.get("w1").orElseThrow();
        assertEquals(WorkerStatus.BUSY, w.status());
        assertEquals("task-1", w.currentTaskRef());
        assertEquals(clock.instant(), w.lastActivity());
    }

    @Test
    void updateStatusKeepsTaskRefWhenNoneGiven() {
        registry.register(worker("w1", "/repo", WorkerStatus.IDLE));
        registry.updateStatus("w1", WorkerStatus.BUSY, "task-1");

        registry.updateStatus("w1", WorkerStatus.ERROR, "");
        assertEquals("task-1", registry.get("w1").orElseThrow().currentTaskRef());

        registry.updateStatus("w1", WorkerStatus.IDLE, null);
        assertEquals("task-1", registry.get("w1").orElseThrow().currentTaskRef());
        assertEquals(WorkerStatus.IDLE, registry.get("w1").orElseThrow().status());
    }

    @Test
    void updateStatusOfUnknownWorkerFails() {
        assertFalse(registry.updateStatus("ghost", WorkerStatus.IDLE, null));
        assertFalse(registry.updateStatus("", WorkerStatus.IDLE, null));
        assertFalse(registry.updateStatus(null, WorkerStatus.IDLE, null));
    }

    @Test
    @DisplayName("Worker registered with C:\\repo\\ is found by c:/repo")
    void findAvailableNormalizesPaths() {
        registry.register(worker("w1", "C:\\repo\\", WorkerStatus.IDLE));

        List<Worker> found = registry.findAvailable("c:/repo");

        assertEquals(1, found.size());
        assertEquals("w1", found.get(0).id());
    }

    @Test
    void findAvailableSkipsErrorAndOffline() {
        registry.register(worker("idle", "/repo", WorkerStatus.IDLE));
        registry.register(worker("busy", "/repo", WorkerStatus.BUSY));
        registry.register(worker("error", "/repo", WorkerStatus.ERROR));
        registry.register(worker("offline", "/repo", WorkerStatus.OFFLINE));
        registry.register(worker("other", "/elsewhere", WorkerStatus.IDLE));

        assertEquals(List.of("idle", "busy"), ids(registry.findAvailable("/repo")));
        assertEquals(List.of("idle", "busy", "other"), ids(registry.findAvailable("")));
        assertEquals(List.of("idle", "busy", "other"), ids(registry.findAvailable(null)));
    }

    @Test
    void findAvailableDoesNotMatchWorkersWithoutContext() {
        registry.register(worker("bare", "", WorkerStatus.IDLE));
        assertTrue(registry.findAvailable("/repo").isEmpty());
    }

    @Test
    void clearAllRemovesEverything() {
        registry.register(worker("w1", "/a", WorkerStatus.IDLE));
        registry.register(worker("w2", "/b", WorkerStatus.IDLE));

        registry.clearAll();

        assertEquals(0, registry.size());
        assertTrue(registry.getAll().isEmpty());
    }

    @Test
    void replaceAllKeepsExactlyTheGivenIds() {
        registry.register(worker("old", "/a", WorkerStatus.IDLE));

        registry.replaceAll(List.of(
                worker("n1", "/a", WorkerStatus.IDLE),
                worker("n2", "/b", WorkerStatus.BUSY),
                worker("n1", "/c", WorkerStatus.IDLE)));

        assertEquals(List.of("n1", "n2"), ids(registry.getAll()));
        assertEquals("/c", registry.get("n1").orElseThrow().resourceContext(), "later duplicate wins");
        assertTrue(registry.get("old").isEmpty());
    }

    @Test
    void getAllReturnsCopy() {
        registry.register(worker("w1", "/a", WorkerStatus.IDLE));
        List<Worker> snapshot = registry.getAll();

        registry.register(worker("w2", "/b", WorkerStatus.IDLE));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(worker("x", "", WorkerStatus.IDLE)));
    }

    @Test
    @DisplayName("Readers never observe an empty registry during replaceAll")
    void replaceAllHasNoEmptyWindow() throws Exception {
        List<Worker> batch = List.of(
                worker("a", "/a", WorkerStatus.IDLE),
                worker("b", "/b", WorkerStatus.IDLE),
                worker("c", "/c", WorkerStatus.IDLE));
        registry.replaceAll(batch);

        AtomicBoolean done = new AtomicBoolean(false);
        AtomicInteger emptyReads = new AtomicInteger();

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 2_000; i++) {
                registry.replaceAll(batch);
            }
            done.set(true);
        });
        writer.start();

        while (!done.get()) {
            if (registry.getAll().size() != 3) {
                emptyReads.incrementAndGet();
            }
        }
        writer.join();

        assertEquals(0, emptyReads.get());
    }

    private static Worker worker(String id, String ctx, WorkerStatus status) {
        return Worker.builder().id(id).name(id).kind("test").resourceContext(ctx).status(status).build();
    }

    private static List<String> ids(List<Worker> workers) {
        return workers.stream().map(Worker::id).toList();
    }
}
