package conductor.coordinator.integration;

import conductor.coordinator.config.CoordinatorConfig;
import conductor.coordinator.config.Dependencies;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.service.OrchestratorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State written by one coordinator instance is picked up by the next one.
 */
class SnapshotRecoveryIntegrationTest {

    @TempDir
    Path dir;

    @Test
    void fileSnapshotSurvivesRestart() {
        Path stateFile = dir.resolve("state.json");
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withSnapshotMode(CoordinatorConfig.SnapshotMode.FILE)
                .withStateFile(stateFile);

        String assignedId;
        String pendingId;
        try (Dependencies first = Dependencies.create(config)) {
            OrchestratorService service = first.orchestratorService();
            service.registerWorker(Worker.builder().id("w1").resourceContext("/repo").build());
            assignedId = service.enqueue("build", "/repo", TaskPriority.NORMAL);
            pendingId = service.enqueue("test", "/repo", TaskPriority.LOW);
        }
        assertTrue(Files.exists(stateFile));

        try (Dependencies second = Dependencies.create(config)) {
            OrchestratorService service = second.orchestratorService();

            Task assigned = service.findTask(assignedId).orElseThrow();
            assertEquals(TaskStatus.ASSIGNED, assigned.status());
            assertEquals("w1", assigned.workerId());
            assertEquals(TaskStatus.PENDING, service.findTask(pendingId).orElseThrow().status());

            Worker w1 = service.findWorker("w1").orElseThrow();
            assertEquals(WorkerStatus.BUSY, w1.status());
            assertEquals(assignedId, w1.currentTaskRef());
        }
    }

    @Test
    void jdbcSnapshotSurvivesRestart() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withSnapshotMode(CoordinatorConfig.SnapshotMode.JDBC)
                .withDatabaseUrl("jdbc:h2:mem:recovery-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");

        String taskId;
        try (Dependencies first = Dependencies.create(config)) {
            taskId = first.orchestratorService().enqueue("deploy", "", TaskPriority.CRITICAL);
        }

        try (Dependencies second = Dependencies.create(config)) {
            Task task = second.orchestratorService().findTask(taskId).orElseThrow();
            assertEquals(TaskPriority.CRITICAL, task.priority());
            assertEquals(TaskStatus.PENDING, task.status());
        }
    }
}
