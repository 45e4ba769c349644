package conductor.coordinator.store;

import conductor.coordinator.model.RegistrySnapshot;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskPriority;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SnapshotStore.
 * A save replaces both tables in one transaction; a snapshot is never half written.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private final Database db;

    public JdbcSnapshotStore(Database db) {
        this.db = db;
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        String workerSql = """
                    INSERT INTO workers (id, name, kind, resource_context, status, last_activity,
                                         current_task, session_ref, position)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String taskSql = """
                    INSERT INTO tasks (id, command, resource_context, priority, status, worker_id,
                                       created_at, started_at, completed_at, result, position)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (Statement st = conn.createStatement();
                    PreparedStatement wps = conn.prepareStatement(workerSql);
                    PreparedStatement tps = conn.prepareStatement(taskSql)) {

                st.executeUpdate("DELETE FROM workers");
                st.executeUpdate("DELETE FROM tasks");

                int pos = 0;
                for (Worker w : snapshot.workers()) {
                    wps.setString(1, w.id());
                    wps.setString(2, w.name());
                    wps.setString(3, w.kind());
                    wps.setString(4, w.resourceContext());
                    wps.setString(5, w.status().name());
                    setTimestamp(wps, 6, w.lastActivity());
                    wps.setString(7, w.currentTaskRef());
                    wps.setString(8, w.sessionRef());
                    wps.setInt(9, pos++);
                    wps.addBatch();
                }
                wps.executeBatch();

                pos = 0;
                for (Task t : snapshot.tasks()) {
                    tps.setString(1, t.id());
                    tps.setString(2, t.command());
                    tps.setString(3, t.resourceContext());
                    tps.setString(4, t.priority().name());
                    tps.setString(5, t.status().name());
                    tps.setString(6, t.workerId());
                    setTimestamp(tps, 7, t.createdAt());
                    setTimestamp(tps, 8, t.startedAt());
                    setTimestamp(tps, 9, t.completedAt());
                    tps.setString(10, t.result());
                    tps.setInt(11, pos++);
                    tps.addBatch();
                }
                tps.executeBatch();

                conn.commit();
                log.debug("Saved snapshot ({} workers, {} tasks)", snapshot.workers().size(), snapshot.tasks().size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to save snapshot", e);
        }
    }

    @Override
    public Optional<RegistrySnapshot> load() {
        try (Connection conn = db.getConnection()) {
            List<Worker> workers = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers ORDER BY position");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    workers.add(mapWorker(rs));
                }
            }

            List<Task> tasks = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM tasks ORDER BY position");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapTask(rs));
                }
            }
            conn.commit();

            if (workers.isEmpty() && tasks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new RegistrySnapshot(workers, tasks, Instant.now()));
        } catch (SQLException e) {
            log.warn("Failed to load snapshot: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Worker mapWorker(ResultSet rs) throws SQLException {
        return Worker.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .kind(rs.getString("kind"))
                .resourceContext(nullToEmpty(rs.getString("resource_context")))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .lastActivity(getInstant(rs, "last_activity"))
                .currentTaskRef(rs.getString("current_task"))
                .sessionRef(rs.getString("session_ref"))
                .build();
    }

    private Task mapTask(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .command(rs.getString("command"))
                .resourceContext(nullToEmpty(rs.getString("resource_context")))
                .priority(TaskPriority.valueOf(rs.getString("priority")))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .workerId(rs.getString("worker_id"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .result(rs.getString("result"))
                .build();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
