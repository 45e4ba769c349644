package conductor.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import conductor.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("conductor-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        // Initialize schema
        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Get the underlying DataSource (for frameworks that need it).
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id               VARCHAR(256) PRIMARY KEY,
                            name             VARCHAR(512),
                            kind             VARCHAR(128),
                            resource_context VARCHAR(1024),
                            status           VARCHAR(20) NOT NULL,
                            last_activity    TIMESTAMP,
                            current_task     VARCHAR(256),
                            session_ref      VARCHAR(256),
                            position         INT NOT NULL
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id               VARCHAR(64) PRIMARY KEY,
                            command          CLOB NOT NULL,
                            resource_context VARCHAR(1024),
                            priority         VARCHAR(20) NOT NULL,
                            status           VARCHAR(20) NOT NULL,
                            worker_id        VARCHAR(256),
                            created_at       TIMESTAMP,
                            started_at       TIMESTAMP,
                            completed_at     TIMESTAMP,
                            result           CLOB,
                            position         INT NOT NULL
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
