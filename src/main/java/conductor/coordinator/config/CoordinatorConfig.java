package conductor.coordinator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    /** Where snapshots are persisted */
    public enum SnapshotMode { NONE, FILE, JDBC }

    // Persistence settings
    private SnapshotMode snapshotMode = SnapshotMode.FILE;
    private Path stateFile = Path.of("conductor-state.json");
    private String databaseUrl = "jdbc:h2:file:./data/conductor;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Assignment loop settings
    private Duration assignmentInterval = Duration.ofSeconds(2);
    private Duration assignmentBackoff = Duration.ofSeconds(20);

    // Discovery settings
    private Path sessionsRoot = null; // discovery disabled when unset
    private Duration discoveryInterval = Duration.ofSeconds(30);
    private Duration activityWindow = Duration.ofMinutes(2);

    // Auth settings (optional)
    private String agentKey = null; // If set, workers must provide X-Conductor-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String mode = System.getenv("CONDUCTOR_SNAPSHOT_MODE");
        if (mode != null && !mode.isBlank()) {
            config.snapshotMode = SnapshotMode.valueOf(mode.trim().toUpperCase());
        }

        String stateFile = System.getenv("CONDUCTOR_STATE_FILE");
        if (stateFile != null && !stateFile.isBlank()) {
            config.stateFile = Path.of(stateFile);
        }

        String dbUrl = System.getenv("CONDUCTOR_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("CONDUCTOR_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String intervalMs = System.getenv("CONDUCTOR_ASSIGNMENT_INTERVAL_MS");
        if (intervalMs != null && !intervalMs.isBlank()) {
            config.assignmentInterval = Duration.ofMillis(Long.parseLong(intervalMs));
            config.assignmentBackoff = config.assignmentInterval.multipliedBy(10);
        }

        String sessionsRoot = System.getenv("CONDUCTOR_SESSIONS_ROOT");
        if (sessionsRoot != null && !sessionsRoot.isBlank()) {
            config.sessionsRoot = Path.of(sessionsRoot);
        }

        String agentKey = System.getenv("CONDUCTOR_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        return config;
    }

    // Getters
    public SnapshotMode snapshotMode() {
        return snapshotMode;
    }

    public Path stateFile() {
        return stateFile;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration assignmentInterval() {
        return assignmentInterval;
    }

    public Duration assignmentBackoff() {
        return assignmentBackoff;
    }

    public Path sessionsRoot() {
        return sessionsRoot;
    }

    public boolean discoveryEnabled() {
        return sessionsRoot != null;
    }

    public Duration discoveryInterval() {
        return discoveryInterval;
    }

    public Duration activityWindow() {
        return activityWindow;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withSnapshotMode(SnapshotMode mode) {
        this.snapshotMode = mode;
        return this;
    }

    public CoordinatorConfig withStateFile(Path stateFile) {
        this.stateFile = stateFile;
        return this;
    }

    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    /** Also resets the backoff to ten times the interval */
    public CoordinatorConfig withAssignmentInterval(Duration interval) {
        this.assignmentInterval = interval;
        this.assignmentBackoff = interval.multipliedBy(10);
        return this;
    }

    public CoordinatorConfig withAssignmentBackoff(Duration backoff) {
        this.assignmentBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withSessionsRoot(Path root) {
        this.sessionsRoot = root;
        return this;
    }

    public CoordinatorConfig withDiscoveryInterval(Duration interval) {
        this.discoveryInterval = interval;
        return this;
    }

    public CoordinatorConfig withActivityWindow(Duration window) {
        this.activityWindow = window;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "snapshotMode=" + snapshotMode +
                ", serverPort=" + serverPort +
                ", assignmentInterval=" + assignmentInterval +
                ", sessionsRoot=" + sessionsRoot +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
