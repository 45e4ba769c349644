package conductor.coordinator.config;

import conductor.coordinator.api.internal.v1.TaskReportController;
import conductor.coordinator.api.internal.v1.WorkerReportController;
import conductor.coordinator.api.v1.HealthController;
import conductor.coordinator.api.v1.RepositoryController;
import conductor.coordinator.api.v1.StateController;
import conductor.coordinator.api.v1.TaskController;
import conductor.coordinator.api.v1.WorkerController;
import conductor.coordinator.core.AppBus;
import conductor.coordinator.discovery.DiscoveryReconciler;
import conductor.coordinator.discovery.DiscoveryRefresher;
import conductor.coordinator.discovery.SessionDirectoryDiscoveryProvider;
import conductor.coordinator.engine.AssignmentEngine;
import conductor.coordinator.registry.WorkerRegistry;
import conductor.coordinator.scheduler.AssignmentLoop;
import conductor.coordinator.scheduler.Scheduler;
import conductor.coordinator.server.CoordinatorNettyServer;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import conductor.coordinator.store.Database;
import conductor.coordinator.store.JdbcSnapshotStore;
import conductor.coordinator.store.JsonFileSnapshotStore;
import conductor.coordinator.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startServer();    // HTTP API
 * deps.startScheduler(); // assignment loop and discovery
 * OrchestratorService service = deps.orchestratorService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final AppBus bus;
    private final Database database; // null unless snapshots go to JDBC
    private final SnapshotStore snapshotStore;
    private final WorkerRegistry workerRegistry;
    private final AssignmentEngine assignmentEngine;
    private final DiscoveryReconciler discoveryReconciler;
    private final DiscoveryRefresher discoveryRefresher; // null when discovery is off
    private final OrchestratorService orchestratorService;

    // Controllers
    private final HealthController healthController;
    private final StateController stateController;
    private final TaskController taskController;
    private final WorkerController workerController;
    private final RepositoryController repositoryController;
    private final WorkerReportController workerReportController;
    private final TaskReportController taskReportController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private CoordinatorNettyServer server;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.bus = new AppBus();
        this.database = config.snapshotMode() == CoordinatorConfig.SnapshotMode.JDBC
                ? new Database(config)
                : null;
        this.snapshotStore = switch (config.snapshotMode()) {
            case FILE -> new JsonFileSnapshotStore(config.stateFile());
            case JDBC -> new JdbcSnapshotStore(database);
            case NONE -> SnapshotStore.NONE;
        };

        // Core
        this.workerRegistry = new WorkerRegistry();
        this.assignmentEngine = new AssignmentEngine(workerRegistry, bus);
        this.discoveryReconciler = new DiscoveryReconciler(workerRegistry, config.activityWindow());
        this.discoveryRefresher = config.discoveryEnabled()
                ? new DiscoveryRefresher(
                        new SessionDirectoryDiscoveryProvider(config.sessionsRoot()), discoveryReconciler, bus)
                : null;

        // Services
        this.orchestratorService = new OrchestratorService(
                workerRegistry, assignmentEngine, snapshotStore, bus, discoveryRefresher);

        // Controllers (public API)
        this.healthController = new HealthController(orchestratorService, database);
        this.stateController = new StateController(orchestratorService);
        this.taskController = new TaskController(orchestratorService);
        this.workerController = new WorkerController(orchestratorService);
        this.repositoryController = new RepositoryController(orchestratorService);

        // Controllers (internal API)
        this.workerReportController = new WorkerReportController(orchestratorService);
        this.taskReportController = new TaskReportController(orchestratorService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public AppBus bus() {
        return bus;
    }

    public SnapshotStore snapshotStore() {
        return snapshotStore;
    }

    public WorkerRegistry workerRegistry() {
        return workerRegistry;
    }

    public AssignmentEngine assignmentEngine() {
        return assignmentEngine;
    }

    public DiscoveryReconciler discoveryReconciler() {
        return discoveryReconciler;
    }

    public OrchestratorService orchestratorService() {
        return orchestratorService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(stateController)
                    .registerController(taskController)
                    .registerController(workerController)
                    .registerController(repositoryController)
                    .registerController(workerReportController)
                    .registerController(taskReportController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            AssignmentLoop loop = new AssignmentLoop(assignmentEngine, workerRegistry,
                    config.assignmentInterval(), config.assignmentBackoff());
            scheduler = new Scheduler(loop, discoveryRefresher, config);
        }
        return scheduler;
    }

    public CoordinatorNettyServer server() {
        if (server == null) {
            server = new CoordinatorNettyServer(routerHandler());
        }
        return server;
    }

    /**
     * Start the HTTP server on the configured host and port.
     *
     * @return true if the server is running
     */
    public boolean startServer() {
        return server().start(config.serverHost(), config.serverPort());
    }

    /**
     * Start the assignment loop and, when configured, periodic discovery.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop intake first, then background work
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Final snapshot before the store goes away
        orchestratorService.persist();

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
