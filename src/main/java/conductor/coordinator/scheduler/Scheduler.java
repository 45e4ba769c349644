package conductor.coordinator.scheduler;

import conductor.coordinator.config.CoordinatorConfig;
import conductor.coordinator.discovery.DiscoveryRefresher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background work:
 * - AssignmentLoop: matches pending tasks to idle workers
 * - DiscoveryRefresher: rebuilds the worker registry from the provider
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final AssignmentLoop assignmentLoop;
    private final DiscoveryRefresher discoveryRefresher;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    /**
     * @param assignmentLoop     reconciliation loop
     * @param discoveryRefresher discovery round, or null to skip periodic discovery
     * @param config             configuration
     */
    public Scheduler(AssignmentLoop assignmentLoop, DiscoveryRefresher discoveryRefresher, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conductor-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.assignmentLoop = assignmentLoop;
        this.discoveryRefresher = discoveryRefresher;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        // Discovery first, so the first assignment cycle sees real workers
        if (discoveryRefresher != null) {
            long discoveryIntervalMs = config.discoveryInterval().toMillis();
            executor.scheduleAtFixedRate(
                    wrapRunnable("discovery-refresh", discoveryRefresher),
                    0,
                    discoveryIntervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("Discovery refresh scheduled every {}ms", discoveryIntervalMs);
        }

        assignmentLoop.start(executor);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        assignmentLoop.stop();
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public AssignmentLoop assignmentLoop() {
        return assignmentLoop;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
