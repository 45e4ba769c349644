package conductor;

import conductor.coordinator.config.CoordinatorConfig;
import conductor.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Starts the HTTP API before the scheduler so workers can report as soon as
 * the first discovery round has registered them.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        if (!deps.startServer()) {
            log.error("Server did not start on port {}, exiting", config.serverPort());
            deps.close();
            System.exit(1);
            return;
        }
        deps.startScheduler();

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            deps.close();
            shutdown.countDown();
        }, "conductor-shutdown"));

        log.info("Conductor running on port {}", deps.server().port());
        shutdown.await();
    }
}
