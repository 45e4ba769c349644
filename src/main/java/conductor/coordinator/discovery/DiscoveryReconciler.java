package conductor.coordinator.discovery;

import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerDescriptor;
import conductor.coordinator.model.WorkerStatus;
import conductor.coordinator.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a batch of discovered workers into the registry.
 *
 * The merge is a full replace: workers absent from the batch disappear, even
 * when tasks still reference them. Freshly discovered workers are IDLE unless
 * their executor was active within the activity window, in which case they
 * are BUSY. Discovery never produces ERROR or OFFLINE workers: being
 * discovered counts as being available.
 */
public class DiscoveryReconciler {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryReconciler.class);

    private final WorkerRegistry registry;
    private final Duration activityWindow;
    private final Clock clock;

    public DiscoveryReconciler(WorkerRegistry registry, Duration activityWindow) {
        this(registry, activityWindow, Clock.systemUTC());
    }

    public DiscoveryReconciler(WorkerRegistry registry, Duration activityWindow, Clock clock) {
        this.registry = registry;
        this.activityWindow = activityWindow;
        this.clock = clock;
    }

    /**
     * Replace the registry content with the given descriptors.
     *
     * @return number of workers now registered
     */
    public int reconcileAll(Collection<WorkerDescriptor> descriptors) {
        Instant now = clock.instant();
        Map<String, Worker> mapped = new LinkedHashMap<>();
        int skipped = 0;

        for (WorkerDescriptor d : descriptors) {
            if (d == null || d.id() == null || d.id().isBlank()) {
                skipped++;
                continue;
            }
            // later duplicates win
            mapped.remove(d.id());
            mapped.put(d.id(), toWorker(d, now));
        }

        if (skipped > 0) {
            log.warn("Skipped {} discovered workers without id", skipped);
        }

        List<Worker> workers = new ArrayList<>(mapped.values());
        registry.replaceAll(workers);

        if (log.isDebugEnabled()) {
            long busy = workers.stream().filter(w -> w.status() == WorkerStatus.BUSY).count();
            log.debug("Reconciled {} workers ({} busy, {} idle)", workers.size(), busy, workers.size() - busy);
        }
        return workers.size();
    }

    /**
     * Default status for a freshly discovered worker.
     */
    public WorkerStatus classify(WorkerDescriptor descriptor, Instant now) {
        if (!descriptor.recentExecutorActivity() || descriptor.lastActivity() == null) {
            return WorkerStatus.IDLE;
        }
        Duration age = Duration.between(descriptor.lastActivity(), now);
        return age.compareTo(activityWindow) <= 0 ? WorkerStatus.BUSY : WorkerStatus.IDLE;
    }

    private Worker toWorker(WorkerDescriptor d, Instant now) {
        return Worker.builder()
                .id(d.id())
                .name(d.name() != null ? d.name() : d.id())
                .kind(d.kind())
                .resourceContext(d.resourceContext() != null ? d.resourceContext() : "")
                .sessionRef(d.sessionRef())
                .status(classify(d, now))
                .lastActivity(d.lastActivity() != null ? d.lastActivity() : now)
                .build();
    }
}
