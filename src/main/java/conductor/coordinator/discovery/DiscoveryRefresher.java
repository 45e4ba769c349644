package conductor.coordinator.discovery;

import conductor.coordinator.core.AppBus;
import conductor.coordinator.model.WorkerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one discovery round: asks the provider for descriptors (slow, no
 * lock held) and then applies them with the reconciler (fast, locked).
 */
public class DiscoveryRefresher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryRefresher.class);

    /** Returned by {@link #refresh()} when the provider failed */
    public static final int PROVIDER_FAILED = -1;

    private final DiscoveryProvider provider;
    private final DiscoveryReconciler reconciler;
    private final AppBus bus;

    public DiscoveryRefresher(DiscoveryProvider provider, DiscoveryReconciler reconciler, AppBus bus) {
        this.provider = provider;
        this.reconciler = reconciler;
        this.bus = bus;
    }

    @Override
    public void run() {
        refresh();
    }

    /**
     * @return number of workers registered, or {@link #PROVIDER_FAILED} if
     *         discovery failed and the registry was left as it was
     */
    public int refresh() {
        List<WorkerDescriptor> descriptors;
        try {
            descriptors = provider.discoverAll();
        } catch (RuntimeException e) {
            log.error("Worker discovery failed, registry left unchanged", e);
            return PROVIDER_FAILED;
        }

        int registered = reconciler.reconcileAll(descriptors);
        log.info("Discovery refreshed registry with {} workers", registered);
        bus.fireWorkersChanged();
        return registered;
    }
}
