package conductor.coordinator.discovery;

import conductor.coordinator.model.WorkerDescriptor;

import java.util.List;

/**
 * Source of worker descriptors (filesystem scan, registry service,
 * heartbeat channel...). Calls may be slow and are never made while
 * holding the registry or engine lock.
 */
public interface DiscoveryProvider {

    /**
     * Discover all currently existing workers.
     * Descriptors that cannot be read are skipped, not reported.
     *
     * @return discovered workers, possibly empty
     */
    List<WorkerDescriptor> discoverAll();
}
