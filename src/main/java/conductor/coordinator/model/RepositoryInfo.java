package conductor.coordinator.model;

import conductor.coordinator.util.ResourceContexts;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workers grouped by the resource context they are bound to.
 */
public record RepositoryInfo(
        String name,
        String path,
        List<Worker> workers,
        int idleCount,
        int busyCount,
        int errorCount,
        int offlineCount,
        Instant lastUpdate) {

    public RepositoryInfo {
        workers = List.copyOf(workers);
    }

    /**
     * Group workers by normalized resource context. The first worker seen
     * for a context provides the displayed path.
     */
    public static List<RepositoryInfo> groupByContext(List<Worker> workers) {
        Map<String, List<Worker>> groups = new LinkedHashMap<>();
        for (Worker w : workers) {
            groups.computeIfAbsent(ResourceContexts.normalize(w.resourceContext()), k -> new ArrayList<>()).add(w);
        }

        Instant now = Instant.now();
        List<RepositoryInfo> result = new ArrayList<>(groups.size());
        for (List<Worker> group : groups.values()) {
            String path = group.get(0).resourceContext();
            result.add(new RepositoryInfo(
                    ResourceContexts.lastSegment(path),
                    path,
                    group,
                    count(group, WorkerStatus.IDLE),
                    count(group, WorkerStatus.BUSY),
                    count(group, WorkerStatus.ERROR),
                    count(group, WorkerStatus.OFFLINE),
                    now));
        }
        result.sort(Comparator.comparing(RepositoryInfo::name, String.CASE_INSENSITIVE_ORDER));
        return result;
    }

    private static int count(List<Worker> workers, WorkerStatus status) {
        return (int) workers.stream().filter(w -> w.status() == status).count();
    }
}
