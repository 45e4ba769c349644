package conductor.coordinator.model;

import java.time.Instant;

/**
 * A worker as reported by a discovery provider, before the default status
 * policy has been applied.
 *
 * @param recentExecutorActivity whether the provider saw the worker's
 *                               executor produce output recently
 */
public record WorkerDescriptor(
        String id,
        String name,
        String kind,
        String resourceContext,
        String sessionRef,
        Instant lastActivity,
        boolean recentExecutorActivity) {
}
