package agentyard.coordinator.model;

import java.time.Instant;

/**
 * A live agent instance as reported by the container scheduler.
 */
public record DiscoveredBackend(
        String agentId,
        String host,
        int port,
        String workloadName,
        Instant lastSeenAt) {
}
