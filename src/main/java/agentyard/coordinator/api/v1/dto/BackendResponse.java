package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.DiscoveredBackend;
import agentyard.coordinator.model.GatewayRoute;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * GET /api/v1/backends
 */
public record BackendResponse(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("workload") String workload,
        @JsonProperty("path") String path,
        @JsonProperty("lastSeenAt") Instant lastSeenAt) {

    public static BackendResponse from(DiscoveredBackend b) {
        return new BackendResponse(b.agentId(), b.host(), b.port(), b.workloadName(),
                GatewayRoute.PATH_PREFIX + b.agentId(), b.lastSeenAt());
    }
}
