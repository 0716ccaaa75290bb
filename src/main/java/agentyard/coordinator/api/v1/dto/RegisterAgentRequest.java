package agentyard.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for registering or updating an agent.
 * POST /api/v1/agents
 */
public record RegisterAgentRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("port") Integer port) {

    /** Validate the request */
    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
    }
}
