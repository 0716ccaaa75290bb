package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.Agent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("port") Integer port,
        @JsonProperty("sourceRef") String sourceRef,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static AgentResponse from(Agent agent) {
        return new AgentResponse(agent.id(), agent.name(), agent.port(), agent.sourceRef(), agent.updatedAt());
    }
}
