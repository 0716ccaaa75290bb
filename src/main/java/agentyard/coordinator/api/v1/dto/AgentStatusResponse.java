package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.service.AgentService.AgentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for the combined agent view.
 * GET /api/v1/agents/{agentId}/status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStatusResponse(
        @JsonProperty("agent") AgentResponse agent,
        @JsonProperty("latestBuild") BuildResponse latestBuild,
        @JsonProperty("currentDeployment") DeploymentResponse currentDeployment,
        @JsonProperty("backend") BackendResponse backend) {

    public static AgentStatusResponse from(AgentStatus status) {
        return new AgentStatusResponse(
                AgentResponse.from(status.agent()),
                status.latestBuild().map(BuildResponse::from).orElse(null),
                status.currentDeployment().map(DeploymentResponse::from).orElse(null),
                status.backend().map(BackendResponse::from).orElse(null));
    }
}
