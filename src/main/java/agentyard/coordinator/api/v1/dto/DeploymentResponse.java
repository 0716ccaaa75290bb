package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.DeploymentRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentResponse(
        @JsonProperty("deploymentId") String deploymentId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("buildId") String buildId,
        @JsonProperty("status") String status,
        @JsonProperty("imageReference") String imageReference,
        @JsonProperty("port") int port,
        @JsonProperty("portSource") String portSource,
        @JsonProperty("workload") String workload,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("error") String error,
        @JsonProperty("supersededBy") String supersededBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("retiredAt") Instant retiredAt) {

    public static DeploymentResponse from(DeploymentRecord d) {
        return new DeploymentResponse(
                d.id(),
                d.jobId(),
                d.buildId(),
                d.status().name(),
                d.imageReference(),
                d.resolvedPort(),
                d.portSource().name(),
                d.workloadName(),
                d.serviceEndpoint(),
                d.errorDetail(),
                d.supersededBy(),
                d.createdAt(),
                d.completedAt(),
                d.retiredAt());
    }
}
