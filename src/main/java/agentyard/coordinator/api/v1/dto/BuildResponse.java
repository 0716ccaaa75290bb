package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.BuildRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildResponse(
        @JsonProperty("buildId") String buildId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("sourceRef") String sourceRef,
        @JsonProperty("imageReference") String imageReference,
        @JsonProperty("backendJob") String backendJob,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static BuildResponse from(BuildRecord build) {
        return new BuildResponse(
                build.id(),
                build.jobId(),
                build.status().name(),
                build.sourceRef(),
                build.imageReference(),
                build.backendJobHandle(),
                build.errorDetail(),
                build.createdAt(),
                build.completedAt());
    }
}
