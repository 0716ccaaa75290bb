package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("agentId") String agentId,
        @JsonProperty("kind") String kind,
        @JsonProperty("status") String status,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("error") String error,
        @JsonProperty("enqueuedAt") Instant enqueuedAt,
        @JsonProperty("visibleAt") Instant visibleAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.agentId(),
                job.kind().name(),
                job.status().name(),
                job.attempts(),
                job.maxAttempts(),
                job.errorMessage(),
                job.enqueuedAt(),
                job.visibleAt(),
                job.finishedAt());
    }
}
