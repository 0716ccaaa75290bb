package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.ReconcileReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pendingJobs") Integer pendingJobs,
        @JsonProperty("claimedJobs") Integer claimedJobs,
        @JsonProperty("deadLetteredJobs") Integer deadLetteredJobs,
        @JsonProperty("workersRunning") Boolean workersRunning,
        @JsonProperty("reconcilerRunning") Boolean reconcilerRunning,
        @JsonProperty("lastReconcile") ReconcileReport lastReconcile) {

    public static HealthResponse healthy(String uptime, String version, int pendingJobs, int claimedJobs,
            int deadLetteredJobs, boolean workersRunning, boolean reconcilerRunning, ReconcileReport lastReconcile) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingJobs, claimedJobs, deadLetteredJobs,
                workersRunning, reconcilerRunning, lastReconcile);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null, null);
    }
}
