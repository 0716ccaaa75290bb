package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.JobKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Request DTO for enqueueing a job.
 * POST /api/v1/jobs
 *
 * <pre>
 * {"jobId": "optional", "agentId": "doc-agent", "kind": "BUILD", "payload": {"sourceRef": "..."}}
 * </pre>
 */
public record CreateJobRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("agentId") String agentId,
        @JsonProperty("kind") String kind,
        @JsonProperty("payload") JsonNode payload) {

    /** Validate the request */
    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        jobKind();
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
    }

    public JobKind jobKind() {
        try {
            return JobKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("kind must be BUILD or DEPLOY, got: " + kind);
        }
    }

    /** Payload as stored on the job */
    public String payloadJson() {
        return payload == null || payload.isNull() ? "{}" : payload.toString();
    }
}
