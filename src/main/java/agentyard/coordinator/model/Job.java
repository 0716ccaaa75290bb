package agentyard.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one queued unit of work.
 * The payload is kept as raw JSON; {@link JobPayload#parse} validates it
 * when the job is claimed.
 */
public final class Job {
    private final String id;
    private final String agentId;
    private final JobKind kind;
    private final String payload;
    private final JobStatus status;
    private final String consumerId; // holder while CLAIMED
    private final int attempts;
    private final int maxAttempts;
    private final String errorMessage;
    private final Instant enqueuedAt;
    private final Instant visibleAt;
    private final Instant claimedAt;
    private final Instant finishedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.agentId = Objects.requireNonNull(builder.agentId, "agentId is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.consumerId = builder.consumerId;
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.errorMessage = builder.errorMessage;
        this.enqueuedAt = builder.enqueuedAt;
        this.visibleAt = builder.visibleAt;
        this.claimedAt = builder.claimedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String agentId() {
        return agentId;
    }

    public JobKind kind() {
        return kind;
    }

    public String payload() {
        return payload;
    }

    public JobStatus status() {
        return status;
    }

    public String consumerId() {
        return consumerId;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public Instant visibleAt() {
        return visibleAt;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Check if another delivery attempt is allowed */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .agentId(agentId)
                .kind(kind)
                .payload(payload)
                .status(status)
                .consumerId(consumerId)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .errorMessage(errorMessage)
                .enqueuedAt(enqueuedAt)
                .visibleAt(visibleAt)
                .claimedAt(claimedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String agentId;
        private JobKind kind;
        private String payload = "{}";
        private JobStatus status = JobStatus.PENDING;
        private String consumerId;
        private int attempts = 0;
        private int maxAttempts = 5;
        private String errorMessage;
        private Instant enqueuedAt;
        private Instant visibleAt;
        private Instant claimedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder consumerId(String consumerId) {
            this.consumerId = consumerId;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder visibleAt(Instant visibleAt) {
            this.visibleAt = visibleAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', agentId='" + agentId + "', kind=" + kind + ", status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
