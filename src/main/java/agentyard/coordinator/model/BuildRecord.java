package agentyard.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable outcome of one build attempt.
 * Records are never deleted; each transition is persisted so status queries
 * always show the latest state and errorDetail.
 */
public final class BuildRecord {
    private final String id;
    private final String jobId;
    private final String agentId;
    private final String sourceRef;
    private final String targetImage; // destination requested from the backend
    private final String imageReference; // set only once SUCCEEDED
    private final BuildStatus status;
    private final String backendJobHandle;
    private final String errorDetail;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;

    private BuildRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = builder.jobId;
        this.agentId = Objects.requireNonNull(builder.agentId, "agentId is required");
        this.sourceRef = Objects.requireNonNull(builder.sourceRef, "sourceRef is required");
        this.targetImage = Objects.requireNonNull(builder.targetImage, "targetImage is required");
        this.imageReference = builder.imageReference;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.backendJobHandle = builder.backendJobHandle;
        this.errorDetail = builder.errorDetail;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public String agentId() {
        return agentId;
    }

    public String sourceRef() {
        return sourceRef;
    }

    public String targetImage() {
        return targetImage;
    }

    public String imageReference() {
        return imageReference;
    }

    public BuildStatus status() {
        return status;
    }

    public String backendJobHandle() {
        return backendJobHandle;
    }

    public String errorDetail() {
        return errorDetail;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isSucceeded() {
        return status == BuildStatus.SUCCEEDED;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .agentId(agentId)
                .sourceRef(sourceRef)
                .targetImage(targetImage)
                .imageReference(imageReference)
                .status(status)
                .backendJobHandle(backendJobHandle)
                .errorDetail(errorDetail)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private String agentId;
        private String sourceRef;
        private String targetImage;
        private String imageReference;
        private BuildStatus status = BuildStatus.QUEUED;
        private String backendJobHandle;
        private String errorDetail;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder sourceRef(String sourceRef) {
            this.sourceRef = sourceRef;
            return this;
        }

        public Builder targetImage(String targetImage) {
            this.targetImage = targetImage;
            return this;
        }

        public Builder imageReference(String imageReference) {
            this.imageReference = imageReference;
            return this;
        }

        public Builder status(BuildStatus status) {
            this.status = status;
            return this;
        }

        public Builder backendJobHandle(String backendJobHandle) {
            this.backendJobHandle = backendJobHandle;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public BuildRecord build() {
            return new BuildRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BuildRecord that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "BuildRecord{id='" + id + "', agentId='" + agentId + "', status=" + status + "}";
    }
}
