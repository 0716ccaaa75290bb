package agentyard.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable outcome of one deployment attempt.
 * A newer RUNNING deployment sets {@code supersededBy} on the previous one;
 * {@code retiredAt} is stamped once the substrate stops reporting the old
 * workload.
 */
public final class DeploymentRecord {
    private final String id;
    private final String jobId;
    private final String agentId;
    private final String buildId;
    private final String imageReference;
    private final int resolvedPort;
    private final PortSource portSource;
    private final String workloadName;
    private final String serviceEndpoint;
    private final DeploymentStatus status;
    private final String errorDetail;
    private final String supersededBy;
    private final Instant retiredAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;

    private DeploymentRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = builder.jobId;
        this.agentId = Objects.requireNonNull(builder.agentId, "agentId is required");
        this.buildId = builder.buildId;
        this.imageReference = Objects.requireNonNull(builder.imageReference, "imageReference is required");
        this.resolvedPort = builder.resolvedPort;
        this.portSource = Objects.requireNonNull(builder.portSource, "portSource is required");
        this.workloadName = Objects.requireNonNull(builder.workloadName, "workloadName is required");
        this.serviceEndpoint = builder.serviceEndpoint;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.errorDetail = builder.errorDetail;
        this.supersededBy = builder.supersededBy;
        this.retiredAt = builder.retiredAt;
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

    public String buildId() {
        return buildId;
    }

    public String imageReference() {
        return imageReference;
    }

    public int resolvedPort() {
        return resolvedPort;
    }

    public PortSource portSource() {
        return portSource;
    }

    public String workloadName() {
        return workloadName;
    }

    public String serviceEndpoint() {
        return serviceEndpoint;
    }

    public DeploymentStatus status() {
        return status;
    }

    public String errorDetail() {
        return errorDetail;
    }

    public String supersededBy() {
        return supersededBy;
    }

    public Instant retiredAt() {
        return retiredAt;
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

    /** Running and not replaced by a newer deployment */
    public boolean isCurrent() {
        return status == DeploymentStatus.RUNNING && supersededBy == null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .agentId(agentId)
                .buildId(buildId)
                .imageReference(imageReference)
                .resolvedPort(resolvedPort)
                .portSource(portSource)
                .workloadName(workloadName)
                .serviceEndpoint(serviceEndpoint)
                .status(status)
                .errorDetail(errorDetail)
                .supersededBy(supersededBy)
                .retiredAt(retiredAt)
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
        private String buildId;
        private String imageReference;
        private int resolvedPort;
        private PortSource portSource = PortSource.DEFAULT;
        private String workloadName;
        private String serviceEndpoint;
        private DeploymentStatus status = DeploymentStatus.QUEUED;
        private String errorDetail;
        private String supersededBy;
        private Instant retiredAt;
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

        public Builder buildId(String buildId) {
            this.buildId = buildId;
            return this;
        }

        public Builder imageReference(String imageReference) {
            this.imageReference = imageReference;
            return this;
        }

        public Builder resolvedPort(int resolvedPort) {
            this.resolvedPort = resolvedPort;
            return this;
        }

        public Builder portSource(PortSource portSource) {
            this.portSource = portSource;
            return this;
        }

        public Builder workloadName(String workloadName) {
            this.workloadName = workloadName;
            return this;
        }

        public Builder serviceEndpoint(String serviceEndpoint) {
            this.serviceEndpoint = serviceEndpoint;
            return this;
        }

        public Builder status(DeploymentStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder supersededBy(String supersededBy) {
            this.supersededBy = supersededBy;
            return this;
        }

        public Builder retiredAt(Instant retiredAt) {
            this.retiredAt = retiredAt;
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

        public DeploymentRecord build() {
            return new DeploymentRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeploymentRecord that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DeploymentRecord{id='" + id + "', agentId='" + agentId + "', status=" + status
                + ", port=" + resolvedPort + "}";
    }
}
