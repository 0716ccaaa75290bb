package agentyard.coordinator.repository;

import agentyard.coordinator.model.DeploymentRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for deployment records. Records are never deleted.
 */
public interface DeploymentRepository {

    void save(DeploymentRecord deployment);

    /**
     * Persist all mutable fields of an existing record.
     */
    void update(DeploymentRecord deployment);

    Optional<DeploymentRecord> findById(String deploymentId);

    Optional<DeploymentRecord> findByJobId(String jobId);

    /**
     * Deployments of one agent, newest first.
     */
    List<DeploymentRecord> findByAgentId(String agentId, int limit);

    /**
     * The RUNNING deployment of the agent that has not been superseded.
     */
    Optional<DeploymentRecord> findCurrent(String agentId);

    /**
     * Deployments of the agent not yet RUNNING or FAILED.
     */
    List<DeploymentRecord> findActive(String agentId);

    /**
     * Mark every other RUNNING, not yet superseded deployment of the agent as
     * superseded by {@code supersededBy}.
     *
     * @return the records that were superseded
     */
    List<DeploymentRecord> supersedeRunning(String agentId, String supersededBy, Instant now);

    /**
     * Superseded deployments whose workload has not been confirmed gone.
     */
    List<DeploymentRecord> findSupersededNotRetired();

    boolean markRetired(String deploymentId, Instant retiredAt);
}
