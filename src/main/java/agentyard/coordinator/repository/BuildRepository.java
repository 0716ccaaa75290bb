package agentyard.coordinator.repository;

import agentyard.coordinator.model.BuildRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for build records. Records are never deleted.
 */
public interface BuildRepository {

    void save(BuildRecord build);

    /**
     * Persist all mutable fields of an existing record.
     */
    void update(BuildRecord build);

    Optional<BuildRecord> findById(String buildId);

    Optional<BuildRecord> findByJobId(String jobId);

    /**
     * Builds of one agent, newest first.
     */
    List<BuildRecord> findByAgentId(String agentId, int limit);

    Optional<BuildRecord> findLatest(String agentId);

    Optional<BuildRecord> findLatestSucceeded(String agentId);

    /**
     * The newest SUCCEEDED build of the agent that produced the image.
     */
    Optional<BuildRecord> findSucceededByImage(String agentId, String imageReference);

    /**
     * Builds of the agent not yet SUCCEEDED or FAILED.
     */
    List<BuildRecord> findActive(String agentId);
}
