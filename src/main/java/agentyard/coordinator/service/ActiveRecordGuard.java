package agentyard.coordinator.service;

import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.repository.BuildRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import agentyard.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps at most one unfinished build or deployment per agent.
 *
 * <p>
 * A job requeued after a transient failure leaves its record QUEUED or mid
 * rollout, and its next delivery resumes it. Once the job ends without another
 * delivery (failed or dead-lettered) nothing would resume the record, so it is
 * closed here as FAILED.
 */
public class ActiveRecordGuard {

    private static final Logger log = LoggerFactory.getLogger(ActiveRecordGuard.class);

    private final JobRepository jobRepository;
    private final BuildRepository buildRepository;
    private final DeploymentRepository deploymentRepository;
    private final BuildCoordinator buildCoordinator;
    private final DeploymentManager deploymentManager;

    public ActiveRecordGuard(JobRepository jobRepository, BuildRepository buildRepository,
            DeploymentRepository deploymentRepository, BuildCoordinator buildCoordinator,
            DeploymentManager deploymentManager) {
        this.jobRepository = jobRepository;
        this.buildRepository = buildRepository;
        this.deploymentRepository = deploymentRepository;
        this.buildCoordinator = buildCoordinator;
        this.deploymentManager = deploymentManager;
    }

    /**
     * Fail every unfinished record the job left behind.
     *
     * @return number of records closed
     */
    public int closeRecords(String jobId, String reason) {
        int closed = 0;
        if (buildCoordinator.abandon(jobId, reason).isPresent()) {
            closed++;
        }
        if (deploymentManager.abandon(jobId, reason).isPresent()) {
            closed++;
        }
        if (closed > 0) {
            log.info("Closed {} unfinished record(s) of job {}: {}", closed, jobId, reason);
        }
        return closed;
    }

    /**
     * Find another job that still owns an unfinished record of the agent and
     * may be delivered again. Records of jobs that already ended are closed on
     * the way.
     *
     * @return id of the job to wait for, empty if the agent is free
     */
    public Optional<String> findBlockingJob(String agentId, String jobId) {
        Set<String> owners = new LinkedHashSet<>();
        for (BuildRecord build : buildRepository.findActive(agentId)) {
            owners.add(build.jobId());
        }
        for (DeploymentRecord deployment : deploymentRepository.findActive(agentId)) {
            owners.add(deployment.jobId());
        }
        owners.remove(jobId);
        owners.remove(null);

        for (String owner : owners) {
            Optional<Job> ownerJob = jobRepository.findById(owner);
            if (ownerJob.isPresent() && !ownerJob.get().isTerminal()) {
                return Optional.of(owner);
            }
            String state = ownerJob.map(j -> j.status().name()).orElse("missing");
            log.warn("Job {} is {} but left a record of agent {} unfinished", owner, state, agentId);
            closeRecords(owner, "job " + owner + " ended as " + state + " before its record finished");
        }
        return Optional.empty();
    }
}
