package agentyard.coordinator.worker;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.InvalidJobException;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobKind;
import agentyard.coordinator.model.JobPayload;
import agentyard.coordinator.model.JobRetryResult;
import agentyard.coordinator.repository.AgentRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import agentyard.coordinator.repository.StoreException;
import agentyard.coordinator.service.ActiveRecordGuard;
import agentyard.coordinator.service.AgentLockService;
import agentyard.coordinator.service.AgentLockService.AgentLock;
import agentyard.coordinator.service.BuildCoordinator;
import agentyard.coordinator.service.BuildCoordinator.BuildCommand;
import agentyard.coordinator.service.DeploymentManager;
import agentyard.coordinator.service.DeploymentManager.DeployCommand;
import agentyard.coordinator.service.JobQueueService;
import agentyard.platform.PlatformException;
import agentyard.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Handles one claimed job: takes the agent's lease, waits out any other job's
 * unfinished rollout, dispatches to the build coordinator or deployment
 * manager, and settles the claim. A job that ends failed or dead-lettered
 * closes the records it left unfinished.
 *
 * <p>
 * Every claim ends in exactly one of ack, fail, retry or defer, except when
 * the state store is failing. Then the claim is abandoned unacknowledged and
 * the reaper redelivers it after the visibility timeout.
 */
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    public enum Outcome {
        ACKED,
        FAILED,
        RETRIED,
        DEAD_LETTERED,
        DEFERRED,
        ABANDONED
    }

    private final JobQueueService queue;
    private final AgentRepository agentRepository;
    private final DeploymentRepository deploymentRepository;
    private final AgentLockService lockService;
    private final BuildCoordinator buildCoordinator;
    private final DeploymentManager deploymentManager;
    private final ActiveRecordGuard recordGuard;
    private final CoordinatorConfig config;

    public JobProcessor(JobQueueService queue, AgentRepository agentRepository,
            DeploymentRepository deploymentRepository, AgentLockService lockService,
            BuildCoordinator buildCoordinator, DeploymentManager deploymentManager,
            ActiveRecordGuard recordGuard, CoordinatorConfig config) {
        this.queue = queue;
        this.agentRepository = agentRepository;
        this.deploymentRepository = deploymentRepository;
        this.lockService = lockService;
        this.buildCoordinator = buildCoordinator;
        this.deploymentManager = deploymentManager;
        this.recordGuard = recordGuard;
        this.config = config;
    }

    public Outcome process(Job job, String consumerId) throws InterruptedException {
        try {
            JobPayload payload;
            try {
                payload = JobPayload.parse(job.kind(), job.payload());
            } catch (InvalidJobException e) {
                queue.fail(job.id(), consumerId, e.getMessage());
                return Outcome.FAILED;
            }

            if (agentRepository.findById(job.agentId()).isEmpty()) {
                queue.fail(job.id(), consumerId, "agent " + job.agentId() + " is not registered");
                return Outcome.FAILED;
            }

            Optional<AgentLock> lock = lockService.acquire(job.agentId(), consumerId, config.lockWaitTimeout());
            if (lock.isEmpty()) {
                log.info("Agent {} busy, deferring job {}", job.agentId(), job.id());
                queue.defer(job.id(), consumerId, config.lockRetryDelay());
                return Outcome.DEFERRED;
            }

            try (AgentLock held = lock.get()) {
                Optional<String> blocking = recordGuard.findBlockingJob(job.agentId(), job.id());
                if (blocking.isPresent()) {
                    log.info("Agent {} has an unfinished rollout of job {}, deferring job {}",
                            job.agentId(), blocking.get(), job.id());
                    queue.defer(job.id(), consumerId, config.lockRetryDelay());
                    return Outcome.DEFERRED;
                }

                Outcome outcome = dispatch(job, payload, consumerId);
                if (held.isLost()) {
                    log.warn("Lease on agent {} was lost while job {} ran", job.agentId(), job.id());
                }
                return outcome;
            }
        } catch (StoreException e) {
            log.error("State store failure on job {}, leaving claim for redelivery", job.id(), e);
            return Outcome.ABANDONED;
        } catch (RuntimeException e) {
            log.error("Unexpected failure on job {}, leaving claim for redelivery", job.id(), e);
            return Outcome.ABANDONED;
        }
    }

    private Outcome dispatch(Job job, JobPayload payload, String consumerId) throws InterruptedException {
        try {
            if (job.kind() == JobKind.BUILD) {
                return runBuild(job, payload, consumerId);
            }
            return runDeploy(job, payload, consumerId);
        } catch (InvalidJobException e) {
            return failAndClose(job, consumerId, e.getMessage());
        } catch (TransientPlatformException e) {
            JobRetryResult result = queue.retry(job.id(), consumerId, e.getMessage(),
                    queue.retryDelay(job.attempts()));
            if (result == JobRetryResult.DEAD_LETTERED) {
                recordGuard.closeRecords(job.id(), "job dead-lettered: " + e.getMessage());
                return Outcome.DEAD_LETTERED;
            }
            return Outcome.RETRIED;
        } catch (PlatformException e) {
            return failAndClose(job, consumerId, e.getMessage());
        }
    }

    private Outcome failAndClose(Job job, String consumerId, String reason) {
        queue.fail(job.id(), consumerId, reason);
        recordGuard.closeRecords(job.id(), "job failed: " + reason);
        return Outcome.FAILED;
    }

    private Outcome runBuild(Job job, JobPayload payload, String consumerId) throws InterruptedException {
        BuildRecord build = buildCoordinator.build(new BuildCommand(job.id(), job.agentId(),
                payload.sourceRef(), payload.imageReference(), payload.force()));
        if (!build.isSucceeded()) {
            queue.fail(job.id(), consumerId, "build " + build.id() + " failed: " + build.errorDetail());
            return Outcome.FAILED;
        }

        if (payload.deployAfterBuild()) {
            if (isAlreadyServing(job, build, payload)) {
                log.info("Agent {} already runs {}, skipping redeploy", job.agentId(), build.imageReference());
            } else {
                DeploymentRecord deployment = deploymentManager.deploy(new DeployCommand(job.id(), job.agentId(),
                        null, payload.port(), payload.env(), build.id()));
                if (deployment.status() != DeploymentStatus.RUNNING) {
                    queue.fail(job.id(), consumerId,
                            "deployment " + deployment.id() + " failed: " + deployment.errorDetail());
                    return Outcome.FAILED;
                }
            }
        }

        queue.ack(job.id(), consumerId);
        return Outcome.ACKED;
    }

    private Outcome runDeploy(Job job, JobPayload payload, String consumerId) throws InterruptedException {
        DeploymentRecord deployment = deploymentManager.deploy(new DeployCommand(job.id(), job.agentId(),
                payload.imageReference(), payload.port(), payload.env(), null));
        if (deployment.status() != DeploymentStatus.RUNNING) {
            queue.fail(job.id(), consumerId, "deployment " + deployment.id() + " failed: " + deployment.errorDetail());
            return Outcome.FAILED;
        }
        queue.ack(job.id(), consumerId);
        return Outcome.ACKED;
    }

    /**
     * A reused build whose image already backs the current deployment needs no
     * new rollout, unless this job asks for a port.
     */
    private boolean isAlreadyServing(Job job, BuildRecord build, JobPayload payload) {
        if (job.id().equals(build.jobId()) || payload.hasPort() || !payload.env().isEmpty()) {
            return false;
        }
        return deploymentRepository.findCurrent(job.agentId())
                .map(d -> build.id().equals(d.buildId()))
                .orElse(false);
    }
}
