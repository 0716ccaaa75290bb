package agentyard.coordinator.service;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.InvalidJobException;
import agentyard.coordinator.model.PortSource;
import agentyard.coordinator.model.ResolvedPort;
import agentyard.coordinator.repository.AgentRepository;
import agentyard.coordinator.repository.BuildRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import agentyard.coordinator.util.Backoff;
import agentyard.platform.ContainerScheduler;
import agentyard.platform.PlatformException;
import agentyard.platform.TransientPlatformException;
import agentyard.platform.WorkloadHandle;
import agentyard.platform.WorkloadSpec;
import agentyard.platform.WorkloadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Rolls out a built image as a workload and waits until it serves.
 *
 * <p>
 * State machine: QUEUED, DEPLOYING, HEALTH_CHECK, then RUNNING or FAILED.
 * The previous RUNNING deployment of the agent is only superseded after the new
 * one is RUNNING, so a failed rollout never takes the agent offline.
 */
public class DeploymentManager {

    private static final Logger log = LoggerFactory.getLogger(DeploymentManager.class);

    private final DeploymentRepository deploymentRepository;
    private final BuildRepository buildRepository;
    private final AgentRepository agentRepository;
    private final ContainerScheduler scheduler;
    private final PortResolver portResolver;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Backoff pollBackoff;

    public DeploymentManager(DeploymentRepository deploymentRepository, BuildRepository buildRepository,
            AgentRepository agentRepository, ContainerScheduler scheduler, PortResolver portResolver,
            CoordinatorConfig config, Clock clock) {
        this.deploymentRepository = deploymentRepository;
        this.buildRepository = buildRepository;
        this.agentRepository = agentRepository;
        this.scheduler = scheduler;
        this.portResolver = portResolver;
        this.config = config;
        this.clock = clock;
        this.pollBackoff = Backoff.exponential(config.deployPollInitial(), config.deployPollMax());
    }

    /**
     * Input of one deployment.
     *
     * @param imageReference image to run, null to use the build or the latest
     *                       successful build
     * @param requestedPort  explicit port, null to resolve it
     * @param buildId        build that produced the image, set when chained
     *                       after a build
     */
    public record DeployCommand(String jobId, String agentId, String imageReference, Integer requestedPort,
            Map<String, String> env, String buildId) {

        public DeployCommand {
            env = env == null ? Map.of() : Map.copyOf(env);
        }
    }

    public DeploymentRecord deploy(DeployCommand cmd) throws InterruptedException {
        Optional<DeploymentRecord> existing = deploymentRepository.findByJobId(cmd.jobId());
        if (existing.isPresent()) {
            return resume(existing.get(), cmd);
        }

        BuildRecord build = selectBuild(cmd);
        ResolvedPort port = portResolver.resolve(cmd.agentId(), cmd.requestedPort());

        Instant now = clock.instant();
        String id = "deploy-" + UUID.randomUUID().toString().substring(0, 8);
        DeploymentRecord record = DeploymentRecord.builder()
                .id(id)
                .jobId(cmd.jobId())
                .agentId(cmd.agentId())
                .buildId(build.id())
                .imageReference(build.imageReference())
                .resolvedPort(port.port())
                .portSource(port.source())
                .workloadName(workloadName(cmd.agentId(), id, now))
                .status(DeploymentStatus.QUEUED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        deploymentRepository.save(record);
        log.info("Deployment {} queued for agent {}: image={}, port={} ({})", record.id(), record.agentId(),
                record.imageReference(), record.resolvedPort(), record.portSource());

        return rollOut(record, cmd.env());
    }

    /**
     * Close the unfinished deployment of a job that will not be delivered
     * again, removing whatever workload it may have applied.
     *
     * @return the FAILED record, empty if the job left no unfinished deployment
     */
    public Optional<DeploymentRecord> abandon(String jobId, String reason) {
        return deploymentRepository.findByJobId(jobId)
                .filter(d -> !d.isTerminal())
                .map(d -> fail(d, reason));
    }

    private DeploymentRecord resume(DeploymentRecord record, DeployCommand cmd) throws InterruptedException {
        if (record.isTerminal()) {
            return record;
        }
        log.info("Resuming deployment {} of agent {} in state {}", record.id(), record.agentId(), record.status());
        // apply is idempotent per workload name, so every state restarts from it
        return rollOut(record, cmd.env());
    }

    private BuildRecord selectBuild(DeployCommand cmd) {
        if (cmd.buildId() != null) {
            BuildRecord build = buildRepository.findById(cmd.buildId())
                    .orElseThrow(() -> new InvalidJobException("build " + cmd.buildId() + " not found"));
            if (!build.isSucceeded()) {
                throw new InvalidJobException("build " + build.id() + " is " + build.status() + ", not SUCCEEDED");
            }
            return build;
        }
        if (cmd.imageReference() != null) {
            return buildRepository.findSucceededByImage(cmd.agentId(), cmd.imageReference())
                    .orElseThrow(() -> new InvalidJobException(
                            "no successful build of agent " + cmd.agentId() + " produced " + cmd.imageReference()));
        }
        return buildRepository.findLatestSucceeded(cmd.agentId())
                .orElseThrow(() -> new InvalidJobException("agent " + cmd.agentId() + " has no successful build"));
    }

    private DeploymentRecord rollOut(DeploymentRecord record, Map<String, String> env) throws InterruptedException {
        WorkloadHandle handle;
        try {
            handle = scheduler.apply(workloadSpec(record, env));
        } catch (TransientPlatformException e) {
            save(record.toBuilder()
                    .status(DeploymentStatus.QUEUED)
                    .errorDetail("scheduler unavailable: " + e.getMessage()));
            throw e;
        } catch (PlatformException e) {
            return fail(record, "workload rejected: " + e.getMessage());
        }

        DeploymentRecord deploying = save(record.toBuilder()
                .status(DeploymentStatus.DEPLOYING)
                .errorDetail(null));
        log.info("Deployment {} applied workload {}", deploying.id(), handle);

        String scheduleFailure = awaitScheduled(deploying, handle);
        if (scheduleFailure != null) {
            return fail(deploying, scheduleFailure);
        }

        DeploymentRecord checking = save(deploying.toBuilder().status(DeploymentStatus.HEALTH_CHECK));
        String healthFailure = awaitReady(checking, handle);
        if (healthFailure != null) {
            return fail(checking, healthFailure);
        }

        String endpoint;
        try {
            endpoint = scheduler.endpoint(handle);
        } catch (TransientPlatformException e) {
            log.warn("Endpoint lookup for deployment {} failed: {}", checking.id(), e.getMessage());
            throw e;
        } catch (PlatformException e) {
            return fail(checking, "endpoint unavailable: " + e.getMessage());
        }

        return promote(checking, endpoint);
    }

    /**
     * @return failure detail, null once the workload is scheduled
     */
    private String awaitScheduled(DeploymentRecord record, WorkloadHandle handle) throws InterruptedException {
        Duration timeout = config.scheduleTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;

        while (true) {
            try {
                WorkloadState state = scheduler.state(handle);
                switch (state.phase()) {
                    case SCHEDULED:
                        return null;
                    case FAILED:
                        return "workload failed to schedule: " + (state.detail() != null ? state.detail() : "unknown");
                    case MISSING:
                        return "workload " + handle + " disappeared from scheduler";
                    default:
                        break;
                }
            } catch (TransientPlatformException e) {
                log.warn("Scheduling check for deployment {} failed, will retry: {}", record.id(), e.getMessage());
            } catch (PlatformException e) {
                return "scheduling check rejected: " + e.getMessage();
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return "workload not scheduled within " + timeout.toSeconds() + "s";
            }
            pollBackoff.pause(++attempt, Duration.ofNanos(remaining));
        }
    }

    /**
     * @return failure detail, null once the workload is ready
     */
    private String awaitReady(DeploymentRecord record, WorkloadHandle handle) throws InterruptedException {
        Duration timeout = config.healthCheckTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;

        while (true) {
            try {
                if (scheduler.isReady(handle)) {
                    return null;
                }
            } catch (TransientPlatformException e) {
                log.warn("Health check for deployment {} failed, will retry: {}", record.id(), e.getMessage());
            } catch (PlatformException e) {
                return "health check rejected: " + e.getMessage();
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return "health check did not pass within " + timeout.toSeconds() + "s";
            }
            pollBackoff.pause(++attempt, Duration.ofNanos(remaining));
        }
    }

    private DeploymentRecord promote(DeploymentRecord record, String endpoint) {
        Instant now = clock.instant();
        DeploymentRecord running = save(record.toBuilder()
                .status(DeploymentStatus.RUNNING)
                .serviceEndpoint(endpoint)
                .errorDetail(null)
                .completedAt(now));

        List<DeploymentRecord> superseded = deploymentRepository.supersedeRunning(running.agentId(), running.id(), now);
        if (running.portSource() == PortSource.EXPLICIT) {
            agentRepository.updatePort(running.agentId(), running.resolvedPort());
        }
        log.info("Deployment {} of agent {} running at {} (superseded {})", running.id(), running.agentId(),
                endpoint, superseded.size());

        if (config.retireSupersededWorkloads()) {
            for (DeploymentRecord old : superseded) {
                if (!old.workloadName().equals(running.workloadName())) {
                    removeQuietly(old.workloadName(), "superseded by " + running.id());
                }
            }
        }
        return running;
    }

    private DeploymentRecord fail(DeploymentRecord record, String detail) {
        DeploymentRecord failed = save(record.toBuilder()
                .status(DeploymentStatus.FAILED)
                .errorDetail(detail)
                .completedAt(clock.instant()));
        log.warn("Deployment {} of agent {} failed: {}", failed.id(), failed.agentId(), detail);
        removeQuietly(failed.workloadName(), "failed rollout");
        return failed;
    }

    // Best effort. A leftover workload is retired by the reconciler later.
    private void removeQuietly(String workloadName, String reason) {
        try {
            scheduler.remove(workloadName);
            log.info("Removed workload {} ({})", workloadName, reason);
        } catch (PlatformException e) {
            log.warn("Could not remove workload {} ({}): {}", workloadName, reason, e.getMessage());
        }
    }

    private DeploymentRecord save(DeploymentRecord.Builder builder) {
        DeploymentRecord updated = builder.updatedAt(clock.instant()).build();
        deploymentRepository.update(updated);
        return updated;
    }

    private WorkloadSpec workloadSpec(DeploymentRecord record, Map<String, String> env) {
        Map<String, String> vars = new LinkedHashMap<>(env);
        vars.put("PORT", String.valueOf(record.resolvedPort()));
        return new WorkloadSpec(record.workloadName(), record.agentId(), record.imageReference(),
                record.resolvedPort(), Map.of(WorkloadSpec.AGENT_ID_LABEL, record.agentId()), vars);
    }

    static String workloadName(String agentId, String deploymentId, Instant now) {
        String suffix = deploymentId.substring(deploymentId.length() - 4);
        return "agent-" + agentId + "-" + now.getEpochSecond() + "-" + suffix;
    }
}
