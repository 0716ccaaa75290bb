package agentyard.coordinator.service;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.BuildStatus;
import agentyard.coordinator.repository.AgentRepository;
import agentyard.coordinator.repository.BuildRepository;
import agentyard.coordinator.util.Backoff;
import agentyard.platform.BuildHandle;
import agentyard.platform.BuildProgress;
import agentyard.platform.BuildRequest;
import agentyard.platform.ImageBuilder;
import agentyard.platform.ImageRegistry;
import agentyard.platform.PlatformException;
import agentyard.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one build from submission to a terminal BuildRecord.
 *
 * <p>
 * State machine: QUEUED, BUILDING, PUSHING, then SUCCEEDED or FAILED. Each
 * transition is persisted before the next collaborator call, so a redelivered
 * job resumes from the stored record instead of submitting a second build.
 * Collaborator rejections end in a FAILED record; only
 * {@link TransientPlatformException} escapes, for job-level retry.
 */
public class BuildCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BuildCoordinator.class);

    private final BuildRepository buildRepository;
    private final AgentRepository agentRepository;
    private final ImageBuilder imageBuilder;
    private final ImageRegistry imageRegistry;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Backoff pollBackoff;

    public BuildCoordinator(BuildRepository buildRepository, AgentRepository agentRepository,
            ImageBuilder imageBuilder, ImageRegistry imageRegistry, CoordinatorConfig config, Clock clock) {
        this.buildRepository = buildRepository;
        this.agentRepository = agentRepository;
        this.imageBuilder = imageBuilder;
        this.imageRegistry = imageRegistry;
        this.config = config;
        this.clock = clock;
        this.pollBackoff = Backoff.exponential(config.buildPollInitial(), config.buildPollMax());
    }

    /**
     * Input of one build.
     *
     * @param imageReference destination tag, null for
     *                       {@code <registry>/<agentId>:v<epochSeconds>}
     * @param force          rebuild even if the same source already built
     */
    public record BuildCommand(String jobId, String agentId, String sourceRef, String imageReference,
            boolean force) {
    }

    public BuildRecord build(BuildCommand cmd) throws InterruptedException {
        Optional<BuildRecord> existing = buildRepository.findByJobId(cmd.jobId());
        if (existing.isPresent()) {
            return resume(existing.get());
        }

        if (!cmd.force()) {
            Optional<BuildRecord> reusable = buildRepository.findLatestSucceeded(cmd.agentId())
                    .filter(b -> b.sourceRef().equals(cmd.sourceRef()));
            if (reusable.isPresent()) {
                log.info("Agent {} already built from {} as {}, skipping rebuild",
                        cmd.agentId(), cmd.sourceRef(), reusable.get().imageReference());
                return reusable.get();
            }
        }

        Instant now = clock.instant();
        BuildRecord record = BuildRecord.builder()
                .id("build-" + UUID.randomUUID().toString().substring(0, 8))
                .jobId(cmd.jobId())
                .agentId(cmd.agentId())
                .sourceRef(cmd.sourceRef())
                .targetImage(cmd.imageReference() != null ? cmd.imageReference() : defaultImage(cmd.agentId(), now))
                .status(BuildStatus.QUEUED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        buildRepository.save(record);
        log.info("Build {} queued for agent {} from {} -> {}",
                record.id(), record.agentId(), record.sourceRef(), record.targetImage());

        return submitAndTrack(record);
    }

    /**
     * Close the unfinished build of a job that will not be delivered again.
     *
     * @return the FAILED record, empty if the job left no unfinished build
     */
    public Optional<BuildRecord> abandon(String jobId, String reason) {
        return buildRepository.findByJobId(jobId)
                .filter(b -> !b.isTerminal())
                .map(b -> fail(b, reason));
    }

    private BuildRecord resume(BuildRecord record) throws InterruptedException {
        if (record.isTerminal()) {
            return record;
        }
        log.info("Resuming build {} of agent {} in state {}", record.id(), record.agentId(), record.status());
        return switch (record.status()) {
            case BUILDING -> record.backendJobHandle() != null
                    ? track(record, new BuildHandle(record.backendJobHandle()))
                    : submitAndTrack(record);
            case PUSHING -> verifyPush(record);
            default -> submitAndTrack(record);
        };
    }

    private BuildRecord submitAndTrack(BuildRecord record) throws InterruptedException {
        BuildHandle handle;
        try {
            handle = imageBuilder.submit(new BuildRequest(record.agentId(), record.sourceRef(), record.targetImage()));
        } catch (TransientPlatformException e) {
            save(record.toBuilder()
                    .status(BuildStatus.QUEUED)
                    .errorDetail("build backend unavailable: " + e.getMessage()));
            throw e;
        } catch (PlatformException e) {
            return fail(record, "build submission rejected: " + e.getMessage());
        }

        BuildRecord building = save(record.toBuilder()
                .status(BuildStatus.BUILDING)
                .backendJobHandle(handle.id())
                .errorDetail(null));
        log.info("Build {} submitted as backend job {}", building.id(), handle);

        return track(building, handle);
    }

    private BuildRecord track(BuildRecord record, BuildHandle handle) throws InterruptedException {
        Duration timeout = config.buildTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;

        while (true) {
            try {
                BuildProgress progress = imageBuilder.status(handle);
                log.debug("Build {} backend job {}: {}", record.id(), handle, progress.state());

                if (progress.state() == BuildProgress.State.SUCCEEDED) {
                    BuildRecord pushing = save(record.toBuilder().status(BuildStatus.PUSHING));
                    return verifyPush(pushing);
                }
                if (progress.state() == BuildProgress.State.FAILED) {
                    String detail = progress.detail() != null ? progress.detail() : "build failed";
                    return fail(record, detail + " (build job " + handle + ")");
                }
            } catch (TransientPlatformException e) {
                log.warn("Build {} status check failed, will retry: {}", record.id(), e.getMessage());
            } catch (PlatformException e) {
                return fail(record, "build status unavailable: " + e.getMessage() + " (build job " + handle + ")");
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return fail(record, "build timed out after " + timeout.toSeconds() + "s (build job " + handle + ")");
            }
            pollBackoff.pause(++attempt, Duration.ofNanos(remaining));
        }
    }

    private BuildRecord verifyPush(BuildRecord record) {
        boolean exists;
        try {
            exists = imageRegistry.exists(record.targetImage());
        } catch (TransientPlatformException e) {
            log.warn("Registry check for build {} failed: {}", record.id(), e.getMessage());
            throw e;
        } catch (PlatformException e) {
            return fail(record, "registry rejected lookup of " + record.targetImage() + ": " + e.getMessage());
        }

        if (!exists) {
            return fail(record, "image " + record.targetImage() + " not found in registry after push");
        }

        Instant now = clock.instant();
        BuildRecord succeeded = save(record.toBuilder()
                .status(BuildStatus.SUCCEEDED)
                .imageReference(record.targetImage())
                .errorDetail(null)
                .completedAt(now));
        agentRepository.updateSourceRef(record.agentId(), record.sourceRef());
        log.info("Build {} of agent {} succeeded: {}", succeeded.id(), succeeded.agentId(), succeeded.imageReference());
        return succeeded;
    }

    private BuildRecord fail(BuildRecord record, String detail) {
        BuildRecord failed = save(record.toBuilder()
                .status(BuildStatus.FAILED)
                .errorDetail(detail)
                .completedAt(clock.instant()));
        log.warn("Build {} of agent {} failed: {}", failed.id(), failed.agentId(), detail);
        return failed;
    }

    private BuildRecord save(BuildRecord.Builder builder) {
        BuildRecord updated = builder.updatedAt(clock.instant()).build();
        buildRepository.update(updated);
        return updated;
    }

    private String defaultImage(String agentId, Instant now) {
        return config.imageRegistry() + "/" + agentId + ":v" + now.getEpochSecond();
    }
}
