package agentyard.coordinator.service;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobAckResult;
import agentyard.coordinator.model.JobKind;
import agentyard.coordinator.model.JobRetryResult;
import agentyard.coordinator.model.JobStatus;
import agentyard.coordinator.repository.JobRepository;
import agentyard.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for the work queue: intake, claiming and acknowledgement.
 * Delivery is at-least-once; a claim that is neither acked nor handed back is
 * redelivered by the {@link agentyard.coordinator.scheduler.JobReaper}.
 */
public class JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    private final JobRepository jobRepository;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Backoff retryBackoff;

    public JobQueueService(JobRepository jobRepository, CoordinatorConfig config, Clock clock) {
        this.jobRepository = jobRepository;
        this.config = config;
        this.clock = clock;
        this.retryBackoff = Backoff.exponential(config.retryBaseDelay(), config.retryMaxDelay());
    }

    /**
     * Append a job, visible immediately.
     *
     * @param jobId producer-assigned id, or null to generate one
     * @throws DuplicateJobException if the id is already taken
     */
    public Job enqueue(String jobId, String agentId, JobKind kind, String payload) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }

        String id = jobId != null && !jobId.isBlank() ? jobId : "job-" + UUID.randomUUID().toString().substring(0, 8);
        Instant now = clock.instant();

        Job job = Job.builder()
                .id(id)
                .agentId(agentId)
                .kind(kind)
                .payload(payload != null ? payload : "{}")
                .status(JobStatus.PENDING)
                .maxAttempts(config.defaultMaxAttempts())
                .enqueuedAt(now)
                .visibleAt(now)
                .build();

        if (!jobRepository.saveIfAbsent(job)) {
            throw new DuplicateJobException(id);
        }

        log.info("Enqueued {} job {} for agent {}", kind, id, agentId);
        return job;
    }

    /**
     * Claim the oldest deliverable job, polling until one arrives or the timeout
     * passes.
     *
     * @return the claimed job, empty if nothing arrived in time
     */
    public Optional<Job> claim(String consumerId, Duration blockTimeout) throws InterruptedException {
        if (consumerId == null || consumerId.isBlank()) {
            throw new IllegalArgumentException("consumerId is required");
        }

        long deadline = System.nanoTime() + blockTimeout.toNanos();
        while (true) {
            Optional<Job> job = jobRepository.claimNext(consumerId, clock.instant());
            if (job.isPresent()) {
                log.debug("Consumer {} claimed job {} (attempt {}/{})",
                        consumerId, job.get().id(), job.get().attempts(), job.get().maxAttempts());
                return job;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.min(config.claimPollInterval().toMillis(), Math.max(1, remaining / 1_000_000)));
        }
    }

    public JobAckResult ack(String jobId, String consumerId) {
        JobAckResult result = jobRepository.complete(jobId, consumerId, JobStatus.DONE, null, clock.instant());
        logAck(jobId, consumerId, result, "done");
        return result;
    }

    /**
     * Terminal acknowledgement with FAILED.
     */
    public JobAckResult fail(String jobId, String consumerId, String reason) {
        JobAckResult result = jobRepository.complete(jobId, consumerId, JobStatus.FAILED, reason, clock.instant());
        logAck(jobId, consumerId, result, "failed: " + reason);
        return result;
    }

    /**
     * Requeue after {@code delay}, or dead-letter when attempts are exhausted.
     */
    public JobRetryResult retry(String jobId, String consumerId, String reason, Duration delay) {
        Instant now = clock.instant();
        JobRetryResult result = jobRepository.requeue(jobId, consumerId, reason, now, now.plus(delay), true);
        switch (result) {
            case REQUEUED -> log.info("Job {} will be retried in {}s: {}", jobId, delay.toSeconds(), reason);
            case DEAD_LETTERED -> log.warn("Job {} dead-lettered after exhausting attempts: {}", jobId, reason);
            default -> log.warn("Retry of job {} by {} rejected: {}", jobId, consumerId, result);
        }
        return result;
    }

    /**
     * Requeue without consuming an attempt.
     */
    public JobRetryResult defer(String jobId, String consumerId, Duration delay) {
        Instant now = clock.instant();
        JobRetryResult result = jobRepository.requeue(jobId, consumerId, "deferred: agent busy",
                now, now.plus(delay), false);
        if (result == JobRetryResult.REQUEUED) {
            log.debug("Job {} deferred for {}ms", jobId, delay.toMillis());
        } else {
            log.warn("Deferral of job {} by {} rejected: {}", jobId, consumerId, result);
        }
        return result;
    }

    /**
     * Delay before redelivering a job that has been delivered {@code attempts}
     * times.
     */
    public Duration retryDelay(int attempts) {
        return retryBackoff.delayFor(attempts);
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> findByAgentId(String agentId, int limit) {
        return jobRepository.findByAgentId(agentId, limit);
    }

    public int countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    private void logAck(String jobId, String consumerId, JobAckResult result, String outcome) {
        switch (result) {
            case ACKED -> log.info("Job {} {}", jobId, outcome);
            case ALREADY_TERMINAL -> log.debug("Job {} already terminal (idempotent)", jobId);
            default -> log.warn("Ack of job {} by {} rejected: {}", jobId, consumerId, result);
        }
    }
}
