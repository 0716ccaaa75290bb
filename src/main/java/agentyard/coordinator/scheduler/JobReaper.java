package agentyard.coordinator.scheduler;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.repository.JobRepository;
import agentyard.coordinator.service.ActiveRecordGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that redelivers jobs whose claim outlived the visibility
 * timeout.
 *
 * Claims expire when:
 * - a worker process crashed mid-job
 * - the state store failed and the worker abandoned the claim
 *
 * Expired claims with attempts left go back to PENDING; the rest are
 * dead-lettered, and the build or deployment they left unfinished is failed.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobRepository jobRepository;
    private final ActiveRecordGuard recordGuard;
    private final CoordinatorConfig config;
    private final Clock clock;

    public JobReaper(JobRepository jobRepository, ActiveRecordGuard recordGuard, CoordinatorConfig config,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.recordGuard = recordGuard;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapExpiredClaims();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * @return number of claims released or dead-lettered
     */
    public int reapExpiredClaims() {
        Instant now = clock.instant();
        List<Job> expired = jobRepository.findExpiredClaims(now.minus(config.visibilityTimeout()));

        if (expired.isEmpty()) {
            log.debug("No expired claims");
            return 0;
        }

        int released = 0;
        int deadLettered = 0;

        for (Job job : expired) {
            try {
                if (job.canRetry()) {
                    if (jobRepository.releaseClaim(job.id(), job.consumerId(), now)) {
                        released++;
                        log.info("Released expired claim on job {} held by {} (attempt {} of {})",
                                job.id(), job.consumerId(), job.attempts(), job.maxAttempts());
                    }
                } else {
                    String reason = "claim expired after " + job.attempts() + "/" + job.maxAttempts() + " attempts";
                    if (jobRepository.deadLetter(job.id(), job.consumerId(), reason, now)) {
                        deadLettered++;
                        log.warn("Job {} dead-lettered after {} attempts (claim expired)", job.id(), job.attempts());
                        recordGuard.closeRecords(job.id(), "job dead-lettered: " + reason);
                    }
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Job reaper: {} released, {} dead-lettered, {} expired", released, deadLettered, expired.size());
        return released + deadLettered;
    }
}
