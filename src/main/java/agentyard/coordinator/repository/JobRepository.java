package agentyard.coordinator.repository;

import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobAckResult;
import agentyard.coordinator.model.JobRetryResult;
import agentyard.coordinator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the durable job queue.
 * All mutations of a claimed job are guarded by the holder's consumer id, so a
 * consumer whose claim was reaped and redelivered cannot acknowledge it.
 */
public interface JobRepository {

    /**
     * Append a job.
     *
     * @return false if a job with the same id already exists
     */
    boolean saveIfAbsent(Job job);

    Optional<Job> findById(String jobId);

    /**
     * Jobs of one agent, newest first.
     */
    List<Job> findByAgentId(String agentId, int limit);

    /**
     * Atomically claim the oldest PENDING job visible at {@code now}.
     * Moves it to CLAIMED for the consumer and increments its attempts.
     *
     * @return the claimed job, empty if nothing is deliverable
     */
    Optional<Job> claimNext(String consumerId, Instant now);

    /**
     * Move a claimed job to a terminal status (DONE or FAILED), finished at
     * {@code now}.
     */
    JobAckResult complete(String jobId, String consumerId, JobStatus terminalStatus, String errorMessage,
            Instant now);

    /**
     * Hand a claimed job back to the queue.
     * A job that has used all of its attempts is dead-lettered instead, unless
     * {@code consumeAttempt} is false, in which case the claim's attempt is
     * returned and the job is always requeued.
     *
     * @param now       finish time if the job is dead-lettered
     * @param visibleAt earliest redelivery time
     */
    JobRetryResult requeue(String jobId, String consumerId, String reason, Instant now, Instant visibleAt,
            boolean consumeAttempt);

    /**
     * Find CLAIMED jobs whose claim is older than the cutoff.
     */
    List<Job> findExpiredClaims(Instant claimedBefore);

    /**
     * Return an expired claim to PENDING.
     * Only succeeds if the job is still CLAIMED by the same consumer.
     */
    boolean releaseClaim(String jobId, String consumerId, Instant visibleAt);

    /**
     * Dead-letter a claimed job. Only succeeds if it is still CLAIMED by the
     * same consumer.
     */
    boolean deadLetter(String jobId, String consumerId, String reason, Instant now);

    int countByStatus(JobStatus status);
}
