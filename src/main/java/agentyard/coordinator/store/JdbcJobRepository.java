package agentyard.coordinator.store;

import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobAckResult;
import agentyard.coordinator.model.JobKind;
import agentyard.coordinator.model.JobRetryResult;
import agentyard.coordinator.model.JobStatus;
import agentyard.coordinator.repository.JobRepository;
import agentyard.coordinator.repository.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static agentyard.coordinator.store.JdbcSupport.clip;
import static agentyard.coordinator.store.JdbcSupport.isLockConflict;
import static agentyard.coordinator.store.JdbcSupport.isUniqueViolation;
import static agentyard.coordinator.store.JdbcSupport.setTimestamp;
import static agentyard.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of JobRepository.
 * Claims are optimistic: candidates are selected, then each is taken with a
 * conditional update that only succeeds while the row is still PENDING, so two
 * consumers never hold the same job.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final int CLAIM_CANDIDATES = 5;
    private static final int MAX_ERROR_LENGTH = 4096;

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean saveIfAbsent(Job job) {
        String sql = """
                    INSERT INTO jobs (id, agent_id, kind, payload, status, attempts, max_attempts,
                                      enqueued_at, visible_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant enqueuedAt = job.enqueuedAt() != null ? job.enqueuedAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.agentId());
            ps.setString(3, job.kind().name());
            ps.setString(4, job.payload());
            ps.setString(5, job.status().name());
            ps.setInt(6, job.attempts());
            ps.setInt(7, job.maxAttempts());
            setTimestamp(ps, 8, enqueuedAt);
            setTimestamp(ps, 9, job.visibleAt() != null ? job.visibleAt() : enqueuedAt);

            try {
                ps.executeUpdate();
            } catch (SQLException e) {
                if (isUniqueViolation(e)) {
                    conn.rollback();
                    log.debug("Job {} already exists", job.id());
                    return false;
                }
                throw e;
            }
            conn.commit();

            log.debug("Enqueued job {} ({}) for agent {}", job.id(), job.kind(), job.agentId());
            return true;
        } catch (SQLException e) {
            throw new StoreException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, jobId);
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    private Optional<Job> findById(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public List<Job> findByAgentId(String agentId, int limit) {
        String sql = "SELECT * FROM jobs WHERE agent_id = ? ORDER BY enqueued_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs for agent: " + agentId, e);
        }
    }

    @Override
    public Optional<Job> claimNext(String consumerId, Instant now) {
        String selectSql = """
                    SELECT id FROM jobs
                    WHERE status = 'PENDING' AND visible_at <= ?
                    ORDER BY enqueued_at, id
                    LIMIT ?
                """;

        String updateSql = """
                    UPDATE jobs
                    SET status = 'CLAIMED', consumer_id = ?, claimed_at = ?, attempts = attempts + 1
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection()) {
            List<String> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                setTimestamp(ps, 1, now);
                ps.setInt(2, CLAIM_CANDIDATES);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("id"));
                    }
                }
            }
            conn.commit();

            for (String id : candidates) {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, consumerId);
                    setTimestamp(ps, 2, now);
                    ps.setString(3, id);
                    updated = ps.executeUpdate();
                } catch (SQLException e) {
                    if (!isLockConflict(e)) {
                        throw e;
                    }
                    // Row locked by a concurrent claimer; try the next candidate
                    conn.rollback();
                    log.debug("Lost claim race for job {}: {}", id, e.getMessage());
                    continue;
                }

                if (updated == 1) {
                    Optional<Job> claimed = findById(conn, id);
                    conn.commit();
                    log.debug("Job {} claimed by {}", id, consumerId);
                    return claimed;
                }
                conn.rollback();
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to claim job for consumer: " + consumerId, e);
        }
    }

    @Override
    public JobAckResult complete(String jobId, String consumerId, JobStatus terminalStatus, String errorMessage,
            Instant now) {
        if (terminalStatus != JobStatus.DONE && terminalStatus != JobStatus.FAILED) {
            throw new IllegalArgumentException("terminal status must be DONE or FAILED: " + terminalStatus);
        }

        String sql = """
                    UPDATE jobs
                    SET status = ?, error_message = ?, finished_at = ?
                    WHERE id = ? AND consumer_id = ? AND status = 'CLAIMED'
                """;

        try (Connection conn = db.getConnection()) {
            Optional<Job> current = findById(conn, jobId);
            if (current.isEmpty()) {
                return JobAckResult.NOT_FOUND;
            }
            if (current.get().isTerminal()) {
                return JobAckResult.ALREADY_TERMINAL;
            }

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, terminalStatus.name());
                ps.setString(2, clip(errorMessage, MAX_ERROR_LENGTH));
                setTimestamp(ps, 3, now);
                ps.setString(4, jobId);
                ps.setString(5, consumerId);

                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    log.warn("Consumer {} tried to ack job {} it does not hold", consumerId, jobId);
                    return JobAckResult.NOT_HOLDER;
                }
            }
            conn.commit();

            log.debug("Job {} acked as {} by {}", jobId, terminalStatus, consumerId);
            return JobAckResult.ACKED;
        } catch (SQLException e) {
            throw new StoreException("Failed to ack job: " + jobId, e);
        }
    }

    @Override
    public JobRetryResult requeue(String jobId, String consumerId, String reason, Instant now, Instant visibleAt,
            boolean consumeAttempt) {
        String requeueSql = """
                    UPDATE jobs
                    SET status = 'PENDING', consumer_id = NULL, claimed_at = NULL,
                        visible_at = ?, error_message = ?, attempts = attempts - ?
                    WHERE id = ? AND consumer_id = ? AND status = 'CLAIMED'
                """;

        try (Connection conn = db.getConnection()) {
            Optional<Job> current = findById(conn, jobId);
            if (current.isEmpty()) {
                return JobRetryResult.NOT_FOUND;
            }
            Job job = current.get();

            if (consumeAttempt && !job.canRetry()) {
                return deadLetter(jobId, consumerId, reason, now)
                        ? JobRetryResult.DEAD_LETTERED
                        : JobRetryResult.NOT_HOLDER;
            }

            try (PreparedStatement ps = conn.prepareStatement(requeueSql)) {
                setTimestamp(ps, 1, visibleAt);
                ps.setString(2, clip(reason, MAX_ERROR_LENGTH));
                ps.setInt(3, consumeAttempt ? 0 : 1);
                ps.setString(4, jobId);
                ps.setString(5, consumerId);

                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    log.warn("Consumer {} tried to requeue job {} it does not hold", consumerId, jobId);
                    return JobRetryResult.NOT_HOLDER;
                }
            }
            conn.commit();

            log.debug("Job {} requeued, visible at {}", jobId, visibleAt);
            return JobRetryResult.REQUEUED;
        } catch (SQLException e) {
            throw new StoreException("Failed to requeue job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findExpiredClaims(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status = 'CLAIMED' AND claimed_at < ?
                    ORDER BY claimed_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, claimedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find expired claims", e);
        }
    }

    @Override
    public boolean releaseClaim(String jobId, String consumerId, Instant visibleAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'PENDING', consumer_id = NULL, claimed_at = NULL, visible_at = ?
                    WHERE id = ? AND consumer_id = ? AND status = 'CLAIMED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, visibleAt);
            ps.setString(2, jobId);
            ps.setString(3, consumerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to release claim of job: " + jobId, e);
        }
    }

    @Override
    public boolean deadLetter(String jobId, String consumerId, String reason, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET status = 'DEAD_LETTERED', error_message = ?, finished_at = ?
                    WHERE id = ? AND consumer_id = ? AND status = 'CLAIMED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, clip(reason, MAX_ERROR_LENGTH));
            setTimestamp(ps, 2, now);
            ps.setString(3, jobId);
            ps.setString(4, consumerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.warn("Job {} dead-lettered: {}", jobId, reason);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to dead-letter job: " + jobId, e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM jobs WHERE status = ?")) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .agentId(rs.getString("agent_id"))
                .kind(JobKind.valueOf(rs.getString("kind")))
                .payload(rs.getString("payload"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .consumerId(rs.getString("consumer_id"))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .errorMessage(rs.getString("error_message"))
                .enqueuedAt(toInstant(rs.getTimestamp("enqueued_at")))
                .visibleAt(toInstant(rs.getTimestamp("visible_at")))
                .claimedAt(toInstant(rs.getTimestamp("claimed_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }
}
