package agentyard.coordinator.store;

import agentyard.coordinator.model.AgentLease;
import agentyard.coordinator.repository.LeaseRepository;
import agentyard.coordinator.repository.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static agentyard.coordinator.store.JdbcSupport.isLockConflict;
import static agentyard.coordinator.store.JdbcSupport.isUniqueViolation;
import static agentyard.coordinator.store.JdbcSupport.setTimestamp;
import static agentyard.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of LeaseRepository backed by the {@code agent_leases}
 * table. The primary key on agent_id makes the insert the arbiter when two
 * holders race for a free lease.
 */
public class JdbcLeaseRepository implements LeaseRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLeaseRepository.class);

    private final Database db;

    public JdbcLeaseRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean tryAcquire(String agentId, String holder, Instant now, Duration ttl) {
        String takeOverSql = """
                    UPDATE agent_leases
                    SET holder = ?, acquired_at = ?, expires_at = ?
                    WHERE agent_id = ? AND (holder = ? OR expires_at <= ?)
                """;
        String insertSql = "INSERT INTO agent_leases (agent_id, holder, acquired_at, expires_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            Instant expiresAt = now.plus(ttl);

            try (PreparedStatement ps = conn.prepareStatement(takeOverSql)) {
                ps.setString(1, holder);
                setTimestamp(ps, 2, now);
                setTimestamp(ps, 3, expiresAt);
                ps.setString(4, agentId);
                ps.setString(5, holder);
                setTimestamp(ps, 6, now);
                if (ps.executeUpdate() > 0) {
                    conn.commit();
                    log.debug("Lease on {} taken by {}", agentId, holder);
                    return true;
                }
            } catch (SQLException e) {
                if (!isLockConflict(e)) {
                    throw e;
                }
                // Row locked by a concurrent acquirer
                conn.rollback();
                log.debug("Lease on {} contended: {}", agentId, e.getMessage());
                return false;
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, agentId);
                ps.setString(2, holder);
                setTimestamp(ps, 3, now);
                setTimestamp(ps, 4, expiresAt);
                ps.executeUpdate();
                conn.commit();
                log.debug("Lease on {} created for {}", agentId, holder);
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to acquire lease on agent: " + agentId, e);
        }
    }

    @Override
    public boolean renew(String agentId, String holder, Instant now, Duration ttl) {
        String sql = "UPDATE agent_leases SET expires_at = ? WHERE agent_id = ? AND holder = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now.plus(ttl));
            ps.setString(2, agentId);
            ps.setString(3, holder);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to renew lease on agent: " + agentId, e);
        }
    }

    @Override
    public boolean release(String agentId, String holder) {
        String sql = "DELETE FROM agent_leases WHERE agent_id = ? AND holder = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            ps.setString(2, holder);

            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to release lease on agent: " + agentId, e);
        }
    }

    @Override
    public Optional<AgentLease> findByAgentId(String agentId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM agent_leases WHERE agent_id = ?")) {

            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new AgentLease(
                        rs.getString("agent_id"),
                        rs.getString("holder"),
                        toInstant(rs.getTimestamp("acquired_at")),
                        toInstant(rs.getTimestamp("expires_at"))));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find lease on agent: " + agentId, e);
        }
    }
}
