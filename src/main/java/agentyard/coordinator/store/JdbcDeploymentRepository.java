package agentyard.coordinator.store;

import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.PortSource;
import agentyard.coordinator.repository.DeploymentRepository;
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
import static agentyard.coordinator.store.JdbcSupport.setTimestamp;
import static agentyard.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of DeploymentRepository.
 */
public class JdbcDeploymentRepository implements DeploymentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeploymentRepository.class);

    private static final int MAX_DETAIL_LENGTH = 4096;

    private final Database db;

    public JdbcDeploymentRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(DeploymentRecord d) {
        String sql = """
                    INSERT INTO deployments (id, job_id, agent_id, build_id, image_reference, resolved_port,
                                             port_source, workload_name, service_endpoint, status, error_detail,
                                             superseded_by, retired_at, created_at, updated_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, d.id());
            ps.setString(2, d.jobId());
            ps.setString(3, d.agentId());
            ps.setString(4, d.buildId());
            ps.setString(5, d.imageReference());
            ps.setInt(6, d.resolvedPort());
            ps.setString(7, d.portSource().name());
            ps.setString(8, d.workloadName());
            ps.setString(9, d.serviceEndpoint());
            ps.setString(10, d.status().name());
            ps.setString(11, clip(d.errorDetail(), MAX_DETAIL_LENGTH));
            ps.setString(12, d.supersededBy());
            setTimestamp(ps, 13, d.retiredAt());
            setTimestamp(ps, 14, d.createdAt() != null ? d.createdAt() : now);
            setTimestamp(ps, 15, d.updatedAt() != null ? d.updatedAt() : now);
            setTimestamp(ps, 16, d.completedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved deployment {} for agent {}", d.id(), d.agentId());
        } catch (SQLException e) {
            throw new StoreException("Failed to save deployment: " + d.id(), e);
        }
    }

    @Override
    public void update(DeploymentRecord d) {
        String sql = """
                    UPDATE deployments
                    SET workload_name = ?, service_endpoint = ?, status = ?, error_detail = ?,
                        updated_at = ?, completed_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, d.workloadName());
            ps.setString(2, d.serviceEndpoint());
            ps.setString(3, d.status().name());
            ps.setString(4, clip(d.errorDetail(), MAX_DETAIL_LENGTH));
            setTimestamp(ps, 5, d.updatedAt() != null ? d.updatedAt() : Instant.now());
            setTimestamp(ps, 6, d.completedAt());
            ps.setString(7, d.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw new IllegalStateException("Deployment not found: " + d.id());
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update deployment: " + d.id(), e);
        }
    }

    @Override
    public Optional<DeploymentRecord> findById(String deploymentId) {
        return findOne("SELECT * FROM deployments WHERE id = ?", deploymentId);
    }

    @Override
    public Optional<DeploymentRecord> findByJobId(String jobId) {
        return findOne("SELECT * FROM deployments WHERE job_id = ? ORDER BY created_at DESC LIMIT 1", jobId);
    }

    @Override
    public List<DeploymentRecord> findByAgentId(String agentId, int limit) {
        String sql = "SELECT * FROM deployments WHERE agent_id = ? ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find deployments for agent: " + agentId, e);
        }
    }

    @Override
    public Optional<DeploymentRecord> findCurrent(String agentId) {
        return findOne("""
                    SELECT * FROM deployments
                    WHERE agent_id = ? AND status = 'RUNNING' AND superseded_by IS NULL
                    ORDER BY completed_at DESC
                    LIMIT 1
                """, agentId);
    }

    @Override
    public List<DeploymentRecord> findActive(String agentId) {
        String sql = """
                    SELECT * FROM deployments
                    WHERE agent_id = ? AND status NOT IN ('RUNNING', 'FAILED')
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find active deployments for agent: " + agentId, e);
        }
    }

    @Override
    public List<DeploymentRecord> supersedeRunning(String agentId, String supersededBy, Instant now) {
        String selectSql = """
                    SELECT * FROM deployments
                    WHERE agent_id = ? AND status = 'RUNNING' AND superseded_by IS NULL AND id <> ?
                """;
        String updateSql = """
                    UPDATE deployments
                    SET superseded_by = ?, updated_at = ?
                    WHERE id = ? AND superseded_by IS NULL
                """;

        try (Connection conn = db.getConnection()) {
            List<DeploymentRecord> previous;
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setString(1, agentId);
                ps.setString(2, supersededBy);
                previous = executeQuery(ps);
            }

            List<DeploymentRecord> superseded = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                for (DeploymentRecord d : previous) {
                    ps.setString(1, supersededBy);
                    setTimestamp(ps, 2, now);
                    ps.setString(3, d.id());
                    if (ps.executeUpdate() > 0) {
                        superseded.add(d.toBuilder().supersededBy(supersededBy).updatedAt(now).build());
                    }
                }
            }
            conn.commit();

            if (!superseded.isEmpty()) {
                log.info("Deployment {} superseded {} previous deployment(s) of agent {}",
                        supersededBy, superseded.size(), agentId);
            }
            return superseded;
        } catch (SQLException e) {
            throw new StoreException("Failed to supersede deployments of agent: " + agentId, e);
        }
    }

    @Override
    public List<DeploymentRecord> findSupersededNotRetired() {
        String sql = """
                    SELECT * FROM deployments
                    WHERE superseded_by IS NOT NULL AND retired_at IS NULL
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find superseded deployments", e);
        }
    }

    @Override
    public boolean markRetired(String deploymentId, Instant retiredAt) {
        String sql = "UPDATE deployments SET retired_at = ?, updated_at = ? WHERE id = ? AND retired_at IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, retiredAt);
            setTimestamp(ps, 2, retiredAt);
            ps.setString(3, deploymentId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to retire deployment: " + deploymentId, e);
        }
    }

    // Helper methods

    private Optional<DeploymentRecord> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query deployments by " + param, e);
        }
    }

    private List<DeploymentRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<DeploymentRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private DeploymentRecord mapRow(ResultSet rs) throws SQLException {
        return DeploymentRecord.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .agentId(rs.getString("agent_id"))
                .buildId(rs.getString("build_id"))
                .imageReference(rs.getString("image_reference"))
                .resolvedPort(rs.getInt("resolved_port"))
                .portSource(PortSource.valueOf(rs.getString("port_source")))
                .workloadName(rs.getString("workload_name"))
                .serviceEndpoint(rs.getString("service_endpoint"))
                .status(DeploymentStatus.valueOf(rs.getString("status")))
                .errorDetail(rs.getString("error_detail"))
                .supersededBy(rs.getString("superseded_by"))
                .retiredAt(toInstant(rs.getTimestamp("retired_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }
}
