package agentyard.coordinator.store;

import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.BuildStatus;
import agentyard.coordinator.repository.BuildRepository;
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
 * JDBC implementation of BuildRepository.
 */
public class JdbcBuildRepository implements BuildRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBuildRepository.class);

    private static final int MAX_DETAIL_LENGTH = 4096;

    private final Database db;

    public JdbcBuildRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(BuildRecord build) {
        String sql = """
                    INSERT INTO builds (id, job_id, agent_id, source_ref, target_image, image_reference, status,
                                        backend_job_handle, error_detail, created_at, updated_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, build.id());
            ps.setString(2, build.jobId());
            ps.setString(3, build.agentId());
            ps.setString(4, build.sourceRef());
            ps.setString(5, build.targetImage());
            ps.setString(6, build.imageReference());
            ps.setString(7, build.status().name());
            ps.setString(8, build.backendJobHandle());
            ps.setString(9, clip(build.errorDetail(), MAX_DETAIL_LENGTH));
            setTimestamp(ps, 10, build.createdAt() != null ? build.createdAt() : now);
            setTimestamp(ps, 11, build.updatedAt() != null ? build.updatedAt() : now);
            setTimestamp(ps, 12, build.completedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved build {} for agent {}", build.id(), build.agentId());
        } catch (SQLException e) {
            throw new StoreException("Failed to save build: " + build.id(), e);
        }
    }

    @Override
    public void update(BuildRecord build) {
        String sql = """
                    UPDATE builds
                    SET image_reference = ?, status = ?, backend_job_handle = ?, error_detail = ?,
                        updated_at = ?, completed_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, build.imageReference());
            ps.setString(2, build.status().name());
            ps.setString(3, build.backendJobHandle());
            ps.setString(4, clip(build.errorDetail(), MAX_DETAIL_LENGTH));
            setTimestamp(ps, 5, build.updatedAt() != null ? build.updatedAt() : Instant.now());
            setTimestamp(ps, 6, build.completedAt());
            ps.setString(7, build.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw new IllegalStateException("Build not found: " + build.id());
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update build: " + build.id(), e);
        }
    }

    @Override
    public Optional<BuildRecord> findById(String buildId) {
        return findOne("SELECT * FROM builds WHERE id = ?", buildId);
    }

    @Override
    public Optional<BuildRecord> findByJobId(String jobId) {
        return findOne("SELECT * FROM builds WHERE job_id = ? ORDER BY created_at DESC LIMIT 1", jobId);
    }

    @Override
    public List<BuildRecord> findByAgentId(String agentId, int limit) {
        String sql = "SELECT * FROM builds WHERE agent_id = ? ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find builds for agent: " + agentId, e);
        }
    }

    @Override
    public Optional<BuildRecord> findLatest(String agentId) {
        return findOne("SELECT * FROM builds WHERE agent_id = ? ORDER BY created_at DESC, id DESC LIMIT 1",
                agentId);
    }

    @Override
    public Optional<BuildRecord> findLatestSucceeded(String agentId) {
        return findOne("""
                    SELECT * FROM builds
                    WHERE agent_id = ? AND status = 'SUCCEEDED'
                    ORDER BY completed_at DESC, created_at DESC
                    LIMIT 1
                """, agentId);
    }

    @Override
    public Optional<BuildRecord> findSucceededByImage(String agentId, String imageReference) {
        String sql = """
                    SELECT * FROM builds
                    WHERE agent_id = ? AND image_reference = ? AND status = 'SUCCEEDED'
                    ORDER BY completed_at DESC
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            ps.setString(2, imageReference);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find build for image: " + imageReference, e);
        }
    }

    @Override
    public List<BuildRecord> findActive(String agentId) {
        String sql = """
                    SELECT * FROM builds
                    WHERE agent_id = ? AND status NOT IN ('SUCCEEDED', 'FAILED')
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find active builds for agent: " + agentId, e);
        }
    }

    // Helper methods

    private Optional<BuildRecord> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query builds by " + param, e);
        }
    }

    private List<BuildRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<BuildRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private BuildRecord mapRow(ResultSet rs) throws SQLException {
        return BuildRecord.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .agentId(rs.getString("agent_id"))
                .sourceRef(rs.getString("source_ref"))
                .targetImage(rs.getString("target_image"))
                .imageReference(rs.getString("image_reference"))
                .status(BuildStatus.valueOf(rs.getString("status")))
                .backendJobHandle(rs.getString("backend_job_handle"))
                .errorDetail(rs.getString("error_detail"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }
}
