package agentyard.coordinator.store;

import agentyard.coordinator.model.Agent;
import agentyard.coordinator.repository.AgentRepository;
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

import static agentyard.coordinator.store.JdbcSupport.getIntOrNull;
import static agentyard.coordinator.store.JdbcSupport.isUniqueViolation;
import static agentyard.coordinator.store.JdbcSupport.setIntOrNull;
import static agentyard.coordinator.store.JdbcSupport.setTimestamp;
import static agentyard.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of AgentRepository.
 */
public class JdbcAgentRepository implements AgentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRepository.class);

    private final Database db;

    public JdbcAgentRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(Agent agent) {
        String updateSql = "UPDATE agents SET name = ?, port = ?, updated_at = ? WHERE id = ?";
        String insertSql = """
                    INSERT INTO agents (id, name, port, source_ref, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            Instant now = Instant.now();

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setString(1, agent.name());
                setIntOrNull(ps, 2, agent.port());
                setTimestamp(ps, 3, now);
                ps.setString(4, agent.id());
                if (ps.executeUpdate() > 0) {
                    conn.commit();
                    log.debug("Updated agent {}", agent.id());
                    return;
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, agent.id());
                ps.setString(2, agent.name());
                setIntOrNull(ps, 3, agent.port());
                ps.setString(4, agent.sourceRef());
                setTimestamp(ps, 5, now);
                setTimestamp(ps, 6, now);
                ps.executeUpdate();
                conn.commit();
                log.info("Registered agent {}", agent.id());
            } catch (SQLException e) {
                if (!isUniqueViolation(e)) {
                    throw e;
                }
                // Registered concurrently; the other writer's row wins
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert agent: " + agent.id(), e);
        }
    }

    @Override
    public Optional<Agent> findById(String agentId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM agents WHERE id = ?")) {

            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find agent: " + agentId, e);
        }
    }

    @Override
    public List<Agent> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM agents ORDER BY id");
                ResultSet rs = ps.executeQuery()) {

            List<Agent> agents = new ArrayList<>();
            while (rs.next()) {
                agents.add(mapRow(rs));
            }
            return agents;
        } catch (SQLException e) {
            throw new StoreException("Failed to list agents", e);
        }
    }

    @Override
    public boolean updatePort(String agentId, int port) {
        return updateColumn("UPDATE agents SET port = ?, updated_at = ? WHERE id = ?", agentId, port);
    }

    @Override
    public boolean updateSourceRef(String agentId, String sourceRef) {
        return updateColumn("UPDATE agents SET source_ref = ?, updated_at = ? WHERE id = ?", agentId, sourceRef);
    }

    private boolean updateColumn(String sql, String agentId, Object value) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, value);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, agentId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update agent: " + agentId, e);
        }
    }

    private Agent mapRow(ResultSet rs) throws SQLException {
        return new Agent(
                rs.getString("id"),
                rs.getString("name"),
                getIntOrNull(rs, "port"),
                rs.getString("source_ref"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }
}
