package agentyard.coordinator.store;

import agentyard.coordinator.model.DiscoveredBackend;
import agentyard.coordinator.repository.BackendRepository;
import agentyard.coordinator.repository.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static agentyard.coordinator.store.JdbcSupport.setTimestamp;
import static agentyard.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of BackendRepository.
 * Only the reconciler thread writes here, so update-then-insert needs no
 * conflict handling.
 */
public class JdbcBackendRepository implements BackendRepository {

    private final Database db;

    public JdbcBackendRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsertAll(Collection<DiscoveredBackend> backends) {
        if (backends.isEmpty())
            return;

        String updateSql = """
                    UPDATE discovered_backends
                    SET host = ?, port = ?, workload_name = ?, last_seen_at = ?
                    WHERE agent_id = ?
                """;
        String insertSql = """
                    INSERT INTO discovered_backends (agent_id, host, port, workload_name, last_seen_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement update = conn.prepareStatement(updateSql);
                PreparedStatement insert = conn.prepareStatement(insertSql)) {

            for (DiscoveredBackend b : backends) {
                update.setString(1, b.host());
                update.setInt(2, b.port());
                update.setString(3, b.workloadName());
                setTimestamp(update, 4, b.lastSeenAt());
                update.setString(5, b.agentId());
                if (update.executeUpdate() == 0) {
                    insert.setString(1, b.agentId());
                    insert.setString(2, b.host());
                    insert.setInt(3, b.port());
                    insert.setString(4, b.workloadName());
                    setTimestamp(insert, 5, b.lastSeenAt());
                    insert.executeUpdate();
                }
            }
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to persist discovered backends", e);
        }
    }

    @Override
    public List<DiscoveredBackend> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM discovered_backends ORDER BY agent_id");
                ResultSet rs = ps.executeQuery()) {

            List<DiscoveredBackend> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to list discovered backends", e);
        }
    }

    @Override
    public Optional<DiscoveredBackend> findByAgentId(String agentId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM discovered_backends WHERE agent_id = ?")) {

            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find backend for agent: " + agentId, e);
        }
    }

    @Override
    public boolean delete(String agentId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM discovered_backends WHERE agent_id = ?")) {

            ps.setString(1, agentId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete backend for agent: " + agentId, e);
        }
    }

    private DiscoveredBackend mapRow(ResultSet rs) throws SQLException {
        return new DiscoveredBackend(
                rs.getString("agent_id"),
                rs.getString("host"),
                rs.getInt("port"),
                rs.getString("workload_name"),
                toInstant(rs.getTimestamp("last_seen_at")));
    }
}
