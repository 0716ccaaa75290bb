package agentyard.coordinator.repository;

import agentyard.coordinator.model.DiscoveredBackend;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Last discovered backend per agent.
 */
public interface BackendRepository {

    /**
     * Insert or update the snapshot of each backend.
     */
    void upsertAll(Collection<DiscoveredBackend> backends);

    List<DiscoveredBackend> findAll();

    Optional<DiscoveredBackend> findByAgentId(String agentId);

    boolean delete(String agentId);
}
