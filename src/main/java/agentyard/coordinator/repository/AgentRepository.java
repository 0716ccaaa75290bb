package agentyard.coordinator.repository;

import agentyard.coordinator.model.Agent;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for agent registry metadata.
 */
public interface AgentRepository {

    /**
     * Insert or update name and port of an agent.
     */
    void upsert(Agent agent);

    Optional<Agent> findById(String agentId);

    List<Agent> findAll();

    boolean updatePort(String agentId, int port);

    boolean updateSourceRef(String agentId, String sourceRef);
}
