package agentyard.coordinator.service;

import agentyard.coordinator.model.Agent;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DiscoveredBackend;
import agentyard.coordinator.repository.AgentRepository;
import agentyard.coordinator.repository.BackendRepository;
import agentyard.coordinator.repository.BuildRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Agent registry metadata and the read side of build, deployment and backend
 * state.
 */
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    // Used in workload names and gateway paths, so it must be DNS-label safe
    private static final Pattern AGENT_ID = Pattern.compile("[a-z0-9]([a-z0-9-]{0,38}[a-z0-9])?");
    private static final int MAX_HISTORY = 100;

    private final AgentRepository agentRepository;
    private final BuildRepository buildRepository;
    private final DeploymentRepository deploymentRepository;
    private final BackendRepository backendRepository;

    public AgentService(AgentRepository agentRepository, BuildRepository buildRepository,
            DeploymentRepository deploymentRepository, BackendRepository backendRepository) {
        this.agentRepository = agentRepository;
        this.buildRepository = buildRepository;
        this.deploymentRepository = deploymentRepository;
        this.backendRepository = backendRepository;
    }

    /**
     * Everything known about one agent.
     *
     * @param latestBuild       newest build in any state
     * @param currentDeployment RUNNING deployment not yet superseded
     * @param backend           last discovered live instance
     */
    public record AgentStatus(
            Agent agent,
            Optional<BuildRecord> latestBuild,
            Optional<DeploymentRecord> currentDeployment,
            Optional<DiscoveredBackend> backend) {
    }

    /**
     * Register an agent or update its name and port. A null port keeps the
     * one already recorded.
     */
    public Agent register(String agentId, String name, Integer port) {
        validateAgentId(agentId);
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }

        Optional<Agent> existing = agentRepository.findById(agentId);
        Integer effectivePort = port != null ? port : existing.map(Agent::port).orElse(null);
        String effectiveName = name != null && !name.isBlank() ? name : existing.map(Agent::name).orElse(agentId);

        agentRepository.upsert(new Agent(agentId, effectiveName, effectivePort,
                existing.map(Agent::sourceRef).orElse(null), null, null));
        log.info("Agent {} registered (name={}, port={})", agentId, effectiveName, effectivePort);

        return agentRepository.findById(agentId)
                .orElseThrow(() -> new IllegalStateException("agent " + agentId + " vanished after upsert"));
    }

    public Optional<Agent> findById(String agentId) {
        return agentRepository.findById(agentId);
    }

    public List<Agent> findAll() {
        return agentRepository.findAll();
    }

    public Optional<AgentStatus> status(String agentId) {
        return agentRepository.findById(agentId).map(agent -> new AgentStatus(
                agent,
                buildRepository.findLatest(agentId),
                deploymentRepository.findCurrent(agentId),
                backendRepository.findByAgentId(agentId)));
    }

    public List<BuildRecord> builds(String agentId, int limit) {
        return buildRepository.findByAgentId(agentId, clampLimit(limit));
    }

    public List<DeploymentRecord> deployments(String agentId, int limit) {
        return deploymentRepository.findByAgentId(agentId, clampLimit(limit));
    }

    public List<DiscoveredBackend> backends() {
        return backendRepository.findAll();
    }

    public static void validateAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (!AGENT_ID.matcher(agentId).matches()) {
            throw new IllegalArgumentException(
                    "agentId must be 1-40 lowercase letters, digits or '-', starting and ending with a letter or digit");
        }
    }

    private static int clampLimit(int limit) {
        return limit <= 0 ? MAX_HISTORY : Math.min(limit, MAX_HISTORY);
    }
}
