package agentyard.coordinator.service;

import agentyard.coordinator.model.Agent;
import agentyard.coordinator.model.PortSource;
import agentyard.coordinator.model.ResolvedPort;
import agentyard.coordinator.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the listen port of a deployment: explicit request, then the port
 * recorded in the agent registry, then the configured default.
 */
public class PortResolver {

    private static final Logger log = LoggerFactory.getLogger(PortResolver.class);

    private final AgentRepository agentRepository;
    private final int defaultPort;

    public PortResolver(AgentRepository agentRepository, int defaultPort) {
        if (!isValid(defaultPort)) {
            throw new IllegalArgumentException("default port out of range: " + defaultPort);
        }
        this.agentRepository = agentRepository;
        this.defaultPort = defaultPort;
    }

    public ResolvedPort resolve(String agentId, Integer requestedPort) {
        if (requestedPort != null) {
            if (isValid(requestedPort)) {
                return new ResolvedPort(requestedPort, PortSource.EXPLICIT);
            }
            log.warn("Ignoring invalid requested port {} for agent {}", requestedPort, agentId);
        }

        Integer stored = agentRepository.findById(agentId).map(Agent::port).orElse(null);
        if (stored != null) {
            if (isValid(stored)) {
                return new ResolvedPort(stored, PortSource.REGISTRY);
            }
            log.warn("Ignoring invalid registry port {} for agent {}", stored, agentId);
        }

        return new ResolvedPort(defaultPort, PortSource.DEFAULT);
    }

    static boolean isValid(int port) {
        return port > 0 && port <= 65535;
    }
}
