package agentyard.platform.simulated;

import agentyard.coordinator.model.GatewayRoute;
import agentyard.platform.GatewayAdmin;
import agentyard.platform.PlatformException;
import agentyard.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory gateway route table keyed by agent id.
 */
public class SimulatedGatewayAdmin implements GatewayAdmin {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGatewayAdmin.class);

    private final Map<String, GatewayRoute> routes = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private volatile boolean unavailable = false;

    @Override
    public List<GatewayRoute> listRoutes() {
        checkAvailable();
        return new ArrayList<>(routes.values());
    }

    @Override
    public void createRoute(GatewayRoute route) {
        check(route.agentId());
        routes.put(route.agentId(), route);
        log.debug("Simulated route {} created", route.pathPrefix());
    }

    @Override
    public void updateRoute(GatewayRoute route) {
        check(route.agentId());
        routes.put(route.agentId(), route);
        log.debug("Simulated route {} updated", route.pathPrefix());
    }

    @Override
    public void deleteRoute(String agentId) {
        check(agentId);
        routes.remove(agentId);
    }

    /** Mutations of the agent's route fail until cleared */
    public void failOperationsFor(String agentId) {
        failing.add(agentId);
    }

    public void clearFailures() {
        failing.clear();
    }

    /** Add a route directly, bypassing fault injection */
    public void seed(GatewayRoute route) {
        routes.put(route.agentId(), route);
    }

    public Map<String, GatewayRoute> routes() {
        return Map.copyOf(routes);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    private void check(String agentId) {
        checkAvailable();
        if (failing.contains(agentId)) {
            throw new PlatformException("gateway rejected change to route of " + agentId + " (simulated)");
        }
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new TransientPlatformException("gateway admin unreachable (simulated)");
        }
    }
}
