package agentyard.platform;

import agentyard.coordinator.model.GatewayRoute;

import java.util.List;

/**
 * Admin API of the API gateway. All mutations are idempotent.
 */
public interface GatewayAdmin {

    List<GatewayRoute> listRoutes();

    void createRoute(GatewayRoute route);

    void updateRoute(GatewayRoute route);

    void deleteRoute(String agentId);
}
