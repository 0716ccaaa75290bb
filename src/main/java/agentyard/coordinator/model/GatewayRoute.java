package agentyard.coordinator.model;

/**
 * Gateway routing entry mapping {@code /agents/<agentId>} to one backend.
 */
public record GatewayRoute(
        String agentId,
        String pathPrefix,
        String backendHost,
        int backendPort) {

    public static final String PATH_PREFIX = "/agents/";

    public static GatewayRoute forBackend(DiscoveredBackend backend) {
        return new GatewayRoute(backend.agentId(), PATH_PREFIX + backend.agentId(),
                backend.host(), backend.port());
    }

    /** Same backend address, ignoring the path */
    public boolean pointsTo(DiscoveredBackend backend) {
        return backendHost != null && backendHost.equals(backend.host()) && backendPort == backend.port();
    }
}
