package agentyard.coordinator.model;

/**
 * Listen port chosen for a deployment and where it came from.
 */
public record ResolvedPort(int port, PortSource source) {
}
