package agentyard.platform;

/**
 * The set of collaborators the coordinator runs against.
 */
public record Platform(
        ImageBuilder imageBuilder,
        ImageRegistry imageRegistry,
        ContainerScheduler containerScheduler,
        GatewayAdmin gatewayAdmin) {
}
