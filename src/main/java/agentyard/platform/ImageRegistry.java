package agentyard.platform;

/**
 * Read-only view of the container image registry.
 */
public interface ImageRegistry {

    /**
     * @param imageReference {@code host[:port]/repository:tag}
     * @return true if the manifest exists
     * @throws TransientPlatformException when the registry is unreachable
     */
    boolean exists(String imageReference);
}
