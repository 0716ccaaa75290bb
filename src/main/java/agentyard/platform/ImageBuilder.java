package agentyard.platform;

/**
 * Builds container images from a source reference and pushes them to the
 * target registry.
 */
public interface ImageBuilder {

    /**
     * Submit a build.
     *
     * @throws TransientPlatformException when the backend is unreachable
     * @throws PlatformException          when the backend rejects the request
     */
    BuildHandle submit(BuildRequest request);

    /**
     * Current progress of a submitted build.
     *
     * @throws TransientPlatformException when the backend is unreachable
     */
    BuildProgress status(BuildHandle handle);
}
