package agentyard.platform;

/**
 * Opaque identifier of a build submitted to the backend.
 */
public record BuildHandle(String id) {

    @Override
    public String toString() {
        return id;
    }
}
