package agentyard.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Registry metadata of a deployable agent.
 *
 * @param port      previously recorded listen port, may be null or invalid
 * @param sourceRef source of the last successful build
 */
public record Agent(
        String id,
        String name,
        Integer port,
        String sourceRef,
        Instant createdAt,
        Instant updatedAt) {

    public Agent {
        Objects.requireNonNull(id, "id is required");
    }

    public Agent withPort(Integer port) {
        return new Agent(id, name, port, sourceRef, createdAt, updatedAt);
    }

    public Agent withSourceRef(String sourceRef) {
        return new Agent(id, name, port, sourceRef, createdAt, updatedAt);
    }
}
