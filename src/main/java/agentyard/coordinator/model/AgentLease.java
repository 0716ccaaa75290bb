package agentyard.coordinator.model;

import java.time.Instant;

/**
 * Advisory per-agent lock row.
 */
public record AgentLease(
        String agentId,
        String holder,
        Instant acquiredAt,
        Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }
}
