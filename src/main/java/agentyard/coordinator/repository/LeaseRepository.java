package agentyard.coordinator.repository;

import agentyard.coordinator.model.AgentLease;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Advisory per-agent leases. A lease is held by exactly one holder until it is
 * released or its {@code expiresAt} passes.
 */
public interface LeaseRepository {

    /**
     * Take the lease if it is free, expired, or already held by the holder.
     *
     * @return true if the holder now owns the lease
     */
    boolean tryAcquire(String agentId, String holder, Instant now, Duration ttl);

    /**
     * Push the expiry forward.
     *
     * @return false if the holder no longer owns the lease
     */
    boolean renew(String agentId, String holder, Instant now, Duration ttl);

    boolean release(String agentId, String holder);

    Optional<AgentLease> findByAgentId(String agentId);
}
