package agentyard.coordinator.service;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.repository.LeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-agent advisory lock over the lease table.
 * While a lock is held its lease is renewed every {@code leaseTtl / 3}; a holder
 * that dies simply lets the lease expire.
 */
public class AgentLockService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentLockService.class);

    private final LeaseRepository leaseRepository;
    private final Duration ttl;
    private final Duration pollInterval;
    private final Clock clock;
    private final ScheduledExecutorService renewer;

    public AgentLockService(LeaseRepository leaseRepository, CoordinatorConfig config, Clock clock) {
        this.leaseRepository = leaseRepository;
        this.ttl = config.leaseTtl();
        this.pollInterval = config.lockPollInterval();
        this.clock = clock;
        this.renewer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentyard-lease-renewer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Try to take the agent's lease, waiting up to {@code wait}.
     *
     * @return the held lock, empty if another holder kept it for the whole wait
     */
    public Optional<AgentLock> acquire(String agentId, String holder, Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();
        while (true) {
            if (leaseRepository.tryAcquire(agentId, holder, clock.instant(), ttl)) {
                log.debug("Lock on agent {} acquired by {}", agentId, holder);
                return Optional.of(new AgentLock(agentId, holder));
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.debug("Lock on agent {} busy, {} gave up", agentId, holder);
                return Optional.empty();
            }
            Thread.sleep(Math.min(pollInterval.toMillis(), Math.max(1, remaining / 1_000_000)));
        }
    }

    @Override
    public void close() {
        renewer.shutdownNow();
    }

    /**
     * A held lease. Closing it stops renewal and releases the lease.
     */
    public final class AgentLock implements AutoCloseable {
        private final String agentId;
        private final String holder;
        private volatile ScheduledFuture<?> renewal;
        private volatile boolean lost = false;

        private AgentLock(String agentId, String holder) {
            this.agentId = agentId;
            this.holder = holder;
            long periodMs = Math.max(1, ttl.toMillis() / 3);
            this.renewal = renewer.scheduleAtFixedRate(this::renew, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }

        private void renew() {
            try {
                if (!leaseRepository.renew(agentId, holder, clock.instant(), ttl)) {
                    lost = true;
                    log.warn("Lease on agent {} lost by {}", agentId, holder);
                    ScheduledFuture<?> r = renewal;
                    if (r != null) {
                        r.cancel(false);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Failed to renew lease on agent {}: {}", agentId, e.getMessage());
            }
        }

        public String agentId() {
            return agentId;
        }

        public String holder() {
            return holder;
        }

        /** True once a renewal found the lease taken over */
        public boolean isLost() {
            return lost;
        }

        @Override
        public void close() {
            renewal.cancel(false);
            if (leaseRepository.release(agentId, holder)) {
                log.debug("Lock on agent {} released by {}", agentId, holder);
            }
        }
    }
}
