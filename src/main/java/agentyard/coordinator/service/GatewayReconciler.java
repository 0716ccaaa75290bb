package agentyard.coordinator.service;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DiscoveredBackend;
import agentyard.coordinator.model.GatewayRoute;
import agentyard.coordinator.model.ReconcileReport;
import agentyard.coordinator.repository.BackendRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import agentyard.platform.ContainerScheduler;
import agentyard.platform.GatewayAdmin;
import agentyard.platform.RunningWorkload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps gateway routes in line with the workloads the container scheduler
 * reports as running.
 *
 * <p>
 * Each tick discovers backends, persists the snapshot and diffs it against
 * the gateway's routes. Route operations are independent: a failed one is
 * counted and retried on the next tick. A route whose backend vanished is
 * kept until the backend has been unseen for the grace window, so a backend
 * missing from one listing does not drop traffic.
 */
public class GatewayReconciler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayReconciler.class);

    private final ContainerScheduler scheduler;
    private final GatewayAdmin gateway;
    private final BackendRepository backendRepository;
    private final DeploymentRepository deploymentRepository;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private volatile boolean running = false;
    private volatile ReconcileReport lastReport;

    public GatewayReconciler(ContainerScheduler scheduler, GatewayAdmin gateway,
            BackendRepository backendRepository, DeploymentRepository deploymentRepository,
            CoordinatorConfig config, Clock clock) {
        this.scheduler = scheduler;
        this.gateway = gateway;
        this.backendRepository = backendRepository;
        this.deploymentRepository = deploymentRepository;
        this.config = config;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentyard-reconciler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running) {
            log.warn("Reconciler already running");
            return;
        }
        running = true;

        long intervalMs = config.reconcileInterval().toMillis();
        executor.scheduleAtFixedRate(() -> {
            try {
                reconcile();
            } catch (Exception e) {
                log.error("Reconciler tick error", e);
            }
        }, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Reconciler scheduled every {}ms (grace window {}s, reserved {})",
                intervalMs, config.routeGraceWindow().toSeconds(), config.reservedRoutes());
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Reconciler forcefully stopped");
            } else {
                log.info("Reconciler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return report of the last completed or skipped tick, null before the
     *         first one
     */
    public ReconcileReport lastReport() {
        return lastReport;
    }

    /**
     * Run one tick. Returns a skipped report if another tick is in progress.
     */
    public ReconcileReport reconcile() {
        Instant now = clock.instant();
        if (!inProgress.compareAndSet(false, true)) {
            log.debug("Previous reconcile tick still running, skipping");
            return ReconcileReport.skipped(now, "previous tick still running");
        }
        try {
            ReconcileReport report = tick(now);
            lastReport = report;
            return report;
        } finally {
            inProgress.set(false);
        }
    }

    private ReconcileReport tick(Instant now) {
        List<RunningWorkload> workloads;
        try {
            workloads = scheduler.listRunning();
        } catch (RuntimeException e) {
            log.warn("Backend discovery failed, leaving routes untouched: {}", e.getMessage());
            return ReconcileReport.skipped(now, "discovery failed: " + e.getMessage());
        }

        Map<String, DiscoveredBackend> discovered = collapse(workloads, now);
        Map<String, DiscoveredBackend> snapshot;
        try {
            backendRepository.upsertAll(discovered.values());
            snapshot = new HashMap<>();
            for (DiscoveredBackend b : backendRepository.findAll()) {
                snapshot.put(b.agentId(), b);
            }
        } catch (RuntimeException e) {
            log.warn("Could not persist backend snapshot, leaving routes untouched: {}", e.getMessage());
            return ReconcileReport.skipped(now, "snapshot failed: " + e.getMessage());
        }

        List<GatewayRoute> routes;
        try {
            routes = gateway.listRoutes();
        } catch (RuntimeException e) {
            log.warn("Could not list gateway routes: {}", e.getMessage());
            return ReconcileReport.skipped(now, "route listing failed: " + e.getMessage());
        }

        Set<String> reserved = config.reservedRoutes();
        Duration grace = config.routeGraceWindow();
        int created = 0;
        int updated = 0;
        int deleted = 0;
        int retained = 0;
        int failed = 0;

        Map<String, GatewayRoute> routesByAgent = new LinkedHashMap<>();
        for (GatewayRoute route : routes) {
            routesByAgent.put(route.agentId(), route);
        }

        for (DiscoveredBackend backend : discovered.values()) {
            if (reserved.contains(backend.agentId())) {
                continue;
            }
            GatewayRoute existing = routesByAgent.get(backend.agentId());
            GatewayRoute desired = GatewayRoute.forBackend(backend);
            try {
                if (existing == null) {
                    gateway.createRoute(desired);
                    created++;
                    log.info("Created route {} -> {}:{}", desired.pathPrefix(), backend.host(), backend.port());
                } else if (!existing.pointsTo(backend)) {
                    gateway.updateRoute(desired);
                    updated++;
                    log.info("Updated route {} -> {}:{} (was {}:{})", desired.pathPrefix(), backend.host(),
                            backend.port(), existing.backendHost(), existing.backendPort());
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Route sync for agent {} failed: {}", backend.agentId(), e.getMessage());
            }
        }

        for (GatewayRoute route : routesByAgent.values()) {
            String agentId = route.agentId();
            if (reserved.contains(agentId) || discovered.containsKey(agentId)) {
                continue;
            }
            DiscoveredBackend lastSeen = snapshot.get(agentId);
            if (lastSeen != null && lastSeen.lastSeenAt().plus(grace).isAfter(now)) {
                retained++;
                log.debug("Retaining route of agent {} within grace window (last seen {})",
                        agentId, lastSeen.lastSeenAt());
                continue;
            }
            try {
                gateway.deleteRoute(agentId);
                deleted++;
                log.info("Deleted route {} (backend gone since {})", route.pathPrefix(),
                        lastSeen != null ? lastSeen.lastSeenAt() : "never seen");
            } catch (RuntimeException e) {
                failed++;
                log.warn("Route delete for agent {} failed: {}", agentId, e.getMessage());
            }
        }

        pruneSnapshot(snapshot, discovered, now, grace);
        int retired = retireSuperseded(workloads, now);

        ReconcileReport report = new ReconcileReport(now, discovered.size(), created, updated, deleted,
                retained, failed, retired, false, null);
        if (created + updated + deleted + failed + retired > 0) {
            log.info("Reconcile: {} discovered, {} created, {} updated, {} deleted, {} retained, {} failed, {} retired",
                    report.discovered(), created, updated, deleted, retained, failed, retired);
        }
        return report;
    }

    /**
     * One backend per agent; the most recently started workload wins.
     */
    private Map<String, DiscoveredBackend> collapse(List<RunningWorkload> workloads, Instant now) {
        Map<String, RunningWorkload> newest = new LinkedHashMap<>();
        for (RunningWorkload w : workloads) {
            String agentId = w.agentId();
            if (agentId == null || agentId.isBlank()) {
                continue;
            }
            RunningWorkload current = newest.get(agentId);
            if (current == null || isNewer(w, current)) {
                newest.put(agentId, w);
            }
        }

        Map<String, DiscoveredBackend> backends = new LinkedHashMap<>();
        newest.forEach((agentId, w) -> backends.put(agentId,
                new DiscoveredBackend(agentId, w.host(), w.port(), w.name(), now)));
        return backends;
    }

    private static boolean isNewer(RunningWorkload candidate, RunningWorkload current) {
        if (candidate.startedAt() == null) {
            return false;
        }
        return current.startedAt() == null || candidate.startedAt().isAfter(current.startedAt());
    }

    private void pruneSnapshot(Map<String, DiscoveredBackend> snapshot, Map<String, DiscoveredBackend> discovered,
            Instant now, Duration grace) {
        for (DiscoveredBackend b : snapshot.values()) {
            if (discovered.containsKey(b.agentId()) || b.lastSeenAt().plus(grace).isAfter(now)) {
                continue;
            }
            try {
                backendRepository.delete(b.agentId());
            } catch (RuntimeException e) {
                log.warn("Could not drop stale backend snapshot of agent {}: {}", b.agentId(), e.getMessage());
            }
        }
    }

    private int retireSuperseded(List<RunningWorkload> workloads, Instant now) {
        Set<String> live = new HashSet<>();
        for (RunningWorkload w : workloads) {
            live.add(w.name());
        }

        int retired = 0;
        try {
            for (DeploymentRecord d : deploymentRepository.findSupersededNotRetired()) {
                if (!live.contains(d.workloadName()) && deploymentRepository.markRetired(d.id(), now)) {
                    retired++;
                    log.info("Deployment {} of agent {} retired, workload {} gone",
                            d.id(), d.agentId(), d.workloadName());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Could not retire superseded deployments: {}", e.getMessage());
        }
        return retired;
    }
}
