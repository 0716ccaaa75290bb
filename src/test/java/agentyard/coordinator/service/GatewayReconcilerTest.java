package agentyard.coordinator.service;

import agentyard.coordinator.MutableClock;
import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.GatewayRoute;
import agentyard.coordinator.model.PortSource;
import agentyard.coordinator.model.ReconcileReport;
import agentyard.coordinator.store.Database;
import agentyard.coordinator.store.JdbcBackendRepository;
import agentyard.coordinator.store.JdbcDeploymentRepository;
import agentyard.platform.WorkloadSpec;
import agentyard.platform.simulated.SimulatedContainerScheduler;
import agentyard.platform.simulated.SimulatedGatewayAdmin;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Convergence of gateway routes with discovered backends.
 */
class GatewayReconcilerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private static Database db;
    private static JdbcBackendRepository backends;
    private static JdbcDeploymentRepository deployments;
    private static CoordinatorConfig config;

    private MutableClock clock;
    private SimulatedContainerScheduler scheduler;
    private SimulatedGatewayAdmin gateway;
    private GatewayReconciler reconciler;

    @BeforeAll
    static void setup() {
        config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reconcile;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withReconcileInterval(INTERVAL)
                .withRouteGraceWindow(INTERVAL)
                .withReservedRoutes(Set.of("admin"));
        db = new Database(config);
        backends = new JdbcBackendRepository(db);
        deployments = new JdbcDeploymentRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM discovered_backends");
            st.execute("DELETE FROM deployments");
            conn.commit();
        }
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        scheduler = new SimulatedContainerScheduler(clock);
        gateway = new SimulatedGatewayAdmin();
        reconciler = new GatewayReconciler(scheduler, gateway, backends, deployments, config, clock);
    }

    @AfterEach
    void stopReconciler() {
        reconciler.close();
    }

    private void run(String workloadName, String agentId, int port) {
        scheduler.apply(new WorkloadSpec(workloadName, agentId, "registry.test:5000/" + agentId + ":v1", port,
                Map.of(WorkloadSpec.AGENT_ID_LABEL, agentId), Map.of()));
    }

    @Test
    @DisplayName("Routes are created for every running agent")
    void createsRoutesForDiscoveredBackends() {
        run("agent-echo-1", "echo", 5000);
        run("agent-summarizer-1", "summarizer", 9001);

        ReconcileReport report = reconciler.reconcile();

        assertEquals(2, report.discovered());
        assertEquals(2, report.created());
        assertTrue(report.converged());

        GatewayRoute echo = gateway.routes().get("echo");
        assertEquals("/agents/echo", echo.pathPrefix());
        assertEquals("agent-echo-1.sim.local", echo.backendHost());
        assertEquals(5000, echo.backendPort());
        assertEquals(9001, gateway.routes().get("summarizer").backendPort());
        assertEquals(2, backends.findAll().size());
        assertSame(report, reconciler.lastReport());
    }

    @Test
    void repeatedTicksAreNoOps() {
        run("agent-echo-1", "echo", 5000);
        reconciler.reconcile();
        clock.advance(INTERVAL);

        ReconcileReport second = reconciler.reconcile();

        assertEquals(0, second.created());
        assertEquals(0, second.updated());
        assertEquals(0, second.deleted());
        assertTrue(second.converged());
    }

    @Test
    @DisplayName("Newer workload of the same agent takes over the route")
    void routeFollowsNewestWorkload() {
        run("agent-echo-1", "echo", 5000);
        reconciler.reconcile();

        clock.advance(Duration.ofSeconds(10));
        run("agent-echo-2", "echo", 5000);
        ReconcileReport overlap = reconciler.reconcile();

        assertEquals(1, overlap.updated());
        assertEquals("agent-echo-2.sim.local", gateway.routes().get("echo").backendHost());

        scheduler.kill("agent-echo-1");
        clock.advance(INTERVAL);
        ReconcileReport after = reconciler.reconcile();
        assertEquals(0, after.updated());
        assertEquals(0, after.deleted());
        assertEquals("agent-echo-2.sim.local", gateway.routes().get("echo").backendHost());
    }

    @Test
    @DisplayName("Route of a vanished agent is removed within two intervals")
    void vanishedBackendIsRemovedWithinTwoIntervals() {
        run("agent-echo-1", "echo", 5000);
        reconciler.reconcile();
        assertTrue(gateway.routes().containsKey("echo"));

        scheduler.kill("agent-echo-1");

        int ticks = 0;
        while (gateway.routes().containsKey("echo") && ticks < 2) {
            clock.advance(INTERVAL);
            reconciler.reconcile();
            ticks++;
        }

        assertFalse(gateway.routes().containsKey("echo"), "route still present after " + ticks + " ticks");
        assertTrue(backends.findByAgentId("echo").isEmpty(), "stale snapshot pruned");
    }

    @Test
    void routeIsRetainedWithinGraceWindow() {
        run("agent-echo-1", "echo", 5000);
        reconciler.reconcile();
        scheduler.kill("agent-echo-1");

        clock.advance(Duration.ofSeconds(10));
        ReconcileReport report = reconciler.reconcile();

        assertEquals(1, report.retained());
        assertEquals(0, report.deleted());
        assertTrue(gateway.routes().containsKey("echo"));
    }

    @Test
    void orphanRouteWithoutHistoryIsDeleted() {
        gateway.seed(new GatewayRoute("ghost", "/agents/ghost", "ghost.sim.local", 5000));

        ReconcileReport report = reconciler.reconcile();

        assertEquals(1, report.deleted());
        assertFalse(gateway.routes().containsKey("ghost"));
    }

    @Test
    @DisplayName("Reserved routes are never touched")
    void reservedRoutesAreLeftAlone() {
        GatewayRoute admin = new GatewayRoute("admin", "/agents/admin", "admin.internal", 80);
        gateway.seed(admin);
        run("agent-admin-1", "admin", 5000);

        ReconcileReport report = reconciler.reconcile();
        clock.advance(Duration.ofHours(1));
        scheduler.kill("agent-admin-1");
        reconciler.reconcile();

        assertEquals(0, report.created() + report.updated() + report.deleted());
        assertEquals(admin, gateway.routes().get("admin"));
    }

    @Test
    @DisplayName("A failing route operation does not stop the others")
    void partialFailureIsCounted() {
        run("agent-echo-1", "echo", 5000);
        run("agent-summarizer-1", "summarizer", 9001);
        gateway.failOperationsFor("echo");

        ReconcileReport report = reconciler.reconcile();

        assertEquals(1, report.created());
        assertEquals(1, report.failed());
        assertFalse(report.converged());
        assertTrue(gateway.routes().containsKey("summarizer"));
        assertFalse(gateway.routes().containsKey("echo"));

        gateway.clearFailures();
        clock.advance(INTERVAL);
        ReconcileReport retry = reconciler.reconcile();
        assertEquals(1, retry.created());
        assertTrue(retry.converged());
    }

    @Test
    @DisplayName("Discovery failure leaves all routes untouched")
    void discoveryFailureSkipsTick() {
        gateway.seed(new GatewayRoute("echo", "/agents/echo", "agent-echo-1.sim.local", 5000));
        scheduler.setListingUnavailable(true);

        ReconcileReport report = reconciler.reconcile();

        assertTrue(report.skipped());
        assertTrue(report.abortReason().startsWith("discovery failed"));
        assertTrue(gateway.routes().containsKey("echo"));
    }

    @Test
    void gatewayOutageSkipsTick() {
        run("agent-echo-1", "echo", 5000);
        gateway.setUnavailable(true);

        ReconcileReport report = reconciler.reconcile();

        assertTrue(report.skipped());
        assertTrue(report.abortReason().startsWith("route listing failed"));
        assertEquals(1, backends.findAll().size(), "snapshot still recorded");
    }

    @Test
    void supersededDeploymentIsRetiredOnceWorkloadIsGone() {
        Instant t0 = clock.instant();
        deployments.save(deployment("d1", "agent-echo-old", t0.minusSeconds(60)));
        deployments.save(deployment("d2", "agent-echo-new", t0));
        deployments.supersedeRunning("echo", "d2", t0);
        run("agent-echo-old", "echo", 5000);
        run("agent-echo-new", "echo", 5000);

        assertEquals(0, reconciler.reconcile().retired());

        scheduler.remove("agent-echo-old");
        clock.advance(INTERVAL);
        ReconcileReport report = reconciler.reconcile();

        assertEquals(1, report.retired());
        assertNotNull(deployments.findById("d1").orElseThrow().retiredAt());
        assertNull(deployments.findById("d2").orElseThrow().retiredAt());
    }

    @Test
    void scheduledLoopRecordsReports() throws Exception {
        run("agent-echo-1", "echo", 5000);

        reconciler.start();
        assertTrue(reconciler.isRunning());

        long deadline = System.currentTimeMillis() + 5000;
        while (reconciler.lastReport() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        reconciler.stop();

        assertFalse(reconciler.isRunning());
        assertNotNull(reconciler.lastReport());
        assertTrue(gateway.routes().containsKey("echo"));
    }

    private static DeploymentRecord deployment(String id, String workloadName, Instant at) {
        return DeploymentRecord.builder()
                .id(id)
                .agentId("echo")
                .imageReference("registry.test:5000/echo:" + id)
                .resolvedPort(5000)
                .portSource(PortSource.DEFAULT)
                .workloadName(workloadName)
                .serviceEndpoint(workloadName + ".sim.local:5000")
                .status(DeploymentStatus.RUNNING)
                .createdAt(at)
                .updatedAt(at)
                .completedAt(at)
                .build();
    }
}
