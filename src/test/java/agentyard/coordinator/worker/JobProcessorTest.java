package agentyard.coordinator.worker;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.Agent;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.BuildStatus;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobKind;
import agentyard.coordinator.model.JobStatus;
import agentyard.coordinator.service.ActiveRecordGuard;
import agentyard.coordinator.service.AgentLockService;
import agentyard.coordinator.service.AgentLockService.AgentLock;
import agentyard.coordinator.service.BuildCoordinator;
import agentyard.coordinator.service.DeploymentManager;
import agentyard.coordinator.service.JobQueueService;
import agentyard.coordinator.service.PortResolver;
import agentyard.coordinator.store.Database;
import agentyard.coordinator.store.JdbcAgentRepository;
import agentyard.coordinator.store.JdbcBuildRepository;
import agentyard.coordinator.store.JdbcDeploymentRepository;
import agentyard.coordinator.store.JdbcJobRepository;
import agentyard.coordinator.store.JdbcLeaseRepository;
import agentyard.coordinator.worker.JobProcessor.Outcome;
import agentyard.platform.simulated.SimulatedContainerScheduler;
import agentyard.platform.simulated.SimulatedImageBuilder;
import agentyard.platform.simulated.SimulatedImageRegistry;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Job outcomes: ack, fail, retry and deferral.
 */
class JobProcessorTest {

    private static final String SOURCE = "git@example.org:agents/echo.git#main";
    private static final String CONSUMER = "worker-test-0";

    private static Database db;
    private static CoordinatorConfig config;
    private static JdbcAgentRepository agents;
    private static JdbcBuildRepository builds;
    private static JdbcDeploymentRepository deployments;
    private static JdbcJobRepository jobs;
    private static JobQueueService queue;
    private static AgentLockService locks;

    private SimulatedImageBuilder builder;
    private SimulatedContainerScheduler scheduler;
    private JobProcessor processor;

    @BeforeAll
    static void setup() {
        config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-processor;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withMaxAttempts(3)
                .withRetryDelays(Duration.ofSeconds(1), Duration.ofSeconds(1))
                .withClaimPollInterval(Duration.ofMillis(10))
                .withLockWaitTimeout(Duration.ofMillis(50))
                .withLockPollInterval(Duration.ofMillis(10))
                .withLockRetryDelay(Duration.ofSeconds(1))
                .withBuildPolling(Duration.ofMillis(5), Duration.ofMillis(20))
                .withDeployPolling(Duration.ofMillis(5), Duration.ofMillis(20))
                .withHealthCheckTimeout(Duration.ofSeconds(1));
        db = new Database(config);
        agents = new JdbcAgentRepository(db);
        builds = new JdbcBuildRepository(db);
        deployments = new JdbcDeploymentRepository(db);
        jobs = new JdbcJobRepository(db);
        queue = new JobQueueService(jobs, config, Clock.systemUTC());
        locks = new AgentLockService(new JdbcLeaseRepository(db), config, Clock.systemUTC());
    }

    @AfterAll
    static void teardown() {
        locks.close();
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            st.execute("DELETE FROM builds");
            st.execute("DELETE FROM deployments");
            st.execute("DELETE FROM agents");
            st.execute("DELETE FROM agent_leases");
            conn.commit();
        }
        agents.upsert(new Agent("echo", "Echo", null, null, null, null));

        SimulatedImageRegistry registry = new SimulatedImageRegistry();
        builder = new SimulatedImageBuilder(registry, 1);
        scheduler = new SimulatedContainerScheduler(Clock.systemUTC());
        BuildCoordinator buildCoordinator = new BuildCoordinator(builds, agents, builder, registry, config,
                Clock.systemUTC());
        DeploymentManager deploymentManager = new DeploymentManager(deployments, builds, agents, scheduler,
                new PortResolver(agents, 5000), config, Clock.systemUTC());
        ActiveRecordGuard recordGuard = new ActiveRecordGuard(jobs, builds, deployments, buildCoordinator,
                deploymentManager);
        processor = new JobProcessor(queue, agents, deployments, locks, buildCoordinator, deploymentManager,
                recordGuard, config);
    }

    private Job claim(String jobId, String agentId, JobKind kind, String payload) throws InterruptedException {
        queue.enqueue(jobId, agentId, kind, payload);
        return queue.claim(CONSUMER, Duration.ofSeconds(1)).orElseThrow();
    }

    private JobStatus statusOf(String jobId) {
        return queue.findById(jobId).orElseThrow().status();
    }

    private void makeVisible(String jobId) throws Exception {
        execute("UPDATE jobs SET visible_at = CURRENT_TIMESTAMP - INTERVAL '1' HOUR WHERE id = '" + jobId + "'");
    }

    private void postpone(String jobId) throws Exception {
        execute("UPDATE jobs SET visible_at = CURRENT_TIMESTAMP + INTERVAL '1' HOUR WHERE id = '" + jobId + "'");
    }

    private void execute(String sql) throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute(sql);
            conn.commit();
        }
    }

    @Test
    @DisplayName("Build job deploys the new image and acks")
    void buildThenDeploy() throws Exception {
        Job job = claim("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}");

        assertEquals(Outcome.ACKED, processor.process(job, CONSUMER));

        assertEquals(JobStatus.DONE, statusOf("job-1"));
        assertEquals(BuildStatus.SUCCEEDED, builds.findByJobId("job-1").orElseThrow().status());
        assertEquals(DeploymentStatus.RUNNING, deployments.findByJobId("job-1").orElseThrow().status());
        Optional<AgentLock> free = locks.acquire("echo", "someone-else", Duration.ZERO);
        assertTrue(free.isPresent(), "lease released");
        free.get().close();
    }

    @Test
    void buildWithoutDeployStopsAfterBuild() throws Exception {
        Job job = claim("job-1", "echo", JobKind.BUILD,
                "{\"sourceRef\":\"" + SOURCE + "\",\"deployAfterBuild\":false}");

        assertEquals(Outcome.ACKED, processor.process(job, CONSUMER));
        assertTrue(deployments.findByAgentId("echo", 10).isEmpty());
    }

    @Test
    @DisplayName("Failed build fails the job and creates no deployment")
    void failedBuildFailsJob() throws Exception {
        builder.failBuildsFor(SOURCE, "unauthorized: authentication required");
        Job job = claim("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}");

        assertEquals(Outcome.FAILED, processor.process(job, CONSUMER));

        Job failed = queue.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertTrue(failed.errorMessage().contains("unauthorized"), failed.errorMessage());
        assertTrue(deployments.findByAgentId("echo", 10).isEmpty());
    }

    @Test
    void unregisteredAgentFailsJob() throws Exception {
        Job job = claim("job-1", "ghost", JobKind.DEPLOY, "{}");

        assertEquals(Outcome.FAILED, processor.process(job, CONSUMER));
        assertEquals("agent ghost is not registered", queue.findById("job-1").orElseThrow().errorMessage());
    }

    @Test
    void malformedPayloadFailsJob() throws Exception {
        Job job = claim("job-1", "echo", JobKind.BUILD, "{\"deployAfterBuild\":true}");

        assertEquals(Outcome.FAILED, processor.process(job, CONSUMER));
        assertEquals(JobStatus.FAILED, statusOf("job-1"));
    }

    @Test
    void deployWithoutBuildFailsJob() throws Exception {
        Job job = claim("job-1", "echo", JobKind.DEPLOY, "{}");

        assertEquals(Outcome.FAILED, processor.process(job, CONSUMER));
        assertTrue(queue.findById("job-1").orElseThrow().errorMessage().contains("no successful build"));
    }

    @Test
    @DisplayName("Unreachable builder schedules a retry")
    void transientFailureRetries() throws Exception {
        builder.setUnavailable(true);
        Job job = claim("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}");

        assertEquals(Outcome.RETRIED, processor.process(job, CONSUMER));

        Job retried = queue.findById("job-1").orElseThrow();
        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals(1, retried.attempts());
        assertTrue(retried.visibleAt().isAfter(retried.enqueuedAt()));
        assertEquals(BuildStatus.QUEUED, builds.findByJobId("job-1").orElseThrow().status());
    }

    @Test
    void transientFailureOnLastAttemptDeadLetters() throws Exception {
        builder.setUnavailable(true);
        queue.enqueue("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}");

        Outcome outcome = null;
        for (int attempt = 0; attempt < config.defaultMaxAttempts(); attempt++) {
            makeVisible("job-1");
            Job job = queue.claim(CONSUMER, Duration.ofSeconds(1)).orElseThrow();
            outcome = processor.process(job, CONSUMER);
        }

        assertEquals(Outcome.DEAD_LETTERED, outcome);
        assertEquals(JobStatus.DEAD_LETTERED, statusOf("job-1"));

        BuildRecord build = builds.findByJobId("job-1").orElseThrow();
        assertEquals(BuildStatus.FAILED, build.status());
        assertTrue(build.errorDetail().startsWith("job dead-lettered: "), build.errorDetail());
        assertNotNull(build.completedAt());
        assertTrue(builds.findActive("echo").isEmpty());
    }

    @Test
    @DisplayName("A second build waits while the first job's build is awaiting retry")
    void secondBuildWaitsForRetryingBuild() throws Exception {
        builder.setUnavailable(true);
        assertEquals(Outcome.RETRIED, processor.process(
                claim("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}"), CONSUMER));
        builder.setUnavailable(false);
        postpone("job-1");

        Outcome second = processor.process(
                claim("job-2", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\",\"force\":true}"),
                CONSUMER);

        assertEquals(Outcome.DEFERRED, second);
        Job deferred = queue.findById("job-2").orElseThrow();
        assertEquals(JobStatus.PENDING, deferred.status());
        assertEquals(0, deferred.attempts());
        assertTrue(builds.findByJobId("job-2").isEmpty());
        List<BuildRecord> active = builds.findActive("echo");
        assertEquals(1, active.size());
        assertEquals("job-1", active.get(0).jobId());
    }

    @Test
    void waitingBuildRunsOnceFirstJobIsDeadLettered() throws Exception {
        builder.setUnavailable(true);
        queue.enqueue("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}");
        for (int attempt = 0; attempt < config.defaultMaxAttempts(); attempt++) {
            makeVisible("job-1");
            processor.process(queue.claim(CONSUMER, Duration.ofSeconds(1)).orElseThrow(), CONSUMER);
        }
        builder.setUnavailable(false);

        Outcome second = processor.process(
                claim("job-2", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}"), CONSUMER);

        assertEquals(Outcome.ACKED, second);
        assertEquals(BuildStatus.FAILED, builds.findByJobId("job-1").orElseThrow().status());
        assertEquals(BuildStatus.SUCCEEDED, builds.findByJobId("job-2").orElseThrow().status());
        assertTrue(builds.findActive("echo").isEmpty());
        assertTrue(deployments.findActive("echo").isEmpty());
    }

    @Test
    @DisplayName("Unfinished build of a job that already ended is failed before the next job runs")
    void orphanedBuildIsClosedByNextJob() throws Exception {
        builder.setUnavailable(true);
        processor.process(claim("job-1", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}"), CONSUMER);
        builder.setUnavailable(false);
        execute("UPDATE jobs SET status = 'FAILED' WHERE id = 'job-1'");

        assertEquals(Outcome.ACKED, processor.process(
                claim("job-2", "echo", JobKind.BUILD, "{\"sourceRef\":\"" + SOURCE + "\"}"), CONSUMER));

        BuildRecord orphan = builds.findByJobId("job-1").orElseThrow();
        assertEquals(BuildStatus.FAILED, orphan.status());
        assertEquals("job job-1 ended as FAILED before its record finished", orphan.errorDetail());
        assertTrue(builds.findActive("echo").isEmpty());
    }

    @Test
    void secondDeployWaitsForRetryingDeployment() throws Exception {
        processor.process(claim("job-build", "echo", JobKind.BUILD,
                "{\"sourceRef\":\"" + SOURCE + "\",\"deployAfterBuild\":false}"), CONSUMER);
        scheduler.setUnavailable(true);
        assertEquals(Outcome.RETRIED, processor.process(claim("job-d1", "echo", JobKind.DEPLOY, "{}"), CONSUMER));
        scheduler.setUnavailable(false);
        postpone("job-d1");

        assertEquals(Outcome.DEFERRED, processor.process(claim("job-d2", "echo", JobKind.DEPLOY, "{}"), CONSUMER));

        List<DeploymentRecord> active = deployments.findActive("echo");
        assertEquals(1, active.size());
        assertEquals("job-d1", active.get(0).jobId());
        assertEquals(DeploymentStatus.QUEUED, active.get(0).status());
        assertTrue(deployments.findByJobId("job-d2").isEmpty());
    }

    @Test
    @DisplayName("Busy agent defers the job without using an attempt")
    void busyAgentDefers() throws Exception {
        Job job = claim("job-1", "echo", JobKind.DEPLOY, "{}");

        try (AgentLock held = locks.acquire("echo", "worker-other", Duration.ZERO).orElseThrow()) {
            assertEquals(Outcome.DEFERRED, processor.process(job, CONSUMER));
        }

        Job deferred = queue.findById("job-1").orElseThrow();
        assertEquals(JobStatus.PENDING, deferred.status());
        assertEquals(0, deferred.attempts());
    }

    @Test
    void unchangedSourceDoesNotRedeploy() throws Exception {
        String payload = "{\"sourceRef\":\"" + SOURCE + "\"}";
        processor.process(claim("job-1", "echo", JobKind.BUILD, payload), CONSUMER);
        int applies = scheduler.applyCount();

        assertEquals(Outcome.ACKED, processor.process(claim("job-2", "echo", JobKind.BUILD, payload), CONSUMER));

        assertEquals(applies, scheduler.applyCount());
        assertEquals(1, deployments.findByAgentId("echo", 10).size());
        assertEquals(1, builder.submissionCount());
    }

    @Test
    void failedRolloutFailsDeployJob() throws Exception {
        processor.process(claim("job-1", "echo", JobKind.BUILD,
                "{\"sourceRef\":\"" + SOURCE + "\",\"deployAfterBuild\":false}"), CONSUMER);
        String image = builds.findByJobId("job-1").orElseThrow().imageReference();
        scheduler.neverReadyFor(image);

        assertEquals(Outcome.FAILED, processor.process(claim("job-2", "echo", JobKind.DEPLOY, "{}"), CONSUMER));
        assertTrue(queue.findById("job-2").orElseThrow().errorMessage().contains("health check did not pass"));
    }
}
