package agentyard.coordinator.store;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.DeploymentRecord;
import agentyard.coordinator.model.DeploymentStatus;
import agentyard.coordinator.model.PortSource;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeploymentRepositoryTest {

    private static Database db;
    private static JdbcDeploymentRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(
                        "jdbc:h2:mem:test-deployments;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcDeploymentRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanDeployments() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM deployments");
            conn.commit();
        }
    }

    private static DeploymentRecord running(String id, Instant at) {
        return DeploymentRecord.builder()
                .id(id)
                .jobId("job-" + id)
                .agentId("echo")
                .buildId("build-1")
                .imageReference("registry.local:5000/echo:v1")
                .resolvedPort(5000)
                .portSource(PortSource.DEFAULT)
                .workloadName("agent-echo-" + at.getEpochSecond() + "-" + id)
                .status(DeploymentStatus.RUNNING)
                .createdAt(at)
                .updatedAt(at)
                .completedAt(at)
                .build();
    }

    @Test
    void supersedeLeavesExactlyOneCurrentDeployment() {
        Instant t0 = Instant.now().minusSeconds(60);
        repo.save(running("d1", t0));
        repo.save(running("d2", t0.plusSeconds(30)));

        List<DeploymentRecord> superseded = repo.supersedeRunning("echo", "d2", t0.plusSeconds(30));

        assertEquals(1, superseded.size());
        assertEquals("d1", superseded.get(0).id());
        assertEquals("d2", repo.findCurrent("echo").orElseThrow().id());
        assertEquals("d2", repo.findById("d1").orElseThrow().supersededBy());
        assertFalse(repo.findById("d1").orElseThrow().isCurrent());
    }

    @Test
    void supersedeIsIdempotent() {
        Instant t0 = Instant.now().minusSeconds(60);
        repo.save(running("d1", t0));
        repo.save(running("d2", t0.plusSeconds(30)));

        repo.supersedeRunning("echo", "d2", t0.plusSeconds(30));
        assertTrue(repo.supersedeRunning("echo", "d2", t0.plusSeconds(31)).isEmpty());
    }

    @Test
    void retirementIsRecordedOnce() {
        Instant t0 = Instant.now().minusSeconds(60);
        repo.save(running("d1", t0));
        repo.save(running("d2", t0.plusSeconds(30)));
        repo.supersedeRunning("echo", "d2", t0.plusSeconds(30));

        assertEquals(1, repo.findSupersededNotRetired().size());
        assertTrue(repo.markRetired("d1", t0.plusSeconds(40)));
        assertFalse(repo.markRetired("d1", t0.plusSeconds(50)));
        assertTrue(repo.findSupersededNotRetired().isEmpty());
        assertNotNull(repo.findById("d1").orElseThrow().retiredAt());
    }

    @Test
    void updatePersistsStatusTransitions() {
        Instant t0 = Instant.now();
        DeploymentRecord queued = running("d1", t0).toBuilder()
                .status(DeploymentStatus.QUEUED)
                .completedAt(null)
                .build();
        repo.save(queued);
        assertEquals(1, repo.findActive("echo").size());

        repo.update(queued.toBuilder()
                .status(DeploymentStatus.FAILED)
                .errorDetail("health check did not pass within 180s")
                .completedAt(t0)
                .build());

        DeploymentRecord failed = repo.findByJobId("job-d1").orElseThrow();
        assertEquals(DeploymentStatus.FAILED, failed.status());
        assertEquals("health check did not pass within 180s", failed.errorDetail());
        assertTrue(repo.findActive("echo").isEmpty());
        assertTrue(repo.findCurrent("echo").isEmpty());
    }

    @Test
    void findByAgentIdIsNewestFirst() {
        Instant t0 = Instant.now().minusSeconds(60);
        repo.save(running("d1", t0));
        repo.save(running("d2", t0.plusSeconds(30)));

        assertEquals(List.of("d2", "d1"), repo.findByAgentId("echo", 10).stream().map(DeploymentRecord::id).toList());
    }
}
