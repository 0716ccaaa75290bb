package agentyard.coordinator.store;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.BuildRecord;
import agentyard.coordinator.model.BuildStatus;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcBuildRepositoryTest {

    private static final String SOURCE = "git@example.org:agents/echo.git#main";

    private static Database db;
    private static JdbcBuildRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-build-records;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcBuildRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanBuilds() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM builds");
            conn.commit();
        }
    }

    private static BuildRecord build(String id, String agentId, BuildStatus status, Instant at) {
        return BuildRecord.builder()
                .id(id)
                .jobId("job-" + id)
                .agentId(agentId)
                .sourceRef(SOURCE)
                .targetImage("registry.local:5000/" + agentId + ":" + id)
                .status(status)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    @Test
    @DisplayName("Active builds are the unfinished ones of the agent, oldest first")
    void findActiveSkipsFinishedBuilds() {
        Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
        repo.save(build("b1", "echo", BuildStatus.SUCCEEDED, t0));
        repo.save(build("b2", "echo", BuildStatus.FAILED, t0.plusSeconds(10)));
        repo.save(build("b3", "echo", BuildStatus.PUSHING, t0.plusSeconds(30)));
        repo.save(build("b4", "echo", BuildStatus.QUEUED, t0.plusSeconds(20)));
        repo.save(build("b5", "other", BuildStatus.BUILDING, t0.plusSeconds(40)));

        List<BuildRecord> active = repo.findActive("echo");

        assertEquals(List.of("b4", "b3"), active.stream().map(BuildRecord::id).toList());
        assertTrue(repo.findActive("nobody").isEmpty());
    }

    @Test
    void updateMovesBuildOutOfActiveSet() {
        Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
        BuildRecord queued = build("b1", "echo", BuildStatus.QUEUED, t0);
        repo.save(queued);
        assertEquals(1, repo.findActive("echo").size());

        repo.update(queued.toBuilder()
                .status(BuildStatus.FAILED)
                .errorDetail("job dead-lettered: build backend unavailable")
                .updatedAt(t0.plusSeconds(60))
                .completedAt(t0.plusSeconds(60))
                .build());

        assertTrue(repo.findActive("echo").isEmpty());
        BuildRecord failed = repo.findByJobId("job-b1").orElseThrow();
        assertEquals(BuildStatus.FAILED, failed.status());
        assertEquals("job dead-lettered: build backend unavailable", failed.errorDetail());
        assertEquals(t0.plusSeconds(60), failed.completedAt());
    }

    @Test
    void latestSucceededIgnoresNewerUnfinishedBuilds() {
        Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
        repo.save(build("b1", "echo", BuildStatus.QUEUED, t0).toBuilder()
                .status(BuildStatus.SUCCEEDED)
                .imageReference("registry.local:5000/echo:b1")
                .completedAt(t0)
                .build());
        repo.save(build("b2", "echo", BuildStatus.BUILDING, t0.plusSeconds(30)));

        assertEquals("b2", repo.findLatest("echo").orElseThrow().id());
        assertEquals("b1", repo.findLatestSucceeded("echo").orElseThrow().id());
        assertEquals("b1", repo.findSucceededByImage("echo", "registry.local:5000/echo:b1").orElseThrow().id());
    }
}
