package agentyard.coordinator.store;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.AgentLease;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLeaseRepositoryTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private static Database db;
    private static JdbcLeaseRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-leases;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcLeaseRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanLeases() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM agent_leases");
            conn.commit();
        }
    }

    @Test
    void secondHolderIsRefusedWhileLeaseIsLive() {
        Instant now = Instant.now();
        assertTrue(repo.tryAcquire("echo", "worker-1", now, TTL));
        assertFalse(repo.tryAcquire("echo", "worker-2", now.plusSeconds(5), TTL));

        AgentLease lease = repo.findByAgentId("echo").orElseThrow();
        assertEquals("worker-1", lease.holder());
        assertFalse(lease.isExpired(now.plusSeconds(5)));
    }

    @Test
    void holderCanReacquire() {
        Instant now = Instant.now();
        assertTrue(repo.tryAcquire("echo", "worker-1", now, TTL));
        assertTrue(repo.tryAcquire("echo", "worker-1", now.plusSeconds(1), TTL));
    }

    @Test
    void expiredLeaseCanBeTakenOver() {
        Instant now = Instant.now();
        assertTrue(repo.tryAcquire("echo", "worker-1", now, TTL));

        Instant later = now.plus(TTL).plusSeconds(1);
        assertTrue(repo.tryAcquire("echo", "worker-2", later, TTL));
        assertEquals("worker-2", repo.findByAgentId("echo").orElseThrow().holder());

        assertFalse(repo.renew("echo", "worker-1", later, TTL), "old holder lost the lease");
        assertFalse(repo.release("echo", "worker-1"));
    }

    @Test
    void renewExtendsExpiry() {
        Instant now = Instant.now();
        repo.tryAcquire("echo", "worker-1", now, TTL);

        assertTrue(repo.renew("echo", "worker-1", now.plusSeconds(20), TTL));
        AgentLease lease = repo.findByAgentId("echo").orElseThrow();
        assertFalse(lease.isExpired(now.plus(TTL).plusSeconds(1)));
    }

    @Test
    void releaseFreesTheAgent() {
        Instant now = Instant.now();
        repo.tryAcquire("echo", "worker-1", now, TTL);

        assertTrue(repo.release("echo", "worker-1"));
        assertTrue(repo.findByAgentId("echo").isEmpty());
        assertTrue(repo.tryAcquire("echo", "worker-2", now, TTL));
    }

    @Test
    void leasesArePerAgent() {
        Instant now = Instant.now();
        assertTrue(repo.tryAcquire("echo", "worker-1", now, TTL));
        assertTrue(repo.tryAcquire("summarizer", "worker-2", now, TTL));
    }
}
