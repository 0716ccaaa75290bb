package agentyard.coordinator.store;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.model.JobAckResult;
import agentyard.coordinator.model.JobKind;
import agentyard.coordinator.model.JobRetryResult;
import agentyard.coordinator.model.JobStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcJobRepository using H2 in-memory database.
 */
class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job job(String id, Instant enqueuedAt, int maxAttempts) {
        return Job.builder()
                .id(id)
                .agentId("echo")
                .kind(JobKind.DEPLOY)
                .payload("{}")
                .status(JobStatus.PENDING)
                .maxAttempts(maxAttempts)
                .enqueuedAt(enqueuedAt)
                .visibleAt(enqueuedAt)
                .build();
    }

    @Test
    void saveIfAbsentRejectsDuplicateId() {
        Instant now = Instant.now();
        assertTrue(repo.saveIfAbsent(job("job-dup", now, 3)));
        assertFalse(repo.saveIfAbsent(job("job-dup", now, 3)));

        Job stored = repo.findById("job-dup").orElseThrow();
        assertEquals(JobStatus.PENDING, stored.status());
        assertEquals(0, stored.attempts());
    }

    @Test
    void claimNextIsFifoAndSkipsInvisibleJobs() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-b", now.minusSeconds(5), 3));
        repo.saveIfAbsent(job("job-a", now.minusSeconds(10), 3));
        repo.saveIfAbsent(job("job-later", now.minusSeconds(20), 3).toBuilder()
                .visibleAt(now.plusSeconds(60))
                .build());

        Job first = repo.claimNext("c1", now).orElseThrow();
        Job second = repo.claimNext("c1", now).orElseThrow();

        assertEquals("job-a", first.id());
        assertEquals("job-b", second.id());
        assertEquals(JobStatus.CLAIMED, first.status());
        assertEquals("c1", first.consumerId());
        assertEquals(1, first.attempts());
        assertTrue(repo.claimNext("c1", now).isEmpty(), "job-later is not visible yet");
    }

    @Test
    void onlyHolderCanAck() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-ack", now, 3));
        repo.claimNext("c1", now);

        assertEquals(JobAckResult.NOT_HOLDER, repo.complete("job-ack", "c2", JobStatus.DONE, null, now));
        assertEquals(JobAckResult.ACKED, repo.complete("job-ack", "c1", JobStatus.DONE, null, now));
        assertEquals(JobAckResult.ALREADY_TERMINAL, repo.complete("job-ack", "c1", JobStatus.DONE, null, now));
        assertEquals(JobAckResult.NOT_FOUND, repo.complete("missing", "c1", JobStatus.DONE, null, now));

        Job done = repo.findById("job-ack").orElseThrow();
        assertEquals(JobStatus.DONE, done.status());
        assertNotNull(done.finishedAt());
    }

    @Test
    void failedJobKeepsErrorMessage() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-fail", now, 3));
        repo.claimNext("c1", now);

        assertEquals(JobAckResult.ACKED, repo.complete("job-fail", "c1", JobStatus.FAILED, "agent ghost is not registered", now));

        Job failed = repo.findById("job-fail").orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("agent ghost is not registered", failed.errorMessage());
    }

    @Test
    void completeRejectsNonTerminalStatus() {
        assertThrows(IllegalArgumentException.class,
                () -> repo.complete("job-x", "c1", JobStatus.PENDING, null, Instant.now()));
    }

    @Test
    void requeueDelaysVisibility() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-retry", now, 3));
        repo.claimNext("c1", now);

        JobRetryResult result = repo.requeue("job-retry", "c1", "registry unreachable", now, now.plusSeconds(30), true);

        assertEquals(JobRetryResult.REQUEUED, result);
        Job requeued = repo.findById("job-retry").orElseThrow();
        assertEquals(JobStatus.PENDING, requeued.status());
        assertNull(requeued.consumerId());
        assertEquals(1, requeued.attempts());
        assertEquals("registry unreachable", requeued.errorMessage());

        assertTrue(repo.claimNext("c1", now.plusSeconds(10)).isEmpty());
        assertTrue(repo.claimNext("c1", now.plusSeconds(31)).isPresent());
    }

    @Test
    void deferralDoesNotConsumeAttempt() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-defer", now, 1));
        repo.claimNext("c1", now);

        assertEquals(JobRetryResult.REQUEUED,
                repo.requeue("job-defer", "c1", "deferred: agent busy", now, now.plusMillis(1), false));
        assertEquals(0, repo.findById("job-defer").orElseThrow().attempts());
    }

    @Test
    void requeueDeadLettersWhenAttemptsExhausted() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-exhausted", now, 1));
        repo.claimNext("c1", now);

        JobRetryResult result = repo.requeue("job-exhausted", "c1", "still down", now, now.plusSeconds(5), true);

        assertEquals(JobRetryResult.DEAD_LETTERED, result);
        Job dead = repo.findById("job-exhausted").orElseThrow();
        assertEquals(JobStatus.DEAD_LETTERED, dead.status());
        assertEquals("still down", dead.errorMessage());
        assertEquals(1, repo.countByStatus(JobStatus.DEAD_LETTERED));
    }

    @Test
    void requeueByNonHolderIsRejected() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-steal", now, 3));
        repo.claimNext("c1", now);

        assertEquals(JobRetryResult.NOT_HOLDER, repo.requeue("job-steal", "c2", "x", now, now, true));
        assertEquals(JobStatus.CLAIMED, repo.findById("job-steal").orElseThrow().status());
    }

    @Test
    void releaseClaimReturnsJobToQueue() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-expired", now.minusSeconds(120), 3));
        repo.claimNext("c1", now.minusSeconds(100));

        List<Job> expired = repo.findExpiredClaims(now.minusSeconds(60));
        assertEquals(1, expired.size());
        assertTrue(repo.releaseClaim("job-expired", "c1", now));
        assertFalse(repo.releaseClaim("job-expired", "c1", now), "second release finds no claim");

        Job released = repo.findById("job-expired").orElseThrow();
        assertEquals(JobStatus.PENDING, released.status());
        assertEquals(1, released.attempts());
    }

    @Test
    void findByAgentIdReturnsNewestFirst() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-old", now.minusSeconds(30), 3));
        repo.saveIfAbsent(job("job-new", now, 3));

        List<Job> jobs = repo.findByAgentId("echo", 10);
        assertEquals(List.of("job-new", "job-old"), jobs.stream().map(Job::id).toList());
        assertEquals(1, repo.findByAgentId("echo", 1).size());
        assertTrue(repo.findByAgentId("nobody", 10).isEmpty());
    }

    @Test
    void concurrentConsumersNeverShareAJob() throws Exception {
        Instant now = Instant.now();
        int jobCount = 20;
        for (int i = 0; i < jobCount; i++) {
            repo.saveIfAbsent(job(String.format("job-%02d", i), now.minusSeconds(jobCount - i), 3));
        }

        Set<String> claimed = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            String consumer = "c" + t;
            futures.add(pool.submit(() -> {
                while (true) {
                    Optional<Job> job = repo.claimNext(consumer, now);
                    if (job.isEmpty()) {
                        if (repo.countByStatus(JobStatus.PENDING) == 0) {
                            return;
                        }
                        continue;
                    }
                    if (!claimed.add(job.get().id())) {
                        duplicates.incrementAndGet();
                    }
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(0, duplicates.get());
        assertEquals(jobCount, claimed.size());
        assertEquals(jobCount, repo.countByStatus(JobStatus.CLAIMED));
    }

    @Test
    void claimTimestampsAreStored() {
        Instant now = Instant.now();
        repo.saveIfAbsent(job("job-ts", now, 3));
        Job claimed = repo.claimNext("c1", now.plus(Duration.ofSeconds(1))).orElseThrow();

        assertNotNull(claimed.claimedAt());
        assertNotNull(claimed.enqueuedAt());
        assertFalse(claimed.claimedAt().isBefore(claimed.enqueuedAt()));
    }
}
