package agentyard.coordinator.scheduler;

import agentyard.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs housekeeping on a single background thread. Currently only the
 * {@link JobReaper}; the gateway reconciler keeps its own executor so a slow
 * gateway cannot delay redelivery.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobReaper jobReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(JobReaper jobReaper, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentyard-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.jobReaper = jobReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                jobReaper,
                reaperIntervalMs, // initial delay
                reaperIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Job reaper scheduled every {}ms", reaperIntervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
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

    public JobReaper jobReaper() {
        return jobReaper;
    }
}
