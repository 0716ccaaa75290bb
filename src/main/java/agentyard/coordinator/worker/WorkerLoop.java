package agentyard.coordinator.worker;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pool of worker threads sharing one consumer group.
 * Each thread loops: claim (blocking up to the claim timeout), process,
 * repeat. Stops cleanly on {@link #stop()}; a job interrupted mid-flight is
 * left claimed and redelivered by the reaper.
 */
public class WorkerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final JobQueueService queue;
    private final JobProcessor processor;
    private final CoordinatorConfig config;
    private final List<Thread> threads = new ArrayList<>();
    private final AtomicLong processed = new AtomicLong();

    private volatile boolean running = false;

    public WorkerLoop(JobQueueService queue, JobProcessor processor, CoordinatorConfig config) {
        this.queue = queue;
        this.processor = processor;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker loop already running");
            return;
        }
        running = true;

        for (int i = 1; i <= config.workerThreads(); i++) {
            String consumerId = config.workerName() + "-" + i;
            Thread t = new Thread(() -> runWorker(consumerId), "agentyard-worker-" + i);
            t.setDaemon(true);
            threads.add(t);
            t.start();
        }
        log.info("Worker loop started: {} threads as {}", threads.size(), config.workerName());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        for (Thread t : threads) {
            t.interrupt();
        }
        for (Thread t : threads) {
            try {
                t.join(5000);
                if (t.isAlive()) {
                    log.warn("Worker thread {} did not stop in time", t.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        threads.clear();
        log.info("Worker loop stopped after {} jobs", processed.get());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int threadCount() {
        return threads.size();
    }

    /** Jobs handled since start, whatever their outcome */
    public long processedCount() {
        return processed.get();
    }

    private void runWorker(String consumerId) {
        log.info("Worker {} started", consumerId);

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<Job> claimed = queue.claim(consumerId, config.claimBlockTimeout());
                if (claimed.isEmpty()) {
                    continue;
                }

                Job job = claimed.get();
                log.info("Worker {} processing {} job {} for agent {} (attempt {}/{})", consumerId,
                        job.kind(), job.id(), job.agentId(), job.attempts(), job.maxAttempts());
                JobProcessor.Outcome outcome = processor.process(job, consumerId);
                processed.incrementAndGet();
                log.info("Worker {} finished job {}: {}", consumerId, job.id(), outcome);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                // Store outage while claiming
                log.warn("Worker {} error: {}", consumerId, e.getMessage());
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", consumerId);
    }
}
