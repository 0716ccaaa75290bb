package agentyard.coordinator.api.v1;

import agentyard.coordinator.api.Controller;
import agentyard.coordinator.api.v1.dto.HealthResponse;
import agentyard.coordinator.model.JobStatus;
import agentyard.coordinator.repository.StoreException;
import agentyard.coordinator.service.GatewayReconciler;
import agentyard.coordinator.service.JobQueueService;
import agentyard.coordinator.store.Database;
import agentyard.coordinator.worker.WorkerLoop;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobQueueService queue;
    private final WorkerLoop workers;
    private final GatewayReconciler reconciler;

    public HealthController(Database database, JobQueueService queue, WorkerLoop workers,
            GatewayReconciler reconciler) {
        this.database = database;
        this.queue = queue;
        this.workers = workers;
        this.reconciler = reconciler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    /**
     * 200 with queue and loop state, 503 when the state store is unreachable.
     */
    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return unhealthy("connection failed");
        }
        try {
            return ControllerResponse.ok(HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    queue.countByStatus(JobStatus.PENDING),
                    queue.countByStatus(JobStatus.CLAIMED),
                    queue.countByStatus(JobStatus.DEAD_LETTERED),
                    workers.isRunning(),
                    reconciler.isRunning(),
                    reconciler.lastReport()));
        } catch (StoreException e) {
            log.warn("Health check could not read the queue: {}", e.getMessage());
            return unhealthy(e.getMessage());
        }
    }

    private static ControllerResponse unhealthy(String reason) {
        return new ControllerResponse(HttpResponseStatus.SERVICE_UNAVAILABLE, HealthResponse.unhealthy(reason));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
