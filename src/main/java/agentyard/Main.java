package agentyard;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.config.Dependencies;
import agentyard.coordinator.server.CoordinatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: HTTP API, worker pool, job reaper and gateway reconciler in
 * one process. Configuration comes from {@code AGENTYARD_*} environment
 * variables.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorServer server = new CoordinatorServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "agentyard-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
            deps.start();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            server.stop();
            deps.close();
            System.exit(1);
        }

        log.info("agentyard coordinator running");
        stopped.await();
    }
}
