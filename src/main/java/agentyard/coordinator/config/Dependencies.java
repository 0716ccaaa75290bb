package agentyard.coordinator.config;

import agentyard.coordinator.api.v1.AgentController;
import agentyard.coordinator.api.v1.BackendController;
import agentyard.coordinator.api.v1.HealthController;
import agentyard.coordinator.api.v1.JobController;
import agentyard.coordinator.repository.AgentRepository;
import agentyard.coordinator.repository.BackendRepository;
import agentyard.coordinator.repository.BuildRepository;
import agentyard.coordinator.repository.DeploymentRepository;
import agentyard.coordinator.repository.JobRepository;
import agentyard.coordinator.repository.LeaseRepository;
import agentyard.coordinator.scheduler.JobReaper;
import agentyard.coordinator.scheduler.Scheduler;
import agentyard.coordinator.server.RouterHandler;
import agentyard.coordinator.service.ActiveRecordGuard;
import agentyard.coordinator.service.AgentLockService;
import agentyard.coordinator.service.AgentService;
import agentyard.coordinator.service.BuildCoordinator;
import agentyard.coordinator.service.DeploymentManager;
import agentyard.coordinator.service.GatewayReconciler;
import agentyard.coordinator.service.JobQueueService;
import agentyard.coordinator.service.PortResolver;
import agentyard.coordinator.store.Database;
import agentyard.coordinator.store.JdbcAgentRepository;
import agentyard.coordinator.store.JdbcBackendRepository;
import agentyard.coordinator.store.JdbcBuildRepository;
import agentyard.coordinator.store.JdbcDeploymentRepository;
import agentyard.coordinator.store.JdbcJobRepository;
import agentyard.coordinator.store.JdbcLeaseRepository;
import agentyard.coordinator.worker.JobProcessor;
import agentyard.coordinator.worker.WorkerLoop;
import agentyard.platform.Platform;
import agentyard.platform.PlatformFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.start(); // workers, reaper, reconciler
 * JobQueueService queue = deps.jobQueueService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final Platform platform;
    private final Database database;

    private final JobRepository jobRepository;
    private final BuildRepository buildRepository;
    private final DeploymentRepository deploymentRepository;
    private final AgentRepository agentRepository;
    private final LeaseRepository leaseRepository;
    private final BackendRepository backendRepository;

    private final JobQueueService jobQueueService;
    private final AgentLockService agentLockService;
    private final AgentService agentService;
    private final BuildCoordinator buildCoordinator;
    private final DeploymentManager deploymentManager;
    private final GatewayReconciler gatewayReconciler;
    private final WorkerLoop workerLoop;
    private final Scheduler scheduler;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, Platform platform, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.platform = platform;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.buildRepository = new JdbcBuildRepository(database);
        this.deploymentRepository = new JdbcDeploymentRepository(database);
        this.agentRepository = new JdbcAgentRepository(database);
        this.leaseRepository = new JdbcLeaseRepository(database);
        this.backendRepository = new JdbcBackendRepository(database);

        // Services
        this.jobQueueService = new JobQueueService(jobRepository, config, clock);
        this.agentLockService = new AgentLockService(leaseRepository, config, clock);
        this.agentService = new AgentService(agentRepository, buildRepository, deploymentRepository,
                backendRepository);
        this.buildCoordinator = new BuildCoordinator(buildRepository, agentRepository,
                platform.imageBuilder(), platform.imageRegistry(), config, clock);
        this.deploymentManager = new DeploymentManager(deploymentRepository, buildRepository, agentRepository,
                platform.containerScheduler(), new PortResolver(agentRepository, config.defaultAgentPort()),
                config, clock);
        this.gatewayReconciler = new GatewayReconciler(platform.containerScheduler(), platform.gatewayAdmin(),
                backendRepository, deploymentRepository, config, clock);

        ActiveRecordGuard recordGuard = new ActiveRecordGuard(jobRepository, buildRepository, deploymentRepository,
                buildCoordinator, deploymentManager);

        // Background work
        JobProcessor processor = new JobProcessor(jobQueueService, agentRepository, deploymentRepository,
                agentLockService, buildCoordinator, deploymentManager, recordGuard, config);
        this.workerLoop = new WorkerLoop(jobQueueService, processor, config);
        this.scheduler = new Scheduler(new JobReaper(jobRepository, recordGuard, config, clock), config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the platform it selects.
     */
    public static Dependencies create(CoordinatorConfig config) {
        Clock clock = Clock.systemUTC();
        return new Dependencies(config, PlatformFactory.create(config, RouterHandler.mapper(), clock), clock);
    }

    /**
     * Create dependencies around an already built platform.
     */
    public static Dependencies create(CoordinatorConfig config, Platform platform, Clock clock) {
        return new Dependencies(config, platform, clock);
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Platform platform() {
        return platform;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public BuildRepository buildRepository() {
        return buildRepository;
    }

    public DeploymentRepository deploymentRepository() {
        return deploymentRepository;
    }

    public AgentRepository agentRepository() {
        return agentRepository;
    }

    public LeaseRepository leaseRepository() {
        return leaseRepository;
    }

    public BackendRepository backendRepository() {
        return backendRepository;
    }

    public JobQueueService jobQueueService() {
        return jobQueueService;
    }

    public AgentService agentService() {
        return agentService;
    }

    public BuildCoordinator buildCoordinator() {
        return buildCoordinator;
    }

    public DeploymentManager deploymentManager() {
        return deploymentManager;
    }

    public GatewayReconciler gatewayReconciler() {
        return gatewayReconciler;
    }

    public WorkerLoop workerLoop() {
        return workerLoop;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, jobQueueService, workerLoop,
                            gatewayReconciler))
                    .registerController(new AgentController(agentService))
                    .registerController(new JobController(jobQueueService))
                    .registerController(new BackendController(agentService));
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Start workers, the job reaper and, if enabled, the gateway reconciler.
     */
    public void start() {
        workerLoop.start();
        scheduler.start();
        if (config.reconcilerEnabled()) {
            gatewayReconciler.start();
        } else {
            log.info("Gateway reconciler disabled");
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop producers of work before the store goes away
        closeQuietly("worker loop", workerLoop);
        closeQuietly("reconciler", gatewayReconciler);
        closeQuietly("scheduler", scheduler);
        closeQuietly("lease renewer", agentLockService);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
