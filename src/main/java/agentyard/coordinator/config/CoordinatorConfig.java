package agentyard.coordinator.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * {@code AGENTYARD_*} environment variables (durations in seconds).
 */
public final class CoordinatorConfig {

    public static final String PLATFORM_SIMULATED = "simulated";
    public static final String PLATFORM_KUBERNETES = "kubernetes";
    public static final String GATEWAY_KONG = "kong";
    public static final String REGISTRY_V2 = "registry";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/agentyard;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private int defaultMaxAttempts = 5;
    private Duration visibilityTimeout = Duration.ofMinutes(20);
    private Duration claimBlockTimeout = Duration.ofSeconds(2);
    private Duration claimPollInterval = Duration.ofMillis(200);
    private Duration retryBaseDelay = Duration.ofSeconds(5);
    private Duration retryMaxDelay = Duration.ofMinutes(5);
    private Duration reaperInterval = Duration.ofSeconds(30);

    // Worker settings
    private int workerThreads = 2;
    private String workerName = "worker-" + ProcessHandle.current().pid();
    private Duration leaseTtl = Duration.ofSeconds(60);
    private Duration lockWaitTimeout = Duration.ofSeconds(5);
    private Duration lockPollInterval = Duration.ofMillis(250);
    private Duration lockRetryDelay = Duration.ofSeconds(10);

    // Build settings
    private String imageRegistry = "registry.local:5000";
    private Duration buildTimeout = Duration.ofSeconds(600);
    private Duration buildPollInitial = Duration.ofSeconds(1);
    private Duration buildPollMax = Duration.ofSeconds(5);

    // Deployment settings
    private int defaultAgentPort = 5000;
    private Duration scheduleTimeout = Duration.ofMinutes(2);
    private Duration healthCheckTimeout = Duration.ofMinutes(3);
    private Duration deployPollInitial = Duration.ofMillis(500);
    private Duration deployPollMax = Duration.ofSeconds(5);
    private boolean retireSupersededWorkloads = true;

    // Reconciler settings
    private boolean reconcilerEnabled = true;
    private Duration reconcileInterval = Duration.ofSeconds(30);
    private Duration routeGraceWindow = Duration.ofSeconds(30);
    private Set<String> reservedRoutes = Set.of();

    // Platform settings
    private String platform = PLATFORM_SIMULATED;
    private String gateway = PLATFORM_SIMULATED;
    // null follows the platform
    private String registry = null;
    private String kubernetesApiUrl = "https://kubernetes.default.svc";
    private String kubernetesToken = null;
    private String kubernetesNamespace = "agents";
    private String buildkitImage = "moby/buildkit:v0.13.2-rootless";
    private String kongAdminUrl = "http://localhost:8001";
    private String registryScheme = "https";
    private String registryToken = null;
    private Duration platformHttpTimeout = Duration.ofSeconds(10);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        config.databaseUrl = envString("AGENTYARD_DB_URL", config.databaseUrl);
        config.databasePoolSize = envInt("AGENTYARD_DB_POOL_SIZE", config.databasePoolSize);
        config.serverHost = envString("AGENTYARD_HOST", config.serverHost);
        config.serverPort = envInt("AGENTYARD_PORT", config.serverPort);

        config.defaultMaxAttempts = envInt("AGENTYARD_MAX_ATTEMPTS", config.defaultMaxAttempts);
        config.visibilityTimeout = envSeconds("AGENTYARD_VISIBILITY_TIMEOUT", config.visibilityTimeout);
        config.retryBaseDelay = envSeconds("AGENTYARD_RETRY_BASE_DELAY", config.retryBaseDelay);
        config.retryMaxDelay = envSeconds("AGENTYARD_RETRY_MAX_DELAY", config.retryMaxDelay);
        config.reaperInterval = envSeconds("AGENTYARD_REAPER_INTERVAL", config.reaperInterval);

        config.workerThreads = envInt("AGENTYARD_WORKER_THREADS", config.workerThreads);
        config.workerName = envString("AGENTYARD_WORKER_NAME", config.workerName);
        config.leaseTtl = envSeconds("AGENTYARD_LEASE_TTL", config.leaseTtl);
        config.lockWaitTimeout = envSeconds("AGENTYARD_LOCK_WAIT_TIMEOUT", config.lockWaitTimeout);
        config.lockRetryDelay = envSeconds("AGENTYARD_LOCK_RETRY_DELAY", config.lockRetryDelay);

        config.imageRegistry = envString("AGENTYARD_IMAGE_REGISTRY", config.imageRegistry);
        config.buildTimeout = envSeconds("AGENTYARD_BUILD_TIMEOUT", config.buildTimeout);

        config.defaultAgentPort = envInt("AGENTYARD_DEFAULT_AGENT_PORT", config.defaultAgentPort);
        config.scheduleTimeout = envSeconds("AGENTYARD_SCHEDULE_TIMEOUT", config.scheduleTimeout);
        config.healthCheckTimeout = envSeconds("AGENTYARD_HEALTH_CHECK_TIMEOUT", config.healthCheckTimeout);
        config.retireSupersededWorkloads = envBool("AGENTYARD_RETIRE_SUPERSEDED", config.retireSupersededWorkloads);

        config.reconcilerEnabled = envBool("AGENTYARD_RECONCILER_ENABLED", config.reconcilerEnabled);
        config.reconcileInterval = envSeconds("AGENTYARD_RECONCILE_INTERVAL", config.reconcileInterval);
        config.routeGraceWindow = envSeconds("AGENTYARD_ROUTE_GRACE_WINDOW", config.reconcileInterval);
        String reserved = System.getenv("AGENTYARD_RESERVED_ROUTES");
        if (reserved != null && !reserved.isBlank()) {
            config.reservedRoutes = parseList(reserved);
        }

        config.platform = envString("AGENTYARD_PLATFORM", config.platform);
        config.gateway = envString("AGENTYARD_GATEWAY", config.gateway);
        config.registry = envString("AGENTYARD_REGISTRY", config.registry);
        config.kubernetesApiUrl = envString("AGENTYARD_K8S_API_URL", config.kubernetesApiUrl);
        config.kubernetesToken = envString("AGENTYARD_K8S_TOKEN", config.kubernetesToken);
        config.kubernetesNamespace = envString("AGENTYARD_K8S_NAMESPACE", config.kubernetesNamespace);
        config.buildkitImage = envString("AGENTYARD_BUILDKIT_IMAGE", config.buildkitImage);
        config.kongAdminUrl = envString("AGENTYARD_KONG_ADMIN_URL", config.kongAdminUrl);
        config.registryScheme = envString("AGENTYARD_REGISTRY_SCHEME", config.registryScheme);
        config.registryToken = envString("AGENTYARD_REGISTRY_TOKEN", config.registryToken);

        return config;
    }

    private static String envString(String name, String fallback) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static int envInt(String name, int fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static boolean envBool(String name, boolean fallback) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? Boolean.parseBoolean(value.trim()) : fallback;
    }

    private static Duration envSeconds(String name, Duration fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number of seconds: " + value, e);
        }
    }

    private static Set<String> parseList(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public Duration visibilityTimeout() {
        return visibilityTimeout;
    }

    public Duration claimBlockTimeout() {
        return claimBlockTimeout;
    }

    public Duration claimPollInterval() {
        return claimPollInterval;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public String workerName() {
        return workerName;
    }

    public Duration leaseTtl() {
        return leaseTtl;
    }

    public Duration lockWaitTimeout() {
        return lockWaitTimeout;
    }

    public Duration lockPollInterval() {
        return lockPollInterval;
    }

    public Duration lockRetryDelay() {
        return lockRetryDelay;
    }

    public String imageRegistry() {
        return imageRegistry;
    }

    public Duration buildTimeout() {
        return buildTimeout;
    }

    public Duration buildPollInitial() {
        return buildPollInitial;
    }

    public Duration buildPollMax() {
        return buildPollMax;
    }

    public int defaultAgentPort() {
        return defaultAgentPort;
    }

    public Duration scheduleTimeout() {
        return scheduleTimeout;
    }

    public Duration healthCheckTimeout() {
        return healthCheckTimeout;
    }

    public Duration deployPollInitial() {
        return deployPollInitial;
    }

    public Duration deployPollMax() {
        return deployPollMax;
    }

    public boolean retireSupersededWorkloads() {
        return retireSupersededWorkloads;
    }

    public boolean reconcilerEnabled() {
        return reconcilerEnabled;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public Duration routeGraceWindow() {
        return routeGraceWindow;
    }

    public Set<String> reservedRoutes() {
        return reservedRoutes;
    }

    public String platform() {
        return platform;
    }

    public String gateway() {
        return gateway;
    }

    /**
     * Image registry implementation. Unless set, the simulated platform uses the
     * simulated registry and every real platform the Registry v2 API.
     */
    public String registry() {
        if (registry != null) {
            return registry;
        }
        return PLATFORM_SIMULATED.equals(platform) ? PLATFORM_SIMULATED : REGISTRY_V2;
    }

    public String kubernetesApiUrl() {
        return kubernetesApiUrl;
    }

    public String kubernetesToken() {
        return kubernetesToken;
    }

    public String kubernetesNamespace() {
        return kubernetesNamespace;
    }

    public String buildkitImage() {
        return buildkitImage;
    }

    public String kongAdminUrl() {
        return kongAdminUrl;
    }

    public String registryScheme() {
        return registryScheme;
    }

    public String registryToken() {
        return registryToken;
    }

    public Duration platformHttpTimeout() {
        return platformHttpTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public CoordinatorConfig withVisibilityTimeout(Duration timeout) {
        this.visibilityTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withClaimBlockTimeout(Duration timeout) {
        this.claimBlockTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withClaimPollInterval(Duration interval) {
        this.claimPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withRetryDelays(Duration base, Duration max) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        return this;
    }

    public CoordinatorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkerThreads(int threads) {
        this.workerThreads = threads;
        return this;
    }

    public CoordinatorConfig withWorkerName(String name) {
        this.workerName = name;
        return this;
    }

    public CoordinatorConfig withLeaseTtl(Duration ttl) {
        this.leaseTtl = ttl;
        return this;
    }

    public CoordinatorConfig withLockWaitTimeout(Duration timeout) {
        this.lockWaitTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withLockPollInterval(Duration interval) {
        this.lockPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withLockRetryDelay(Duration delay) {
        this.lockRetryDelay = delay;
        return this;
    }

    public CoordinatorConfig withImageRegistry(String registry) {
        this.imageRegistry = registry;
        return this;
    }

    public CoordinatorConfig withBuildTimeout(Duration timeout) {
        this.buildTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withBuildPolling(Duration initial, Duration max) {
        this.buildPollInitial = initial;
        this.buildPollMax = max;
        return this;
    }

    public CoordinatorConfig withDefaultAgentPort(int port) {
        this.defaultAgentPort = port;
        return this;
    }

    public CoordinatorConfig withScheduleTimeout(Duration timeout) {
        this.scheduleTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withHealthCheckTimeout(Duration timeout) {
        this.healthCheckTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withDeployPolling(Duration initial, Duration max) {
        this.deployPollInitial = initial;
        this.deployPollMax = max;
        return this;
    }

    public CoordinatorConfig withRetireSupersededWorkloads(boolean retire) {
        this.retireSupersededWorkloads = retire;
        return this;
    }

    public CoordinatorConfig withReconcilerEnabled(boolean enabled) {
        this.reconcilerEnabled = enabled;
        return this;
    }

    public CoordinatorConfig withReconcileInterval(Duration interval) {
        this.reconcileInterval = interval;
        return this;
    }

    public CoordinatorConfig withRouteGraceWindow(Duration window) {
        this.routeGraceWindow = window;
        return this;
    }

    public CoordinatorConfig withReservedRoutes(Set<String> routes) {
        this.reservedRoutes = Set.copyOf(routes);
        return this;
    }

    public CoordinatorConfig withPlatform(String platform) {
        this.platform = platform;
        return this;
    }

    public CoordinatorConfig withGateway(String gateway) {
        this.gateway = gateway;
        return this;
    }

    public CoordinatorConfig withRegistry(String registry) {
        this.registry = registry;
        return this;
    }

    public CoordinatorConfig withKubernetes(String apiUrl, String token, String namespace) {
        this.kubernetesApiUrl = apiUrl;
        this.kubernetesToken = token;
        this.kubernetesNamespace = namespace;
        return this;
    }

    public CoordinatorConfig withKongAdminUrl(String url) {
        this.kongAdminUrl = url;
        return this;
    }

    public CoordinatorConfig withRegistryAccess(String scheme, String token) {
        this.registryScheme = scheme;
        this.registryToken = token;
        return this;
    }

    public CoordinatorConfig withPlatformHttpTimeout(Duration timeout) {
        this.platformHttpTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxAttempts=" + defaultMaxAttempts +
                ", workerThreads=" + workerThreads +
                ", platform=" + platform +
                ", gateway=" + gateway +
                ", registry=" + registry() +
                ", imageRegistry='" + imageRegistry + '\'' +
                ", reconcileInterval=" + reconcileInterval +
                ", routeGraceWindow=" + routeGraceWindow +
                ", kubernetesTokenSet=" + (kubernetesToken != null) +
                ", registryTokenSet=" + (registryToken != null) +
                '}';
    }
}
