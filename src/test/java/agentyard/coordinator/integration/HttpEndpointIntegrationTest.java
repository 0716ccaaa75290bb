package agentyard.coordinator.integration;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.config.Dependencies;
import agentyard.coordinator.server.CoordinatorServer;
import agentyard.platform.Platform;
import agentyard.platform.simulated.SimulatedContainerScheduler;
import agentyard.platform.simulated.SimulatedGatewayAdmin;
import agentyard.platform.simulated.SimulatedImageBuilder;
import agentyard.platform.simulated.SimulatedImageRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Runs the full flow through the Netty server and the worker pool.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private CoordinatorServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withWorkerThreads(2)
                .withClaimBlockTimeout(Duration.ofMillis(200))
                .withClaimPollInterval(Duration.ofMillis(10))
                .withBuildPolling(Duration.ofMillis(5), Duration.ofMillis(20))
                .withDeployPolling(Duration.ofMillis(5), Duration.ofMillis(20))
                .withReconcilerEnabled(false);

        SimulatedImageRegistry registry = new SimulatedImageRegistry();
        Platform platform = new Platform(new SimulatedImageBuilder(registry, 1), registry,
                new SimulatedContainerScheduler(Clock.systemUTC()), new SimulatedGatewayAdmin());
        deps = Dependencies.create(config, platform, Clock.systemUTC());

        server = new CoordinatorServer(deps.routerHandler());
        server.start("127.0.0.1", 0);
        deps.start();

        baseUrl = "http://127.0.0.1:" + server.port();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode awaitJob(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 20_000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode job = MAPPER.readTree(get("/api/v1/jobs/" + jobId).body());
            String status = job.get("status").asText();
            if (!status.equals("PENDING") && !status.equals("CLAIMED")) {
                return job;
            }
            Thread.sleep(20);
        }
        fail("job " + jobId + " did not finish in time");
        return null;
    }

    @Test
    void healthReportsQueueAndWorkers() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals(0, health.get("pendingJobs").asInt());
        assertTrue(health.get("workersRunning").asBoolean());
        assertFalse(health.get("reconcilerRunning").asBoolean());
    }

    @Test
    @DisplayName("Full HTTP flow: register agent, submit build, read status")
    void registerBuildAndInspect() throws Exception {
        HttpResponse<String> registered = post("/api/v1/agents", """
                {"agentId": "echo", "name": "Echo agent"}
                """);
        assertEquals(201, registered.statusCode(), registered.body());
        assertEquals("echo", MAPPER.readTree(registered.body()).get("agentId").asText());

        HttpResponse<String> created = post("/api/v1/jobs", """
                {
                    "jobId": "job-http-1",
                    "agentId": "echo",
                    "kind": "build",
                    "payload": {"sourceRef": "git@example.org:agents/echo.git#main", "port": 9001}
                }
                """);
        assertEquals(202, created.statusCode(), created.body());
        JsonNode job = MAPPER.readTree(created.body());
        assertEquals("job-http-1", job.get("jobId").asText());
        assertEquals("BUILD", job.get("kind").asText());

        JsonNode finished = awaitJob("job-http-1");
        assertEquals("DONE", finished.get("status").asText(), finished.toString());

        HttpResponse<String> statusResponse = get("/api/v1/agents/echo/status");
        assertEquals(200, statusResponse.statusCode());
        JsonNode status = MAPPER.readTree(statusResponse.body());
        assertEquals(9001, status.get("agent").get("port").asInt());
        assertEquals("SUCCEEDED", status.get("latestBuild").get("status").asText());
        JsonNode deployment = status.get("currentDeployment");
        assertEquals("RUNNING", deployment.get("status").asText());
        assertEquals(9001, deployment.get("port").asInt());
        assertEquals("EXPLICIT", deployment.get("portSource").asText());

        JsonNode builds = MAPPER.readTree(get("/api/v1/agents/echo/builds").body());
        assertEquals(1, builds.get("builds").size());
        JsonNode deployments = MAPPER.readTree(get("/api/v1/agents/echo/deployments?limit=5").body());
        assertEquals(1, deployments.get("deployments").size());

        deps.gatewayReconciler().reconcile();
        JsonNode backends = MAPPER.readTree(get("/api/v1/backends").body());
        assertEquals(1, backends.get("backends").size());
        assertEquals("/agents/echo", backends.get("backends").get(0).get("path").asText());
    }

    @Test
    void duplicateJobIdIsRejected() throws Exception {
        post("/api/v1/agents", "{\"agentId\": \"echo\"}");
        String body = "{\"jobId\": \"job-dup\", \"agentId\": \"echo\", \"kind\": \"DEPLOY\"}";

        assertEquals(202, post("/api/v1/jobs", body).statusCode());
        assertEquals(409, post("/api/v1/jobs", body).statusCode());
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        assertEquals(400, post("/api/v1/agents", "{\"agentId\": \"Not Valid!\"}").statusCode());
        assertEquals(400, post("/api/v1/agents", "{\"agentId\": \"echo\", \"port\": 70000}").statusCode());
        assertEquals(400, post("/api/v1/agents", "{not json").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"agentId\": \"echo\", \"kind\": \"restart\"}").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"agentId\": \"echo\", \"kind\": \"BUILD\", \"payload\": [1]}")
                .statusCode());
    }

    @Test
    void unknownResourcesAreNotFound() throws Exception {
        assertEquals(404, get("/api/v1/agents/nobody/status").statusCode());
        assertEquals(404, get("/api/v1/agents/nobody/builds").statusCode());
        assertEquals(404, get("/api/v1/jobs/job-missing").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    void registeredAgentsAreListed() throws Exception {
        post("/api/v1/agents", "{\"agentId\": \"echo\", \"port\": 7000}");
        post("/api/v1/agents", "{\"agentId\": \"summarizer\"}");

        JsonNode agents = MAPPER.readTree(get("/api/v1/agents").body()).get("agents");

        assertEquals(2, agents.size());
        assertEquals("echo", agents.get(0).get("agentId").asText());
        assertEquals(7000, agents.get(0).get("port").asInt());
        assertEquals("summarizer", agents.get(1).get("name").asText());
    }
}
