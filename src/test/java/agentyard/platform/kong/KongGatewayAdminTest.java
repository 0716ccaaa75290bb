package agentyard.platform.kong;

import agentyard.coordinator.model.GatewayRoute;
import agentyard.platform.JsonHttpClient;
import agentyard.platform.PlatformException;
import agentyard.platform.StubHttpServer;
import agentyard.platform.StubHttpServer.Recorded;
import agentyard.platform.TransientPlatformException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KongGatewayAdminTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StubHttpServer kong;
    private KongGatewayAdmin admin;

    @BeforeEach
    void setUp() throws Exception {
        kong = new StubHttpServer();
        admin = new KongGatewayAdmin(new JsonHttpClient(kong.baseUrl(), "kong-token", Duration.ofSeconds(2), MAPPER));
    }

    @AfterEach
    void tearDown() {
        kong.close();
    }

    @Test
    @DisplayName("Only agent services are listed, across pages")
    void listRoutesFollowsPagesAndSkipsForeignServices() {
        kong.reply("GET", "/services?size=1000", 200, """
                {"data": [
                    {"name": "agent-echo", "host": "agent-echo-1.agents.svc.cluster.local", "port": 5000},
                    {"name": "billing", "host": "billing.internal", "port": 80}
                ], "next": "/services?offset=page2&size=1000"}
                """);
        kong.reply("GET", "/services?offset=page2&size=1000", 200, """
                {"data": [
                    {"name": "agent-summarizer", "host": "agent-summarizer-1.agents.svc.cluster.local", "port": 9001}
                ], "next": null}
                """);

        List<GatewayRoute> routes = admin.listRoutes();

        assertEquals(List.of(
                new GatewayRoute("echo", "/agents/echo", "agent-echo-1.agents.svc.cluster.local", 5000),
                new GatewayRoute("summarizer", "/agents/summarizer",
                        "agent-summarizer-1.agents.svc.cluster.local", 9001)), routes);
        assertEquals("Bearer kong-token", kong.requests().get(0).header("Authorization"));
    }

    @Test
    void createRouteUpsertsServiceThenRoute() throws Exception {
        kong.reply("PUT", "/services/agent-echo", 200, "{}");
        kong.reply("PUT", "/services/agent-echo/routes/agent-echo-route", 200, "{}");

        admin.createRoute(new GatewayRoute("echo", "/agents/echo", "agent-echo-1.sim.local", 5000));

        assertEquals(List.of("PUT /services/agent-echo", "PUT /services/agent-echo/routes/agent-echo-route"),
                kong.requestLines());

        JsonNode service = MAPPER.readTree(kong.requests().get(0).body());
        assertEquals("agent-echo", service.get("name").asText());
        assertEquals("http", service.get("protocol").asText());
        assertEquals("agent-echo-1.sim.local", service.get("host").asText());
        assertEquals(5000, service.get("port").asInt());
        assertEquals(3, service.get("retries").asInt());

        JsonNode route = MAPPER.readTree(kong.requests().get(1).body());
        assertEquals("agent-echo-route", route.get("name").asText());
        assertTrue(route.get("strip_path").asBoolean());
        assertEquals("/agents/echo", route.get("paths").get(0).asText());
    }

    @Test
    void updateRoutePointsServiceAtNewBackend() throws Exception {
        kong.reply("PUT", "/services/agent-echo", 200, "{}");
        kong.reply("PUT", "/services/agent-echo/routes/agent-echo-route", 200, "{}");

        admin.updateRoute(new GatewayRoute("echo", "/agents/echo", "agent-echo-2.sim.local", 9001));

        Recorded service = kong.requests().get(0);
        assertEquals("application/json", service.header("Content-Type"));
        assertEquals("agent-echo-2.sim.local", MAPPER.readTree(service.body()).get("host").asText());
        assertEquals(9001, MAPPER.readTree(service.body()).get("port").asInt());
    }

    @Test
    void deleteRouteToleratesMissingObjects() {
        kong.reply("DELETE", "/routes/agent-echo-route", 204, "");

        admin.deleteRoute("echo");

        assertEquals(List.of("DELETE /routes/agent-echo-route", "DELETE /services/agent-echo"), kong.requestLines());
    }

    @Test
    void serverErrorsAreTransient() {
        kong.reply("GET", "/services?size=1000", 503, "{\"message\":\"upstream unavailable\"}");

        TransientPlatformException e = assertThrows(TransientPlatformException.class, () -> admin.listRoutes());
        assertTrue(e.getMessage().contains("HTTP 503"), e.getMessage());
    }

    @Test
    void clientErrorsAreNotRetried() {
        kong.reply("PUT", "/services/agent-echo", 400, "{\"message\":\"schema violation (host: required field missing)\"}");

        PlatformException e = assertThrows(PlatformException.class,
                () -> admin.createRoute(new GatewayRoute("echo", "/agents/echo", null, 5000)));
        assertFalse(e instanceof TransientPlatformException);
        assertTrue(e.getMessage().contains("schema violation"), e.getMessage());
    }

    @Test
    void namesRequireAnAgentId() {
        assertEquals("agent-echo", KongGatewayAdmin.serviceName("echo"));
        assertEquals("agent-echo-route", KongGatewayAdmin.routeName("echo"));
        assertThrows(PlatformException.class, () -> KongGatewayAdmin.serviceName(" "));
    }
}
