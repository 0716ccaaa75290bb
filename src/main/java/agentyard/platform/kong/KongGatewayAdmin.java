package agentyard.platform.kong;

import agentyard.coordinator.model.GatewayRoute;
import agentyard.platform.GatewayAdmin;
import agentyard.platform.JsonHttpClient;
import agentyard.platform.JsonHttpClient.Response;
import agentyard.platform.PlatformException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Kong admin API adapter. Each agent is one Kong service {@code agent-<id>}
 * pointing at the backend, with one route {@code agent-<id>-route} on
 * {@code /agents/<id>}. Services without the prefix belong to someone else and
 * are never listed.
 */
public class KongGatewayAdmin implements GatewayAdmin {

    private static final Logger log = LoggerFactory.getLogger(KongGatewayAdmin.class);

    static final String SERVICE_PREFIX = "agent-";

    private final JsonHttpClient client;

    public KongGatewayAdmin(JsonHttpClient client) {
        this.client = client;
    }

    @Override
    public List<GatewayRoute> listRoutes() {
        List<GatewayRoute> routes = new ArrayList<>();
        String next = "/services?size=1000";
        while (next != null) {
            JsonNode page = client.json(client.get(next), "list Kong services");
            for (JsonNode service : page.path("data")) {
                String name = service.path("name").asText("");
                if (!name.startsWith(SERVICE_PREFIX)) {
                    continue;
                }
                String agentId = name.substring(SERVICE_PREFIX.length());
                routes.add(new GatewayRoute(agentId, GatewayRoute.PATH_PREFIX + agentId,
                        service.path("host").asText(null), service.path("port").asInt()));
            }
            JsonNode nextNode = page.get("next");
            next = nextNode == null || nextNode.isNull() ? null : nextNode.asText();
        }
        return routes;
    }

    @Override
    public void createRoute(GatewayRoute route) {
        upsert(route);
    }

    @Override
    public void updateRoute(GatewayRoute route) {
        upsert(route);
    }

    @Override
    public void deleteRoute(String agentId) {
        String service = serviceName(agentId);
        deleteIgnoringMissing("/routes/" + routeName(agentId), "delete Kong route " + routeName(agentId));
        deleteIgnoringMissing("/services/" + service, "delete Kong service " + service);
        log.debug("Kong service {} removed", service);
    }

    // PUT creates or replaces by name
    private void upsert(GatewayRoute route) {
        String service = serviceName(route.agentId());
        ObjectMapper mapper = client.mapper();

        ObjectNode serviceBody = mapper.createObjectNode()
                .put("name", service)
                .put("protocol", "http")
                .put("host", route.backendHost())
                .put("port", route.backendPort())
                .put("connect_timeout", 60000)
                .put("write_timeout", 60000)
                .put("read_timeout", 60000)
                .put("retries", 3);
        client.expectSuccess(client.put("/services/" + service, serviceBody), "upsert Kong service " + service);

        ObjectNode routeBody = mapper.createObjectNode()
                .put("name", routeName(route.agentId()))
                .put("strip_path", true)
                .put("preserve_host", false);
        routeBody.putArray("paths").add(route.pathPrefix());
        client.expectSuccess(client.put("/services/" + service + "/routes/" + routeName(route.agentId()), routeBody),
                "upsert Kong route " + routeName(route.agentId()));
        log.debug("Kong service {} -> {}:{}", service, route.backendHost(), route.backendPort());
    }

    private void deleteIgnoringMissing(String path, String operation) {
        Response response = client.delete(path);
        if (!response.isSuccess() && !response.isNotFound()) {
            throw JsonHttpClient.failure(response, operation);
        }
    }

    static String serviceName(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new PlatformException("agent id required for Kong service name");
        }
        return SERVICE_PREFIX + agentId;
    }

    static String routeName(String agentId) {
        return serviceName(agentId) + "-route";
    }
}
