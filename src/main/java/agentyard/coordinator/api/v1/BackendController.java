package agentyard.coordinator.api.v1;

import agentyard.coordinator.api.Controller;
import agentyard.coordinator.api.v1.dto.BackendResponse;
import agentyard.coordinator.service.AgentService;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/backends - last discovered backend of every agent
 */
public class BackendController implements Controller {

    private final AgentService agentService;

    public BackendController(AgentService agentService) {
        this.agentService = agentService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/backends".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        List<BackendResponse> backends = agentService.backends().stream()
                .map(BackendResponse::from)
                .toList();
        return ControllerResponse.ok(Map.of("backends", backends));
    }
}
