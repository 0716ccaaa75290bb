package agentyard.coordinator.api.v1;

import agentyard.coordinator.api.Controller;
import agentyard.coordinator.api.v1.dto.AgentResponse;
import agentyard.coordinator.api.v1.dto.AgentStatusResponse;
import agentyard.coordinator.api.v1.dto.BuildResponse;
import agentyard.coordinator.api.v1.dto.DeploymentResponse;
import agentyard.coordinator.api.v1.dto.RegisterAgentRequest;
import agentyard.coordinator.model.Agent;
import agentyard.coordinator.service.AgentService;
import agentyard.coordinator.service.AgentService.AgentStatus;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for agent registry metadata and per-agent history (public API).
 *
 * POST /api/v1/agents - Register or update an agent
 * GET /api/v1/agents/{agentId}/status - Latest build, current deployment, backend
 * GET /api/v1/agents/{agentId}/builds?limit=N - Build history, newest first
 * GET /api/v1/agents/{agentId}/deployments?limit=N - Deployment history
 */
public class AgentController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private static final Pattern AGENTS_PATTERN = Pattern.compile("^/api/v1/agents$");
    private static final Pattern AGENT_VIEW_PATTERN = Pattern.compile(
            "^/api/v1/agents/([^/]+)/(status|builds|deployments)$");
    private static final int DEFAULT_LIMIT = 20;

    private final AgentService agentService;

    public AgentController(AgentService agentService) {
        this.agentService = agentService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return AGENTS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return AGENTS_PATTERN.matcher(path).matches() || AGENT_VIEW_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        if (AGENTS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST)
                    ? register(readBody(req, RegisterAgentRequest.class))
                    : ControllerResponse.ok(Map.of("agents",
                            agentService.findAll().stream().map(AgentResponse::from).toList()));
        }

        Matcher m = AGENT_VIEW_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown agent endpoint");
        }
        String agentId = m.group(1);
        if (agentService.findById(agentId).isEmpty()) {
            return ControllerResponse.notFound("agent not found: " + agentId);
        }
        return switch (m.group(2)) {
            case "status" -> status(agentId);
            case "builds" -> ControllerResponse.ok(Map.of("agentId", agentId,
                    "builds", agentService.builds(agentId, limit(req)).stream().map(BuildResponse::from).toList()));
            default -> ControllerResponse.ok(Map.of("agentId", agentId,
                    "deployments", agentService.deployments(agentId, limit(req)).stream()
                            .map(DeploymentResponse::from)
                            .toList()));
        };
    }

    private ControllerResponse register(RegisterAgentRequest request) {
        request.validate();
        Agent agent = agentService.register(request.agentId(), request.name(), request.port());
        log.info("Agent {} registered over HTTP (port {})", agent.id(), agent.port());
        return ControllerResponse.created(AgentResponse.from(agent));
    }

    private ControllerResponse status(String agentId) {
        Optional<AgentStatus> status = agentService.status(agentId);
        return status.map(s -> ControllerResponse.ok(AgentStatusResponse.from(s)))
                .orElseGet(() -> ControllerResponse.notFound("agent not found: " + agentId));
    }

    private static int limit(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (values == null || values.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        try {
            return Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }
}
