package agentyard.coordinator.api;

import agentyard.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;

/**
 * One group of {@code /api/v1} endpoints.
 *
 * <p>
 * Controllers return a status and a body object; the {@link RouterHandler}
 * writes it as JSON. Failures are thrown, not rendered:
 * {@link IllegalArgumentException} and unparseable bodies become 400,
 * {@link agentyard.coordinator.service.DuplicateJobException} 409, anything
 * else 500.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(FullHttpRequest req, String path) throws Exception;

    /**
     * Bind the request body to {@code type}.
     */
    default <T> T readBody(FullHttpRequest req, Class<T> type) throws JsonProcessingException {
        return RouterHandler.mapper().readValue(req.content().toString(StandardCharsets.UTF_8), type);
    }

    /**
     * Body of every non-2xx response.
     */
    record ApiError(String error) {
    }

    /**
     * @param body serialized with the shared mapper
     */
    record ControllerResponse(HttpResponseStatus status, Object body) {

        public static ControllerResponse ok(Object body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse created(Object body) {
            return new ControllerResponse(HttpResponseStatus.CREATED, body);
        }

        public static ControllerResponse accepted(Object body) {
            return new ControllerResponse(HttpResponseStatus.ACCEPTED, body);
        }

        public static ControllerResponse notFound(String message) {
            return new ControllerResponse(HttpResponseStatus.NOT_FOUND, new ApiError(message));
        }
    }
}
