package agentyard.coordinator.server;

import agentyard.coordinator.api.Controller;
import agentyard.coordinator.api.Controller.ApiError;
import agentyard.coordinator.api.Controller.ControllerResponse;
import agentyard.coordinator.service.DuplicateJobException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches {@code /api/v1} requests to the first matching controller and
 * renders its result as JSON.
 *
 * <p>
 * Error responses always carry {@code {"error": "..."}}:
 * 400 for validation and unparseable bodies, 404 for unknown routes and
 * missing resources, 409 for a duplicate job id, 500 otherwise. Internal
 * failure details are logged, not returned.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Controllers are consulted in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        ControllerResponse response = route(req, path);
        send(ctx, req, response);
    }

    private ControllerResponse route(FullHttpRequest req, String path) {
        Optional<Controller> controller = controllers.stream()
                .filter(c -> c.matches(req.method(), path))
                .findFirst();
        if (controller.isEmpty()) {
            log.debug("No route for {} {}", req.method(), path);
            return ControllerResponse.notFound("no route for " + req.method() + " " + path);
        }

        try {
            return controller.get().handle(req, path);
        } catch (JsonProcessingException e) {
            return failure(HttpResponseStatus.BAD_REQUEST, "invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.info("Rejected {} {}: {}", req.method(), path, e.getMessage());
            return failure(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        } catch (DuplicateJobException e) {
            return failure(HttpResponseStatus.CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed", req.method(), path, e);
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    private void send(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        byte[] body;
        HttpResponseStatus status = response.status();
        try {
            body = MAPPER.writeValueAsBytes(response.body());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize response to {} {}", req.method(), req.uri(), e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            body = "{\"error\":\"internal error\"}".getBytes(StandardCharsets.UTF_8);
        }

        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);

        if (HttpUtil.isKeepAlive(req)) {
            ctx.writeAndFlush(http);
        } else {
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Closing channel after error: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static ControllerResponse failure(HttpResponseStatus status, String message) {
        return new ControllerResponse(status, new ApiError(message));
    }

    /**
     * Shared JSON mapper: ISO-8601 dates, unknown request fields ignored.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
