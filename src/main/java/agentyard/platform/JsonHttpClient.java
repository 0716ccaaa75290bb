package agentyard.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking JSON request helper shared by the HTTP platform adapters.
 *
 * <p>
 * Maps failures onto the platform exception hierarchy: I/O errors, timeouts,
 * 429 and 5xx are {@link TransientPlatformException}; any other non-2xx
 * status is a {@link PlatformException}.
 */
public class JsonHttpClient {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
    private static final int MAX_ERROR_BODY = 300;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration timeout;
    private final String bearerToken;

    public JsonHttpClient(String baseUrl, String bearerToken, Duration timeout, ObjectMapper mapper) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.bearerToken = bearerToken == null || bearerToken.isBlank() ? null : bearerToken;
    }

    /**
     * Status and body of a completed exchange.
     */
    public record Response(int status, String body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }

        public boolean isNotFound() {
            return status == 404;
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    public Response get(String path) {
        return send(request(path).GET());
    }

    public Response head(String path, String accept) {
        HttpRequest.Builder builder = request(path).method("HEAD", HttpRequest.BodyPublishers.noBody());
        if (accept != null) {
            builder.header("Accept", accept);
        }
        return send(builder);
    }

    public Response delete(String path) {
        return send(request(path).DELETE());
    }

    public Response put(String path, Object body) {
        return send(request(path)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    public Response post(String path, Object body) {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    public Response patch(String path, Object body, String contentType) {
        return send(request(path)
                .header("Content-Type", contentType)
                .method("PATCH", HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    /**
     * Parse a successful response; any other status is mapped to an exception.
     */
    public JsonNode json(Response response, String operation) {
        expectSuccess(response, operation);
        try {
            return response.body().isEmpty() ? mapper.createObjectNode() : mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new PlatformException(operation + ": invalid JSON response: " + e.getOriginalMessage(), e);
        }
    }

    public void expectSuccess(Response response, String operation) {
        if (response.isSuccess()) {
            return;
        }
        throw failure(response, operation);
    }

    public static PlatformException failure(Response response, String operation) {
        String message = operation + " returned HTTP " + response.status() + clip(response.body());
        if (response.status() == 429 || response.status() >= 500) {
            return new TransientPlatformException(message);
        }
        return new PlatformException(message);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path)).timeout(timeout);
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder;
    }

    private Response send(HttpRequest.Builder builder) {
        HttpRequest request = builder.build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return new Response(response.statusCode(), response.body() == null ? "" : response.body());
        } catch (IOException e) {
            throw new TransientPlatformException(request.method() + " " + request.uri() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientPlatformException(request.method() + " " + request.uri() + " interrupted", e);
        }
    }

    private String toJson(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    private static String clip(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) + "..." : trimmed);
    }
}
