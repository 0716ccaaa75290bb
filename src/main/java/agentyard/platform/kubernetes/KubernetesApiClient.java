package agentyard.platform.kubernetes;

import agentyard.platform.JsonHttpClient;
import agentyard.platform.JsonHttpClient.Response;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Minimal namespaced Kubernetes REST client: server-side apply, get, list by
 * label selector and delete.
 */
public class KubernetesApiClient {

    static final String FIELD_MANAGER = "agentyard";
    private static final String APPLY_PATCH = "application/apply-patch+yaml";

    private final JsonHttpClient client;
    private final String namespace;

    public KubernetesApiClient(JsonHttpClient client, String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }

    public ObjectNode newObject() {
        return client.mapper().createObjectNode();
    }

    /**
     * Create or update the object at {@code collection/name} through
     * server-side apply. JSON is valid YAML, so the body is sent as is.
     */
    public JsonNode apply(String collection, String name, ObjectNode body) {
        String path = collection + "/" + name + "?fieldManager=" + FIELD_MANAGER + "&force=true";
        return client.json(client.patch(path, body, APPLY_PATCH), "apply " + name);
    }

    public Optional<JsonNode> get(String collection, String name) {
        Response response = client.get(collection + "/" + name);
        if (response.isNotFound()) {
            return Optional.empty();
        }
        return Optional.of(client.json(response, "get " + name));
    }

    public JsonNode list(String collection, String labelSelector) {
        String path = collection + "?labelSelector=" + URLEncoder.encode(labelSelector, StandardCharsets.UTF_8);
        return client.json(client.get(path), "list " + collection);
    }

    /**
     * Raw text of a sub-resource such as pod logs. Empty on 404.
     */
    public Optional<String> text(String path) {
        Response response = client.get(path);
        if (response.isNotFound()) {
            return Optional.empty();
        }
        client.expectSuccess(response, "get " + path);
        return Optional.of(response.body());
    }

    /**
     * Delete with background propagation; a missing object is not an error.
     */
    public void delete(String collection, String name) {
        Response response = client.delete(collection + "/" + name + "?propagationPolicy=Background");
        if (!response.isSuccess() && !response.isNotFound()) {
            throw JsonHttpClient.failure(response, "delete " + name);
        }
    }

    public String jobs() {
        return "/apis/batch/v1/namespaces/" + namespace + "/jobs";
    }

    public String deployments() {
        return "/apis/apps/v1/namespaces/" + namespace + "/deployments";
    }

    public String services() {
        return "/api/v1/namespaces/" + namespace + "/services";
    }

    public String pods() {
        return "/api/v1/namespaces/" + namespace + "/pods";
    }
}
