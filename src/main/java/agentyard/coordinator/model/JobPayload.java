package agentyard.coordinator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed job payload.
 *
 * <pre>
 * BUILD:  {"sourceRef": "...", "imageReference": "...", "deployAfterBuild": true, "port": 8080, "force": false}
 * DEPLOY: {"imageReference": "...", "port": 8080, "env": {"KEY": "value"}}
 * </pre>
 */
public record JobPayload(
        String sourceRef,
        String imageReference,
        boolean deployAfterBuild,
        Integer port,
        boolean force,
        Map<String, String> env) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public JobPayload {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public boolean hasPort() {
        return port != null;
    }

    public static JobPayload parse(JobKind kind, String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new InvalidJobException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidJobException("payload must be a JSON object");
        }

        String sourceRef = text(root, "sourceRef");
        String imageReference = text(root, "imageReference");
        boolean deployAfterBuild = bool(root, "deployAfterBuild", true);
        boolean force = bool(root, "force", false);
        Integer port = port(root);
        Map<String, String> env = env(root);

        if (kind == JobKind.BUILD && sourceRef == null) {
            throw new InvalidJobException("sourceRef is required for BUILD jobs");
        }

        return new JobPayload(sourceRef, imageReference, deployAfterBuild, port, force, env);
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new InvalidJobException(field + " must be a string");
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static boolean bool(JsonNode root, String field, boolean defaultValue) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new InvalidJobException(field + " must be a boolean");
        }
        return node.asBoolean();
    }

    private static Integer port(JsonNode root) {
        JsonNode node = root.get("port");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidJobException("port must be an integer");
        }
        int port = node.asInt();
        if (port < 1 || port > 65535) {
            throw new InvalidJobException("port out of range: " + port);
        }
        return port;
    }

    private static Map<String, String> env(JsonNode root) {
        JsonNode node = root.get("env");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new InvalidJobException("env must be an object");
        }
        Map<String, String> env = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            if (!e.getValue().isValueNode()) {
                throw new InvalidJobException("env." + e.getKey() + " must be a scalar");
            }
            env.put(e.getKey(), e.getValue().asText());
        });
        return env;
    }
}
