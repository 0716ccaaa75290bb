package agentyard.platform;

import java.util.Map;
import java.util.Objects;

/**
 * Desired workload submitted to the container scheduler.
 */
public record WorkloadSpec(
        String name,
        String agentId,
        String image,
        int port,
        Map<String, String> labels,
        Map<String, String> env) {

    public static final String AGENT_ID_LABEL = "agent-id";

    public WorkloadSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(image, "image");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
