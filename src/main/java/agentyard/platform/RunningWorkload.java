package agentyard.platform;

import java.time.Instant;
import java.util.Map;

/**
 * A workload the scheduler currently reports as running.
 */
public record RunningWorkload(
        String name,
        Map<String, String> labels,
        String host,
        int port,
        Instant startedAt) {

    public RunningWorkload {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String agentId() {
        return labels.get(WorkloadSpec.AGENT_ID_LABEL);
    }
}
