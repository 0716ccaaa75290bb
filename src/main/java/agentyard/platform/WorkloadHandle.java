package agentyard.platform;

/**
 * Name of a workload accepted by the container scheduler.
 */
public record WorkloadHandle(String name) {

    @Override
    public String toString() {
        return name;
    }
}
