package agentyard.platform;

/**
 * Scheduling state of a workload.
 */
public record WorkloadState(Phase phase, String detail) {

    public enum Phase {
        /** Accepted, not yet placed on a node */
        PENDING,
        /** Placed and starting */
        SCHEDULED,
        /** Cannot be placed or crashed */
        FAILED,
        /** Scheduler does not know the workload */
        MISSING
    }

    public static WorkloadState pending() {
        return new WorkloadState(Phase.PENDING, null);
    }

    public static WorkloadState scheduled() {
        return new WorkloadState(Phase.SCHEDULED, null);
    }

    public static WorkloadState failed(String detail) {
        return new WorkloadState(Phase.FAILED, detail);
    }

    public static WorkloadState missing() {
        return new WorkloadState(Phase.MISSING, null);
    }
}
