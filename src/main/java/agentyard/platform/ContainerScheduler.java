package agentyard.platform;

import java.util.List;

/**
 * Orchestration substrate that runs agent workloads.
 * Every call may throw {@link TransientPlatformException} when the substrate is
 * unreachable and {@link PlatformException} when it rejects the request.
 */
public interface ContainerScheduler {

    WorkloadHandle apply(WorkloadSpec spec);

    WorkloadState state(WorkloadHandle handle);

    boolean isReady(WorkloadHandle handle);

    /** {@code host:port} other services use to reach the workload */
    String endpoint(WorkloadHandle handle);

    List<RunningWorkload> listRunning();

    /** Idempotent; removing an unknown workload is not an error */
    void remove(String workloadName);
}
