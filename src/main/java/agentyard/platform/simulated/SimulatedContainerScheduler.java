package agentyard.platform.simulated;

import agentyard.platform.ContainerScheduler;
import agentyard.platform.PlatformException;
import agentyard.platform.RunningWorkload;
import agentyard.platform.TransientPlatformException;
import agentyard.platform.WorkloadHandle;
import agentyard.platform.WorkloadSpec;
import agentyard.platform.WorkloadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory container scheduler. Applied workloads are scheduled and ready at
 * once, reachable at {@code <name>.sim.local:<port>}, unless a fault was
 * configured for their image.
 */
public class SimulatedContainerScheduler implements ContainerScheduler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedContainerScheduler.class);

    private final Clock clock;
    private final Map<String, Workload> workloads = new ConcurrentHashMap<>();
    private final Map<String, String> schedulingFailures = new ConcurrentHashMap<>();
    private final Set<String> neverReady = ConcurrentHashMap.newKeySet();
    private final AtomicInteger applies = new AtomicInteger();
    private volatile boolean unavailable = false;
    private volatile boolean listingUnavailable = false;

    public SimulatedContainerScheduler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WorkloadHandle apply(WorkloadSpec spec) {
        checkAvailable();
        applies.incrementAndGet();
        workloads.compute(spec.name(), (name, existing) -> existing != null
                ? new Workload(spec, existing.startedAt)
                : new Workload(spec, clock.instant()));
        log.debug("Simulated workload {} applied with image {}", spec.name(), spec.image());
        return new WorkloadHandle(spec.name());
    }

    @Override
    public WorkloadState state(WorkloadHandle handle) {
        checkAvailable();
        Workload w = workloads.get(handle.name());
        if (w == null) {
            return WorkloadState.missing();
        }
        String failure = schedulingFailures.get(w.spec.image());
        return failure != null ? WorkloadState.failed(failure) : WorkloadState.scheduled();
    }

    @Override
    public boolean isReady(WorkloadHandle handle) {
        checkAvailable();
        Workload w = workloads.get(handle.name());
        return w != null && !neverReady.contains(w.spec.image());
    }

    @Override
    public String endpoint(WorkloadHandle handle) {
        checkAvailable();
        Workload w = workloads.get(handle.name());
        if (w == null) {
            throw new PlatformException("workload " + handle + " not found");
        }
        return host(w) + ":" + w.spec.port();
    }

    @Override
    public List<RunningWorkload> listRunning() {
        checkAvailable();
        if (listingUnavailable) {
            throw new TransientPlatformException("workload listing unavailable (simulated)");
        }
        List<RunningWorkload> running = new ArrayList<>();
        for (Workload w : workloads.values()) {
            if (!schedulingFailures.containsKey(w.spec.image()) && !neverReady.contains(w.spec.image())) {
                running.add(new RunningWorkload(w.spec.name(), w.spec.labels(), host(w), w.spec.port(), w.startedAt));
            }
        }
        return running;
    }

    @Override
    public void remove(String workloadName) {
        checkAvailable();
        if (workloads.remove(workloadName) != null) {
            log.debug("Simulated workload {} removed", workloadName);
        }
    }

    /** Workloads of {@code image} fail to schedule with {@code detail} */
    public void failSchedulingFor(String image, String detail) {
        schedulingFailures.put(image, detail);
    }

    /** Workloads of {@code image} schedule but never pass readiness */
    public void neverReadyFor(String image) {
        neverReady.add(image);
    }

    /** Workload crashes and disappears without the coordinator asking */
    public void kill(String workloadName) {
        workloads.remove(workloadName);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setListingUnavailable(boolean listingUnavailable) {
        this.listingUnavailable = listingUnavailable;
    }

    public int applyCount() {
        return applies.get();
    }

    public Set<String> workloadNames() {
        return Set.copyOf(workloads.keySet());
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new TransientPlatformException("scheduler unreachable (simulated)");
        }
    }

    private static String host(Workload w) {
        return w.spec.name() + ".sim.local";
    }

    private static final class Workload {
        private final WorkloadSpec spec;
        private final Instant startedAt;

        private Workload(WorkloadSpec spec, Instant startedAt) {
            this.spec = spec;
            this.startedAt = startedAt;
        }
    }
}
