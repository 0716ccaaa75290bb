package agentyard.platform.simulated;

import agentyard.platform.BuildHandle;
import agentyard.platform.BuildProgress;
import agentyard.platform.BuildRequest;
import agentyard.platform.ImageBuilder;
import agentyard.platform.PlatformException;
import agentyard.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process build backend. A build reports RUNNING for a fixed number of
 * status polls, then pushes its image to the simulated registry and reports
 * SUCCEEDED, unless a failure was configured for its source.
 */
public class SimulatedImageBuilder implements ImageBuilder {

    private static final Logger log = LoggerFactory.getLogger(SimulatedImageBuilder.class);

    private final SimulatedImageRegistry registry;
    private final int pollsUntilDone;
    private final Map<String, SimulatedBuild> builds = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Set<String> skipPush = ConcurrentHashMap.newKeySet();
    private final AtomicInteger submissions = new AtomicInteger();
    private volatile boolean unavailable = false;

    public SimulatedImageBuilder(SimulatedImageRegistry registry, int pollsUntilDone) {
        this.registry = registry;
        this.pollsUntilDone = Math.max(0, pollsUntilDone);
    }

    @Override
    public BuildHandle submit(BuildRequest request) {
        if (unavailable) {
            throw new TransientPlatformException("build backend unreachable (simulated)");
        }
        if (request.sourceRef().isBlank()) {
            throw new PlatformException("empty source reference");
        }
        int n = submissions.incrementAndGet();
        String id = "simbuild-" + request.agentId() + "-" + n;
        builds.put(id, new SimulatedBuild(request));
        log.debug("Simulated build {} submitted for {}", id, request.sourceRef());
        return new BuildHandle(id);
    }

    @Override
    public BuildProgress status(BuildHandle handle) {
        if (unavailable) {
            throw new TransientPlatformException("build backend unreachable (simulated)");
        }
        SimulatedBuild build = builds.get(handle.id());
        if (build == null) {
            throw new PlatformException("unknown build job " + handle);
        }

        if (build.polls.incrementAndGet() <= pollsUntilDone) {
            return BuildProgress.running();
        }
        String failure = failures.get(build.request.sourceRef());
        if (failure != null) {
            return BuildProgress.failed(failure);
        }
        if (!skipPush.contains(build.request.sourceRef())) {
            registry.push(build.request.targetImage());
        }
        return BuildProgress.succeeded();
    }

    /** Builds of {@code sourceRef} end FAILED with {@code detail} */
    public void failBuildsFor(String sourceRef, String detail) {
        failures.put(sourceRef, detail);
    }

    /** Builds of {@code sourceRef} succeed but never reach the registry */
    public void skipPushFor(String sourceRef) {
        skipPush.add(sourceRef);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int submissionCount() {
        return submissions.get();
    }

    private static final class SimulatedBuild {
        private final BuildRequest request;
        private final AtomicInteger polls = new AtomicInteger();

        private SimulatedBuild(BuildRequest request) {
            this.request = request;
        }
    }
}
