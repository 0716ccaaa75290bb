package agentyard.platform.simulated;

import agentyard.platform.ImageRegistry;
import agentyard.platform.TransientPlatformException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory image registry. Images appear when the simulated builder pushes
 * them or a test calls {@link #push(String)}.
 */
public class SimulatedImageRegistry implements ImageRegistry {

    private final Set<String> images = ConcurrentHashMap.newKeySet();
    private volatile boolean unavailable = false;

    @Override
    public boolean exists(String imageReference) {
        if (unavailable) {
            throw new TransientPlatformException("registry unreachable (simulated)");
        }
        return images.contains(imageReference);
    }

    public void push(String imageReference) {
        images.add(imageReference);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }
}
