package agentyard.platform;

import java.util.Objects;

/**
 * Source location and destination image of one build.
 */
public record BuildRequest(String agentId, String sourceRef, String targetImage) {

    public BuildRequest {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sourceRef, "sourceRef");
        Objects.requireNonNull(targetImage, "targetImage");
    }
}
