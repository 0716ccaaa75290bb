package agentyard.coordinator.model;

/**
 * What a queued job asks the worker to do.
 */
public enum JobKind {
    /** Build an image from source (optionally followed by a deployment) */
    BUILD,
    /** Run an already built image */
    DEPLOY
}
