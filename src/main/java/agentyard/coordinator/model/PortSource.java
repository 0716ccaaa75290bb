package agentyard.coordinator.model;

/**
 * Where a deployment's listen port came from.
 */
public enum PortSource {
    /** Port given on the job payload */
    EXPLICIT,
    /** Port previously recorded in the agent registry */
    REGISTRY,
    /** Platform default */
    DEFAULT
}
