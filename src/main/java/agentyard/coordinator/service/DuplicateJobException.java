package agentyard.coordinator.service;

/**
 * A job with the same id is already queued.
 */
public class DuplicateJobException extends RuntimeException {

    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("job already exists: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
