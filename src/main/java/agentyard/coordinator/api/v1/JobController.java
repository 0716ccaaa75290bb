package agentyard.coordinator.api.v1;

import agentyard.coordinator.api.Controller;
import agentyard.coordinator.api.v1.dto.CreateJobRequest;
import agentyard.coordinator.api.v1.dto.JobResponse;
import agentyard.coordinator.model.Job;
import agentyard.coordinator.service.AgentService;
import agentyard.coordinator.service.JobQueueService;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the work queue (public API).
 *
 * POST /api/v1/jobs - Enqueue a build or deploy job
 * GET /api/v1/jobs/{jobId} - Get job status
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final JobQueueService queue;

    public JobController(JobQueueService queue) {
        this.queue = queue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST) && JOBS_PATTERN.matcher(path).matches()) {
            return true;
        }
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST)) {
            return createJob(readBody(req, CreateJobRequest.class));
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (!jobMatcher.matches()) {
            return ControllerResponse.notFound("unknown job endpoint");
        }
        String jobId = jobMatcher.group(1);
        return queue.findById(jobId)
                .map(job -> ControllerResponse.ok(JobResponse.from(job)))
                .orElseGet(() -> ControllerResponse.notFound("job not found: " + jobId));
    }

    /**
     * POST /api/v1/jobs, answered with 202 before any work starts.
     */
    private ControllerResponse createJob(CreateJobRequest request) {
        request.validate();
        AgentService.validateAgentId(request.agentId());

        Job job = queue.enqueue(request.jobId(), request.agentId(), request.jobKind(), request.payloadJson());
        log.debug("Accepted {} job {} over HTTP", job.kind(), job.id());
        return ControllerResponse.accepted(JobResponse.from(job));
    }
}
