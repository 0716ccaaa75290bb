package agentyard.platform.kubernetes;

import agentyard.platform.BuildHandle;
import agentyard.platform.BuildProgress;
import agentyard.platform.BuildRequest;
import agentyard.platform.ImageBuilder;
import agentyard.platform.PlatformException;
import agentyard.platform.WorkloadSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.UUID;

/**
 * Runs each build as a one-shot Kubernetes Job around rootless BuildKit,
 * which builds the source context and pushes the image itself.
 */
public class KubernetesImageBuilder implements ImageBuilder {

    private static final Logger log = LoggerFactory.getLogger(KubernetesImageBuilder.class);

    private static final int LOG_TAIL_LINES = 20;

    private final KubernetesApiClient api;
    private final String buildkitImage;

    public KubernetesImageBuilder(KubernetesApiClient api, String buildkitImage) {
        this.api = api;
        this.buildkitImage = buildkitImage;
    }

    @Override
    public BuildHandle submit(BuildRequest request) {
        String name = "build-" + request.agentId() + "-" + UUID.randomUUID().toString().substring(0, 6);
        api.apply(api.jobs(), name, jobManifest(name, request));
        log.info("Submitted BuildKit job {} for {}", name, request.targetImage());
        return new BuildHandle(name);
    }

    @Override
    public BuildProgress status(BuildHandle handle) {
        JsonNode job = api.get(api.jobs(), handle.id())
                .orElseThrow(() -> new PlatformException("build job " + handle + " not found"));
        JsonNode status = job.path("status");

        if (status.path("succeeded").asInt(0) > 0) {
            return BuildProgress.succeeded();
        }
        if (status.path("failed").asInt(0) > 0 || hasCondition(status, "Failed")) {
            return BuildProgress.failed(failureDetail(handle, status));
        }
        return status.path("active").asInt(0) > 0 ? BuildProgress.running() : BuildProgress.pending();
    }

    private ObjectNode jobManifest(String name, BuildRequest request) {
        ObjectNode job = api.newObject()
                .put("apiVersion", "batch/v1")
                .put("kind", "Job");
        ObjectNode metadata = job.putObject("metadata")
                .put("name", name)
                .put("namespace", api.namespace());
        metadata.putObject("labels")
                .put(WorkloadSpec.AGENT_ID_LABEL, request.agentId())
                .put("app.kubernetes.io/managed-by", KubernetesApiClient.FIELD_MANAGER);

        ObjectNode spec = job.putObject("spec")
                .put("backoffLimit", 0)
                .put("ttlSecondsAfterFinished", 3600);
        ObjectNode podSpec = spec.putObject("template").putObject("spec")
                .put("restartPolicy", "Never");

        ObjectNode container = podSpec.putArray("containers").addObject()
                .put("name", "buildkit")
                .put("image", buildkitImage);
        container.putArray("command").add("buildctl-daemonless.sh");
        ArrayNode args = container.putArray("args");
        args.add("build")
                .add("--frontend").add("dockerfile.v0")
                .add("--opt").add("context=" + request.sourceRef())
                .add("--output").add("type=image,name=" + request.targetImage() + ",push=true");
        container.putArray("env").addObject()
                .put("name", "BUILDKITD_FLAGS")
                .put("value", "--oci-worker-no-process-sandbox");
        container.putObject("securityContext")
                .putObject("seccompProfile").put("type", "Unconfined");
        return job;
    }

    private String failureDetail(BuildHandle handle, JsonNode status) {
        String detail = "build failed";
        for (JsonNode condition : status.path("conditions")) {
            if ("Failed".equals(condition.path("type").asText())) {
                detail = condition.path("reason").asText("Failed") + ": " + condition.path("message").asText("");
            }
        }
        String errorLine = lastErrorLine(handle);
        return errorLine != null ? detail + "; " + errorLine : detail;
    }

    // Best effort; the job condition alone rarely says why a build failed
    private String lastErrorLine(BuildHandle handle) {
        try {
            JsonNode pods = api.list(api.pods(), "job-name=" + handle.id());
            for (JsonNode pod : pods.path("items")) {
                String podName = pod.path("metadata").path("name").asText();
                String logs = api.text(api.pods() + "/" + podName + "/log?tailLines=" + LOG_TAIL_LINES).orElse("");
                String[] lines = logs.split("\n");
                for (int i = lines.length - 1; i >= 0; i--) {
                    if (lines[i].toLowerCase(Locale.ROOT).contains("error")) {
                        return lines[i].strip();
                    }
                }
            }
        } catch (PlatformException e) {
            log.debug("Could not read logs of build job {}: {}", handle, e.getMessage());
        }
        return null;
    }

    private static boolean hasCondition(JsonNode status, String type) {
        for (JsonNode condition : status.path("conditions")) {
            if (type.equals(condition.path("type").asText()) && "True".equals(condition.path("status").asText())) {
                return true;
            }
        }
        return false;
    }
}
