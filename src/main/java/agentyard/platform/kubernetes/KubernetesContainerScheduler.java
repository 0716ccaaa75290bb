package agentyard.platform.kubernetes;

import agentyard.platform.ContainerScheduler;
import agentyard.platform.PlatformException;
import agentyard.platform.RunningWorkload;
import agentyard.platform.WorkloadHandle;
import agentyard.platform.WorkloadSpec;
import agentyard.platform.WorkloadState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs each workload as a single-replica Deployment fronted by a ClusterIP
 * Service of the same name.
 */
public class KubernetesContainerScheduler implements ContainerScheduler {

    private static final Logger log = LoggerFactory.getLogger(KubernetesContainerScheduler.class);

    static final String PORT_ANNOTATION = "agentyard.io/port";
    private static final String APP_LABEL = "app";
    private static final Set<String> FATAL_WAIT_REASONS = Set.of(
            "ErrImagePull", "ImagePullBackOff", "InvalidImageName", "CrashLoopBackOff", "CreateContainerConfigError");

    private final KubernetesApiClient api;

    public KubernetesContainerScheduler(KubernetesApiClient api) {
        this.api = api;
    }

    @Override
    public WorkloadHandle apply(WorkloadSpec spec) {
        api.apply(api.deployments(), spec.name(), deploymentManifest(spec));
        api.apply(api.services(), spec.name(), serviceManifest(spec));
        log.info("Applied deployment {} ({}) in {}", spec.name(), spec.image(), api.namespace());
        return new WorkloadHandle(spec.name());
    }

    @Override
    public WorkloadState state(WorkloadHandle handle) {
        Optional<JsonNode> deployment = api.get(api.deployments(), handle.name());
        if (deployment.isEmpty()) {
            return WorkloadState.missing();
        }

        for (JsonNode condition : deployment.get().path("status").path("conditions")) {
            String type = condition.path("type").asText();
            String status = condition.path("status").asText();
            if ("ReplicaFailure".equals(type) && "True".equals(status)
                    || "Progressing".equals(type) && "False".equals(status)) {
                return WorkloadState.failed(condition.path("reason").asText() + ": " + condition.path("message").asText());
            }
        }

        JsonNode pods = api.list(api.pods(), APP_LABEL + "=" + handle.name());
        boolean scheduled = false;
        for (JsonNode pod : pods.path("items")) {
            for (JsonNode cs : pod.path("status").path("containerStatuses")) {
                String reason = cs.path("state").path("waiting").path("reason").asText("");
                if (FATAL_WAIT_REASONS.contains(reason)) {
                    return WorkloadState.failed(reason + ": "
                            + cs.path("state").path("waiting").path("message").asText(""));
                }
            }
            for (JsonNode condition : pod.path("status").path("conditions")) {
                if ("PodScheduled".equals(condition.path("type").asText())
                        && "True".equals(condition.path("status").asText())) {
                    scheduled = true;
                }
            }
        }
        return scheduled ? WorkloadState.scheduled() : WorkloadState.pending();
    }

    @Override
    public boolean isReady(WorkloadHandle handle) {
        return api.get(api.deployments(), handle.name())
                .map(d -> d.path("status").path("readyReplicas").asInt(0) >= 1)
                .orElse(false);
    }

    @Override
    public String endpoint(WorkloadHandle handle) {
        JsonNode deployment = api.get(api.deployments(), handle.name())
                .orElseThrow(() -> new PlatformException("deployment " + handle + " not found"));
        int port = port(deployment);
        if (port <= 0) {
            throw new PlatformException("deployment " + handle + " has no " + PORT_ANNOTATION + " annotation");
        }
        return host(handle.name()) + ":" + port;
    }

    @Override
    public List<RunningWorkload> listRunning() {
        JsonNode list = api.list(api.deployments(), WorkloadSpec.AGENT_ID_LABEL);
        List<RunningWorkload> running = new ArrayList<>();
        for (JsonNode deployment : list.path("items")) {
            if (deployment.path("status").path("readyReplicas").asInt(0) < 1) {
                continue;
            }
            JsonNode metadata = deployment.path("metadata");
            String name = metadata.path("name").asText();
            int port = port(deployment);
            if (port <= 0) {
                log.warn("Deployment {} has no {} annotation, skipping", name, PORT_ANNOTATION);
                continue;
            }
            Map<String, String> labels = new HashMap<>();
            metadata.path("labels").fields().forEachRemaining(e -> labels.put(e.getKey(), e.getValue().asText()));
            running.add(new RunningWorkload(name, labels, host(name), port,
                    parseTime(metadata.path("creationTimestamp").asText(null))));
        }
        return running;
    }

    @Override
    public void remove(String workloadName) {
        api.delete(api.deployments(), workloadName);
        api.delete(api.services(), workloadName);
        log.info("Removed deployment {} from {}", workloadName, api.namespace());
    }

    private ObjectNode deploymentManifest(WorkloadSpec spec) {
        ObjectNode deployment = api.newObject()
                .put("apiVersion", "apps/v1")
                .put("kind", "Deployment");
        ObjectNode metadata = deployment.putObject("metadata")
                .put("name", spec.name())
                .put("namespace", api.namespace());
        labels(metadata.putObject("labels"), spec);
        metadata.putObject("annotations").put(PORT_ANNOTATION, String.valueOf(spec.port()));

        ObjectNode deploymentSpec = deployment.putObject("spec")
                .put("replicas", 1)
                .put("progressDeadlineSeconds", 600);
        deploymentSpec.putObject("selector").putObject("matchLabels").put(APP_LABEL, spec.name());

        ObjectNode template = deploymentSpec.putObject("template");
        labels(template.putObject("metadata").putObject("labels"), spec);

        ObjectNode container = template.putObject("spec").putArray("containers").addObject()
                .put("name", "agent")
                .put("image", spec.image());
        container.putArray("ports").addObject().put("containerPort", spec.port());
        ArrayNode env = container.putArray("env");
        spec.env().forEach((k, v) -> env.addObject().put("name", k).put("value", v));
        container.putObject("readinessProbe")
                .put("periodSeconds", 5)
                .putObject("tcpSocket").put("port", spec.port());
        return deployment;
    }

    private ObjectNode serviceManifest(WorkloadSpec spec) {
        ObjectNode service = api.newObject()
                .put("apiVersion", "v1")
                .put("kind", "Service");
        ObjectNode metadata = service.putObject("metadata")
                .put("name", spec.name())
                .put("namespace", api.namespace());
        labels(metadata.putObject("labels"), spec);

        ObjectNode serviceSpec = service.putObject("spec").put("type", "ClusterIP");
        serviceSpec.putObject("selector").put(APP_LABEL, spec.name());
        serviceSpec.putArray("ports").addObject()
                .put("port", spec.port())
                .put("targetPort", spec.port());
        return service;
    }

    private static void labels(ObjectNode node, WorkloadSpec spec) {
        spec.labels().forEach((k, v) -> node.put(k, v));
        node.put(APP_LABEL, spec.name());
        node.put(WorkloadSpec.AGENT_ID_LABEL, spec.agentId());
        node.put("app.kubernetes.io/managed-by", KubernetesApiClient.FIELD_MANAGER);
    }

    private String host(String name) {
        return name + "." + api.namespace() + ".svc.cluster.local";
    }

    private static int port(JsonNode deployment) {
        String value = deployment.path("metadata").path("annotations").path(PORT_ANNOTATION).asText("");
        try {
            return value.isEmpty() ? -1 : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static Instant parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
