package agentyard.platform;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.platform.kong.KongGatewayAdmin;
import agentyard.platform.kubernetes.KubernetesApiClient;
import agentyard.platform.kubernetes.KubernetesContainerScheduler;
import agentyard.platform.kubernetes.KubernetesImageBuilder;
import agentyard.platform.registry.RegistryV2ImageRegistry;
import agentyard.platform.simulated.SimulatedContainerScheduler;
import agentyard.platform.simulated.SimulatedGatewayAdmin;
import agentyard.platform.simulated.SimulatedImageBuilder;
import agentyard.platform.simulated.SimulatedImageRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Selects collaborator implementations from configuration.
 */
public final class PlatformFactory {

    private static final Logger log = LoggerFactory.getLogger(PlatformFactory.class);

    private static final int SIMULATED_BUILD_POLLS = 2;

    private PlatformFactory() {
    }

    /**
     * @throws IllegalArgumentException for unknown or incomplete settings, or a
     *                                  real build backend paired with the
     *                                  simulated registry
     */
    public static Platform create(CoordinatorConfig config, ObjectMapper mapper, Clock clock) {
        // The simulated registry only sees pushes of the simulated builder
        if (CoordinatorConfig.PLATFORM_SIMULATED.equals(config.registry())
                && !CoordinatorConfig.PLATFORM_SIMULATED.equals(config.platform())) {
            throw new IllegalArgumentException("AGENTYARD_REGISTRY=simulated cannot verify images pushed by the "
                    + config.platform() + " platform; use " + CoordinatorConfig.REGISTRY_V2);
        }

        SimulatedImageRegistry simulatedRegistry = new SimulatedImageRegistry();

        ImageRegistry registry = switch (config.registry()) {
            case CoordinatorConfig.PLATFORM_SIMULATED -> simulatedRegistry;
            case CoordinatorConfig.REGISTRY_V2 -> new RegistryV2ImageRegistry(config.registryScheme(),
                    config.registryToken(), config.platformHttpTimeout(), mapper);
            default -> throw new IllegalArgumentException("Unknown registry: " + config.registry());
        };

        ImageBuilder builder;
        ContainerScheduler scheduler;
        switch (config.platform()) {
            case CoordinatorConfig.PLATFORM_SIMULATED -> {
                builder = new SimulatedImageBuilder(simulatedRegistry, SIMULATED_BUILD_POLLS);
                scheduler = new SimulatedContainerScheduler(clock);
            }
            case CoordinatorConfig.PLATFORM_KUBERNETES -> {
                requireSetting(config.kubernetesApiUrl(), "AGENTYARD_K8S_API_URL");
                KubernetesApiClient api = new KubernetesApiClient(
                        new JsonHttpClient(config.kubernetesApiUrl(), config.kubernetesToken(),
                                config.platformHttpTimeout(), mapper),
                        config.kubernetesNamespace());
                builder = new KubernetesImageBuilder(api, config.buildkitImage());
                scheduler = new KubernetesContainerScheduler(api);
            }
            default -> throw new IllegalArgumentException("Unknown platform: " + config.platform());
        }

        GatewayAdmin gateway = switch (config.gateway()) {
            case CoordinatorConfig.PLATFORM_SIMULATED -> new SimulatedGatewayAdmin();
            case CoordinatorConfig.GATEWAY_KONG -> new KongGatewayAdmin(
                    new JsonHttpClient(config.kongAdminUrl(), null, config.platformHttpTimeout(), mapper));
            default -> throw new IllegalArgumentException("Unknown gateway: " + config.gateway());
        };

        log.info("Platform: {} scheduler, {} gateway, {} registry",
                config.platform(), config.gateway(), config.registry());
        return new Platform(builder, registry, scheduler, gateway);
    }

    private static void requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
