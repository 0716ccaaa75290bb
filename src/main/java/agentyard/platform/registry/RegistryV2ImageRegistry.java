package agentyard.platform.registry;

import agentyard.platform.ImageRegistry;
import agentyard.platform.JsonHttpClient;
import agentyard.platform.JsonHttpClient.Response;
import agentyard.platform.PlatformException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks image presence with a manifest HEAD against the Docker Registry
 * HTTP API v2.
 */
public class RegistryV2ImageRegistry implements ImageRegistry {

    static final String MANIFEST_TYPES = String.join(", ",
            "application/vnd.oci.image.index.v1+json",
            "application/vnd.oci.image.manifest.v1+json",
            "application/vnd.docker.distribution.manifest.list.v2+json",
            "application/vnd.docker.distribution.manifest.v2+json");

    private final String scheme;
    private final String token;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Map<String, JsonHttpClient> clients = new ConcurrentHashMap<>();

    public RegistryV2ImageRegistry(String scheme, String token, Duration timeout, ObjectMapper mapper) {
        this.scheme = scheme;
        this.token = token;
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public boolean exists(String imageReference) {
        ImageName image = ImageName.parse(imageReference);
        JsonHttpClient client = clients.computeIfAbsent(image.host(),
                host -> new JsonHttpClient(scheme + "://" + host, token, timeout, mapper));

        Response response = client.head("/v2/" + image.repository() + "/manifests/" + image.reference(),
                MANIFEST_TYPES);
        if (response.isSuccess()) {
            return true;
        }
        if (response.isNotFound()) {
            return false;
        }
        throw JsonHttpClient.failure(response, "manifest lookup of " + imageReference);
    }

    /**
     * {@code host[:port]/repository[:tag|@digest]}. The host part is
     * mandatory since images are always pushed to an explicit registry.
     */
    record ImageName(String host, String repository, String reference) {

        static ImageName parse(String imageReference) {
            if (imageReference == null || imageReference.isBlank()) {
                throw new PlatformException("empty image reference");
            }
            int slash = imageReference.indexOf('/');
            if (slash <= 0) {
                throw new PlatformException("image reference has no registry host: " + imageReference);
            }
            String host = imageReference.substring(0, slash);
            String rest = imageReference.substring(slash + 1);

            int at = rest.indexOf('@');
            if (at >= 0) {
                return new ImageName(host, rest.substring(0, at), rest.substring(at + 1));
            }
            int colon = rest.lastIndexOf(':');
            if (colon > rest.lastIndexOf('/')) {
                return new ImageName(host, rest.substring(0, colon), rest.substring(colon + 1));
            }
            return new ImageName(host, rest, "latest");
        }
    }
}
