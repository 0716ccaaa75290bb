package agentyard.platform.registry;

import agentyard.platform.PlatformException;
import agentyard.platform.StubHttpServer;
import agentyard.platform.TransientPlatformException;
import agentyard.platform.registry.RegistryV2ImageRegistry.ImageName;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistryV2ImageRegistryTest {

    private StubHttpServer registryServer;
    private RegistryV2ImageRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registryServer = new StubHttpServer();
        registry = new RegistryV2ImageRegistry("http", "push-token", Duration.ofSeconds(2), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        registryServer.close();
    }

    private String image(String repositoryAndTag) {
        return registryServer.hostPort() + "/" + repositoryAndTag;
    }

    @Test
    void presentManifestExists() {
        registryServer.reply("HEAD", "/v2/agents/echo/manifests/v1", 200, "");

        assertTrue(registry.exists(image("agents/echo:v1")));

        StubHttpServer.Recorded head = registryServer.requests().get(0);
        assertEquals("HEAD", head.method());
        assertTrue(head.header("Accept").contains("application/vnd.oci.image.manifest.v1+json"));
        assertTrue(head.header("Accept").contains("application/vnd.docker.distribution.manifest.v2+json"));
        assertEquals("Bearer push-token", head.header("Authorization"));
    }

    @Test
    void missingManifestDoesNotExist() {
        assertFalse(registry.exists(image("agents/echo:never-pushed")));
        assertEquals(List.of("HEAD /v2/agents/echo/manifests/never-pushed"), registryServer.requestLines());
    }

    @Test
    void registryOutageIsTransient() {
        registryServer.reply("HEAD", "/v2/echo/manifests/latest", 503, "");

        assertThrows(TransientPlatformException.class, () -> registry.exists(image("echo")));
    }

    @Test
    void unauthorizedIsPermanent() {
        registryServer.reply("HEAD", "/v2/echo/manifests/v1", 401, "");

        PlatformException e = assertThrows(PlatformException.class, () -> registry.exists(image("echo:v1")));
        assertFalse(e instanceof TransientPlatformException);
        assertTrue(e.getMessage().contains("HTTP 401"), e.getMessage());
    }

    @Test
    @DisplayName("Image references split into host, repository and tag or digest")
    void parsesImageReferences() {
        assertEquals(new ImageName("registry.local:5000", "echo", "v1"),
                ImageName.parse("registry.local:5000/echo:v1"));
        assertEquals(new ImageName("registry.local:5000", "team/echo", "latest"),
                ImageName.parse("registry.local:5000/team/echo"));
        assertEquals(new ImageName("registry.local", "team/echo", "sha256:abc123"),
                ImageName.parse("registry.local/team/echo@sha256:abc123"));
    }

    @Test
    void imageWithoutRegistryHostIsRejected() {
        assertThrows(PlatformException.class, () -> ImageName.parse("echo:v1"));
        assertThrows(PlatformException.class, () -> ImageName.parse(" "));
        assertThrows(PlatformException.class, () -> ImageName.parse(null));
    }
}
