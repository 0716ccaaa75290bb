package agentyard.coordinator.api.v1.dto;

import agentyard.coordinator.model.JobKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "jobId": "job-42",
                  "agentId": "doc-agent",
                  "kind": "build",
                  "payload": { "sourceRef": "git@example.org:agents/doc.git#main", "port": 9001 }
                }
                """;

        CreateJobRequest req = mapper.readValue(json, CreateJobRequest.class);
        req.validate();

        assertEquals("job-42", req.jobId());
        assertEquals("doc-agent", req.agentId());
        assertEquals(JobKind.BUILD, req.jobKind()); // case-insensitive
        assertEquals(9001, mapper.readTree(req.payloadJson()).get("port").asInt());
    }

    @Test
    void missingPayloadIsEmptyObject() throws Exception {
        CreateJobRequest req = mapper.readValue("{\"agentId\": \"doc-agent\", \"kind\": \"DEPLOY\"}",
                CreateJobRequest.class);

        req.validate();
        assertNull(req.jobId());
        assertEquals("{}", req.payloadJson());
    }

    @Test
    void validateMissingAgentId() {
        CreateJobRequest req = new CreateJobRequest(null, " ", "BUILD", null);
        assertThrows(IllegalArgumentException.class, req::validate);
    }

    @Test
    void validateUnknownKind() {
        CreateJobRequest req = new CreateJobRequest(null, "doc-agent", "restart", null);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, req::validate);
        assertTrue(e.getMessage().contains("restart"));

        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, "doc-agent", null, null).validate());
    }

    @Test
    void validateNonObjectPayload() throws Exception {
        CreateJobRequest req = new CreateJobRequest(null, "doc-agent", "BUILD", mapper.readTree("[1, 2]"));
        assertThrows(IllegalArgumentException.class, req::validate);
    }

    @Test
    void registerRequestPortRange() {
        new RegisterAgentRequest("doc-agent", null, 8080).validate();
        new RegisterAgentRequest("doc-agent", "Docs", null).validate();

        assertThrows(IllegalArgumentException.class, () -> new RegisterAgentRequest("doc-agent", null, 0).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterAgentRequest("doc-agent", null, 65536).validate());
        assertThrows(IllegalArgumentException.class, () -> new RegisterAgentRequest(null, null, 80).validate());
    }
}
