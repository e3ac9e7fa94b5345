package com.anonymizer.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the full shell on a random port. Only commands that do not start
 * the worker are exercised.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "anonymizer.config.path=target/no-such-dir/anonymizer.json")
class AnonymizerApplicationTest {

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void sidecarStatus_reportsDefaults() throws Exception {
        ResponseEntity<String> response = rest.postForEntity("/api/commands/sidecar_status", null, String.class);

        assertEquals(200, response.getStatusCode().value());
        JsonNode body = mapper.readTree(response.getBody());
        assertTrue(body.get("ok").asBoolean());
        assertEquals("python", body.get("data").get("executable").asText());
        assertEquals(600, body.get("data").get("timeout_seconds").asInt());
        assertTrue(body.get("data").get("batch_args").get(0).asText().endsWith("batch_entrypoint.py"));
    }

    @Test
    void listPresets_returnsBuiltIns() throws Exception {
        ResponseEntity<String> response = rest.postForEntity("/api/commands/list_presets", null, String.class);

        JsonNode body = mapper.readTree(response.getBody());
        assertEquals(3, body.get("data").get("presets").size());
        assertEquals("layer1_fast_legal_scrub", body.get("data").get("presets").get(0).get("preset_id").asText());
    }

    @Test
    void unknownCommand_is404() {
        ResponseEntity<String> response = rest.postForEntity("/api/commands/nope", null, String.class);

        assertEquals(404, response.getStatusCode().value());
    }
}
