package com.anonymizer.app.preset;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PresetTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static Preset valid() {
        return PresetCatalog.find(PresetCatalog.LAYER1_FAST).orElseThrow();
    }

    @Test
    void validPreset_hasNoProblems() {
        assertTrue(valid().validate().isEmpty());
    }

    @Test
    void validate_reportsEveryProblem() {
        Preset preset = new Preset();
        preset.setLayer(7);
        preset.setMinimumConfidence(101);
        preset.setEntitiesEnabled(null);

        List<String> problems = preset.validate();

        assertTrue(problems.contains("preset_id is required"));
        assertTrue(problems.contains("name is required"));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("layer must be between 1 and 3")));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("minimum_confidence")));
        assertTrue(problems.contains("uncertainty_policy is required"));
        assertTrue(problems.contains("pseudonym_style is required"));
        assertTrue(problems.contains("language_mode is required"));
        assertTrue(problems.contains("entities_enabled is required"));
    }

    @Test
    void fixedLanguageMode_requiresLanguage() {
        Preset preset = valid().toBuilder().languageMode(LanguageMode.FIXED).build();
        assertEquals(List.of("language is required when language_mode is fixed"), preset.validate());

        assertTrue(preset.toBuilder().language("nl").build().validate().isEmpty());
    }

    @Test
    void serialize_usesWireNamesAndSendsUnsetLanguageAsNull() {
        JsonNode json = mapper.valueToTree(valid());

        assertEquals("layer1_fast_legal_scrub", json.get("preset_id").asText());
        assertEquals(75, json.get("minimum_confidence").asInt());
        assertEquals("mask", json.get("uncertainty_policy").asText());
        assertEquals("neutral", json.get("pseudonym_style").asText());
        assertEquals("auto", json.get("language_mode").asText());
        assertTrue(json.get("entities_enabled").get("PERSON").asBoolean());
        assertTrue(json.has("language"));
        assertTrue(json.get("language").isNull());
        assertFalse(json.has("whitelist"));
        assertFalse(json.has("language_whitelists"));
        assertFalse(json.has("presetId"));
    }

    @Test
    void serialize_builtIns_carryEveryCoreField() {
        for (Preset preset : PresetCatalog.builtIns()) {
            JsonNode json = mapper.valueToTree(preset);
            for (String field : List.of("preset_id", "name", "layer", "minimum_confidence", "uncertainty_policy",
                    "pseudonym_style", "language_mode", "language", "entities_enabled")) {
                assertTrue(json.has(field), preset.getPresetId() + " lacks " + field);
            }
        }
    }

    @Test
    void serialize_keepsEntityOrder() {
        Map<String, Boolean> entities = new LinkedHashMap<>();
        entities.put("URL", false);
        entities.put("PERSON", true);
        entities.put("EMAIL", true);
        JsonNode json = mapper.valueToTree(valid().toBuilder().entitiesEnabled(entities).build());

        var names = json.get("entities_enabled").fieldNames();
        assertEquals("URL", names.next());
        assertEquals("PERSON", names.next());
        assertEquals("EMAIL", names.next());
    }

    @Test
    void deserialize_acceptsWireForm() throws Exception {
        String json = """
                {"preset_id":"custom","name":"Custom","layer":2,"minimum_confidence":80,
                 "uncertainty_policy":"leave_intact","pseudonym_style":"realistic",
                 "language_mode":"fixed","language":"de","entities_enabled":{"PERSON":true},
                 "whitelist":["ACME"],"language_blacklists":{"de":["Herr"]}}""";

        Preset preset = mapper.readValue(json, Preset.class);

        assertEquals(UncertaintyPolicy.LEAVE_INTACT, preset.getUncertaintyPolicy());
        assertEquals(PseudonymStyle.REALISTIC, preset.getPseudonymStyle());
        assertEquals(LanguageMode.FIXED, preset.getLanguageMode());
        assertEquals(List.of("ACME"), preset.getWhitelist());
        assertEquals(List.of("Herr"), preset.getLanguageBlacklists().get("de"));
        assertTrue(preset.validate().isEmpty());
    }

    @Test
    void deserialize_rejectsUnknownPolicy() {
        String json = "{\"uncertainty_policy\":\"shred\"}";

        var e = assertThrows(JsonMappingException.class, () -> mapper.readValue(json, Preset.class));
        assertTrue(e.getMessage().contains("mask, redact, leave_intact, flag_only"));
    }
}
