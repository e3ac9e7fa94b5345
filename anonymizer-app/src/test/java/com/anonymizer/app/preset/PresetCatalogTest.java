package com.anonymizer.app.preset;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PresetCatalogTest {

    @Test
    void builtIns_areValidAndOrderedByLayer() {
        List<Preset> presets = PresetCatalog.builtIns();

        assertEquals(3, presets.size());
        for (int i = 0; i < presets.size(); i++) {
            Preset preset = presets.get(i);
            assertEquals(i + 1, preset.getLayer());
            assertTrue(preset.validate().isEmpty(), preset.getPresetId() + ": " + preset.validate());
        }
    }

    @Test
    void regulatoryPreset_redactsUncertainFindings() {
        Preset preset = PresetCatalog.find(PresetCatalog.LAYER3_REGULATORY).orElseThrow();
        assertEquals(UncertaintyPolicy.REDACT, preset.getUncertaintyPolicy());
        assertEquals(90, preset.getMinimumConfidence());
    }

    @Test
    void find_unknownId_isEmpty() {
        assertTrue(PresetCatalog.find("nope").isEmpty());
    }

    @Test
    void defaultEntities_disableOptionalCategories() {
        Map<String, Boolean> entities = PresetCatalog.defaultEntities();

        assertEquals(18, entities.size());
        assertEquals("NATIONAL_ID", entities.keySet().iterator().next());
        assertFalse(entities.get("DATE"));
        assertFalse(entities.get("MONEY"));
        assertFalse(entities.get("URL"));
        assertTrue(entities.get("PERSON"));
    }

    @Test
    void builtIns_returnsFreshCopies() {
        PresetCatalog.builtIns().get(0).getEntitiesEnabled().put("PERSON", false);

        assertTrue(PresetCatalog.builtIns().get(0).getEntitiesEnabled().get("PERSON"));
    }
}
