package com.anonymizer.app.preset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in presets offered by the shell.
 */
public final class PresetCatalog {

    private PresetCatalog() {
    }

    public static final String LAYER1_FAST = "layer1_fast_legal_scrub";
    public static final String LAYER2_ACCURATE = "layer2_accurate_legal_review";
    public static final String LAYER3_REGULATORY = "layer3_regulatory_standard";

    private static final Map<String, Boolean> DEFAULT_ENTITIES;
    static {
        Map<String, Boolean> entities = new LinkedHashMap<>();
        entities.put("NATIONAL_ID", true);
        entities.put("PASSPORT_NUMBER", true);
        entities.put("MEDICAL_ID", true);
        entities.put("BANK_ACCOUNT", true);
        entities.put("CREDIT_CARD", true);
        entities.put("PERSON", true);
        entities.put("DATE_OF_BIRTH", true);
        entities.put("EMAIL", true);
        entities.put("PHONE_NUMBER", true);
        entities.put("VEHICLE_ID", true);
        entities.put("ADDRESS", true);
        entities.put("IP_ADDRESS", true);
        entities.put("ORGANIZATION", true);
        entities.put("LOCATION", true);
        entities.put("ACCOUNT_USERNAME", true);
        // Optional categories, off by default
        entities.put("DATE", false);
        entities.put("MONEY", false);
        entities.put("URL", false);
        DEFAULT_ENTITIES = Collections.unmodifiableMap(entities);
    }

    /**
     * Entity categories and whether they are enabled by default, in display order.
     */
    public static Map<String, Boolean> defaultEntities() {
        return new LinkedHashMap<>(DEFAULT_ENTITIES);
    }

    /**
     * All built-in presets, fastest first. Each call returns fresh copies.
     */
    public static List<Preset> builtIns() {
        return List.of(
                base(LAYER1_FAST, "Layer 1: Fast Scrub", 1, 75, UncertaintyPolicy.MASK),
                base(LAYER2_ACCURATE, "Layer 2: Accurate (Transformers)", 2, 85, UncertaintyPolicy.MASK),
                base(LAYER3_REGULATORY, "Layer 3: Regulatory", 3, 90, UncertaintyPolicy.REDACT));
    }

    public static Optional<Preset> find(String presetId) {
        return builtIns().stream()
                .filter(p -> p.getPresetId().equals(presetId))
                .findFirst();
    }

    private static Preset base(String id, String name, int layer, int confidence, UncertaintyPolicy policy) {
        return Preset.builder()
                .presetId(id)
                .name(name)
                .layer(layer)
                .minimumConfidence(confidence)
                .uncertaintyPolicy(policy)
                .pseudonymStyle(PseudonymStyle.NEUTRAL)
                .languageMode(LanguageMode.AUTO)
                .entitiesEnabled(defaultEntities())
                .build();
    }
}
