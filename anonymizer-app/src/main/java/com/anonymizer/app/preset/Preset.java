package com.anonymizer.app.preset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detection and redaction settings the worker applies to one run.
 * <p>
 * The shell only checks the shape; the values are forwarded to the worker
 * as-is under their snake_case wire names. The worker requires every core
 * field including {@code language}; the word lists are left out unless set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "preset_id", "name", "layer", "minimum_confidence", "uncertainty_policy",
        "pseudonym_style", "language_mode", "language", "entities_enabled" })
public class Preset {

    public static final int MIN_LAYER = 1;
    public static final int MAX_LAYER = 3;

    @JsonProperty("preset_id")
    private String presetId;

    @JsonProperty("name")
    private String name;

    /** 1 = fast pattern scrub, 2 = transformer model, 3 = regulatory analyzer. */
    @JsonProperty("layer")
    private int layer;

    /** 0..100 */
    @JsonProperty("minimum_confidence")
    private int minimumConfidence;

    @JsonProperty("uncertainty_policy")
    private UncertaintyPolicy uncertaintyPolicy;

    @JsonProperty("pseudonym_style")
    private PseudonymStyle pseudonymStyle;

    @JsonProperty("language_mode")
    private LanguageMode languageMode;

    /** Required when {@link #languageMode} is {@link LanguageMode#FIXED}. Sent as null when unset. */
    @JsonProperty("language")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String language;

    @JsonProperty("entities_enabled")
    @Builder.Default
    private Map<String, Boolean> entitiesEnabled = new LinkedHashMap<>();

    @JsonProperty("whitelist")
    private List<String> whitelist;

    @JsonProperty("blacklist")
    private List<String> blacklist;

    @JsonProperty("language_whitelists")
    private Map<String, List<String>> languageWhitelists;

    @JsonProperty("language_blacklists")
    private Map<String, List<String>> languageBlacklists;

    /**
     * Shape problems that would make the worker reject this preset.
     *
     * @return human-readable problems, empty when the preset is well-formed
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (presetId == null || presetId.isBlank()) {
            problems.add("preset_id is required");
        }
        if (name == null || name.isBlank()) {
            problems.add("name is required");
        }
        if (layer < MIN_LAYER || layer > MAX_LAYER) {
            problems.add("layer must be between " + MIN_LAYER + " and " + MAX_LAYER + ", got " + layer);
        }
        if (minimumConfidence < 0 || minimumConfidence > 100) {
            problems.add("minimum_confidence must be between 0 and 100, got " + minimumConfidence);
        }
        if (uncertaintyPolicy == null) {
            problems.add("uncertainty_policy is required");
        }
        if (pseudonymStyle == null) {
            problems.add("pseudonym_style is required");
        }
        if (languageMode == null) {
            problems.add("language_mode is required");
        } else if (languageMode == LanguageMode.FIXED && (language == null || language.isBlank())) {
            problems.add("language is required when language_mode is fixed");
        }
        if (entitiesEnabled == null) {
            problems.add("entities_enabled is required");
        } else if (entitiesEnabled.containsValue(null)) {
            problems.add("entities_enabled values must be true or false");
        }
        return problems;
    }
}
