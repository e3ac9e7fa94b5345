package com.anonymizer.app.commands;

import com.anonymizer.app.preset.Preset;
import com.anonymizer.app.preset.PresetCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads host arguments; every problem surfaces as an
 * {@link IllegalArgumentException} naming the argument.
 */
final class HostArgs {

    private HostArgs() {
    }

    static String requireText(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing argument '" + name + "'");
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a string");
        }
        return value.asText();
    }

    static String optionalText(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a string");
        }
        return value.asText();
    }

    static Integer optionalInt(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
        }
        return value.asInt();
    }

    static boolean optionalBoolean(JsonNode args, String name, boolean defaultValue) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be true or false");
        }
        return value.asBoolean();
    }

    /**
     * A preset object, or the id of a built-in preset.
     */
    static Preset requirePreset(JsonNode args, ObjectMapper mapper) {
        JsonNode value = args.get("preset");
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing argument 'preset'");
        }
        if (value.isTextual()) {
            return PresetCatalog.find(value.asText())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown preset '" + value.asText() + "'"));
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("Argument 'preset' must be an object or a preset id");
        }
        try {
            return mapper.treeToValue(value, Preset.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid preset: " + e.getOriginalMessage(), e);
        }
    }
}
