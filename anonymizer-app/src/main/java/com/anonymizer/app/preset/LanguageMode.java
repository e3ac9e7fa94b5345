package com.anonymizer.app.preset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether the worker detects the document language or uses the preset's.
 */
public enum LanguageMode {
    AUTO("auto"),
    FIXED("fixed");

    private final String wireName;

    LanguageMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static LanguageMode fromWire(String value) {
        return WireEnums.parse(LanguageMode.class, value, LanguageMode::wireName);
    }
}
