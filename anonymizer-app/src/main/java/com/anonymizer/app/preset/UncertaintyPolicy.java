package com.anonymizer.app.preset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the worker does with a finding below the confidence threshold.
 */
public enum UncertaintyPolicy {
    MASK("mask"),
    REDACT("redact"),
    LEAVE_INTACT("leave_intact"),
    FLAG_ONLY("flag_only");

    private final String wireName;

    UncertaintyPolicy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static UncertaintyPolicy fromWire(String value) {
        return WireEnums.parse(UncertaintyPolicy.class, value, UncertaintyPolicy::wireName);
    }
}
