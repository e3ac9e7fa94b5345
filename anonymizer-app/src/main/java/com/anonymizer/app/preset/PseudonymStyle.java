package com.anonymizer.app.preset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PseudonymStyle {
    NEUTRAL("neutral"),
    REALISTIC("realistic");

    private final String wireName;

    PseudonymStyle(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PseudonymStyle fromWire(String value) {
        return WireEnums.parse(PseudonymStyle.class, value, PseudonymStyle::wireName);
    }
}
