package com.anonymizer.app.preset;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

final class WireEnums {

    private WireEnums() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value, Function<E, String> wireName) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (E constant : type.getEnumConstants()) {
            if (wireName.apply(constant).equalsIgnoreCase(normalized)) {
                return constant;
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(wireName)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Unknown " + type.getSimpleName() + " '" + value + "' (expected one of: " + allowed + ")");
    }
}
