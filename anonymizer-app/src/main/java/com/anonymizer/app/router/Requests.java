package com.anonymizer.app.router;

import com.anonymizer.app.preset.Preset;

import java.util.List;

final class Requests {

    private Requests() {
    }

    static List<String> presetProblems(Preset preset) {
        if (preset == null) {
            return List.of("preset is required");
        }
        return preset.validate().stream()
                .map(problem -> "preset: " + problem)
                .toList();
    }
}
