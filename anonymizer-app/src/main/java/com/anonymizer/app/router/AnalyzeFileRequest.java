package com.anonymizer.app.router;

import com.anonymizer.app.preset.Preset;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record AnalyzeFileRequest(
        @JsonProperty("input_path") String inputPath,
        @JsonProperty("preset") Preset preset) implements WorkerRequest {

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (inputPath == null || inputPath.isBlank()) {
            problems.add("input_path is required");
        }
        problems.addAll(Requests.presetProblems(preset));
        return problems;
    }
}
