package com.anonymizer.app.router;

import com.anonymizer.app.preset.Preset;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * @param text      text to analyze
 * @param preset    detection settings
 * @param modelPath model directory for layer 2, omitted from the payload when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeTextRequest(
        @JsonProperty("text") String text,
        @JsonProperty("preset") Preset preset,
        @JsonProperty("model_path") String modelPath) implements WorkerRequest {

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (text == null) {
            problems.add("text is required");
        }
        problems.addAll(Requests.presetProblems(preset));
        return problems;
    }
}
