package com.anonymizer.app.router;

import com.anonymizer.app.preset.Preset;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Analyze every supported file below a folder.
 *
 * @param maxFiles stop after this many files; null for no limit
 * @param language language for all files; null lets the worker decide
 * @param runsBase where the run folder is created; null for the worker default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeBatchRequest(
        @JsonProperty("input_folder") String inputFolder,
        @JsonProperty("preset") Preset preset,
        @JsonProperty("recursive") boolean recursive,
        @JsonProperty("max_files") Integer maxFiles,
        @JsonProperty("language") String language,
        @JsonProperty("runs_base") String runsBase) implements WorkerRequest {

    public AnalyzeBatchRequest(String inputFolder, Preset preset) {
        this(inputFolder, preset, true, null, null, null);
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (inputFolder == null || inputFolder.isBlank()) {
            problems.add("input_folder is required");
        }
        if (maxFiles != null && maxFiles < 1) {
            problems.add("max_files must be positive, got " + maxFiles);
        }
        problems.addAll(Requests.presetProblems(preset));
        return problems;
    }
}
