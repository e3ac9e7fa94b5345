package com.anonymizer.app.router;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Worker reply to {@code analyze_file}.
 *
 * @param outputPath redacted copy of the input file inside the run folder
 */
public record AnalyzeFileResult(
        @JsonProperty("run_id") String runId,
        @JsonProperty("run_folder") String runFolder,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("summary") Map<String, Integer> summary,
        @JsonProperty("findings_count") int findingsCount) {
}
