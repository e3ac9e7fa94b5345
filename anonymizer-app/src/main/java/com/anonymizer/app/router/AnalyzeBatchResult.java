package com.anonymizer.app.router;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record AnalyzeBatchResult(
        @JsonProperty("run_id") String runId,
        @JsonProperty("run_folder") String runFolder,
        @JsonProperty("processed_files") int processedFiles,
        @JsonProperty("skipped_files") int skippedFiles,
        @JsonProperty("total_files_seen") int totalFilesSeen,
        @JsonProperty("summary") Map<String, Integer> summary,
        @JsonProperty("output_folder") String outputFolder) {
}
