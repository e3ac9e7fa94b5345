package com.anonymizer.app.router;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Worker reply to {@code analyze_text}.
 *
 * @param summary findings per entity category
 */
public record AnalyzeTextResult(
        @JsonProperty("run_id") String runId,
        @JsonProperty("run_folder") String runFolder,
        @JsonProperty("redacted_text") String redactedText,
        @JsonProperty("summary") Map<String, Integer> summary,
        @JsonProperty("findings_count") int findingsCount,
        @JsonProperty("language") String language) {
}
