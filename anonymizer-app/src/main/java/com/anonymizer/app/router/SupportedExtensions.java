package com.anonymizer.app.router;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * File types the worker can analyze, e.g. {@code [".docx", ".pdf", ".txt"]}.
 */
public record SupportedExtensions(@JsonProperty("extensions") List<String> extensions) {
}
