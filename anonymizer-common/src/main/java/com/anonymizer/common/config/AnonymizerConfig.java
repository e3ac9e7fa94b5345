package com.anonymizer.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration type for the desktop shell.
 */
@Data
public class AnonymizerConfig {

    /** Worker process settings. */
    private SidecarConfig sidecar;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class SidecarConfig {
        /** Program started for every worker call (e.g. "python" or a bundled binary). */
        private String executable = "python";

        /** Arguments placed before the command name. */
        private List<String> args = new ArrayList<>(List.of(ConfigDefaults.DEFAULT_WORKER_SCRIPT));

        /** Arguments for batch runs, which use their own entrypoint with the same program. */
        private List<String> batchArgs = new ArrayList<>(List.of(ConfigDefaults.DEFAULT_BATCH_SCRIPT));

        /** Working directory of the worker; null inherits the shell's. */
        private String workingDirectory;

        /** Extra environment variables for the worker. */
        private Map<String, String> environment = new LinkedHashMap<>();

        /** Per-call limit; 0 waits forever. */
        private long timeoutSeconds = ConfigDefaults.DEFAULT_TIMEOUT_SECONDS;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";

        /** Mask personal data in worker diagnostics before they are logged. */
        private boolean redactSensitive = true;
    }
}
