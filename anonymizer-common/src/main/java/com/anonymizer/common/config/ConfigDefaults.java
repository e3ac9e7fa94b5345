package com.anonymizer.common.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Default values applied when the config file leaves a setting out.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    /** Worker entrypoint, relative to the shell's working directory. */
    public static final String DEFAULT_WORKER_SCRIPT = "../../engine/python/scripts/sidecar_entrypoint.py";

    /** Batch entrypoint; reads the whole request from stdin and takes no command argument. */
    public static final String DEFAULT_BATCH_SCRIPT = "../../engine/python/scripts/batch_entrypoint.py";

    public static final long DEFAULT_TIMEOUT_SECONDS = 600;

    /**
     * Fill in missing sections so callers never see a null section.
     */
    public static AnonymizerConfig applyDefaults(AnonymizerConfig config) {
        if (config.getSidecar() == null) {
            config.setSidecar(new AnonymizerConfig.SidecarConfig());
        }
        AnonymizerConfig.SidecarConfig sidecar = config.getSidecar();
        if (sidecar.getExecutable() == null || sidecar.getExecutable().isBlank()) {
            sidecar.setExecutable("python");
        }
        if (sidecar.getArgs() == null) {
            sidecar.setArgs(new ArrayList<>());
        }
        if (sidecar.getBatchArgs() == null) {
            sidecar.setBatchArgs(new ArrayList<>());
        }
        if (sidecar.getEnvironment() == null) {
            sidecar.setEnvironment(new LinkedHashMap<>());
        }
        if (sidecar.getTimeoutSeconds() < 0) {
            sidecar.setTimeoutSeconds(0);
        }
        if (config.getLogging() == null) {
            config.setLogging(new AnonymizerConfig.LoggingConfig());
        }
        return config;
    }
}
