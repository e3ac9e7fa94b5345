package com.anonymizer.app.config;

import com.anonymizer.common.config.AnonymizerConfig;
import com.anonymizer.common.config.ConfigDefaults;
import com.anonymizer.common.config.ConfigPaths;
import com.anonymizer.sidecar.SidecarCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Builds the worker launch description from the {@code sidecar} config section.
 */
public final class SidecarCommands {

    private SidecarCommands() {
    }

    public static SidecarCommand fromConfig(AnonymizerConfig.SidecarConfig config) {
        return fromConfig(config, System.getProperty("user.home"));
    }

    public static SidecarCommand batchFromConfig(AnonymizerConfig.SidecarConfig config) {
        return batchFromConfig(config, System.getProperty("user.home"));
    }

    /**
     * Batch launch spec: same program, working directory, environment and
     * time limit, with {@code batchArgs} in place of {@code args}.
     */
    public static SidecarCommand batchFromConfig(AnonymizerConfig.SidecarConfig config, String homedir) {
        SidecarCommand analysis = fromConfig(config, homedir);
        List<String> batchArgs = config != null && config.getBatchArgs() != null
                ? config.getBatchArgs()
                : List.of(ConfigDefaults.DEFAULT_BATCH_SCRIPT);
        return new SidecarCommand(analysis.executable(), batchArgs, analysis.workingDirectory(),
                analysis.environment(), analysis.timeout());
    }

    /**
     * @param homedir used to expand a leading {@code ~} in the working directory
     */
    public static SidecarCommand fromConfig(AnonymizerConfig.SidecarConfig config, String homedir) {
        AnonymizerConfig.SidecarConfig section = config != null ? config : new AnonymizerConfig.SidecarConfig();
        String executable = section.getExecutable() == null || section.getExecutable().isBlank()
                ? "python"
                : section.getExecutable().trim();

        Path workingDirectory = null;
        if (section.getWorkingDirectory() != null && !section.getWorkingDirectory().isBlank()) {
            workingDirectory = ConfigPaths.resolveUserPath(section.getWorkingDirectory(), homedir);
        }

        // 0 or less: no limit
        Duration timeout = section.getTimeoutSeconds() <= 0 ? null : Duration.ofSeconds(section.getTimeoutSeconds());

        return new SidecarCommand(executable, section.getArgs(), workingDirectory, section.getEnvironment(), timeout);
    }
}
