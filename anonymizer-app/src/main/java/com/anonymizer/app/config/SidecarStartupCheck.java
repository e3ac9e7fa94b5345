package com.anonymizer.app.config;

import com.anonymizer.common.config.AnonymizerConfig;
import com.anonymizer.common.config.ConfigService;
import com.anonymizer.sidecar.Executables;
import com.anonymizer.sidecar.SidecarCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies the configured log level and reports, once the shell is up,
 * whether the worker program can be found. Never starts the worker.
 */
@Slf4j
@Component
public class SidecarStartupCheck {

    private final ConfigService configService;
    private final SidecarCommand sidecarCommand;
    private final LoggingSystem loggingSystem;

    public SidecarStartupCheck(ConfigService configService, SidecarCommand sidecarCommand,
            LoggingSystem loggingSystem) {
        this.configService = configService;
        this.sidecarCommand = sidecarCommand;
        this.loggingSystem = loggingSystem;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        applyLogLevel(configService.loadConfig().getLogging());

        Optional<Path> resolved = Executables.resolve(sidecarCommand);
        if (resolved.isPresent()) {
            log.info("Worker program: {} (args {}, timeout {})", resolved.get(), sidecarCommand.args(),
                    sidecarCommand.hasTimeout() ? sidecarCommand.timeout().toSeconds() + "s" : "none");
        } else {
            log.warn("Worker program '{}' not found; analysis commands will fail until it is installed "
                    + "or sidecar.executable is changed in {}", sidecarCommand.executable(),
                    configService.getConfigPath());
        }
    }

    void applyLogLevel(AnonymizerConfig.LoggingConfig logging) {
        if (logging == null || logging.getLevel() == null || logging.getLevel().isBlank()) {
            return;
        }
        try {
            LogLevel level = LogLevel.valueOf(logging.getLevel().trim().toUpperCase(Locale.ROOT));
            loggingSystem.setLogLevel("com.anonymizer", level);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown log level '{}'", logging.getLevel());
        }
    }
}
