package com.anonymizer.app.config;

import com.anonymizer.app.router.CommandRouter;
import com.anonymizer.app.router.WorkerCodec;
import com.anonymizer.common.config.AnonymizerConfig;
import com.anonymizer.common.config.ConfigPaths;
import com.anonymizer.common.config.ConfigService;
import com.anonymizer.common.logging.LogRedact;
import com.anonymizer.sidecar.ProcessSidecarBridge;
import com.anonymizer.sidecar.SidecarBridge;
import com.anonymizer.sidecar.SidecarCommand;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Spring configuration for the worker bridges and the command router.
 * <p>
 * Two launch specs share one program: the command dispatcher entrypoint and
 * the batch entrypoint.
 */
@Configuration
public class SidecarBeanConfig {

    @Value("${anonymizer.config.path:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        if (configPath == null || configPath.isBlank()) {
            return new ConfigService(ConfigPaths.resolveConfigPath());
        }
        return new ConfigService(ConfigPaths.resolveUserPath(configPath, System.getProperty("user.home")));
    }

    @Bean
    @Primary
    public SidecarCommand sidecarCommand(ConfigService configService) {
        return SidecarCommands.fromConfig(configService.loadConfig().getSidecar());
    }

    @Bean
    public SidecarCommand batchSidecarCommand(ConfigService configService) {
        return SidecarCommands.batchFromConfig(configService.loadConfig().getSidecar());
    }

    @Bean
    @Primary
    public SidecarBridge sidecarBridge(SidecarCommand sidecarCommand, ConfigService configService) {
        return bridge(sidecarCommand, configService);
    }

    @Bean
    public SidecarBridge batchSidecarBridge(@Qualifier("batchSidecarCommand") SidecarCommand batchSidecarCommand,
            ConfigService configService) {
        return bridge(batchSidecarCommand, configService);
    }

    @Bean
    public CommandRouter commandRouter(SidecarBridge sidecarBridge,
            @Qualifier("batchSidecarBridge") SidecarBridge batchSidecarBridge) {
        return new CommandRouter(sidecarBridge, batchSidecarBridge, new WorkerCodec());
    }

    private static SidecarBridge bridge(SidecarCommand command, ConfigService configService) {
        AnonymizerConfig.LoggingConfig logging = configService.loadConfig().getLogging();
        boolean redact = logging == null || logging.isRedactSensitive();
        return new ProcessSidecarBridge(command, ProcessSidecarBridge.defaultMapper(),
                LogRedact.RedactMode.of(redact));
    }
}
