package com.anonymizer.app.commands;

import com.anonymizer.app.preset.PresetCatalog;
import com.anonymizer.sidecar.Executables;
import com.anonymizer.sidecar.SidecarCommand;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Host commands answered by the shell itself, without starting the worker.
 */
@Component
public class StatusCommands {

    private final SidecarCommand sidecarCommand;
    private final SidecarCommand batchCommand;

    public StatusCommands(SidecarCommand sidecarCommand,
            @Qualifier("batchSidecarCommand") SidecarCommand batchCommand) {
        this.sidecarCommand = sidecarCommand;
        this.batchCommand = batchCommand;
    }

    public CommandResult handleListPresets(JsonNode args) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("presets", PresetCatalog.builtIns());
        data.put("default_entities", PresetCatalog.defaultEntities());
        return CommandResult.ok(data);
    }

    public CommandResult handleSidecarStatus(JsonNode args) {
        Path resolved = Executables.resolve(sidecarCommand).orElse(null);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executable", sidecarCommand.executable());
        data.put("resolved_path", resolved == null ? null : resolved.toString());
        data.put("available", resolved != null);
        data.put("args", sidecarCommand.args());
        data.put("batch_args", batchCommand.args());
        data.put("working_directory", sidecarCommand.workingDirectory() == null
                ? null
                : sidecarCommand.workingDirectory().toString());
        data.put("timeout_seconds", sidecarCommand.hasTimeout() ? sidecarCommand.timeout().toSeconds() : 0);
        return CommandResult.ok(data);
    }
}
