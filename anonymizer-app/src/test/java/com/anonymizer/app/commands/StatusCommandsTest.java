package com.anonymizer.app.commands;

import com.anonymizer.app.preset.Preset;
import com.anonymizer.sidecar.SidecarCommand;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusCommandsTest {

    @Test
    @SuppressWarnings("unchecked")
    void listPresets_includesBuiltInsAndDefaults() {
        var result = new StatusCommands(SidecarCommand.of("python"), SidecarCommand.of("python"))
                .handleListPresets(null);

        assertTrue(result.ok());
        var data = (Map<String, Object>) result.data();
        assertEquals(3, ((List<Preset>) data.get("presets")).size());
        assertEquals(18, ((Map<String, Boolean>) data.get("default_entities")).size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void sidecarStatus_reportsLaunchSettings() {
        var command = new SidecarCommand("/bin/sh", List.of("worker.sh"), Path.of("/tmp"), Map.of(),
                Duration.ofSeconds(30));

        var batch = SidecarCommand.of("/bin/sh", "batch.sh");

        var data = (Map<String, Object>) new StatusCommands(command, batch).handleSidecarStatus(null).data();

        assertEquals("/bin/sh", data.get("executable"));
        assertEquals(List.of("worker.sh"), data.get("args"));
        assertEquals(List.of("batch.sh"), data.get("batch_args"));
        assertEquals(30L, data.get("timeout_seconds"));
        assertEquals(Path.of("/tmp").toString(), data.get("working_directory"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void sidecarStatus_missingProgram_isUnavailable() {
        var command = SidecarCommand.of("/definitely/not/here/worker-bin");

        var data = (Map<String, Object>) new StatusCommands(command, command).handleSidecarStatus(null).data();

        assertEquals(false, data.get("available"));
        assertNull(data.get("resolved_path"));
        assertEquals(0L, ((Number) data.get("timeout_seconds")).longValue());
    }
}
