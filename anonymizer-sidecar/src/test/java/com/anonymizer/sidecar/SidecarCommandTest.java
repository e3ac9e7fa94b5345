package com.anonymizer.sidecar;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SidecarCommandTest {

    @Test
    void argv_putsCommandNameLast() {
        var command = SidecarCommand.of("python", "scripts/sidecar_entrypoint.py");

        assertEquals(List.of("python", "scripts/sidecar_entrypoint.py", "analyze_text"),
                command.argv("analyze_text"));
    }

    @Test
    void argv_isFreshPerCall() {
        var command = SidecarCommand.of("engine");

        List<String> first = command.argv("analyze_file");
        first.add("tampered");

        assertEquals(List.of("engine", "get_supported_extensions"), command.argv("get_supported_extensions"));
    }

    @Test
    void args_areDefensivelyCopied() {
        List<String> args = new ArrayList<>(List.of("a"));
        var command = new SidecarCommand("engine", args, null, null, null);
        args.add("b");

        assertEquals(List.of("a"), command.args());
        assertThrows(UnsupportedOperationException.class, () -> command.args().add("c"));
    }

    @Test
    void zeroOrNegativeTimeout_meansNoTimeout() {
        assertFalse(SidecarCommand.of("engine").withTimeout(Duration.ZERO).hasTimeout());
        assertFalse(SidecarCommand.of("engine").withTimeout(Duration.ofSeconds(-1)).hasTimeout());
        assertTrue(SidecarCommand.of("engine").withTimeout(Duration.ofSeconds(5)).hasTimeout());
    }

    @Test
    void withers_keepOtherFields() {
        var command = SidecarCommand.of("engine", "x")
                .withTimeout(Duration.ofSeconds(9))
                .withWorkingDirectory(Path.of("/opt/engine"));

        assertEquals(List.of("x"), command.args());
        assertEquals(Duration.ofSeconds(9), command.timeout());
        assertEquals(Path.of("/opt/engine"), command.workingDirectory());
    }

    @Test
    void blankExecutable_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> SidecarCommand.of(" "));
        assertThrows(NullPointerException.class, () -> SidecarCommand.of(null));
    }
}
