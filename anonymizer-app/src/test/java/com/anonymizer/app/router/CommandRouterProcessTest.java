package com.anonymizer.app.router;

import com.anonymizer.app.preset.PresetCatalog;
import com.anonymizer.sidecar.ProcessSidecarBridge;
import com.anonymizer.sidecar.SidecarCommand;
import com.anonymizer.sidecar.SidecarException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Router on top of the real process bridge, with a shell script as worker.
 */
@DisabledOnOs(OS.WINDOWS)
class CommandRouterProcessTest {

    @TempDir
    Path tempDir;

    private CommandRouter routerFor(String body) throws Exception {
        return new CommandRouter(new ProcessSidecarBridge(worker("worker", body)));
    }

    private SidecarCommand worker(String name, String body) throws Exception {
        Path script = tempDir.resolve(name + ".sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        return SidecarCommand.of("/bin/sh", script.toString());
    }

    @Test
    void supportedExtensions_endToEnd() throws Exception {
        CommandRouter router = routerFor("""
                cat > /dev/null
                if [ "$1" = "get_supported_extensions" ]; then
                  printf '{"extensions":[".txt",".docx",".pdf"]}'
                else
                  echo "unexpected command $1" >&2; exit 3
                fi""");

        assertEquals(List.of(".txt", ".docx", ".pdf"), router.getSupportedExtensions().extensions());
    }

    @Test
    void analyzeText_workerSeesPayload() throws Exception {
        // Two findings only when the payload carried the text.
        CommandRouter router = routerFor("""
                input=$(cat)
                case "$input" in
                  *'"text":"Jan Jansen"'*) n=2 ;;
                  *) n=0 ;;
                esac
                printf '{"run_id":"r","run_folder":"/r","redacted_text":"[PERSON]","summary":{"PERSON":%s},"findings_count":%s,"language":"nl"}' $n $n""");

        AnalyzeTextResult result = router.analyzeText("Jan Jansen", PresetCatalog.builtIns().get(0), null);

        assertEquals(2, result.findingsCount());
        assertEquals(2, result.summary().get("PERSON"));
    }

    @Test
    void builtInPreset_sendsLanguageKey() throws Exception {
        // Mirrors a worker that builds its preset from every core field and fails when one is missing.
        CommandRouter router = routerFor("""
                input=$(cat)
                case "$input" in
                  *'"language":null'*) ;;
                  *) printf '{"error":"missing language"}'; exit 1 ;;
                esac
                printf '{"run_id":"r","run_folder":"/r","output_path":"/r/a.txt","summary":{},"findings_count":0}'""");

        for (var preset : PresetCatalog.builtIns()) {
            assertEquals("/r/a.txt", router.analyzeFile("/a.txt", preset).outputPath());
        }
    }

    @Test
    void analyzeBatch_runsBatchEntrypoint() throws Exception {
        var analysis = worker("analysis", """
                cat > /dev/null
                printf '{"error":"Unknown command: %s"}' "$1"
                exit 1""");
        var batch = worker("batch", """
                input=$(cat)
                case "$input" in
                  *'"input_folder":"/docs"'*) ;;
                  *) echo "bad request" >&2; exit 2 ;;
                esac
                printf '{"run_id":"b","run_folder":"/runs/b","processed_files":2,"skipped_files":1,"total_files_seen":3,"summary":{"PERSON":4},"output_folder":"/runs/b/out"}'""");
        var router = new CommandRouter(new ProcessSidecarBridge(analysis), new ProcessSidecarBridge(batch),
                new WorkerCodec());

        var request = new AnalyzeBatchRequest("/docs", PresetCatalog.builtIns().get(0));
        AnalyzeBatchResult result = router.analyzeBatch(request);

        assertEquals(2, result.processedFiles());
        assertEquals(4, result.summary().get("PERSON"));
    }

    @Test
    void workerCrash_isBridgeFailureWithStderr() throws Exception {
        CommandRouter router = routerFor("cat > /dev/null\necho 'boom' >&2\nexit 1");

        var e = assertThrows(CommandException.class, router::getSupportedExtensions);

        assertEquals(CommandException.Kind.BRIDGE_FAILURE, e.getKind());
        assertEquals(SidecarException.Kind.WORKER_FAILED, e.getSidecarFailure().getKind());
        assertEquals(1, e.getSidecarFailure().getExitCode());
        assertTrue(e.getSidecarFailure().getDiagnostic().contains("boom"));
    }
}
