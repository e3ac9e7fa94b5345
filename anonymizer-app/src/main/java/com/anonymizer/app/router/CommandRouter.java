package com.anonymizer.app.router;

import com.anonymizer.app.preset.Preset;
import com.anonymizer.sidecar.CancellationToken;
import com.anonymizer.sidecar.SidecarBridge;
import com.anonymizer.sidecar.SidecarException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps typed host operations onto worker calls: encode the arguments, run
 * the command through the {@link SidecarBridge}, decode the reply.
 * <p>
 * Every call either returns a fully populated result or throws a
 * {@link CommandException}; there are no partial results.
 */
@Slf4j
public class CommandRouter {

    private final SidecarBridge analysisBridge;
    private final SidecarBridge batchBridge;
    private final WorkerCodec codec;

    /**
     * Router whose commands all go through one bridge.
     */
    public CommandRouter(SidecarBridge bridge) {
        this(bridge, bridge, new WorkerCodec());
    }

    /**
     * @param analysisBridge runs {@link WorkerCommand.Entrypoint#ANALYSIS} commands
     * @param batchBridge    runs {@link WorkerCommand.Entrypoint#BATCH} commands
     */
    public CommandRouter(SidecarBridge analysisBridge, SidecarBridge batchBridge, WorkerCodec codec) {
        this.analysisBridge = analysisBridge;
        this.batchBridge = batchBridge;
        this.codec = codec;
    }

    public <A, R> R invoke(WorkerCommand<A, R> command, A args) throws CommandException {
        return invoke(command, args, new CancellationToken());
    }

    public <A, R> R invoke(WorkerCommand<A, R> command, A args, CancellationToken token) throws CommandException {
        JsonNode payload = codec.encode(command, args);
        JsonNode response;
        try {
            response = bridgeFor(command).execute(command.getName(), payload, token);
        } catch (SidecarException e) {
            log.debug("Worker command '{}' failed: {}", command.getName(), e.getKind());
            throw CommandException.bridgeFailure(e);
        }
        R result = codec.decode(command, response);
        log.debug("Worker command '{}' decoded into {}", command.getName(), command.getResultType().getSimpleName());
        return result;
    }

    // --- Host operations ---

    public AnalyzeTextResult analyzeText(String text, Preset preset, String modelPath) throws CommandException {
        return invoke(WorkerCommand.ANALYZE_TEXT, new AnalyzeTextRequest(text, preset, emptyToNull(modelPath)));
    }

    public AnalyzeFileResult analyzeFile(String inputPath, Preset preset) throws CommandException {
        return invoke(WorkerCommand.ANALYZE_FILE, new AnalyzeFileRequest(inputPath, preset));
    }

    public AnalyzeBatchResult analyzeBatch(AnalyzeBatchRequest request) throws CommandException {
        return invoke(WorkerCommand.ANALYZE_BATCH, request);
    }

    public SupportedExtensions getSupportedExtensions() throws CommandException {
        return invoke(WorkerCommand.GET_SUPPORTED_EXTENSIONS, null);
    }

    private SidecarBridge bridgeFor(WorkerCommand<?, ?> command) {
        return command.getEntrypoint() == WorkerCommand.Entrypoint.BATCH ? batchBridge : analysisBridge;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
