package com.anonymizer.app.commands;

import com.anonymizer.app.router.AnalyzeBatchRequest;
import com.anonymizer.app.router.CommandException;
import com.anonymizer.app.router.CommandRouter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Host commands that run the worker.
 */
@Component
public class AnalysisCommands {

    private final CommandRouter router;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnalysisCommands(CommandRouter router) {
        this.router = router;
    }

    public CommandResult handleAnalyzeText(JsonNode args) throws CommandException {
        return CommandResult.ok(router.analyzeText(
                HostArgs.requireText(args, "text"),
                HostArgs.requirePreset(args, mapper),
                HostArgs.optionalText(args, "modelPath")));
    }

    public CommandResult handleAnalyzeFile(JsonNode args) throws CommandException {
        return CommandResult.ok(router.analyzeFile(
                HostArgs.requireText(args, "inputPath"),
                HostArgs.requirePreset(args, mapper)));
    }

    public CommandResult handleAnalyzeBatch(JsonNode args) throws CommandException {
        var request = new AnalyzeBatchRequest(
                HostArgs.requireText(args, "inputFolder"),
                HostArgs.requirePreset(args, mapper),
                HostArgs.optionalBoolean(args, "recursive", true),
                HostArgs.optionalInt(args, "maxFiles"),
                HostArgs.optionalText(args, "language"),
                HostArgs.optionalText(args, "runsBase"));
        return CommandResult.ok(router.analyzeBatch(request));
    }

    public CommandResult handleSupportedExtensions(JsonNode args) throws CommandException {
        return CommandResult.ok(router.getSupportedExtensions());
    }
}
