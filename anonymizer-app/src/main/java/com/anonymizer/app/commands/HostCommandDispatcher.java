package com.anonymizer.app.commands;

import com.anonymizer.app.router.CommandException;
import com.anonymizer.common.infra.ErrorUtils;
import com.anonymizer.common.logging.LogRedact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes host commands by name to their handlers and turns every failure
 * into a {@link CommandResult#error(String)}. Nothing thrown by a handler
 * reaches the host.
 */
@Slf4j
@Component
public class HostCommandDispatcher {

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public HostCommandDispatcher(AnalysisCommands analysisCommands, StatusCommands statusCommands) {
        // Worker-backed
        handlers.put("analyze_text", analysisCommands::handleAnalyzeText);
        handlers.put("analyze_file", analysisCommands::handleAnalyzeFile);
        handlers.put("analyze_batch", analysisCommands::handleAnalyzeBatch);
        handlers.put("get_supported_extensions", analysisCommands::handleSupportedExtensions);

        // Answered locally
        handlers.put("list_presets", statusCommands::handleListPresets);
        handlers.put("sidecar_status", statusCommands::handleSidecarStatus);
    }

    public Set<String> commandNames() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public boolean isKnown(String name) {
        return name != null && handlers.containsKey(name.trim());
    }

    /**
     * Run a host command.
     *
     * @param name command name, e.g. {@code analyze_text}
     * @param args host arguments, null for none
     */
    public CommandResult dispatch(String name, JsonNode args) {
        if (name == null || name.isBlank()) {
            return CommandResult.error("Command name is required");
        }
        String trimmed = name.trim();
        CommandHandler handler = handlers.get(trimmed);
        if (handler == null) {
            log.debug("Unknown command: {}", trimmed);
            return CommandResult.error("Unknown command: " + trimmed);
        }

        JsonNode effectiveArgs = args == null || args.isNull() ? JsonNodeFactory.instance.objectNode() : args;
        if (!effectiveArgs.isObject()) {
            return CommandResult.error("Arguments for '" + trimmed + "' must be an object");
        }
        try {
            return handler.handle(effectiveArgs);
        } catch (CommandException e) {
            log.warn("Command {} failed ({}): {}", trimmed, e.getKind(), LogRedact.redactSensitiveText(e.getMessage()));
            return CommandResult.error(ErrorUtils.formatErrorMessage(e));
        } catch (IllegalArgumentException e) {
            log.debug("Command {} rejected: {}", trimmed, e.getMessage());
            return CommandResult.error(ErrorUtils.formatErrorMessage(e));
        } catch (RuntimeException e) {
            log.error("Command {} failed unexpectedly: {}", trimmed, e.getMessage(), e);
            return CommandResult.error(ErrorUtils.formatErrorMessage(e));
        }
    }
}
