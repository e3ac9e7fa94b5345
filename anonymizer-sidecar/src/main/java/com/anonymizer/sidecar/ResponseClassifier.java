package com.anonymizer.sidecar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Turns a {@link ProcessOutcome} into a response document or a failure.
 * <p>
 * Two independent checks, first failure wins: the exit status, then the
 * {@value #ERROR_FIELD} field of the parsed document. A worker that exits
 * with status zero but reports an error has still failed.
 */
public final class ResponseClassifier {

    public static final String ERROR_FIELD = "error";

    private ResponseClassifier() {
    }

    public static JsonNode classify(String commandName, ProcessOutcome outcome, ObjectMapper mapper)
            throws SidecarException {
        // Standard output is ignored on a failed exit
        if (!outcome.isSuccess()) {
            throw SidecarException.nonZeroExit(commandName, outcome.exitCode(), outcome.stderrText());
        }

        JsonNode document = parse(commandName, outcome, mapper);

        JsonNode error = document.isObject() ? document.get(ERROR_FIELD) : null;
        if (error != null) {
            throw SidecarException.reportedError(commandName, outcome.exitCode(), errorText(error));
        }
        return document;
    }

    private static JsonNode parse(String commandName, ProcessOutcome outcome, ObjectMapper mapper)
            throws SidecarException {
        String raw = outcome.stdoutText();
        if (raw.isBlank()) {
            throw SidecarException.invalidOutput(commandName, "worker wrote no output", raw, null);
        }
        try {
            JsonNode document = mapper.readTree(outcome.stdout());
            if (document == null || document.isMissingNode()) {
                throw SidecarException.invalidOutput(commandName, "worker wrote no document", raw, null);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw SidecarException.invalidOutput(commandName, e.getOriginalMessage(), raw, e);
        } catch (IOException e) {
            throw SidecarException.invalidOutput(commandName, e.getMessage(), raw, e);
        }
    }

    static String errorText(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        if (error.isNull()) {
            return "worker reported an unspecified error";
        }
        JsonNode message = error.get("message");
        if (message != null && message.isTextual()) {
            return message.asText();
        }
        return error.toString();
    }
}
