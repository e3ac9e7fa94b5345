package com.anonymizer.app.router;

import com.anonymizer.sidecar.SidecarException;

import java.util.List;

/**
 * Failure of a typed worker call, as seen by the host.
 */
public class CommandException extends Exception {

    public enum Kind {
        /** Typed arguments could not be turned into a request payload. */
        ENCODING_FAILURE,
        /** The bridge failed; the cause is the {@link SidecarException}. */
        BRIDGE_FAILURE,
        /** The response document does not have the command's result shape. */
        DECODING_FAILURE
    }

    private final Kind kind;
    private final String commandName;
    private final String rawDocument;

    private CommandException(Kind kind, String commandName, String message, String rawDocument, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.commandName = commandName;
        this.rawDocument = rawDocument;
    }

    public static CommandException invalidArguments(String commandName, List<String> problems) {
        return new CommandException(Kind.ENCODING_FAILURE, commandName,
                "Invalid arguments for '" + commandName + "': " + String.join("; ", problems), null, null);
    }

    public static CommandException encodingFailure(String commandName, Throwable cause) {
        return new CommandException(Kind.ENCODING_FAILURE, commandName,
                "Could not encode arguments for '" + commandName + "': " + cause.getMessage(), null, cause);
    }

    public static CommandException bridgeFailure(SidecarException cause) {
        return new CommandException(Kind.BRIDGE_FAILURE, cause.getCommandName(), cause.getMessage(), null, cause);
    }

    public static CommandException decodingFailure(String commandName, String rawDocument, Throwable cause) {
        return new CommandException(Kind.DECODING_FAILURE, commandName,
                "Unexpected response from '" + commandName + "': " + cause.getMessage() + ". response=" + rawDocument,
                rawDocument, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getCommandName() {
        return commandName;
    }

    /** The offending response document, only for {@link Kind#DECODING_FAILURE}. */
    public String getRawDocument() {
        return rawDocument;
    }

    /** The bridge failure behind a {@link Kind#BRIDGE_FAILURE}, otherwise null. */
    public SidecarException getSidecarFailure() {
        return getCause() instanceof SidecarException sidecar ? sidecar : null;
    }
}
