package com.anonymizer.sidecar;

import java.time.Duration;

/**
 * Terminal failure of a single worker call. Every call either returns a
 * response document or throws exactly one of these; nothing is retried.
 */
public class SidecarException extends Exception {

    public enum Kind {
        /** Request could not be serialized; no process was started. */
        INVALID_PAYLOAD,
        /** Process could not be launched or the request could not be delivered. */
        START_FAILED,
        /** Non-zero exit, or an error field in the response regardless of exit status. */
        WORKER_FAILED,
        /** Standard output was not a well-formed document. */
        INVALID_OUTPUT,
        /** The worker outlived the configured time limit and was killed. */
        TIMED_OUT,
        /** The caller cancelled the call; the worker was killed. */
        CANCELLED
    }

    private final Kind kind;
    private final String commandName;
    private final String diagnostic;
    private final Integer exitCode;
    private final String rawOutput;

    private SidecarException(Kind kind, String commandName, String message, String diagnostic,
            Integer exitCode, String rawOutput, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.commandName = commandName;
        this.diagnostic = diagnostic;
        this.exitCode = exitCode;
        this.rawOutput = rawOutput;
    }

    public static SidecarException invalidPayload(String commandName, Throwable cause) {
        String detail = cause.getMessage();
        return new SidecarException(Kind.INVALID_PAYLOAD, commandName,
                "Could not serialize request for '" + commandName + "': " + detail,
                detail, null, null, cause);
    }

    public static SidecarException startFailed(String commandName, String osMessage, Throwable cause) {
        return new SidecarException(Kind.START_FAILED, commandName,
                "Failed to start worker for '" + commandName + "': " + osMessage,
                osMessage, null, null, cause);
    }

    /**
     * Non-zero exit. {@code stderr} is kept verbatim as the diagnostic.
     */
    public static SidecarException nonZeroExit(String commandName, int exitCode, String stderr) {
        String trimmed = stderr == null ? "" : stderr.strip();
        String message = "Worker '" + commandName + "' exited with status " + exitCode
                + (trimmed.isEmpty() ? "" : ": " + trimmed);
        return new SidecarException(Kind.WORKER_FAILED, commandName, message,
                stderr == null ? "" : stderr, exitCode, null, null);
    }

    /**
     * Error field found in an otherwise well-formed response.
     */
    public static SidecarException reportedError(String commandName, int exitCode, String errorText) {
        return new SidecarException(Kind.WORKER_FAILED, commandName,
                "Worker '" + commandName + "' reported an error: " + errorText,
                errorText, exitCode, null, null);
    }

    public static SidecarException invalidOutput(String commandName, String parseError, String rawOutput,
            Throwable cause) {
        return new SidecarException(Kind.INVALID_OUTPUT, commandName,
                "Invalid worker output for '" + commandName + "': " + parseError + ". stdout=" + rawOutput,
                parseError, 0, rawOutput, cause);
    }

    public static SidecarException timedOut(String commandName, Duration limit) {
        return new SidecarException(Kind.TIMED_OUT, commandName,
                "Worker '" + commandName + "' did not finish within " + limit.toSeconds() + "s",
                null, null, null, null);
    }

    public static SidecarException cancelled(String commandName) {
        return new SidecarException(Kind.CANCELLED, commandName,
                "Worker call '" + commandName + "' was cancelled",
                null, null, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * Worker- or OS-provided text: standard error on non-zero exit, the error
     * field's text, the parse error, or the OS launch error.
     */
    public String getDiagnostic() {
        return diagnostic;
    }

    /** Exit status when the process ran to completion, otherwise null. */
    public Integer getExitCode() {
        return exitCode;
    }

    /** Raw standard output, only for {@link Kind#INVALID_OUTPUT}. */
    public String getRawOutput() {
        return rawOutput;
    }
}
