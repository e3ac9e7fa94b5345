package com.anonymizer.sidecar;

import com.anonymizer.common.infra.ErrorUtils;
import com.anonymizer.common.logging.LogRedact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * {@link SidecarBridge} that starts a fresh worker process for every call.
 * <p>
 * Per call: serialize the payload, start the worker with all three standard
 * streams piped, write the payload and close standard input, drain standard
 * output and standard error until the process exits, then hand the outcome to
 * {@link ResponseClassifier}. The process and its buffers belong to that one
 * call, so concurrent calls share nothing and need no locking.
 */
@Slf4j
public class ProcessSidecarBridge implements SidecarBridge {

    private static final Executor DRAIN_THREADS = task -> {
        Thread thread = new Thread(task, "sidecar-drain");
        thread.setDaemon(true);
        thread.start();
    };

    private final SidecarCommand command;
    private final ObjectMapper mapper;
    private final LogRedact.RedactMode redactMode;

    public ProcessSidecarBridge(SidecarCommand command) {
        this(command, defaultMapper(), LogRedact.RedactMode.ON);
    }

    public ProcessSidecarBridge(SidecarCommand command, ObjectMapper mapper, LogRedact.RedactMode redactMode) {
        this.command = command;
        this.mapper = mapper;
        this.redactMode = redactMode;
    }

    /**
     * Mapper that rejects trailing garbage after the response document.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public SidecarCommand getCommand() {
        return command;
    }

    @Override
    public JsonNode execute(String commandName, Object payload, CancellationToken token) throws SidecarException {
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("commandName must not be blank");
        }
        CancellationToken effectiveToken = token != null ? token : new CancellationToken();

        byte[] input = serialize(commandName, payload);
        if (effectiveToken.isCancelled()) {
            throw SidecarException.cancelled(commandName);
        }

        long startedAt = System.nanoTime();
        ProcessOutcome outcome = run(commandName, input, effectiveToken);
        log.debug("Worker '{}' exited with {} after {} ms (stdout {} bytes, stderr {} bytes)",
                commandName, outcome.exitCode(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt),
                outcome.stdout().length, outcome.stderr().length);

        if (!outcome.isSuccess()) {
            log.warn("Worker '{}' failed with exit code {}: {}", commandName, outcome.exitCode(),
                    redact(outcome.stderrText()));
        } else if (outcome.stderr().length > 0 && log.isDebugEnabled()) {
            log.debug("Worker '{}' stderr: {}", commandName, redact(outcome.stderrText()));
        }
        return ResponseClassifier.classify(commandName, outcome, mapper);
    }

    private byte[] serialize(String commandName, Object payload) throws SidecarException {
        try {
            return payload == null
                    ? mapper.writeValueAsBytes(mapper.createObjectNode())
                    : mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            log.warn("Request for worker '{}' could not be serialized: {}", commandName, e.getOriginalMessage());
            throw SidecarException.invalidPayload(commandName, e);
        }
    }

    private ProcessOutcome run(String commandName, byte[] input, CancellationToken token) throws SidecarException {
        ProcessBuilder pb = new ProcessBuilder(command.argv(commandName))
                .redirectErrorStream(false);
        if (command.workingDirectory() != null) {
            pb.directory(command.workingDirectory().toFile());
        }
        Map<String, String> env = pb.environment();
        env.putAll(command.environment());

        log.debug("Starting worker '{}' via {} ({} payload bytes)", commandName, command.executable(), input.length);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            String osMessage = ErrorUtils.rootCauseMessage(e);
            log.warn("Worker '{}' could not be started: {}", commandName, osMessage);
            throw SidecarException.startFailed(commandName, osMessage, e);
        }

        try (CancellationToken.Registration ignored = token.onCancel(process::destroyForcibly)) {
            CompletableFuture<byte[]> stdout = drain(process.getInputStream());
            CompletableFuture<byte[]> stderr = drain(process.getErrorStream());

            writeInput(commandName, process, input, token);

            if (!waitForExit(commandName, process, token)) {
                process.destroyForcibly();
                log.warn("Worker '{}' timed out after {}s, killed", commandName, command.timeout().toSeconds());
                throw SidecarException.timedOut(commandName, command.timeout());
            }
            if (token.isCancelled()) {
                throw SidecarException.cancelled(commandName);
            }

            byte[] out = join(commandName, stdout);
            byte[] err = join(commandName, stderr);
            if (token.isCancelled()) {
                throw SidecarException.cancelled(commandName);
            }
            return new ProcessOutcome(process.exitValue(), out, err);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private void writeInput(String commandName, Process process, byte[] input, CancellationToken token)
            throws SidecarException {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw SidecarException.cancelled(commandName);
            }
            process.destroyForcibly();
            String osMessage = ErrorUtils.rootCauseMessage(e);
            log.warn("Payload could not be written to worker '{}': {}", commandName, osMessage);
            throw SidecarException.startFailed(commandName, "could not write payload: " + osMessage, e);
        }
    }

    private boolean waitForExit(String commandName, Process process, CancellationToken token)
            throws SidecarException {
        try {
            if (command.hasTimeout()) {
                return process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            process.waitFor();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            token.cancel();
            throw SidecarException.cancelled(commandName);
        }
    }

    private byte[] join(String commandName, CompletableFuture<byte[]> stream) throws SidecarException {
        try {
            return stream.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw SidecarException.invalidOutput(commandName,
                    "could not read worker output: " + ErrorUtils.formatErrorMessage(cause), "", cause);
        }
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAIN_THREADS);
    }

    private String redact(String text) {
        return LogRedact.redactSensitiveText(text, redactMode, LogRedact.DEFAULT_MAX_LENGTH);
    }
}
