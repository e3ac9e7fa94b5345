package com.anonymizer.sidecar;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How to launch the worker: program, leading arguments, working directory,
 * extra environment and the per-call time limit.
 * <p>
 * Immutable; every call builds its own {@link ProcessBuilder} from it, so one
 * instance can be shared by any number of concurrent calls.
 *
 * @param executable       program to run, either a bare name looked up on
 *                         {@code PATH} or a path
 * @param args             arguments placed before the command name
 * @param workingDirectory working directory of the worker, null to inherit
 * @param environment      variables added to the inherited environment
 * @param timeout          per-call limit, null or zero to wait indefinitely
 */
public record SidecarCommand(
        String executable,
        List<String> args,
        Path workingDirectory,
        Map<String, String> environment,
        Duration timeout) {

    public SidecarCommand {
        Objects.requireNonNull(executable, "executable");
        if (executable.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        args = args == null ? List.of() : List.copyOf(args);
        environment = environment == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            timeout = null;
        }
    }

    /** Command with no extra args, environment or time limit. */
    public static SidecarCommand of(String executable, String... args) {
        return new SidecarCommand(executable, List.of(args), null, null, null);
    }

    public SidecarCommand withTimeout(Duration timeout) {
        return new SidecarCommand(executable, args, workingDirectory, environment, timeout);
    }

    public SidecarCommand withWorkingDirectory(Path workingDirectory) {
        return new SidecarCommand(executable, args, workingDirectory, environment, timeout);
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    /**
     * Full argument vector for one call: executable, leading args, then the
     * command name as the last positional argument.
     */
    public List<String> argv(String commandName) {
        List<String> argv = new ArrayList<>(args.size() + 2);
        argv.add(executable);
        argv.addAll(args);
        argv.add(commandName);
        return argv;
    }
}
