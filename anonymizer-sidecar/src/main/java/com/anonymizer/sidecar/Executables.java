package com.anonymizer.sidecar;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Locates the worker executable the same way the OS would, without
 * starting it.
 */
public final class Executables {

    private Executables() {
    }

    private static final List<String> WINDOWS_SUFFIXES = List.of(".exe", ".cmd", ".bat");

    /**
     * Resolve the worker executable of a command against its working
     * directory and the current {@code PATH}.
     */
    public static Optional<Path> resolve(SidecarCommand command) {
        Path base = command.workingDirectory() != null
                ? command.workingDirectory()
                : Path.of("").toAbsolutePath();
        String pathEnv = command.environment().getOrDefault("PATH", System.getenv("PATH"));
        return resolve(command.executable(), base, pathEnv, isWindows());
    }

    /**
     * Resolve an executable name.
     * <p>
     * Names containing a path separator are resolved against {@code base};
     * bare names are searched on {@code pathEnv}.
     *
     * @return the executable file, or empty if none is found
     */
    public static Optional<Path> resolve(String executable, Path base, String pathEnv, boolean windows) {
        if (executable == null || executable.isBlank()) {
            return Optional.empty();
        }
        String name = executable.trim();
        if (name.contains("/") || name.contains(File.separator)) {
            return candidate(base.resolve(name).normalize(), windows);
        }
        if (pathEnv == null || pathEnv.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Optional<Path> found = candidate(Path.of(dir.trim()).resolve(name), windows);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> candidate(Path path, boolean windows) {
        if (isExecutableFile(path, windows)) {
            return Optional.of(path);
        }
        if (windows && !hasWindowsSuffix(path)) {
            for (String suffix : WINDOWS_SUFFIXES) {
                Path withSuffix = path.resolveSibling(path.getFileName() + suffix);
                if (isExecutableFile(withSuffix, true)) {
                    return Optional.of(withSuffix);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path path, boolean windows) {
        return Files.isRegularFile(path) && (windows || Files.isExecutable(path));
    }

    private static boolean hasWindowsSuffix(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return WINDOWS_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
