package com.anonymizer.common.config;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory and config file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".anonymizer";
    private static final String CONFIG_FILENAME = "anonymizer.json";

    /**
     * State directory for mutable data.
     * Can be overridden via ANONYMIZER_STATE_DIR.
     * Default: ~/.anonymizer
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "ANONYMIZER_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Config file path. ANONYMIZER_CONFIG_PATH wins over the state directory.
     */
    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), homeDir());
    }

    public static Path resolveConfigPath(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "ANONYMIZER_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveStateDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    /**
     * Expand a leading {@code ~} and make the path absolute.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String trimmed = input.trim();
        if (trimmed.equals("~")) {
            return Path.of(homedir);
        }
        if (trimmed.startsWith("~/") || trimmed.startsWith("~" + File.separator)) {
            return Path.of(homedir, trimmed.substring(2)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
