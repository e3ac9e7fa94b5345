package com.anonymizer.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the shell configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(2);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AnonymizerConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public AnonymizerConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AnonymizerConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private AnonymizerConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.info("Config file not found: {}, using defaults", configPath);
            return ConfigDefaults.applyDefaults(new AnonymizerConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            AnonymizerConfig config = objectMapper.readValue(raw, AnonymizerConfig.class);
            if (config == null) {
                config = new AnonymizerConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return ConfigDefaults.applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return ConfigDefaults.applyDefaults(new AnonymizerConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
