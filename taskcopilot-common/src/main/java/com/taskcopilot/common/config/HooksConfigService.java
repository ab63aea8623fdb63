package com.taskcopilot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the hook runtime configuration.
 * <p>
 * A missing or unreadable file yields defaults; configuration problems are
 * logged and never thrown to the caller.
 */
@Slf4j
public class HooksConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, HooksConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public HooksConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public HooksConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
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
    public HooksConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public HooksConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private HooksConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new HooksConfig());
        }
        try {
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            HooksConfig config = objectMapper.readValue(raw, HooksConfig.class);
            if (config == null) {
                config = new HooksConfig();
            }
            config = applyDefaults(config);
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new HooksConfig());
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

    /**
     * Apply default values to missing config sections.
     */
    HooksConfig applyDefaults(HooksConfig config) {
        return new Defaults().apply(config);
    }

    static final class Defaults {

        HooksConfig apply(HooksConfig config) {
            if (config.getHooks() == null) {
                config.setHooks(new HooksConfig.HookDefaults());
            }
            if (config.getSecurity() == null) {
                config.setSecurity(new HooksConfig.SecurityConfig());
            }
            HooksConfig.SecurityConfig security = config.getSecurity();
            if (security.getDisabledRules() == null) {
                security.setDisabledRules(new ArrayList<>());
            }
            if (security.getCustomRules() == null) {
                security.setCustomRules(new ArrayList<>());
            }
            if (config.getAutoCheckpoint() == null) {
                config.setAutoCheckpoint(new HooksConfig.AutoCheckpointConfig());
            }
            HooksConfig.AutoCheckpointConfig checkpoint = config.getAutoCheckpoint();
            if (checkpoint.getTriggers() == null) {
                checkpoint.setTriggers(new HooksConfig.Triggers());
            }
            if (checkpoint.getStopTriggers() == null) {
                checkpoint.setStopTriggers(new HooksConfig.AutoCheckpointConfig().getStopTriggers());
            }
            if (checkpoint.getIterationToolPatterns() == null) {
                checkpoint.setIterationToolPatterns(
                        new HooksConfig.AutoCheckpointConfig().getIterationToolPatterns());
            }
            return config;
        }
    }
}
