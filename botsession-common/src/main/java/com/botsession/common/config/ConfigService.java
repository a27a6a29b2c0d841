package com.botsession.common.config;

import com.botsession.common.logging.LogLevel;
import com.botsession.common.logging.SubsystemLogger;
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
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bot session configuration file.
 * <p>
 * A missing or unreadable file yields the defaults; string values may use
 * {@code ${VAR}} and {@code ${VAR:-default}} environment references.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    static final List<String> DEFAULT_PREFIXES = List.of("/", "");

    private final ObjectMapper objectMapper;
    private final Cache<String, BotSessionConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
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
    public BotSessionConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BotSessionConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Push the logging section into {@link SubsystemLogger}.
     */
    public static void applyLogging(BotSessionConfig config) {
        BotSessionConfig.LoggingConfig logging = config.getLogging();
        if (logging == null) {
            return;
        }
        SubsystemLogger.setMinLevel(LogLevel.normalize(logging.getLevel()));
        List<String> subsystems = logging.getSubsystems();
        SubsystemLogger.setSubsystemFilter(
                subsystems != null ? subsystems.toArray(new String[0]) : null);
    }

    /**
     * Fill every unset value with its default.
     */
    public static BotSessionConfig applyDefaults(BotSessionConfig config) {
        if (config.getBot() == null) {
            config.setBot(new BotSessionConfig.BotConfig());
        }
        BotSessionConfig.BotConfig bot = config.getBot();
        if (bot.getAvatarApi() == null || bot.getAvatarApi().isBlank()) {
            bot.setAvatarApi(BotSessionConfig.DEFAULT_AVATAR_API);
        }
        if (bot.getAvatarSize() == null || bot.getAvatarSize() <= 0) {
            bot.setAvatarSize(BotSessionConfig.DEFAULT_AVATAR_SIZE);
        }

        if (config.getDispatch() == null) {
            config.setDispatch(new BotSessionConfig.DispatchConfig());
        }
        BotSessionConfig.DispatchConfig dispatch = config.getDispatch();
        if (dispatch.getDefaultPrefixes() == null || dispatch.getDefaultPrefixes().isEmpty()) {
            dispatch.setDefaultPrefixes(new ArrayList<>(DEFAULT_PREFIXES));
        }
        if (dispatch.getHandlerTimeoutMs() == null || dispatch.getHandlerTimeoutMs() < 0) {
            dispatch.setHandlerTimeoutMs(0L);
        }

        if (config.getLogging() == null) {
            config.setLogging(new BotSessionConfig.LoggingConfig());
        }
        if (config.getLogging().getLevel() == null) {
            config.getLogging().setLevel("info");
        }
        return config;
    }

    private BotSessionConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new BotSessionConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            BotSessionConfig config = applyDefaults(objectMapper.readValue(raw, BotSessionConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new BotSessionConfig());
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
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
