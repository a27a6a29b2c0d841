package com.botsession.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type.
 */
@Data
public class BotSessionConfig {

    public static final String DEFAULT_AVATAR_API = "https://thirdqq.qlogo.cn/qqapp/{}/{}/{}";
    public static final int DEFAULT_AVATAR_SIZE = 640;

    /** Bot identity and platform URLs. */
    private BotConfig bot;

    /** Command dispatch settings. */
    private DispatchConfig dispatch;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class BotConfig {
        /** Bot application id, used when building avatar URLs. */
        private String appId;
        /** Avatar URL template; the three {} are app id, open id and size. */
        private String avatarApi;
        private Integer avatarSize;
    }

    @Data
    public static class DispatchConfig {
        /** Prefixes used by bindings that declare none. */
        private List<String> defaultPrefixes;
        /** Upper bound on a single handler run; 0 disables the bound. */
        private Long handlerTimeoutMs;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        /** Subsystem prefixes allowed to log; empty means all. */
        private List<String> subsystems = new ArrayList<>();
    }
}
