package com.botsession.dispatch;

import java.util.Locale;

/**
 * The kind of conversation an inbound message arrived in.
 */
public enum ConversationKind {
    /** One-to-one conversation ("c2c"). */
    DIRECT("c2c"),
    /** Multi-party group chat. */
    GROUP("group"),
    /** Guild/channel conversation. */
    CHANNEL("channel");

    private final String token;

    ConversationKind(String token) {
        this.token = token;
    }

    /** Canonical limitation token of this kind. */
    public String token() {
        return token;
    }

    /**
     * Normalize a raw limitation token.
     *
     * @param raw raw token such as "group", "c2c" or "channel"
     * @return the matching kind, or null if the token is not recognized
     */
    public static ConversationKind normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "c2c", "direct", "dm" -> DIRECT;
            case "group" -> GROUP;
            case "channel" -> CHANNEL;
            default -> null;
        };
    }
}
