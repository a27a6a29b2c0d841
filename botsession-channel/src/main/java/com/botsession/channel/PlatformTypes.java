package com.botsession.channel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound message shapes delivered by the bot platform client, one per
 * conversation kind, plus the media reference returned by file uploads.
 */
public final class PlatformTypes {

    private PlatformTypes() {
    }

    /** Fields every inbound platform message carries. */
    public interface PlatformMessage {
        String getId();

        String getContent();

        /** ISO-8601 send time, may be null. */
        String getTimestamp();
    }

    // =========================================================================
    // Inbound messages
    // =========================================================================

    /** Message posted in a guild channel. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelMessage implements PlatformMessage {
        private String id;
        private String content;
        private String timestamp;
        private String channelId;
        private String guildId;
        /** Channel-scoped author id. */
        private String authorId;
        /** Author avatar URL as delivered by the platform. */
        private String authorAvatar;
    }

    /** Message posted in a group chat. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupMessage implements PlatformMessage {
        private String id;
        private String content;
        private String timestamp;
        private String groupOpenid;
        private String memberOpenid;
    }

    /** Direct (c2c) message. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class C2cMessage implements PlatformMessage {
        private String id;
        private String content;
        private String timestamp;
        private String userOpenid;
    }

    // =========================================================================
    // Media
    // =========================================================================

    /** Handle of an uploaded rich-media file, passed back when posting it. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MediaRef {
        private String fileUuid;
        private String fileInfo;
        /** Seconds the upload stays valid; 0 means unlimited. */
        private long ttl;
    }
}
