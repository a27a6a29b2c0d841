package com.botsession.channel;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound calls of the bot platform client.
 * <p>
 * Implemented by the transport layer; this module only routes replies to the
 * right call.
 */
public interface PlatformApi {

    /** Message type for plain text posts. */
    int MSG_TYPE_TEXT = 0;
    /** Message type for posts carrying an uploaded media file. */
    int MSG_TYPE_MEDIA = 7;

    CompletableFuture<Void> postMessage(String channelId, String content, String image, String msgId);

    CompletableFuture<Void> postGroupMessage(String groupOpenid, int msgType, String content,
            String msgId, int msgSeq, PlatformTypes.MediaRef media);

    CompletableFuture<Void> postC2cMessage(String openid, int msgType, String content,
            String msgId, int msgSeq, PlatformTypes.MediaRef media);

    CompletableFuture<PlatformTypes.MediaRef> postGroupFile(String groupOpenid, int fileType, String url);

    CompletableFuture<PlatformTypes.MediaRef> postC2cFile(String openid, int fileType, String url);
}
