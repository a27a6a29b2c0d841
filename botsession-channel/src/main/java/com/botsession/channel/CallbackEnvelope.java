package com.botsession.channel;

import com.botsession.channel.PlatformTypes.C2cMessage;
import com.botsession.channel.PlatformTypes.ChannelMessage;
import com.botsession.channel.PlatformTypes.GroupMessage;
import com.botsession.channel.PlatformTypes.MediaRef;
import com.botsession.channel.PlatformTypes.PlatformMessage;
import com.botsession.channel.errors.ContentTypeError;
import com.botsession.channel.errors.EmptyContentError;
import com.botsession.channel.errors.IncompatibilityError;
import com.botsession.channel.errors.PlatformSendError;
import com.botsession.common.config.BotSessionConfig;
import com.botsession.dispatch.CommandDispatcher;
import com.botsession.dispatch.CommandMatcher;
import com.botsession.dispatch.ConversationKind;
import com.botsession.dispatch.DispatchOutcome;
import com.botsession.dispatch.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Envelope over one inbound platform message.
 * <p>
 * Gives handlers the message content, sender identity and avatar, and routes
 * replies (text, image, voice, video) to the platform call matching the
 * conversation the message came from. Do not hold on to an instance after its
 * dispatch completes.
 */
@Slf4j
public class CallbackEnvelope implements Envelope {

    static final int MAX_MSG_SEQ = 1_000_000;

    private final PlatformMessage message;
    private final PlatformApi api;
    private final ConversationKind kind;
    private final String botAppId;
    private final String avatarApi;
    private final int avatarSize;
    private final Clock clock;

    public CallbackEnvelope(PlatformMessage message, PlatformApi api) {
        this(message, api, null);
    }

    public CallbackEnvelope(PlatformMessage message, PlatformApi api, BotSessionConfig.BotConfig bot) {
        this(message, api, bot, Clock.systemDefaultZone());
    }

    CallbackEnvelope(PlatformMessage message, PlatformApi api, BotSessionConfig.BotConfig bot, Clock clock) {
        this.kind = kindOf(message);
        this.message = message;
        this.api = api;
        this.botAppId = bot != null ? bot.getAppId() : null;
        this.avatarApi = bot != null && bot.getAvatarApi() != null
                ? bot.getAvatarApi()
                : BotSessionConfig.DEFAULT_AVATAR_API;
        this.avatarSize = bot != null && bot.getAvatarSize() != null && bot.getAvatarSize() > 0
                ? bot.getAvatarSize()
                : BotSessionConfig.DEFAULT_AVATAR_SIZE;
        this.clock = clock;
    }

    private static ConversationKind kindOf(PlatformMessage message) {
        if (message instanceof ChannelMessage) {
            return ConversationKind.CHANNEL;
        }
        if (message instanceof GroupMessage) {
            return ConversationKind.GROUP;
        }
        if (message instanceof C2cMessage) {
            return ConversationKind.DIRECT;
        }
        throw new ContentTypeError("unsupported message type: "
                + (message == null ? "null" : message.getClass().getSimpleName()), 400);
    }

    // =========================================================================
    // Envelope
    // =========================================================================

    @Override
    public String rawText() {
        return content();
    }

    @Override
    public ConversationKind conversationKind() {
        return kind;
    }

    @Override
    public String senderId() {
        return userOpenid();
    }

    /**
     * Reply with text. Transport failures complete the future with
     * {@link PlatformSendError}.
     *
     * @throws EmptyContentError if the text is null or empty
     */
    @Override
    public CompletableFuture<Void> send(String text) {
        return send(text, nextSeq());
    }

    public CompletableFuture<Void> send(String text, int seq) {
        if (text == null || text.isEmpty()) {
            throw new EmptyContentError("message must not be empty", 200);
        }
        return deliver("text", () -> {
            if (message instanceof ChannelMessage m) {
                return api.postMessage(m.getChannelId(), text, null, m.getId());
            }
            if (message instanceof GroupMessage m) {
                return api.postGroupMessage(m.getGroupOpenid(), PlatformApi.MSG_TYPE_TEXT, text,
                        m.getId(), seq, null);
            }
            C2cMessage m = (C2cMessage) message;
            return api.postC2cMessage(m.getUserOpenid(), PlatformApi.MSG_TYPE_TEXT, text,
                    m.getId(), seq, null);
        });
    }

    // =========================================================================
    // Rich media
    // =========================================================================

    /**
     * Reply with an image (by URL) and a caption.
     *
     * @throws EmptyContentError if the caption is null or empty
     */
    public CompletableFuture<Void> sendImage(String imageUrl, String caption) {
        if (caption == null || caption.isEmpty()) {
            throw new EmptyContentError("message must not be empty", 500);
        }
        return sendMedia(imageUrl, MediaType.IMAGE, caption, nextSeq());
    }

    /**
     * Reply with a silk voice clip (by URL).
     *
     * @throws IncompatibilityError in a channel conversation
     */
    public CompletableFuture<Void> sendVoice(String voiceUrl) {
        return sendMedia(voiceUrl, MediaType.VOICE, "", nextSeq());
    }

    /**
     * Reply with an mp4 video (by URL).
     *
     * @throws IncompatibilityError in a channel conversation
     */
    public CompletableFuture<Void> sendVideo(String videoUrl) {
        return sendMedia(videoUrl, MediaType.VIDEO, "", nextSeq());
    }

    CompletableFuture<Void> sendMedia(String url, MediaType type, String content, int seq) {
        if (message instanceof ChannelMessage m) {
            if (type != MediaType.IMAGE) {
                throw new IncompatibilityError("channel conversations cannot receive "
                        + type.name().toLowerCase(Locale.ROOT) + " messages", 500);
            }
            return deliver("image", () -> api.postMessage(m.getChannelId(), content, url, m.getId()));
        }
        if (message instanceof GroupMessage m) {
            return deliver(type.name().toLowerCase(Locale.ROOT), () -> api
                    .postGroupFile(m.getGroupOpenid(), type.fileType(), url)
                    .thenCompose(media -> api.postGroupMessage(m.getGroupOpenid(), PlatformApi.MSG_TYPE_MEDIA,
                            content, m.getId(), seq, media)));
        }
        C2cMessage m = (C2cMessage) message;
        return deliver(type.name().toLowerCase(Locale.ROOT), () -> api
                .postC2cFile(m.getUserOpenid(), type.fileType(), url)
                .thenCompose(media -> api.postC2cMessage(m.getUserOpenid(), PlatformApi.MSG_TYPE_MEDIA,
                        content, m.getId(), seq, media)));
    }

    // =========================================================================
    // Message views
    // =========================================================================

    /** Trimmed message content, never null. */
    public String content() {
        String raw = message.getContent();
        return raw == null ? "" : raw.strip();
    }

    /**
     * Command tokens of the message.
     *
     * @param prefix    command prefix, e.g. "/"
     * @param sepParams whether splitting is wanted at all
     * @return the whitespace-separated tokens after the prefix, or null when
     *         the message does not start with the prefix or splitting is off
     */
    public List<String> command(String prefix, boolean sepParams) {
        String text = content();
        if (!sepParams || prefix == null || !text.startsWith(prefix)) {
            return null;
        }
        return CommandMatcher.tokenize(text.substring(prefix.length()));
    }

    public List<String> command(String prefix) {
        return command(prefix, true);
    }

    /** Platform open id of the sender; channel ids differ from group and c2c ids. */
    public String userOpenid() {
        if (message instanceof ChannelMessage m) {
            return m.getAuthorId();
        }
        if (message instanceof GroupMessage m) {
            return m.getMemberOpenid();
        }
        return ((C2cMessage) message).getUserOpenid();
    }

    /** Send time as delivered by the platform, or null. */
    public String timestamp() {
        return message.getTimestamp();
    }

    /** Today as yyyy-MM-dd. */
    public String date() {
        return LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /** Current host load, or null if unavailable. */
    public RuntimeUsage usage() {
        return RuntimeUsage.sample();
    }

    /** Limitation token of the conversation ("channel", "group" or "c2c"). */
    public String msgType() {
        return kind.token();
    }

    public PlatformMessage getMessage() {
        return message;
    }

    /**
     * Avatar URL of the sender using the configured bot app id.
     */
    public String headUrl() {
        return headUrl(null, null, null, 0);
    }

    /**
     * Avatar URL of a user. Channel messages carry the author avatar directly;
     * for other kinds the URL template is filled with app id, open id and size.
     *
     * @param appId      bot app id; the configured one wins when both are set
     * @param userOpenid open id to look up, defaults to the sender
     * @param api        URL template with three {} placeholders, defaults to the
     *                   configured one
     * @param size       avatar edge in pixels, defaults to the configured size
     */
    public String headUrl(String appId, String userOpenid, String api, int size) {
        if (message instanceof ChannelMessage m) {
            return m.getAuthorAvatar();
        }
        String openid = userOpenid != null ? userOpenid : userOpenid();
        String template = api != null ? api : avatarApi;
        String app = botAppId != null ? botAppId : appId;
        return fillTemplate(template, String.valueOf(app), openid,
                String.valueOf(size > 0 ? size : avatarSize));
    }

    /**
     * Dispatch this envelope and report whether a handler ran successfully.
     */
    public CompletableFuture<Boolean> dispatchWith(CommandDispatcher dispatcher) {
        return dispatcher.dispatch(this).thenApply(outcome -> outcome instanceof DispatchOutcome.Handled);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private CompletableFuture<Void> deliver(String what, Supplier<CompletableFuture<Void>> call) {
        CompletableFuture<Void> sent;
        try {
            sent = call.get();
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        if (sent == null) {
            sent = CompletableFuture.completedFuture(null);
        }
        return sent.handle((ignored, err) -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null
                        ? err.getCause()
                        : err;
                log.warn("Failed to send {} reply to {} {}: {}", what, kind.token(), message.getId(),
                        cause.getMessage());
                throw new PlatformSendError("failed to send " + what + " reply", cause);
            }
            return null;
        });
    }

    private static int nextSeq() {
        return ThreadLocalRandom.current().nextInt(MAX_MSG_SEQ + 1);
    }

    static String fillTemplate(String template, String... values) {
        StringBuilder out = new StringBuilder();
        int from = 0;
        for (String value : values) {
            int at = template.indexOf("{}", from);
            if (at < 0) {
                break;
            }
            out.append(template, from, at).append(value);
            from = at + 2;
        }
        out.append(template.substring(from));
        return out.toString();
    }
}
