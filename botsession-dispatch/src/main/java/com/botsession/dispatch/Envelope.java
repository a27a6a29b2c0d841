package com.botsession.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Normalized view of one inbound message event.
 * <p>
 * Implementations are immutable; one envelope is built per event and dropped
 * once its dispatch completes.
 */
public interface Envelope {

    /** Message text as received. */
    String rawText();

    ConversationKind conversationKind();

    /** Platform identity of the sender. */
    String senderId();

    /**
     * Reply into the conversation the message came from. Delivery is owned by
     * the platform client; the returned future only reports its result.
     */
    CompletableFuture<Void> send(String text);
}
