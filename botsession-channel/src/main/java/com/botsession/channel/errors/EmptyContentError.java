package com.botsession.channel.errors;

import com.botsession.common.errors.BotSessionException;

/** Raised when a reply has no content. */
public class EmptyContentError extends BotSessionException {

    public EmptyContentError(String message, int code) {
        super(message, code);
    }
}
