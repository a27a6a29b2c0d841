package com.botsession.channel.errors;

import com.botsession.common.errors.BotSessionException;

/** Raised when a conversation kind cannot carry the requested reply. */
public class IncompatibilityError extends BotSessionException {

    public IncompatibilityError(String message, int code) {
        super(message, code);
    }
}
