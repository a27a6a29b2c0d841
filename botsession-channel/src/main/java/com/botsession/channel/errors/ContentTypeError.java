package com.botsession.channel.errors;

import com.botsession.common.errors.BotSessionException;

/** Raised for a platform message of an unsupported type. */
public class ContentTypeError extends BotSessionException {

    public ContentTypeError(String message, int code) {
        super(message, code);
    }
}
