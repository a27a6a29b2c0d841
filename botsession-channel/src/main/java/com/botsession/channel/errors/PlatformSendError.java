package com.botsession.channel.errors;

import com.botsession.common.errors.BotSessionException;

/** The platform client failed to deliver a reply. */
public class PlatformSendError extends BotSessionException {

    public static final int CODE = 500;

    public PlatformSendError(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
