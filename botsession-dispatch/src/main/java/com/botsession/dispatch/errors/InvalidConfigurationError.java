package com.botsession.dispatch.errors;

import com.botsession.common.errors.BotSessionException;

/**
 * A command binding is malformed: no trigger, a blank trigger, no prefix, no
 * handler or an unknown limitation token.
 */
public class InvalidConfigurationError extends BotSessionException {

    public static final int CODE = 100;

    public InvalidConfigurationError(String message) {
        super(message, CODE);
    }
}
