package com.botsession.dispatch.errors;

import com.botsession.common.errors.BotSessionException;

/**
 * A command handler failed while handling a message.
 */
public class HandlerError extends BotSessionException {

    public static final int CODE = 500;

    private final String trigger;

    public HandlerError(String trigger, Throwable cause) {
        super("handler for '" + trigger + "' failed: " + describe(cause), CODE, cause);
        this.trigger = trigger;
    }

    public String getTrigger() {
        return trigger;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank()
                ? message
                : cause.getClass().getSimpleName();
    }
}
