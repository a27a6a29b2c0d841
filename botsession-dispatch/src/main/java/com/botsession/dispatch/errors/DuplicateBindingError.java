package com.botsession.dispatch.errors;

import com.botsession.common.errors.BotSessionException;

/**
 * A binding would share a prefix and trigger with an existing binding in an
 * overlapping scope.
 */
public class DuplicateBindingError extends BotSessionException {

    public static final int CODE = 100;

    private final String prefix;
    private final String trigger;

    public DuplicateBindingError(String prefix, String trigger) {
        super("command '" + prefix + trigger + "' is already bound in an overlapping scope", CODE);
        this.prefix = prefix;
        this.trigger = trigger;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getTrigger() {
        return trigger;
    }
}
