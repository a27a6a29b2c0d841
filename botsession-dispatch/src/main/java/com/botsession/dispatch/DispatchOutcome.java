package com.botsession.dispatch;

import com.botsession.dispatch.errors.HandlerError;

import java.util.List;

/**
 * What happened to one dispatched envelope.
 */
public sealed interface DispatchOutcome
        permits DispatchOutcome.Handled, DispatchOutcome.Ignored, DispatchOutcome.Rejected, DispatchOutcome.Failed {

    /** The handler ran and completed normally. */
    record Handled(String trigger, List<String> params) implements DispatchOutcome {
    }

    /** No command applies. Nothing ran and nothing was sent. */
    record Ignored() implements DispatchOutcome {
    }

    /** The command exists but not for this conversation kind. Nothing is sent. */
    record Rejected(String trigger, ConversationKind scope) implements DispatchOutcome {
    }

    /** The handler ran and failed. */
    record Failed(HandlerError error) implements DispatchOutcome {

        public String trigger() {
            return error.getTrigger();
        }
    }
}
