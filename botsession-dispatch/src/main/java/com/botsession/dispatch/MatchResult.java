package com.botsession.dispatch;

import java.util.List;

/**
 * Outcome of matching one envelope against the registry.
 */
public sealed interface MatchResult permits MatchResult.Matched, MatchResult.NoMatch, MatchResult.ScopeRejected {

    /** A binding accepts the message; {@code params} are the tokens after the trigger. */
    record Matched(CommandBinding binding, String prefix, String trigger, List<String> params)
            implements MatchResult {

        public Matched {
            params = List.copyOf(params);
        }
    }

    /** No registered prefix and trigger combination starts the message. */
    record NoMatch() implements MatchResult {
    }

    /** The text names a command, but none of its bindings allows this conversation kind. */
    record ScopeRejected(CommandBinding binding, String trigger, ConversationKind scope)
            implements MatchResult {
    }
}
