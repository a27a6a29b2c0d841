package com.botsession.dispatch;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the binding an envelope addresses.
 * <p>
 * Prefixes are tried longest first so that the empty prefix, which every text
 * starts with, is tried last. Under one (prefix, trigger) pair the first
 * binding in registration order whose scope permits the conversation wins.
 * A scope miss is remembered but scanning goes on with the remaining
 * prefixes. Matching reads the registry only and has no side effects.
 */
public final class CommandMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CommandMatcher() {
    }

    public static MatchResult match(Envelope envelope, CommandRegistry registry) {
        String text = envelope.rawText() == null ? "" : envelope.rawText().strip();
        ConversationKind kind = envelope.conversationKind();

        MatchResult.ScopeRejected rejected = null;
        for (String prefix : registry.prefixesLongestFirst()) {
            if (!text.startsWith(prefix)) {
                continue;
            }
            List<String> tokens = tokenize(text.substring(prefix.length()));
            if (tokens.isEmpty()) {
                continue;
            }
            String trigger = tokens.get(0);
            List<CommandBinding> candidates = registry.lookup(prefix, trigger);
            for (CommandBinding binding : candidates) {
                if (binding.permits(kind)) {
                    return new MatchResult.Matched(binding, prefix, trigger, tokens.subList(1, tokens.size()));
                }
            }
            if (rejected == null && !candidates.isEmpty()) {
                rejected = new MatchResult.ScopeRejected(candidates.get(0), trigger, kind);
            }
        }
        return rejected != null ? rejected : new MatchResult.NoMatch();
    }

    /**
     * Whether the text holds any character the tokenizer splits on.
     */
    public static boolean containsWhitespace(String text) {
        return text != null && WHITESPACE.matcher(text).find();
    }

    /**
     * Split on runs of whitespace after trimming. No quoting.
     */
    public static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return WHITESPACE.splitAsStream(trimmed)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toList());
    }
}
