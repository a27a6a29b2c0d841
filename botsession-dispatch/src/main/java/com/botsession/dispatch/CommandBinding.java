package com.botsession.dispatch;

import com.botsession.dispatch.errors.InvalidConfigurationError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One registered command: its trigger names, accepted prefixes, the
 * conversation kinds it may run in and its handler.
 * <p>
 * Trigger names are case-sensitive and must not contain whitespace. An empty
 * scope set means the command runs everywhere.
 */
public record CommandBinding(
        List<String> triggerNames,
        List<String> prefixes,
        Set<ConversationKind> allowedScopes,
        CommandHandler handler) {

    public static final List<String> DEFAULT_PREFIXES = List.of("/", "");

    public CommandBinding {
        triggerNames = normalizeTriggers(triggerNames);
        prefixes = normalizePrefixes(prefixes);
        allowedScopes = allowedScopes == null || allowedScopes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedScopes));
        if (handler == null) {
            throw new InvalidConfigurationError("command " + triggerNames + " has no handler");
        }
    }

    /**
     * Binding with the default prefixes and no scope restriction.
     */
    public static CommandBinding of(CommandHandler handler, String... triggerNames) {
        return new CommandBinding(triggerNames == null ? null : Arrays.asList(triggerNames),
                DEFAULT_PREFIXES, Set.of(), handler);
    }

    /** First trigger name, used in logs and outcomes. */
    public String name() {
        return triggerNames.get(0);
    }

    public boolean permits(ConversationKind kind) {
        return allowedScopes.isEmpty() || allowedScopes.contains(kind);
    }

    /**
     * Whether some conversation kind is allowed by both bindings.
     */
    public boolean scopesOverlap(CommandBinding other) {
        if (allowedScopes.isEmpty() || other.allowedScopes.isEmpty()) {
            return true;
        }
        return !Collections.disjoint(allowedScopes, other.allowedScopes);
    }

    private static List<String> normalizeTriggers(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidConfigurationError("a command needs at least one trigger name");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String trigger : raw) {
            if (trigger == null || trigger.isEmpty()) {
                throw new InvalidConfigurationError("trigger names must not be empty");
            }
            if (CommandMatcher.containsWhitespace(trigger)) {
                throw new InvalidConfigurationError("trigger '" + trigger + "' contains whitespace");
            }
            seen.add(trigger);
        }
        return List.copyOf(seen);
    }

    private static List<String> normalizePrefixes(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidConfigurationError("a command needs at least one prefix");
        }
        List<String> out = new ArrayList<>();
        for (String prefix : raw) {
            if (prefix == null) {
                throw new InvalidConfigurationError("prefixes must not be null");
            }
            if (!out.contains(prefix)) {
                out.add(prefix);
            }
        }
        return List.copyOf(out);
    }
}
