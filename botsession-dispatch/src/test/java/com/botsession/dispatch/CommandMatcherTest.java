package com.botsession.dispatch;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandMatcherTest {

    private static final CommandHandler NOOP = (env, params) -> null;

    private static CommandBinding binding(List<String> prefixes, Set<ConversationKind> scopes, String... triggers) {
        return new CommandBinding(List.of(triggers), prefixes, scopes, NOOP);
    }

    @Nested
    class Prefixes {

        @Test
        void defaultPrefixes_matchWithAndWithoutSlash() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "echo"));

            var slash = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("/echo hi"), registry));
            assertEquals("/", slash.prefix());
            assertEquals("echo", slash.trigger());
            assertEquals(List.of("hi"), slash.params());

            var bare = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("echo hi"), registry));
            assertEquals("", bare.prefix());
            assertEquals(List.of("hi"), bare.params());
        }

        @Test
        void triggerIsWholeToken_notSubstring() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "echo"));

            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group("echox hi"), registry));
            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group("/echox hi"), registry));
        }

        @Test
        void longestPrefixTriedFirst() {
            var registry = new CommandRegistry();
            var bang = binding(List.of("!"), Set.of(), "!go");
            var doubleBang = binding(List.of("!!"), Set.of(), "go");
            registry.register(bang);
            registry.register(doubleBang);

            assertEquals(List.of("!!", "!"), registry.prefixesLongestFirst());
            var result = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("!!go now"), registry));
            assertSame(doubleBang, result.binding());
        }

        @Test
        void fallsBackToShorterPrefix_whenLongerHasNoTrigger() {
            var registry = new CommandRegistry();
            registry.register(binding(List.of("//"), Set.of(), "other"));
            var echo = binding(List.of("/"), Set.of(), "/echo");
            registry.register(echo);

            var result = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("//echo x"), registry));
            assertSame(echo, result.binding());
            assertEquals(List.of("x"), result.params());
        }

        @Test
        void whitespaceAfterPrefix_isIgnored() {
            var registry = new CommandRegistry();
            registry.register(binding(List.of("/"), Set.of(), "echo"));

            var result = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("  /   echo   a  b "), registry));
            assertEquals(List.of("a", "b"), result.params());
        }

        @Test
        void prefixAlone_isNoMatch() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "echo"));

            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group("/"), registry));
            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group("   "), registry));
            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group(null), registry));
        }

        @Test
        void triggersAreCaseSensitive() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "echo"));

            assertInstanceOf(MatchResult.NoMatch.class,
                    CommandMatcher.match(RecordingEnvelope.group("/Echo hi"), registry));
        }
    }

    @Nested
    class Scopes {

        @Test
        void unrestrictedBinding_matchesEveryKind() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "help"));

            for (ConversationKind kind : ConversationKind.values()) {
                assertInstanceOf(MatchResult.Matched.class,
                        CommandMatcher.match(new RecordingEnvelope("/help", kind), registry));
            }
        }

        @Test
        void firstPermittedBinding_wins() {
            var registry = new CommandRegistry();
            var group = binding(List.of("/"), Set.of(ConversationKind.GROUP), "ping");
            var direct = binding(List.of("/"), Set.of(ConversationKind.DIRECT), "ping");
            registry.register(group);
            registry.register(direct);

            var inGroup = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.group("/ping"), registry));
            assertSame(group, inGroup.binding());

            var inDirect = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.direct("/ping"), registry));
            assertSame(direct, inDirect.binding());
        }

        @Test
        void noPermittedBinding_isScopeRejected() {
            var registry = new CommandRegistry();
            var group = binding(List.of("/"), Set.of(ConversationKind.GROUP), "ping");
            registry.register(group);

            var result = assertInstanceOf(MatchResult.ScopeRejected.class,
                    CommandMatcher.match(RecordingEnvelope.channel("/ping"), registry));
            assertSame(group, result.binding());
            assertEquals("ping", result.trigger());
            assertEquals(ConversationKind.CHANNEL, result.scope());
        }

        @Test
        void scopeMissUnderLongPrefix_doesNotMaskShorterPrefixMatch() {
            var registry = new CommandRegistry();
            registry.register(binding(List.of("/"), Set.of(ConversationKind.GROUP), "ping"));
            var bare = binding(List.of(""), Set.of(), "/ping");
            registry.register(bare);

            var result = assertInstanceOf(MatchResult.Matched.class,
                    CommandMatcher.match(RecordingEnvelope.direct("/ping"), registry));
            assertSame(bare, result.binding());
        }
    }

    @Test
    void matchIsIdempotent() {
        var registry = new CommandRegistry();
        registry.register(CommandBinding.of(NOOP, "echo"));
        var envelope = RecordingEnvelope.group("/echo a b");

        assertEquals(CommandMatcher.match(envelope, registry), CommandMatcher.match(envelope, registry));
    }

    @Test
    void tokenize_splitsOnWhitespaceRuns() {
        assertEquals(List.of("a", "b", "c"), CommandMatcher.tokenize(" a \t b\n c "));
        assertEquals(List.of("\"a", "b\""), CommandMatcher.tokenize("\"a b\""));
        assertEquals(List.of("a", "b"), CommandMatcher.tokenize("a　b"));
        assertEquals(List.of(), CommandMatcher.tokenize("   "));
        assertEquals(List.of(), CommandMatcher.tokenize(null));
    }
}
