package com.botsession.dispatch;

import com.botsession.dispatch.errors.DuplicateBindingError;
import com.botsession.dispatch.errors.InvalidConfigurationError;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {

    private static final CommandHandler NOOP = (env, params) -> null;

    private static CommandBinding ping(List<String> prefixes, ConversationKind... scopes) {
        return new CommandBinding(List.of("ping"), prefixes, Set.of(scopes), NOOP);
    }

    @Nested
    class Duplicates {

        @Test
        void disjointScopes_bothRegister() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("/"), ConversationKind.GROUP));
            registry.register(ping(List.of("/"), ConversationKind.DIRECT));

            assertEquals(2, registry.size());
            assertEquals(2, registry.lookup("/", "ping").size());
        }

        @Test
        void overlappingScopes_fail() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("/"), ConversationKind.GROUP, ConversationKind.CHANNEL));

            var error = assertThrows(DuplicateBindingError.class,
                    () -> registry.register(ping(List.of("/"), ConversationKind.CHANNEL)));
            assertEquals("/", error.getPrefix());
            assertEquals("ping", error.getTrigger());
            assertEquals(DuplicateBindingError.CODE, error.getCode());
        }

        @Test
        void emptyScopeOverlapsEverything() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("/")));

            assertThrows(DuplicateBindingError.class,
                    () -> registry.register(ping(List.of("/"), ConversationKind.DIRECT)));
            assertThrows(DuplicateBindingError.class, () -> registry.register(ping(List.of("/"))));
        }

        @Test
        void differentPrefixes_doNotConflict() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("/")));
            registry.register(ping(List.of("!")));

            assertEquals(2, registry.size());
        }

        @Test
        void sharedPairInMultiPrefixBinding_conflicts() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("!")));

            assertThrows(DuplicateBindingError.class, () -> registry.register(ping(List.of("/", "!"))));
        }

        @Test
        void failedRegistration_leavesRegistryUnchanged() {
            var registry = new CommandRegistry();
            registry.register(ping(List.of("!")));
            List<String> prefixesBefore = registry.prefixesLongestFirst();

            assertThrows(DuplicateBindingError.class, () -> registry.register(ping(List.of("/", "!"))));

            assertEquals(1, registry.size());
            assertEquals(prefixesBefore, registry.prefixesLongestFirst());
            assertTrue(registry.lookup("/", "ping").isEmpty());
        }

        @Test
        void nullBinding_isInvalid() {
            var registry = new CommandRegistry();
            assertThrows(InvalidConfigurationError.class, () -> registry.register(null));
        }
    }

    @Nested
    class Snapshots {

        @Test
        void allBindings_keepsRegistrationOrder() {
            var registry = new CommandRegistry();
            var a = CommandBinding.of(NOOP, "a");
            var b = CommandBinding.of(NOOP, "b");
            registry.register(a);
            registry.register(b);

            assertEquals(List.of(a, b), registry.allBindings());
        }

        @Test
        void snapshot_isNotAffectedByLaterRegistration() {
            var registry = new CommandRegistry();
            registry.register(CommandBinding.of(NOOP, "a"));
            List<CommandBinding> before = registry.allBindings();

            registry.register(CommandBinding.of(NOOP, "b"));

            assertEquals(1, before.size());
            assertEquals(2, registry.allBindings().size());
            assertThrows(UnsupportedOperationException.class, () -> before.add(CommandBinding.of(NOOP, "c")));
        }

        @Test
        void prefixes_longestFirst_equalLengthsKeepOrder() {
            var registry = new CommandRegistry();
            registry.register(new CommandBinding(List.of("a"), List.of("", "/", "#"), Set.of(), NOOP));
            registry.register(new CommandBinding(List.of("b"), List.of(">>", "!"), Set.of(), NOOP));

            assertEquals(List.of(">>", "/", "#", "!", ""), registry.prefixesLongestFirst());
        }

        @Test
        void concurrentRegistration_keepsEveryBinding() throws Exception {
            var registry = new CommandRegistry();
            int threads = 8;
            int perThread = 50;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    int id = t;
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            registry.register(CommandBinding.of(NOOP, "cmd-" + id + "-" + i));
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get();
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(threads * perThread, registry.size());
            assertEquals(1, registry.lookup("/", "cmd-3-7").size());
        }
    }
}
