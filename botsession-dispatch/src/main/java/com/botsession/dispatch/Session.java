package com.botsession.dispatch;

import com.botsession.common.config.BotSessionConfig;
import com.botsession.dispatch.errors.InvalidConfigurationError;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Command binder owning one {@link CommandRegistry}.
 *
 * <pre>
 * Session session = new Session();
 * session.bind((env, params) -&gt; env.send(String.join(" ", params)), "echo");
 * session.command("ping")
 *         .prefixes("/")
 *         .limitation("group")
 *         .handle((env, params) -&gt; env.send("pong"));
 * CommandDispatcher dispatcher = session.dispatcher();
 * </pre>
 *
 * Limitation tokens name the conversation kinds a command may run in:
 * {@code "channel"}, {@code "group"} and {@code "c2c"}. Leaving them out
 * allows every kind.
 */
public class Session {

    private final CommandRegistry registry = new CommandRegistry();
    private final List<String> defaultPrefixes;

    public Session() {
        this(CommandBinding.DEFAULT_PREFIXES);
    }

    public Session(List<String> defaultPrefixes) {
        if (defaultPrefixes == null || defaultPrefixes.isEmpty()) {
            throw new InvalidConfigurationError("default prefixes must not be empty");
        }
        this.defaultPrefixes = List.copyOf(defaultPrefixes);
    }

    /**
     * Session whose default prefixes come from the dispatch config section.
     */
    public static Session fromConfig(BotSessionConfig config) {
        BotSessionConfig.DispatchConfig dispatch = config != null ? config.getDispatch() : null;
        if (dispatch == null || dispatch.getDefaultPrefixes() == null || dispatch.getDefaultPrefixes().isEmpty()) {
            return new Session();
        }
        return new Session(dispatch.getDefaultPrefixes());
    }

    /**
     * Bind a handler under the default prefixes with no scope restriction.
     */
    public CommandBinding bind(CommandHandler handler, String... triggers) {
        return command(triggers).handle(handler);
    }

    /**
     * Start a binding for the given trigger names.
     */
    public CommandBuilder command(String... triggers) {
        return new CommandBuilder(triggers == null ? List.of() : Arrays.asList(triggers));
    }

    /**
     * Register a fully built binding.
     */
    public CommandBinding register(CommandBinding binding) {
        registry.register(binding);
        return binding;
    }

    public List<CommandBinding> getBindings() {
        return registry.allBindings();
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public List<String> getDefaultPrefixes() {
        return defaultPrefixes;
    }

    /**
     * Combine this session's bindings with those of other sessions into a new
     * session. Order is this session first, then the others as given; null
     * entries are skipped. Overlapping bindings fail with
     * {@link com.botsession.dispatch.errors.DuplicateBindingError}.
     */
    public Session fusion(Session... sessions) {
        Session fused = new Session(defaultPrefixes);
        getBindings().forEach(fused::register);
        if (sessions != null) {
            for (Session other : sessions) {
                if (other != null) {
                    other.getBindings().forEach(fused::register);
                }
            }
        }
        return fused;
    }

    public CommandDispatcher dispatcher() {
        return new CommandDispatcher(registry);
    }

    public CommandDispatcher dispatcher(Executor executor, Duration handlerTimeout) {
        return new CommandDispatcher(registry, executor, handlerTimeout);
    }

    /**
     * Dispatcher using the handler timeout of the dispatch config section.
     */
    public CommandDispatcher dispatcher(BotSessionConfig config, Executor executor) {
        BotSessionConfig.DispatchConfig dispatch = config != null ? config.getDispatch() : null;
        long timeoutMs = dispatch != null && dispatch.getHandlerTimeoutMs() != null
                ? dispatch.getHandlerTimeoutMs()
                : 0L;
        return dispatcher(executor != null ? executor : ForkJoinPool.commonPool(),
                Duration.ofMillis(Math.max(0L, timeoutMs)));
    }

    /**
     * Parse limitation tokens into conversation kinds.
     *
     * @throws InvalidConfigurationError on an unknown token
     */
    public static Set<ConversationKind> parseLimitation(Collection<String> tokens) {
        Set<ConversationKind> kinds = EnumSet.noneOf(ConversationKind.class);
        if (tokens == null) {
            return kinds;
        }
        for (String token : tokens) {
            ConversationKind kind = ConversationKind.normalize(token);
            if (kind == null) {
                throw new InvalidConfigurationError("unknown limitation '" + token
                        + "', expected one of channel, group, c2c");
            }
            kinds.add(kind);
        }
        return kinds;
    }

    /**
     * Builder for one binding; {@link #handle(CommandHandler)} registers it.
     */
    public final class CommandBuilder {

        private final List<String> triggers;
        private List<String> prefixes = defaultPrefixes;
        private Set<ConversationKind> scopes = EnumSet.noneOf(ConversationKind.class);

        private CommandBuilder(List<String> triggers) {
            this.triggers = triggers;
        }

        public CommandBuilder prefixes(String... prefixes) {
            return prefixes(prefixes == null ? null : Arrays.asList(prefixes));
        }

        public CommandBuilder prefixes(List<String> prefixes) {
            this.prefixes = prefixes;
            return this;
        }

        public CommandBuilder limitation(String... tokens) {
            return limitation(tokens == null ? null : Arrays.asList(tokens));
        }

        public CommandBuilder limitation(Collection<String> tokens) {
            this.scopes = parseLimitation(tokens);
            return this;
        }

        public CommandBuilder scopes(ConversationKind... kinds) {
            Set<ConversationKind> set = EnumSet.noneOf(ConversationKind.class);
            if (kinds != null) {
                set.addAll(Arrays.asList(kinds));
            }
            this.scopes = set;
            return this;
        }

        public CommandBinding handle(CommandHandler handler) {
            return register(new CommandBinding(triggers, prefixes, scopes, handler));
        }
    }
}
