package com.botsession.dispatch;

import com.botsession.common.logging.SubsystemLogger;
import com.botsession.dispatch.errors.HandlerError;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Matches each inbound envelope and runs at most one handler for it.
 * <p>
 * The dispatcher is the failure boundary for handlers: whatever a handler
 * throws or fails its future with comes back as {@link DispatchOutcome.Failed}
 * and never escapes {@link #dispatch(Envelope)}. No state is written while
 * dispatching, so independent envelopes may be dispatched concurrently.
 */
public class CommandDispatcher {

    private static final SubsystemLogger log = SubsystemLogger.create("dispatch");

    private final CommandRegistry registry;
    private final Executor executor;
    private final Duration handlerTimeout;

    public CommandDispatcher(CommandRegistry registry) {
        this(registry, ForkJoinPool.commonPool(), Duration.ZERO);
    }

    /**
     * @param handlerTimeout upper bound on one handler run; zero or null
     *                       disables the bound
     */
    public CommandDispatcher(CommandRegistry registry, Executor executor, Duration handlerTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.handlerTimeout = handlerTimeout != null && !handlerTimeout.isNegative()
                ? handlerTimeout
                : Duration.ZERO;
    }

    /**
     * Dispatch one envelope on the caller's thread. The returned future
     * completes when the handler (if any) has finished; it never completes
     * exceptionally.
     */
    public CompletableFuture<DispatchOutcome> dispatch(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        MatchResult result = CommandMatcher.match(envelope, registry);

        if (result instanceof MatchResult.Matched matched) {
            return invoke(envelope, matched);
        }
        if (result instanceof MatchResult.ScopeRejected rejected) {
            log.debug("Command rejected for conversation kind", Map.of(
                    "trigger", rejected.trigger(),
                    "scope", String.valueOf(rejected.scope()),
                    "allowed", rejected.binding().allowedScopes()));
            return CompletableFuture.completedFuture(
                    new DispatchOutcome.Rejected(rejected.trigger(), rejected.scope()));
        }
        log.debug("No command matched", Map.of("sender", String.valueOf(envelope.senderId())));
        return CompletableFuture.completedFuture(new DispatchOutcome.Ignored());
    }

    /**
     * Dispatch one envelope on this dispatcher's executor, so a slow handler
     * never holds up the caller.
     */
    public CompletableFuture<DispatchOutcome> dispatchAsync(Envelope envelope) {
        return CompletableFuture.supplyAsync(() -> dispatch(envelope), executor)
                .thenCompose(Function.identity());
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    private CompletableFuture<DispatchOutcome> invoke(Envelope envelope, MatchResult.Matched matched) {
        String trigger = matched.trigger();
        log.debug("Dispatching command", Map.of(
                "trigger", trigger,
                "prefix", matched.prefix(),
                "params", matched.params(),
                "sender", String.valueOf(envelope.senderId())));

        CompletableFuture<Void> run;
        try {
            run = matched.binding().handler().handle(envelope, matched.params());
            if (run == null) {
                run = CompletableFuture.completedFuture(null);
            }
        } catch (Exception | Error e) {
            run = CompletableFuture.failedFuture(e);
        }

        if (!handlerTimeout.isZero()) {
            run = run.copy().orTimeout(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return run.handle((ignored, err) -> {
            if (err == null) {
                log.debug("Command handled", Map.of("trigger", trigger));
                return new DispatchOutcome.Handled(trigger, matched.params());
            }
            HandlerError error = new HandlerError(trigger, unwrap(err));
            log.warn("Command handler failed", Map.of("trigger", trigger), error.getCause());
            return new DispatchOutcome.Failed(error);
        });
    }

    private static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
