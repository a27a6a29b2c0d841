package com.botsession.dispatch;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Callback invoked for a matched command.
 * <p>
 * Failures may be thrown directly or reported through the returned future;
 * the dispatcher treats both the same way. A null return counts as immediate
 * success.
 */
@FunctionalInterface
public interface CommandHandler {

    CompletableFuture<Void> handle(Envelope envelope, List<String> params) throws Exception;
}
