package org.chessarena.agent;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An external player that answers a prompt with free text containing a move.
 * Cancelling a returned future aborts the underlying request.
 */
public interface MoveAgent extends AutoCloseable {

    String name();

    CompletableFuture<String> requestMove(String prompt);

    /**
     * Incremental variant of {@link #requestMove}. Agents without a streaming
     * transport emit the whole reply as a single delta.
     */
    default CompletableFuture<String> streamMove(String prompt, Consumer<String> onDelta) {
        return requestMove(prompt).thenApply(content -> {
            onDelta.accept(content);
            return content;
        });
    }

    @Override
    default void close() {
    }
}
