package work.hostbridge.registry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of a handler invocation: either a value available right away or a future that completes on a later
 * turn of the host loop.
 */
public sealed interface HandlerResult permits HandlerResult.Immediate, HandlerResult.Deferred {

    static HandlerResult immediate(Object value) {
        return new Immediate(value);
    }

    static HandlerResult deferred(CompletableFuture<?> future) {
        return new Deferred(future);
    }

    record Immediate(Object value) implements HandlerResult {}

    record Deferred(CompletableFuture<?> future) implements HandlerResult {
        public Deferred {
            Objects.requireNonNull(future, "future");
        }
    }
}
