package work.hostbridge.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Scheduler bookkeeping for one submission. {@code claimed} is only read and written under the scheduler lock.
 */
final class PendingCommand {
    private final String id;
    private final String commandText;
    private final CompletableFuture<String> completion;
    private final CancellationToken token;
    private final CancellationToken.Registration registration;
    private boolean claimed;

    PendingCommand(
        String id,
        String commandText,
        CompletableFuture<String> completion,
        CancellationToken token,
        CancellationToken.Registration registration
    ) {
        this.id = id;
        this.commandText = commandText;
        this.completion = completion;
        this.token = token;
        this.registration = registration;
    }

    String id() {
        return id;
    }

    String commandText() {
        return commandText;
    }

    CompletableFuture<String> completion() {
        return completion;
    }

    CancellationToken token() {
        return token;
    }

    boolean claimed() {
        return claimed;
    }

    void markClaimed() {
        claimed = true;
    }

    void complete(String payload) {
        completion.complete(payload);
    }

    void cancel() {
        completion.cancel(false);
    }

    void release() {
        registration.close();
    }
}
