package work.hostbridge.dispatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostbridge.envelope.CommandEnvelope;
import work.hostbridge.envelope.CommandEnvelopes;
import work.hostbridge.envelope.MalformedCommandException;
import work.hostbridge.envelope.ResponseEnvelopes;
import work.hostbridge.host.HostLoop;
import work.hostbridge.registry.CommandHandler;
import work.hostbridge.registry.CommandRegistry;
import work.hostbridge.registry.HandlerResult;
import work.hostbridge.registry.UnknownCommandException;

/**
 * Executes submitted commands on the host loop thread.
 *
 * <p>Any thread may {@link #submit(String, CancellationToken) submit}; the returned future completes with the JSON
 * response envelope, or is cancelled when the caller's token fires before a tick claims the request. The scheduler's
 * tick is attached to the {@link HostLoop} only while requests are pending. Each tick claims every unclaimed request
 * under the lock and processes them outside it, so handlers may submit further commands without deadlocking.
 *
 * <p>A handler returning {@link HandlerResult.Deferred} keeps its request pending (claimed) until the inner future
 * completes; the bookkeeping removal is then posted back to the loop.
 */
public final class CommandScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(CommandScheduler.class);

    private enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final CommandRegistry registry;
    private final HostLoop loop;
    private final Runnable tick = this::drainOnce;
    private final Object lock = new Object();
    private final Map<String, PendingCommand> pending = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private boolean hooked;
    private State state = State.NEW;

    public CommandScheduler(CommandRegistry registry, HostLoop loop) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    /**
     * Initializes the registry and accepts work. Submissions are also accepted before {@code start()}; the registry
     * is then initialized lazily by the first command that needs it.
     */
    public void start() {
        synchronized (lock) {
            if (state == State.STOPPED) {
                throw new IllegalStateException("Scheduler already stopped");
            }
            state = State.RUNNING;
        }
        registry.initialize();
        LOG.debug("Command scheduler started");
    }

    /**
     * Rejects further submissions and cancels every request that has not been claimed yet. Claimed requests run to
     * completion.
     */
    public void stop() {
        var abandoned = new ArrayList<PendingCommand>();
        synchronized (lock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            Iterator<PendingCommand> it = pending.values().iterator();
            while (it.hasNext()) {
                PendingCommand request = it.next();
                if (!request.claimed()) {
                    it.remove();
                    abandoned.add(request);
                }
            }
            unhookIfIdle();
        }
        for (PendingCommand request : abandoned) {
            request.release();
            request.cancel();
        }
        LOG.debug("Command scheduler stopped, {} unclaimed request(s) cancelled", abandoned.size());
    }

    /**
     * Queues {@code commandText} for execution on the host loop and returns without blocking.
     *
     * @param commandText raw command text, never {@code null}; empty text yields an error response
     * @param token cancellation signal honoured until the request is claimed, {@code null} for none
     * @throws IllegalStateException when the scheduler has been stopped
     */
    public CompletableFuture<String> submit(String commandText, CancellationToken token) {
        Objects.requireNonNull(commandText, "commandText");
        CancellationToken effective = token == null ? CancellationToken.NONE : token;
        String id = "cmd-" + sequence.incrementAndGet();
        var completion = new CompletableFuture<String>();
        CancellationToken.Registration registration = effective.onCancel(() -> cancelPending(id));
        var request = new PendingCommand(id, commandText, completion, effective, registration);
        synchronized (lock) {
            if (state == State.STOPPED) {
                registration.close();
                throw new IllegalStateException("Scheduler is stopped; command rejected");
            }
            pending.put(id, request);
            hookIfNeeded();
        }
        return completion;
    }

    public CompletableFuture<String> submit(String commandText) {
        return submit(commandText, CancellationToken.NONE);
    }

    /**
     * One turn of the scheduler. Runs on the host loop; transports never call it.
     */
    void drainOnce() {
        var ready = new ArrayList<PendingCommand>();
        synchronized (lock) {
            for (PendingCommand request : pending.values()) {
                if (!request.claimed()) {
                    request.markClaimed();
                    ready.add(request);
                }
            }
            if (ready.isEmpty()) {
                unhookIfIdle();
                return;
            }
        }
        for (PendingCommand request : ready) {
            process(request);
        }
    }

    private void process(PendingCommand request) {
        if (request.token().isCancelled()) {
            remove(request);
            request.cancel();
            return;
        }

        String text = request.commandText().trim();
        if (text.isEmpty()) {
            finish(request, ResponseEnvelopes.error("Empty command received", null));
            return;
        }
        if (CommandEnvelopes.isPing(text)) {
            finish(request, ResponseEnvelopes.pong());
            return;
        }
        if (!CommandEnvelopes.isValidJson(text)) {
            finish(request, ResponseEnvelopes.invalidJson(text));
            return;
        }

        String type = null;
        try {
            CommandEnvelope envelope = CommandEnvelopes.parse(text);
            type = envelope.type();
            if (!envelope.hasType()) {
                finish(request, ResponseEnvelopes.error("Command type cannot be empty", null));
                return;
            }
            if (envelope.isPing()) {
                finish(request, ResponseEnvelopes.pong());
                return;
            }
            registry.initialize();
            CommandHandler handler = registry.resolve(type);
            LOG.debug("Dispatching {} as '{}'", request.id(), type);
            HandlerResult result = handler.handle(envelope.params());
            if (result instanceof HandlerResult.Deferred deferred) {
                awaitDeferred(request, type, deferred.future());
                return;
            }
            Object value = result instanceof HandlerResult.Immediate immediate ? immediate.value() : null;
            finish(request, ResponseEnvelopes.success(value));
        } catch (MalformedCommandException ex) {
            finish(request, ResponseEnvelopes.error(ex.getMessage(), type));
        } catch (UnknownCommandException ex) {
            LOG.warn(ex.getMessage());
            finish(request, ResponseEnvelopes.error(ex.getMessage(), ex.command()));
        } catch (VirtualMachineError ex) {
            throw ex;
        } catch (Exception | Error ex) {
            LOG.error("Error processing command '{}': {}", type, ResponseEnvelopes.messageOf(ex), ex);
            finish(request, ResponseEnvelopes.failure(ex, type));
        }
    }

    private void awaitDeferred(PendingCommand request, String type, CompletableFuture<?> future) {
        LOG.debug("Command {} ('{}') deferred", request.id(), type);
        future.whenComplete((value, error) -> {
            if (error == null) {
                request.complete(ResponseEnvelopes.success(value));
            } else {
                Throwable cause = unwrap(error);
                LOG.error("Deferred command '{}' failed: {}", type, ResponseEnvelopes.messageOf(cause), cause);
                request.complete(ResponseEnvelopes.failure(cause, type));
            }
            loop.post(() -> remove(request));
        });
    }

    private void finish(PendingCommand request, String payload) {
        remove(request);
        request.complete(payload);
    }

    private void remove(PendingCommand request) {
        synchronized (lock) {
            pending.remove(request.id());
            unhookIfIdle();
        }
        request.release();
    }

    private void cancelPending(String id) {
        PendingCommand request;
        synchronized (lock) {
            request = pending.get(id);
            if (request == null || request.claimed()) {
                return;
            }
            pending.remove(id);
            unhookIfIdle();
        }
        request.release();
        request.cancel();
        LOG.debug("Command {} cancelled before execution", id);
    }

    private void hookIfNeeded() {
        if (!hooked) {
            hooked = true;
            loop.attach(tick);
        }
    }

    private void unhookIfIdle() {
        if (pending.isEmpty() && hooked) {
            hooked = false;
            loop.detach(tick);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public boolean isHooked() {
        synchronized (lock) {
            return hooked;
        }
    }

    public boolean isStopped() {
        synchronized (lock) {
            return state == State.STOPPED;
        }
    }
}
