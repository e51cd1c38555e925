package work.hostbridge.dispatch;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-owned cancellation signal. Listeners registered after cancellation run immediately on the registering
 * thread; otherwise they run on the thread that calls {@link #cancel()}.
 */
public final class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled = false;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
        }
        for (Runnable listener : listeners) {
            notify(listener);
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * Registers {@code listener} to run once on cancellation. Closing the returned registration detaches it.
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return Registration.EMPTY;
        }
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        notify(listener);
        return Registration.EMPTY;
    }

    private static void notify(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException ex) {
            LOG.warn("Cancellation listener failed: {}", ex.getMessage(), ex);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        Registration EMPTY = () -> {};

        @Override
        void close();
    }
}
