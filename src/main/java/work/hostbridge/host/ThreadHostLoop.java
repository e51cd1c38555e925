package work.hostbridge.host;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loop for hosts without a natural tick: a dedicated thread runs a frame every {@code tickInterval} while a tick is
 * attached, drains posted actions as they arrive, and blocks when there is nothing to do.
 */
public final class ThreadHostLoop extends AbstractHostLoop implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ThreadHostLoop.class);

    private final long tickMillis;
    private final Object monitor = new Object();
    private final Thread thread;
    private volatile boolean started;
    private volatile boolean closed;

    public ThreadHostLoop(Duration tickInterval) {
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must not be negative");
        }
        this.tickMillis = Math.max(1L, tickInterval.toMillis());
        this.thread = new Thread(this::loop, "host-bridge-loop");
        this.thread.setDaemon(true);
    }

    public synchronized ThreadHostLoop start() {
        if (closed) {
            throw new IllegalStateException("Host loop already closed");
        }
        if (!started) {
            started = true;
            thread.start();
            LOG.debug("Host loop thread started (tick every {} ms)", tickMillis);
        }
        return this;
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == thread;
    }

    public boolean isRunning() {
        return started && !closed && thread.isAlive();
    }

    @Override
    void wake() {
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    private void loop() {
        try {
            while (!closed) {
                synchronized (monitor) {
                    while (!closed && !hasWork()) {
                        monitor.wait();
                    }
                }
                if (closed) {
                    break;
                }
                runFrame();
                if (hasTicks()) {
                    synchronized (monitor) {
                        if (!closed) {
                            monitor.wait(tickMillis);
                        }
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Host loop thread stopped");
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        wake();
        if (started && !isLoopThread()) {
            try {
                thread.join(Math.max(1_000L, tickMillis * 10));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
