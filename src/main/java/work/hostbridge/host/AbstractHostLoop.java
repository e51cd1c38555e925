package work.hostbridge.host;

import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frame bookkeeping shared by the loop implementations. A frame first drains the actions that were posted before it
 * started, then runs each attached tick once.
 */
abstract class AbstractHostLoop implements HostLoop {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractHostLoop.class);

    private final Set<Runnable> ticks = new CopyOnWriteArraySet<>();
    private final Queue<Runnable> posted = new ConcurrentLinkedQueue<>();
    private final AtomicLong frames = new AtomicLong();

    @Override
    public void attach(Runnable tick) {
        Objects.requireNonNull(tick, "tick");
        if (ticks.add(tick)) {
            LOG.trace("Tick attached: {}", tick);
            wake();
        }
    }

    @Override
    public void detach(Runnable tick) {
        if (tick != null && ticks.remove(tick)) {
            LOG.trace("Tick detached: {}", tick);
        }
    }

    @Override
    public void post(Runnable action) {
        posted.add(Objects.requireNonNull(action, "action"));
        wake();
    }

    public boolean isAttached(Runnable tick) {
        return ticks.contains(tick);
    }

    public int attachedCount() {
        return ticks.size();
    }

    public int postedCount() {
        return posted.size();
    }

    public long frameCount() {
        return frames.get();
    }

    boolean hasWork() {
        return !ticks.isEmpty() || !posted.isEmpty();
    }

    boolean hasTicks() {
        return !ticks.isEmpty();
    }

    void runFrame() {
        int due = posted.size();
        for (int i = 0; i < due; i++) {
            Runnable action = posted.poll();
            if (action == null) {
                break;
            }
            runGuarded(action, "posted action");
        }
        for (Runnable tick : ticks) {
            runGuarded(tick, "tick");
        }
        frames.incrementAndGet();
    }

    /**
     * Called when a tick is attached or an action is posted.
     */
    void wake() {}

    private static void runGuarded(Runnable runnable, String kind) {
        try {
            runnable.run();
        } catch (VirtualMachineError ex) {
            throw ex;
        } catch (RuntimeException | Error ex) {
            LOG.error("Host loop {} failed: {}", kind, ex.getMessage(), ex);
        }
    }
}
