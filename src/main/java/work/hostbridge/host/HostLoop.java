package work.hostbridge.host;

/**
 * The host's single cooperative thread, seen from the dispatch side. Ticks run once per loop turn while attached.
 */
public interface HostLoop {
    /**
     * Attaches {@code tick} so it runs on every turn. Attaching an attached tick is a no-op.
     */
    void attach(Runnable tick);

    /**
     * Detaches {@code tick}. Detaching a tick that is not attached is a no-op.
     */
    void detach(Runnable tick);

    /**
     * Runs {@code action} on a later turn of the loop, on the loop thread.
     */
    void post(Runnable action);
}
