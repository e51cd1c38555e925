package work.hostbridge.host;

import java.util.function.BooleanSupplier;

/**
 * Loop pumped by a host that already owns a per-frame callback: call {@link #frame()} once per frame from the
 * host's mutation thread.
 */
public final class FrameHostLoop extends AbstractHostLoop {
    private boolean inFrame;

    public void frame() {
        if (inFrame) {
            throw new IllegalStateException("frame() is not reentrant");
        }
        inFrame = true;
        try {
            runFrame();
        } finally {
            inFrame = false;
        }
    }

    /**
     * Pumps frames until {@code condition} holds or {@code maxFrames} frames ran. Returns the number of frames run.
     */
    public int frameUntil(BooleanSupplier condition, int maxFrames) {
        int count = 0;
        while (count < maxFrames && !condition.getAsBoolean()) {
            frame();
            count++;
        }
        return count;
    }
}
