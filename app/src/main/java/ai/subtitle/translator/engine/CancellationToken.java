package ai.subtitle.translator.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal, checked before each provider call.
 */
public final class CancellationToken {

    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
