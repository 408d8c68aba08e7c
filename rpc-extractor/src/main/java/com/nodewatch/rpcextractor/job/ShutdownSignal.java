package com.nodewatch.rpcextractor.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide cooperative shutdown flag. Set at most once, never reset.
 */
public class ShutdownSignal {

    private final AtomicBoolean triggered = new AtomicBoolean(false);

    /**
     * @return true only for the call that actually set the signal
     */
    public boolean trigger() {
        return triggered.compareAndSet(false, true);
    }

    public boolean isTriggered() {
        return triggered.get();
    }
}
