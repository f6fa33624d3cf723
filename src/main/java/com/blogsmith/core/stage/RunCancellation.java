package com.blogsmith.core.stage;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation token for a single run.
 * <p>
 * The pipeline checks the token at every stage boundary. Cancelling also interrupts the
 * collaborator call in flight, if any, so the run does not wait for its timeout.
 */
public class RunCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private volatile Future<?> inFlight;

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public void cancel(String why) {
        if (reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            Future<?> current = inFlight;
            if (current != null) {
                current.cancel(true);
            }
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * @throws RunCancelledException if the run has been cancelled
     */
    public void throwIfCancelled(String stage) {
        String why = reason.get();
        if (why != null) {
            throw new RunCancelledException(stage, why);
        }
    }

    void track(Future<?> future) {
        inFlight = future;
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        if (inFlight == future) {
            inFlight = null;
        }
    }
}
