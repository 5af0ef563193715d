package de.caluga.topology.sdam;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared by a topology and all of its monitors. Cancelling stops every monitor.
 */
public class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled = false;

    public void cancel() {
        List<Runnable> toRun;

        synchronized (this) {
            if (cancelled) {
                return;
            }

            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }

        for (Runnable r : toRun) {
            run(r);
        }
    }

    /**
     * registers a callback, runs it right away if already cancelled
     */
    public void onCancel(Runnable r) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(r);
                return;
            }
        }

        run(r);
    }

    /**
     * drops a callback registered with {@link #onCancel(Runnable)}, e.g. when its owner is closed first
     */
    public synchronized boolean removeOnCancel(Runnable r) {
        return callbacks.remove(r);
    }

    public synchronized int getCallbackCount() {
        return callbacks.size();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private static void run(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            log.error("cancel callback failed", e);
        }
    }
}
