package de.caluga.topology.sdam;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Runs a task on its own daemon thread every <code>interval</code> ms. {@link #wake()} makes the next
 * run happen early, but never earlier than <code>minInterval</code> after the previous one. The task
 * returning false stops the executor.
 */
public class PeriodicExecutor {
    private static final Logger log = LoggerFactory.getLogger(PeriodicExecutor.class);
    private final String name;
    private final long interval;
    private final long minInterval;
    private final BooleanSupplier target;
    private final Object lock = new Object();
    private boolean event = false;
    private volatile boolean stopped = true;
    private Thread thread;

    public PeriodicExecutor(String name, long interval, long minInterval, BooleanSupplier target) {
        this.name = name;
        this.interval = interval;
        this.minInterval = minInterval;
        this.target = target;
    }

    /**
     * starts the thread. Calling open on a running executor does nothing.
     */
    public synchronized void open() {
        stopped = false;

        if (thread != null && thread.isAlive()) {
            return;
        }

        thread = new Thread(this::run, name);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * stops after the current run, does not wait for the thread
     */
    public void close() {
        stopped = true;

        synchronized (lock) {
            lock.notifyAll();
        }
    }

    public boolean join(long timeout) throws InterruptedException {
        Thread t;

        synchronized (this) {
            t = thread;
        }

        if (t == null) {
            return true;
        }

        t.join(timeout);
        return !t.isAlive();
    }

    public void wake() {
        synchronized (lock) {
            event = true;
            lock.notifyAll();
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    private void run() {
        while (!stopped) {
            boolean cont;

            try {
                cont = target.getAsBoolean();
            } catch (RuntimeException e) {
                log.error("{}: periodic task failed", name, e);
                cont = true;
            }

            if (!cont) {
                stopped = true;
                break;
            }

            long now = now();
            long deadline = now + interval;
            long earliest = now + minInterval;

            synchronized (lock) {
                try {
                    while (!stopped) {
                        now = now();

                        if (now >= deadline || (event && now >= earliest)) {
                            break;
                        }

                        lock.wait(Math.max(1, (event ? earliest : deadline) - now));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("{} interrupted", name);
                    stopped = true;
                }

                event = false;
            }
        }
    }

    private static long now() {
        return System.nanoTime() / 1000000L;
    }

    @Override
    public String toString() {
        return "PeriodicExecutor{" + name + ", interval=" + interval + "}";
    }
}
