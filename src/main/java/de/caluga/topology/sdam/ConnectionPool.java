package de.caluga.topology.sdam;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.wire.MongoConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Connections to one server. At most <code>maxPoolSize</code> connections exist at a time, borrowing
 * blocks up to <code>maxWaitTime</code> ms when all are in use.
 * <p>
 * {@link #reset()} starts a new generation: idle connections are closed right away, borrowed ones when
 * they are released.
 */
public class ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private final ServerAddress address;
    private final Supplier<MongoConnection> connectionSupplier;
    private final int maxPoolSize;
    private final long maxWaitTime;
    private final Consumer<DriverStatsKey> stats;
    private final BlockingDeque<ConnectionContainer> idle = new LinkedBlockingDeque<>();
    private final Map<MongoConnection, ConnectionContainer> borrowed = new IdentityHashMap<>();
    private final Semaphore permits;
    private final AtomicInteger generation = new AtomicInteger(0);
    private final AtomicInteger waitCounter = new AtomicInteger(0);
    private volatile boolean closed = false;

    public ConnectionPool(ServerAddress address, Supplier<MongoConnection> connectionSupplier, int maxPoolSize, long maxWaitTime, Consumer<DriverStatsKey> stats) {
        this.address = address;
        this.connectionSupplier = connectionSupplier;
        this.maxPoolSize = maxPoolSize <= 0 ? Integer.MAX_VALUE : maxPoolSize;
        this.maxWaitTime = maxWaitTime;
        this.stats = stats == null ? k -> { } : stats;
        permits = new Semaphore(this.maxPoolSize, true);
    }

    /**
     * an idle connection of the current generation, or a new one if none is idle
     */
    public MongoConnection borrowConnection() throws DriverException {
        if (closed) {
            throw new DriverException("connection pool for " + address + " is closed");
        }

        waitCounter.incrementAndGet();

        try {
            boolean acquired;

            if (maxWaitTime <= 0) {
                permits.acquire();
                acquired = true;
            } else {
                acquired = permits.tryAcquire(maxWaitTime, TimeUnit.MILLISECONDS);
            }

            if (!acquired) {
                log.error("Could not get connection to {} in time {}ms, borrowed {}, waiting {}", address, maxWaitTime, getBorrowedCount(), waitCounter.get());
                throw new DriverException(String.format("Could not get connection to %s in time %dms", address, maxWaitTime));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Waiting for connection was aborted", e);
        } finally {
            waitCounter.decrementAndGet();
        }

        try {
            ConnectionContainer c;

            while ((c = idle.pollFirst()) != null) {
                if (c.getGeneration() == generation.get() && c.getCon().isConnected()) {
                    break;
                }

                closeConnection(c.getCon());
            }

            if (c == null) {
                int gen = generation.get();
                MongoConnection con = connectionSupplier.get();
                long start = System.nanoTime();
                HelloResult hello = con.connect(address);
                stats.accept(DriverStatsKey.CONNECTIONS_OPENED);
                c = new ConnectionContainer(con, gen);
                c.setHandshake(hello, (System.nanoTime() - start) / 1000000.0);
            }

            synchronized (borrowed) {
                borrowed.put(c.getCon(), c);
            }

            stats.accept(DriverStatsKey.CONNECTIONS_BORROWED);
            return c.getCon();
        } catch (DriverException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * The handshake reply of a borrowed connection if this borrow opened it, null otherwise. Only
     * returned once per connection.
     */
    public Handshake takeHandshake(MongoConnection con) {
        synchronized (borrowed) {
            ConnectionContainer c = borrowed.get(con);

            if (c == null) {
                return null;
            }

            Handshake h = c.handshake;
            c.handshake = null;
            return h;
        }
    }

    public void releaseConnection(MongoConnection con) {
        if (con == null) {
            return;
        }

        ConnectionContainer c;

        synchronized (borrowed) {
            c = borrowed.remove(con);
        }

        if (c == null) {
            log.warn("releasing connection {} that was not borrowed from pool {}", con, address);
            return;
        }

        stats.accept(DriverStatsKey.CONNECTIONS_RELEASED);

        c.handshake = null;

        if (closed || c.getGeneration() != generation.get() || !con.isConnected()) {
            closeConnection(con);
        } else {
            idle.offerFirst(c);
        }

        permits.release();
    }

    /**
     * closes all idle connections and marks borrowed ones as stale
     */
    public void reset() {
        generation.incrementAndGet();
        List<ConnectionContainer> toClose = new ArrayList<>();
        idle.drainTo(toClose);

        for (ConnectionContainer c : toClose) {
            closeConnection(c.getCon());
        }
    }

    /**
     * opens connections until <code>minPoolSize</code> exist. Errors are logged, a failing server will
     * be noticed by its monitor anyway.
     */
    public void prefill(int minPoolSize) {
        while (!closed && idle.size() + getBorrowedCount() < Math.min(minPoolSize, maxPoolSize)) {
            if (!permits.tryAcquire()) {
                return;
            }

            try {
                int gen = generation.get();
                MongoConnection con = connectionSupplier.get();
                con.connect(address);
                stats.accept(DriverStatsKey.CONNECTIONS_OPENED);
                idle.offerLast(new ConnectionContainer(con, gen));
            } catch (DriverException | RuntimeException e) {
                log.warn("could not prefill pool for {}: {}", address, e.getMessage());
                return;
            } finally {
                permits.release();
            }
        }
    }

    public void close() {
        closed = true;
        reset();
    }

    public boolean isClosed() {
        return closed;
    }

    public ServerAddress getAddress() {
        return address;
    }

    public int getGeneration() {
        return generation.get();
    }

    public int getIdleCount() {
        return idle.size();
    }

    public int getBorrowedCount() {
        synchronized (borrowed) {
            return borrowed.size();
        }
    }

    public int getWaitCounter() {
        return waitCounter.get();
    }

    private void closeConnection(MongoConnection con) {
        try {
            con.close();
        } catch (RuntimeException e) {
            log.debug("error closing connection to {}: {}", address, e.getMessage());
        }

        stats.accept(DriverStatsKey.CONNECTIONS_CLOSED);
    }

    /**
     * reply and duration in ms of the handshake done when a connection was opened
     */
    public record Handshake(HelloResult hello, double duration) {
    }

    private static class ConnectionContainer {
        private final MongoConnection con;
        private final int generation;
        private Handshake handshake;

        ConnectionContainer(MongoConnection con, int generation) {
            this.con = con;
            this.generation = generation;
        }

        MongoConnection getCon() {
            return con;
        }

        int getGeneration() {
            return generation;
        }

        void setHandshake(HelloResult hello, double duration) {
            if (hello != null) {
                handshake = new Handshake(hello, duration);
            }
        }
    }
}
