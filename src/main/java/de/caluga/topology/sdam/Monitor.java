package de.caluga.topology.sdam;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.wire.MongoConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Checks one server every heartbeatFrequency ms and reports the result to the {@link Topology}.
 * Uses its own single connection pool, never the application one.
 */
public class Monitor {
    public static final long MIN_HEARTBEAT_INTERVAL = 500;
    private static final Logger log = LoggerFactory.getLogger(Monitor.class);

    private final ServerAddress address;
    private final Topology topology;
    private final ConnectionPool pool;
    private final MovingAverage avgRoundTripTime = new MovingAverage();
    private final PeriodicExecutor executor;
    private final CancellationToken token;
    private final Runnable onCancel = this::close;
    private volatile ServerDescription serverDescription;
    private volatile MongoConnection current;

    public Monitor(ServerDescription serverDescription, Topology topology, ConnectionPool pool, TopologySettings settings, CancellationToken token) {
        this.serverDescription = serverDescription;
        this.address = serverDescription.getAddress();
        this.topology = topology;
        this.pool = pool;
        executor = new PeriodicExecutor("Monitor-" + address, settings.getHeartbeatFrequency(), MIN_HEARTBEAT_INTERVAL, this::run);
        this.token = token;

        if (token != null) {
            token.onCancel(onCancel);
        }
    }

    public void open() {
        executor.open();
    }

    /**
     * stops the monitor for good
     */
    public void close() {
        if (token != null) {
            token.removeOnCancel(onCancel);
        }

        executor.close();
        pool.reset();
    }

    public boolean join(long timeout) throws InterruptedException {
        return executor.join(timeout);
    }

    public void requestCheck() {
        executor.wake();
    }

    /**
     * aborts a check that is currently running by closing its connection
     */
    public void cancelCheck() {
        MongoConnection c = current;

        if (c != null) {
            c.close();
        }

        pool.reset();
    }

    public ServerAddress getAddress() {
        return address;
    }

    /**
     * average round trip time in ms, null after a failed check
     */
    public Double getRoundTripTime() {
        return avgRoundTripTime.get();
    }

    public ServerDescription getServerDescription() {
        return serverDescription;
    }

    private boolean run() {
        serverDescription = checkWithRetry();
        topology.onChange(serverDescription);

        if (serverDescription.isDataBearing()) {
            topology.updatePool(address);
        }

        return true;
    }

    /**
     * A failed check is retried once right away, unless the server was Unknown before. After a
     * final failure the round trip average starts over.
     */
    public ServerDescription checkWithRetry() {
        boolean retry = serverDescription.getType() != ServerType.Unknown;
        long start = System.nanoTime();

        try {
            return checkOnce();
        } catch (DriverException | RuntimeException e) {
            heartbeatFailed(start, e, retry);
            topology.resetPool(address);
            ServerDescription fallback = ServerDescription.unknown(address, e);

            if (!retry) {
                avgRoundTripTime.reset();
                return fallback;
            }

            start = System.nanoTime();

            try {
                return checkOnce();
            } catch (DriverException | RuntimeException e2) {
                heartbeatFailed(start, e2, false);
                avgRoundTripTime.reset();
                return fallback;
            }
        }
    }

    private void heartbeatFailed(long start, Exception e, boolean wasKnown) {
        double duration = (System.nanoTime() - start) / 1000000.0;
        topology.incStat(DriverStatsKey.HEARTBEAT_FAILURES);

        if (wasKnown) {
            log.warn("heartbeat to {} failed: {}", address, e.getMessage());
        } else {
            log.debug("heartbeat to {} failed: {}", address, e.getMessage());
        }

        topology.publish(l -> l.serverHeartbeatFailed(address, duration, e));
    }

    /**
     * one hello. On a connection opened for this check, the reply of the connection handshake is used.
     */
    @SuppressWarnings("unchecked")
    public ServerDescription checkOnce() throws DriverException {
        topology.incStat(DriverStatsKey.HEARTBEATS);
        topology.publish(l -> l.serverHeartbeatStarted(address));
        MongoConnection con = pool.borrowConnection();
        current = con;

        try {
            ConnectionPool.Handshake handshake = pool.takeHandshake(con);
            HelloResult hello;
            double rtt;

            if (handshake != null) {
                hello = handshake.hello();
                rtt = handshake.duration();
            } else {
                long start = System.nanoTime();

                try {
                    hello = con.hello();
                } catch (OperationFailureException e) {
                    // hello failed, but the cluster time is still valid
                    if (e.getReply() != null && e.getReply().get("$clusterTime") instanceof Map) {
                        topology.receiveClusterTime((Map<String, Object>) e.getReply().get("$clusterTime"));
                    }

                    throw e;
                }

                rtt = (System.nanoTime() - start) / 1000000.0;
            }

            avgRoundTripTime.addSample(rtt);
            ServerDescription sd = ServerDescription.fromHello(address, hello, avgRoundTripTime.get());
            log.debug("heartbeat {}: {} in {}ms", address, sd.getType(), rtt);
            final HelloResult reply = hello;
            topology.publish(l -> l.serverHeartbeatSucceeded(address, rtt, reply));
            return sd;
        } finally {
            current = null;
            pool.releaseConnection(con);
        }
    }

    @Override
    public String toString() {
        return "Monitor{" + address + "}";
    }
}
