package de.caluga.topology.sdam;

import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.ErrorCodes;
import de.caluga.topology.driver.NotPrimaryException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.ServerSelectionTimeoutException;
import de.caluga.topology.driver.bson.MongoTimestamp;
import de.caluga.topology.driver.wire.ConnectionFactory;
import de.caluga.topology.session.ServerSession;
import de.caluga.topology.session.ServerSessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keeps the current {@link TopologyDescription}, one {@link Server} per tracked address and selects
 * servers for operations.
 * <p>
 * All state changes happen holding <code>lock</code>. Threads waiting for a suitable server wait on it
 * and are woken with notifyAll whenever the description changes. No I/O is done holding the lock.
 */
public class Topology {
    /**
     * upper bound for one wait of the selection loop
     */
    public static final long MIN_HEARTBEAT_INTERVAL = Monitor.MIN_HEARTBEAT_INTERVAL;
    private static final Logger log = LoggerFactory.getLogger(Topology.class);

    private final Object lock = new Object();
    private final TopologySettings settings;
    private final List<ServerAddress> seedAddresses;
    private final Map<ServerAddress, Server> servers = new LinkedHashMap<>();
    private final ServerSessionPool sessionPool = new ServerSessionPool();
    private final List<TopologyListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<DriverStatsKey, AtomicLong> stats = new EnumMap<>(DriverStatsKey.class);
    private volatile TopologyDescription description;
    private volatile Map<String, Object> maxClusterTime;
    private CancellationToken cancellationToken = new CancellationToken();
    private boolean opened = false;

    public Topology(TopologySettings settings) {
        this.settings = settings;
        description = TopologyDescription.initial(settings);
        seedAddresses = new ArrayList<>(description.getServerDescriptions().keySet());

        for (DriverStatsKey k : DriverStatsKey.values()) {
            stats.put(k, new AtomicLong());
        }
    }

    public TopologySettings getSettings() {
        return settings;
    }

    public TopologyDescription getDescription() {
        return description;
    }

    public boolean isOpened() {
        synchronized (lock) {
            return opened;
        }
    }

    public void addListener(TopologyListener l) {
        listeners.add(l);
    }

    public void removeListener(TopologyListener l) {
        listeners.remove(l);
    }

    /**
     * starts monitoring. Calling it more than once has no effect.
     */
    public void open() {
        synchronized (lock) {
            ensureOpened();
        }
    }

    // hold the lock
    private void ensureOpened() {
        if (!opened) {
            opened = true;

            if (cancellationToken.isCancelled()) {
                cancellationToken = new CancellationToken();
            }

            log.info("opening topology {} with seeds {}", description.getType(), seedAddresses);
            TopologyDescription td = description;
            publish(l -> l.topologyOpened(td));
            updateServers();
        }

        for (Server s : servers.values()) {
            s.open();
        }
    }

    /**
     * Stops all monitors and clears the pools. Every server is marked Unknown. The topology is
     * opened again on the next selection.
     */
    public void close() {
        synchronized (lock) {
            if (!opened) {
                return;
            }

            cancellationToken.cancel();

            for (Server s : servers.values()) {
                s.close();
                s.getPool().close();
            }

            servers.clear();
            description = description.reset();
            opened = false;
            lock.notifyAll();
        }

        log.info("topology closed");
        publish(TopologyListener::topologyClosed);
    }

    /**
     * Drops everything learned so far: every server Unknown, pools reset, pooled sessions forgotten.
     * Needed after a fork or a restore of the process state.
     */
    public void reset() {
        synchronized (lock) {
            for (Server s : servers.values()) {
                s.reset();
            }

            description = description.reset();
            updateServers();
            sessionPool.clear();
            maxClusterTime = null;
            lock.notifyAll();
        }

        log.info("topology reset");
    }

    public List<Server> selectServers(ServerSelector selector) throws DriverException {
        return selectServers(selector, settings.getServerSelectionTimeout(), null);
    }

    /**
     * @param timeout ms to wait for a suitable server, 0 means do not wait
     * @param address if set, only this server is considered
     * @throws ServerSelectionTimeoutException if nothing suitable showed up in time
     */
    public List<Server> selectServers(ServerSelector selector, long timeout, ServerAddress address) throws DriverException {
        synchronized (lock) {
            List<ServerDescription> sds = selectServersLoop(selector, timeout, address);
            List<Server> ret = new ArrayList<>(sds.size());

            for (ServerDescription sd : sds) {
                Server s = servers.get(sd.getAddress());

                if (s != null) {
                    ret.add(s);
                }
            }

            incStat(DriverStatsKey.SERVER_SELECTIONS);
            return ret;
        }
    }

    // hold the lock
    private List<ServerDescription> selectServersLoop(ServerSelector selector, long timeout, ServerAddress address) throws DriverException {
        long now = System.nanoTime();
        long end = now + timeout * 1000000L;
        List<ServerDescription> sds = description.applySelector(selector, address);

        while (sds.isEmpty()) {
            if (timeout == 0 || now > end) {
                incStat(DriverStatsKey.SERVER_SELECTION_TIMEOUTS);
                String msg = errorMessage(selector);
                log.warn("server selection failed: {}", msg);
                throw new ServerSelectionTimeoutException(msg + ", Timeout: " + timeout + "ms, Topology Description: " + description);
            }

            ensureOpened();
            requestCheckAllLocked();
            long wait = Math.max(1, Math.min((end - now) / 1000000L, MIN_HEARTBEAT_INTERVAL));

            try {
                lock.wait(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("server selection was interrupted", e);
            }

            description.checkCompatible();
            now = System.nanoTime();
            sds = description.applySelector(selector, address);
        }

        description.checkCompatible();
        return sds;
    }

    /**
     * like {@link #selectServers(ServerSelector, long, ServerAddress)}, picks one of the suitable servers at random
     */
    public Server selectServer(ServerSelector selector, long timeout, ServerAddress address) throws DriverException {
        List<Server> lst = selectServers(selector, timeout, address);

        if (lst.isEmpty()) {
            // server was removed between selection and lookup
            throw new ServerSelectionTimeoutException(errorMessage(selector));
        }

        return lst.get(ThreadLocalRandom.current().nextInt(lst.size()));
    }

    public Server selectServer(ServerSelector selector) throws DriverException {
        return selectServer(selector, settings.getServerSelectionTimeout(), null);
    }

    public Server selectServerByAddress(ServerAddress address, long timeout) throws DriverException {
        return selectServer(ServerSelectors.ANY, timeout, address);
    }

    public Server selectServerByAddress(ServerAddress address) throws DriverException {
        return selectServerByAddress(address, settings.getServerSelectionTimeout());
    }

    /**
     * the server currently tracked for the address, null if there is none. Does not wait.
     */
    public Server getServer(ServerAddress address) {
        synchronized (lock) {
            return servers.get(address);
        }
    }

    public CancellationToken getCancellationToken() {
        synchronized (lock) {
            return cancellationToken;
        }
    }

    /**
     * result of a heartbeat. Ignored if the topology is closed or the address is not tracked any more.
     */
    public void onChange(ServerDescription sd) {
        synchronized (lock) {
            if (opened && description.hasServer(sd.getAddress())) {
                processChange(sd);
            }
        }
    }

    // hold the lock
    private void processChange(ServerDescription sd) {
        TopologyDescription old = description;
        ServerDescription oldSd = old.getServerDescription(sd.getAddress());

        if (!Objects.equals(oldSd, sd)) {
            publish(l -> l.serverDescriptionChanged(oldSd, sd));
        }

        description = TopologyDescription.updated(old, sd);
        updateServers();
        receiveClusterTimeLocked(sd.getClusterTime());

        if (old.getType() != description.getType()) {
            log.info("topology type changed {} -> {}", old.getType(), description.getType());
        }

        TopologyDescription cur = description;
        publish(l -> l.topologyDescriptionChanged(old, cur));
        incStat(DriverStatsKey.TOPOLOGY_CHANGES);
        lock.notifyAll();
    }

    // hold the lock
    private void updateServers() {
        ConnectionFactory factory = settings.getConnectionFactory();

        for (Map.Entry<ServerAddress, ServerDescription> e : description.getServerDescriptions().entrySet()) {
            ServerAddress address = e.getKey();
            Server s = servers.get(address);

            if (s == null) {
                ConnectionPool monitorPool = new ConnectionPool(address, factory::createMonitorConnection, 1, settings.getMaxWaitTime(), this::incStat);
                Monitor monitor = new Monitor(e.getValue(), this, monitorPool, settings, cancellationToken);
                ConnectionPool pool = new ConnectionPool(address, factory::createConnection, settings.getMaxPoolSize(), settings.getMaxWaitTime(), this::incStat);
                s = new Server(e.getValue(), pool, monitor);
                servers.put(address, s);
                log.debug("tracking new server {}", address);

                if (opened) {
                    s.open();
                }
            } else {
                s.setDescription(e.getValue());
            }
        }

        Iterator<Map.Entry<ServerAddress, Server>> it = servers.entrySet().iterator();

        while (it.hasNext()) {
            Map.Entry<ServerAddress, Server> e = it.next();

            if (!description.hasServer(e.getKey())) {
                log.info("server {} removed from topology", e.getKey());
                e.getValue().close();
                e.getValue().getPool().close();
                it.remove();
            }
        }
    }

    /**
     * fills the application pool of a data bearing server up to minPoolSize. Connecting is done
     * outside the lock.
     */
    public void updatePool(ServerAddress address) {
        if (settings.getMinPoolSize() <= 0) {
            return;
        }

        Server s = getServer(address);

        if (s != null) {
            s.getPool().prefill(settings.getMinPoolSize());
        }
    }

    public void resetPool(ServerAddress address) {
        Server s = getServer(address);

        if (s != null) {
            s.reset();
        }
    }

    /**
     * clears the pool and marks the server Unknown, without requesting a check
     */
    public void resetServer(ServerAddress address) {
        synchronized (lock) {
            resetServerLocked(address, true);
        }
    }

    public void resetServerAndRequestCheck(ServerAddress address) {
        synchronized (lock) {
            resetServerLocked(address, true);
            requestCheckLocked(address);
        }
    }

    public void markServerUnknownAndRequestCheck(ServerAddress address) {
        synchronized (lock) {
            resetServerLocked(address, false);
            requestCheckLocked(address);
        }
    }

    private void resetServerLocked(ServerAddress address, boolean resetPool) {
        Server s = servers.get(address);

        if (s == null) {
            return;
        }

        if (resetPool) {
            s.reset();
        }

        description = description.resetServer(address);
        updateServers();
        lock.notifyAll();
    }

    private void requestCheckLocked(ServerAddress address) {
        Server s = servers.get(address);

        if (s != null) {
            s.requestCheck();
        }
    }

    private void requestCheckAllLocked() {
        for (Server s : servers.values()) {
            s.requestCheck();
        }
    }

    /**
     * wakes all monitors and waits up to <code>waitTime</code> ms for a change
     */
    public void requestCheckAll(long waitTime) {
        synchronized (lock) {
            requestCheckAllLocked();

            try {
                lock.wait(Math.max(1, waitTime));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Updates the topology after an operation on <code>address</code> failed. Network errors mark the
     * server Unknown and clear its pool, not primary errors mark it Unknown and request a check.
     * Everything else leaves the topology unchanged.
     *
     * @param maxWireVersion of the connection the error happened on
     */
    public void handleError(ServerAddress address, DriverException err, int maxWireVersion) {
        if (err instanceof ServerSelectionTimeoutException) {
            return;
        }

        Server s = getServer(address);

        if (s == null) {
            return;
        }

        if (err instanceof DriverNetworkException) {
            log.warn("network error on {}, marking it unknown: {}", address, err.getMessage());
            resetServer(address);
            s.getMonitor().cancelCheck();
            return;
        }

        if (err instanceof NotPrimaryException || (err instanceof OperationFailureException && ErrorCodes.isNotPrimary(err.getMongoCode()))) {
            boolean shutdown = ErrorCodes.isShutdown(err.getMongoCode());
            log.warn("{} is not primary any more ({}), requesting check", address, err.getMessage());

            if (shutdown || maxWireVersion <= 7) {
                resetServerAndRequestCheck(address);
            } else {
                markServerUnknownAndRequestCheck(address);
            }
        }
    }

    /**
     * address of the primary, null if the topology has none
     */
    public ServerAddress getPrimary() {
        TopologyDescription td = description;

        if (td.getType() != TopologyType.ReplicaSetWithPrimary) {
            return null;
        }

        Selection s = ServerSelectors.WRITABLE.select(Selection.fromTopologyDescription(td));
        return s.isEmpty() ? null : s.getServerDescriptions().get(0).getAddress();
    }

    public Set<ServerAddress> getSecondaries() {
        return replicaSetMembers(ServerSelectors.SECONDARY);
    }

    public Set<ServerAddress> getArbiters() {
        return replicaSetMembers(ServerSelectors.ARBITER);
    }

    private Set<ServerAddress> replicaSetMembers(ServerSelector selector) {
        TopologyDescription td = description;

        if (!td.getType().isReplicaSet()) {
            return Collections.emptySet();
        }

        Set<ServerAddress> ret = new LinkedHashSet<>();

        for (ServerDescription sd : selector.select(Selection.fromTopologyDescription(td)).getServerDescriptions()) {
            ret.add(sd.getAddress());
        }

        return ret;
    }

    /**
     * the highest <code>$clusterTime</code> seen from any server
     */
    public Map<String, Object> getMaxClusterTime() {
        return maxClusterTime;
    }

    public void receiveClusterTime(Map<String, Object> clusterTime) {
        synchronized (lock) {
            receiveClusterTimeLocked(clusterTime);
        }
    }

    private void receiveClusterTimeLocked(Map<String, Object> clusterTime) {
        if (clusterTime == null || !(clusterTime.get("clusterTime") instanceof MongoTimestamp)) {
            return;
        }

        if (maxClusterTime == null || ((MongoTimestamp) clusterTime.get("clusterTime")).compareTo((MongoTimestamp) maxClusterTime.get("clusterTime")) > 0) {
            maxClusterTime = clusterTime;
        }
    }

    /**
     * a pooled or new server session. Runs a selection first if the session timeout is not known yet.
     *
     * @throws ConfigurationException if the deployment does not support sessions
     */
    public ServerSession getServerSession() throws DriverException {
        synchronized (lock) {
            if (description.getLogicalSessionTimeoutMinutes() == null) {
                if (description.getType() == TopologyType.Single) {
                    if (!description.hasKnownServers()) {
                        selectServersLoop(ServerSelectors.ANY, settings.getServerSelectionTimeout(), null);
                    }
                } else if (description.getReadableServers().isEmpty()) {
                    selectServersLoop(ServerSelectors.READABLE, settings.getServerSelectionTimeout(), null);
                }
            }

            Integer timeout = description.getLogicalSessionTimeoutMinutes();

            if (timeout == null) {
                throw new ConfigurationException("Sessions are not supported by this MongoDB deployment");
            }

            return sessionPool.getServerSession(timeout);
        }
    }

    public void returnServerSession(ServerSession session) {
        synchronized (lock) {
            Integer timeout = description.getLogicalSessionTimeoutMinutes();

            if (timeout != null) {
                sessionPool.returnServerSession(session, timeout);
            }
        }
    }

    public List<Map<String, Object>> popAllSessions() {
        synchronized (lock) {
            return sessionPool.popAll();
        }
    }

    public int getPooledSessionCount() {
        return sessionPool.size();
    }

    /**
     * calls every listener, errors are logged and do not stop the others
     */
    void publish(Consumer<TopologyListener> event) {
        for (TopologyListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.error("topology listener {} failed", l, e);
            }
        }
    }

    public void incStat(DriverStatsKey key) {
        stats.get(key).incrementAndGet();
    }

    public Map<DriverStatsKey, Long> getStats() {
        Map<DriverStatsKey, Long> ret = new EnumMap<>(DriverStatsKey.class);

        for (Map.Entry<DriverStatsKey, AtomicLong> e : stats.entrySet()) {
            ret.put(e.getKey(), e.getValue().get());
        }

        return ret;
    }

    // hold the lock
    private String errorMessage(ServerSelector selector) {
        TopologyDescription td = description;
        boolean isReplicaSet = td.getType().isReplicaSet();
        String noun;

        if (isReplicaSet) {
            noun = "replica set members";
        } else if (td.getType() == TopologyType.Sharded) {
            noun = "mongoses";
        } else {
            noun = "servers";
        }

        if (td.hasKnownServers()) {
            if (selector == ServerSelectors.WRITABLE) {
                return isReplicaSet ? "No primary available for writes" : "No " + noun + " available for writes";
            }

            return "No " + noun + " match selector \"" + selector + "\"";
        }

        List<ServerDescription> sds = new ArrayList<>(td.getServerDescriptions().values());

        if (sds.isEmpty()) {
            if (isReplicaSet) {
                return "No " + noun + " available for replica set name \"" + settings.getReplicaSetName() + "\"";
            }

            return "No " + noun + " available";
        }

        String first = errorText(sds.get(0).getError());
        boolean same = true;

        for (ServerDescription sd : sds) {
            if (!Objects.equals(first, errorText(sd.getError()))) {
                same = false;
                break;
            }
        }

        if (same) {
            if (first == null) {
                return "No " + noun + " found yet";
            }

            if (isReplicaSet && Collections.disjoint(td.getServerDescriptions().keySet(), seedAddresses)) {
                return "Could not reach any servers in " + td.getServerDescriptions().keySet() + ". Replica set is configured with internal hostnames or IPs?";
            }

            return first;
        }

        List<String> errs = new ArrayList<>();

        for (ServerDescription sd : sds) {
            if (sd.getError() != null) {
                errs.add(errorText(sd.getError()));
            }
        }

        return String.join(",", errs);
    }

    private static String errorText(Throwable t) {
        if (t == null) {
            return null;
        }

        return t.getMessage() == null ? t.toString() : t.getMessage();
    }

    @Override
    public String toString() {
        return "Topology{" + description + "}";
    }
}
