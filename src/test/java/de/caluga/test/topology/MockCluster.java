package de.caluga.test.topology;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.bson.MongoId;
import de.caluga.topology.driver.wire.ConnectionFactory;
import de.caluga.topology.driver.wire.MongoConnection;
import de.caluga.topology.sdam.HelloResult;
import de.caluga.topology.sdam.ServerAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable fake deployment. Every address has a hello reply (none means the host is down) and an
 * optional handler for all other commands. Every command sent is recorded.
 */
public class MockCluster implements ConnectionFactory {

    private final Map<ServerAddress, Map<String, Object>> helloReplies = new ConcurrentHashMap<>();
    private final Map<ServerAddress, CommandHandler> handlers = new ConcurrentHashMap<>();
    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final List<MockConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger helloCount = new AtomicInteger();
    private final AtomicInteger connectCount = new AtomicInteger();
    private final Set<ServerAddress> failNextHello = ConcurrentHashMap.newKeySet();

    @FunctionalInterface
    public interface CommandHandler {
        Map<String, Object> handle(String db, Map<String, Object> cmd) throws DriverException;
    }

    public record Received(ServerAddress address, String db, Map<String, Object> cmd) {
        public String name() {
            return cmd.keySet().iterator().next();
        }
    }

    public static Doc standalone() {
        return Doc.of("ok", 1.0, "isWritablePrimary", true, "minWireVersion", 0, "maxWireVersion", 8).add("logicalSessionTimeoutMinutes", 30);
    }

    public static Doc mongos() {
        return Doc.of("ok", 1.0, "msg", "isdbgrid", "minWireVersion", 0, "maxWireVersion", 8).add("logicalSessionTimeoutMinutes", 30);
    }

    public static Doc primary(String setName, List<String> hosts) {
        return Doc.of("ok", 1.0, "isWritablePrimary", true, "setName", setName, "hosts", hosts).add("minWireVersion", 0).add("maxWireVersion", 8)
                  .add("logicalSessionTimeoutMinutes", 30).add("setVersion", 1).add("electionId", new MongoId("000000000000000000000001"));
    }

    public static Doc secondary(String setName, List<String> hosts) {
        return Doc.of("ok", 1.0, "secondary", true, "setName", setName, "hosts", hosts).add("minWireVersion", 0).add("maxWireVersion", 8)
                  .add("logicalSessionTimeoutMinutes", 30);
    }

    public static Doc ok() {
        return Doc.of("ok", 1.0);
    }

    public static Doc error(int code, String errmsg) {
        return Doc.of("ok", 0.0, "code", code, "errmsg", errmsg);
    }

    public MockCluster setHello(ServerAddress address, Map<String, Object> hello) {
        helloReplies.put(address, hello);
        return this;
    }

    /**
     * host does not answer any more, open connections fail on next use
     */
    public MockCluster setDown(ServerAddress address) {
        helloReplies.remove(address);

        for (MockConnection c : connections) {
            if (address.equals(c.getAddress())) {
                c.close();
            }
        }

        return this;
    }

    /**
     * the next hello command on an open connection to the address fails with a network error
     */
    public MockCluster failNextHello(ServerAddress address) {
        failNextHello.add(address);
        return this;
    }

    public MockCluster setHandler(ServerAddress address, CommandHandler handler) {
        handlers.put(address, handler);
        return this;
    }

    public List<Received> getReceived() {
        return Collections.unmodifiableList(received);
    }

    public List<Received> getReceived(String commandName) {
        List<Received> ret = new ArrayList<>();

        for (Received r : received) {
            if (r.name().equals(commandName)) {
                ret.add(r);
            }
        }

        return ret;
    }

    public void clearReceived() {
        received.clear();
    }

    /**
     * hello commands on open connections, handshakes not included
     */
    public int getHelloCount() {
        return helloCount.get();
    }

    /**
     * connection attempts, each one a handshake
     */
    public int getConnectCount() {
        return connectCount.get();
    }

    public List<MockConnection> getConnections() {
        return connections;
    }

    @Override
    public MongoConnection createConnection() {
        MockConnection c = new MockConnection();
        connections.add(c);
        return c;
    }

    private static boolean isHello(Map<String, Object> cmd) {
        return cmd.containsKey("hello") || cmd.containsKey("isMaster") || cmd.containsKey("ismaster");
    }

    public class MockConnection implements MongoConnection {
        private volatile ServerAddress address;
        private volatile boolean connected = false;

        @Override
        public HelloResult connect(ServerAddress address) throws DriverException {
            this.address = address;
            connectCount.incrementAndGet();
            Map<String, Object> hello = helloReplies.get(address);

            if (hello == null) {
                throw new DriverNetworkException("connection refused: " + address);
            }

            connected = true;
            return HelloResult.fromMsg(hello);
        }

        @Override
        public Map<String, Object> runCommand(String db, Map<String, Object> cmd) throws DriverException {
            if (!connected) {
                throw new DriverNetworkException("connection to " + address + " closed");
            }

            if (isHello(cmd)) {
                helloCount.incrementAndGet();
                Map<String, Object> hello = helloReplies.get(address);

                if (hello == null || failNextHello.remove(address)) {
                    connected = false;
                    throw new DriverNetworkException("connection reset: " + address);
                }

                return new Doc(hello);
            }

            received.add(new Received(address, db, new Doc(cmd)));
            CommandHandler h = handlers.get(address);

            if (h == null) {
                return ok();
            }

            return h.handle(db, cmd);
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public ServerAddress getAddress() {
            return address;
        }

        @Override
        public int getMaxWireVersion() {
            Map<String, Object> hello = address == null ? null : helloReplies.get(address);

            if (hello == null || !(hello.get("maxWireVersion") instanceof Number)) {
                return 0;
            }

            return ((Number) hello.get("maxWireVersion")).intValue();
        }

        @Override
        public void close() {
            connected = false;
        }
    }
}
