package de.caluga.test.topology.sdam;

import de.caluga.test.topology.MockCluster;
import de.caluga.topology.driver.ConfigurationException;
import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.NotPrimaryException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.ServerSelectionTimeoutException;
import de.caluga.topology.driver.bson.MongoId;
import de.caluga.topology.driver.bson.MongoTimestamp;
import de.caluga.topology.sdam.DriverStatsKey;
import de.caluga.topology.sdam.Server;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.sdam.ServerDescription;
import de.caluga.topology.sdam.ServerSelectors;
import de.caluga.topology.sdam.ServerType;
import de.caluga.topology.sdam.Topology;
import de.caluga.topology.sdam.TopologyDescription;
import de.caluga.topology.sdam.TopologyListener;
import de.caluga.topology.sdam.TopologySettings;
import de.caluga.topology.sdam.TopologyType;
import de.caluga.topology.session.ServerSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static de.caluga.test.topology.TestUtils.waitForConditionToBecomeTrue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("sdam")
public class TopologyTest {
    private static final Logger log = LoggerFactory.getLogger(TopologyTest.class);
    private static final ServerAddress A = ServerAddress.parse("a:27017");
    private static final ServerAddress B = ServerAddress.parse("b:27017");
    private static final ServerAddress C = ServerAddress.parse("c:27017");
    private static final List<String> HOSTS = List.of("a:27017", "b:27017", "c:27017");

    private MockCluster cluster;
    private Topology topology;

    @BeforeEach
    public void setup() {
        cluster = new MockCluster();
    }

    @AfterEach
    public void tearDown() {
        if (topology != null) {
            topology.close();
        }
    }

    private Topology open(TopologySettings.Builder b) {
        topology = new Topology(b.setConnectionFactory(cluster).build());
        topology.open();
        return topology;
    }

    private TopologySettings.Builder direct(ServerAddress a) {
        return TopologySettings.builder().setSeeds(a).setDirect(true).setHeartbeatFrequency(10000).setServerSelectionTimeout(2000);
    }

    private TopologySettings.Builder replicaSet(ServerAddress... seeds) {
        return TopologySettings.builder().setSeeds(seeds).setReplicaSetName("rs").setHeartbeatFrequency(500).setServerSelectionTimeout(3000);
    }

    private void startReplicaSet() {
        cluster.setHello(A, MockCluster.primary("rs", HOSTS));
        cluster.setHello(B, MockCluster.secondary("rs", HOSTS));
        cluster.setHello(C, MockCluster.secondary("rs", HOSTS));
    }

    @Test
    public void selectionTimesOutWhenNoServerIsKnown() {
        open(TopologySettings.builder().setSeeds(A).setHeartbeatFrequency(500));
        long start = System.currentTimeMillis();
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(ServerSelectors.WRITABLE, 200, null));
        long dur = System.currentTimeMillis() - start;
        log.info("selection failed after {}ms: {}", dur, ex.getMessage());
        assertThat(dur).isGreaterThanOrEqualTo(200).isLessThan(200 + Topology.MIN_HEARTBEAT_INTERVAL + 500);
        assertThat(ex.getMessage()).contains(", Timeout: 200ms, Topology Description: ");
        assertEquals(1, topology.getStats().get(DriverStatsKey.SERVER_SELECTION_TIMEOUTS));
    }

    @Test
    public void zeroTimeoutDoesNotWait() {
        topology = new Topology(TopologySettings.builder().setSeeds(A).setConnectionFactory(cluster).build());
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(ServerSelectors.ANY, 0, null));
        assertThat(ex.getMessage()).startsWith("No servers found yet, Timeout: 0ms");
        assertFalse(topology.isOpened());
    }

    @Test
    public void directConnection() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        Server s = topology.selectServer(ServerSelectors.WRITABLE);
        assertEquals(A, s.getAddress());
        assertEquals(TopologyType.Single, topology.getDescription().getType());
        assertEquals(ServerType.Standalone, s.getDescription().getType());
        assertNull(topology.getPrimary());
    }

    @Test
    public void discoversReplicaSet() throws Exception {
        startReplicaSet();
        open(replicaSet(A));
        Server primary = topology.selectServer(ServerSelectors.WRITABLE);
        assertEquals(A, primary.getAddress());
        assertEquals(A, topology.getPrimary());
        waitForConditionToBecomeTrue(5000, "secondaries not discovered", () -> topology.getSecondaries().size() == 2);
        assertThat(topology.getSecondaries()).containsExactlyInAnyOrder(B, C);

        List<Server> readable = topology.selectServers(ReadPreference.secondary(), 2000, null);
        assertThat(readable).extracting(Server::getAddress).containsExactlyInAnyOrder(B, C);
        assertEquals(B, topology.selectServerByAddress(B).getAddress());
    }

    @Test
    public void noPrimaryMessage() {
        cluster.setHello(A, MockCluster.secondary("rs", List.of("a:27017")));
        open(replicaSet(A));
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(ServerSelectors.WRITABLE, 700, null));
        assertThat(ex.getMessage()).startsWith("No primary available for writes, Timeout: 700ms");
    }

    @Test
    public void noMatchMessage() {
        cluster.setHello(A, MockCluster.primary("rs", List.of("a:27017")));
        open(replicaSet(A));
        ReadPreference rp = ReadPreference.secondary(List.of(Map.of("dc", "tokyo")), -1);
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(rp, 700, null));
        assertThat(ex.getMessage()).startsWith("No replica set members match selector \"" + rp + "\"");
    }

    @Test
    public void noMembersForSetNameMessage() {
        cluster.setHello(A, MockCluster.standalone());
        open(replicaSet(A));
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(ServerSelectors.WRITABLE, 700, null));
        assertThat(ex.getMessage()).startsWith("No replica set members available for replica set name \"rs\"");
    }

    @Test
    public void differingErrorsAreJoined() {
        open(TopologySettings.builder().setSeeds(A, B).setHeartbeatFrequency(500));
        ServerSelectionTimeoutException ex = assertThrows(ServerSelectionTimeoutException.class, () -> topology.selectServers(ServerSelectors.WRITABLE, 700, null));
        assertThat(ex.getMessage()).contains("connection refused: a:27017").contains("connection refused: b:27017").contains(",");
    }

    @Test
    public void primaryFailover() throws Exception {
        startReplicaSet();
        open(replicaSet(A, B, C));
        assertEquals(A, topology.selectServer(ServerSelectors.WRITABLE).getAddress());

        long failures = topology.getStats().get(DriverStatsKey.HEARTBEAT_FAILURES);
        cluster.setDown(A);
        topology.getServer(A).requestCheck();
        waitForConditionToBecomeTrue(5000, "primary not marked unknown", () -> topology.getDescription().getType() == TopologyType.ReplicaSetNoPrimary);

        ServerDescription sd = topology.getDescription().getServerDescription(A);
        assertEquals(ServerType.Unknown, sd.getType());
        assertNotNull(sd.getError());
        // first check failed after a known description, so it was retried once
        assertThat(topology.getStats().get(DriverStatsKey.HEARTBEAT_FAILURES)).isGreaterThanOrEqualTo(failures + 2);

        cluster.setHello(B, MockCluster.primary("rs", HOSTS).add("electionId", new MongoId("000000000000000000000002")));
        assertEquals(B, topology.selectServer(ServerSelectors.WRITABLE).getAddress());
    }

    @Test
    public void networkErrorResetsServer() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        Server s = topology.selectServer(ServerSelectors.WRITABLE);
        int gen = s.getPool().getGeneration();

        topology.handleError(A, new DriverNetworkException("connection reset"), 8);
        assertEquals(ServerType.Unknown, topology.getDescription().getServerDescription(A).getType());
        assertThat(s.getPool().getGeneration()).isGreaterThan(gen);

        assertEquals(A, topology.selectServer(ServerSelectors.WRITABLE).getAddress());
    }

    @Test
    public void notPrimaryErrorRequestsCheck() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        Server s = topology.selectServer(ServerSelectors.WRITABLE);
        int gen = s.getPool().getGeneration();

        topology.handleError(A, new NotPrimaryException("not master", 10107, Doc.of("ok", 0.0)), 8);
        assertEquals(gen, s.getPool().getGeneration(), "not primary on a modern server keeps the pool");
        waitForConditionToBecomeTrue(3000, "server not checked again", () -> topology.getDescription().getServerDescription(A).getType() == ServerType.Standalone);

        topology.handleError(A, new NotPrimaryException("shutdown in progress", 91, Doc.of("ok", 0.0)), 8);
        assertThat(s.getPool().getGeneration()).isGreaterThan(gen);
    }

    @Test
    public void otherErrorsAreIgnored() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        Server s = topology.selectServer(ServerSelectors.WRITABLE);
        int gen = s.getPool().getGeneration();
        topology.handleError(A, new OperationFailureException("duplicate key", 11000, Doc.of("ok", 0.0)), 8);
        topology.handleError(A, new ServerSelectionTimeoutException("no server"), 8);
        assertEquals(ServerType.Standalone, topology.getDescription().getServerDescription(A).getType());
        assertEquals(gen, s.getPool().getGeneration());
    }

    @Test
    public void clusterTimeIsGossiped() throws Exception {
        MongoTimestamp ts = new MongoTimestamp(100, 1);
        cluster.setHello(A, MockCluster.standalone().add("$clusterTime", Doc.of("clusterTime", ts, "signature", Doc.of("keyId", 0L))));
        open(direct(A));
        topology.selectServer(ServerSelectors.WRITABLE);
        assertEquals(ts, topology.getMaxClusterTime().get("clusterTime"));

        topology.receiveClusterTime(Doc.of("clusterTime", new MongoTimestamp(50, 7)));
        assertEquals(ts, topology.getMaxClusterTime().get("clusterTime"));

        MongoTimestamp newer = new MongoTimestamp(100, 2);
        topology.receiveClusterTime(Doc.of("clusterTime", newer));
        assertEquals(newer, topology.getMaxClusterTime().get("clusterTime"));
    }

    @Test
    public void serverSessions() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        ServerSession s = topology.getServerSession();
        assertNotNull(s.getSessionId().get("id"));
        topology.returnServerSession(s);
        assertEquals(1, topology.getPooledSessionCount());
        assertSame(s, topology.getServerSession());

        topology.returnServerSession(s);
        List<Map<String, Object>> ids = topology.popAllSessions();
        assertEquals(1, ids.size());
        assertEquals(0, topology.getPooledSessionCount());
    }

    @Test
    public void sessionsNotSupported() {
        Doc hello = MockCluster.standalone();
        hello.remove("logicalSessionTimeoutMinutes");
        cluster.setHello(A, hello);
        open(direct(A).setServerSelectionTimeout(1000));
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> topology.getServerSession());
        assertEquals("Sessions are not supported by this MongoDB deployment", ex.getMessage());
    }

    @Test
    public void listenersAndClose() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch closed = new CountDownLatch(1);
        topology = new Topology(direct(A).setConnectionFactory(cluster).build());
        topology.addListener(new TopologyListener() {
            @Override
            public void topologyOpened(TopologyDescription description) {
                events.add("opened");
            }

            @Override
            public void serverDescriptionChanged(ServerDescription previous, ServerDescription current) {
                events.add("changed " + current.getType());
            }

            @Override
            public void topologyClosed() {
                events.add("closed");
                closed.countDown();
            }
        });
        topology.addListener(new TopologyListener() {
            @Override
            public void topologyOpened(TopologyDescription description) {
                throw new IllegalStateException("listener failure must not break the topology");
            }
        });
        topology.open();
        topology.selectServer(ServerSelectors.WRITABLE);
        topology.close();
        assertTrue(closed.await(1, TimeUnit.SECONDS));

        assertThat(events).startsWith("opened").contains("changed Standalone").endsWith("closed");
        assertFalse(topology.isOpened());
        assertNull(topology.getServer(A));
        assertFalse(topology.getDescription().hasKnownServers());

        // selecting opens it again
        assertEquals(A, topology.selectServer(ServerSelectors.WRITABLE).getAddress());
        assertTrue(topology.isOpened());
    }

    @Test
    public void resetForgetsEverything() throws Exception {
        cluster.setHello(A, MockCluster.standalone());
        open(direct(A));
        ServerSession s = topology.getServerSession();
        topology.returnServerSession(s);
        topology.reset();
        assertEquals(0, topology.getPooledSessionCount());
        assertNull(topology.getMaxClusterTime());
        assertEquals(ServerType.Unknown, topology.getDescription().getServerDescription(A).getType());
        assertEquals(A, topology.selectServer(ServerSelectors.WRITABLE).getAddress());
    }
}
