package de.caluga.test.topology.sdam;

import de.caluga.test.topology.MockCluster;
import de.caluga.topology.sdam.CancellationToken;
import de.caluga.topology.sdam.ConnectionPool;
import de.caluga.topology.sdam.DriverStatsKey;
import de.caluga.topology.sdam.Monitor;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.sdam.ServerDescription;
import de.caluga.topology.sdam.ServerType;
import de.caluga.topology.sdam.Topology;
import de.caluga.topology.sdam.TopologySettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.caluga.test.topology.TestUtils.waitForConditionToBecomeTrue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * heartbeat retry rules. The background heartbeat runs once on open and then sleeps for 10s, so the
 * checks below are the only ones running.
 */
@Tag("sdam")
public class MonitorTest {
    private static final ServerAddress A = ServerAddress.parse("a:27017");
    private static final ServerAddress B = ServerAddress.parse("b:27017");
    private static final ServerAddress C = ServerAddress.parse("c:27017");

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

    private Monitor openDirect() {
        topology = new Topology(TopologySettings.builder().setSeeds(A).setDirect(true).setHeartbeatFrequency(10000).setServerSelectionTimeout(2000)
                                                .setConnectionFactory(cluster).build());
        topology.open();
        return topology.getServer(A).getMonitor();
    }

    private Monitor openKnown() {
        cluster.setHello(A, MockCluster.standalone());
        Monitor m = openDirect();
        waitForConditionToBecomeTrue(3000, "server not discovered", () -> m.getServerDescription().getType() == ServerType.Standalone);
        return m;
    }

    private long stat(DriverStatsKey k) {
        return topology.getStats().getOrDefault(k, 0L);
    }

    @Test
    public void firstCheckUsesHandshake() {
        Monitor m = openKnown();
        assertEquals(1, cluster.getConnectCount());
        assertEquals(0, cluster.getHelloCount());
        assertNotNull(m.getRoundTripTime());
        assertEquals(1, stat(DriverStatsKey.HEARTBEATS));

        // pooled monitor connection, so a real hello this time
        assertEquals(ServerType.Standalone, m.checkWithRetry().getType());
        assertEquals(1, cluster.getConnectCount());
        assertEquals(1, cluster.getHelloCount());
    }

    @Test
    public void failedCheckAfterKnownStateIsRetriedOnce() {
        Monitor m = openKnown();
        int generation = topology.getServer(A).getPool().getGeneration();
        long heartbeats = stat(DriverStatsKey.HEARTBEATS);
        long failures = stat(DriverStatsKey.HEARTBEAT_FAILURES);
        int connects = cluster.getConnectCount();
        assertNotNull(m.getRoundTripTime());

        cluster.setDown(A);
        ServerDescription sd = m.checkWithRetry();

        assertEquals(ServerType.Unknown, sd.getType());
        assertNotNull(sd.getError());
        assertEquals(heartbeats + 2, stat(DriverStatsKey.HEARTBEATS));
        assertEquals(failures + 2, stat(DriverStatsKey.HEARTBEAT_FAILURES));
        assertEquals(connects + 2, cluster.getConnectCount());
        assertEquals(0, cluster.getHelloCount());
        assertNull(m.getRoundTripTime());
        assertThat(topology.getServer(A).getPool().getGeneration()).isGreaterThan(generation);
    }

    @Test
    public void retrySucceedsOnNewConnection() {
        Monitor m = openKnown();
        long heartbeats = stat(DriverStatsKey.HEARTBEATS);
        long failures = stat(DriverStatsKey.HEARTBEAT_FAILURES);
        int connects = cluster.getConnectCount();

        cluster.failNextHello(A);
        ServerDescription sd = m.checkWithRetry();

        assertEquals(ServerType.Standalone, sd.getType());
        assertEquals(heartbeats + 2, stat(DriverStatsKey.HEARTBEATS));
        assertEquals(failures + 1, stat(DriverStatsKey.HEARTBEAT_FAILURES));
        // the failed hello, then the handshake of the replacement connection
        assertEquals(1, cluster.getHelloCount());
        assertEquals(connects + 1, cluster.getConnectCount());
        assertNotNull(m.getRoundTripTime());
    }

    @Test
    public void unknownServerIsNotRetried() {
        Monitor m = openDirect();
        waitForConditionToBecomeTrue(3000, "first check did not fail", () -> stat(DriverStatsKey.HEARTBEAT_FAILURES) >= 1);
        assertEquals(1, stat(DriverStatsKey.HEARTBEAT_FAILURES), "no retry when Unknown already");
        long heartbeats = stat(DriverStatsKey.HEARTBEATS);
        int connects = cluster.getConnectCount();

        ServerDescription sd = m.checkWithRetry();

        assertEquals(ServerType.Unknown, sd.getType());
        assertThat(sd.getError().getMessage()).contains("connection refused");
        assertEquals(heartbeats + 1, stat(DriverStatsKey.HEARTBEATS));
        assertEquals(2, stat(DriverStatsKey.HEARTBEAT_FAILURES));
        assertEquals(connects + 1, cluster.getConnectCount());
        assertNull(m.getRoundTripTime());
    }

    @Test
    public void closedMonitorLeavesToken() {
        TopologySettings settings = TopologySettings.builder().setSeeds(A).setDirect(true).setConnectionFactory(cluster).build();
        topology = new Topology(settings);
        CancellationToken token = new CancellationToken();
        ConnectionPool pool = new ConnectionPool(A, cluster::createConnection, 1, 1000, null);
        Monitor m = new Monitor(ServerDescription.unknown(A), topology, pool, settings, token);
        assertEquals(1, token.getCallbackCount());

        m.close();
        assertEquals(0, token.getCallbackCount());
        token.cancel();
    }

    @Test
    public void removedMembersDeregisterFromToken() {
        cluster.setHello(A, MockCluster.primary("rs", List.of("a:27017", "b:27017", "c:27017")));
        cluster.setHello(B, MockCluster.secondary("rs", List.of("a:27017", "b:27017", "c:27017")));
        cluster.setHello(C, MockCluster.secondary("rs", List.of("a:27017", "b:27017", "c:27017")));
        topology = new Topology(TopologySettings.builder().setSeeds(A).setReplicaSetName("rs").setHeartbeatFrequency(500).setServerSelectionTimeout(3000)
                                                .setConnectionFactory(cluster).build());
        topology.open();
        waitForConditionToBecomeTrue(3000, "members not discovered", () -> topology.getServer(C) != null);
        assertEquals(3, topology.getCancellationToken().getCallbackCount());

        cluster.setHello(A, MockCluster.primary("rs", List.of("a:27017", "b:27017")));
        topology.getServer(A).requestCheck();
        waitForConditionToBecomeTrue(3000, "member not removed", () -> topology.getServer(C) == null);
        assertEquals(2, topology.getCancellationToken().getCallbackCount());
    }
}
