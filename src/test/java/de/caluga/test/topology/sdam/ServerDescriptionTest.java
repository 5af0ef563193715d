package de.caluga.test.topology.sdam;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.bson.MongoId;
import de.caluga.topology.sdam.HelloResult;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.sdam.ServerDescription;
import de.caluga.topology.sdam.ServerType;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class ServerDescriptionTest {
    private static final ServerAddress A = ServerAddress.parse("A.example.com");

    private static ServerType typeOf(Map<String, Object> hello) {
        return HelloResult.fromMsg(hello).getServerType();
    }

    @Test
    public void address() {
        assertEquals("a.example.com", A.host());
        assertEquals(27017, A.port());
        assertEquals(new ServerAddress("localhost", 27018), ServerAddress.parse("localhost:27018"));
        assertEquals("a.example.com:27017", A.toString());
    }

    @Test
    public void serverTypes() {
        assertEquals(ServerType.Unknown, typeOf(Doc.of("ok", 0.0)));
        assertEquals(ServerType.Standalone, typeOf(Doc.of("ok", 1.0, "ismaster", true)));
        assertEquals(ServerType.Mongos, typeOf(Doc.of("ok", 1.0, "msg", "isdbgrid")));
        assertEquals(ServerType.RSGhost, typeOf(Doc.of("ok", 1.0, "isreplicaset", true)));
        assertEquals(ServerType.RSPrimary, typeOf(Doc.of("ok", 1.0, "setName", "rs", "isWritablePrimary", true)));
        assertEquals(ServerType.RSPrimary, typeOf(Doc.of("ok", 1, "setName", "rs", "ismaster", true)));
        assertEquals(ServerType.RSSecondary, typeOf(Doc.of("ok", 1.0, "setName", "rs", "secondary", true)));
        assertEquals(ServerType.RSArbiter, typeOf(Doc.of("ok", 1.0, "setName", "rs", "arbiterOnly", true)));
        assertEquals(ServerType.RSOther, typeOf(Doc.of("ok", 1.0, "setName", "rs", "secondary", true, "hidden", true)));
        assertEquals(ServerType.RSOther, typeOf(Doc.of("ok", 1.0, "setName", "rs")));
    }

    @Test
    public void fromHello() {
        Doc hello = Doc.of("ok", 1.0, "setName", "rs", "isWritablePrimary", true, "hosts", List.of("A:27017", "b:27017"));
        hello.add("passives", List.of("c:27017")).add("arbiters", List.of("d:27017")).add("me", "a:27017").add("setVersion", 3)
             .add("electionId", new MongoId("7fffffff0000000000000003")).add("tags", Doc.of("dc", "ny")).add("maxWireVersion", 8)
             .add("logicalSessionTimeoutMinutes", 30).add("lastWrite", Doc.of("lastWriteDate", new Date(12345L)));
        ServerDescription sd = ServerDescription.fromHello(ServerAddress.parse("a:27017"), HelloResult.fromMsg(hello), 4.5);

        assertEquals(ServerType.RSPrimary, sd.getType());
        assertEquals("rs", sd.getReplicaSetName());
        assertEquals(3, sd.getSetVersion());
        assertEquals(ServerAddress.parse("a:27017"), sd.getMe());
        assertThat(sd.getAllHosts()).extracting(ServerAddress::toString).containsExactly("a:27017", "b:27017", "c:27017", "d:27017");
        assertEquals(Map.of("dc", "ny"), sd.getTags());
        assertEquals(12345L, sd.getLastWriteDate());
        assertEquals(4.5, sd.getRoundTripTime());
        assertEquals(0, sd.getMinWireVersion());
        assertTrue(sd.isWritable());
        assertTrue(sd.isReadable());
        assertTrue(sd.isDataBearing());
        assertTrue(sd.isRetryableWritesSupported());
        assertTrue(sd.getElectionTuple().isComplete());
    }

    @Test
    public void unknown() {
        ServerDescription sd = ServerDescription.unknown(A);
        assertFalse(sd.isServerTypeKnown());
        assertFalse(sd.isReadable());
        assertFalse(sd.isRetryableWritesSupported());
        assertNull(sd.getRoundTripTime());
        assertNull(sd.getError());
        assertThat(sd.getAllHosts()).isEmpty();

        DriverNetworkException err = new DriverNetworkException("timed out");
        ServerDescription failed = sd.toUnknown(err);
        assertSame(err, failed.getError());
        assertThat(failed.toString()).contains("error=timed out");
    }

    @Test
    public void equalityIgnoresRoundTripTime() {
        HelloResult hello = new HelloResult().setOk(1.0).setSecondary(true).setSetName("rs").setMaxWireVersion(8);
        ServerDescription s1 = ServerDescription.fromHello(A, hello, 1.0);
        ServerDescription s2 = ServerDescription.fromHello(A, hello, 99.0);
        assertEquals(s1, s2);
        assertEquals(s1.hashCode(), s2.hashCode());
        assertEquals(s1, s1.withRoundTripTime(3.0));
        assertNotEquals(s1, ServerDescription.unknown(A));

        assertEquals(ServerDescription.unknown(A, new DriverNetworkException("x")), ServerDescription.unknown(A, new DriverNetworkException("x")));
        assertNotEquals(ServerDescription.unknown(A, new DriverNetworkException("x")), ServerDescription.unknown(A, new DriverNetworkException("y")));
    }

    @Test
    public void secondaryDoesNotSupportRetryableWrites() {
        HelloResult hello = new HelloResult().setOk(1.0).setSecondary(true).setSetName("rs").setLogicalSessionTimeoutMinutes(30);
        ServerDescription sd = ServerDescription.fromHello(A, hello, 1.0);
        assertTrue(sd.isReadable());
        assertFalse(sd.isWritable());
        assertFalse(sd.isRetryableWritesSupported());
    }
}
