package de.caluga.test.topology.driver.wire;

import de.caluga.topology.config.ConnectionSettings;
import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.wire.SingleMongoConnection;
import de.caluga.topology.driver.wireprotocol.OpCompressed;
import de.caluga.topology.driver.wireprotocol.OpMsg;
import de.caluga.topology.driver.wireprotocol.WireProtocolMessage;
import de.caluga.topology.sdam.HelloResult;
import de.caluga.topology.sdam.ServerAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * talks OP_MSG to a minimal in process server
 */
public class SingleMongoConnectionTest {
    private static final Logger log = LoggerFactory.getLogger(SingleMongoConnectionTest.class);

    private ServerSocket serverSocket;
    private Thread serverThread;
    private final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger replyId = new AtomicInteger(1);
    private SingleMongoConnection con;

    @BeforeEach
    public void startServer() throws IOException {
        serverSocket = new ServerSocket(0);
        serverThread = new Thread(this::serve, "fake-mongod");
        serverThread.setDaemon(true);
        serverThread.start();
    }

    @AfterEach
    public void stopServer() throws Exception {
        if (con != null) {
            con.close();
        }

        serverSocket.close();
        serverThread.join(2000);
    }

    private void serve() {
        while (!serverSocket.isClosed()) {
            try (Socket s = serverSocket.accept()) {
                InputStream in = s.getInputStream();
                OutputStream out = s.getOutputStream();

                while (true) {
                    WireProtocolMessage msg = WireProtocolMessage.parseFromStream(in);

                    if (msg == null) {
                        break;
                    }

                    Map<String, Object> cmd = ((OpMsg) msg).getFirstDoc();
                    received.add(cmd);
                    String name = cmd.keySet().iterator().next();

                    if (name.equals("shutdown")) {
                        break;
                    }

                    OpMsg reply = new OpMsg();
                    reply.setMessageId(replyId.incrementAndGet());
                    reply.setResponseTo(msg.getMessageId());
                    reply.setFirstDoc(answer(name, cmd));
                    out.write(reply.bytes());
                    out.flush();
                }
            } catch (Exception e) {
                log.debug("fake server: {}", e.getMessage());
            }
        }
    }

    private static Map<String, Object> answer(String name, Map<String, Object> cmd) {
        if (name.equals("isMaster") || name.equals("hello")) {
            Doc hello = Doc.of("ok", 1.0, "isWritablePrimary", true, "maxWireVersion", 8, "minWireVersion", 0).add("helloOk", true);

            if (cmd.get("compression") != null) {
                hello.put("compression", List.of("zlib"));
            }

            return hello;
        }

        return Doc.of("ok", 1.0, "echo", name, "db", cmd.get("$db"));
    }

    private ServerAddress address() {
        return new ServerAddress("localhost", serverSocket.getLocalPort());
    }

    @Test
    public void handshakeAndCommands() throws Exception {
        con = new SingleMongoConnection(new ConnectionSettings().setConnectionTimeout(1000), false);
        HelloResult hello = con.connect(address());
        assertTrue(con.isConnected());
        assertTrue(con.isHelloOk());
        assertEquals(8, con.getMaxWireVersion());
        assertEquals(Boolean.TRUE, hello.getIsWritablePrimary());
        assertEquals(OpCompressed.COMPRESSOR_NOOP, con.getCompressorId());

        Map<String, Object> handshake = received.get(0);
        assertEquals("isMaster", handshake.keySet().iterator().next());
        assertEquals(true, handshake.get("helloOk"));
        assertEquals("admin", handshake.get("$db"));
        assertNotNull(handshake.get("client"));
        assertNull(handshake.get("compression"));

        Map<String, Object> reply = con.runCommand("test", Doc.of("ping", 1));
        assertEquals("ping", reply.get("echo"));
        assertEquals("test", reply.get("db"));

        con.hello();
        Map<String, Object> heartbeat = received.get(2);
        assertEquals("hello", heartbeat.keySet().iterator().next());
        assertNull(heartbeat.get("client"));
    }

    @Test
    public void compressionIsNegotiated() throws Exception {
        con = new SingleMongoConnection(new ConnectionSettings().setConnectionTimeout(1000).setCompressors(List.of("snappy", "zlib")), false);
        con.connect(address());
        assertEquals(List.of("snappy", "zlib"), received.get(0).get("compression"));
        assertEquals(OpCompressed.COMPRESSOR_ZLIB, con.getCompressorId());

        Doc big = Doc.of("insert", "coll", "documents", List.of(Doc.of("text", "x".repeat(10000))));
        Map<String, Object> reply = con.runCommand("test", big);
        assertEquals("insert", reply.get("echo"));
        assertEquals("x".repeat(10000), ((Map<?, ?>) ((List<?>) received.get(1).get("documents")).get(0)).get("text"));
    }

    @Test
    public void serverClosingConnection() throws Exception {
        con = new SingleMongoConnection(new ConnectionSettings().setConnectionTimeout(1000).setReadTimeout(2000), false);
        con.connect(address());
        assertThrows(DriverNetworkException.class, () -> con.runCommand("admin", Doc.of("shutdown", 1)));
        assertFalse(con.isConnected());
        DriverNetworkException ex = assertThrows(DriverNetworkException.class, () -> con.runCommand("admin", Doc.of("ping", 1)));
        assertTrue(ex.getMessage().contains("closed"));
    }

    @Test
    public void connectionRefused() throws Exception {
        ServerAddress addr = address();
        serverSocket.close();
        serverThread.join(2000);
        con = new SingleMongoConnection(new ConnectionSettings().setConnectionTimeout(1000), false);
        DriverNetworkException ex = assertThrows(DriverNetworkException.class, () -> con.connect(addr));
        assertTrue(ex.getMessage().startsWith("Connection failed"));
        assertFalse(con.isConnected());
    }
}
