package de.caluga.topology.driver.wire;

import de.caluga.topology.config.ConnectionSettings;
import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.commands.HelloCommand;
import de.caluga.topology.driver.wireprotocol.OpCompressed;
import de.caluga.topology.driver.wireprotocol.OpMsg;
import de.caluga.topology.driver.wireprotocol.WireProtocolMessage;
import de.caluga.topology.sdam.HelloResult;
import de.caluga.topology.sdam.ServerAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * plain socket connection speaking OP_MSG. Any IO problem closes the connection and is reported as
 * {@link DriverNetworkException}.
 */
public class SingleMongoConnection implements MongoConnection {
    private static final Logger log = LoggerFactory.getLogger(SingleMongoConnection.class);
    private static final AtomicInteger msgId = new AtomicInteger(1000);
    private static final Set<String> UNCOMPRESSABLE = Set.of("hello", "isMaster", "ismaster", "saslStart", "saslContinue", "getnonce",
            "authenticate", "createUser", "updateUser", "copydbSaslStart", "copydbgetnonce", "copydb");

    private final ConnectionSettings settings;
    private final boolean monitor;
    private Socket s;
    private OutputStream out;
    private InputStream in;
    private ServerAddress address;
    private boolean connected = false;
    private boolean helloOk = false;
    private int compressorId = OpCompressed.COMPRESSOR_NOOP;
    private int maxWireVersion = 0;

    /**
     * @param monitor monitoring connections use the connect timeout as read timeout
     */
    public SingleMongoConnection(ConnectionSettings settings, boolean monitor) {
        this.settings = settings;
        this.monitor = monitor;
    }

    @Override
    public HelloResult connect(ServerAddress address) throws DriverException {
        this.address = address;

        try {
            s = new Socket();
            int timeout = settings.getConnectionTimeout();

            if (timeout <= 0) {
                timeout = 1000;
            }

            s.connect(new InetSocketAddress(address.host(), address.port()), timeout);
            s.setKeepAlive(true);
            s.setTcpNoDelay(true);
            int readTimeout = monitor ? timeout : settings.getReadTimeout();

            if (readTimeout > 0) {
                s.setSoTimeout(readTimeout);
            }

            out = s.getOutputStream();
            in = s.getInputStream();
        } catch (IOException e) {
            close();
            throw new DriverNetworkException("Connection failed: " + address, e);
        }

        connected = true;
        HelloCommand cmd = new HelloCommand().setCompression(settings.getCompressors().isEmpty() ? null : settings.getCompressors())
                                             .setAppName(settings.getAppName());
        Map<String, Object> reply;

        try {
            reply = runCommand(cmd);
            ReplyHelper.checkReply(reply);
        } catch (DriverException e) {
            close();
            throw e;
        }

        HelloResult hello = HelloResult.fromMsg(reply);
        helloOk = Boolean.TRUE.equals(hello.getHelloOk());
        maxWireVersion = hello.getMaxWireVersion() == null ? 0 : hello.getMaxWireVersion();
        compressorId = OpCompressed.negotiate(settings.getCompressors(), hello.getCompression());
        log.debug("connected to {}, maxWireVersion {}, compressor {}", address, maxWireVersion, compressorId);
        return hello;
    }

    @Override
    public Map<String, Object> runCommand(String db, Map<String, Object> cmd) throws DriverException {
        if (!connected || out == null) {
            throw new DriverNetworkException("connection to " + address + " is closed");
        }

        Doc doc = new Doc(cmd);
        doc.put("$db", db);
        OpMsg q = new OpMsg();
        q.setMessageId(msgId.incrementAndGet());
        q.setFirstDoc(doc);
        String name = cmd.isEmpty() ? "" : cmd.keySet().iterator().next();

        try {
            out.write(q.bytes(UNCOMPRESSABLE.contains(name) ? OpCompressed.COMPRESSOR_NOOP : compressorId));
            out.flush();
        } catch (IOException e) {
            close();
            throw new DriverNetworkException("Error sending request to " + address + ": " + e.getMessage(), e);
        }

        while (true) {
            WireProtocolMessage incoming;

            try {
                incoming = WireProtocolMessage.parseFromStream(in);
            } catch (DriverNetworkException e) {
                close();
                throw e;
            }

            if (incoming == null) {
                close();
                throw new DriverNetworkException("connection closed by " + address);
            }

            if (incoming.getResponseTo() != q.getMessageId()) {
                log.warn("skipping reply for message {} - waiting for {}", incoming.getResponseTo(), q.getMessageId());
                continue;
            }

            if (!(incoming instanceof OpMsg)) {
                close();
                throw new DriverNetworkException("unexpected reply type " + incoming.getClass().getSimpleName());
            }

            return ((OpMsg) incoming).getReply();
        }
    }

    @Override
    public boolean isHelloOk() {
        return helloOk;
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
        return maxWireVersion;
    }

    public int getCompressorId() {
        return compressorId;
    }

    public int getSourcePort() {
        if (s == null) {
            return 0;
        }

        return s.getLocalPort();
    }

    @Override
    public void close() {
        connected = false;

        if (s != null) {
            try {
                s.close();
            } catch (IOException e) {
                log.debug("error closing socket to {}: {}", address, e.getMessage());
            }
        }

        in = null;
        out = null;
        s = null;
    }

    @Override
    public String toString() {
        return "SingleMongoConnection{" + address + (monitor ? ", monitor" : "") + "}";
    }
}
