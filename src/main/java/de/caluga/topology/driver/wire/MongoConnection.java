package de.caluga.topology.driver.wire;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.commands.HelloCommand;
import de.caluga.topology.driver.commands.MongoCommand;
import de.caluga.topology.sdam.HelloResult;
import de.caluga.topology.sdam.ServerAddress;

import java.io.Closeable;
import java.util.Map;

/**
 * one connection to one server. Implementations need not be thread safe, a connection is used by one
 * thread at a time (see {@link de.caluga.topology.sdam.ConnectionPool}).
 */
public interface MongoConnection extends Closeable {

    /**
     * opens the connection and runs the initial handshake
     *
     * @return the handshake reply
     */
    HelloResult connect(ServerAddress address) throws DriverException;

    /**
     * sends the command and returns the raw reply. The reply is not checked for <code>ok: 0</code>, see
     * {@link ReplyHelper#checkReply(Map)}.
     */
    Map<String, Object> runCommand(String db, Map<String, Object> cmd) throws DriverException;

    default Map<String, Object> runCommand(MongoCommand<?> cmd) throws DriverException {
        return runCommand(cmd.getDb(), cmd.asMap());
    }

    default HelloResult hello() throws DriverException {
        HelloCommand cmd = new HelloCommand().setLegacy(!isHelloOk()).setIncludeClient(false);
        Map<String, Object> reply = runCommand(cmd);
        ReplyHelper.checkReply(reply);
        return HelloResult.fromMsg(reply);
    }

    /**
     * true once the server confirmed it understands <code>hello</code>
     */
    default boolean isHelloOk() {
        return false;
    }

    boolean isConnected();

    ServerAddress getAddress();

    /**
     * max wire version reported during the handshake, 0 if not connected
     */
    int getMaxWireVersion();

    @Override
    void close();
}
