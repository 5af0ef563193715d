package de.caluga.topology.operation;

import de.caluga.topology.sdam.ServerAddress;

import java.util.Map;

/**
 * a checked reply together with the server that sent it
 */
public class CommandResult {
    private final Map<String, Object> reply;
    private final ServerAddress address;

    public CommandResult(Map<String, Object> reply, ServerAddress address) {
        this.reply = reply;
        this.address = address;
    }

    public Map<String, Object> getReply() {
        return reply;
    }

    public ServerAddress getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "CommandResult{address=" + address + ", reply=" + reply + "}";
    }
}
