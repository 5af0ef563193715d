package de.caluga.topology.driver.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ends server sessions, the list of ids goes in as command value
 */
public class EndSessionsCommand extends AdminMongoCommand<EndSessionsCommand> {
    /** the server accepts at most this many ids per command */
    public static final int MAX_BATCH = 10000;

    private transient List<Map<String, Object>> sessionIds = new ArrayList<>();

    public List<Map<String, Object>> getSessionIds() {
        return sessionIds;
    }

    public EndSessionsCommand setSessionIds(List<Map<String, Object>> sessionIds) {
        this.sessionIds = sessionIds;
        return this;
    }

    @Override
    protected Object getCommandValue() {
        return sessionIds;
    }

    @Override
    public String getCommandName() {
        return "endSessions";
    }
}
