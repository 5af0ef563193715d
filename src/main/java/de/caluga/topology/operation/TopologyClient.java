package de.caluga.topology.operation;

import de.caluga.topology.config.DriverConfig;
import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.ReadConcern;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.WriteConcern;
import de.caluga.topology.driver.commands.EndSessionsCommand;
import de.caluga.topology.driver.commands.MongoCommand;
import de.caluga.topology.driver.wire.ConnectionFactory;
import de.caluga.topology.sdam.Topology;
import de.caluga.topology.sdam.TopologySettings;
import de.caluga.topology.session.ClientSession;
import de.caluga.topology.session.ServerSession;
import de.caluga.topology.session.SessionClient;
import de.caluga.topology.session.SessionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point: owns the {@link Topology}, starts sessions and runs commands. Operations without an
 * explicit session use an implicit one if the deployment supports sessions.
 */
public class TopologyClient implements SessionClient, Closeable {
    private static final Logger log = LoggerFactory.getLogger(TopologyClient.class);

    private final DriverConfig config;
    private final Topology topology;
    private final OperationExecutor executor;
    private ReadPreference readPreference;
    private ReadConcern readConcern = ReadConcern.DEFAULT;
    private WriteConcern writeConcern;

    public TopologyClient(DriverConfig config) {
        this(config, null);
    }

    /**
     * @param factory creates the connections, a socket based one if null
     */
    public TopologyClient(DriverConfig config, ConnectionFactory factory) {
        this.config = config;
        TopologySettings settings = TopologySettings.fromConfig(config, factory);
        topology = new Topology(settings);
        executor = new OperationExecutor(topology, config.getConnectionSettings().isRetryReads(), config.getConnectionSettings().isRetryWrites());
        readPreference = config.getDefaultReadPreference();
        topology.open();
    }

    public DriverConfig getConfig() {
        return config;
    }

    public Topology getTopology() {
        return topology;
    }

    public OperationExecutor getExecutor() {
        return executor;
    }

    @Override
    public ReadPreference getReadPreference() {
        return readPreference;
    }

    public TopologyClient setReadPreference(ReadPreference readPreference) {
        this.readPreference = readPreference;
        return this;
    }

    @Override
    public ReadConcern getReadConcern() {
        return readConcern;
    }

    public TopologyClient setReadConcern(ReadConcern readConcern) {
        this.readConcern = readConcern == null ? ReadConcern.DEFAULT : readConcern;
        return this;
    }

    @Override
    public WriteConcern getWriteConcern() {
        return writeConcern;
    }

    public TopologyClient setWriteConcern(WriteConcern writeConcern) {
        this.writeConcern = writeConcern;
        return this;
    }

    public ClientSession startSession() throws DriverException {
        return startSession(new SessionOptions());
    }

    /**
     * @throws de.caluga.topology.driver.ConfigurationException if the deployment does not support sessions
     */
    public ClientSession startSession(SessionOptions options) throws DriverException {
        return new ClientSession(this, topology.getServerSession(), options);
    }

    public Map<String, Object> runCommand(String db, Map<String, Object> cmd) throws DriverException {
        return runCommand(db, cmd, readPreference, null);
    }

    /**
     * runs a read command, retried once on retryable errors if retryReads is enabled
     *
     * @param session explicit session, null for an implicit one
     */
    public Map<String, Object> runCommand(String db, Map<String, Object> cmd, ReadPreference rp, ClientSession session) throws DriverException {
        ClientSession s = session == null ? implicitSession() : session;

        try {
            return executor.executeRead(db, withReadConcern(cmd, s), rp == null ? readPreference : rp, s).getReply();
        } finally {
            if (session == null && s != null) {
                s.endSession();
            }
        }
    }

    public Map<String, Object> runWriteCommand(String db, Map<String, Object> cmd) throws DriverException {
        return runWriteCommand(db, cmd, null, true);
    }

    /**
     * runs a write command on the primary
     *
     * @param retryable true if the command may be retried with the same txnNumber, e.g. single document
     *                  inserts and updates
     */
    public Map<String, Object> runWriteCommand(String db, Map<String, Object> cmd, ClientSession session, boolean retryable) throws DriverException {
        ClientSession s = session == null ? implicitSession() : session;

        try {
            return executor.executeWrite(db, withWriteConcern(cmd, s), s, retryable).getReply();
        } finally {
            if (session == null && s != null) {
                s.endSession();
            }
        }
    }

    public CommandCursor cursor(String db, Map<String, Object> cmd, int batchSize) throws DriverException {
        return cursor(db, cmd, readPreference, null, batchSize);
    }

    /**
     * runs a command returning a cursor, e.g. find or aggregate. An implicit session lives as long as the
     * cursor.
     */
    public CommandCursor cursor(String db, Map<String, Object> cmd, ReadPreference rp, ClientSession session, int batchSize) throws DriverException {
        ClientSession s = session == null ? implicitSession() : session;

        try {
            CommandResult res = executor.executeRead(db, withReadConcern(cmd, s), rp == null ? readPreference : rp, s);
            return new CommandCursor(executor, res.getReply(), res.getAddress(), batchSize, s, session == null);
        } catch (DriverException | RuntimeException e) {
            if (session == null && s != null) {
                s.endSession();
            }

            throw e;
        }
    }

    @Override
    public Map<String, Object> runTransactionCommand(ClientSession session, MongoCommand<?> cmd) throws DriverException {
        return executor.executeTransactionCommand(session, cmd);
    }

    @Override
    public void returnServerSession(ServerSession session) {
        topology.returnServerSession(session);
    }

    private ClientSession implicitSession() {
        if (topology.getDescription().getLogicalSessionTimeoutMinutes() == null) {
            return null;
        }

        try {
            return new ClientSession(this, topology.getServerSession(), new SessionOptions(false, null));
        } catch (DriverException | RuntimeException e) {
            log.debug("no implicit session: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> withReadConcern(Map<String, Object> cmd, ClientSession session) {
        if (readConcern.isServerDefault() || cmd.containsKey("readConcern") || (session != null && session.isInTransaction())) {
            return cmd;
        }

        Map<String, Object> ret = new Doc(cmd);
        ret.put("readConcern", readConcern.asMap());
        return ret;
    }

    private Map<String, Object> withWriteConcern(Map<String, Object> cmd, ClientSession session) {
        if (writeConcern == null || cmd.containsKey("writeConcern") || (session != null && session.isInTransaction())) {
            return cmd;
        }

        Map<String, Object> ret = new Doc(cmd);
        ret.put("writeConcern", writeConcern.asMap());
        return ret;
    }

    /**
     * ends all pooled server sessions on the server, then closes the topology
     */
    @Override
    public void close() {
        endSessions(topology.popAllSessions());
        topology.close();
    }

    private void endSessions(List<Map<String, Object>> ids) {
        if (ids.isEmpty()) {
            return;
        }

        ReadPreference rp = ReadPreference.primaryPreferred();

        if (!topology.getDescription().hasReadableServer(rp)) {
            log.debug("no server to end {} sessions on", ids.size());
            return;
        }

        try {
            for (int i = 0; i < ids.size(); i += EndSessionsCommand.MAX_BATCH) {
                List<Map<String, Object>> batch = new ArrayList<>(ids.subList(i, Math.min(ids.size(), i + EndSessionsCommand.MAX_BATCH)));
                EndSessionsCommand cmd = new EndSessionsCommand().setSessionIds(batch);
                executor.executeRead(cmd.getDb(), cmd.asMap(), rp, null);
            }
        } catch (DriverException e) {
            log.warn("could not end sessions: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "TopologyClient{" + topology + "}";
    }
}
