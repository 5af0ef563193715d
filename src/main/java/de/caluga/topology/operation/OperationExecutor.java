package de.caluga.topology.operation;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.ErrorCodes;
import de.caluga.topology.driver.ErrorLabel;
import de.caluga.topology.driver.NotPrimaryException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.ServerSelectionTimeoutException;
import de.caluga.topology.driver.bson.MongoTimestamp;
import de.caluga.topology.driver.commands.MongoCommand;
import de.caluga.topology.driver.wire.MongoConnection;
import de.caluga.topology.driver.wire.ReplyHelper;
import de.caluga.topology.sdam.Server;
import de.caluga.topology.sdam.ServerAddress;
import de.caluga.topology.sdam.ServerSelector;
import de.caluga.topology.sdam.ServerSelectors;
import de.caluga.topology.sdam.ServerType;
import de.caluga.topology.sdam.Topology;
import de.caluga.topology.sdam.TopologyType;
import de.caluga.topology.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs commands against the topology: selects a server, borrows a connection, adds session and
 * cluster time fields, checks the reply and reports failures back to the topology. Reads and writes
 * are retried once if enabled and possible.
 */
public class OperationExecutor {
    /**
     * servers below this wire version cannot retry reads
     */
    public static final int RETRYABLE_READS_MIN_WIRE_VERSION = 6;
    private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);

    private final Topology topology;
    private final boolean retryReads;
    private final boolean retryWrites;

    public OperationExecutor(Topology topology, boolean retryReads, boolean retryWrites) {
        this.topology = topology;
        this.retryReads = retryReads;
        this.retryWrites = retryWrites;
    }

    public Topology getTopology() {
        return topology;
    }

    public boolean isRetryReads() {
        return retryReads;
    }

    public boolean isRetryWrites() {
        return retryWrites;
    }

    /**
     * Runs a read. Inside a transaction the transaction's read preference is used. A failed read is
     * retried once on a network error or a retryable error code, unless in a transaction.
     */
    public CommandResult executeRead(String db, Map<String, Object> cmd, ReadPreference readPreference, ClientSession session) throws DriverException {
        if (session != null && session.getTransactionReadPreference() != null) {
            readPreference = session.getTransactionReadPreference();
        }

        if (readPreference == null) {
            readPreference = ReadPreference.primary();
        }

        boolean retryable = retryReads && (session == null || !session.isInTransaction());
        boolean retrying = false;
        DriverException lastError = null;

        while (true) {
            try {
                Server server = select(readPreference, session, null);

                if (retrying && server.getDescription().getMaxWireVersion() < RETRYABLE_READS_MIN_WIRE_VERSION) {
                    throw lastError;
                }

                return runOnServer(server, db, cmd, session, readPreference, true, false);
            } catch (ServerSelectionTimeoutException e) {
                if (retrying) {
                    throw lastError;
                }

                throw e;
            } catch (DriverNetworkException e) {
                if (!retryable || retrying) {
                    throw e;
                }

                lastError = e;
            } catch (OperationFailureException e) {
                if (!retryable || retrying || !ErrorCodes.isRetryable(e.getMongoCode())) {
                    throw e;
                }

                lastError = e;
            }

            retrying = true;
            log.warn("retrying read {} after error: {}", firstKey(cmd), lastError.getMessage());
        }
    }

    /**
     * Runs a write on the primary (or the pinned mongos). A retryable write needs a session, gets a new
     * txnNumber and is retried once with the same txnNumber if the server supports it.
     */
    public CommandResult executeWrite(String db, Map<String, Object> cmd, ClientSession session, boolean retryableWrite) throws DriverException {
        boolean retryable = retryableWrite && retryWrites && session != null && !session.isInTransaction();
        boolean retrying = false;
        boolean txnNumberAssigned = false;
        DriverException lastError = null;

        while (true) {
            try {
                Server server = select(ServerSelectors.WRITABLE, session, null);
                boolean supported = server.getDescription().isRetryableWritesSupported();

                if (retryable && !supported) {
                    if (retrying) {
                        throw lastError;
                    }

                    retryable = false;
                }

                if (retryable && !txnNumberAssigned) {
                    session.getServerSession().incTransactionId();
                    txnNumberAssigned = true;
                }

                return runOnServer(server, db, cmd, session, null, false, retryable);
            } catch (ServerSelectionTimeoutException e) {
                if (retrying) {
                    throw lastError;
                }

                throw e;
            } catch (DriverNetworkException e) {
                if (!retryable) {
                    throw e;
                }

                e.addErrorLabel(ErrorLabel.RETRYABLE_WRITE_ERROR);

                if (retrying) {
                    throw e;
                }

                lastError = e;
            } catch (OperationFailureException e) {
                if (!retryable) {
                    throw e;
                }

                if (ErrorCodes.isRetryable(e.getMongoCode())) {
                    e.addErrorLabel(ErrorLabel.RETRYABLE_WRITE_ERROR);
                }

                if (retrying || !e.hasErrorLabel(ErrorLabel.RETRYABLE_WRITE_ERROR)) {
                    throw e;
                }

                lastError = e;
            }

            retrying = true;
            log.warn("retrying write {} after error: {}", firstKey(cmd), lastError.getMessage());
        }
    }

    /**
     * runs a command on one given server, no retry. Used for getMore and killCursors.
     */
    public CommandResult executeAt(ServerAddress address, String db, Map<String, Object> cmd, ClientSession session) throws DriverException {
        Server server = topology.selectServerByAddress(address);
        return runOnServer(server, db, cmd, session, null, true, false);
    }

    /**
     * one attempt of commitTransaction / abortTransaction, the session retries itself
     */
    public Map<String, Object> executeTransactionCommand(ClientSession session, MongoCommand<?> cmd) throws DriverException {
        Server server = select(ServerSelectors.WRITABLE, session, null);
        return runOnServer(server, cmd.getDb(), cmd.asMap(), session, null, false, false).getReply();
    }

    private Server select(ServerSelector selector, ClientSession session, ServerAddress address) throws DriverException {
        if (session != null && session.getPinnedAddress() != null) {
            address = session.getPinnedAddress();
        }

        Server server;

        try {
            server = topology.selectServer(selector, topology.getSettings().getServerSelectionTimeout(), address);
        } catch (ServerSelectionTimeoutException e) {
            if (session != null && session.isInTransaction()) {
                e.addErrorLabel(ErrorLabel.TRANSIENT_TRANSACTION_ERROR);
                session.unpin();
            }

            throw e;
        }

        if (session != null && session.isInTransaction() && server.getDescription().getType() == ServerType.Mongos) {
            session.pin(server.getAddress());
        }

        return server;
    }

    @SuppressWarnings("unchecked")
    private CommandResult runOnServer(Server server, String db, Map<String, Object> command, ClientSession session, ReadPreference readPreference, boolean isRead,
                                      boolean retryableWrite) throws DriverException {
        Doc cmd = new Doc(command);
        cmd.remove("$db");

        if (session != null) {
            session.applyTo(cmd, retryableWrite, readPreference, isRead);
        }

        if (readPreference != null) {
            addReadPreference(server, cmd, readPreference);
        }

        MongoConnection con = server.getPool().borrowConnection();

        try {
            addClusterTime(cmd, session, con.getMaxWireVersion());
            Map<String, Object> reply = con.runCommand(db, cmd);

            if (reply != null && reply.get("$clusterTime") instanceof Map) {
                topology.receiveClusterTime((Map<String, Object>) reply.get("$clusterTime"));
            }

            if (session != null) {
                session.processResponse(reply);
            }

            ReplyHelper.checkReply(reply);
            return new CommandResult(reply, server.getAddress());
        } catch (DriverNetworkException e) {
            log.warn("network error running {} on {}: {}", firstKey(cmd), server.getAddress(), e.getMessage());

            if (session != null) {
                session.getServerSession().markDirty();

                if (session.isInTransaction()) {
                    e.addErrorLabel(ErrorLabel.TRANSIENT_TRANSACTION_ERROR);
                }
            }

            topology.handleError(server.getAddress(), e, con.getMaxWireVersion());
            throw e;
        } catch (NotPrimaryException e) {
            topology.handleError(server.getAddress(), e, con.getMaxWireVersion());
            throw e;
        } finally {
            server.getPool().releaseConnection(con);
        }
    }

    private void addReadPreference(Server server, Doc cmd, ReadPreference readPreference) {
        if (server.getDescription().getType() == ServerType.Mongos) {
            if (!readPreference.isPrimary()) {
                cmd.put("$readPreference", readPreference.document());
            }
        } else if (topology.getDescription().getType() == TopologyType.Single) {
            // a direct connection may point at a secondary
            cmd.put("$readPreference", ReadPreference.primaryPreferred().document());
        }
    }

    private void addClusterTime(Doc cmd, ClientSession session, int maxWireVersion) {
        if (maxWireVersion < 6) {
            return;
        }

        Map<String, Object> ct = topology.getMaxClusterTime();

        if (session != null && session.getClusterTime() != null) {
            if (ct == null || ts(session.getClusterTime()).compareTo(ts(ct)) > 0) {
                ct = session.getClusterTime();
            }
        }

        if (ct != null) {
            cmd.put("$clusterTime", ct);
        }
    }

    private static MongoTimestamp ts(Map<String, Object> clusterTime) {
        return (MongoTimestamp) clusterTime.get("clusterTime");
    }

    private static String firstKey(Map<String, Object> cmd) {
        return cmd.isEmpty() ? "" : cmd.keySet().iterator().next();
    }
}
