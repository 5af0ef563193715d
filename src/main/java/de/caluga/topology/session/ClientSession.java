package de.caluga.topology.session;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.DriverNetworkException;
import de.caluga.topology.driver.ErrorCodes;
import de.caluga.topology.driver.ErrorLabel;
import de.caluga.topology.driver.InvalidOperationException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.ReadConcern;
import de.caluga.topology.driver.ReadPreference;
import de.caluga.topology.driver.ServerSelectionTimeoutException;
import de.caluga.topology.driver.WriteConcern;
import de.caluga.topology.driver.WriteConcernException;
import de.caluga.topology.driver.bson.MongoTimestamp;
import de.caluga.topology.driver.commands.AbortTransactionCommand;
import de.caluga.topology.driver.commands.CommitTransactionCommand;
import de.caluga.topology.driver.commands.MongoCommand;
import de.caluga.topology.sdam.ServerAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * A logical session: causally consistent reads and multi document transactions.
 * <p>
 * Not thread safe, a session must only be used by one thread at a time.
 */
public class ClientSession implements AutoCloseable {
    /**
     * withTransaction gives up retrying after this many ms
     */
    public static final long WITH_TRANSACTION_RETRY_TIME_LIMIT = 120000;
    private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

    private final SessionClient client;
    private final SessionOptions options;
    private final Transaction transaction = new Transaction();
    private ServerSession serverSession;
    private Map<String, Object> clusterTime;
    private MongoTimestamp operationTime;

    public ClientSession(SessionClient client, ServerSession serverSession, SessionOptions options) {
        this.client = client;
        this.serverSession = serverSession;
        this.options = options == null ? new SessionOptions() : options;
    }

    public SessionOptions getOptions() {
        return options;
    }

    public Map<String, Object> getSessionId() throws InvalidOperationException {
        checkEnded();
        return serverSession.getSessionId();
    }

    public ServerSession getServerSession() {
        return serverSession;
    }

    public Map<String, Object> getClusterTime() {
        return clusterTime;
    }

    public MongoTimestamp getOperationTime() {
        return operationTime;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public boolean hasEnded() {
        return serverSession == null;
    }

    public boolean isInTransaction() {
        return transaction.isActive();
    }

    /**
     * the mongos this transaction is pinned to, null if there is none or no transaction is active
     */
    public ServerAddress getPinnedAddress() {
        return transaction.isActive() ? transaction.getPinnedAddress() : null;
    }

    public void pin(ServerAddress mongos) {
        transaction.pin(mongos);
    }

    public void unpin() {
        transaction.unpin();
    }

    /**
     * read preference of the active transaction, null if there is none
     */
    public ReadPreference getTransactionReadPreference() {
        return isInTransaction() ? transaction.getOptions().getReadPreference() : null;
    }

    private void checkEnded() throws InvalidOperationException {
        if (serverSession == null) {
            throw new InvalidOperationException("Cannot use ended session");
        }
    }

    /**
     * @param clusterTime <code>$clusterTime</code> document as returned by the server
     */
    @SuppressWarnings("unchecked")
    public void advanceClusterTime(Map<String, Object> clusterTime) {
        if (clusterTime == null || !(clusterTime.get("clusterTime") instanceof MongoTimestamp)) {
            throw new IllegalArgumentException("Invalid cluster_time: " + clusterTime);
        }

        doAdvanceClusterTime(clusterTime);
    }

    private void doAdvanceClusterTime(Map<String, Object> ct) {
        if (ct == null) {
            return;
        }

        if (clusterTime == null) {
            clusterTime = ct;
        } else if (((MongoTimestamp) ct.get("clusterTime")).compareTo((MongoTimestamp) clusterTime.get("clusterTime")) > 0) {
            clusterTime = ct;
        }
    }

    public void advanceOperationTime(MongoTimestamp ts) {
        if (ts == null) {
            throw new IllegalArgumentException("operation time must not be null");
        }

        doAdvanceOperationTime(ts);
    }

    private void doAdvanceOperationTime(MongoTimestamp ts) {
        if (ts != null && (operationTime == null || ts.compareTo(operationTime) > 0)) {
            operationTime = ts;
        }
    }

    public void startTransaction() throws DriverException {
        startTransaction(null);
    }

    /**
     * starts a transaction. Options not set are taken from the session defaults, then from the client.
     * No command is sent before the first operation.
     */
    public void startTransaction(TransactionOptions opts) throws DriverException {
        checkEnded();

        if (isInTransaction()) {
            throw new InvalidOperationException("Transaction already in progress");
        }

        if (opts == null) {
            opts = TransactionOptions.DEFAULT;
        }

        TransactionOptions defaults = options.getDefaultTransactionOptions();
        ReadConcern rc = opts.getReadConcern();
        WriteConcern wc = opts.getWriteConcern();
        ReadPreference rp = opts.getReadPreference();
        Integer maxCommitTime = opts.getMaxCommitTimeMS();

        if (defaults != null) {
            rc = rc == null ? defaults.getReadConcern() : rc;
            wc = wc == null ? defaults.getWriteConcern() : wc;
            rp = rp == null ? defaults.getReadPreference() : rp;
            maxCommitTime = maxCommitTime == null ? defaults.getMaxCommitTimeMS() : maxCommitTime;
        }

        rc = rc == null ? client.getReadConcern() : rc;
        wc = wc == null ? client.getWriteConcern() : wc;
        rp = rp == null ? client.getReadPreference() : rp;
        transaction.setOptions(new TransactionOptions(rc, wc, rp, maxCommitTime));
        transaction.reset();
        transaction.setState(TransactionState.STARTING);
        serverSession.incTransactionId();
    }

    public void commitTransaction() throws DriverException {
        checkEnded();
        boolean retry = false;

        switch (transaction.getState()) {
            case NONE:
                throw new InvalidOperationException("No transaction started");

            case STARTING:
            case COMMITTED_EMPTY:
                // nothing was sent to the server yet
                transaction.setState(TransactionState.COMMITTED_EMPTY);
                return;

            case ABORTED:
                throw new InvalidOperationException("Cannot call commitTransaction after calling abortTransaction");

            case COMMITTED:
                // explicit retry of a commit, back to in progress so the command is sent as part of the transaction
                transaction.setState(TransactionState.IN_PROGRESS);
                retry = true;
                break;

            default:
                break;
        }

        try {
            finishTransactionWithRetry(true, retry);
        } catch (WriteConcernException e) {
            if (e.isWTimeout() || ErrorCodes.isUnknownCommit(e.getMongoCode())) {
                e.addErrorLabel(ErrorLabel.UNKNOWN_TRANSACTION_COMMIT_RESULT);
            }

            throw e;
        } catch (DriverNetworkException e) {
            // we cannot know whether the commit was applied
            e.removeErrorLabel(ErrorLabel.TRANSIENT_TRANSACTION_ERROR);
            e.addErrorLabel(ErrorLabel.UNKNOWN_TRANSACTION_COMMIT_RESULT);
            throw e;
        } catch (OperationFailureException e) {
            if (ErrorCodes.isUnknownCommit(e.getMongoCode())) {
                e.addErrorLabel(ErrorLabel.UNKNOWN_TRANSACTION_COMMIT_RESULT);
            }

            throw e;
        } finally {
            transaction.setState(TransactionState.COMMITTED);
        }
    }

    /**
     * aborts the transaction. Errors from the server are logged and ignored.
     */
    public void abortTransaction() throws DriverException {
        checkEnded();

        switch (transaction.getState()) {
            case NONE:
                throw new InvalidOperationException("No transaction started");

            case STARTING:
                transaction.setState(TransactionState.ABORTED);
                return;

            case ABORTED:
                throw new InvalidOperationException("Cannot call abortTransaction twice");

            case COMMITTED:
            case COMMITTED_EMPTY:
                throw new InvalidOperationException("Cannot call abortTransaction after calling commitTransaction");

            default:
                break;
        }

        try {
            finishTransactionWithRetry(false, false);
        } catch (OperationFailureException | DriverNetworkException e) {
            log.debug("ignoring error during abortTransaction: {}", e.getMessage());
        } finally {
            transaction.setState(TransactionState.ABORTED);
            transaction.unpin();
        }
    }

    /**
     * one retry after a network error or a retryable error code. Server selection failing on the retry
     * gives the original error, as the first attempt may have reached the server.
     */
    private Map<String, Object> finishTransactionWithRetry(boolean commit, boolean explicitRetry) throws DriverException {
        try {
            return finishTransaction(commit, explicitRetry);
        } catch (ServerSelectionTimeoutException e) {
            throw e;
        } catch (DriverNetworkException e) {
            return retryFinish(commit, e);
        } catch (OperationFailureException e) {
            if (!ErrorCodes.isRetryable(e.getMongoCode())) {
                throw e;
            }

            return retryFinish(commit, e);
        }
    }

    private Map<String, Object> retryFinish(boolean commit, DriverException original) throws DriverException {
        log.warn("retrying {} after error: {}", commit ? "commitTransaction" : "abortTransaction", original.getMessage());

        try {
            return finishTransaction(commit, true);
        } catch (ServerSelectionTimeoutException e) {
            throw original;
        }
    }

    private Map<String, Object> finishTransaction(boolean commit, boolean retrying) throws DriverException {
        TransactionOptions opts = transaction.getOptions();
        WriteConcern wc = opts.getWriteConcern();
        MongoCommand<?> cmd;
        transaction.incAttempt();

        if (commit) {
            CommitTransactionCommand c = new CommitTransactionCommand();

            if (opts.getMaxCommitTimeMS() != null && opts.getMaxCommitTimeMS() > 0) {
                c.setMaxTimeMS(opts.getMaxCommitTimeMS());
            }

            // commit retries must not be satisfied by a minority
            if (retrying) {
                wc = wc == null ? WriteConcern.majority(10000) : wc.withMajority(10000);
            }

            c.setWriteConcern(wc == null ? null : wc.asMap());
            c.setRecoveryToken(transaction.getRecoveryToken());
            cmd = c;
        } else {
            cmd = new AbortTransactionCommand().setWriteConcern(wc == null ? null : wc.asMap()).setRecoveryToken(transaction.getRecoveryToken());
        }

        return client.runTransactionCommand(this, cmd);
    }

    public <T> T withTransaction(TransactionBody<T> body) throws DriverException {
        return withTransaction(body, null);
    }

    /**
     * Runs the body in a transaction and commits it. The whole transaction is retried on
     * TransientTransactionError, the commit alone on UnknownTransactionCommitResult, for up to
     * {@link #WITH_TRANSACTION_RETRY_TIME_LIMIT} ms.
     */
    public <T> T withTransaction(TransactionBody<T> body, TransactionOptions opts) throws DriverException {
        long start = System.nanoTime();

        while (true) {
            startTransaction(opts);
            T ret;

            try {
                ret = body.execute(this);
            } catch (DriverException | RuntimeException e) {
                if (isInTransaction()) {
                    abortTransaction();
                }

                if (e instanceof DriverException && ((DriverException) e).hasErrorLabel(ErrorLabel.TRANSIENT_TRANSACTION_ERROR) && withinTimeLimit(start)) {
                    log.warn("retrying transaction after transient error: {}", e.getMessage());
                    continue;
                }

                throw e;
            }

            TransactionState state = transaction.getState();

            if (state == TransactionState.NONE || state == TransactionState.COMMITTED || state == TransactionState.ABORTED) {
                // the body ended the transaction itself
                return ret;
            }

            boolean restart = false;

            while (true) {
                try {
                    commitTransaction();
                } catch (DriverException e) {
                    if (e.hasErrorLabel(ErrorLabel.UNKNOWN_TRANSACTION_COMMIT_RESULT) && withinTimeLimit(start) && !isMaxTimeExpired(e)) {
                        log.warn("retrying commit after error: {}", e.getMessage());
                        continue;
                    }

                    if (e.hasErrorLabel(ErrorLabel.TRANSIENT_TRANSACTION_ERROR) && withinTimeLimit(start)) {
                        restart = true;
                        break;
                    }

                    throw e;
                }

                break;
            }

            if (!restart) {
                return ret;
            }
        }
    }

    private static boolean withinTimeLimit(long start) {
        return (System.nanoTime() - start) / 1000000L < WITH_TRANSACTION_RETRY_TIME_LIMIT;
    }

    private static boolean isMaxTimeExpired(DriverException e) {
        return e instanceof OperationFailureException && Integer.valueOf(ErrorCodes.MAX_TIME_MS_EXPIRED).equals(e.getMongoCode());
    }

    /**
     * adds session fields to a command before it is sent
     *
     * @param retryable      true for a retryable write outside a transaction, adds txnNumber only
     * @param readPreference used to reject non primary reads in a transaction
     * @param isRead         reads get afterClusterTime when causally consistent
     */
    @SuppressWarnings("unchecked")
    public void applyTo(Map<String, Object> cmd, boolean retryable, ReadPreference readPreference, boolean isRead) throws InvalidOperationException {
        checkEnded();
        serverSession.touch();
        cmd.put("lsid", serverSession.getSessionId());

        if (!isInTransaction()) {
            transaction.reset();
        }

        if (retryable) {
            cmd.put("txnNumber", serverSession.getTransactionId());
            return;
        }

        if (isInTransaction()) {
            if (readPreference != null && !readPreference.isPrimary()) {
                throw new InvalidOperationException("read preference in a transaction must be primary, not: " + readPreference);
            }

            if (transaction.isStarting()) {
                transaction.setState(TransactionState.IN_PROGRESS);
                cmd.put("startTransaction", true);
                ReadConcern rc = transaction.getOptions().getReadConcern();
                Doc rcDoc = rc == null ? new Doc() : new Doc(rc.asMap());

                if (options.isCausalConsistency() && operationTime != null) {
                    rcDoc.put("afterClusterTime", operationTime);
                }

                if (!rcDoc.isEmpty()) {
                    cmd.put("readConcern", rcDoc);
                }
            }

            cmd.put("txnNumber", serverSession.getTransactionId());
            cmd.put("autocommit", false);
            return;
        }

        if (isRead && options.isCausalConsistency() && operationTime != null) {
            Doc rc = cmd.get("readConcern") instanceof Map ? new Doc((Map<String, Object>) cmd.get("readConcern")) : new Doc();
            rc.put("afterClusterTime", operationTime);
            cmd.put("readConcern", rc);
        }
    }

    /**
     * picks up cluster time, operation time and, for sharded transactions, the recovery token
     */
    @SuppressWarnings("unchecked")
    public void processResponse(Map<String, Object> reply) {
        if (reply == null) {
            return;
        }

        if (reply.get("$clusterTime") instanceof Map && ((Map<String, Object>) reply.get("$clusterTime")).get("clusterTime") instanceof MongoTimestamp) {
            doAdvanceClusterTime((Map<String, Object>) reply.get("$clusterTime"));
        }

        if (reply.get("operationTime") instanceof MongoTimestamp) {
            doAdvanceOperationTime((MongoTimestamp) reply.get("operationTime"));
        }

        if (isInTransaction() && transaction.isSharded() && reply.get("recoveryToken") instanceof Map) {
            transaction.setRecoveryToken((Map<String, Object>) reply.get("recoveryToken"));
        }
    }

    /**
     * aborts a running transaction and gives the server session back to the pool. The session cannot be
     * used afterwards.
     */
    public void endSession() {
        if (serverSession == null) {
            return;
        }

        try {
            if (isInTransaction()) {
                abortTransaction();
            }
        } catch (DriverException e) {
            log.warn("could not abort transaction when ending session: {}", e.getMessage());
        } finally {
            transaction.unpin();
            client.returnServerSession(serverSession);
            serverSession = null;
        }
    }

    @Override
    public void close() {
        endSession();
    }

    @Override
    public String toString() {
        return "ClientSession{" + (serverSession == null ? "ended" : serverSession.toString()) + ", " + transaction + "}";
    }
}
