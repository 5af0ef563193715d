package de.caluga.topology.session;

import de.caluga.topology.sdam.ServerAddress;

import java.util.Map;

/**
 * state of the current (or last) transaction of a {@link ClientSession}
 */
public class Transaction {
    private TransactionOptions options;
    private TransactionState state = TransactionState.NONE;
    private boolean sharded = false;
    private ServerAddress pinnedAddress;
    private Map<String, Object> recoveryToken;
    private int attempt = 0;

    public boolean isActive() {
        return state == TransactionState.STARTING || state == TransactionState.IN_PROGRESS;
    }

    public boolean isStarting() {
        return state == TransactionState.STARTING;
    }

    /**
     * pins the transaction to a mongos, all following commands go there
     */
    public void pin(ServerAddress mongos) {
        sharded = true;
        pinnedAddress = mongos;
    }

    public void unpin() {
        pinnedAddress = null;
    }

    public void reset() {
        state = TransactionState.NONE;
        sharded = false;
        pinnedAddress = null;
        recoveryToken = null;
        attempt = 0;
    }

    public TransactionOptions getOptions() {
        return options;
    }

    void setOptions(TransactionOptions options) {
        this.options = options;
    }

    public TransactionState getState() {
        return state;
    }

    void setState(TransactionState state) {
        this.state = state;
    }

    public boolean isSharded() {
        return sharded;
    }

    public ServerAddress getPinnedAddress() {
        return pinnedAddress;
    }

    public Map<String, Object> getRecoveryToken() {
        return recoveryToken;
    }

    void setRecoveryToken(Map<String, Object> recoveryToken) {
        this.recoveryToken = recoveryToken;
    }

    /**
     * number of commit/abort commands sent for this transaction
     */
    public int getAttempt() {
        return attempt;
    }

    void incAttempt() {
        attempt++;
    }

    @Override
    public String toString() {
        return "Transaction{state=" + state + (sharded ? ", pinned=" + pinnedAddress : "") + "}";
    }
}
