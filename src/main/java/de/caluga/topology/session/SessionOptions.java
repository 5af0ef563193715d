package de.caluga.topology.session;

public final class SessionOptions {
    private final boolean causalConsistency;
    private final TransactionOptions defaultTransactionOptions;

    public SessionOptions() {
        this(true, null);
    }

    public SessionOptions(boolean causalConsistency, TransactionOptions defaultTransactionOptions) {
        this.causalConsistency = causalConsistency;
        this.defaultTransactionOptions = defaultTransactionOptions;
    }

    public boolean isCausalConsistency() {
        return causalConsistency;
    }

    /**
     * may be null
     */
    public TransactionOptions getDefaultTransactionOptions() {
        return defaultTransactionOptions;
    }

    @Override
    public String toString() {
        return "SessionOptions{causalConsistency=" + causalConsistency + ", defaultTransactionOptions=" + defaultTransactionOptions + "}";
    }
}
