package de.caluga.topology.session;

public enum TransactionState {
    NONE, STARTING, IN_PROGRESS, COMMITTED, COMMITTED_EMPTY, ABORTED,
}
