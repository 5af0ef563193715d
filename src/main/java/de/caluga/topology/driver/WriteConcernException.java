package de.caluga.topology.driver;

import java.util.Map;

/**
 * the write itself succeeded but the write concern could not be satisfied
 */
public class WriteConcernException extends OperationFailureException {
    private final boolean wTimeout;

    public WriteConcernException(String message, Integer code, Map<String, Object> reply, boolean wTimeout) {
        super(message, code, reply);
        this.wTimeout = wTimeout;
    }

    public boolean isWTimeout() {
        return wTimeout;
    }
}
