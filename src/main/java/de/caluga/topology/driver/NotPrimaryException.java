package de.caluga.topology.driver;

import java.util.Map;

/**
 * the server is not (or no longer) primary, or it is shutting down
 */
public class NotPrimaryException extends OperationFailureException {

    public NotPrimaryException(String message, Integer code, Map<String, Object> reply) {
        super(message, code, reply);
    }

    public boolean isShuttingDown() {
        return ErrorCodes.isShutdown(getMongoCode());
    }
}
