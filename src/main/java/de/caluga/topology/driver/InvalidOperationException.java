package de.caluga.topology.driver;

/**
 * an operation that is not allowed in the current local state, e.g. committing a transaction that was
 * already aborted. Never sent to the server.
 */
public class InvalidOperationException extends DriverException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
