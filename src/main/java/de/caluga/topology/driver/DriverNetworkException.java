package de.caluga.topology.driver;

/**
 * network related issues when accessing the database: connection refused, socket closed, read
 * timeouts and the like
 **/
public class DriverNetworkException extends DriverException {

    public DriverNetworkException(String message) {
        super(message);
    }

    public DriverNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
