package de.caluga.topology.driver;

/**
 * no suitable server was found before the selection deadline. The message explains what the topology
 * looked like at that time.
 */
public class ServerSelectionTimeoutException extends DriverNetworkException {

    public ServerSelectionTimeoutException(String message) {
        super(message);
    }
}
